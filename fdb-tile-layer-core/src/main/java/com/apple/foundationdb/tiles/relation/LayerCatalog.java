/*
 * LayerCatalog.java
 *
 * This source file is part of the FoundationDB open source project
 *
 * Copyright 2015-2025 Apple Inc. and the FoundationDB project authors
 *
 * Licensed under the Apache License, Version 2.0 (the "License");
 * you may not use this file except in compliance with the License.
 * You may obtain a copy of the License at
 *
 *     http://www.apache.org/licenses/LICENSE-2.0
 *
 * Unless required by applicable law or agreed to in writing, software
 * distributed under the License is distributed on an "AS IS" BASIS,
 * WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either express or implied.
 * See the License for the specific language governing permissions and
 * limitations under the License.
 */

package com.apple.foundationdb.tiles.relation;

import com.apple.foundationdb.annotation.API;
import com.apple.foundationdb.tiles.api.exceptions.LayerNotFoundException;
import com.apple.foundationdb.tiles.api.exceptions.UnsupportedTypeException;
import com.apple.foundationdb.tiles.logging.KeyValueLogMessage;
import com.apple.foundationdb.tiles.model.KeyVariant;
import com.apple.foundationdb.tiles.model.LayerHeader;
import com.apple.foundationdb.tiles.model.LayerId;
import com.apple.foundationdb.tiles.model.ValueVariant;
import com.apple.foundationdb.tiles.spi.AttributeStore;
import com.apple.foundationdb.tiles.util.LogMessageKeys;
import com.google.common.collect.ImmutableList;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import javax.annotation.Nonnull;
import javax.annotation.Nullable;
import java.util.List;
import java.util.Objects;

/**
 * Lists the layers of a store together with the variants their headers resolve to.
 */
@API(API.Status.EXPERIMENTAL)
public class LayerCatalog {
    private static final Logger LOGGER = LoggerFactory.getLogger(LayerCatalog.class);

    @Nonnull
    private final AttributeStore store;

    public LayerCatalog(@Nonnull AttributeStore store) {
        this.store = store;
    }

    /**
     * List every layer of the store, sorted by name and then zoom. A layer whose header names a type that cannot be
     * read is listed without variants. A layer removed while the list is being built is left out.
     *
     * @return the catalog entries
     */
    @Nonnull
    public List<Entry> list() {
        final ImmutableList.Builder<Entry> entries = ImmutableList.builder();
        for (LayerId layerId : ImmutableList.sortedCopyOf(store.layerIds())) {
            final LayerHeader header;
            try {
                header = store.readHeader(layerId);
            } catch (LayerNotFoundException e) {
                if (LOGGER.isDebugEnabled()) {
                    LOGGER.debug(KeyValueLogMessage.build("layer removed while listing",
                                    LogMessageKeys.LAYER_NAME, layerId.getName(),
                                    LogMessageKeys.LAYER_ZOOM, layerId.getZoom())
                            .addLogInfo(e)
                            .toString());
                }
                continue;
            }
            ResolvedLayerType type;
            try {
                type = LayerTypeResolver.resolve(header);
            } catch (UnsupportedTypeException e) {
                if (LOGGER.isDebugEnabled()) {
                    LOGGER.debug(KeyValueLogMessage.build("layer cannot be read",
                                    LogMessageKeys.LAYER_NAME, layerId.getName(),
                                    LogMessageKeys.LAYER_ZOOM, layerId.getZoom())
                            .addLogInfo(e)
                            .toString());
                }
                type = null;
            }
            entries.add(new Entry(layerId, header, type));
        }
        return entries.build();
    }

    /**
     * One layer of a catalog.
     */
    public static final class Entry {
        @Nonnull
        private final LayerId layerId;
        @Nonnull
        private final LayerHeader header;
        @Nullable
        private final ResolvedLayerType type;

        Entry(@Nonnull LayerId layerId, @Nonnull LayerHeader header, @Nullable ResolvedLayerType type) {
            this.layerId = layerId;
            this.header = header;
            this.type = type;
        }

        @Nonnull
        public LayerId getLayerId() {
            return layerId;
        }

        @Nonnull
        public LayerHeader getHeader() {
            return header;
        }

        /**
         * Whether a {@link LayerRelation} can read this layer.
         * @return {@code true} if the header resolved
         */
        public boolean isReadable() {
            return type != null;
        }

        @Nullable
        public KeyVariant getKeyVariant() {
            return type == null ? null : type.getKeyVariant();
        }

        @Nullable
        public ValueVariant getValueVariant() {
            return type == null ? null : type.getValueVariant();
        }

        @Override
        public boolean equals(Object o) {
            if (this == o) {
                return true;
            }
            if (!(o instanceof Entry)) {
                return false;
            }
            final Entry that = (Entry)o;
            return layerId.equals(that.layerId) && header.equals(that.header) && Objects.equals(type, that.type);
        }

        @Override
        public int hashCode() {
            return Objects.hash(layerId, header, type);
        }

        @Override
        public String toString() {
            return layerId + (type == null ? " (unreadable)" : " " + type);
        }
    }
}
