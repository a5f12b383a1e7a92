/*
 * InMemoryLayerStoreProvider.java
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

package com.apple.foundationdb.tiles.memory;

import com.apple.foundationdb.annotation.API;
import com.apple.foundationdb.tiles.api.exceptions.ErrorCode;
import com.apple.foundationdb.tiles.api.exceptions.LayerNotFoundException;
import com.apple.foundationdb.tiles.api.exceptions.TileLayerException;
import com.apple.foundationdb.tiles.spi.LayerStore;
import com.apple.foundationdb.tiles.spi.LayerStoreProvider;
import com.apple.foundationdb.tiles.util.LogMessageKeys;
import com.google.auto.service.AutoService;
import com.google.common.base.Strings;

import javax.annotation.Nonnull;
import javax.annotation.Nullable;
import java.net.URI;

/**
 * Opens registered {@link InMemoryLayerStore}s for {@code memory:<name>} and {@code memory://<name>} locations.
 */
@AutoService(LayerStoreProvider.class)
@API(API.Status.EXPERIMENTAL)
public class InMemoryLayerStoreProvider implements LayerStoreProvider {

    @Nonnull
    @Override
    public String getName() {
        return InMemoryLayerStore.SCHEME;
    }

    @Override
    public boolean canProcess(@Nonnull URI location) {
        return InMemoryLayerStore.SCHEME.equalsIgnoreCase(location.getScheme());
    }

    @Nonnull
    @Override
    public LayerStore open(@Nonnull URI location) {
        final String name = storeName(location);
        if (Strings.isNullOrEmpty(name)) {
            throw new TileLayerException("Missing store name in " + location, ErrorCode.INVALID_PARAMETER,
                    LogMessageKeys.STORE_LOCATION, location);
        }
        final InMemoryLayerStore store = InMemoryLayerStore.lookup(name);
        if (store == null) {
            throw new LayerNotFoundException("No in-memory layer store named " + name, ErrorCode.STORE_NOT_FOUND,
                    LogMessageKeys.STORE_LOCATION, location,
                    LogMessageKeys.STORE_NAME, name);
        }
        return store;
    }

    @Nullable
    private static String storeName(@Nonnull URI location) {
        if (location.isOpaque()) {
            return location.getSchemeSpecificPart();
        }
        return location.getAuthority();
    }
}
