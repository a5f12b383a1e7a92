/*
 * LayerRelation.java
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
import com.apple.foundationdb.tiles.api.LayerSchema;
import com.apple.foundationdb.tiles.api.RelationOptions;
import com.apple.foundationdb.tiles.api.Row;
import com.apple.foundationdb.tiles.api.exceptions.ErrorCode;
import com.apple.foundationdb.tiles.api.exceptions.TileLayerException;
import com.apple.foundationdb.tiles.logging.KeyValueLogMessage;
import com.apple.foundationdb.tiles.model.KeyVariant;
import com.apple.foundationdb.tiles.model.LayerId;
import com.apple.foundationdb.tiles.model.TileLayerMetadata;
import com.apple.foundationdb.tiles.model.ValueVariant;
import com.apple.foundationdb.tiles.spi.LayerStore;
import com.apple.foundationdb.tiles.store.LayerStores;
import com.apple.foundationdb.tiles.util.LogMessageKeys;
import com.google.common.base.Suppliers;
import com.google.common.collect.ImmutableList;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import javax.annotation.Nonnull;
import java.net.URI;
import java.util.Arrays;
import java.util.List;
import java.util.function.Supplier;

/**
 * A tile layer exposed as a table: one row per tile, with the columns named by {@link LayerSchemaBuilder}.
 *
 * <p>
 * A relation is immutable. {@link #withFilter(FilterPredicate)} returns a new relation with the filter appended and
 * leaves this one untouched. The layer header, the variants it resolves to, the layout metadata and the schema are
 * read on first use and then cached; a failed read is not cached, so the next access tries again and raises the same
 * error. Relations derived with {@code withFilter} share these cached values.
 * </p>
 *
 * <p>
 * Filters the store cannot apply pass through and are reported by {@link #getUnhandledFilters()}. Each scan logs them
 * at warn level, or fails with {@link ErrorCode#UNSUPPORTED_FILTER} when
 * {@link RelationOptions.Name#FAIL_ON_UNHANDLED_FILTER} is set.
 * </p>
 */
@API(API.Status.EXPERIMENTAL)
public class LayerRelation {
    private static final Logger LOGGER = LoggerFactory.getLogger(LayerRelation.class);

    @Nonnull
    private final URI location;
    @Nonnull
    private final LayerStore store;
    @Nonnull
    private final LayerId layerId;
    @Nonnull
    private final ImmutableList<FilterPredicate> filters;
    @Nonnull
    private final RelationOptions options;

    @Nonnull
    private final Supplier<ResolvedLayerType> resolvedType;
    @Nonnull
    private final Supplier<TileLayerMetadata<?>> metadata;
    @Nonnull
    private final Supplier<LayerSchema> schema;

    public LayerRelation(@Nonnull URI location, @Nonnull LayerStore store, @Nonnull LayerId layerId) {
        this(location, store, layerId, RelationOptions.none());
    }

    public LayerRelation(@Nonnull URI location, @Nonnull LayerStore store, @Nonnull LayerId layerId,
                         @Nonnull RelationOptions options) {
        this.location = location;
        this.store = store;
        this.layerId = layerId;
        this.filters = ImmutableList.of();
        this.options = options;
        this.resolvedType = Suppliers.memoize(() -> LayerTypeResolver.resolve(store.readHeader(layerId)));
        this.metadata = Suppliers.memoize(() -> store.readMetadata(layerId, getKeyVariant().getKeyClass()));
        this.schema = Suppliers.memoize(() -> LayerSchemaBuilder.build(resolvedType.get(), metadata.get()));
    }

    private LayerRelation(@Nonnull LayerRelation base, @Nonnull ImmutableList<FilterPredicate> filters) {
        this.location = base.location;
        this.store = base.store;
        this.layerId = base.layerId;
        this.filters = filters;
        this.options = base.options;
        this.resolvedType = base.resolvedType;
        this.metadata = base.metadata;
        this.schema = base.schema;
    }

    /**
     * Open a relation over a layer of the store at a location.
     *
     * @param location the store location, resolved with {@link LayerStores#open(URI)}
     * @param layerId the layer
     * @param options the relation options
     * @return the relation
     */
    @Nonnull
    public static LayerRelation open(@Nonnull URI location, @Nonnull LayerId layerId, @Nonnull RelationOptions options) {
        return new LayerRelation(location, LayerStores.open(location), layerId, options);
    }

    @Nonnull
    public URI getLocation() {
        return location;
    }

    @Nonnull
    public LayerId getLayerId() {
        return layerId;
    }

    @Nonnull
    public List<FilterPredicate> getFilters() {
        return filters;
    }

    @Nonnull
    public RelationOptions getOptions() {
        return options;
    }

    @Nonnull
    public KeyVariant getKeyVariant() {
        return resolvedType.get().getKeyVariant();
    }

    @Nonnull
    public ValueVariant getValueVariant() {
        return resolvedType.get().getValueVariant();
    }

    @Nonnull
    public TileLayerMetadata<?> getTileLayerMetadata() {
        return metadata.get();
    }

    @Nonnull
    public LayerSchema getSchema() {
        return schema.get();
    }

    /**
     * Add a filter.
     *
     * @param predicate the filter
     * @return a new relation with the same layer and the filters of this one followed by {@code predicate}
     */
    @Nonnull
    public LayerRelation withFilter(@Nonnull FilterPredicate predicate) {
        return new LayerRelation(this, ImmutableList.<FilterPredicate>builder().addAll(filters).add(predicate).build());
    }

    /**
     * Get the filters that a scan does not apply. The consumer has to evaluate these itself.
     * @return the filters for which {@link LayerFilters#isHandled(FilterPredicate)} is false, in order
     */
    @Nonnull
    public List<FilterPredicate> getUnhandledFilters() {
        return filters.stream()
                .filter(filter -> !LayerFilters.isHandled(filter))
                .collect(ImmutableList.toImmutableList());
    }

    /**
     * Always the configured {@link RelationOptions.Name#SIZE_IN_BYTES}. Nothing is derived from the layer.
     * @return the size estimate
     */
    public long estimatedSizeBytes() {
        return options.<Long>getOption(RelationOptions.Name.SIZE_IN_BYTES);
    }

    @Nonnull
    public Iterable<Row> buildScan(@Nonnull String... requestedColumns) {
        return buildScan(Arrays.asList(requestedColumns));
    }

    /**
     * Scan the layer.
     *
     * @param requestedColumns the columns of each row, in order
     * @return a lazy iterable of rows; each iteration reads the layer again
     * @throws com.apple.foundationdb.tiles.api.exceptions.UnsupportedTypeException if the layer's key or value type is
     * not supported
     * @throws com.apple.foundationdb.tiles.api.exceptions.InvalidColumnReferenceException if a requested column is not
     * in the schema
     * @throws TileLayerException with {@link ErrorCode#UNSUPPORTED_FILTER} if a filter cannot be applied and the
     * relation was opened with {@link RelationOptions.Name#FAIL_ON_UNHANDLED_FILTER}
     */
    @Nonnull
    public Iterable<Row> buildScan(@Nonnull List<String> requestedColumns) {
        final LayerSchema layerSchema = getSchema();
        final List<FilterPredicate> unhandled = getUnhandledFilters();
        if (!unhandled.isEmpty()) {
            if (options.<Boolean>getOption(RelationOptions.Name.FAIL_ON_UNHANDLED_FILTER)) {
                throw new TileLayerException("Unsupported filter " + unhandled.get(0), ErrorCode.UNSUPPORTED_FILTER,
                        LogMessageKeys.LAYER_NAME, layerId.getName(),
                        LogMessageKeys.LAYER_ZOOM, layerId.getZoom(),
                        LogMessageKeys.UNHANDLED_FILTERS, unhandled);
            }
            if (LOGGER.isWarnEnabled()) {
                LOGGER.warn(KeyValueLogMessage.of("filters not applied by the layer store",
                        LogMessageKeys.LAYER_NAME, layerId.getName(),
                        LogMessageKeys.LAYER_ZOOM, layerId.getZoom(),
                        LogMessageKeys.UNHANDLED_FILTERS, unhandled));
            }
        }
        if (LOGGER.isDebugEnabled()) {
            LOGGER.debug(KeyValueLogMessage.of("building layer scan",
                    LogMessageKeys.STORE_LOCATION, location,
                    LogMessageKeys.LAYER_NAME, layerId.getName(),
                    LogMessageKeys.LAYER_ZOOM, layerId.getZoom(),
                    LogMessageKeys.KEY_VARIANT, getKeyVariant(),
                    LogMessageKeys.REQUESTED_COLUMNS, requestedColumns,
                    LogMessageKeys.FILTERS, filters));
        }
        final LayerScanExecutor executor = new LayerScanExecutor(store, layerId, resolvedType.get(),
                getTileLayerMetadata().getMapTransform(), layerSchema, filters);
        return executor.scan(requestedColumns);
    }

    @Override
    public String toString() {
        return "LayerRelation{location=" + location + ", layer=" + layerId + ", filters=" + filters + "}";
    }
}
