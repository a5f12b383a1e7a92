/*
 * LayerScanExecutor.java
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
import com.apple.foundationdb.tiles.api.ArrayRow;
import com.apple.foundationdb.tiles.api.LayerSchema;
import com.apple.foundationdb.tiles.api.Row;
import com.apple.foundationdb.tiles.api.exceptions.ErrorCode;
import com.apple.foundationdb.tiles.api.exceptions.InvalidColumnReferenceException;
import com.apple.foundationdb.tiles.api.exceptions.TileLayerException;
import com.apple.foundationdb.tiles.model.LayerId;
import com.apple.foundationdb.tiles.model.MapKeyTransform;
import com.apple.foundationdb.tiles.model.SpaceTimeKey;
import com.apple.foundationdb.tiles.model.SpatialComponent;
import com.apple.foundationdb.tiles.model.SpatialKey;
import com.apple.foundationdb.tiles.spi.LayerEntry;
import com.apple.foundationdb.tiles.spi.LayerQuery;
import com.apple.foundationdb.tiles.spi.LayerReader;
import com.apple.foundationdb.tiles.util.LogMessageKeys;
import com.google.common.collect.ImmutableList;
import com.google.common.collect.Iterables;

import javax.annotation.Nonnull;
import javax.annotation.Nullable;
import java.util.List;
import java.util.function.IntFunction;

/**
 * Reads the tiles of one layer and projects them into rows of the requested columns.
 *
 * <p>
 * The requested names are resolved against the layer schema when {@link #scan(List)} is called, so an unknown
 * column fails before anything is read. The returned iterable is lazy: each iteration executes the narrowed query
 * again, and each row computes only the columns that were requested.
 * </p>
 */
@API(API.Status.INTERNAL)
public class LayerScanExecutor {
    @Nonnull
    private final LayerReader reader;
    @Nonnull
    private final LayerId layerId;
    @Nonnull
    private final ResolvedLayerType type;
    @Nonnull
    private final MapKeyTransform mapTransform;
    @Nonnull
    private final LayerSchema schema;
    @Nonnull
    private final List<FilterPredicate> filters;

    public LayerScanExecutor(@Nonnull LayerReader reader,
                             @Nonnull LayerId layerId,
                             @Nonnull ResolvedLayerType type,
                             @Nonnull MapKeyTransform mapTransform,
                             @Nonnull LayerSchema schema,
                             @Nonnull List<FilterPredicate> filters) {
        this.reader = reader;
        this.layerId = layerId;
        this.type = type;
        this.mapTransform = mapTransform;
        this.schema = schema;
        this.filters = ImmutableList.copyOf(filters);
    }

    /**
     * Scan the layer.
     *
     * @param requestedColumns the columns of each row, in order; a column may be requested more than once
     * @return the rows, one per matching tile
     * @throws InvalidColumnReferenceException if a requested column is not in the schema
     */
    @Nonnull
    public Iterable<Row> scan(@Nonnull List<String> requestedColumns) {
        final int[] positions = new int[requestedColumns.size()];
        for (int i = 0; i < positions.length; i++) {
            positions[i] = schema.getColumnIndex(requestedColumns.get(i));
        }
        switch (type.getKeyVariant()) {
            case SPATIAL:
                return scanSpatial(positions);
            case SPACE_TIME:
                return scanSpaceTime(positions);
            default:
                throw new TileLayerException("unexpected key variant", ErrorCode.INTERNAL_ERROR,
                        LogMessageKeys.KEY_VARIANT, type.getKeyVariant());
        }
    }

    @Nonnull
    private Iterable<Row> scanSpatial(@Nonnull int[] positions) {
        final LayerQuery<SpatialKey> query = narrow(reader.query(layerId, SpatialKey.class, type.getValueVariant()));
        final Iterable<LayerEntry<SpatialKey>> entries = query::execute;
        return Iterables.transform(entries, entry -> project(positions, position -> spatialValue(position, entry)));
    }

    @Nonnull
    private Iterable<Row> scanSpaceTime(@Nonnull int[] positions) {
        final LayerQuery<SpaceTimeKey> query = narrow(reader.query(layerId, SpaceTimeKey.class, type.getValueVariant()));
        final Iterable<LayerEntry<SpaceTimeKey>> entries = query::execute;
        return Iterables.transform(entries, entry -> project(positions, position -> spaceTimeValue(position, entry)));
    }

    @Nonnull
    private <K extends SpatialComponent> LayerQuery<K> narrow(@Nonnull LayerQuery<K> query) {
        LayerQuery<K> narrowed = query;
        for (FilterPredicate filter : filters) {
            narrowed = LayerFilters.applyFilter(narrowed, filter);
        }
        return narrowed;
    }

    // spatialKey, extent, tile
    @Nullable
    private Object spatialValue(int position, @Nonnull LayerEntry<SpatialKey> entry) {
        switch (position) {
            case 0:
                return entry.getKey();
            case 1:
                return mapTransform.keyToExtent(entry.getKey());
            case 2:
                return entry.getTile();
            default:
                throw InvalidColumnReferenceException.getExceptionForInvalidPositionNumber(position);
        }
    }

    // spatialKey, temporalKey, extent, tile
    @Nullable
    private Object spaceTimeValue(int position, @Nonnull LayerEntry<SpaceTimeKey> entry) {
        switch (position) {
            case 0:
                return entry.getKey().getSpatialKey();
            case 1:
                return entry.getKey().getTemporalKey();
            case 2:
                return mapTransform.keyToExtent(entry.getKey());
            case 3:
                return entry.getTile();
            default:
                throw InvalidColumnReferenceException.getExceptionForInvalidPositionNumber(position);
        }
    }

    @Nonnull
    private static Row project(@Nonnull int[] positions, @Nonnull IntFunction<Object> valueAt) {
        final Object[] values = new Object[positions.length];
        for (int i = 0; i < positions.length; i++) {
            values[i] = valueAt.apply(positions[i]);
        }
        return new ArrayRow(values);
    }
}
