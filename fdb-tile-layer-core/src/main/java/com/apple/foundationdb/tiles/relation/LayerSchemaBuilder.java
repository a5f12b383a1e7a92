/*
 * LayerSchemaBuilder.java
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
import com.apple.foundationdb.tiles.api.DataType;
import com.apple.foundationdb.tiles.api.LayerSchema;
import com.apple.foundationdb.tiles.api.exceptions.ErrorCode;
import com.apple.foundationdb.tiles.api.exceptions.TileLayerException;
import com.apple.foundationdb.tiles.model.TileLayerMetadata;
import com.apple.foundationdb.tiles.util.LogMessageKeys;
import com.google.common.collect.ImmutableList;
import com.google.common.collect.ImmutableMap;

import javax.annotation.Nonnull;
import javax.annotation.Nullable;
import java.util.Map;

/**
 * Derives the output schema of a layer from its resolved variants.
 *
 * <p>
 * A spatial layer has the columns {@code [spatialKey, extent, tile]}; a space-time layer has
 * {@code [spatialKey, temporalKey, extent, tile]}. Consumers address columns by position as well as by name, so the
 * order never changes. The key columns carry a metadata tag ({@value #SPATIAL_KEY_TAG}, {@value #TEMPORAL_KEY_TAG})
 * that marks them as keys; the spatial key column also carries the layer's layout metadata under
 * {@value #CONTEXT_KEY} when it is known.
 * </p>
 *
 * <p>
 * The struct types describe the fields of the value objects a scan emits: {@code SpatialKey},
 * {@code TemporalKey} and {@code Extent} from the model package.
 * </p>
 */
@API(API.Status.EXPERIMENTAL)
public final class LayerSchemaBuilder {
    public static final String SPATIAL_KEY_COLUMN = "spatialKey";
    public static final String TEMPORAL_KEY_COLUMN = "temporalKey";
    public static final String EXTENT_COLUMN = "extent";
    public static final String TILE_COLUMN = "tile";

    public static final String SPATIAL_KEY_TAG = "_stSpatialKey";
    public static final String TEMPORAL_KEY_TAG = "_stTemporalKey";
    public static final String CONTEXT_KEY = "_context";

    public static final DataType.StructType SPATIAL_KEY_TYPE = DataType.StructType.from("SpatialKey", ImmutableList.of(
            DataType.StructType.Field.from("col", DataType.IntegerType.notNullable(), 1),
            DataType.StructType.Field.from("row", DataType.IntegerType.notNullable(), 2)), false);

    public static final DataType.StructType TEMPORAL_KEY_TYPE = DataType.StructType.from("TemporalKey", ImmutableList.of(
            DataType.StructType.Field.from("instant", DataType.LongType.notNullable(), 1)), false);

    public static final DataType.StructType EXTENT_TYPE = DataType.StructType.from("Extent", ImmutableList.of(
            DataType.StructType.Field.from("xmin", DataType.DoubleType.notNullable(), 1),
            DataType.StructType.Field.from("ymin", DataType.DoubleType.notNullable(), 2),
            DataType.StructType.Field.from("xmax", DataType.DoubleType.notNullable(), 3),
            DataType.StructType.Field.from("ymax", DataType.DoubleType.notNullable(), 4)), false);

    private LayerSchemaBuilder() {
    }

    @Nonnull
    public static LayerSchema build(@Nonnull ResolvedLayerType type) {
        return build(type, null);
    }

    /**
     * Build the schema of a layer.
     *
     * @param type the resolved variants
     * @param metadata the layout metadata of the layer, recorded on the spatial key column if given
     * @return the schema
     */
    @Nonnull
    public static LayerSchema build(@Nonnull ResolvedLayerType type, @Nullable TileLayerMetadata<?> metadata) {
        final ImmutableList.Builder<LayerSchema.Column> columns = ImmutableList.builder();
        columns.add(LayerSchema.Column.of(SPATIAL_KEY_COLUMN, SPATIAL_KEY_TYPE, spatialKeyMetadata(metadata)));
        switch (type.getKeyVariant()) {
            case SPATIAL:
                break;
            case SPACE_TIME:
                columns.add(LayerSchema.Column.of(TEMPORAL_KEY_COLUMN, TEMPORAL_KEY_TYPE,
                        ImmutableMap.of(TEMPORAL_KEY_TAG, Boolean.TRUE.toString())));
                break;
            default:
                throw new TileLayerException("unexpected key variant", ErrorCode.INTERNAL_ERROR,
                        LogMessageKeys.KEY_VARIANT, type.getKeyVariant());
        }
        columns.add(LayerSchema.Column.of(EXTENT_COLUMN, EXTENT_TYPE));
        columns.add(LayerSchema.Column.of(TILE_COLUMN, DataType.TileType.nullable()));
        return LayerSchema.of(columns.build());
    }

    @Nonnull
    private static Map<String, String> spatialKeyMetadata(@Nullable TileLayerMetadata<?> metadata) {
        if (metadata == null) {
            return ImmutableMap.of(SPATIAL_KEY_TAG, Boolean.TRUE.toString());
        }
        return ImmutableMap.of(SPATIAL_KEY_TAG, Boolean.TRUE.toString(), CONTEXT_KEY, metadata.toString());
    }
}
