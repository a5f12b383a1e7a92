/*
 * LayerRelationTest.java
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

import com.apple.foundationdb.tiles.CountingLayerStore;
import com.apple.foundationdb.tiles.TestLayers;
import com.apple.foundationdb.tiles.api.ArrayRow;
import com.apple.foundationdb.tiles.api.RelationOptions;
import com.apple.foundationdb.tiles.api.Row;
import com.apple.foundationdb.tiles.api.exceptions.ErrorCode;
import com.apple.foundationdb.tiles.api.exceptions.LayerNotFoundException;
import com.apple.foundationdb.tiles.memory.InMemoryLayerStore;
import com.apple.foundationdb.tiles.model.Extent;
import com.apple.foundationdb.tiles.model.KeyVariant;
import com.apple.foundationdb.tiles.model.LayerHeader;
import com.apple.foundationdb.tiles.model.LayerId;
import com.apple.foundationdb.tiles.model.SpaceTimeKey;
import com.apple.foundationdb.tiles.model.SpatialComponent;
import com.apple.foundationdb.tiles.model.SpatialKey;
import com.apple.foundationdb.tiles.model.TemporalKey;
import com.apple.foundationdb.tiles.model.ValueVariant;
import com.apple.foundationdb.tiles.spi.LayerEntry;
import com.apple.foundationdb.tiles.spi.LayerQuery;
import com.apple.foundationdb.tiles.spi.QueryConstraint;
import com.google.common.collect.ImmutableList;
import com.google.common.collect.ImmutableMap;
import com.google.common.collect.Iterables;
import com.google.common.collect.Iterators;
import org.assertj.core.api.Assertions;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.Arguments;
import org.junit.jupiter.params.provider.MethodSource;
import org.locationtech.jts.geom.Geometry;

import javax.annotation.Nonnull;
import java.util.ArrayList;
import java.util.Iterator;
import java.util.List;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;
import java.util.stream.Stream;

import static com.apple.foundationdb.tiles.TileLayerAssertions.assertThrowsTileLayerException;

class LayerRelationTest {
    private InMemoryLayerStore store;

    @BeforeEach
    void setUp() {
        store = TestLayers.newStore();
        TestLayers.writeL1(store);
        TestLayers.writeSpaceTime(store);
    }

    @AfterEach
    void tearDown() {
        InMemoryLayerStore.drop(store.getName());
    }

    private LayerRelation relation(LayerId layerId) {
        return new LayerRelation(store.getLocation(), store, layerId);
    }

    private static List<Row> scan(LayerRelation relation, String... columns) {
        return ImmutableList.copyOf(relation.buildScan(columns));
    }

    @Test
    void spatialSchema() {
        LayerRelation relation = relation(TestLayers.L1);
        Assertions.assertThat(relation.getSchema().getColumnNames()).containsExactly("spatialKey", "extent", "tile");
        Assertions.assertThat(relation.getKeyVariant()).isEqualTo(KeyVariant.SPATIAL);
        Assertions.assertThat(relation.getValueVariant()).isEqualTo(ValueVariant.TILE);
        Assertions.assertThat(relation.getTileLayerMetadata()).isEqualTo(TestLayers.spatialMetadata());
    }

    @Test
    void spaceTimeSchema() {
        LayerRelation relation = relation(TestLayers.ST);
        Assertions.assertThat(relation.getSchema().getColumnNames())
                .containsExactly("spatialKey", "temporalKey", "extent", "tile");
        Assertions.assertThat(relation.getKeyVariant()).isEqualTo(KeyVariant.SPACE_TIME);
    }

    @Test
    void scanExtentAndTile() {
        List<Row> rows = scan(relation(TestLayers.L1), "extent", "tile");
        Assertions.assertThat(rows).hasSize(2);
        Assertions.assertThat(rows).allSatisfy(row -> Assertions.assertThat(row.getNumFields()).isEqualTo(2));
        Assertions.assertThat(rows).containsExactlyInAnyOrder(
                new ArrayRow(new Extent(0, 0, 1, 1), TestLayers.TILE_0),
                new ArrayRow(new Extent(1, 0, 2, 1), TestLayers.TILE_1));
    }

    @Test
    void pointFilterSelectsOneKey() {
        LayerRelation filtered = relation(TestLayers.L1)
                .withFilter(FilterPredicate.of("extent", "intersects", TestLayers.point(0.5, 0.5)));
        List<Row> rows = scan(filtered, "spatialKey");
        Assertions.assertThat(rows).hasSize(1);
        Assertions.assertThat(rows.get(0).getObject(0)).isEqualTo(SpatialKey.of(0, 0));
    }

    @Test
    void rowsFollowRequestedOrder() {
        List<Row> rows = scan(relation(TestLayers.L1), "tile", "spatialKey", "tile");
        Assertions.assertThat(rows).hasSize(2);
        for (Row row : rows) {
            Assertions.assertThat(row.getNumFields()).isEqualTo(3);
            Assertions.assertThat(row.getObject(1)).isInstanceOf(SpatialKey.class);
            Assertions.assertThat(row.getObject(0)).isSameAs(row.getObject(2));
            SpatialKey key = row.getObject(1, SpatialKey.class);
            Assertions.assertThat(row.getObject(0)).isEqualTo(key.getCol() == 0 ? TestLayers.TILE_0 : TestLayers.TILE_1);
        }
    }

    @Test
    void spaceTimeScan() {
        List<Row> rows = scan(relation(TestLayers.ST), "temporalKey", "spatialKey", "extent");
        Assertions.assertThat(rows).containsExactlyInAnyOrder(
                new ArrayRow(new TemporalKey(TestLayers.T1), SpatialKey.of(0, 0), new Extent(0, 0, 1, 1)),
                new ArrayRow(new TemporalKey(TestLayers.T1), SpatialKey.of(1, 0), new Extent(1, 0, 2, 1)),
                new ArrayRow(new TemporalKey(TestLayers.T2), SpatialKey.of(0, 0), new Extent(0, 0, 1, 1)));
    }

    @Test
    void spaceTimePointFilterKeepsAllInstants() {
        LayerRelation filtered = relation(TestLayers.ST).withFilter(FilterPredicate.extentIntersects(TestLayers.point(0.5, 0.5)));
        Assertions.assertThat(scan(filtered, "temporalKey"))
                .extracting(row -> row.getObject(0))
                .containsExactlyInAnyOrder(new TemporalKey(TestLayers.T1), new TemporalKey(TestLayers.T2));
    }

    @Test
    void withFilterDoesNotChangeOriginal() {
        LayerRelation original = relation(TestLayers.L1);
        LayerRelation filtered = original.withFilter(FilterPredicate.extentIntersects(TestLayers.point(0.5, 0.5)));
        Assertions.assertThat(original.getFilters()).isEmpty();
        Assertions.assertThat(filtered.getFilters()).hasSize(1);
        Assertions.assertThat(scan(original, "spatialKey")).hasSize(2);
        Assertions.assertThat(scan(filtered, "spatialKey")).hasSize(1);

        LayerRelation twice = filtered.withFilter(FilterPredicate.extentIntersects(TestLayers.point(1.5, 0.5)));
        Assertions.assertThat(filtered.getFilters()).hasSize(1);
        Assertions.assertThat(twice.getFilters()).hasSize(2);
        Assertions.assertThat(scan(twice, "spatialKey")).isEmpty();
    }

    static Stream<Arguments> geometries() {
        return Stream.of(
                Arguments.of(TestLayers.point(0.5, 0.5), 1),
                Arguments.of(TestLayers.point(1.0, 0.5), 1),
                Arguments.of(TestLayers.point(5, 5), 0),
                Arguments.of(TestLayers.box(0.2, 0.2, 0.8, 0.8), 1),
                Arguments.of(TestLayers.box(0.5, 0.2, 1.5, 0.8), 2),
                Arguments.of(TestLayers.box(-10, -10, 10, 10), 2),
                Arguments.of(TestLayers.box(3, 3, 4, 4), 0),
                Arguments.of(TestLayers.line(1.5, 0.1, 1.9, 0.9), 1)
        );
    }

    @ParameterizedTest
    @MethodSource("geometries")
    void recognizedFilterNeverEnlarges(Geometry geometry, int expected) {
        LayerRelation relation = relation(TestLayers.L1);
        int unfiltered = Iterables.size(relation.buildScan("spatialKey"));
        int filtered = Iterables.size(relation.withFilter(FilterPredicate.extentIntersects(geometry)).buildScan("spatialKey"));
        Assertions.assertThat(filtered).isEqualTo(expected).isLessThanOrEqualTo(unfiltered);
    }

    @Test
    void unrecognizedFilterPassesThrough() {
        LayerRelation relation = relation(TestLayers.L1);
        FilterPredicate onTile = FilterPredicate.of("tile", "intersects", TestLayers.point(0.5, 0.5));
        FilterPredicate contains = FilterPredicate.of("extent", "contains", TestLayers.point(0.5, 0.5));
        LayerRelation filtered = relation.withFilter(onTile).withFilter(contains);

        Assertions.assertThat(scan(filtered, "spatialKey", "extent")).isEqualTo(scan(relation, "spatialKey", "extent"));
        Assertions.assertThat(filtered.getUnhandledFilters()).containsExactly(onTile, contains);
    }

    @Test
    void unrecognizedFilterCanFail() {
        RelationOptions options = RelationOptions.builder()
                .withOption(RelationOptions.Name.FAIL_ON_UNHANDLED_FILTER, true)
                .build();
        LayerRelation strict = new LayerRelation(store.getLocation(), store, TestLayers.L1, options);
        Assertions.assertThat(scan(strict.withFilter(FilterPredicate.extentIntersects(TestLayers.point(0.5, 0.5))), "tile"))
                .hasSize(1);
        assertThrowsTileLayerException(() -> strict.withFilter(FilterPredicate.of("tile", "intersects", TestLayers.point(0, 0)))
                .buildScan("tile"), ErrorCode.UNSUPPORTED_FILTER)
                .hasLogInfo("layer_name", "L1");
    }

    @Test
    void unknownKeyTypeFailsBeforeReading() {
        LayerId gridLayer = LayerId.of("grid", 0);
        store.writeLayer(gridLayer, new LayerHeader("GridKey", "Tile"), SpatialKey.class, TestLayers.spatialMetadata(),
                ImmutableMap.of(SpatialKey.of(0, 0), TestLayers.TILE_0));
        CountingLayerStore counting = new CountingLayerStore(store);
        LayerRelation relation = new LayerRelation(store.getLocation(), counting, gridLayer);

        assertThrowsTileLayerException(relation::getSchema, ErrorCode.UNSUPPORTED_KEY_TYPE)
                .hasMessage("Unsupported key type GridKey");
        assertThrowsTileLayerException(() -> relation.buildScan("tile"), ErrorCode.UNSUPPORTED_KEY_TYPE);
        Assertions.assertThat(counting.getHeaderReads()).isEqualTo(2);
        Assertions.assertThat(counting.getMetadataReads()).isZero();
        Assertions.assertThat(counting.getQueries()).isZero();
    }

    @Test
    void unknownValueTypeFailsBeforeReading() {
        LayerId multiband = LayerId.of("multiband", 0);
        store.writeLayer(multiband, new LayerHeader("SpatialKey", "MultibandTile"), SpatialKey.class,
                TestLayers.spatialMetadata(), ImmutableMap.of(SpatialKey.of(0, 0), TestLayers.TILE_0));
        CountingLayerStore counting = new CountingLayerStore(store);
        LayerRelation relation = new LayerRelation(store.getLocation(), counting, multiband);

        assertThrowsTileLayerException(() -> relation.buildScan("spatialKey"), ErrorCode.UNSUPPORTED_VALUE_TYPE)
                .hasLogInfo("value_class", "MultibandTile");
        Assertions.assertThat(counting.getQueries()).isZero();
    }

    @Test
    void unknownColumnFailsEagerly() {
        CountingLayerStore counting = new CountingLayerStore(store);
        LayerRelation relation = new LayerRelation(store.getLocation(), counting, TestLayers.L1);
        assertThrowsTileLayerException(() -> relation.buildScan("extent", "temporalKey"), ErrorCode.UNKNOWN_COLUMN)
                .hasLogInfo("column_name", "temporalKey");
        Assertions.assertThat(counting.getQueries()).isZero();
    }

    @Test
    void metadataReadOnce() {
        CountingLayerStore counting = new CountingLayerStore(store);
        LayerRelation relation = new LayerRelation(store.getLocation(), counting, TestLayers.L1);
        relation.getSchema();
        scan(relation, "extent");
        scan(relation.withFilter(FilterPredicate.extentIntersects(TestLayers.point(0.5, 0.5))), "extent");
        Assertions.assertThat(counting.getHeaderReads()).isEqualTo(1);
        Assertions.assertThat(counting.getMetadataReads()).isEqualTo(1);
        Assertions.assertThat(counting.getQueries()).isEqualTo(2);
    }

    @Test
    void concurrentFirstAccessReadsOnce() throws Exception {
        final int threads = 16;
        ExecutorService executor = Executors.newFixedThreadPool(threads);
        try {
            for (int round = 0; round < 20; round++) {
                CountingLayerStore counting = new CountingLayerStore(store);
                LayerRelation relation = new LayerRelation(store.getLocation(), counting, TestLayers.L1);
                CountDownLatch start = new CountDownLatch(1);
                List<Future<List<Row>>> futures = new ArrayList<>();
                for (int i = 0; i < threads; i++) {
                    futures.add(executor.submit(() -> {
                        start.await();
                        return scan(relation, "extent", "tile");
                    }));
                }
                start.countDown();
                for (Future<List<Row>> future : futures) {
                    Assertions.assertThat(future.get(30, TimeUnit.SECONDS)).hasSize(2);
                }
                Assertions.assertThat(counting.getHeaderReads()).isEqualTo(1);
                Assertions.assertThat(counting.getMetadataReads()).isEqualTo(1);
                Assertions.assertThat(counting.getQueries()).isEqualTo(threads);
            }
        } finally {
            executor.shutdownNow();
        }
    }

    @Test
    void missingTilesScanAsNull() {
        CountingLayerStore tileless = new CountingLayerStore(store) {
            @Nonnull
            @Override
            public <K extends SpatialComponent> LayerQuery<K> query(@Nonnull LayerId layerId, @Nonnull Class<K> keyClass,
                                                                   @Nonnull ValueVariant valueVariant) {
                return new TilelessQuery<>(super.query(layerId, keyClass, valueVariant));
            }
        };
        LayerRelation relation = new LayerRelation(store.getLocation(), tileless, TestLayers.L1);
        Assertions.assertThat(relation.getSchema().getColumn(2).isNullable()).isTrue();

        List<Row> rows = scan(relation, "spatialKey", "tile");
        Assertions.assertThat(rows).containsExactly(
                new ArrayRow(SpatialKey.of(0, 0), null),
                new ArrayRow(SpatialKey.of(1, 0), null));
    }

    @Test
    void scanIsReExecutedOnEachIteration() {
        Iterable<Row> rows = relation(TestLayers.L1).buildScan("spatialKey");
        Assertions.assertThat(rows).hasSize(2);
        store.overwriteLayer(TestLayers.L1, store.readHeader(TestLayers.L1), SpatialKey.class, TestLayers.spatialMetadata(),
                ImmutableMap.of(SpatialKey.of(1, 0), TestLayers.TILE_2));
        Assertions.assertThat(rows).extracting(row -> row.getObject(0)).containsExactly(SpatialKey.of(1, 0));
    }

    @Test
    void missingLayer() {
        LayerRelation relation = relation(LayerId.of("L1", 7));
        Assertions.assertThatThrownBy(relation::getSchema)
                .isInstanceOf(LayerNotFoundException.class)
                .extracting("errorCode")
                .isEqualTo(ErrorCode.LAYER_NOT_FOUND);
    }

    @Test
    void estimatedSize() {
        Assertions.assertThat(relation(TestLayers.L1).estimatedSizeBytes()).isEqualTo(Long.MAX_VALUE);
        RelationOptions options = RelationOptions.builder().withOption(RelationOptions.Name.SIZE_IN_BYTES, 4096L).build();
        Assertions.assertThat(new LayerRelation(store.getLocation(), store, TestLayers.L1, options).estimatedSizeBytes())
                .isEqualTo(4096L);
    }

    @Test
    void openByLocation() {
        LayerRelation relation = LayerRelation.open(store.getLocation(), TestLayers.ST, RelationOptions.none());
        Assertions.assertThat(scan(relation, "spatialKey")).hasSize(3);
        Assertions.assertThat(relation.toString()).contains(store.getName(), "ST");
    }

    @Test
    void spaceTimeKeysKeepTheirSpatialKey() {
        List<Row> rows = scan(relation(TestLayers.ST).withFilter(FilterPredicate.extentIntersects(TestLayers.point(1.5, 0.5))),
                "spatialKey", "temporalKey");
        Assertions.assertThat(rows).hasSize(1);
        Assertions.assertThat(new SpaceTimeKey(rows.get(0).getObject(0, SpatialKey.class), rows.get(0).getObject(1, TemporalKey.class)))
                .isEqualTo(SpaceTimeKey.of(1, 0, TestLayers.T1));
    }

    private static final class TilelessQuery<K extends SpatialComponent> implements LayerQuery<K> {
        private final LayerQuery<K> delegate;

        TilelessQuery(LayerQuery<K> delegate) {
            this.delegate = delegate;
        }

        @Nonnull
        @Override
        public LayerId getLayerId() {
            return delegate.getLayerId();
        }

        @Nonnull
        @Override
        public List<QueryConstraint> getConstraints() {
            return delegate.getConstraints();
        }

        @Nonnull
        @Override
        public LayerQuery<K> where(@Nonnull QueryConstraint constraint) {
            return new TilelessQuery<>(delegate.where(constraint));
        }

        @Nonnull
        @Override
        public Iterator<LayerEntry<K>> execute() {
            return Iterators.transform(delegate.execute(), entry -> new LayerEntry<>(entry.getKey(), null));
        }
    }
}
