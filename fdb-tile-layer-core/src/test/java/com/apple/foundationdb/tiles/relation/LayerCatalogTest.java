/*
 * LayerCatalogTest.java
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
import com.apple.foundationdb.tiles.memory.InMemoryLayerStore;
import com.apple.foundationdb.tiles.model.KeyVariant;
import com.apple.foundationdb.tiles.model.LayerHeader;
import com.apple.foundationdb.tiles.model.LayerId;
import com.apple.foundationdb.tiles.model.SpatialKey;
import com.apple.foundationdb.tiles.model.ValueVariant;
import com.google.common.collect.ImmutableList;
import com.google.common.collect.ImmutableMap;
import org.assertj.core.api.Assertions;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import javax.annotation.Nonnull;
import java.util.List;

class LayerCatalogTest {
    private InMemoryLayerStore store;

    @BeforeEach
    void setUp() {
        store = TestLayers.newStore();
    }

    @AfterEach
    void tearDown() {
        InMemoryLayerStore.drop(store.getName());
    }

    @Test
    void emptyStore() {
        Assertions.assertThat(new LayerCatalog(store).list()).isEmpty();
    }

    @Test
    void listsSortedWithVariants() {
        TestLayers.writeSpaceTime(store);
        TestLayers.writeL1(store);
        store.writeLayer(LayerId.of("L1", 3), SpatialKey.class, TestLayers.spatialMetadata(), ImmutableMap.of());

        List<LayerCatalog.Entry> entries = new LayerCatalog(store).list();
        Assertions.assertThat(entries)
                .extracting(LayerCatalog.Entry::getLayerId)
                .containsExactly(TestLayers.L1, LayerId.of("L1", 3), TestLayers.ST);
        Assertions.assertThat(entries)
                .extracting(LayerCatalog.Entry::getKeyVariant)
                .containsExactly(KeyVariant.SPATIAL, KeyVariant.SPATIAL, KeyVariant.SPACE_TIME);
        Assertions.assertThat(entries).allMatch(LayerCatalog.Entry::isReadable);
        Assertions.assertThat(entries.get(0).getValueVariant()).isEqualTo(ValueVariant.TILE);
    }

    @Test
    void unreadableLayersAreListed() {
        TestLayers.writeL1(store);
        LayerId legacy = LayerId.of("legacy", 0);
        store.writeLayer(legacy, new LayerHeader("GridKey", "Tile"), SpatialKey.class, TestLayers.spatialMetadata(),
                ImmutableMap.of());

        List<LayerCatalog.Entry> entries = new LayerCatalog(store).list();
        Assertions.assertThat(entries).hasSize(2);
        LayerCatalog.Entry entry = entries.get(1);
        Assertions.assertThat(entry.getLayerId()).isEqualTo(legacy);
        Assertions.assertThat(entry.isReadable()).isFalse();
        Assertions.assertThat(entry.getKeyVariant()).isNull();
        Assertions.assertThat(entry.getValueVariant()).isNull();
        Assertions.assertThat(entry.getHeader().getKeyClassName()).isEqualTo("GridKey");
        Assertions.assertThat(entry).hasToString("LayerId(legacy, 0) (unreadable)");
    }

    @Test
    void layersRemovedWhileListingAreSkipped() {
        TestLayers.writeL1(store);
        LayerId removed = LayerId.of("removed", 2);
        CountingLayerStore staleIds = new CountingLayerStore(store) {
            @Nonnull
            @Override
            public List<LayerId> layerIds() {
                return ImmutableList.<LayerId>builder().addAll(super.layerIds()).add(removed).build();
            }
        };

        List<LayerCatalog.Entry> entries = new LayerCatalog(staleIds).list();
        Assertions.assertThat(entries)
                .extracting(LayerCatalog.Entry::getLayerId)
                .containsExactly(TestLayers.L1);
        Assertions.assertThat(staleIds.getHeaderReads()).isEqualTo(2);
    }
}
