/*
 * InMemoryLayerQuery.java
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
import com.apple.foundationdb.tiles.model.Extent;
import com.apple.foundationdb.tiles.model.LayerId;
import com.apple.foundationdb.tiles.model.MapKeyTransform;
import com.apple.foundationdb.tiles.model.SpatialComponent;
import com.apple.foundationdb.tiles.model.SpatialKey;
import com.apple.foundationdb.tiles.spi.Contains;
import com.apple.foundationdb.tiles.spi.Intersects;
import com.apple.foundationdb.tiles.spi.LayerEntry;
import com.apple.foundationdb.tiles.spi.LayerQuery;
import com.apple.foundationdb.tiles.spi.QueryConstraint;
import com.google.common.base.Predicate;
import com.google.common.base.Predicates;
import com.google.common.collect.ImmutableList;
import com.google.common.collect.Iterators;

import javax.annotation.Nonnull;
import java.util.Iterator;
import java.util.List;

/**
 * A query over one layer of an {@link InMemoryLayerStore}. Constraints are evaluated against each key's grid cell,
 * computed with the layer's {@link MapKeyTransform}.
 *
 * @param <K> the key type
 */
@API(API.Status.INTERNAL)
class InMemoryLayerQuery<K extends SpatialComponent> implements LayerQuery<K> {
    @Nonnull
    private final InMemoryLayerStore store;
    @Nonnull
    private final LayerId layerId;
    @Nonnull
    private final Class<K> keyClass;
    @Nonnull
    private final ImmutableList<QueryConstraint> constraints;

    InMemoryLayerQuery(@Nonnull InMemoryLayerStore store, @Nonnull LayerId layerId, @Nonnull Class<K> keyClass,
                       @Nonnull ImmutableList<QueryConstraint> constraints) {
        this.store = store;
        this.layerId = layerId;
        this.keyClass = keyClass;
        this.constraints = constraints;
    }

    @Nonnull
    @Override
    public LayerId getLayerId() {
        return layerId;
    }

    @Nonnull
    @Override
    public List<QueryConstraint> getConstraints() {
        return constraints;
    }

    @Nonnull
    @Override
    public LayerQuery<K> where(@Nonnull QueryConstraint constraint) {
        return new InMemoryLayerQuery<>(store, layerId, keyClass,
                ImmutableList.<QueryConstraint>builder().addAll(constraints).add(constraint).build());
    }

    @Nonnull
    @Override
    public Iterator<LayerEntry<K>> execute() {
        final InMemoryLayerStore.StoredLayer<K> layer = store.getLayer(layerId, keyClass);
        final MapKeyTransform mapTransform = layer.getMetadata().getMapTransform();
        final List<Predicate<SpatialComponent>> predicates = constraints.stream()
                .map(constraint -> constraint.accept(new KeyPredicateVisitor(mapTransform)))
                .collect(ImmutableList.toImmutableList());
        final Predicate<SpatialComponent> matches = Predicates.and(predicates);
        return Iterators.transform(
                Iterators.filter(layer.getTiles().entrySet().iterator(), entry -> matches.apply(entry.getKey())),
                entry -> new LayerEntry<>(entry.getKey(), entry.getValue()));
    }

    @Override
    public String toString() {
        return "InMemoryLayerQuery{store=" + store.getName() + ", layer=" + layerId + ", constraints=" + constraints + "}";
    }

    /**
     * Turns a constraint into a predicate over keys.
     */
    private static final class KeyPredicateVisitor implements QueryConstraint.Visitor<Predicate<SpatialComponent>> {
        @Nonnull
        private final MapKeyTransform mapTransform;

        KeyPredicateVisitor(@Nonnull MapKeyTransform mapTransform) {
            this.mapTransform = mapTransform;
        }

        @Override
        public Predicate<SpatialComponent> visitContains(@Nonnull Contains contains) {
            final SpatialKey cell = mapTransform.pointToKey(contains.getX(), contains.getY());
            return key -> cell.equals(key.getSpatialKey());
        }

        @Override
        public Predicate<SpatialComponent> visitIntersects(@Nonnull Intersects intersects) {
            final Extent extent = intersects.getExtent();
            return key -> mapTransform.keyToExtent(key).intersects(extent);
        }
    }
}
