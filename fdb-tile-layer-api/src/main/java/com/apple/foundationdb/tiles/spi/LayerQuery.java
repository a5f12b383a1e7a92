/*
 * LayerQuery.java
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

package com.apple.foundationdb.tiles.spi;

import com.apple.foundationdb.annotation.API;
import com.apple.foundationdb.tiles.model.LayerId;
import com.apple.foundationdb.tiles.model.SpatialComponent;

import javax.annotation.Nonnull;
import java.util.Iterator;
import java.util.List;

/**
 * A query over the tiles of one layer. Queries are immutable: {@link #where(QueryConstraint)} returns a new query
 * and leaves this one as it was. Every constraint can only remove entries from the result.
 *
 * @param <K> the key type of the layer
 */
@API(API.Status.EXPERIMENTAL)
public interface LayerQuery<K extends SpatialComponent> {

    @Nonnull
    LayerId getLayerId();

    /**
     * The constraints added so far, in the order they were added.
     * @return the constraints
     */
    @Nonnull
    List<QueryConstraint> getConstraints();

    /**
     * Narrow this query.
     *
     * @param constraint the constraint every result must satisfy
     * @return a new query with the constraint added
     */
    @Nonnull
    LayerQuery<K> where(@Nonnull QueryConstraint constraint);

    /**
     * Run the query. Each call runs it again.
     *
     * @return a lazy iterator over the matching entries
     */
    @Nonnull
    Iterator<LayerEntry<K>> execute();
}
