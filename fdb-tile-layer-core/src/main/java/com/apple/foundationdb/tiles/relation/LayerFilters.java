/*
 * LayerFilters.java
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
import com.apple.foundationdb.tiles.api.exceptions.ErrorCode;
import com.apple.foundationdb.tiles.api.exceptions.TileLayerException;
import com.apple.foundationdb.tiles.model.Extent;
import com.apple.foundationdb.tiles.model.SpatialComponent;
import com.apple.foundationdb.tiles.spi.Contains;
import com.apple.foundationdb.tiles.spi.Intersects;
import com.apple.foundationdb.tiles.spi.LayerQuery;
import com.apple.foundationdb.tiles.spi.QueryConstraint;
import com.apple.foundationdb.tiles.util.LogMessageKeys;
import org.locationtech.jts.geom.Point;

import javax.annotation.Nonnull;
import javax.annotation.Nullable;

/**
 * Translates {@link FilterPredicate}s into {@link QueryConstraint}s the store applies natively.
 *
 * <p>
 * Only {@code extent intersects <geometry>} is understood. A point becomes {@link Contains}, so that exactly the
 * tile whose cell holds the point is read; any other geometry becomes {@link Intersects} over its envelope.
 * </p>
 *
 * <p>
 * Every other predicate passes through: the query is returned unchanged, nothing is filtered and nothing fails.
 * A consumer that needs to know whether a predicate was honored must ask {@link #isHandled(FilterPredicate)}
 * (or {@link LayerRelation#getUnhandledFilters()}) and evaluate the unhandled ones itself.
 * </p>
 */
@API(API.Status.EXPERIMENTAL)
public final class LayerFilters {
    public static final String INTERSECTS = "intersects";

    private LayerFilters() {
    }

    public static boolean isHandled(@Nonnull FilterPredicate predicate) {
        return LayerSchemaBuilder.EXTENT_COLUMN.equals(predicate.getColumnName())
               && INTERSECTS.equals(predicate.getRelationName());
    }

    /**
     * Get the native constraint for a predicate.
     *
     * @param predicate the predicate
     * @return the constraint, or {@code null} if the predicate passes through
     * @throws TileLayerException if a handled predicate has an empty geometry
     */
    @Nullable
    public static QueryConstraint toConstraint(@Nonnull FilterPredicate predicate) {
        if (!isHandled(predicate)) {
            return null;
        }
        if (predicate.getGeometry().isEmpty()) {
            throw new TileLayerException("cannot filter extent on an empty geometry", ErrorCode.INVALID_PARAMETER,
                    LogMessageKeys.FILTERS, predicate);
        }
        if (predicate.getGeometry() instanceof Point) {
            return Contains.of((Point)predicate.getGeometry());
        }
        return new Intersects(Extent.fromEnvelope(predicate.getGeometry().getEnvelopeInternal()));
    }

    /**
     * Narrow a query by a predicate.
     *
     * @param query the query so far
     * @param predicate the predicate to apply
     * @param <K> the key type
     * @return the narrowed query, or {@code query} itself if the predicate passes through
     */
    @Nonnull
    public static <K extends SpatialComponent> LayerQuery<K> applyFilter(@Nonnull LayerQuery<K> query,
                                                                        @Nonnull FilterPredicate predicate) {
        final QueryConstraint constraint = toConstraint(predicate);
        if (constraint == null) {
            // pass-through: no narrowing, no error
            return query;
        }
        return query.where(constraint);
    }
}
