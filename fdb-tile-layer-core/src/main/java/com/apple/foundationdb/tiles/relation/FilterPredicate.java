/*
 * FilterPredicate.java
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
import org.locationtech.jts.geom.Geometry;

import javax.annotation.Nonnull;
import java.util.Objects;

/**
 * A geometric filter requested by the consumer of a {@link LayerRelation}: "{@code columnName relationName
 * geometry}", for example {@code extent intersects POINT(0.5 0.5)}. Whether it narrows a scan is decided by
 * {@link LayerFilters}.
 */
@API(API.Status.EXPERIMENTAL)
public final class FilterPredicate {
    @Nonnull
    private final String columnName;
    @Nonnull
    private final String relationName;
    @Nonnull
    private final Geometry geometry;

    private FilterPredicate(@Nonnull String columnName, @Nonnull String relationName, @Nonnull Geometry geometry) {
        this.columnName = columnName;
        this.relationName = relationName;
        this.geometry = geometry;
    }

    @Nonnull
    public static FilterPredicate of(@Nonnull String columnName, @Nonnull String relationName, @Nonnull Geometry geometry) {
        return new FilterPredicate(columnName, relationName, geometry);
    }

    /**
     * Shorthand for the one predicate shape that is pushed down to the store.
     *
     * @param geometry the query geometry
     * @return {@code extent intersects geometry}
     */
    @Nonnull
    public static FilterPredicate extentIntersects(@Nonnull Geometry geometry) {
        return new FilterPredicate(LayerSchemaBuilder.EXTENT_COLUMN, LayerFilters.INTERSECTS, geometry);
    }

    @Nonnull
    public String getColumnName() {
        return columnName;
    }

    @Nonnull
    public String getRelationName() {
        return relationName;
    }

    @Nonnull
    public Geometry getGeometry() {
        return geometry;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (!(o instanceof FilterPredicate)) {
            return false;
        }
        final FilterPredicate that = (FilterPredicate)o;
        return columnName.equals(that.columnName)
               && relationName.equals(that.relationName)
               && geometry.equalsExact(that.geometry);
    }

    @Override
    public int hashCode() {
        return Objects.hash(columnName, relationName, geometry.getGeometryType(), geometry.getEnvelopeInternal());
    }

    @Override
    public String toString() {
        return columnName + " " + relationName + " " + geometry;
    }
}
