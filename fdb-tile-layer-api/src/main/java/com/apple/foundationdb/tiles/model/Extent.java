/*
 * Extent.java
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

package com.apple.foundationdb.tiles.model;

import com.apple.foundationdb.annotation.API;
import com.google.common.base.Preconditions;
import org.locationtech.jts.geom.Envelope;

import javax.annotation.Nonnull;
import java.util.Objects;

/**
 * An axis-aligned bounding box in layer coordinates. Edges are inclusive: two extents that share an edge intersect.
 */
@API(API.Status.EXPERIMENTAL)
public final class Extent {
    private final double xmin;
    private final double ymin;
    private final double xmax;
    private final double ymax;

    public Extent(double xmin, double ymin, double xmax, double ymax) {
        Preconditions.checkArgument(xmin <= xmax, "invalid extent: xmin %s is greater than xmax %s", xmin, xmax);
        Preconditions.checkArgument(ymin <= ymax, "invalid extent: ymin %s is greater than ymax %s", ymin, ymax);
        this.xmin = xmin;
        this.ymin = ymin;
        this.xmax = xmax;
        this.ymax = ymax;
    }

    /**
     * Create the extent covering a JTS envelope.
     *
     * @param envelope a non-null envelope
     * @return an extent with the same bounds
     */
    @Nonnull
    public static Extent fromEnvelope(@Nonnull Envelope envelope) {
        Preconditions.checkArgument(!envelope.isNull(), "cannot create an extent from an empty envelope");
        return new Extent(envelope.getMinX(), envelope.getMinY(), envelope.getMaxX(), envelope.getMaxY());
    }

    public double getXmin() {
        return xmin;
    }

    public double getYmin() {
        return ymin;
    }

    public double getXmax() {
        return xmax;
    }

    public double getYmax() {
        return ymax;
    }

    public double getWidth() {
        return xmax - xmin;
    }

    public double getHeight() {
        return ymax - ymin;
    }

    public boolean intersects(@Nonnull Extent other) {
        return !(other.xmin > xmax || other.xmax < xmin || other.ymin > ymax || other.ymax < ymin);
    }

    public boolean contains(double x, double y) {
        return x >= xmin && x <= xmax && y >= ymin && y <= ymax;
    }

    @Nonnull
    public Envelope toEnvelope() {
        return new Envelope(xmin, xmax, ymin, ymax);
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (!(o instanceof Extent)) {
            return false;
        }
        final Extent extent = (Extent)o;
        return Double.compare(extent.xmin, xmin) == 0
               && Double.compare(extent.ymin, ymin) == 0
               && Double.compare(extent.xmax, xmax) == 0
               && Double.compare(extent.ymax, ymax) == 0;
    }

    @Override
    public int hashCode() {
        return Objects.hash(xmin, ymin, xmax, ymax);
    }

    @Override
    public String toString() {
        return "Extent(" + xmin + ", " + ymin + ", " + xmax + ", " + ymax + ")";
    }
}
