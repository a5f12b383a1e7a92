/*
 * Contains.java
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
import org.locationtech.jts.geom.Point;

import javax.annotation.Nonnull;
import java.util.Objects;

/**
 * Keeps the tiles whose grid cell contains a point.
 */
@API(API.Status.EXPERIMENTAL)
public final class Contains implements QueryConstraint {
    private final double x;
    private final double y;

    public Contains(double x, double y) {
        this.x = x;
        this.y = y;
    }

    @Nonnull
    public static Contains of(@Nonnull Point point) {
        return new Contains(point.getX(), point.getY());
    }

    public double getX() {
        return x;
    }

    public double getY() {
        return y;
    }

    @Override
    public <R> R accept(@Nonnull Visitor<R> visitor) {
        return visitor.visitContains(this);
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (!(o instanceof Contains)) {
            return false;
        }
        final Contains that = (Contains)o;
        return Double.compare(that.x, x) == 0 && Double.compare(that.y, y) == 0;
    }

    @Override
    public int hashCode() {
        return Objects.hash(x, y);
    }

    @Override
    public String toString() {
        return "Contains(" + x + ", " + y + ")";
    }
}
