/*
 * TemporalKey.java
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

import javax.annotation.Nonnull;
import java.time.Instant;

/**
 * Time component of a {@link SpaceTimeKey}, stored as milliseconds since the epoch.
 */
@API(API.Status.EXPERIMENTAL)
public final class TemporalKey implements Comparable<TemporalKey> {
    private final long instant;

    public TemporalKey(long instant) {
        this.instant = instant;
    }

    @Nonnull
    public static TemporalKey of(@Nonnull Instant time) {
        return new TemporalKey(time.toEpochMilli());
    }

    public long getInstant() {
        return instant;
    }

    @Nonnull
    public Instant getTime() {
        return Instant.ofEpochMilli(instant);
    }

    @Override
    public int compareTo(@Nonnull TemporalKey other) {
        return Long.compare(instant, other.instant);
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (!(o instanceof TemporalKey)) {
            return false;
        }
        return instant == ((TemporalKey)o).instant;
    }

    @Override
    public int hashCode() {
        return Long.hashCode(instant);
    }

    @Override
    public String toString() {
        return "TemporalKey(" + getTime() + ")";
    }
}
