/*
 * ResolvedLayerType.java
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
import com.apple.foundationdb.tiles.model.KeyVariant;
import com.apple.foundationdb.tiles.model.ValueVariant;

import javax.annotation.Nonnull;
import java.util.Objects;

/**
 * The key and value representation a layer header resolved to.
 */
@API(API.Status.EXPERIMENTAL)
public final class ResolvedLayerType {
    @Nonnull
    private final KeyVariant keyVariant;
    @Nonnull
    private final ValueVariant valueVariant;

    public ResolvedLayerType(@Nonnull KeyVariant keyVariant, @Nonnull ValueVariant valueVariant) {
        this.keyVariant = keyVariant;
        this.valueVariant = valueVariant;
    }

    @Nonnull
    public KeyVariant getKeyVariant() {
        return keyVariant;
    }

    @Nonnull
    public ValueVariant getValueVariant() {
        return valueVariant;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (!(o instanceof ResolvedLayerType)) {
            return false;
        }
        final ResolvedLayerType that = (ResolvedLayerType)o;
        return keyVariant == that.keyVariant && valueVariant == that.valueVariant;
    }

    @Override
    public int hashCode() {
        return Objects.hash(keyVariant, valueVariant);
    }

    @Override
    public String toString() {
        return keyVariant + "/" + valueVariant;
    }
}
