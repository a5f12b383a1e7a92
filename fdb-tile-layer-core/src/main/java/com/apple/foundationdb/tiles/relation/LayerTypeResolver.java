/*
 * LayerTypeResolver.java
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
import com.apple.foundationdb.tiles.api.exceptions.UnsupportedTypeException;
import com.apple.foundationdb.tiles.model.KeyVariant;
import com.apple.foundationdb.tiles.model.LayerHeader;
import com.apple.foundationdb.tiles.model.ValueVariant;

import javax.annotation.Nonnull;

/**
 * Maps the type names declared in a {@link LayerHeader} onto the key and value variants this library can read.
 * The key type is checked before the value type, so a header with two unknown names reports the key.
 */
@API(API.Status.EXPERIMENTAL)
public final class LayerTypeResolver {

    private LayerTypeResolver() {
    }

    /**
     * Resolve a header.
     *
     * @param header the layer header
     * @return the resolved variants
     * @throws UnsupportedTypeException if the key or the value type name is not recognized
     */
    @Nonnull
    public static ResolvedLayerType resolve(@Nonnull LayerHeader header) {
        final KeyVariant keyVariant = KeyVariant.forClassName(header.getKeyClassName());
        if (keyVariant == null) {
            throw UnsupportedTypeException.unsupportedKeyType(header.getKeyClassName());
        }
        final ValueVariant valueVariant = ValueVariant.forClassName(header.getValueClassName());
        if (valueVariant == null) {
            throw UnsupportedTypeException.unsupportedValueType(header.getValueClassName());
        }
        return new ResolvedLayerType(keyVariant, valueVariant);
    }
}
