/*
 * LayerHeader.java
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
import javax.annotation.Nullable;
import java.util.Objects;

/**
 * The header a store keeps for every layer. It names the key and value representations the layer was written with;
 * the relation resolves those names into a {@link KeyVariant} and a {@link ValueVariant}.
 */
@API(API.Status.EXPERIMENTAL)
public final class LayerHeader {
    @Nonnull
    private final String keyClassName;
    @Nonnull
    private final String valueClassName;
    @Nullable
    private final String format;

    public LayerHeader(@Nonnull String keyClassName, @Nonnull String valueClassName, @Nullable String format) {
        this.keyClassName = keyClassName;
        this.valueClassName = valueClassName;
        this.format = format;
    }

    public LayerHeader(@Nonnull String keyClassName, @Nonnull String valueClassName) {
        this(keyClassName, valueClassName, null);
    }

    @Nonnull
    public String getKeyClassName() {
        return keyClassName;
    }

    @Nonnull
    public String getValueClassName() {
        return valueClassName;
    }

    /**
     * The name of the backend that wrote the layer, if the store records one. Informational only.
     * @return the format name or {@code null}
     */
    @Nullable
    public String getFormat() {
        return format;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (!(o instanceof LayerHeader)) {
            return false;
        }
        final LayerHeader that = (LayerHeader)o;
        return keyClassName.equals(that.keyClassName)
               && valueClassName.equals(that.valueClassName)
               && Objects.equals(format, that.format);
    }

    @Override
    public int hashCode() {
        return Objects.hash(keyClassName, valueClassName, format);
    }

    @Override
    public String toString() {
        return "LayerHeader{keyClass=" + keyClassName + ", valueClass=" + valueClassName
               + (format == null ? "" : ", format=" + format) + "}";
    }
}
