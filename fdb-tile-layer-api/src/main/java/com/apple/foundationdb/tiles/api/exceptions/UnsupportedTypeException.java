/*
 * UnsupportedTypeException.java
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

package com.apple.foundationdb.tiles.api.exceptions;

import com.apple.foundationdb.annotation.API;
import com.apple.foundationdb.tiles.util.LogMessageKeys;

import javax.annotation.Nonnull;
import javax.annotation.Nullable;

/**
 * Thrown when a layer header declares a key or value representation the relation cannot expose. The error code is
 * {@link ErrorCode#UNSUPPORTED_KEY_TYPE} or {@link ErrorCode#UNSUPPORTED_VALUE_TYPE}.
 */
@SuppressWarnings("serial")
@API(API.Status.EXPERIMENTAL)
public class UnsupportedTypeException extends TileLayerException {
    public UnsupportedTypeException(@Nonnull String message, @Nonnull ErrorCode errorCode, @Nullable Object... keyValues) {
        super(message, errorCode, keyValues);
    }

    @Nonnull
    public static UnsupportedTypeException unsupportedKeyType(@Nonnull String keyClassName) {
        return new UnsupportedTypeException("Unsupported key type " + keyClassName, ErrorCode.UNSUPPORTED_KEY_TYPE,
                LogMessageKeys.KEY_CLASS, keyClassName);
    }

    @Nonnull
    public static UnsupportedTypeException unsupportedValueType(@Nonnull String valueClassName) {
        return new UnsupportedTypeException("Unsupported tile type " + valueClassName, ErrorCode.UNSUPPORTED_VALUE_TYPE,
                LogMessageKeys.VALUE_CLASS, valueClassName);
    }
}
