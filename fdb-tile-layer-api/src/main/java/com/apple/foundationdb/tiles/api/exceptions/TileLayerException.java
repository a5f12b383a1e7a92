/*
 * TileLayerException.java
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
import com.apple.foundationdb.tiles.util.LoggableException;

import javax.annotation.Nonnull;
import javax.annotation.Nullable;

/**
 * Base exception of the tile layer relation. Every instance carries an {@link ErrorCode}.
 */
@SuppressWarnings("serial")
@API(API.Status.EXPERIMENTAL)
public class TileLayerException extends LoggableException {
    @Nonnull
    private final ErrorCode errorCode;

    public TileLayerException(@Nonnull String message, @Nonnull ErrorCode errorCode, @Nullable Object... keyValues) {
        super(message, keyValues);
        this.errorCode = errorCode;
    }

    public TileLayerException(@Nonnull String message, @Nonnull ErrorCode errorCode, @Nullable Throwable cause) {
        super(message, cause);
        this.errorCode = errorCode;
    }

    @Nonnull
    public ErrorCode getErrorCode() {
        return errorCode;
    }

    @Nonnull
    @Override
    public TileLayerException addLogInfo(@Nonnull String description, @Nullable Object object) {
        super.addLogInfo(description, object);
        return this;
    }

    @Nonnull
    @Override
    public TileLayerException addLogInfo(@Nonnull Object... keyValue) {
        super.addLogInfo(keyValue);
        return this;
    }
}
