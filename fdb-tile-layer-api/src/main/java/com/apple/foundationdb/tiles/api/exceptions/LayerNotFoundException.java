/*
 * LayerNotFoundException.java
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

import javax.annotation.Nonnull;
import javax.annotation.Nullable;

/**
 * Thrown by stores when the requested layer, or the store itself, does not exist. The error code is
 * {@link ErrorCode#LAYER_NOT_FOUND} or {@link ErrorCode#STORE_NOT_FOUND}.
 */
@SuppressWarnings("serial")
@API(API.Status.EXPERIMENTAL)
public class LayerNotFoundException extends TileLayerException {
    public LayerNotFoundException(@Nonnull String message, @Nonnull ErrorCode errorCode, @Nullable Object... keyValues) {
        super(message, errorCode, keyValues);
    }
}
