/*
 * LogMessageKeys.java
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

package com.apple.foundationdb.tiles.util;

import com.apple.foundationdb.annotation.API;

import java.util.Locale;

/**
 * Keys used in log messages and in the log info of {@link LoggableException}s raised by the tile layer libraries.
 * Keeping them in one place makes collisions easy to spot.
 */
@API(API.Status.UNSTABLE)
public enum LogMessageKeys {
    TITLE,

    // layers and stores
    LAYER_NAME,
    LAYER_ZOOM,
    STORE_LOCATION,
    STORE_NAME,
    KEY_CLASS,
    VALUE_CLASS,
    KEY_VARIANT,

    // scans
    COLUMN_NAME,
    REQUESTED_COLUMNS,
    AVAILABLE_COLUMNS,
    FILTERS,
    UNHANDLED_FILTERS,
    CONSTRAINT,
    TILE_KEY,

    // options and parameters
    OPTION_NAME,
    OPTION_VALUE,
    PARAMETER_NAME,
    EXPECTED_TYPE,
    ;

    private final String logKey;

    LogMessageKeys() {
        this.logKey = name().toLowerCase(Locale.ROOT);
    }

    @Override
    public String toString() {
        return logKey;
    }
}
