/*
 * ErrorCode.java
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
import java.util.Map;
import java.util.function.Function;
import java.util.stream.Collectors;
import java.util.stream.Stream;

/**
 * Error codes of the tile layer relation. The code strings follow the SQLSTATE layout: a two character class
 * followed by a three character subclass.
 */
@API(API.Status.EXPERIMENTAL)
public enum ErrorCode {
    // Class 0A - feature not supported
    UNSUPPORTED_KEY_TYPE("0AT01"),
    UNSUPPORTED_VALUE_TYPE("0AT02"),
    UNSUPPORTED_FILTER("0AT03"),
    UNSUPPORTED_STORE("0AT04"),

    // Class 22 - data exception
    INVALID_TYPE("22000"),
    INVALID_PARAMETER("22023"),

    // Class 42 - syntax error or access rule violation
    UNKNOWN_COLUMN("42703"),
    LAYER_NOT_FOUND("42P01"),
    STORE_NOT_FOUND("42P02"),

    // Class XX - internal error
    INTERNAL_ERROR("XX000"),
    UNKNOWN("XXXXX");

    private static final Map<String, ErrorCode> BY_CODE = Stream.of(values())
            .collect(Collectors.toUnmodifiableMap(ErrorCode::getErrorCode, Function.identity()));

    @Nonnull
    private final String errorCode;

    ErrorCode(@Nonnull String errorCode) {
        this.errorCode = errorCode;
    }

    @Nonnull
    public String getErrorCode() {
        return errorCode;
    }

    /**
     * Look up the error code with the given code string.
     *
     * @param code the five character code
     * @return the matching error code, or {@link #UNKNOWN} if there is none
     */
    @Nonnull
    public static ErrorCode get(@Nonnull String code) {
        return BY_CODE.getOrDefault(code, UNKNOWN);
    }
}
