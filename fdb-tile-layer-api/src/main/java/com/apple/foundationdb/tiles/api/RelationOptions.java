/*
 * RelationOptions.java
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

package com.apple.foundationdb.tiles.api;

import com.apple.foundationdb.annotation.API;
import com.apple.foundationdb.tiles.api.exceptions.ErrorCode;
import com.apple.foundationdb.tiles.api.exceptions.TileLayerException;
import com.apple.foundationdb.tiles.util.LogMessageKeys;
import com.google.common.collect.ImmutableMap;

import javax.annotation.Nonnull;
import javax.annotation.Nullable;
import java.util.EnumMap;
import java.util.Map;
import java.util.Objects;
import java.util.function.Function;
import java.util.function.Predicate;

/**
 * Options that tune a tile layer relation. An option that was never set reads as its default.
 */
@API(API.Status.EXPERIMENTAL)
public final class RelationOptions {

    private static final RelationOptions NONE = new RelationOptions(ImmutableMap.of());

    public enum Name {
        /**
         * Fail a scan with {@link ErrorCode#UNSUPPORTED_FILTER} instead of ignoring a filter the store cannot apply.
         * Default: {@code false}.
         */
        FAIL_ON_UNHANDLED_FILTER("failOnUnhandledFilter", Boolean.class, false, RelationOptions::parseBoolean, value -> true),

        /**
         * Size in bytes the relation reports to planners. No estimate is computed from layer metadata, so this
         * is reported as is. Must not be negative. Default: {@link Long#MAX_VALUE}, meaning unknown.
         */
        SIZE_IN_BYTES("sizeInBytes", Long.class, Long.MAX_VALUE, Long::parseLong, value -> (Long)value >= 0L),
        ;

        @Nonnull
        private final String key;
        @Nonnull
        private final Class<?> type;
        @Nonnull
        private final Object defaultValue;
        @Nonnull
        private final Function<String, ?> parser;
        @Nonnull
        private final Predicate<Object> range;

        Name(@Nonnull String key, @Nonnull Class<?> type, @Nonnull Object defaultValue,
             @Nonnull Function<String, ?> parser, @Nonnull Predicate<Object> range) {
            this.key = key;
            this.type = type;
            this.defaultValue = defaultValue;
            this.parser = parser;
            this.range = range;
        }

        /**
         * The name of this option in string-keyed parameter maps.
         * @return the parameter key
         */
        @Nonnull
        public String getKey() {
            return key;
        }

        @Nonnull
        public Class<?> getType() {
            return type;
        }

        @Nonnull
        public Object getDefaultValue() {
            return defaultValue;
        }

        @Nullable
        public static Name forKey(@Nonnull String key) {
            for (Name name : values()) {
                if (name.key.equals(key)) {
                    return name;
                }
            }
            return null;
        }
    }

    @Nonnull
    private final ImmutableMap<Name, Object> options;

    private RelationOptions(@Nonnull Map<Name, Object> options) {
        this.options = ImmutableMap.copyOf(options);
    }

    @Nonnull
    public static RelationOptions none() {
        return NONE;
    }

    @Nonnull
    public static Builder builder() {
        return new Builder();
    }

    @Nonnull
    public Builder toBuilder() {
        final Builder builder = new Builder();
        builder.options.putAll(options);
        return builder;
    }

    /**
     * Read an option.
     *
     * @param name the option
     * @param <T> the type of the option's value
     * @return the value that was set, or the option's default
     */
    @Nonnull
    @SuppressWarnings("unchecked")
    public <T> T getOption(@Nonnull Name name) {
        return (T) options.getOrDefault(name, name.getDefaultValue());
    }

    public boolean hasOption(@Nonnull Name name) {
        return options.containsKey(name);
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (!(o instanceof RelationOptions)) {
            return false;
        }
        return options.equals(((RelationOptions)o).options);
    }

    @Override
    public int hashCode() {
        return Objects.hash(options);
    }

    @Override
    public String toString() {
        return "RelationOptions" + options;
    }

    @Nonnull
    private static Boolean parseBoolean(@Nonnull String value) {
        if ("true".equalsIgnoreCase(value)) {
            return Boolean.TRUE;
        }
        if ("false".equalsIgnoreCase(value)) {
            return Boolean.FALSE;
        }
        throw new IllegalArgumentException("not a boolean: " + value);
    }

    public static final class Builder {
        private final Map<Name, Object> options = new EnumMap<>(Name.class);

        private Builder() {
        }

        /**
         * Set an option.
         *
         * @param name the option
         * @param value the value, which must be an instance of the option's type
         * @return this builder
         * @throws TileLayerException with {@link ErrorCode#INVALID_PARAMETER} if the value has the wrong type or is
         * out of the option's range
         */
        @Nonnull
        public Builder withOption(@Nonnull Name name, @Nonnull Object value) {
            if (!name.getType().isInstance(value)) {
                throw new TileLayerException("Invalid value for option " + name.getKey(), ErrorCode.INVALID_PARAMETER,
                        LogMessageKeys.OPTION_NAME, name,
                        LogMessageKeys.OPTION_VALUE, value,
                        LogMessageKeys.EXPECTED_TYPE, name.getType().getSimpleName());
            }
            if (!name.range.test(value)) {
                throw new TileLayerException("Value out of range for option " + name.getKey(), ErrorCode.INVALID_PARAMETER,
                        LogMessageKeys.OPTION_NAME, name,
                        LogMessageKeys.OPTION_VALUE, value);
            }
            options.put(name, value);
            return this;
        }

        /**
         * Set an option from its string form.
         *
         * @param name the option
         * @param value the string form of the value
         * @return this builder
         * @throws TileLayerException with {@link ErrorCode#INVALID_PARAMETER} if the value cannot be parsed
         */
        @Nonnull
        public Builder withOptionFromString(@Nonnull Name name, @Nonnull String value) {
            final Object parsed;
            try {
                parsed = name.parser.apply(value.trim());
            } catch (IllegalArgumentException e) {
                throw new TileLayerException("Cannot parse value for option " + name.getKey(), ErrorCode.INVALID_PARAMETER, e)
                        .addLogInfo(LogMessageKeys.OPTION_NAME.toString(), name)
                        .addLogInfo(LogMessageKeys.OPTION_VALUE.toString(), value);
            }
            return withOption(name, parsed);
        }

        @Nonnull
        public RelationOptions build() {
            if (options.isEmpty()) {
                return NONE;
            }
            return new RelationOptions(options);
        }
    }
}
