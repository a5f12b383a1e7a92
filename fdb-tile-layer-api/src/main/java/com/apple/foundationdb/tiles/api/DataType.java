/*
 * DataType.java
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
import com.google.common.base.Suppliers;
import com.google.common.collect.ImmutableList;

import javax.annotation.Nonnull;
import java.util.List;
import java.util.Objects;
import java.util.function.Supplier;
import java.util.stream.Collectors;

/**
 * Types of the columns a tile layer relation exposes. Every type knows whether it admits {@code null}.
 */
@API(API.Status.EXPERIMENTAL)
public abstract class DataType {
    private static final String OR_NULL = " ∪ ∅";

    private final boolean nullable;
    @Nonnull
    private final Code code;

    /**
     * Discriminates the concrete type.
     */
    public enum Code {
        INTEGER,
        LONG,
        DOUBLE,
        STRUCT,
        TILE
    }

    private DataType(boolean nullable, @Nonnull Code code) {
        this.nullable = nullable;
        this.code = code;
    }

    public boolean isNullable() {
        return nullable;
    }

    @Nonnull
    public Code getCode() {
        return code;
    }

    public boolean isPrimitive() {
        return code != Code.STRUCT && code != Code.TILE;
    }

    @Nonnull
    public abstract DataType withNullable(boolean isNullable);

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (o == null || getClass() != o.getClass()) {
            return false;
        }
        final DataType other = (DataType)o;
        return nullable == other.nullable && code == other.code;
    }

    @Override
    public int hashCode() {
        return Objects.hash(nullable, code);
    }

    @Nonnull
    String nullSuffix() {
        return nullable ? OR_NULL : "";
    }

    public static final class IntegerType extends DataType {
        private static final IntegerType NOT_NULLABLE_INSTANCE = new IntegerType(false);
        private static final IntegerType NULLABLE_INSTANCE = new IntegerType(true);

        private IntegerType(boolean nullable) {
            super(nullable, Code.INTEGER);
        }

        @Nonnull
        public static IntegerType nullable() {
            return NULLABLE_INSTANCE;
        }

        @Nonnull
        public static IntegerType notNullable() {
            return NOT_NULLABLE_INSTANCE;
        }

        @Nonnull
        @Override
        public DataType withNullable(boolean isNullable) {
            return isNullable ? NULLABLE_INSTANCE : NOT_NULLABLE_INSTANCE;
        }

        @Override
        public String toString() {
            return "int" + nullSuffix();
        }
    }

    public static final class LongType extends DataType {
        private static final LongType NOT_NULLABLE_INSTANCE = new LongType(false);
        private static final LongType NULLABLE_INSTANCE = new LongType(true);

        private LongType(boolean nullable) {
            super(nullable, Code.LONG);
        }

        @Nonnull
        public static LongType nullable() {
            return NULLABLE_INSTANCE;
        }

        @Nonnull
        public static LongType notNullable() {
            return NOT_NULLABLE_INSTANCE;
        }

        @Nonnull
        @Override
        public DataType withNullable(boolean isNullable) {
            return isNullable ? NULLABLE_INSTANCE : NOT_NULLABLE_INSTANCE;
        }

        @Override
        public String toString() {
            return "long" + nullSuffix();
        }
    }

    public static final class DoubleType extends DataType {
        private static final DoubleType NOT_NULLABLE_INSTANCE = new DoubleType(false);
        private static final DoubleType NULLABLE_INSTANCE = new DoubleType(true);

        private DoubleType(boolean nullable) {
            super(nullable, Code.DOUBLE);
        }

        @Nonnull
        public static DoubleType nullable() {
            return NULLABLE_INSTANCE;
        }

        @Nonnull
        public static DoubleType notNullable() {
            return NOT_NULLABLE_INSTANCE;
        }

        @Nonnull
        @Override
        public DataType withNullable(boolean isNullable) {
            return isNullable ? NULLABLE_INSTANCE : NOT_NULLABLE_INSTANCE;
        }

        @Override
        public String toString() {
            return "double" + nullSuffix();
        }
    }

    /**
     * Opaque raster tile. Consumers receive tile objects as they came out of the store.
     */
    public static final class TileType extends DataType {
        private static final TileType NOT_NULLABLE_INSTANCE = new TileType(false);
        private static final TileType NULLABLE_INSTANCE = new TileType(true);

        private TileType(boolean nullable) {
            super(nullable, Code.TILE);
        }

        @Nonnull
        public static TileType nullable() {
            return NULLABLE_INSTANCE;
        }

        @Nonnull
        public static TileType notNullable() {
            return NOT_NULLABLE_INSTANCE;
        }

        @Nonnull
        @Override
        public DataType withNullable(boolean isNullable) {
            return isNullable ? NULLABLE_INSTANCE : NOT_NULLABLE_INSTANCE;
        }

        @Override
        public String toString() {
            return "tile" + nullSuffix();
        }
    }

    /**
     * A named, ordered collection of fields.
     */
    public static final class StructType extends DataType {
        @Nonnull
        private final String name;
        @Nonnull
        private final ImmutableList<Field> fields;
        @Nonnull
        private final Supplier<Integer> hashCodeSupplier;

        private StructType(@Nonnull String name, @Nonnull List<Field> fields, boolean nullable) {
            super(nullable, Code.STRUCT);
            this.name = name;
            this.fields = ImmutableList.copyOf(fields);
            this.hashCodeSupplier = Suppliers.memoize(() -> Objects.hash(name, this.fields, nullable));
        }

        @Nonnull
        public static StructType from(@Nonnull String name, @Nonnull List<Field> fields, boolean isNullable) {
            return new StructType(name, fields, isNullable);
        }

        @Nonnull
        public String getName() {
            return name;
        }

        @Nonnull
        public List<Field> getFields() {
            return fields;
        }

        @Nonnull
        @Override
        public StructType withNullable(boolean isNullable) {
            if (isNullable == isNullable()) {
                return this;
            }
            return new StructType(name, fields, isNullable);
        }

        @Override
        public boolean equals(Object o) {
            if (!super.equals(o)) {
                return false;
            }
            final StructType other = (StructType)o;
            return name.equals(other.name) && fields.equals(other.fields);
        }

        @Override
        public int hashCode() {
            return hashCodeSupplier.get();
        }

        @Override
        public String toString() {
            return name + " { " + fields.stream().map(Field::toString).collect(Collectors.joining(",")) + " }" + nullSuffix();
        }

        /**
         * A field of a struct. The index is the field's 1-based position inside the struct.
         */
        public static final class Field {
            @Nonnull
            private final String name;
            @Nonnull
            private final DataType type;
            private final int index;

            private Field(@Nonnull String name, @Nonnull DataType type, int index) {
                this.name = name;
                this.type = type;
                this.index = index;
            }

            @Nonnull
            public static Field from(@Nonnull String name, @Nonnull DataType type, int index) {
                return new Field(name, type, index);
            }

            @Nonnull
            public String getName() {
                return name;
            }

            @Nonnull
            public DataType getType() {
                return type;
            }

            public int getIndex() {
                return index;
            }

            @Override
            public boolean equals(Object o) {
                if (this == o) {
                    return true;
                }
                if (!(o instanceof Field)) {
                    return false;
                }
                final Field field = (Field)o;
                return index == field.index && name.equals(field.name) && type.equals(field.type);
            }

            @Override
            public int hashCode() {
                return Objects.hash(name, type, index);
            }

            @Override
            public String toString() {
                return name + ":" + type;
            }
        }
    }
}
