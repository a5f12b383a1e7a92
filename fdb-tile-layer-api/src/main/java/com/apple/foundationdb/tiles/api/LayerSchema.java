/*
 * LayerSchema.java
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
import com.apple.foundationdb.tiles.api.exceptions.InvalidColumnReferenceException;
import com.apple.foundationdb.tiles.util.LogMessageKeys;
import com.google.common.base.Preconditions;
import com.google.common.base.Suppliers;
import com.google.common.collect.ImmutableList;
import com.google.common.collect.ImmutableMap;

import javax.annotation.Nonnull;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.function.Supplier;
import java.util.stream.Collectors;

/**
 * The ordered columns of a tile layer relation. Consumers may address columns by name or by 0-based position, so
 * the order is part of the contract.
 */
@API(API.Status.EXPERIMENTAL)
public final class LayerSchema {
    @Nonnull
    private final ImmutableList<Column> columns;
    @Nonnull
    private final ImmutableMap<String, Integer> positionsByName;
    @Nonnull
    private final Supplier<Integer> hashCodeSupplier;

    private LayerSchema(@Nonnull List<Column> columns) {
        this.columns = ImmutableList.copyOf(columns);
        final ImmutableMap.Builder<String, Integer> positions = ImmutableMap.builder();
        for (int i = 0; i < this.columns.size(); i++) {
            positions.put(this.columns.get(i).getName(), i);
        }
        this.positionsByName = positions.buildOrThrow();
        this.hashCodeSupplier = Suppliers.memoize(this.columns::hashCode);
    }

    /**
     * Create a schema from its columns.
     *
     * @param columns columns in positional order; names must be unique
     * @return the schema
     * @throws IllegalArgumentException if two columns share a name
     */
    @Nonnull
    public static LayerSchema of(@Nonnull List<Column> columns) {
        return new LayerSchema(columns);
    }

    @Nonnull
    public List<Column> getColumns() {
        return columns;
    }

    public int getColumnCount() {
        return columns.size();
    }

    @Nonnull
    public Column getColumn(int position) {
        if (position < 0 || position >= columns.size()) {
            throw InvalidColumnReferenceException.getExceptionForInvalidPositionNumber(position);
        }
        return columns.get(position);
    }

    @Nonnull
    public List<String> getColumnNames() {
        return columns.stream().map(Column::getName).collect(ImmutableList.toImmutableList());
    }

    public boolean hasColumn(@Nonnull String name) {
        return positionsByName.containsKey(name);
    }

    /**
     * Find the position of a column.
     *
     * @param name column name, matched exactly
     * @return the 0-based position of the column
     * @throws InvalidColumnReferenceException if there is no column with that name
     */
    public int getColumnIndex(@Nonnull String name) {
        final Integer position = positionsByName.get(name);
        if (position == null) {
            throw new InvalidColumnReferenceException("Unknown column " + name,
                    LogMessageKeys.COLUMN_NAME, name,
                    LogMessageKeys.AVAILABLE_COLUMNS, getColumnNames());
        }
        return position;
    }

    /**
     * The schema as a single struct type, with one field per column.
     *
     * @param typeName the name to give the struct
     * @return the struct type
     */
    @Nonnull
    public DataType.StructType toStructType(@Nonnull String typeName) {
        final ImmutableList.Builder<DataType.StructType.Field> fields = ImmutableList.builder();
        for (int i = 0; i < columns.size(); i++) {
            fields.add(DataType.StructType.Field.from(columns.get(i).getName(), columns.get(i).getType(), i + 1));
        }
        return DataType.StructType.from(typeName, fields.build(), false);
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (!(o instanceof LayerSchema)) {
            return false;
        }
        return columns.equals(((LayerSchema)o).columns);
    }

    @Override
    public int hashCode() {
        return hashCodeSupplier.get();
    }

    @Override
    public String toString() {
        return columns.stream().map(Column::toString).collect(Collectors.joining(", ", "[", "]"));
    }

    /**
     * One column: a name, a type (which carries nullability) and free-form metadata tags that consumers use to
     * recognize special columns.
     */
    public static final class Column {
        @Nonnull
        private final String name;
        @Nonnull
        private final DataType type;
        @Nonnull
        private final ImmutableMap<String, String> metadata;

        private Column(@Nonnull String name, @Nonnull DataType type, @Nonnull ImmutableMap<String, String> metadata) {
            Preconditions.checkArgument(!name.isEmpty(), "column name must not be empty");
            this.name = name;
            this.type = type;
            this.metadata = metadata;
        }

        @Nonnull
        public static Column of(@Nonnull String name, @Nonnull DataType type) {
            return new Column(name, type, ImmutableMap.of());
        }

        @Nonnull
        public static Column of(@Nonnull String name, @Nonnull DataType type, @Nonnull Map<String, String> metadata) {
            return new Column(name, type, ImmutableMap.copyOf(metadata));
        }

        @Nonnull
        public String getName() {
            return name;
        }

        @Nonnull
        public DataType getType() {
            return type;
        }

        public boolean isNullable() {
            return type.isNullable();
        }

        @Nonnull
        public ImmutableMap<String, String> getMetadata() {
            return metadata;
        }

        public boolean hasTag(@Nonnull String tag) {
            return Boolean.parseBoolean(metadata.get(tag));
        }

        @Override
        public boolean equals(Object o) {
            if (this == o) {
                return true;
            }
            if (!(o instanceof Column)) {
                return false;
            }
            final Column column = (Column)o;
            return name.equals(column.name) && type.equals(column.type) && metadata.equals(column.metadata);
        }

        @Override
        public int hashCode() {
            return Objects.hash(name, type, metadata);
        }

        @Override
        public String toString() {
            return name + ":" + type;
        }
    }
}
