/*
 * AbstractRow.java
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

import com.apple.foundationdb.tiles.api.exceptions.InvalidColumnReferenceException;
import com.apple.foundationdb.tiles.api.exceptions.InvalidTypeException;

import javax.annotation.Nonnull;
import javax.annotation.Nullable;
import java.util.Objects;
import java.util.stream.Collectors;
import java.util.stream.IntStream;

/**
 * Implements the typed accessors and value equality of {@link Row} on top of {@link #getObject(int)}.
 */
public abstract class AbstractRow implements Row {

    @Nullable
    @Override
    public <T> T getObject(int position, @Nonnull Class<T> type) throws InvalidTypeException, InvalidColumnReferenceException {
        checkPosition(position);
        final Object o = getObject(position);
        if (o == null) {
            return null;
        }
        if (!type.isInstance(o)) {
            throw new InvalidTypeException("Value <" + o + "> cannot be cast to " + type.getSimpleName());
        }
        return type.cast(o);
    }

    @Override
    public long getLong(int position) throws InvalidTypeException, InvalidColumnReferenceException {
        checkPosition(position);
        Object o = getObject(position);
        if (!(o instanceof Number)) {
            throw new InvalidTypeException("Value <" + o + "> cannot be cast to a scalar type");
        }
        return ((Number) o).longValue();
    }

    @Override
    public double getDouble(int position) throws InvalidTypeException, InvalidColumnReferenceException {
        checkPosition(position);
        Object o = getObject(position);
        if (!(o instanceof Number)) {
            throw new InvalidTypeException("Value <" + o + "> cannot be cast to a double type");
        }
        return ((Number) o).doubleValue();
    }

    private void checkPosition(int position) {
        if (position < 0 || position >= getNumFields()) {
            throw InvalidColumnReferenceException.getExceptionForInvalidPositionNumber(position);
        }
    }

    @Override
    public boolean equals(Object other) {
        if (this == other) {
            return true;
        }
        if (!(other instanceof Row)) {
            return false;
        }
        final Row otherRow = (Row) other;
        final int numFields = getNumFields();
        if (numFields != otherRow.getNumFields()) {
            return false;
        }
        for (int i = 0; i < numFields; i++) {
            if (!Objects.equals(getObject(i), otherRow.getObject(i))) {
                return false;
            }
        }
        return true;
    }

    @Override
    public int hashCode() {
        return Objects.hash(IntStream.range(0, getNumFields()).mapToObj(this::getObject).toArray());
    }

    @Override
    public String toString() {
        return IntStream.range(0, getNumFields())
                .mapToObj(i -> String.valueOf(getObject(i)))
                .collect(Collectors.joining(",", "(", ")"));
    }
}
