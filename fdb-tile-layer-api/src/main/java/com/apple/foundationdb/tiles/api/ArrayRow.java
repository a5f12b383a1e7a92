/*
 * ArrayRow.java
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
import com.google.common.base.Suppliers;

import javax.annotation.Nullable;
import java.util.Arrays;
import java.util.function.Supplier;

/**
 * A {@link Row} backed by an array of values. The array is used as given, not copied.
 */
@API(API.Status.EXPERIMENTAL)
public class ArrayRow extends AbstractRow {
    private final Object[] data;
    private final Supplier<Integer> hashCodeSupplier;

    public ArrayRow(Object... data) {
        this.data = data;
        this.hashCodeSupplier = Suppliers.memoize(() -> Arrays.hashCode(data));
    }

    @Override
    public int getNumFields() {
        return data.length;
    }

    @Nullable
    @Override
    public Object getObject(int position) throws InvalidColumnReferenceException {
        if (position < 0 || position >= data.length) {
            throw InvalidColumnReferenceException.getExceptionForInvalidPositionNumber(position);
        }
        return data[position];
    }

    @Override
    public boolean equals(Object other) {
        if (other instanceof ArrayRow) {
            return Arrays.equals(data, ((ArrayRow) other).data);
        }
        return super.equals(other);
    }

    @Override
    public int hashCode() {
        return hashCodeSupplier.get();
    }
}
