/*
 * Row.java
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

/**
 * One result of a scan. The fields of a row line up, by count and by order, with the columns the scan requested.
 */
public interface Row {

    /**
     * Get the number of fields in this row.
     *
     * @return the number of fields in the row.
     */
    int getNumFields();

    /**
     * Get the value at the specified position.
     *
     * @param position the position in the row
     * @return the value of the row at the specified position
     * @throws InvalidColumnReferenceException if {@code position < 0 } or {@code position >=}{@link #getNumFields()}
     */
    @Nullable
    Object getObject(int position) throws InvalidColumnReferenceException;

    /**
     * Get the value at the specified position, as an instance of the given class.
     *
     * @param position the position in the row
     * @param type the expected class of the value
     * @param <T> the expected type of the value
     * @return the value of the row at the specified position, or {@code null} if the value is null
     * @throws InvalidTypeException if the value is not an instance of {@code type}
     * @throws InvalidColumnReferenceException if {@code position < 0 } or {@code position >=}{@link #getNumFields()}
     */
    @Nullable
    <T> T getObject(int position, @Nonnull Class<T> type) throws InvalidTypeException, InvalidColumnReferenceException;

    /**
     * Get the value at the specified position, as a long.
     *
     * @param position the position in the row
     * @return the value of the row at the specified position, as a long.
     * @throws InvalidTypeException if the field at the position is not a number
     * @throws InvalidColumnReferenceException if {@code position < 0 } or {@code position >=}{@link #getNumFields()}
     */
    long getLong(int position) throws InvalidTypeException, InvalidColumnReferenceException;

    /**
     * Get the value at the specified position, as a double.
     *
     * @param position the position in the row
     * @return the value of the row at the specified position, as a double.
     * @throws InvalidTypeException if the field at the position is not a number
     * @throws InvalidColumnReferenceException if {@code position < 0 } or {@code position >=}{@link #getNumFields()}
     */
    double getDouble(int position) throws InvalidTypeException, InvalidColumnReferenceException;
}
