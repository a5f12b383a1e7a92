/*
 * RelationOptionsTest.java
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

import com.apple.foundationdb.tiles.api.exceptions.ErrorCode;
import com.apple.foundationdb.tiles.api.exceptions.TileLayerException;
import org.assertj.core.api.Assertions;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.ValueSource;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertSame;
import static org.junit.jupiter.api.Assertions.assertThrows;

class RelationOptionsTest {

    @Test
    void defaults() {
        assertEquals(Boolean.FALSE, RelationOptions.none().getOption(RelationOptions.Name.FAIL_ON_UNHANDLED_FILTER));
        assertEquals(Long.valueOf(Long.MAX_VALUE), RelationOptions.none().getOption(RelationOptions.Name.SIZE_IN_BYTES));
        assertFalse(RelationOptions.none().hasOption(RelationOptions.Name.SIZE_IN_BYTES));
    }

    @Test
    void emptyBuilderIsNone() {
        assertSame(RelationOptions.none(), RelationOptions.builder().build());
    }

    @Test
    void simpleOptions() {
        RelationOptions options = RelationOptions.builder()
                .withOption(RelationOptions.Name.FAIL_ON_UNHANDLED_FILTER, true)
                .withOption(RelationOptions.Name.SIZE_IN_BYTES, 1024L)
                .build();
        assertEquals(Boolean.TRUE, options.getOption(RelationOptions.Name.FAIL_ON_UNHANDLED_FILTER));
        assertEquals(Long.valueOf(1024L), options.getOption(RelationOptions.Name.SIZE_IN_BYTES));
        Assertions.assertThat(options.toBuilder().build()).isEqualTo(options);
    }

    @Test
    void violatedContract() {
        TileLayerException e = assertThrows(TileLayerException.class,
                () -> RelationOptions.builder().withOption(RelationOptions.Name.SIZE_IN_BYTES, "big"));
        assertEquals(ErrorCode.INVALID_PARAMETER, e.getErrorCode());
        Assertions.assertThat(e.getLogInfo()).containsEntry("expected_type", "Long");
    }

    @Test
    void fromStrings() {
        RelationOptions options = RelationOptions.builder()
                .withOptionFromString(RelationOptions.Name.FAIL_ON_UNHANDLED_FILTER, "TRUE")
                .withOptionFromString(RelationOptions.Name.SIZE_IN_BYTES, " 42 ")
                .build();
        assertEquals(Boolean.TRUE, options.getOption(RelationOptions.Name.FAIL_ON_UNHANDLED_FILTER));
        assertEquals(Long.valueOf(42L), options.getOption(RelationOptions.Name.SIZE_IN_BYTES));
    }

    @ParameterizedTest
    @ValueSource(strings = {"yes", "1", ""})
    void unparseableBoolean(String value) {
        TileLayerException e = assertThrows(TileLayerException.class,
                () -> RelationOptions.builder().withOptionFromString(RelationOptions.Name.FAIL_ON_UNHANDLED_FILTER, value));
        assertEquals(ErrorCode.INVALID_PARAMETER, e.getErrorCode());
    }

    @Test
    void unparseableLong() {
        TileLayerException e = assertThrows(TileLayerException.class,
                () -> RelationOptions.builder().withOptionFromString(RelationOptions.Name.SIZE_IN_BYTES, "12kb"));
        assertEquals(ErrorCode.INVALID_PARAMETER, e.getErrorCode());
        Assertions.assertThat(e).hasCauseInstanceOf(NumberFormatException.class);
    }

    @Test
    void negativeSize() {
        TileLayerException e = assertThrows(TileLayerException.class,
                () -> RelationOptions.builder().withOption(RelationOptions.Name.SIZE_IN_BYTES, -1L));
        assertEquals(ErrorCode.INVALID_PARAMETER, e.getErrorCode());
        Assertions.assertThat(e.getLogInfo()).containsEntry("option_value", -1L);

        e = assertThrows(TileLayerException.class,
                () -> RelationOptions.builder().withOptionFromString(RelationOptions.Name.SIZE_IN_BYTES, "-5"));
        assertEquals(ErrorCode.INVALID_PARAMETER, e.getErrorCode());

        assertEquals(Long.valueOf(0L), RelationOptions.builder()
                .withOption(RelationOptions.Name.SIZE_IN_BYTES, 0L)
                .build()
                .getOption(RelationOptions.Name.SIZE_IN_BYTES));
    }

    @Test
    void forKey() {
        assertSame(RelationOptions.Name.SIZE_IN_BYTES, RelationOptions.Name.forKey("sizeInBytes"));
        Assertions.assertThat(RelationOptions.Name.forKey("sizeinbytes")).isNull();
    }
}
