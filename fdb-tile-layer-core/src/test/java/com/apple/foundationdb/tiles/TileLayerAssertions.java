/*
 * TileLayerAssertions.java
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

package com.apple.foundationdb.tiles;

import com.apple.foundationdb.tiles.api.exceptions.ErrorCode;
import com.apple.foundationdb.tiles.api.exceptions.TileLayerException;
import org.assertj.core.api.AbstractThrowableAssert;
import org.junit.jupiter.api.Assertions;
import org.junit.jupiter.api.function.Executable;

import java.util.Objects;

public final class TileLayerAssertions {

    public static TileLayerExceptionAssert assertThrowsTileLayerException(Executable executable) {
        return new TileLayerExceptionAssert(Assertions.assertThrows(TileLayerException.class, executable));
    }

    public static TileLayerExceptionAssert assertThrowsTileLayerException(Executable executable, ErrorCode expectedErrorCode) {
        return assertThrowsTileLayerException(executable).hasErrorCode(expectedErrorCode);
    }

    public static final class TileLayerExceptionAssert extends AbstractThrowableAssert<TileLayerExceptionAssert, TileLayerException> {
        TileLayerExceptionAssert(TileLayerException actual) {
            super(actual, TileLayerExceptionAssert.class);
        }

        public TileLayerExceptionAssert hasErrorCode(ErrorCode expected) {
            isNotNull();
            if (actual.getErrorCode() != expected) {
                failWithMessage("Invalid Error Code. Expected: %s<%s> but was: %s<%s>",
                        expected.name(), expected.getErrorCode(),
                        actual.getErrorCode().name(), actual.getErrorCode().getErrorCode());
            }
            return this;
        }

        public TileLayerExceptionAssert hasLogInfo(Object key, Object value) {
            isNotNull();
            final String logKey = key.toString();
            if (!actual.getLogInfo().containsKey(logKey) || !Objects.equals(actual.getLogInfo().get(logKey), value)) {
                failWithMessage("Expected log info %s=%s but was %s", logKey, value, actual.getLogInfo());
            }
            return this;
        }
    }

    private TileLayerAssertions() {
    }
}
