/*
 * KeyValueLogMessageTest.java
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

package com.apple.foundationdb.tiles.logging;

import com.apple.foundationdb.tiles.api.exceptions.ErrorCode;
import com.apple.foundationdb.tiles.api.exceptions.TileLayerException;
import com.apple.foundationdb.tiles.util.LogMessageKeys;
import org.assertj.core.api.Assertions;
import org.junit.jupiter.api.Test;

class KeyValueLogMessageTest {

    @Test
    void keysAreSorted() {
        String message = KeyValueLogMessage.of("building layer scan",
                LogMessageKeys.LAYER_ZOOM, 3,
                LogMessageKeys.LAYER_NAME, "L1");
        Assertions.assertThat(message).isEqualTo("building layer scan layer_name=\"L1\" layer_zoom=\"3\"");
    }

    @Test
    void sanitized() {
        String message = KeyValueLogMessage.of("title", "a=b", "say \"hi\"", "n", null);
        Assertions.assertThat(message).isEqualTo("title ab=\"say 'hi'\" n=\"null\"");
    }

    @Test
    void unbalanced() {
        Assertions.assertThatThrownBy(() -> KeyValueLogMessage.of("title", "key"))
                .isInstanceOf(IllegalArgumentException.class);
        Assertions.assertThatThrownBy(() -> KeyValueLogMessage.of("title", null, "value"))
                .isInstanceOf(IllegalArgumentException.class);
    }

    @Test
    void exceptionLogInfo() {
        TileLayerException e = new TileLayerException("boom", ErrorCode.INTERNAL_ERROR, LogMessageKeys.STORE_NAME, "s1");
        KeyValueLogMessage message = KeyValueLogMessage.build("failed", LogMessageKeys.LAYER_NAME, "L1")
                .addLogInfo(e)
                .addKeyAndValue(LogMessageKeys.LAYER_ZOOM, 0);
        Assertions.assertThat(message.getStaticMessage()).isEqualTo("failed");
        Assertions.assertThat(message.getKeyValueMap()).containsOnlyKeys("layer_name", "layer_zoom", "store_name");
        Assertions.assertThat(message.toString()).startsWith("failed layer_name=\"L1\"");
    }
}
