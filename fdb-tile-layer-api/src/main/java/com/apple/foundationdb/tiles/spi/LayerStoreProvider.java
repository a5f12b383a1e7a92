/*
 * LayerStoreProvider.java
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

package com.apple.foundationdb.tiles.spi;

import com.apple.foundationdb.annotation.API;

import javax.annotation.Nonnull;
import java.net.URI;

/**
 * Opens {@link LayerStore}s for the store locations it understands. Providers are discovered with
 * {@link java.util.ServiceLoader}.
 */
@API(API.Status.EXPERIMENTAL)
public interface LayerStoreProvider {

    /**
     * A short name for log messages.
     * @return the provider name
     */
    @Nonnull
    String getName();

    /**
     * Whether this provider handles a store location. Usually decided by the URI scheme.
     *
     * @param location the store location
     * @return {@code true} if {@link #open(URI)} accepts the location
     */
    boolean canProcess(@Nonnull URI location);

    /**
     * Open the store at a location.
     *
     * @param location the store location
     * @return the store
     */
    @Nonnull
    LayerStore open(@Nonnull URI location);
}
