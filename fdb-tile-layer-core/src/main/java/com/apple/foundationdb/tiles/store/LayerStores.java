/*
 * LayerStores.java
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

package com.apple.foundationdb.tiles.store;

import com.apple.foundationdb.annotation.API;
import com.apple.foundationdb.tiles.api.exceptions.ErrorCode;
import com.apple.foundationdb.tiles.api.exceptions.TileLayerException;
import com.apple.foundationdb.tiles.logging.KeyValueLogMessage;
import com.apple.foundationdb.tiles.spi.LayerStore;
import com.apple.foundationdb.tiles.spi.LayerStoreProvider;
import com.apple.foundationdb.tiles.util.LogMessageKeys;
import com.google.common.base.Suppliers;
import com.google.common.collect.ImmutableList;
import com.google.common.collect.Iterables;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import javax.annotation.Nonnull;
import java.net.URI;
import java.util.List;
import java.util.ServiceConfigurationError;
import java.util.ServiceLoader;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.function.Supplier;

/**
 * Resolves store locations to {@link LayerStore}s.
 *
 * <p>
 * Providers registered with {@link #register(LayerStoreProvider)} are asked first, in registration order, then
 * the providers found with {@link ServiceLoader}. The first provider that {@linkplain LayerStoreProvider#canProcess
 * can process} a location opens it.
 * </p>
 */
@API(API.Status.EXPERIMENTAL)
public final class LayerStores {
    private static final Logger LOGGER = LoggerFactory.getLogger(LayerStores.class);

    private static final List<LayerStoreProvider> REGISTERED = new CopyOnWriteArrayList<>();
    private static final Supplier<List<LayerStoreProvider>> LOADED = Suppliers.memoize(LayerStores::loadProviders);

    private LayerStores() {
    }

    public static void register(@Nonnull LayerStoreProvider provider) {
        REGISTERED.add(provider);
    }

    public static boolean unregister(@Nonnull LayerStoreProvider provider) {
        return REGISTERED.remove(provider);
    }

    /**
     * Get every known provider, in the order they are asked.
     * @return the providers
     */
    @Nonnull
    public static List<LayerStoreProvider> getProviders() {
        return ImmutableList.copyOf(Iterables.concat(REGISTERED, LOADED.get()));
    }

    /**
     * Open the store at a location.
     *
     * @param location the store location
     * @return the store
     * @throws TileLayerException with {@link ErrorCode#UNSUPPORTED_STORE} if no provider can process the location
     */
    @Nonnull
    public static LayerStore open(@Nonnull URI location) {
        for (LayerStoreProvider provider : getProviders()) {
            if (provider.canProcess(location)) {
                if (LOGGER.isDebugEnabled()) {
                    LOGGER.debug(KeyValueLogMessage.of("opening layer store",
                            LogMessageKeys.STORE_LOCATION, location,
                            LogMessageKeys.STORE_NAME, provider.getName()));
                }
                return provider.open(location);
            }
        }
        throw new TileLayerException("No layer store provider for " + location, ErrorCode.UNSUPPORTED_STORE,
                LogMessageKeys.STORE_LOCATION, location);
    }

    @Nonnull
    private static List<LayerStoreProvider> loadProviders() {
        try {
            return ImmutableList.copyOf(ServiceLoader.load(LayerStoreProvider.class));
        } catch (ServiceConfigurationError err) {
            throw new TileLayerException("Unable to load layer store providers", ErrorCode.INTERNAL_ERROR, err);
        }
    }
}
