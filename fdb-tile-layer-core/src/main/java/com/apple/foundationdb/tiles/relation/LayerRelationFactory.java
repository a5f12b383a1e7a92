/*
 * LayerRelationFactory.java
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

package com.apple.foundationdb.tiles.relation;

import com.apple.foundationdb.annotation.API;
import com.apple.foundationdb.tiles.api.RelationOptions;
import com.apple.foundationdb.tiles.api.exceptions.ErrorCode;
import com.apple.foundationdb.tiles.api.exceptions.TileLayerException;
import com.apple.foundationdb.tiles.model.LayerId;
import com.apple.foundationdb.tiles.spi.LayerStore;
import com.apple.foundationdb.tiles.store.LayerStores;
import com.apple.foundationdb.tiles.util.LogMessageKeys;
import com.google.common.base.Strings;
import com.google.common.collect.ImmutableSet;

import javax.annotation.Nonnull;
import java.net.URI;
import java.net.URISyntaxException;
import java.util.Map;
import java.util.function.Function;

/**
 * Creates {@link LayerRelation}s from string parameters, as passed by a data source entry point.
 *
 * <p>
 * Required parameters are {@value #PATH} (the store location), {@value #LAYER} (the layer name) and {@value #ZOOM}
 * (the zoom level). Every other parameter must be the key of a {@link RelationOptions.Name}.
 * </p>
 */
@API(API.Status.EXPERIMENTAL)
public class LayerRelationFactory {
    public static final String PATH = "path";
    public static final String LAYER = "layer";
    public static final String ZOOM = "zoom";

    private static final ImmutableSet<String> LAYER_PARAMETERS = ImmutableSet.of(PATH, LAYER, ZOOM);

    @Nonnull
    private final Function<URI, LayerStore> storeResolver;

    public LayerRelationFactory() {
        this(LayerStores::open);
    }

    public LayerRelationFactory(@Nonnull Function<URI, LayerStore> storeResolver) {
        this.storeResolver = storeResolver;
    }

    /**
     * Create a relation. The store is opened here, so an unknown location fails now rather than at the first scan.
     *
     * @param parameters the parameters
     * @return the relation
     * @throws TileLayerException with {@link ErrorCode#INVALID_PARAMETER} if a parameter is missing, malformed or
     * unknown
     */
    @Nonnull
    public LayerRelation createRelation(@Nonnull Map<String, String> parameters) {
        final URI location = parseLocation(required(parameters, PATH));
        final LayerId layerId = LayerId.of(required(parameters, LAYER), parseZoom(required(parameters, ZOOM)));
        final RelationOptions options = parseOptions(parameters);
        return new LayerRelation(location, storeResolver.apply(location), layerId, options);
    }

    @Nonnull
    private static String required(@Nonnull Map<String, String> parameters, @Nonnull String name) {
        final String value = parameters.get(name);
        if (Strings.isNullOrEmpty(value)) {
            throw new TileLayerException("Missing parameter " + name, ErrorCode.INVALID_PARAMETER,
                    LogMessageKeys.PARAMETER_NAME, name);
        }
        return value;
    }

    @Nonnull
    private static URI parseLocation(@Nonnull String path) {
        try {
            return new URI(path);
        } catch (URISyntaxException e) {
            throw new TileLayerException("Invalid store location " + path, ErrorCode.INVALID_PARAMETER, e)
                    .addLogInfo(LogMessageKeys.PARAMETER_NAME.toString(), PATH);
        }
    }

    private static int parseZoom(@Nonnull String zoom) {
        final int value;
        try {
            value = Integer.parseInt(zoom.trim());
        } catch (NumberFormatException e) {
            throw new TileLayerException("Invalid zoom " + zoom, ErrorCode.INVALID_PARAMETER, e)
                    .addLogInfo(LogMessageKeys.PARAMETER_NAME.toString(), ZOOM);
        }
        if (value < 0) {
            throw new TileLayerException("Zoom must not be negative", ErrorCode.INVALID_PARAMETER,
                    LogMessageKeys.PARAMETER_NAME, ZOOM,
                    LogMessageKeys.LAYER_ZOOM, value);
        }
        return value;
    }

    @Nonnull
    private static RelationOptions parseOptions(@Nonnull Map<String, String> parameters) {
        final RelationOptions.Builder builder = RelationOptions.builder();
        for (Map.Entry<String, String> parameter : parameters.entrySet()) {
            if (LAYER_PARAMETERS.contains(parameter.getKey())) {
                continue;
            }
            final RelationOptions.Name name = RelationOptions.Name.forKey(parameter.getKey());
            if (name == null) {
                throw new TileLayerException("Unknown parameter " + parameter.getKey(), ErrorCode.INVALID_PARAMETER,
                        LogMessageKeys.PARAMETER_NAME, parameter.getKey());
            }
            builder.withOptionFromString(name, parameter.getValue());
        }
        return builder.build();
    }
}
