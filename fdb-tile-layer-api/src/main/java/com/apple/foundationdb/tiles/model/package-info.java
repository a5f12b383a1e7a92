/*
 * package-info.java
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

/**
 * The tile layer data model: layer ids and headers, spatial and space-time keys, extents, tiles and layout metadata.
 *
 * <p>
 * A layer is a set of tiles on a regular grid. The grid is described by {@link com.apple.foundationdb.tiles.model.TileLayerMetadata},
 * whose {@link com.apple.foundationdb.tiles.model.MapKeyTransform} maps a key's column and row to the extent the tile covers.
 * Row 0 is the top row of the layout.
 * </p>
 */
package com.apple.foundationdb.tiles.model;
