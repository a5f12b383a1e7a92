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
 * The layer relation: resolving a layer's key and value types, deriving its schema, pushing filters down to the
 * store, and projecting scanned tiles into rows.
 *
 * <p>
 * Entry points are {@link com.apple.foundationdb.tiles.relation.LayerRelation#open LayerRelation.open},
 * {@link com.apple.foundationdb.tiles.relation.LayerRelationFactory} for string parameters, and
 * {@link com.apple.foundationdb.tiles.relation.LayerCatalog} to find out which layers a store holds.
 * </p>
 */
package com.apple.foundationdb.tiles.relation;
