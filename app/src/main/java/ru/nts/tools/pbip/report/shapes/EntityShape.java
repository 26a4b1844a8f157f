/*
 * Copyright 2025 Aristo
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
package ru.nts.tools.pbip.report.shapes;

import ru.nts.tools.pbip.report.BindingNode;

import java.util.Set;

/**
 * {@code "Entity": "Sales"} в SourceRef, From и прочих местах.
 */
final class EntityShape implements ReferenceShape {

    @Override
    public ShapeKind kind() {
        return ShapeKind.ENTITY;
    }

    @Override
    public Set<String> keys() {
        return Set.of("Entity");
    }

    @Override
    public void collect(BindingNode owner, String key, BindingNode value, ShapeScan scan) {
        if (value.isString()) {
            scan.add(BindingReference.table(ShapeKind.ENTITY, value.token(), value.stringValue()));
        } else {
            scan.notAnalyzable(value, key, "Entity is not a string");
        }
    }
}
