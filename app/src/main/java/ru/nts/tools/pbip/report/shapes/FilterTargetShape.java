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
import ru.nts.tools.pbip.report.shapes.BindingReference.MemberHint;

import java.util.Optional;
import java.util.Set;

/**
 * Цель фильтра: {@code "target": {"table": "Sales", "column": "Region"}}.
 */
final class FilterTargetShape implements ReferenceShape {

    @Override
    public ShapeKind kind() {
        return ShapeKind.FILTER_TARGET;
    }

    @Override
    public Set<String> keys() {
        return Set.of("target");
    }

    @Override
    public void collect(BindingNode owner, String key, BindingNode value, ShapeScan scan) {
        if (!value.isObject()) {
            return;
        }
        Optional<BindingNode> table = value.stringMember("table");
        Optional<BindingNode> column = value.stringMember("column");
        Optional<BindingNode> measure = value.stringMember("measure");
        if (table.isEmpty()) {
            if (column.isPresent() || measure.isPresent()) {
                scan.notAnalyzable(value, column.or(() -> measure).get().stringValue(), "Filter target without table");
            }
            return;
        }
        String tableName = table.get().stringValue();
        scan.add(BindingReference.table(ShapeKind.FILTER_TARGET, table.get().token(), tableName));
        column.ifPresent(c -> scan.add(BindingReference.member(ShapeKind.FILTER_TARGET, c.token(), tableName, MemberHint.COLUMN)));
        measure.ifPresent(m -> scan.add(BindingReference.member(ShapeKind.FILTER_TARGET, m.token(), tableName, MemberHint.MEASURE)));
    }
}
