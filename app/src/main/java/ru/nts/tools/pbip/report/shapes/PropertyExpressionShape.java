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
 * Поле запроса: {@code {"Column": {"Expression": {"SourceRef": {"Entity": "Sales"}}, "Property": "Amount"}}}.
 * Псевдоним {@code "SourceRef": {"Source": "s"}} разрешается через ближайший список {@code From}.
 */
final class PropertyExpressionShape implements ReferenceShape {

    @Override
    public ShapeKind kind() {
        return ShapeKind.PROPERTY_EXPRESSION;
    }

    @Override
    public Set<String> keys() {
        return Set.of("Column", "Measure", "PropertyVariationSource");
    }

    @Override
    public void collect(BindingNode owner, String key, BindingNode value, ShapeScan scan) {
        if (!value.isObject()) {
            return;
        }
        Optional<BindingNode> property = value.stringMember("Property");
        Optional<BindingNode> expression = value.member("Expression").filter(BindingNode::isObject);
        if (property.isEmpty() || expression.isEmpty()) {
            scan.notAnalyzable(value, key, key + " without Property or Expression");
            return;
        }
        String propertyName = property.get().stringValue();
        Optional<BindingNode> sourceRef = expression.get().member("SourceRef").filter(BindingNode::isObject);
        if (sourceRef.isEmpty()) {
            scan.notAnalyzable(property.get(), propertyName, "Field source is not a table reference");
            return;
        }
        String table = entityOf(sourceRef.get());
        if (table == null) {
            scan.notAnalyzable(property.get(), propertyName, "SourceRef alias is not declared in From");
            return;
        }
        MemberHint hint = key.equals("Measure") ? MemberHint.MEASURE : MemberHint.COLUMN;
        scan.add(BindingReference.member(ShapeKind.PROPERTY_EXPRESSION, property.get().token(), table, hint));
    }

    private static String entityOf(BindingNode sourceRef) {
        Optional<BindingNode> entity = sourceRef.stringMember("Entity");
        if (entity.isPresent()) {
            return entity.get().stringValue();
        }
        Optional<BindingNode> source = sourceRef.stringMember("Source");
        return source.map(s -> resolveAlias(sourceRef, s.stringValue())).orElse(null);
    }

    private static String resolveAlias(BindingNode from, String alias) {
        BindingNode current = from.parent();
        while (current != null) {
            if (current.isObject()) {
                Optional<BindingNode> list = current.member("From");
                if (list.isPresent() && list.get().kind() == BindingNode.Kind.ARRAY) {
                    for (BindingNode item : list.get().elements()) {
                        Optional<BindingNode> name = item.stringMember("Name");
                        Optional<BindingNode> entity = item.stringMember("Entity");
                        if (name.isPresent() && entity.isPresent() && name.get().stringValue().equals(alias)) {
                            return entity.get().stringValue();
                        }
                    }
                }
            }
            current = current.parent();
        }
        return null;
    }
}
