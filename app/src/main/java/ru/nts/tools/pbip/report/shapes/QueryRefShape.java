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
import ru.nts.tools.pbip.report.JsonStringToken;
import ru.nts.tools.pbip.report.shapes.BindingReference.MemberHint;

import java.util.Optional;
import java.util.Set;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Ссылка вида {@code Table.Member} или {@code Func(Table.Member)}:
 * {@code queryRef}, {@code Select[].Name}, {@code selector.metadata} и ключи {@code columnProperties}.
 */
final class QueryRefShape implements ReferenceShape {

    private static final Pattern AGGREGATE = Pattern.compile("^([A-Za-z][A-Za-z0-9_.]*)\\((.+)\\)$", Pattern.DOTALL);

    @Override
    public ShapeKind kind() {
        return ShapeKind.QUERY_REF;
    }

    @Override
    public Set<String> keys() {
        return Set.of("queryRef", "Name", "metadata", "columnProperties");
    }

    @Override
    public void collect(BindingNode owner, String key, BindingNode value, ShapeScan scan) {
        switch (key) {
            case "columnProperties" -> {
                if (value.isObject()) {
                    for (BindingNode.Member member : value.members()) {
                        add(member.key(), value, scan);
                    }
                }
            }
            case "Name" -> {
                if (isSelectItem(owner) && value.isString()) {
                    add(value.token(), value, scan);
                }
            }
            case "metadata" -> {
                if ("selector".equals(owner.keyInParent()) && value.isString()) {
                    add(value.token(), value, scan);
                }
            }
            default -> {
                if (value.isString()) {
                    add(value.token(), value, scan);
                }
            }
        }
    }

    private static void add(JsonStringToken token, BindingNode node, ShapeScan scan) {
        Optional<BindingReference> reference = parse(token);
        if (reference.isPresent()) {
            scan.add(reference.get());
        } else {
            scan.notAnalyzable(node, token.value(), "Query reference is not in Table.Member form");
        }
    }

    /**
     * Выделяет фрагмент {@code Table.Member}, снимая обертку агрегата.
     */
    static Optional<BindingReference> parse(JsonStringToken token) {
        String value = token.value();
        int start = 0;
        int end = value.length();
        Matcher m = AGGREGATE.matcher(value);
        if (m.matches()) {
            start = m.start(2);
            end = m.end(2);
        }
        int dot = value.indexOf('.', start);
        if (dot <= start || dot >= end - 1) {
            return Optional.empty();
        }
        return Optional.of(new BindingReference(ShapeKind.QUERY_REF, token, start, end, null, null, MemberHint.ANY, null));
    }

    private static boolean isSelectItem(BindingNode owner) {
        BindingNode parent = owner.parent();
        return parent != null && parent.kind() == BindingNode.Kind.ARRAY && "Select".equals(parent.keyInParent());
    }
}
