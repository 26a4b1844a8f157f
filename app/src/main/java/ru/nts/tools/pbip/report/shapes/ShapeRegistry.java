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

import ru.nts.tools.pbip.report.BindingDocument;
import ru.nts.tools.pbip.report.BindingNode;

import java.util.HashMap;
import java.util.List;
import java.util.Map;

/**
 * Таблица диспетчеризации форм ссылок: ключ члена JSON-объекта -> обработчик.
 * Обход идет по всему дереву; встретив зарегистрированный ключ, реестр передает
 * член обработчику и продолжает спуск внутрь значения.
 */
public final class ShapeRegistry {

    private final Map<String, ReferenceShape> handlers = new HashMap<>();

    public ShapeRegistry(List<ReferenceShape> shapes) {
        for (ReferenceShape shape : shapes) {
            for (String key : shape.keys()) {
                ReferenceShape previous = handlers.putIfAbsent(key, shape);
                if (previous != null) {
                    throw new IllegalArgumentException("Key '" + key + "' is claimed by " + previous.kind() + " and " + shape.kind());
                }
            }
        }
    }

    public static ShapeRegistry defaults() {
        return new ShapeRegistry(List.of(
                new EntityShape(),
                new PropertyExpressionShape(),
                new QueryRefShape(),
                new NativeQueryRefShape(),
                new FilterTargetShape(),
                new EmbeddedJsonShape()));
    }

    public ShapeScan scan(BindingDocument document) {
        ShapeScan scan = new ShapeScan(this, document);
        walk(document.root(), scan);
        return scan;
    }

    void walk(BindingNode node, ShapeScan scan) {
        if (node.isObject()) {
            for (BindingNode.Member member : node.members()) {
                String key = member.key().value();
                ReferenceShape handler = handlers.get(key);
                if (handler != null) {
                    handler.collect(node, key, member.value(), scan);
                }
                walk(member.value(), scan);
            }
        } else if (node.kind() == BindingNode.Kind.ARRAY) {
            for (BindingNode element : node.elements()) {
                walk(element, scan);
            }
        }
    }
}
