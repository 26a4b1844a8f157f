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
package ru.nts.tools.pbip.tmdl;

import ru.nts.tools.pbip.core.TextEdit;

import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.Set;

/**
 * Разобранный TMDL-файл.
 * Документ неизменяем и хранит исходный текст целиком: запись без правок
 * возвращает его байт в байт, правки применяются только к своим span.
 */
public final class TmdlDocument {

    /** Свойства вида {@code key = ...}, значение которых является DAX. */
    private static final Set<String> DAX_PROPERTIES = Set.of("formatStringDefinition", "detailRowsDefinition");

    private final Path path;
    private final String source;
    private final List<TmdlNode> roots;

    TmdlDocument(Path path, String source, List<TmdlNode> roots) {
        this.path = path;
        this.source = source;
        this.roots = List.copyOf(roots);
    }

    public Path path() {
        return path;
    }

    public String source() {
        return source;
    }

    public List<TmdlNode> roots() {
        return roots;
    }

    /**
     * Все узлы документа в порядке обхода в глубину (порядок следования в файле).
     */
    public List<TmdlNode> allNodes() {
        List<TmdlNode> result = new ArrayList<>();
        roots.forEach(root -> collect(root, result));
        return result;
    }

    private static void collect(TmdlNode node, List<TmdlNode> out) {
        out.add(node);
        node.children().forEach(child -> collect(child, out));
    }

    /**
     * Все выражения DAX документа: меры, вычисляемые колонки, элементы групп вычислений,
     * фильтры ролей, источники вычисляемых таблиц и определения строк формата.
     * Выражения M (партиции импорта, общие выражения) сюда не входят.
     */
    public List<DaxExpressionSite> daxExpressions() {
        List<DaxExpressionSite> result = new ArrayList<>();
        for (TmdlNode node : allNodes()) {
            String table = owningTable(node);
            TmdlExpression expression = node.expression();
            switch (node.kind()) {
                case MEASURE, COLUMN, CALCULATION_ITEM -> {
                    if (expression != null && !expression.isBlank()) {
                        result.add(new DaxExpressionSite(node, expression, table, describe(node)));
                    }
                }
                case TABLE_PERMISSION -> {
                    if (expression != null && !expression.isBlank()) {
                        result.add(new DaxExpressionSite(node, expression, node.name(), describe(node)));
                    }
                }
                case PARTITION -> {
                    if (expression != null && "calculated".equalsIgnoreCase(expression.text().trim())) {
                        node.property("source")
                                .filter(TmdlProperty::isExpression)
                                .ifPresent(p -> result.add(new DaxExpressionSite(node, p.expression(), table, describe(node) + ".source")));
                    }
                }
                default -> {
                }
            }
            for (TmdlProperty property : node.properties()) {
                if (property.isExpression() && DAX_PROPERTIES.contains(property.key()) && !property.expression().isBlank()) {
                    result.add(new DaxExpressionSite(node, property.expression(), table, describe(node) + "." + property.key()));
                }
            }
        }
        return result;
    }

    /**
     * Имя таблицы, в которой объявлен узел (для самой таблицы ее имя).
     */
    public static String owningTable(TmdlNode node) {
        if (node.kind() == TmdlNodeKind.TABLE) {
            return node.name();
        }
        return node.ancestor(TmdlNodeKind.TABLE).map(TmdlNode::name).orElse(null);
    }

    private static String describe(TmdlNode node) {
        return node.keyword() + (node.name() != null ? " " + TmdlNames.format(node.name(), false) : "");
    }

    public String write() {
        return source;
    }

    public String write(List<TextEdit> edits) {
        return TextEdit.applyAll(source, edits);
    }
}
