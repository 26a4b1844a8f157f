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

import ru.nts.tools.pbip.graph.ResolutionIssue;
import ru.nts.tools.pbip.report.BindingDocument;
import ru.nts.tools.pbip.report.BindingNode;
import ru.nts.tools.pbip.report.JsonStringToken;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * Результат обхода одного файла отчета: найденные ссылки и места, которые не удалось разобрать.
 */
public final class ShapeScan {

    private final ShapeRegistry registry;
    private final BindingDocument document;
    private final List<BindingReference> references = new ArrayList<>();
    private final List<ResolutionIssue> issues = new ArrayList<>();

    ShapeScan(ShapeRegistry registry, BindingDocument document) {
        this.registry = registry;
        this.document = document;
    }

    public List<BindingReference> references() {
        return Collections.unmodifiableList(references);
    }

    public List<ResolutionIssue> issues() {
        return Collections.unmodifiableList(issues);
    }

    public void add(BindingReference reference) {
        references.add(reference);
    }

    public void notAnalyzable(BindingNode node, String text, String detail) {
        JsonStringToken token = node.token();
        int line = token != null ? token.line() : node.span().line();
        issues.add(ResolutionIssue.notAnalyzable(document.file(), line, node.path(), text, detail));
    }

    /**
     * Обходит вложенный документ тем же реестром.
     */
    void walkEmbedded(BindingDocument embedded) {
        registry.walk(embedded.root(), this);
    }
}
