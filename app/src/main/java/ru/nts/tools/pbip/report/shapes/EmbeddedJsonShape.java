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
import ru.nts.tools.pbip.report.BindingParser;

import java.util.Set;

/**
 * Строки легаси report.json, содержащие JSON. Разобранный вложенный документ
 * обходится тем же реестром; неразобранный попадает в отчет как NOT_ANALYZABLE.
 */
final class EmbeddedJsonShape implements ReferenceShape {

    @Override
    public ShapeKind kind() {
        return ShapeKind.EMBEDDED_JSON;
    }

    @Override
    public Set<String> keys() {
        return BindingParser.EMBEDDED_KEYS;
    }

    @Override
    public void collect(BindingNode owner, String key, BindingNode value, ShapeScan scan) {
        if (!value.isString()) {
            return;
        }
        if (value.embedded() != null) {
            scan.walkEmbedded(value.embedded());
            return;
        }
        for (BindingDocument.EmbeddedFailure failure : value.token().owner().embeddedFailures()) {
            if (failure.token() == value.token()) {
                scan.notAnalyzable(value, value.stringValue(), "Embedded JSON is malformed: " + failure.detail());
            }
        }
    }
}
