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

import ru.nts.tools.pbip.dax.DaxQuoting;

import java.util.ArrayList;
import java.util.List;

/**
 * Проверка кавычек в TMDL: имена и ссылки с пробелами без кавычек, а также
 * таблицы с пробелами в DAX без кавычек. Ничего не исправляет.
 */
public class TmdlLinter {

    public List<TmdlDiagnostic> lint(TmdlDocument document, List<String> tableNames) {
        List<TmdlDiagnostic> result = new ArrayList<>();
        String source = document.source();

        for (TmdlNode node : document.allNodes()) {
            TmdlNameToken name = node.nameToken();
            if (name != null && name.isUnsafelyBare()) {
                result.add(new TmdlDiagnostic(document.path(), node.line(), TmdlDiagnostic.Type.UNQUOTED_NAME,
                        node.keyword() + " name must be quoted: " + TmdlNames.quote(name.value()),
                        lineText(source, name.span().start())));
            }
            for (TmdlProperty property : node.properties()) {
                for (TmdlNameToken ref : property.references()) {
                    if (ref.isUnsafelyBare()) {
                        result.add(new TmdlDiagnostic(document.path(), property.line(), TmdlDiagnostic.Type.UNQUOTED_REFERENCE,
                                property.key() + " reference must be quoted: " + TmdlNames.quote(ref.value()),
                                lineText(source, ref.span().start())));
                    }
                }
            }
        }

        for (DaxExpressionSite site : document.daxExpressions()) {
            TmdlExpression expression = site.expression();
            for (DaxQuoting.UnquotedTable hit : DaxQuoting.findUnquotedTables(expression.text(), tableNames)) {
                int offset = expression.span().start() + hit.start();
                result.add(new TmdlDiagnostic(document.path(), lineOf(source, offset), TmdlDiagnostic.Type.UNQUOTED_TABLE_IN_DAX,
                        "Table '" + hit.tableName() + "' must be quoted in " + site.location(),
                        lineText(source, offset)));
            }
        }
        return result;
    }

    private static int lineOf(String source, int offset) {
        int line = 1;
        for (int i = 0; i < offset; i++) {
            if (source.charAt(i) == '\n') {
                line++;
            }
        }
        return line;
    }

    private static String lineText(String source, int offset) {
        int start = source.lastIndexOf('\n', offset - 1) + 1;
        int end = source.indexOf('\n', offset);
        return source.substring(start, end < 0 ? source.length() : end).trim();
    }
}
