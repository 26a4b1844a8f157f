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
package ru.nts.tools.pbip.graph;

import ru.nts.tools.pbip.core.SourceSpan;
import ru.nts.tools.pbip.core.TextEdit;
import ru.nts.tools.pbip.dax.DaxQuoting;
import ru.nts.tools.pbip.report.JsonStringToken;
import ru.nts.tools.pbip.tmdl.TmdlNames;

import java.nio.file.Path;

/**
 * Одно место в файле, ссылающееся ровно на один идентификатор.
 *
 * <p>Для TMDL {@code span} задан в смещениях файла. Для JSON отчета {@code span} задан
 * в координатах декодированного значения строки {@code hostToken}.
 *
 * @param file      Файл.
 * @param span      Положение токена имени.
 * @param target    Идентификатор, на который указывает ссылка.
 * @param form      Синтаксическая форма.
 * @param encoding  Правило записи нового имени.
 * @param hostToken JSON-строка, содержащая ссылку ({@code null} для TMDL).
 * @param spelled   Текст в исходном написании (с кавычками или скобками).
 */
public record ReferenceOccurrence(Path file, SourceSpan span, IdentifierKey target, SyntacticForm form,
                                  NameEncoding encoding, JsonStringToken hostToken, String spelled) {

    public boolean isDeclaration() {
        return form == SyntacticForm.DECLARATION;
    }

    public boolean isQuoted() {
        return form == SyntacticForm.QUOTED_REFERENCE || spelled.startsWith("'");
    }

    /**
     * Правка, заменяющая это место новым именем. Единственная точка подстановки:
     * ею пользуются и фазы переименования, и перезапись отдельного выражения.
     */
    public TextEdit renameTo(String newName) {
        return TextEdit.replace(span, render(newName));
    }

    /**
     * Записывает новое имя так, как его требует синтаксис этого места.
     * Кавычки сохраняются, если они были, и добавляются, если без них новое имя невалидно.
     */
    public String render(String newName) {
        return switch (encoding) {
            case TMDL_NAME -> TmdlNames.format(newName, isQuoted());
            case DAX_TABLE -> DaxQuoting.formatTable(newName, form == SyntacticForm.QUOTED_REFERENCE);
            case DAX_MEMBER -> DaxQuoting.formatMember(newName);
            case JSON_SEGMENT -> newName;
        };
    }
}
