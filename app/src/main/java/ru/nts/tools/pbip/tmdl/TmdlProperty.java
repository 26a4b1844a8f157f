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

import ru.nts.tools.pbip.core.SourceSpan;

import java.util.List;

/**
 * Свойство объекта: {@code key: value}, {@code key = expression} или флаг {@code key}.
 *
 * @param key        Имя свойства.
 * @param value      Значение после двоеточия (пусто для флагов и выражений).
 * @param valueSpan  Положение значения.
 * @param references Разобранные имена для свойств-ссылок (fromColumn, sortByColumn...).
 * @param expression Выражение для формы {@code key = ...}, иначе {@code null}.
 * @param line       Номер строки.
 */
public record TmdlProperty(String key, String value, SourceSpan valueSpan, List<TmdlNameToken> references,
                           TmdlExpression expression, int line) {

    public TmdlProperty {
        references = List.copyOf(references);
    }

    public boolean isExpression() {
        return expression != null;
    }
}
