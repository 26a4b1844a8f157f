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

/**
 * Выражение (DAX, M или произвольный текст) после знака {@code =}.
 *
 * @param text   Исходный текст выражения, как он записан в файле.
 * @param span   Положение текста в файле.
 * @param fenced Выражение записано в блоке {@code ```}.
 */
public record TmdlExpression(String text, SourceSpan span, boolean fenced) {

    public boolean isBlank() {
        return text.isBlank();
    }
}
