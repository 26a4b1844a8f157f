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

/**
 * Синтаксическая форма места, где встречается идентификатор.
 */
public enum SyntacticForm {
    /** Имя в объявлении объекта. */
    DECLARATION,
    /** Имя без кавычек и квалификации: {@code Sales}, {@code [Amount]}. */
    BARE_REFERENCE,
    /** Часть квалифицированной ссылки без кавычек: {@code Sales[Amount]}, {@code Sales.Amount}. */
    QUALIFIED_REFERENCE,
    /** Имя в кавычках: {@code 'Fact Sales'}. */
    QUOTED_REFERENCE,
    /** Поле или фрагмент строки в JSON отчета. */
    BINDING_FIELD
}
