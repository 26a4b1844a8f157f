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

/**
 * Выражение DAX в TMDL вместе с контекстом: объект-владелец и таблица,
 * относительно которой разрешаются голые ссылки {@code [Name]}.
 *
 * @param owner       Узел, которому принадлежит выражение.
 * @param expression  Выражение.
 * @param owningTable Имя таблицы-владельца ({@code null}, если выражение вне таблицы).
 * @param location    Описание места для сообщений, например {@code measure 'Total Sales'}.
 */
public record DaxExpressionSite(TmdlNode owner, TmdlExpression expression, String owningTable, String location) {
}
