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
 * Как записать новое имя в месте ссылки.
 */
public enum NameEncoding {
    /** Имя TMDL, кавычки по правилам TMDL. */
    TMDL_NAME,
    /** Имя таблицы в DAX: {@code Sales} или {@code 'Fact Sales'}. */
    DAX_TABLE,
    /** Имя колонки или меры в DAX: {@code [Amount]}. */
    DAX_MEMBER,
    /** Фрагмент декодированной JSON-строки, записывается как есть. */
    JSON_SEGMENT
}
