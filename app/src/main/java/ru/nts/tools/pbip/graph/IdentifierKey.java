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

import java.util.Locale;

/**
 * Ключ идентификатора модели без учета регистра.
 * Колонки и меры квалифицируются таблицей-владельцем; у таблиц {@code table == null}.
 * Оба поля хранятся в свернутом регистре ({@link Locale#ROOT}).
 */
public record IdentifierKey(IdentifierKind kind, String table, String name) {

    public static IdentifierKey table(String name) {
        return new IdentifierKey(IdentifierKind.TABLE, null, fold(name));
    }

    public static IdentifierKey column(String table, String name) {
        return new IdentifierKey(IdentifierKind.COLUMN, fold(table), fold(name));
    }

    public static IdentifierKey measure(String table, String name) {
        return new IdentifierKey(IdentifierKind.MEASURE, fold(table), fold(name));
    }

    public static IdentifierKey of(IdentifierKind kind, String table, String name) {
        return switch (kind) {
            case TABLE -> table(name);
            case COLUMN -> column(table, name);
            case MEASURE -> measure(table, name);
        };
    }

    public static String fold(String name) {
        return name.toLowerCase(Locale.ROOT);
    }

    /**
     * Ключ таблицы-владельца (для таблицы возвращает себя).
     */
    public IdentifierKey tableKey() {
        return kind == IdentifierKind.TABLE ? this : new IdentifierKey(IdentifierKind.TABLE, null, table);
    }

    @Override
    public String toString() {
        return kind == IdentifierKind.TABLE ? kind + ":" + name : kind + ":" + table + "[" + name + "]";
    }
}
