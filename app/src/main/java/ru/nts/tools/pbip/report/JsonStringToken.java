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
package ru.nts.tools.pbip.report;

/**
 * JSON-строка (значение или ключ) в исходном тексте документа.
 * Равенство по идентичности: токен служит ключом набора правок.
 */
public final class JsonStringToken {

    private final int start;
    private final int end;
    private final String value;
    private final int line;
    private final int column;
    private final String path;
    private final boolean key;
    private BindingDocument owner;

    JsonStringToken(int start, int end, String value, int line, int column, String path, boolean key) {
        this.start = start;
        this.end = end;
        this.value = value;
        this.line = line;
        this.column = column;
        this.path = path;
        this.key = key;
    }

    void setOwner(BindingDocument owner) {
        this.owner = owner;
    }

    /** Начало токена (открывающая кавычка) в тексте документа-владельца. */
    public int start() {
        return start;
    }

    /** Позиция после закрывающей кавычки. */
    public int end() {
        return end;
    }

    /** Декодированное значение строки. */
    public String value() {
        return value;
    }

    public int line() {
        return line;
    }

    public int column() {
        return column;
    }

    public String path() {
        return path;
    }

    public boolean isKey() {
        return key;
    }

    public BindingDocument owner() {
        return owner;
    }

    @Override
    public String toString() {
        return path + (key ? " (key)" : "") + " = \"" + value + "\"";
    }
}
