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
package ru.nts.tools.pbip.rename;

import java.nio.file.Path;
import java.util.List;

/**
 * Причина, по которой пакет переименований не может быть применен.
 *
 * @param type        Вид конфликта.
 * @param message     Описание.
 * @param files       Затронутые файлы.
 * @param identifiers Затронутые идентификаторы.
 */
public record Conflict(Type type, String message, List<Path> files, List<String> identifiers) {

    public enum Type {
        INVALID_REQUEST,
        IDENTIFIER_NOT_FOUND,
        AMBIGUOUS_IDENTIFIER,
        NAME_COLLISION,
        UNRESOLVED_REFERENCE,
        AMBIGUOUS_REFERENCE
    }

    public Conflict {
        files = List.copyOf(files);
        identifiers = List.copyOf(identifiers);
    }

    public static Conflict of(Type type, String message, String... identifiers) {
        return new Conflict(type, message, List.of(), List.of(identifiers));
    }

    @Override
    public String toString() {
        return type + ": " + message;
    }
}
