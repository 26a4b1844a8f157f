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

import java.nio.file.Path;

/**
 * Замечание линтера TMDL.
 *
 * @param file    Файл.
 * @param line    Строка.
 * @param type    Вид замечания.
 * @param message Описание.
 * @param context Фрагмент исходного текста.
 */
public record TmdlDiagnostic(Path file, int line, Type type, String message, String context) {

    public enum Type {
        /** Имя объекта с пробелами или кавычкой записано без кавычек. */
        UNQUOTED_NAME,
        /** Имя в свойстве-ссылке (fromColumn, sortByColumn...) записано без нужных кавычек. */
        UNQUOTED_REFERENCE,
        /** Таблица с пробелами в имени упомянута в DAX без кавычек. */
        UNQUOTED_TABLE_IN_DAX
    }

    @Override
    public String toString() {
        return file.getFileName() + ":" + line + " [" + type + "] " + message + " | " + context;
    }
}
