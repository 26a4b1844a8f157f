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

import java.util.Locale;
import java.util.Set;
import java.util.regex.Pattern;

/**
 * Правила записи имен объектов в TMDL.
 *
 * <p>Имя записывается без кавычек, только если это простой идентификатор и не
 * ключевое слово. Иначе оно заключается в одинарные кавычки, а внутренние
 * кавычки удваиваются: {@code Bob's Sales -> 'Bob''s Sales'}.
 */
public final class TmdlNames {

    private static final Pattern BARE_NAME = Pattern.compile("[\\p{L}_][\\p{L}\\p{N}_]*");

    private static final Set<String> RESERVED = Set.of(
            "model", "table", "column", "measure", "relationship", "hierarchy", "level",
            "partition", "ref", "expression", "annotation", "role", "perspective", "culture",
            "calculationgroup", "calculationitem", "datasource", "true", "false");

    private TmdlNames() {
    }

    public static boolean needsQuoting(String name) {
        if (name == null || name.isEmpty()) {
            return true;
        }
        return !BARE_NAME.matcher(name).matches() || RESERVED.contains(name.toLowerCase(Locale.ROOT));
    }

    public static String quote(String name) {
        return "'" + name.replace("'", "''") + "'";
    }

    /**
     * Форматирует имя для записи. {@code forceQuote} сохраняет кавычки там, где они уже были.
     */
    public static String format(String name, boolean forceQuote) {
        return forceQuote || needsQuoting(name) ? quote(name) : name;
    }

    public static String unquote(String token) {
        String trimmed = token.trim();
        if (trimmed.length() >= 2 && trimmed.startsWith("'") && trimmed.endsWith("'")) {
            return trimmed.substring(1, trimmed.length() - 1).replace("''", "'");
        }
        return trimmed;
    }
}
