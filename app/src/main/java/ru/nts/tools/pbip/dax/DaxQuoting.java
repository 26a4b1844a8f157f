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
package ru.nts.tools.pbip.dax;

import ru.nts.tools.pbip.core.TextEdit;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Locale;
import java.util.Set;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Правила записи имен в DAX и исправление таблиц, записанных без кавычек.
 */
public final class DaxQuoting {

    private static final Pattern BARE_TABLE = Pattern.compile("[A-Za-z_][A-Za-z0-9_]*");

    private static final Set<String> KEYWORDS = Set.of(
            "var", "return", "in", "not", "and", "or", "true", "false", "define", "evaluate",
            "measure", "column", "table", "order", "by", "asc", "desc", "start", "at", "datatable");

    /**
     * Найденная ссылка на таблицу без кавычек, которой кавычки нужны.
     *
     * @param start     Начало имени в выражении.
     * @param end       Конец имени.
     * @param tableName Имя таблицы, как оно объявлено в модели.
     */
    public record UnquotedTable(int start, int end, String tableName) {
    }

    private DaxQuoting() {
    }

    public static boolean needsQuoting(String tableName) {
        return !BARE_TABLE.matcher(tableName).matches() || KEYWORDS.contains(tableName.toLowerCase(Locale.ROOT));
    }

    public static String quoteTable(String tableName) {
        return "'" + tableName.replace("'", "''") + "'";
    }

    /**
     * Записывает имя таблицы. {@code forceQuote} сохраняет кавычки там, где они были.
     */
    public static String formatTable(String tableName, boolean forceQuote) {
        return forceQuote || needsQuoting(tableName) ? quoteTable(tableName) : tableName;
    }

    public static String formatMember(String memberName) {
        return "[" + memberName.replace("]", "]]") + "]";
    }

    /**
     * Ищет ссылки вида {@code Leads Sales Data[Amount]}: имя известной таблицы, которому нужны
     * кавычки, записанное без них перед {@code [}. Строки, комментарии и уже взятые
     * в кавычки имена пропускаются.
     */
    public static List<UnquotedTable> findUnquotedTables(String expression, List<String> tableNames) {
        boolean[] shielded = new boolean[expression.length()];
        for (DaxToken token : DaxLexer.tokenize(expression)) {
            if (token.type() == DaxTokenType.STRING || token.type() == DaxTokenType.COMMENT
                    || token.type() == DaxTokenType.QUOTED_TABLE || token.type() == DaxTokenType.BRACKETED) {
                for (int i = token.start(); i < token.end(); i++) {
                    shielded[i] = true;
                }
            }
        }

        List<String> candidates = new ArrayList<>();
        for (String name : tableNames) {
            if (needsQuoting(name)) {
                candidates.add(name);
            }
        }
        // Длинные имена первыми: 'Sales Data Archive' не должен стать 'Sales Data' + Archive
        candidates.sort(Comparator.comparingInt(String::length).reversed());

        List<UnquotedTable> found = new ArrayList<>();
        boolean[] taken = new boolean[expression.length()];
        for (String name : candidates) {
            Pattern pattern = Pattern.compile("(?<![\\p{L}\\p{N}_.'])" + Pattern.quote(name) + "(?=\\s*\\[)",
                    Pattern.CASE_INSENSITIVE | Pattern.UNICODE_CASE);
            Matcher m = pattern.matcher(expression);
            while (m.find()) {
                if (isFree(shielded, taken, m.start(), m.end())) {
                    for (int i = m.start(); i < m.end(); i++) {
                        taken[i] = true;
                    }
                    found.add(new UnquotedTable(m.start(), m.end(), name));
                }
            }
        }
        found.sort(Comparator.comparingInt(UnquotedTable::start));
        return found;
    }

    /**
     * Берет в кавычки имена таблиц, записанные без них:
     * {@code SUM(Leads Sales Data[Amount]) -> SUM('Leads Sales Data'[Amount])}.
     * Повторное применение ничего не меняет.
     */
    public static String fixTableReferences(String expression, List<String> tableNames) {
        List<TextEdit> edits = new ArrayList<>();
        for (UnquotedTable hit : findUnquotedTables(expression, tableNames)) {
            edits.add(new TextEdit(hit.start(), hit.end(), quoteTable(expression.substring(hit.start(), hit.end()))));
        }
        return TextEdit.applyAll(expression, edits);
    }

    private static boolean isFree(boolean[] shielded, boolean[] taken, int start, int end) {
        for (int i = start; i < end; i++) {
            if (shielded[i] || taken[i]) {
                return false;
            }
        }
        return true;
    }
}
