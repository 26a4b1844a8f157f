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

import java.nio.file.Path;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

/**
 * Место, цель которого не удалось однозначно определить. Такие места никогда
 * не отбрасываются молча: они попадают в отчет о влиянии.
 *
 * @param kind          Вид проблемы.
 * @param file          Файл.
 * @param line          Строка (с единицы).
 * @param location      JSON-путь для отчета или описание места в модели.
 * @param spelledTable  Имя таблицы как написано ({@code null}, если не указано).
 * @param spelledMember Имя колонки или меры как написано ({@code null}, если не указано).
 * @param detail        Пояснение.
 * @param candidates    Кандидаты для неоднозначной ссылки.
 */
public record ResolutionIssue(IssueKind kind, Path file, int line, String location, String spelledTable,
                              String spelledMember, String detail, List<IdentifierKey> candidates) {

    public enum IssueKind {
        UNRESOLVED,
        AMBIGUOUS,
        NOT_ANALYZABLE,
        DUPLICATE_DECLARATION
    }

    public ResolutionIssue {
        candidates = List.copyOf(candidates);
    }

    public static ResolutionIssue unresolved(Path file, int line, String location, String table, String member, String detail) {
        return new ResolutionIssue(IssueKind.UNRESOLVED, file, line, location, table, member, detail, List.of());
    }

    public static ResolutionIssue ambiguous(Path file, int line, String location, String table, String member,
                                            List<IdentifierKey> candidates) {
        return new ResolutionIssue(IssueKind.AMBIGUOUS, file, line, location, table, member,
                "Bare reference matches " + candidates.size() + " identifiers", candidates);
    }

    public static ResolutionIssue notAnalyzable(Path file, int line, String location, String text, String detail) {
        return new ResolutionIssue(IssueKind.NOT_ANALYZABLE, file, line, location, null, text, detail, List.of());
    }

    /**
     * Неразрешенная или неоднозначная ссылка: такие места запрещают переименование.
     */
    public boolean isBlocking() {
        return kind == IssueKind.UNRESOLVED || kind == IssueKind.AMBIGUOUS;
    }

    /**
     * Блокирующие проблемы из {@code after}, которых не было в {@code before}.
     * Места сопоставляются по виду, файлу и строке (с учетом количества): новые имена не содержат
     * переводов строк, поэтому строки не сдвигаются, а описание места может содержать старое имя.
     */
    public static List<ResolutionIssue> introduced(List<ResolutionIssue> before, List<ResolutionIssue> after) {
        Map<String, Integer> known = new HashMap<>();
        for (ResolutionIssue issue : before) {
            if (issue.isBlocking()) {
                known.merge(issue.site(), 1, Integer::sum);
            }
        }
        List<ResolutionIssue> result = new ArrayList<>();
        for (ResolutionIssue issue : after) {
            if (!issue.isBlocking()) {
                continue;
            }
            Integer left = known.get(issue.site());
            if (left != null && left > 0) {
                known.put(issue.site(), left - 1);
            } else {
                result.add(issue);
            }
        }
        return result;
    }

    private String site() {
        return kind + "|" + file + "|" + line;
    }

    /**
     * Ссылка в исходном написании.
     */
    public String spelled() {
        if (spelledTable != null && spelledMember != null) {
            return spelledTable + "[" + spelledMember + "]";
        }
        return spelledTable != null ? spelledTable : String.valueOf(spelledMember);
    }

    @Override
    public String toString() {
        return kind + " " + spelled() + " at " + (file != null ? file.getFileName() : "<expression>") + ":" + line
                + (location != null ? " (" + location + ")" : "") + ": " + detail;
    }
}
