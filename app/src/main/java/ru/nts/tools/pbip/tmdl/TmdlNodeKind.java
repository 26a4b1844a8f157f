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

import java.util.HashMap;
import java.util.Map;

/**
 * Виды объектов TMDL, которые различает парсер.
 * Все прочие ключевые слова разбираются как {@link #OBJECT}.
 */
public enum TmdlNodeKind {
    MODEL("model"),
    TABLE("table"),
    COLUMN("column"),
    MEASURE("measure"),
    RELATIONSHIP("relationship"),
    HIERARCHY("hierarchy"),
    LEVEL("level"),
    PARTITION("partition"),
    REF("ref"),
    CALCULATION_GROUP("calculationGroup"),
    CALCULATION_ITEM("calculationItem"),
    PERSPECTIVE("perspective"),
    PERSPECTIVE_TABLE("perspectiveTable"),
    PERSPECTIVE_COLUMN("perspectiveColumn"),
    PERSPECTIVE_MEASURE("perspectiveMeasure"),
    PERSPECTIVE_HIERARCHY("perspectiveHierarchy"),
    ROLE("role"),
    TABLE_PERMISSION("tablePermission"),
    COLUMN_PERMISSION("columnPermission"),
    ANNOTATION("annotation"),
    EXPRESSION("expression"),
    CULTURE("culture"),
    OBJECT(null);

    private static final Map<String, TmdlNodeKind> BY_KEYWORD;

    static {
        HashMap<String, TmdlNodeKind> map = new HashMap<>();
        for (TmdlNodeKind kind : values()) {
            if (kind.keyword != null) {
                map.put(kind.keyword, kind);
            }
        }
        for (String generic : new String[]{"database", "dataSource", "queryGroup", "variation", "extendedProperty",
                "member", "function", "calendar", "cultureInfo", "linguisticMetadata", "createOrReplace"}) {
            map.put(generic, OBJECT);
        }
        BY_KEYWORD = Map.copyOf(map);
    }

    private final String keyword;

    TmdlNodeKind(String keyword) {
        this.keyword = keyword;
    }

    /**
     * Возвращает вид объекта по ключевому слову или {@code null}, если слово не объявляет объект.
     */
    public static TmdlNodeKind fromKeyword(String word) {
        return BY_KEYWORD.get(word);
    }
}
