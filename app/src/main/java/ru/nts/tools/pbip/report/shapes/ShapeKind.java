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
package ru.nts.tools.pbip.report.shapes;

/**
 * Виды мест в JSON отчета, где хранятся ссылки на модель.
 */
public enum ShapeKind {
    /** {@code "Entity": "Sales"}. */
    ENTITY,
    /** {@code {"Column"|"Measure": {"Expression": {"SourceRef": ...}, "Property": "Amount"}}}. */
    PROPERTY_EXPRESSION,
    /** {@code "queryRef": "Sum(Sales.Amount)"}, {@code Select[].Name}, ключи {@code columnProperties}. */
    QUERY_REF,
    /** Отображаемое имя поля ({@code nativeQueryRef}, {@code NativeReferenceName}). */
    NATIVE_QUERY_REF,
    /** {@code "target": {"table": "Sales", "column": "Region"}}. */
    FILTER_TARGET,
    /** Строка, содержащая JSON ({@code config}, {@code filters}, {@code query}, {@code dataTransforms}). */
    EMBEDDED_JSON
}
