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

import ru.nts.tools.pbip.report.JsonStringToken;

/**
 * Ссылка на модель, найденная в JSON отчета, до сопоставления с таблицей символов.
 *
 * <p>{@code start}/{@code end} задают фрагмент декодированного значения {@code token},
 * который содержит имя. Для {@link ShapeKind#QUERY_REF} фрагмент содержит
 * {@code Table.Member} целиком: точка разделения выбирается при сопоставлении,
 * так как имена таблиц могут содержать точки.
 *
 * @param shape     Вид места.
 * @param token     Строка, содержащая ссылку.
 * @param start     Начало фрагмента в декодированном значении.
 * @param end       Конец фрагмента.
 * @param table     Имя таблицы ({@code null} для QUERY_REF и NATIVE_QUERY_REF).
 * @param member    Имя колонки или меры ({@code null}, если ссылка на таблицу).
 * @param hint      Ожидаемый вид члена таблицы.
 * @param companion Связанная ссылка QUERY_REF для NATIVE_QUERY_REF.
 */
public record BindingReference(ShapeKind shape, JsonStringToken token, int start, int end, String table,
                               String member, MemberHint hint, BindingReference companion) {

    public enum MemberHint {
        COLUMN, MEASURE, ANY
    }

    public static BindingReference table(ShapeKind shape, JsonStringToken token, String table) {
        return new BindingReference(shape, token, 0, token.value().length(), table, null, MemberHint.ANY, null);
    }

    public static BindingReference member(ShapeKind shape, JsonStringToken token, String table, MemberHint hint) {
        return new BindingReference(shape, token, 0, token.value().length(), table, token.value(), hint, null);
    }

    public boolean isTableReference() {
        return member == null && shape != ShapeKind.QUERY_REF && shape != ShapeKind.NATIVE_QUERY_REF;
    }

    public String text() {
        return token.value().substring(start, end);
    }
}
