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

import java.util.ArrayList;
import java.util.List;

/**
 * Лексер DAX, достаточный для поиска ссылок на идентификаторы.
 * Строки ({@code ""} внутри), комментарии ({@code //}, {@code --}, {@code /* *}{@code /}),
 * имена таблиц в кавычках ({@code ''} внутри) и имена в скобках ({@code ]]} внутри)
 * выделяются целиком, поэтому их содержимое никогда не считается ссылкой.
 */
public final class DaxLexer {

    private DaxLexer() {
    }

    public static List<DaxToken> tokenize(String text) {
        List<DaxToken> tokens = new ArrayList<>();
        int length = text.length();
        int pos = 0;
        while (pos < length) {
            char c = text.charAt(pos);
            int start = pos;

            if (Character.isWhitespace(c)) {
                while (pos < length && Character.isWhitespace(text.charAt(pos))) pos++;
                tokens.add(new DaxToken(DaxTokenType.WHITESPACE, text.substring(start, pos), start, pos, true));
            } else if (c == '/' && next(text, pos) == '/' || c == '-' && next(text, pos) == '-') {
                while (pos < length && text.charAt(pos) != '\n' && text.charAt(pos) != '\r') pos++;
                tokens.add(new DaxToken(DaxTokenType.COMMENT, text.substring(start, pos), start, pos, true));
            } else if (c == '/' && next(text, pos) == '*') {
                int close = text.indexOf("*/", pos + 2);
                pos = close < 0 ? length : close + 2;
                tokens.add(new DaxToken(DaxTokenType.COMMENT, text.substring(start, pos), start, pos, close >= 0));
            } else if (c == '"') {
                int close = scanDoubled(text, pos, '"');
                pos = close < 0 ? length : close;
                tokens.add(new DaxToken(DaxTokenType.STRING, text.substring(start, pos), start, pos, close >= 0));
            } else if (c == '\'') {
                int close = scanDoubled(text, pos, '\'');
                pos = close < 0 ? length : close;
                tokens.add(new DaxToken(DaxTokenType.QUOTED_TABLE, text.substring(start, pos), start, pos, close >= 0));
            } else if (c == '[') {
                int close = scanDoubled(text, pos, ']');
                pos = close < 0 ? length : close;
                tokens.add(new DaxToken(DaxTokenType.BRACKETED, text.substring(start, pos), start, pos, close >= 0));
            } else if (Character.isLetter(c) || c == '_') {
                while (pos < length && isIdentifierPart(text.charAt(pos))) pos++;
                tokens.add(new DaxToken(DaxTokenType.IDENTIFIER, text.substring(start, pos), start, pos, true));
            } else if (Character.isDigit(c)) {
                while (pos < length && (Character.isLetterOrDigit(text.charAt(pos)) || text.charAt(pos) == '.')) pos++;
                tokens.add(new DaxToken(DaxTokenType.NUMBER, text.substring(start, pos), start, pos, true));
            } else {
                pos++;
                tokens.add(new DaxToken(DaxTokenType.OPERATOR, text.substring(start, pos), start, pos, true));
            }
        }
        return tokens;
    }

    public static boolean isIdentifierPart(char c) {
        return Character.isLetterOrDigit(c) || c == '_' || c == '.';
    }

    private static char next(String text, int pos) {
        return pos + 1 < text.length() ? text.charAt(pos + 1) : '\0';
    }

    /**
     * Сканирует до закрывающего символа, пропуская удвоенные. Возвращает позицию после него
     * или -1, если он не закрыт.
     */
    private static int scanDoubled(String text, int pos, char close) {
        int j = pos + 1;
        while (j < text.length()) {
            if (text.charAt(j) == close) {
                if (j + 1 < text.length() && text.charAt(j + 1) == close) {
                    j += 2;
                    continue;
                }
                return j + 1;
            }
            j++;
        }
        return -1;
    }
}
