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

/**
 * Лексема DAX с положением в тексте выражения.
 *
 * @param terminated {@code false} для строки, кавычки или скобки, не закрытых до конца текста.
 */
public record DaxToken(DaxTokenType type, String text, int start, int end, boolean terminated) {

    /**
     * Имя без кавычек или скобок, с раскрытым экранированием.
     */
    public String name() {
        return switch (type) {
            case QUOTED_TABLE -> strip(text, '\'');
            case BRACKETED -> {
                String inner = text.substring(1, terminated ? text.length() - 1 : text.length());
                yield inner.replace("]]", "]");
            }
            default -> text;
        };
    }

    public boolean is(DaxTokenType expected, String value) {
        return type == expected && text.equalsIgnoreCase(value);
    }

    public boolean isSignificant() {
        return type != DaxTokenType.WHITESPACE && type != DaxTokenType.COMMENT;
    }

    private String strip(String raw, char quote) {
        String inner = raw.substring(1, terminated ? raw.length() - 1 : raw.length());
        String twice = String.valueOf(quote) + quote;
        return inner.replace(twice, String.valueOf(quote));
    }
}
