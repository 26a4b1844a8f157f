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
package ru.nts.tools.pbip.core;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;

/**
 * Замена фрагмента текста [start, end) на новую строку.
 */
public record TextEdit(int start, int end, String replacement) {

    public TextEdit {
        if (start < 0 || end < start) {
            throw new IllegalArgumentException("Invalid edit range [" + start + ", " + end + ")");
        }
    }

    public static TextEdit replace(SourceSpan span, String replacement) {
        return new TextEdit(span.start(), span.end(), replacement);
    }

    /**
     * Применяет правки справа налево, чтобы смещения ранних правок оставались валидными.
     * Без правок возвращает исходную строку как есть.
     *
     * @throws IllegalArgumentException если правки перекрываются или выходят за границы текста.
     */
    public static String applyAll(String source, List<TextEdit> edits) {
        if (edits.isEmpty()) {
            return source;
        }
        List<TextEdit> sorted = new ArrayList<>(edits);
        sorted.sort(Comparator.comparingInt(TextEdit::start).thenComparingInt(TextEdit::end));

        for (int i = 1; i < sorted.size(); i++) {
            TextEdit prev = sorted.get(i - 1);
            TextEdit cur = sorted.get(i);
            if (cur.start() < prev.end()) {
                if (cur.start() == prev.start() && cur.end() == prev.end() && cur.replacement().equals(prev.replacement())) {
                    continue;
                }
                throw new IllegalArgumentException("Overlapping edits at offset " + cur.start());
            }
        }

        StringBuilder sb = new StringBuilder(source);
        TextEdit last = null;
        for (int i = sorted.size() - 1; i >= 0; i--) {
            TextEdit edit = sorted.get(i);
            if (edit.equals(last)) {
                continue;
            }
            if (edit.end() > source.length()) {
                throw new IllegalArgumentException("Edit beyond end of text: " + edit.end() + " > " + source.length());
            }
            sb.replace(edit.start(), edit.end(), edit.replacement());
            last = edit;
        }
        return sb.toString();
    }
}
