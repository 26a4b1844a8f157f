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

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import ru.nts.tools.pbip.core.ModelParseException;
import ru.nts.tools.pbip.core.SourceSpan;

import java.nio.file.Path;
import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.List;
import java.util.Set;

/**
 * Парсер TMDL без потерь.
 *
 * <p>Вложенность определяется отступом (табуляция считается за 4 позиции, пробел за одну).
 * Каждая значимая строка это объявление объекта ({@code table Sales}), свойство
 * ({@code dataType: string}, {@code source = ...}) или флаг ({@code isHidden}).
 * Выражение после {@code =} занимает остаток строки, либо следующий блок строк с отступом
 * глубже объявления, либо блок в тройных обратных кавычках.
 *
 * <p>Парсер не исправляет ошибки: незакрытая кавычка в имени, незакрытый блок
 * {@code ```}, нераспознанная строка или текст после имени дают {@link ModelParseException}.
 */
public class TmdlParser {

    private static final Logger log = LoggerFactory.getLogger(TmdlParser.class);

    private static final String FENCE = "```";

    /** Свойства, значение которых ссылается на таблицу или колонку. */
    static final Set<String> REFERENCE_PROPERTIES = Set.of(
            "fromTable", "toTable", "fromColumn", "toColumn", "sortByColumn", "groupByColumn",
            "column", "baseTable", "baseColumn");

    /** Свойства-ссылки, допускающие форму {@code Table.Column}. */
    private static final Set<String> QUALIFIED_PROPERTIES = Set.of("fromColumn", "toColumn", "baseColumn");

    private record Line(int number, int start, int contentStart, int end, int width, boolean blank) {
    }

    private record ExpressionResult(TmdlExpression expression, int nextLine) {
    }

    private record Frame(int width, TmdlNode node) {
    }

    public TmdlDocument parse(Path file, String source) throws ModelParseException {
        return new Session(file, source).run();
    }

    /**
     * Состояние разбора одного файла.
     */
    private static final class Session {
        private final Path file;
        private final String src;
        private final List<Line> lines;

        Session(Path file, String src) {
            this.file = file;
            this.src = src;
            this.lines = splitLines(src);
        }

        TmdlDocument run() throws ModelParseException {
            List<TmdlNode> roots = new ArrayList<>();
            Deque<Frame> stack = new ArrayDeque<>();
            int i = 0;
            while (i < lines.size()) {
                Line line = lines.get(i);
                if (line.blank() || isComment(line)) {
                    i++;
                    continue;
                }
                while (!stack.isEmpty() && stack.peek().width() >= line.width()) {
                    stack.pop();
                }
                TmdlNode parent = stack.isEmpty() ? null : stack.peek().node();
                i = parseLine(i, line, parent, roots, stack);
            }
            log.debug("Parsed {}: {} lines, {} top-level objects", file, lines.size(), roots.size());
            return new TmdlDocument(file, src, roots);
        }

        private int parseLine(int index, Line line, TmdlNode parent, List<TmdlNode> roots,
                              Deque<Frame> stack) throws ModelParseException {
            int pos = line.contentStart();
            int wordEnd = readWord(pos, line.end());
            if (wordEnd == pos) {
                throw error(line, pos, "Unrecognized line");
            }
            String word = src.substring(pos, wordEnd);
            int next = skipSpaces(wordEnd, line.end());
            char c = next < line.end() ? src.charAt(next) : '\n';

            if (c == ':') {
                requireParent(parent, line, pos, word);
                int valueStart = skipSpaces(next + 1, line.end());
                int valueEnd = trimEnd(valueStart, line.end());
                SourceSpan valueSpan = span(valueStart, valueEnd, line);
                List<TmdlNameToken> refs = REFERENCE_PROPERTIES.contains(word)
                        ? parseReferences(word, valueStart, valueEnd, line)
                        : List.of();
                parent.addProperty(new TmdlProperty(word, src.substring(valueStart, valueEnd), valueSpan, refs, null, line.number()));
                return index + 1;
            }
            if (c == '=') {
                requireParent(parent, line, pos, word);
                ExpressionResult expr = parseExpression(index, next + 1);
                parent.addProperty(new TmdlProperty(word, "", span(next, next, line), List.of(), expr.expression(), line.number()));
                return expr.nextLine();
            }

            TmdlNodeKind kind = TmdlNodeKind.fromKeyword(word);
            if (kind != null) {
                return parseObject(index, line, kind, word, next, parent, roots, stack);
            }
            if (c == '\n') {
                // Флаг или безымянный объект (alternateOf, calculationGroup в старых версиях)
                requireParent(parent, line, pos, word);
                if (hasDeeperChild(index, line.width())) {
                    TmdlNode node = new TmdlNode(TmdlNodeKind.OBJECT, word, null, null, null, line.number(), parent);
                    attach(node, parent, roots);
                    stack.push(new Frame(line.width(), node));
                } else {
                    parent.addProperty(new TmdlProperty(word, "", span(wordEnd, wordEnd, line), List.of(), null, line.number()));
                }
                return index + 1;
            }
            throw error(line, next, "Unrecognized line starting with '" + word + "'");
        }

        private int parseObject(int index, Line line, TmdlNodeKind kind, String keyword, int pos, TmdlNode parent,
                                List<TmdlNode> roots, Deque<Frame> stack) throws ModelParseException {
            String refKind = null;
            if (kind == TmdlNodeKind.REF) {
                int refEnd = readWord(pos, line.end());
                if (refEnd == pos) {
                    throw error(line, pos, "Expected object kind after 'ref'");
                }
                refKind = src.substring(pos, refEnd);
                pos = skipSpaces(refEnd, line.end());
            }

            TmdlNameToken name = null;
            int after = pos;
            if (pos < line.end() && src.charAt(pos) != '=') {
                if (src.charAt(pos) == '\'') {
                    name = readQuoted(pos, line.end(), line);
                    after = skipSpaces(name.span().end(), line.end());
                    if (after < line.end() && src.charAt(after) != '=') {
                        throw error(line, after, "Unexpected text after name " + name.value());
                    }
                } else {
                    int eq = src.indexOf('=', pos);
                    int limit = eq >= 0 && eq < line.end() ? eq : line.end();
                    int nameEnd = trimEnd(pos, limit);
                    name = new TmdlNameToken(src.substring(pos, nameEnd), span(pos, nameEnd, line), false);
                    after = limit;
                }
            }

            TmdlExpression expression = null;
            int nextLine = index + 1;
            if (after < line.end() && src.charAt(after) == '=') {
                ExpressionResult expr = parseExpression(index, after + 1);
                expression = expr.expression();
                nextLine = expr.nextLine();
            }

            TmdlNode node = new TmdlNode(kind, keyword, refKind, name, expression, line.number(), parent);
            attach(node, parent, roots);
            stack.push(new Frame(line.width(), node));
            return nextLine;
        }

        private ExpressionResult parseExpression(int index, int pos) throws ModelParseException {
            Line line = lines.get(index);
            int restStart = skipSpaces(pos, line.end());
            int restEnd = trimEnd(restStart, line.end());

            if (src.startsWith(FENCE, restStart) && restEnd - restStart == FENCE.length()) {
                for (int j = index + 1; j < lines.size(); j++) {
                    Line candidate = lines.get(j);
                    if (src.startsWith(FENCE, candidate.contentStart())
                            && trimEnd(candidate.contentStart(), candidate.end()) - candidate.contentStart() == FENCE.length()) {
                        int start = lines.get(index + 1).start();
                        int end = j > index + 1 ? lines.get(j - 1).end() : start;
                        Line first = lines.get(Math.min(index + 1, j));
                        return new ExpressionResult(new TmdlExpression(src.substring(start, end),
                                new SourceSpan(start, end, first.number(), 1), true), j + 1);
                    }
                }
                throw error(line, restStart, "Unterminated ``` block");
            }

            if (restStart < restEnd) {
                return new ExpressionResult(new TmdlExpression(src.substring(restStart, restEnd),
                        span(restStart, restEnd, line), false), index + 1);
            }

            // Многострочное выражение: строки глубже объявления
            int first = index + 1;
            while (first < lines.size() && lines.get(first).blank()) {
                first++;
            }
            if (first >= lines.size() || lines.get(first).width() <= line.width()) {
                return new ExpressionResult(new TmdlExpression("", span(restStart, restStart, line), false), index + 1);
            }
            int bodyWidth = lines.get(first).width();
            int last = first;
            for (int k = first + 1; k < lines.size(); k++) {
                Line candidate = lines.get(k);
                if (candidate.blank()) {
                    continue;
                }
                if (candidate.width() < bodyWidth) {
                    break;
                }
                last = k;
            }
            Line firstLine = lines.get(first);
            int start = firstLine.contentStart();
            int end = lines.get(last).end();
            return new ExpressionResult(new TmdlExpression(src.substring(start, end),
                    span(start, end, firstLine), false), last + 1);
        }

        private List<TmdlNameToken> parseReferences(String key, int start, int end, Line line) throws ModelParseException {
            List<TmdlNameToken> result = new ArrayList<>();
            boolean qualified = QUALIFIED_PROPERTIES.contains(key);
            int pos = start;
            while (pos < end) {
                TmdlNameToken token;
                if (src.charAt(pos) == '\'') {
                    token = readQuoted(pos, end, line);
                } else {
                    int limit = end;
                    if (qualified && result.isEmpty()) {
                        int dot = src.indexOf('.', pos);
                        if (dot >= 0 && dot < end) {
                            limit = dot;
                        }
                    }
                    int tokenEnd = trimEnd(pos, limit);
                    token = new TmdlNameToken(src.substring(pos, tokenEnd), span(pos, tokenEnd, line), false);
                }
                result.add(token);
                pos = skipSpaces(token.span().end(), end);
                if (pos >= end) {
                    break;
                }
                if (qualified && result.size() == 1 && src.charAt(pos) == '.') {
                    pos = skipSpaces(pos + 1, end);
                    continue;
                }
                throw error(line, pos, "Unexpected text in reference '" + src.substring(start, end) + "'");
            }
            return result;
        }

        private TmdlNameToken readQuoted(int pos, int end, Line line) throws ModelParseException {
            StringBuilder value = new StringBuilder();
            int j = pos + 1;
            while (true) {
                if (j >= end) {
                    throw error(line, pos, "Unterminated quoted name");
                }
                char ch = src.charAt(j);
                if (ch == '\'') {
                    if (j + 1 < end && src.charAt(j + 1) == '\'') {
                        value.append('\'');
                        j += 2;
                        continue;
                    }
                    return new TmdlNameToken(value.toString(), span(pos, j + 1, line), true);
                }
                value.append(ch);
                j++;
            }
        }

        private boolean hasDeeperChild(int index, int width) {
            for (int k = index + 1; k < lines.size(); k++) {
                Line candidate = lines.get(k);
                if (candidate.blank() || isComment(candidate)) {
                    continue;
                }
                return candidate.width() > width;
            }
            return false;
        }

        private void requireParent(TmdlNode parent, Line line, int pos, String word) throws ModelParseException {
            if (parent == null) {
                throw error(line, pos, "Property '" + word + "' outside of any object");
            }
        }

        private static void attach(TmdlNode node, TmdlNode parent, List<TmdlNode> roots) {
            if (parent == null) {
                roots.add(node);
            } else {
                parent.addChild(node);
            }
        }

        private boolean isComment(Line line) {
            return src.startsWith("//", line.contentStart());
        }

        private int readWord(int pos, int end) {
            int j = pos;
            while (j < end) {
                char ch = src.charAt(j);
                if (!Character.isLetterOrDigit(ch) && ch != '_') {
                    break;
                }
                j++;
            }
            return j;
        }

        private int skipSpaces(int pos, int end) {
            int j = pos;
            while (j < end && (src.charAt(j) == ' ' || src.charAt(j) == '\t')) {
                j++;
            }
            return j;
        }

        private int trimEnd(int start, int end) {
            int j = end;
            while (j > start && Character.isWhitespace(src.charAt(j - 1))) {
                j--;
            }
            return j;
        }

        private SourceSpan span(int start, int end, Line line) {
            return new SourceSpan(start, end, line.number(), start - line.start() + 1);
        }

        private ModelParseException error(Line line, int pos, String detail) {
            return new ModelParseException(file, line.number(), pos - line.start() + 1, detail);
        }

        private static List<Line> splitLines(String src) {
            List<Line> result = new ArrayList<>();
            int start = 0;
            int number = 1;
            int length = src.length();
            while (start <= length) {
                int nl = src.indexOf('\n', start);
                int rawEnd = nl >= 0 ? nl : length;
                int end = rawEnd > start && src.charAt(rawEnd - 1) == '\r' ? rawEnd - 1 : rawEnd;
                int width = 0;
                int content = start;
                while (content < end && (src.charAt(content) == ' ' || src.charAt(content) == '\t')) {
                    width += src.charAt(content) == '\t' ? 4 : 1;
                    content++;
                }
                boolean blank = src.substring(content, end).isBlank();
                result.add(new Line(number++, start, content, end, width, blank));
                if (nl < 0) {
                    break;
                }
                start = nl + 1;
            }
            return result;
        }
    }
}
