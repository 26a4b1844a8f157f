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
package ru.nts.tools.pbip.report;

import com.fasterxml.jackson.core.JsonFactory;
import com.fasterxml.jackson.core.JsonLocation;
import com.fasterxml.jackson.core.JsonParser;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.core.JsonToken;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import ru.nts.tools.pbip.core.ModelParseException;
import ru.nts.tools.pbip.core.SourceSpan;

import java.io.IOException;
import java.nio.file.Path;
import java.util.Set;

/**
 * Парсер JSON отчета на потоковом API Jackson.
 *
 * <p>Jackson отвечает за синтаксис и декодирование строк, а положения токенов берутся
 * из {@link JsonParser#getTokenLocation()}; конец строкового токена находится
 * сканированием исходного текста. Строки под ключами {@code config}, {@code filters},
 * {@code query}, {@code dataTransforms}, содержащие JSON, разбираются рекурсивно.
 */
public class BindingParser {

    private static final Logger log = LoggerFactory.getLogger(BindingParser.class);

    /** Ключи, под которыми легаси report.json хранит JSON внутри строки. */
    public static final Set<String> EMBEDDED_KEYS = Set.of("config", "filters", "query", "dataTransforms");

    private final JsonFactory factory = JsonFactory.builder().build();

    public BindingDocument parse(Path file, String source) throws ModelParseException {
        BindingDocument document = new BindingDocument(file, source, null, 0);
        parseInto(document, "$");
        log.debug("Parsed {}: {} string tokens", file, document.tokens().size());
        return document;
    }

    private BindingDocument parseEmbedded(Path file, JsonStringToken parentToken, int depth) throws ModelParseException {
        BindingDocument document = new BindingDocument(file, parentToken.value(), parentToken, depth);
        parseInto(document, parentToken.path());
        return document;
    }

    private void parseInto(BindingDocument document, String rootPath) throws ModelParseException {
        String source = document.source();
        try (JsonParser parser = factory.createParser(source)) {
            JsonToken first = parser.nextToken();
            if (first == null) {
                throw new ModelParseException(document.file(), 1, 1, "Empty JSON document");
            }
            Reader reader = new Reader(document, parser);
            document.setRoot(reader.readValue(first, null, rootPath, null));
            if (parser.nextToken() != null) {
                JsonLocation loc = parser.getTokenLocation();
                throw new ModelParseException(document.file(), loc.getLineNr(), loc.getColumnNr(),
                        "Unexpected content after the root value");
            }
        } catch (JsonProcessingException e) {
            JsonLocation loc = e.getLocation();
            int line = loc != null ? loc.getLineNr() : 0;
            int column = loc != null ? loc.getColumnNr() : 0;
            throw new ModelParseException(document.file(), line, column, e.getOriginalMessage(), e);
        } catch (IOException e) {
            throw new ModelParseException(document.file(), 0, 0, "Cannot read JSON: " + e.getMessage(), e);
        }
    }

    /**
     * Обход потока токенов одного документа.
     */
    private final class Reader {
        private final BindingDocument document;
        private final JsonParser parser;
        private final String source;

        Reader(BindingDocument document, JsonParser parser) {
            this.document = document;
            this.parser = parser;
            this.source = document.source();
        }

        BindingNode readValue(JsonToken token, BindingNode parent, String path, String key) throws IOException, ModelParseException {
            JsonLocation location = parser.getTokenLocation();
            int start = (int) location.getCharOffset();
            int line = location.getLineNr();
            int column = location.getColumnNr();

            switch (token) {
                case START_OBJECT -> {
                    BindingNode node = new BindingNode(BindingNode.Kind.OBJECT, path, parent, key);
                    JsonToken next;
                    while ((next = parser.nextToken()) != JsonToken.END_OBJECT) {
                        if (next != JsonToken.FIELD_NAME) {
                            throw new ModelParseException(document.file(), line, column, "Expected field name, got " + next);
                        }
                        String name = parser.currentName();
                        String childPath = path + "." + name;
                        JsonStringToken keyToken = stringToken(name, childPath, true);
                        BindingNode child = readValue(parser.nextToken(), node, childPath, name);
                        node.addMember(keyToken, child);
                    }
                    node.setSpan(new SourceSpan(start, endOf(parser.getTokenLocation()), line, column));
                    return node;
                }
                case START_ARRAY -> {
                    BindingNode node = new BindingNode(BindingNode.Kind.ARRAY, path, parent, key);
                    JsonToken next;
                    int index = 0;
                    while ((next = parser.nextToken()) != JsonToken.END_ARRAY) {
                        node.addElement(readValue(next, node, path + "[" + index++ + "]", null));
                    }
                    node.setSpan(new SourceSpan(start, endOf(parser.getTokenLocation()), line, column));
                    return node;
                }
                case VALUE_STRING -> {
                    BindingNode node = new BindingNode(BindingNode.Kind.STRING, path, parent, key);
                    JsonStringToken stringToken = stringToken(parser.getText(), path, false);
                    node.setToken(stringToken);
                    node.setSpan(new SourceSpan(stringToken.start(), stringToken.end(), line, column));
                    if (key != null && EMBEDDED_KEYS.contains(key)) {
                        attachEmbedded(node, stringToken);
                    }
                    return node;
                }
                default -> {
                    BindingNode.Kind kind = switch (token) {
                        case VALUE_TRUE, VALUE_FALSE -> BindingNode.Kind.BOOLEAN;
                        case VALUE_NULL -> BindingNode.Kind.NULL;
                        default -> BindingNode.Kind.NUMBER;
                    };
                    BindingNode node = new BindingNode(kind, path, parent, key);
                    node.setSpan(new SourceSpan(start, start + parser.getText().length(), line, column));
                    return node;
                }
            }
        }

        private void attachEmbedded(BindingNode node, JsonStringToken token) {
            String trimmed = token.value().trim();
            if (!(trimmed.startsWith("{") || trimmed.startsWith("["))) {
                return;
            }
            try {
                node.setEmbedded(parseEmbedded(document.file(), token, document.depth() + 1));
            } catch (ModelParseException e) {
                log.debug("Embedded JSON at {} in {} is not parseable: {}", token.path(), document.file(), e.getDetail());
                document.addEmbeddedFailure(new BindingDocument.EmbeddedFailure(token, e.getDetail()));
            }
        }

        private JsonStringToken stringToken(String value, String path, boolean key) throws ModelParseException {
            JsonLocation location = parser.getTokenLocation();
            int start = locateQuote((int) location.getCharOffset(), location);
            int end = scanStringEnd(start, location);
            JsonStringToken token = new JsonStringToken(start, end, value, location.getLineNr(), location.getColumnNr(), path, key);
            document.register(token);
            return token;
        }

        private int locateQuote(int offset, JsonLocation location) throws ModelParseException {
            if (offset >= 0 && offset < source.length() && source.charAt(offset) == '"') {
                return offset;
            }
            if (offset > 0 && offset <= source.length() && source.charAt(offset - 1) == '"') {
                return offset - 1;
            }
            throw new ModelParseException(document.file(), location.getLineNr(), location.getColumnNr(),
                    "Cannot locate string token at offset " + offset);
        }

        private int scanStringEnd(int quote, JsonLocation location) throws ModelParseException {
            int j = quote + 1;
            while (j < source.length()) {
                char c = source.charAt(j);
                if (c == '\\') {
                    j += 2;
                } else if (c == '"') {
                    return j + 1;
                } else {
                    j++;
                }
            }
            throw new ModelParseException(document.file(), location.getLineNr(), location.getColumnNr(), "Unterminated string");
        }

        private int endOf(JsonLocation closing) {
            return (int) closing.getCharOffset() + 1;
        }
    }
}
