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

import com.fasterxml.jackson.core.io.JsonStringEncoder;
import ru.nts.tools.pbip.core.TextEdit;

import java.nio.file.Path;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Map;

/**
 * Разобранный JSON-документ отчета (файл или JSON внутри строки).
 *
 * <p>Документ ничего не сериализует заново: запись подставляет новые значения только
 * в указанные строковые токены, остальные байты, порядок ключей и неизвестные поля
 * остаются как были.
 */
public final class BindingDocument {

    /**
     * Вложенная строка, значение которой похоже на JSON, но не разобралось.
     */
    public record EmbeddedFailure(JsonStringToken token, String detail) {
    }

    private final Path file;
    private final String source;
    private final JsonStringToken parentToken;
    private final int depth;
    private final List<JsonStringToken> tokens = new ArrayList<>();
    private final List<EmbeddedFailure> embeddedFailures = new ArrayList<>();
    private BindingNode root;

    BindingDocument(Path file, String source, JsonStringToken parentToken, int depth) {
        this.file = file;
        this.source = source;
        this.parentToken = parentToken;
        this.depth = depth;
    }

    void setRoot(BindingNode root) {
        this.root = root;
    }

    void register(JsonStringToken token) {
        token.setOwner(this);
        tokens.add(token);
    }

    void addEmbeddedFailure(EmbeddedFailure failure) {
        embeddedFailures.add(failure);
    }

    public Path file() {
        return file;
    }

    public String source() {
        return source;
    }

    public BindingNode root() {
        return root;
    }

    /** Строка внешнего документа, содержащая этот документ ({@code null} для файла). */
    public JsonStringToken parentToken() {
        return parentToken;
    }

    public int depth() {
        return depth;
    }

    public List<JsonStringToken> tokens() {
        return Collections.unmodifiableList(tokens);
    }

    public List<EmbeddedFailure> embeddedFailures() {
        return Collections.unmodifiableList(embeddedFailures);
    }

    public String write() {
        return source;
    }

    /**
     * Записывает документ, заменяя значения токенов этого документа.
     * Токены других документов в карте игнорируются.
     */
    public String write(Map<JsonStringToken, String> replacements) {
        List<TextEdit> edits = new ArrayList<>();
        for (Map.Entry<JsonStringToken, String> entry : replacements.entrySet()) {
            JsonStringToken token = entry.getKey();
            if (token.owner() == this) {
                edits.add(new TextEdit(token.start(), token.end(), encode(entry.getValue())));
            }
        }
        return TextEdit.applyAll(source, edits);
    }

    /**
     * Кодирует строку как JSON-литерал в кавычках.
     */
    public static String encode(String value) {
        return "\"" + new String(JsonStringEncoder.getInstance().quoteAsString(value)) + "\"";
    }
}
