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

import ru.nts.tools.pbip.core.SourceSpan;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Optional;

/**
 * Узел JSON-дерева отчета. Хранит путь от корня, положение в исходном тексте
 * и, для строк, токен с декодированным значением. Порядок ключей объекта сохраняется.
 */
public final class BindingNode {

    public enum Kind {
        OBJECT, ARRAY, STRING, NUMBER, BOOLEAN, NULL
    }

    /**
     * Член объекта: токен ключа и значение.
     */
    public record Member(JsonStringToken key, BindingNode value) {
    }

    private final Kind kind;
    private final String path;
    private final BindingNode parent;
    private final String keyInParent;
    private final List<Member> members = new ArrayList<>();
    private final List<BindingNode> elements = new ArrayList<>();
    private SourceSpan span;
    private JsonStringToken token;
    private BindingDocument embedded;

    BindingNode(Kind kind, String path, BindingNode parent, String keyInParent) {
        this.kind = kind;
        this.path = path;
        this.parent = parent;
        this.keyInParent = keyInParent;
    }

    void setSpan(SourceSpan span) {
        this.span = span;
    }

    void setToken(JsonStringToken token) {
        this.token = token;
    }

    void setEmbedded(BindingDocument embedded) {
        this.embedded = embedded;
    }

    void addMember(JsonStringToken key, BindingNode value) {
        members.add(new Member(key, value));
    }

    void addElement(BindingNode element) {
        elements.add(element);
    }

    public Kind kind() {
        return kind;
    }

    public String path() {
        return path;
    }

    public BindingNode parent() {
        return parent;
    }

    /** Ключ, под которым узел лежит в родительском объекте ({@code null} для элементов массива). */
    public String keyInParent() {
        return keyInParent;
    }

    public SourceSpan span() {
        return span;
    }

    public JsonStringToken token() {
        return token;
    }

    /** Вложенный JSON-документ, если значение строки само является JSON. */
    public BindingDocument embedded() {
        return embedded;
    }

    public List<Member> members() {
        return Collections.unmodifiableList(members);
    }

    public List<BindingNode> elements() {
        return Collections.unmodifiableList(elements);
    }

    public boolean isObject() {
        return kind == Kind.OBJECT;
    }

    public boolean isString() {
        return kind == Kind.STRING;
    }

    public String stringValue() {
        return token != null ? token.value() : null;
    }

    public Optional<BindingNode> member(String key) {
        for (Member member : members) {
            if (member.key().value().equals(key)) {
                return Optional.of(member.value());
            }
        }
        return Optional.empty();
    }

    /**
     * Строковое значение члена объекта, если он есть и является строкой.
     */
    public Optional<BindingNode> stringMember(String key) {
        return member(key).filter(BindingNode::isString);
    }

    @Override
    public String toString() {
        return kind + " " + path;
    }
}
