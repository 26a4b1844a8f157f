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

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Optional;

/**
 * Узел дерева TMDL: объявление объекта с именем, свойствами, выражением и дочерними узлами.
 */
public final class TmdlNode {

    private final TmdlNodeKind kind;
    private final String keyword;
    private final String refKind;
    private final TmdlNameToken name;
    private final TmdlExpression expression;
    private final int line;
    private final TmdlNode parent;
    private final List<TmdlProperty> properties = new ArrayList<>();
    private final List<TmdlNode> children = new ArrayList<>();

    TmdlNode(TmdlNodeKind kind, String keyword, String refKind, TmdlNameToken name,
             TmdlExpression expression, int line, TmdlNode parent) {
        this.kind = kind;
        this.keyword = keyword;
        this.refKind = refKind;
        this.name = name;
        this.expression = expression;
        this.line = line;
        this.parent = parent;
    }

    void addProperty(TmdlProperty property) {
        properties.add(property);
    }

    void addChild(TmdlNode child) {
        children.add(child);
    }

    public TmdlNodeKind kind() {
        return kind;
    }

    public String keyword() {
        return keyword;
    }

    /**
     * Вид объекта для {@code ref} (например, {@code table} в {@code ref table Sales}).
     */
    public String refKind() {
        return refKind;
    }

    public TmdlNameToken nameToken() {
        return name;
    }

    public String name() {
        return name != null ? name.value() : null;
    }

    public TmdlExpression expression() {
        return expression;
    }

    public int line() {
        return line;
    }

    public TmdlNode parent() {
        return parent;
    }

    public List<TmdlProperty> properties() {
        return Collections.unmodifiableList(properties);
    }

    public List<TmdlNode> children() {
        return Collections.unmodifiableList(children);
    }

    public Optional<TmdlProperty> property(String key) {
        return properties.stream().filter(p -> p.key().equals(key)).findFirst();
    }

    public String propertyValue(String key) {
        return property(key).map(TmdlProperty::value).orElse(null);
    }

    /**
     * Ближайший предок заданного вида.
     */
    public Optional<TmdlNode> ancestor(TmdlNodeKind ancestorKind) {
        TmdlNode current = parent;
        while (current != null) {
            if (current.kind == ancestorKind) {
                return Optional.of(current);
            }
            current = current.parent;
        }
        return Optional.empty();
    }

    @Override
    public String toString() {
        return keyword + (name != null ? " " + name.value() : "") + " @" + line;
    }
}
