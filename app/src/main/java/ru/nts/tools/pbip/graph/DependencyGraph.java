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
package ru.nts.tools.pbip.graph;

import ru.nts.tools.pbip.core.PbipErrorCode;
import ru.nts.tools.pbip.project.ProjectSources;
import ru.nts.tools.pbip.report.BindingDocument;
import ru.nts.tools.pbip.tmdl.TmdlDocument;

import java.nio.file.Path;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Граф зависимостей проекта: объявленные идентификаторы, ребра "на идентификатор ссылается место",
 * проблемы разрешения и отпечатки файлов (CRC32C) на момент построения.
 *
 * <p>После построения граф только читается. Коммит переименования вызывает {@link #invalidate()};
 * любой последующий запрос к графу бросает {@link IllegalStateException}.
 */
public final class DependencyGraph {

    private final ProjectSources sources;
    private final Map<Path, TmdlDocument> modelDocuments;
    private final Map<Path, BindingDocument> reportDocuments;
    private final ModelSymbolTable symbols;
    private final List<ReferenceOccurrence> occurrences;
    private final Map<IdentifierKey, List<ReferenceOccurrence>> edges;
    private final List<ResolutionIssue> issues;
    private final Map<Path, Long> fingerprints;
    private volatile boolean invalidated;

    DependencyGraph(ProjectSources sources, Map<Path, TmdlDocument> modelDocuments,
                    Map<Path, BindingDocument> reportDocuments, ModelSymbolTable symbols,
                    List<ReferenceOccurrence> occurrences, Map<IdentifierKey, List<ReferenceOccurrence>> edges,
                    List<ResolutionIssue> issues, Map<Path, Long> fingerprints) {
        this.sources = sources;
        this.modelDocuments = Collections.unmodifiableMap(modelDocuments);
        this.reportDocuments = Collections.unmodifiableMap(reportDocuments);
        this.symbols = symbols;
        this.occurrences = List.copyOf(occurrences);
        Map<IdentifierKey, List<ReferenceOccurrence>> frozen = new LinkedHashMap<>();
        edges.forEach((k, v) -> frozen.put(k, List.copyOf(v)));
        this.edges = Collections.unmodifiableMap(frozen);
        this.issues = List.copyOf(issues);
        this.fingerprints = Collections.unmodifiableMap(fingerprints);
    }

    private void ensureValid() {
        if (invalidated) {
            throw new IllegalStateException(PbipErrorCode.GRAPH_INVALIDATED.format());
        }
    }

    public ProjectSources sources() {
        ensureValid();
        return sources;
    }

    public ModelSymbolTable symbols() {
        ensureValid();
        return symbols;
    }

    public Map<Path, TmdlDocument> modelDocuments() {
        ensureValid();
        return modelDocuments;
    }

    public Map<Path, BindingDocument> reportDocuments() {
        ensureValid();
        return reportDocuments;
    }

    /**
     * Все места в порядке файлов проекта.
     */
    public List<ReferenceOccurrence> occurrences() {
        ensureValid();
        return occurrences;
    }

    /**
     * Места, ссылающиеся на идентификатор (включая его объявление).
     */
    public List<ReferenceOccurrence> referencedBy(IdentifierKey key) {
        ensureValid();
        return edges.getOrDefault(key, List.of());
    }

    /**
     * Файлы, содержащие хотя бы одно место для любого из идентификаторов.
     */
    public Set<Path> filesReferencing(Iterable<IdentifierKey> keys) {
        ensureValid();
        Set<Path> files = new LinkedHashSet<>();
        for (IdentifierKey key : keys) {
            referencedBy(key).forEach(o -> files.add(o.file()));
        }
        return files;
    }

    public List<ResolutionIssue> issues() {
        ensureValid();
        return issues;
    }

    public Map<Path, Long> fingerprints() {
        ensureValid();
        return fingerprints;
    }

    public long fingerprint(Path file) {
        ensureValid();
        Long crc = fingerprints.get(file);
        if (crc == null) {
            throw new IllegalArgumentException("File is not part of the graph: " + file);
        }
        return crc;
    }

    public void invalidate() {
        invalidated = true;
    }

    public boolean isInvalidated() {
        return invalidated;
    }
}
