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

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import ru.nts.tools.pbip.core.ModelParseException;
import ru.nts.tools.pbip.core.PbipErrorCode;
import ru.nts.tools.pbip.core.PbipException;
import ru.nts.tools.pbip.core.PbipSettings;
import ru.nts.tools.pbip.core.SourceSpan;
import ru.nts.tools.pbip.dax.ExpressionReferenceResolver;
import ru.nts.tools.pbip.dax.ExpressionScan;
import ru.nts.tools.pbip.project.FileFamily;
import ru.nts.tools.pbip.project.ProjectSources;
import ru.nts.tools.pbip.project.SourceFile;
import ru.nts.tools.pbip.report.BindingDocument;
import ru.nts.tools.pbip.report.BindingParser;
import ru.nts.tools.pbip.report.shapes.BindingReference;
import ru.nts.tools.pbip.report.shapes.ShapeRegistry;
import ru.nts.tools.pbip.report.shapes.ShapeScan;
import ru.nts.tools.pbip.tmdl.DaxExpressionSite;
import ru.nts.tools.pbip.tmdl.TmdlDocument;
import ru.nts.tools.pbip.tmdl.TmdlNameToken;
import ru.nts.tools.pbip.tmdl.TmdlNode;
import ru.nts.tools.pbip.tmdl.TmdlNodeKind;
import ru.nts.tools.pbip.tmdl.TmdlParser;
import ru.nts.tools.pbip.tmdl.TmdlProperty;

import java.nio.file.Path;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;

/**
 * Строит {@link DependencyGraph} из набора файлов проекта (с диска или staged).
 *
 * <p>Файлы разбираются параллельно на ограниченном пуле: разбор только читает.
 * Затем собирается таблица символов и выполняется один проход разрешения
 * в порядке файлов, добавляющий по одному ребру на каждое найденное место.
 */
public class DependencyGraphBuilder {

    private static final Logger log = LoggerFactory.getLogger(DependencyGraphBuilder.class);

    private final PbipSettings settings;
    private final TmdlParser tmdlParser = new TmdlParser();
    private final BindingParser bindingParser = new BindingParser();
    private final ShapeRegistry shapes = ShapeRegistry.defaults();

    public DependencyGraphBuilder(PbipSettings settings) {
        this.settings = settings;
    }

    /**
     * @throws ModelParseException если какой-либо файл не разбирается (все ошибки перечислены в контексте первой).
     * @throws PbipException       если разбор был прерван.
     */
    public DependencyGraph build(ProjectSources sources) throws PbipException {
        long started = System.nanoTime();
        Map<Path, TmdlDocument> modelDocs = new LinkedHashMap<>();
        Map<Path, BindingDocument> reportDocs = new LinkedHashMap<>();
        parseAll(sources, modelDocs, reportDocs);

        ModelSymbolTable.Builder symbolsBuilder = ModelSymbolTable.builder();
        for (TmdlDocument doc : modelDocs.values()) {
            declare(doc, symbolsBuilder);
        }
        ModelSymbolTable symbols = symbolsBuilder.build();

        Resolution resolution = new Resolution(symbols);
        for (ModelIdentifier duplicate : symbolsBuilder.duplicates()) {
            resolution.issues.add(new ResolutionIssue(ResolutionIssue.IssueKind.DUPLICATE_DECLARATION, duplicate.file(),
                    duplicate.span().line(), "declaration", duplicate.tableName(), duplicate.name(),
                    "Identifier is declared more than once", List.of(duplicate.key())));
        }
        modelDocs.values().forEach(resolution::resolveModel);
        reportDocs.values().forEach(resolution::resolveReport);

        Map<Path, Long> fingerprints = new LinkedHashMap<>();
        sources.files().forEach(f -> fingerprints.put(f.path(), f.crc32c()));

        DependencyGraph graph = new DependencyGraph(sources, modelDocs, reportDocs, symbols,
                resolution.occurrences, resolution.edges, resolution.issues, fingerprints);
        log.debug("Graph built in {} ms: {} identifiers, {} occurrences, {} issues{}",
                (System.nanoTime() - started) / 1_000_000, symbols.size(), resolution.occurrences.size(),
                resolution.issues.size(), sources.isStaged() ? " (staged)" : "");
        return graph;
    }

    private void parseAll(ProjectSources sources, Map<Path, TmdlDocument> modelDocs,
                          Map<Path, BindingDocument> reportDocs) throws PbipException {
        List<SourceFile> files = new ArrayList<>(sources.files());
        if (files.isEmpty()) {
            return;
        }
        int threads = Math.max(1, Math.min(settings.getParseThreads(), files.size()));
        ExecutorService pool = Executors.newFixedThreadPool(threads, r -> {
            Thread t = new Thread(r, "pbip-parse");
            t.setDaemon(true);
            return t;
        });
        try {
            List<Future<Object>> futures = new ArrayList<>(files.size());
            for (SourceFile file : files) {
                futures.add(pool.submit(() -> file.family() == FileFamily.MODEL
                        ? tmdlParser.parse(file.path(), file.text())
                        : bindingParser.parse(file.path(), file.text())));
            }

            List<ModelParseException> failures = new ArrayList<>();
            for (int i = 0; i < files.size(); i++) {
                try {
                    Object parsed = futures.get(i).get();
                    if (parsed instanceof TmdlDocument tmdl) {
                        modelDocs.put(files.get(i).path(), tmdl);
                    } else {
                        reportDocs.put(files.get(i).path(), (BindingDocument) parsed);
                    }
                } catch (ExecutionException e) {
                    if (e.getCause() instanceof ModelParseException mpe) {
                        failures.add(mpe);
                    } else {
                        throw new PbipException(PbipErrorCode.INTERNAL_ERROR,
                                Map.of("file", files.get(i).path().toString()), e.getCause()).addFile(files.get(i).path());
                    }
                }
            }
            if (!failures.isEmpty()) {
                ModelParseException first = failures.get(0);
                for (ModelParseException other : failures.subList(1, failures.size())) {
                    first.addFile(other.getFile());
                    first.addSuggestion(other.getFile() + ":" + other.getLine() + ":" + other.getColumn() + " " + other.getDetail());
                }
                log.debug("{} file(s) failed to parse", failures.size());
                throw first;
            }
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new PbipException(PbipErrorCode.INTERNAL_ERROR, Map.of("reason", "parse interrupted"), e);
        } finally {
            pool.shutdownNow();
        }
    }

    private static void declare(TmdlDocument doc, ModelSymbolTable.Builder symbols) {
        for (TmdlNode node : doc.allNodes()) {
            if (node.nameToken() == null) {
                continue;
            }
            switch (node.kind()) {
                case TABLE -> symbols.declare(IdentifierKind.TABLE, null, node.name(), doc.path(), node.nameToken().span());
                case COLUMN, MEASURE -> {
                    if (node.parent() != null && node.parent().kind() == TmdlNodeKind.TABLE && node.parent().name() != null) {
                        IdentifierKind kind = node.kind() == TmdlNodeKind.COLUMN ? IdentifierKind.COLUMN : IdentifierKind.MEASURE;
                        symbols.declare(kind, node.parent().name(), node.name(), doc.path(), node.nameToken().span());
                    }
                }
                default -> {
                }
            }
        }
    }

    /**
     * Проход разрешения ссылок по всем файлам.
     */
    private final class Resolution {
        private final ModelSymbolTable symbols;
        private final ExpressionReferenceResolver daxResolver;
        private final List<ReferenceOccurrence> occurrences = new ArrayList<>();
        private final Map<IdentifierKey, List<ReferenceOccurrence>> edges = new LinkedHashMap<>();
        private final List<ResolutionIssue> issues = new ArrayList<>();

        Resolution(ModelSymbolTable symbols) {
            this.symbols = symbols;
            this.daxResolver = new ExpressionReferenceResolver(symbols);
        }

        private void add(ReferenceOccurrence occurrence) {
            occurrences.add(occurrence);
            edges.computeIfAbsent(occurrence.target(), k -> new ArrayList<>()).add(occurrence);
        }

        // ============ Model ============

        void resolveModel(TmdlDocument doc) {
            for (TmdlNode node : doc.allNodes()) {
                TmdlNameToken name = node.nameToken();
                String table = TmdlDocument.owningTable(node);
                switch (node.kind()) {
                    case TABLE -> declaration(doc, name, name == null ? null : IdentifierKey.table(name.value()));
                    case COLUMN -> {
                        if (name != null && table != null && node.parent().kind() == TmdlNodeKind.TABLE) {
                            declaration(doc, name, IdentifierKey.column(table, name.value()));
                        }
                        referenceProperty(doc, node, "sortByColumn", IdentifierKind.COLUMN, table);
                        referenceProperty(doc, node, "groupByColumn", IdentifierKind.COLUMN, table);
                    }
                    case MEASURE -> {
                        if (name != null && table != null && node.parent().kind() == TmdlNodeKind.TABLE) {
                            declaration(doc, name, IdentifierKey.measure(table, name.value()));
                        }
                    }
                    case REF -> {
                        if ("table".equals(node.refKind()) && name != null) {
                            tableReference(doc, name, "ref table");
                        }
                    }
                    case PERSPECTIVE_TABLE, TABLE_PERMISSION -> {
                        if (name != null) {
                            tableReference(doc, name, node.keyword());
                        }
                    }
                    case PERSPECTIVE_COLUMN, COLUMN_PERMISSION -> {
                        if (name != null && node.parent() != null && node.parent().name() != null) {
                            memberReference(doc, name, IdentifierKind.COLUMN, node.parent().name(), node.keyword());
                        }
                    }
                    case PERSPECTIVE_MEASURE -> {
                        if (name != null && node.parent() != null && node.parent().name() != null) {
                            memberReference(doc, name, IdentifierKind.MEASURE, node.parent().name(), node.keyword());
                        }
                    }
                    case LEVEL -> {
                        String hierarchyTable = node.ancestor(TmdlNodeKind.TABLE).map(TmdlNode::name).orElse(null);
                        referenceProperty(doc, node, "column", IdentifierKind.COLUMN, hierarchyTable);
                    }
                    case RELATIONSHIP -> {
                        relationshipEnd(doc, node, "fromTable", "fromColumn");
                        relationshipEnd(doc, node, "toTable", "toColumn");
                    }
                    case OBJECT -> {
                        if ("alternateOf".equals(node.keyword())) {
                            relationshipEnd(doc, node, "baseTable", "baseColumn");
                        }
                    }
                    default -> {
                    }
                }
            }

            for (DaxExpressionSite site : doc.daxExpressions()) {
                ExpressionScan scan = daxResolver.extractReferences(doc.path(), site.expression(), site.owningTable());
                scan.occurrences().forEach(this::add);
                for (ResolutionIssue issue : scan.issues()) {
                    issues.add(new ResolutionIssue(issue.kind(), issue.file(), issue.line(), site.location(),
                            issue.spelledTable(), issue.spelledMember(), issue.detail(), issue.candidates()));
                }
            }
        }

        private void declaration(TmdlDocument doc, TmdlNameToken name, IdentifierKey key) {
            if (name == null || key == null) {
                return;
            }
            add(new ReferenceOccurrence(doc.path(), name.span(), key, SyntacticForm.DECLARATION,
                    NameEncoding.TMDL_NAME, null, name.span().slice(doc.source())));
        }

        private void tableReference(TmdlDocument doc, TmdlNameToken token, String location) {
            Optional<ModelIdentifier> table = symbols.table(token.value());
            if (table.isPresent()) {
                add(tmdlOccurrence(doc, token, table.get().key()));
            } else {
                issues.add(ResolutionIssue.unresolved(doc.path(), token.span().line(), location, token.value(), null, "Unknown table"));
            }
        }

        private void memberReference(TmdlDocument doc, TmdlNameToken token, IdentifierKind kind, String table, String location) {
            Optional<ModelIdentifier> member = symbols.get(IdentifierKey.of(kind, table, token.value()));
            if (member.isPresent()) {
                add(tmdlOccurrence(doc, token, member.get().key()));
            } else {
                issues.add(ResolutionIssue.unresolved(doc.path(), token.span().line(), location, table, token.value(),
                        "Unknown " + kind.name().toLowerCase()));
            }
        }

        private void referenceProperty(TmdlDocument doc, TmdlNode node, String key, IdentifierKind kind, String table) {
            Optional<TmdlProperty> property = node.property(key);
            if (property.isEmpty() || property.get().references().isEmpty()) {
                return;
            }
            TmdlNameToken token = property.get().references().get(0);
            if (table == null) {
                issues.add(ResolutionIssue.unresolved(doc.path(), property.get().line(), node.keyword() + "." + key,
                        null, token.value(), "Owning table is unknown"));
                return;
            }
            memberReference(doc, token, kind, table, node.keyword() + "." + key);
        }

        /**
         * Конец связи: {@code fromTable: Sales} и {@code fromColumn: Sales.CustomerId}
         * (или {@code fromColumn: CustomerId} при наличии fromTable).
         */
        private void relationshipEnd(TmdlDocument doc, TmdlNode node, String tableKey, String columnKey) {
            Optional<TmdlProperty> tableProperty = node.property(tableKey);
            String tableName = null;
            if (tableProperty.isPresent() && !tableProperty.get().references().isEmpty()) {
                TmdlNameToken tableToken = tableProperty.get().references().get(0);
                tableReference(doc, tableToken, node.keyword() + "." + tableKey);
                tableName = tableToken.value();
            }
            Optional<TmdlProperty> columnProperty = node.property(columnKey);
            if (columnProperty.isEmpty() || columnProperty.get().references().isEmpty()) {
                return;
            }
            List<TmdlNameToken> segments = columnProperty.get().references();
            String location = node.keyword() + "." + columnKey;
            if (segments.size() == 2) {
                tableReference(doc, segments.get(0), location);
                memberReference(doc, segments.get(1), IdentifierKind.COLUMN, segments.get(0).value(), location);
            } else if (tableName != null) {
                memberReference(doc, segments.get(0), IdentifierKind.COLUMN, tableName, location);
            } else {
                issues.add(ResolutionIssue.unresolved(doc.path(), columnProperty.get().line(), location,
                        null, segments.get(0).value(), "Column without table"));
            }
        }

        private ReferenceOccurrence tmdlOccurrence(TmdlDocument doc, TmdlNameToken token, IdentifierKey target) {
            SyntacticForm form = token.quoted() ? SyntacticForm.QUOTED_REFERENCE : SyntacticForm.BARE_REFERENCE;
            return new ReferenceOccurrence(doc.path(), token.span(), target, form, NameEncoding.TMDL_NAME, null,
                    token.span().slice(doc.source()));
        }

        // ============ Report ============

        void resolveReport(BindingDocument doc) {
            ShapeScan scan = shapes.scan(doc);
            issues.addAll(scan.issues());
            for (BindingReference reference : scan.references()) {
                switch (reference.shape()) {
                    case QUERY_REF -> queryRef(doc, reference);
                    case NATIVE_QUERY_REF -> nativeQueryRef(reference);
                    default -> {
                        if (reference.isTableReference()) {
                            bindingTable(doc, reference, reference.start(), reference.end(), reference.table());
                        } else {
                            bindingMember(doc, reference);
                        }
                    }
                }
            }
        }

        private void bindingTable(BindingDocument doc, BindingReference reference, int start, int end, String tableName) {
            Optional<ModelIdentifier> table = symbols.table(tableName);
            if (table.isPresent()) {
                add(jsonOccurrence(reference, start, end, table.get().key()));
            } else {
                issues.add(ResolutionIssue.unresolved(doc.file(), reference.token().line(), reference.token().path(),
                        tableName, null, "Unknown table in " + reference.shape()));
            }
        }

        private void bindingMember(BindingDocument doc, BindingReference reference) {
            List<ModelIdentifier> candidates = switch (reference.hint()) {
                case COLUMN -> symbols.column(reference.table(), reference.member()).map(List::of).orElse(List.of());
                case MEASURE -> symbols.measure(reference.table(), reference.member()).map(List::of).orElse(List.of());
                case ANY -> symbols.members(reference.table(), reference.member());
            };
            if (candidates.size() == 1) {
                add(jsonOccurrence(reference, reference.start(), reference.end(), candidates.get(0).key()));
            } else if (candidates.isEmpty()) {
                issues.add(ResolutionIssue.unresolved(doc.file(), reference.token().line(), reference.token().path(),
                        reference.table(), reference.member(), "Unknown " + reference.hint().name().toLowerCase() + " in " + reference.shape()));
            } else {
                issues.add(ResolutionIssue.ambiguous(doc.file(), reference.token().line(), reference.token().path(),
                        reference.table(), reference.member(), candidates.stream().map(ModelIdentifier::key).toList()));
            }
        }

        /**
         * {@code Table.Member}: точка разделения выбирается так, чтобы слева была объявленная
         * таблица, а справа ее колонка или мера.
         */
        private void queryRef(BindingDocument doc, BindingReference reference) {
            String text = reference.text();
            List<int[]> matches = new ArrayList<>();
            int longestTablePrefix = -1;
            for (int dot = text.indexOf('.'); dot > 0; dot = text.indexOf('.', dot + 1)) {
                String table = text.substring(0, dot);
                if (symbols.table(table).isEmpty()) {
                    continue;
                }
                longestTablePrefix = dot;
                List<ModelIdentifier> members = symbols.members(table, text.substring(dot + 1));
                if (members.size() == 1) {
                    matches.add(new int[]{dot});
                }
            }
            String location = reference.token().path();
            int line = reference.token().line();
            if (matches.size() == 1) {
                int dot = matches.get(0)[0];
                String table = text.substring(0, dot);
                ModelIdentifier member = symbols.members(table, text.substring(dot + 1)).get(0);
                add(jsonOccurrence(reference, reference.start(), reference.start() + dot, IdentifierKey.table(table)));
                add(jsonOccurrence(reference, reference.start() + dot + 1, reference.end(), member.key()));
            } else if (matches.size() > 1) {
                issues.add(ResolutionIssue.ambiguous(doc.file(), line, location, null, text, List.of()));
            } else if (longestTablePrefix > 0) {
                // Таблица известна, член нет (уровень иерархии, вариация): ссылку на таблицу все равно учитываем
                String table = text.substring(0, longestTablePrefix);
                add(jsonOccurrence(reference, reference.start(), reference.start() + longestTablePrefix, IdentifierKey.table(table)));
                issues.add(ResolutionIssue.unresolved(doc.file(), line, location, table,
                        text.substring(longestTablePrefix + 1), "Unknown member in " + reference.shape()));
            } else {
                int dot = text.indexOf('.');
                issues.add(ResolutionIssue.unresolved(doc.file(), line, location, text.substring(0, dot),
                        text.substring(dot + 1), "Unknown table in " + reference.shape()));
            }
        }

        private void nativeQueryRef(BindingReference reference) {
            BindingReference companion = reference.companion();
            String text = companion.text();
            for (int dot = text.indexOf('.'); dot > 0; dot = text.indexOf('.', dot + 1)) {
                String table = text.substring(0, dot);
                List<ModelIdentifier> members = symbols.table(table).isPresent()
                        ? symbols.members(table, text.substring(dot + 1))
                        : List.of();
                if (members.size() == 1 && members.get(0).name().equalsIgnoreCase(reference.token().value())) {
                    add(jsonOccurrence(reference, reference.start(), reference.end(), members.get(0).key()));
                    return;
                }
            }
        }

        private ReferenceOccurrence jsonOccurrence(BindingReference reference, int start, int end, IdentifierKey target) {
            SourceSpan span = new SourceSpan(start, end, reference.token().line(), reference.token().column());
            return new ReferenceOccurrence(reference.token().owner().file(), span, target, SyntacticForm.BINDING_FIELD,
                    NameEncoding.JSON_SEGMENT, reference.token(), reference.token().value().substring(start, end));
        }
    }
}
