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
package ru.nts.tools.pbip.rename;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import ru.nts.tools.pbip.core.NameCollisionException;
import ru.nts.tools.pbip.core.PbipErrorCode;
import ru.nts.tools.pbip.core.PbipException;
import ru.nts.tools.pbip.core.PbipSettings;
import ru.nts.tools.pbip.core.UnresolvedReferenceException;
import ru.nts.tools.pbip.graph.DependencyGraph;
import ru.nts.tools.pbip.graph.DependencyGraphBuilder;
import ru.nts.tools.pbip.graph.IdentifierKey;
import ru.nts.tools.pbip.graph.IdentifierKind;
import ru.nts.tools.pbip.graph.ModelIdentifier;
import ru.nts.tools.pbip.graph.ModelSymbolTable;
import ru.nts.tools.pbip.graph.ReferenceOccurrence;
import ru.nts.tools.pbip.graph.ResolutionIssue;
import ru.nts.tools.pbip.project.SourceFile;
import ru.nts.tools.pbip.tmdl.TmdlNames;

import java.io.IOException;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.Collection;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.stream.Collectors;

/**
 * Анализ пакета переименований по графу зависимостей.
 *
 * <p>{@link #scan} выполняет сухой прогон и возвращает отчет даже при конфликтах.
 * {@link #plan} строит план для применения или бросает исключение, описывающее
 * первый вид найденных конфликтов (все конфликты этого вида перечислены в исключении).
 *
 * <p>Порядок подстановки: участники цепочек и циклов ({@code A->B, B->C}, {@code A<->B})
 * сначала получают временные имена, затем все переименования применяются второй фазой.
 */
public class ImpactScanner {

    private static final Logger log = LoggerFactory.getLogger(ImpactScanner.class);

    private final PbipSettings settings;
    private final DependencyGraphBuilder graphBuilder;
    private final OccurrenceRewriter rewriter = new OccurrenceRewriter();

    public ImpactScanner(PbipSettings settings) {
        this(settings, new DependencyGraphBuilder(settings));
    }

    /**
     * @param graphBuilder Используется, чтобы разобрать файлы в том виде, который они примут после
     *                     переименования, и найти ссылки, которые станут неразрешимыми.
     */
    public ImpactScanner(PbipSettings settings, DependencyGraphBuilder graphBuilder) {
        this.settings = settings;
        this.graphBuilder = graphBuilder;
    }

    /**
     * Сухой прогон: ничего не пишет, конфликты возвращает в отчете.
     */
    public ImpactReport scan(DependencyGraph graph, RenameRequest request) {
        return analyze(graph, request).report;
    }

    /**
     * Строит план применения.
     *
     * @throws PbipException INVALID_REQUEST, IDENTIFIER_NOT_FOUND, AMBIGUOUS_IDENTIFIER,
     *                       {@link NameCollisionException} или {@link UnresolvedReferenceException}.
     */
    public RenamePlan plan(DependencyGraph graph, RenameRequest request) throws PbipException {
        Analysis analysis = analyze(graph, request);
        if (analysis.report.blocked()) {
            throw toException(analysis.report.conflicts());
        }
        return analysis.plan;
    }

    private Analysis analyze(DependencyGraph graph, RenameRequest request) {
        ModelSymbolTable symbols = graph.symbols();
        List<Conflict> conflicts = new ArrayList<>();
        List<String> warnings = new ArrayList<>();

        if (request.mappings().isEmpty()) {
            conflicts.add(Conflict.of(Conflict.Type.INVALID_REQUEST, "No renames given"));
        }

        // 1. Сопоставление с объявлениями
        Map<IdentifierKey, ResolvedMapping> byKey = new LinkedHashMap<>();
        for (RenameMapping mapping : request.mappings()) {
            Optional<String> invalid = validateNewName(mapping.newName());
            if (invalid.isPresent()) {
                conflicts.add(Conflict.of(Conflict.Type.INVALID_REQUEST, invalid.get() + ": " + mapping, mapping.oldQualifiedName()));
                continue;
            }
            List<ModelIdentifier> candidates = candidates(symbols, mapping);
            if (candidates.isEmpty()) {
                conflicts.add(Conflict.of(Conflict.Type.IDENTIFIER_NOT_FOUND,
                        mapping.kind().name().toLowerCase() + " " + mapping.oldQualifiedName() + " is not declared in the model",
                        mapping.oldQualifiedName()));
                continue;
            }
            if (candidates.size() > 1) {
                conflicts.add(Conflict.of(Conflict.Type.AMBIGUOUS_IDENTIFIER, mapping.oldQualifiedName() + " matches "
                                + candidates.stream().map(ModelIdentifier::qualifiedName).collect(Collectors.joining(", ")),
                        mapping.oldQualifiedName()));
                continue;
            }
            ModelIdentifier source = candidates.get(0);
            if (byKey.containsKey(source.key())) {
                conflicts.add(Conflict.of(Conflict.Type.INVALID_REQUEST,
                        source.qualifiedName() + " is renamed more than once", source.qualifiedName()));
                continue;
            }
            if (source.name().equals(mapping.newName())) {
                warnings.add(source.qualifiedName() + " already has this name, skipped");
                continue;
            }
            byKey.put(source.key(), new ResolvedMapping(mapping, source, mapping.newName()));
        }
        List<ResolvedMapping> resolved = new ArrayList<>(byKey.values());

        // 2. Уникальность итоговых имен
        conflicts.addAll(collisions(symbols, byKey));

        // 3. Проблемные места, касающиеся переименований
        List<ResolutionIssue> excluded = new ArrayList<>();
        for (ResolutionIssue issue : graph.issues()) {
            if (!isRelevant(issue, resolved, symbols)) {
                continue;
            }
            boolean ambiguous = issue.kind() == ResolutionIssue.IssueKind.AMBIGUOUS;
            if (request.allowPartial() && !ambiguous) {
                excluded.add(issue);
                warnings.add("Excluded: " + issue);
            } else {
                conflicts.add(new Conflict(ambiguous ? Conflict.Type.AMBIGUOUS_REFERENCE : Conflict.Type.UNRESOLVED_REFERENCE,
                        issue.toString(), issue.file() != null ? List.of(issue.file()) : List.of(),
                        List.of(issue.spelled())));
            }
        }

        // 4. Ссылки, которые станут неразрешимыми или неоднозначными после переименования
        if (conflicts.isEmpty() && !resolved.isEmpty()) {
            predictIssues(graph, resolved, request.allowPartial(), conflicts, warnings);
        }

        // 5. Места для перезаписи
        List<ReferenceOccurrence> occurrences = new ArrayList<>();
        for (ResolvedMapping mapping : resolved) {
            occurrences.addAll(graph.referencedBy(mapping.key()));
        }
        Map<Path, Integer> counts = new LinkedHashMap<>();
        for (SourceFile file : graph.sources().files()) {
            counts.put(file.path(), 0);
        }
        occurrences.forEach(o -> counts.merge(o.file(), 1, Integer::sum));
        List<ImpactReport.FileImpact> files = new ArrayList<>();
        counts.forEach((path, count) -> {
            if (count > 0) {
                files.add(new ImpactReport.FileImpact(path, graph.sources().get(path).family(), count));
            }
        });

        ImpactReport report = new ImpactReport(resolved.stream().map(ResolvedMapping::describe).toList(),
                files, occurrences.size(), conflicts, warnings, excluded);
        log.info("Impact scan: {} rename(s), {} occurrence(s) in {} file(s), {} conflict(s)",
                resolved.size(), occurrences.size(), files.size(), conflicts.size());

        RenamePlan plan = report.blocked() ? null : buildPlan(request, symbols, resolved, occurrences, report);
        return new Analysis(report, plan);
    }

    // ============ Разбор старого имени ============

    private static List<ModelIdentifier> candidates(ModelSymbolTable symbols, RenameMapping mapping) {
        String old = mapping.oldQualifiedName().trim();
        IdentifierKind kind = mapping.kind();
        if (kind == IdentifierKind.TABLE) {
            return symbols.table(TmdlNames.unquote(old)).map(List::of).orElse(List.of());
        }

        Optional<String[]> bracketed = splitBracketed(old);
        if (bracketed.isPresent()) {
            String table = bracketed.get()[0];
            String member = bracketed.get()[1];
            return table == null ? modelWide(symbols, kind, member) : lookup(symbols, kind, table, member);
        }

        // Table.Member: имена таблиц могут содержать точки
        List<ModelIdentifier> result = new ArrayList<>();
        for (int dot = old.indexOf('.'); dot > 0; dot = old.indexOf('.', dot + 1)) {
            result.addAll(lookup(symbols, kind, TmdlNames.unquote(old.substring(0, dot)), old.substring(dot + 1)));
        }
        return result.isEmpty() ? modelWide(symbols, kind, old) : result;
    }

    /**
     * {@code 'Table'[Member]}, {@code Table[Member]} или {@code [Member]} (таблица {@code null}).
     */
    static Optional<String[]> splitBracketed(String text) {
        if (!text.endsWith("]")) {
            return Optional.empty();
        }
        int open;
        String table;
        if (text.startsWith("'")) {
            int close = 1;
            while (close < text.length()) {
                if (text.charAt(close) == '\'') {
                    if (close + 1 < text.length() && text.charAt(close + 1) == '\'') {
                        close += 2;
                        continue;
                    }
                    break;
                }
                close++;
            }
            if (close + 1 >= text.length() || text.charAt(close + 1) != '[') {
                return Optional.empty();
            }
            table = TmdlNames.unquote(text.substring(0, close + 1));
            open = close + 1;
        } else {
            open = text.indexOf('[');
            if (open < 0) {
                return Optional.empty();
            }
            String prefix = text.substring(0, open).trim();
            table = prefix.isEmpty() ? null : prefix;
        }
        String member = text.substring(open + 1, text.length() - 1).replace("]]", "]");
        return Optional.of(new String[]{table, member});
    }

    private static List<ModelIdentifier> lookup(ModelSymbolTable symbols, IdentifierKind kind, String table, String member) {
        Optional<ModelIdentifier> found = kind == IdentifierKind.COLUMN
                ? symbols.column(table, member)
                : symbols.measure(table, member);
        return found.map(List::of).orElse(List.of());
    }

    private static List<ModelIdentifier> modelWide(ModelSymbolTable symbols, IdentifierKind kind, String name) {
        return kind == IdentifierKind.MEASURE ? symbols.measuresNamed(name) : symbols.columnsNamed(name);
    }

    private Optional<String> validateNewName(String name) {
        if (name.isBlank()) {
            return Optional.of("New name is blank");
        }
        if (name.indexOf('\n') >= 0 || name.indexOf('\r') >= 0) {
            return Optional.of("New name contains a line break");
        }
        if (!name.equals(name.strip())) {
            return Optional.of("New name has leading or trailing whitespace");
        }
        if (IdentifierKey.fold(name).startsWith(IdentifierKey.fold(settings.getPlaceholderPrefix()))) {
            return Optional.of("New name uses the reserved prefix " + settings.getPlaceholderPrefix());
        }
        return Optional.empty();
    }

    // ============ Коллизии ============

    private static List<Conflict> collisions(ModelSymbolTable symbols, Map<IdentifierKey, ResolvedMapping> byKey) {
        List<Conflict> conflicts = new ArrayList<>();
        if (byKey.isEmpty()) {
            return conflicts;
        }
        collide("project tables", symbols.tables(), byKey, conflicts);
        List<ModelIdentifier> measures = new ArrayList<>();
        for (ModelIdentifier table : symbols.tables()) {
            List<ModelIdentifier> members = symbols.members(table.name());
            collide("table " + table.qualifiedName(), members, byKey, conflicts);
            members.stream().filter(m -> m.kind() == IdentifierKind.MEASURE).forEach(measures::add);
        }
        // Голые [Мера] разрешаются по всей модели
        List<Conflict> modelWide = new ArrayList<>();
        collide("model measures", measures, byKey, modelWide);
        for (Conflict conflict : modelWide) {
            if (!conflicts.contains(conflict)) {
                conflicts.add(conflict);
            }
        }
        return conflicts;
    }

    private static void collide(String scope, Collection<ModelIdentifier> identifiers,
                                Map<IdentifierKey, ResolvedMapping> byKey, List<Conflict> out) {
        Map<String, List<ModelIdentifier>> groups = new LinkedHashMap<>();
        for (ModelIdentifier id : identifiers) {
            groups.computeIfAbsent(IdentifierKey.fold(finalName(id, byKey)), k -> new ArrayList<>()).add(id);
        }
        for (Map.Entry<String, List<ModelIdentifier>> group : groups.entrySet()) {
            List<ModelIdentifier> ids = group.getValue();
            if (ids.size() < 2 || ids.stream().noneMatch(id -> byKey.containsKey(id.key()))) {
                continue;
            }
            // Коллизия внутри одной таблицы уже отчитана в области таблицы
            if (scope.equals("model measures") && ids.stream().map(id -> IdentifierKey.fold(id.tableName())).distinct().count() == 1) {
                continue;
            }
            String names = ids.stream()
                    .map(id -> byKey.containsKey(id.key()) ? id.qualifiedName() + " -> " + finalName(id, byKey) : id.qualifiedName())
                    .collect(Collectors.joining(", "));
            Set<Path> files = new LinkedHashSet<>();
            ids.forEach(id -> files.add(id.file()));
            out.add(new Conflict(Conflict.Type.NAME_COLLISION,
                    "Name '" + finalName(ids.get(0), byKey) + "' is not unique in " + scope + ": " + names,
                    new ArrayList<>(files), ids.stream().map(ModelIdentifier::qualifiedName).toList()));
        }
    }

    private static String finalName(ModelIdentifier id, Map<IdentifierKey, ResolvedMapping> byKey) {
        ResolvedMapping mapping = byKey.get(id.key());
        return mapping != null ? mapping.newName() : id.name();
    }

    // ============ Проблемные места ============

    /**
     * Проблемное место касается пакета, если в нем написано старое или новое имя переименуемого
     * идентификатора или если переименуемый идентификатор среди его кандидатов.
     */
    private static boolean isRelevant(ResolutionIssue issue, List<ResolvedMapping> mappings, ModelSymbolTable symbols) {
        for (ResolvedMapping mapping : mappings) {
            if (issue.candidates().contains(mapping.key())) {
                return true;
            }
            if (issue.kind() == ResolutionIssue.IssueKind.NOT_ANALYZABLE) {
                String text = issue.spelledMember() == null ? "" : IdentifierKey.fold(issue.spelledMember());
                if (text.contains(IdentifierKey.fold(mapping.oldName()))) {
                    return true;
                }
                continue;
            }
            if (mapping.kind() == IdentifierKind.TABLE) {
                // Если часть-таблица разрешилась, проблема в члене таблицы, а не в ней самой
                if (matches(issue.spelledTable(), mapping)
                        && (issue.spelledMember() == null || symbols.table(issue.spelledTable()).isEmpty())) {
                    return true;
                }
            } else if (matches(issue.spelledMember(), mapping)
                    && (issue.spelledTable() == null
                    || IdentifierKey.fold(issue.spelledTable()).equals(IdentifierKey.fold(mapping.source().tableName())))) {
                return true;
            }
        }
        return false;
    }

    /**
     * Переписывает файлы в памяти сразу в итоговые имена, разбирает результат и сравнивает
     * проблемные места с исходным графом. Новая голая ссылка {@code [Name]} становится
     * неоднозначной, если переименование дало ее имя мере, а в таблице уже есть такая колонка.
     */
    private void predictIssues(DependencyGraph graph, List<ResolvedMapping> resolved, boolean allowPartial,
                               List<Conflict> conflicts, List<String> warnings) {
        Map<IdentifierKey, String> finalNames = new LinkedHashMap<>();
        resolved.forEach(m -> finalNames.put(m.key(), m.newName()));
        Map<Path, String> texts = rewriter.rewrite(graph, finalNames).texts();

        DependencyGraph predicted;
        try {
            predicted = graphBuilder.build(graph.sources().withTexts(texts));
        } catch (IOException e) {
            conflicts.add(new Conflict(Conflict.Type.INVALID_REQUEST,
                    "New names cannot be encoded in the file charset: " + e.getMessage(),
                    new ArrayList<>(texts.keySet()), List.of()));
            return;
        } catch (PbipException e) {
            conflicts.add(new Conflict(Conflict.Type.INVALID_REQUEST,
                    "Renamed files do not parse: " + e.getMessage(), e.getFiles(), e.getIdentifiers()));
            return;
        }

        for (ResolutionIssue issue : ResolutionIssue.introduced(graph.issues(), predicted.issues())) {
            boolean ambiguous = issue.kind() == ResolutionIssue.IssueKind.AMBIGUOUS;
            String message = "After rename: " + issue;
            if (allowPartial && !ambiguous) {
                warnings.add(message);
                continue;
            }
            List<String> identifiers = new ArrayList<>();
            identifiers.add(issue.spelled());
            for (IdentifierKey key : issue.candidates()) {
                identifiers.add(predicted.symbols().get(key).map(ModelIdentifier::qualifiedName).orElse(key.toString()));
            }
            conflicts.add(new Conflict(ambiguous ? Conflict.Type.AMBIGUOUS_REFERENCE : Conflict.Type.UNRESOLVED_REFERENCE,
                    message, issue.file() != null ? List.of(issue.file()) : List.of(), identifiers));
        }
    }

    private static boolean matches(String spelled, ResolvedMapping mapping) {
        return spelled != null && (spelled.equalsIgnoreCase(mapping.oldName()) || spelled.equalsIgnoreCase(mapping.newName()));
    }

    // ============ План ============

    private RenamePlan buildPlan(RenameRequest request, ModelSymbolTable symbols, List<ResolvedMapping> resolved,
                                 List<ReferenceOccurrence> occurrences, ImpactReport report) {
        Set<String> taken = new LinkedHashSet<>();
        symbols.all().forEach(id -> taken.add(id.name()));
        resolved.forEach(m -> taken.add(m.newName()));
        PlaceholderAllocator allocator = new PlaceholderAllocator(settings.getPlaceholderPrefix(), taken);

        Map<IdentifierKey, String> placeholderNames = new LinkedHashMap<>();
        for (ResolvedMapping mapping : resolved) {
            if (isChainMember(mapping, resolved)) {
                placeholderNames.put(mapping.key(), allocator.next());
            }
        }

        Map<IdentifierKey, String> tableRenames = new LinkedHashMap<>();
        resolved.stream().filter(m -> m.kind() == IdentifierKind.TABLE).forEach(m -> tableRenames.put(m.key(), m.newName()));

        Map<IdentifierKey, String> finalPhase = new LinkedHashMap<>();
        Map<IdentifierKey, IdentifierKey> finalKeys = new LinkedHashMap<>();
        for (ResolvedMapping mapping : resolved) {
            ModelIdentifier source = mapping.source();
            String intermediateName = placeholderNames.getOrDefault(mapping.key(), source.name());
            if (mapping.kind() == IdentifierKind.TABLE) {
                finalPhase.put(IdentifierKey.table(intermediateName), mapping.newName());
                finalKeys.put(mapping.key(), IdentifierKey.table(mapping.newName()));
            } else {
                IdentifierKey tableKey = mapping.key().tableKey();
                String intermediateTable = placeholderNames.getOrDefault(tableKey, source.tableName());
                String finalTable = tableRenames.getOrDefault(tableKey, source.tableName());
                finalPhase.put(IdentifierKey.of(mapping.kind(), intermediateTable, intermediateName), mapping.newName());
                finalKeys.put(mapping.key(), IdentifierKey.of(mapping.kind(), finalTable, mapping.newName()));
            }
        }

        List<SubstitutionPhase> phases = new ArrayList<>();
        if (!placeholderNames.isEmpty()) {
            phases.add(new SubstitutionPhase("placeholders", placeholderNames));
            log.debug("Chain or cycle detected, {} identifier(s) go through placeholders", placeholderNames.size());
        }
        phases.add(new SubstitutionPhase("final", finalPhase));
        return new RenamePlan(request, resolved, phases, occurrences, finalKeys, settings.getPlaceholderPrefix(), report);
    }

    /**
     * Новое имя совпадает со старым именем другого переименования в той же области.
     */
    private static boolean isChainMember(ResolvedMapping mapping, List<ResolvedMapping> all) {
        String target = IdentifierKey.fold(mapping.newName());
        for (ResolvedMapping other : all) {
            if (other != mapping && sameScope(mapping, other) && IdentifierKey.fold(other.oldName()).equals(target)) {
                return true;
            }
        }
        return false;
    }

    private static boolean sameScope(ResolvedMapping a, ResolvedMapping b) {
        if (a.kind() == IdentifierKind.TABLE || b.kind() == IdentifierKind.TABLE) {
            return a.kind() == b.kind();
        }
        boolean sameTable = a.key().table().equals(b.key().table());
        return sameTable || (a.kind() == IdentifierKind.MEASURE && b.kind() == IdentifierKind.MEASURE);
    }

    // ============ Исключения ============

    private static PbipException toException(List<Conflict> conflicts) {
        Conflict.Type type = conflicts.stream().map(Conflict::type).min(Enum::compareTo).orElseThrow();
        List<Conflict> ofType = conflicts.stream().filter(c -> c.type() == type).toList();
        PbipException exception = switch (type) {
            case INVALID_REQUEST -> new PbipException(PbipErrorCode.INVALID_REQUEST, "reason", ofType.get(0).message());
            case IDENTIFIER_NOT_FOUND -> new PbipException(PbipErrorCode.IDENTIFIER_NOT_FOUND, "identifier", ofType.get(0).identifiers().get(0));
            case AMBIGUOUS_IDENTIFIER -> new PbipException(PbipErrorCode.AMBIGUOUS_IDENTIFIER, "identifier", ofType.get(0).identifiers().get(0));
            case NAME_COLLISION -> new NameCollisionException(ofType.size());
            case UNRESOLVED_REFERENCE -> UnresolvedReferenceException.unresolved(ofType.size());
            case AMBIGUOUS_REFERENCE -> UnresolvedReferenceException.ambiguous(ofType.size());
        };
        for (Conflict conflict : ofType) {
            conflict.files().forEach(exception::addFile);
            conflict.identifiers().forEach(exception::addIdentifier);
            exception.addSuggestion(conflict.message());
        }
        return exception;
    }

    private record Analysis(ImpactReport report, RenamePlan plan) {
    }
}
