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
import ru.nts.tools.pbip.core.ExternalChangeTracker;
import ru.nts.tools.pbip.core.PbipException;
import ru.nts.tools.pbip.core.PbipSettings;
import ru.nts.tools.pbip.core.TextEdit;
import ru.nts.tools.pbip.dax.DaxQuoting;
import ru.nts.tools.pbip.graph.DependencyGraph;
import ru.nts.tools.pbip.graph.DependencyGraphBuilder;
import ru.nts.tools.pbip.graph.IdentifierKind;
import ru.nts.tools.pbip.graph.ModelIdentifier;
import ru.nts.tools.pbip.graph.ResolutionIssue;
import ru.nts.tools.pbip.project.FileFamily;
import ru.nts.tools.pbip.project.PbipProject;
import ru.nts.tools.pbip.project.ProjectLoader;
import ru.nts.tools.pbip.project.ProjectSources;
import ru.nts.tools.pbip.project.SourceFile;
import ru.nts.tools.pbip.tmdl.DaxExpressionSite;
import ru.nts.tools.pbip.tmdl.TmdlDiagnostic;
import ru.nts.tools.pbip.tmdl.TmdlDocument;
import ru.nts.tools.pbip.tmdl.TmdlLinter;

import java.nio.file.Path;
import java.util.ArrayList;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;

/**
 * Точка входа движка переименования для одного проекта.
 *
 * <p>Граф зависимостей кешируется между вызовами и переиспользуется, пока CRC32C файлов
 * на диске совпадают с зарегистрированными при построении. После коммита граф
 * инвалидируется и строится заново при следующем обращении.
 */
public class PbipRenameEngine {

    private static final Logger log = LoggerFactory.getLogger(PbipRenameEngine.class);

    private final PbipProject project;
    private final PbipSettings settings;
    private final ProjectLoader loader;
    private final DependencyGraphBuilder graphBuilder;
    private final ImpactScanner scanner;
    private final RenameTransactionCoordinator coordinator;
    private final ExternalChangeTracker changeTracker = new ExternalChangeTracker();
    private final TmdlLinter linter = new TmdlLinter();
    private DependencyGraph graph;

    public PbipRenameEngine(PbipProject project, PbipSettings settings, FileStore store) {
        this.project = project;
        this.settings = settings;
        this.loader = new ProjectLoader(settings);
        this.graphBuilder = new DependencyGraphBuilder(settings);
        this.scanner = new ImpactScanner(settings, graphBuilder);
        this.coordinator = new RenameTransactionCoordinator(settings, graphBuilder, store);
    }

    /**
     * Открывает проект по пути к .pbip файлу, папке проекта или папке *.SemanticModel.
     */
    public static PbipRenameEngine open(Path projectPath, PbipSettings settings) throws PbipException {
        PbipProject project = new ProjectLoader(settings).locate(projectPath);
        return new PbipRenameEngine(project, settings, new DiskFileStore());
    }

    public PbipProject getProject() {
        return project;
    }

    public PbipSettings getSettings() {
        return settings;
    }

    /**
     * Актуальный граф: кешированный, если ни один файл не менялся, иначе построенный заново.
     */
    public synchronized DependencyGraph graph() throws PbipException {
        ProjectSources sources = loader.load(project);
        if (graph != null && !graph.isInvalidated() && isUnchanged(sources)) {
            log.debug("Reusing dependency graph of {}", project.name());
            return graph;
        }
        graph = graphBuilder.build(sources);
        for (SourceFile file : sources.files()) {
            changeTracker.registerSnapshot(file.path(), file.crc32c(), file.bytes().length);
        }
        log.info("Dependency graph of {} built: {} file(s), {} identifier(s), {} reference(s)",
                project.name(), sources.size(), graph.symbols().size(), graph.occurrences().size());
        return graph;
    }

    private boolean isUnchanged(ProjectSources sources) {
        Set<Path> current = new HashSet<>();
        sources.files().forEach(f -> current.add(f.path()));
        if (!current.equals(graph.fingerprints().keySet())) {
            log.info("Project file set changed, rebuilding graph");
            return false;
        }
        for (SourceFile file : sources.files()) {
            ExternalChangeTracker.ExternalChangeResult change = changeTracker.checkForExternalChange(file.path(), file.crc32c());
            if (change.hasExternalChange()) {
                log.info("{}, rebuilding graph", change.changeDescription());
                return false;
            }
        }
        return true;
    }

    /**
     * Сухой прогон: файлы, количество мест, конфликты. Ничего не пишет.
     */
    public ImpactReport scanImpact(RenameRequest request) throws PbipException {
        return scanner.scan(graph(), request);
    }

    /**
     * Применяет пакет переименований целиком или не применяет ничего.
     */
    public synchronized CommitResult applyRename(RenameRequest request) throws PbipException {
        DependencyGraph current = graph();
        RenamePlan plan = scanner.plan(current, request);
        return coordinator.commit(plan, current);
    }

    /**
     * Проверка модели: имена с пробелами без кавычек и имена таблиц без кавычек в DAX.
     */
    public List<TmdlDiagnostic> validate() throws PbipException {
        DependencyGraph current = graph();
        List<String> tableNames = tableNames(current);
        List<TmdlDiagnostic> diagnostics = new ArrayList<>();
        for (TmdlDocument document : current.modelDocuments().values()) {
            diagnostics.addAll(linter.lint(document, tableNames));
        }
        return diagnostics;
    }

    /**
     * Берет в кавычки имена таблиц, записанные в DAX без них.
     *
     * @param dryRun только подсчитать исправления.
     */
    public synchronized QuotingFix fixDaxQuoting(boolean dryRun) throws PbipException {
        DependencyGraph current = graph();
        List<String> tableNames = tableNames(current);
        Map<Path, String> texts = new LinkedHashMap<>();
        Map<Path, Integer> fixes = new LinkedHashMap<>();

        for (TmdlDocument document : current.modelDocuments().values()) {
            List<TextEdit> edits = new ArrayList<>();
            for (DaxExpressionSite site : document.daxExpressions()) {
                String text = site.expression().text();
                int base = site.expression().span().start();
                for (DaxQuoting.UnquotedTable hit : DaxQuoting.findUnquotedTables(text, tableNames)) {
                    edits.add(new TextEdit(base + hit.start(), base + hit.end(),
                            DaxQuoting.quoteTable(text.substring(hit.start(), hit.end()))));
                }
            }
            if (!edits.isEmpty()) {
                texts.put(document.path(), document.write(edits));
                fixes.put(document.path(), edits.size());
            }
        }

        if (dryRun || texts.isEmpty()) {
            return new QuotingFix(fixes, false, Optional.empty());
        }
        CommitResult result = coordinator.commitTexts(current, texts, "quote table names in DAX");
        return new QuotingFix(fixes, true, Optional.of(result));
    }

    public ProjectInfo projectInfo() throws PbipException {
        DependencyGraph current = graph();
        int columns = 0;
        int measures = 0;
        for (ModelIdentifier id : current.symbols().all()) {
            if (id.kind() == IdentifierKind.COLUMN) {
                columns++;
            } else if (id.kind() == IdentifierKind.MEASURE) {
                measures++;
            }
        }
        Map<ResolutionIssue.IssueKind, Integer> issues = new LinkedHashMap<>();
        current.issues().forEach(i -> issues.merge(i.kind(), 1, Integer::sum));
        ProjectSources sources = current.sources();
        return new ProjectInfo(project.name(), project.root(), project.semanticModelDir(), project.reportDirs(),
                sources.files(FileFamily.MODEL).size(), sources.files(FileFamily.REPORT).size(),
                current.symbols().tables().size(), columns, measures, current.occurrences().size(),
                issues.getOrDefault(ResolutionIssue.IssueKind.UNRESOLVED, 0),
                issues.getOrDefault(ResolutionIssue.IssueKind.AMBIGUOUS, 0),
                issues.getOrDefault(ResolutionIssue.IssueKind.NOT_ANALYZABLE, 0));
    }

    private static List<String> tableNames(DependencyGraph graph) {
        return graph.symbols().tables().stream().map(ModelIdentifier::name).toList();
    }
}
