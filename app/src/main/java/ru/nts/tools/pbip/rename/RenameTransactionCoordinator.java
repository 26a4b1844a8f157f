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
import ru.nts.tools.pbip.core.ExternalMutationException;
import ru.nts.tools.pbip.core.FileUtils;
import ru.nts.tools.pbip.core.PartialWriteException;
import ru.nts.tools.pbip.core.PbipErrorCode;
import ru.nts.tools.pbip.core.PbipException;
import ru.nts.tools.pbip.core.PbipSettings;
import ru.nts.tools.pbip.core.RollbackException;
import ru.nts.tools.pbip.graph.DependencyGraph;
import ru.nts.tools.pbip.graph.DependencyGraphBuilder;
import ru.nts.tools.pbip.graph.IdentifierKey;
import ru.nts.tools.pbip.graph.ResolutionIssue;
import ru.nts.tools.pbip.project.ProjectSources;
import ru.nts.tools.pbip.project.SourceFile;

import java.io.IOException;
import java.nio.file.NoSuchFileException;
import java.nio.file.Path;
import java.time.LocalDateTime;
import java.time.format.DateTimeFormatter;
import java.util.ArrayList;
import java.util.Collection;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Применяет план переименования как единое целое.
 *
 * <p>Последовательность: снимок затронутых файлов и сверка с отпечатками графа, подготовка
 * фаз в памяти с перестроением графа после каждой, проверка результата, резервная копия,
 * последовательная запись с повторной сверкой CRC32C перед каждым файлом. Любой сбой записи
 * восстанавливает уже записанные файлы из снимка.
 */
public class RenameTransactionCoordinator {

    private static final Logger log = LoggerFactory.getLogger(RenameTransactionCoordinator.class);
    private static final DateTimeFormatter BACKUP_STAMP = DateTimeFormatter.ofPattern("yyyyMMdd_HHmmss_SSS");

    private final PbipSettings settings;
    private final DependencyGraphBuilder graphBuilder;
    private final OccurrenceRewriter rewriter = new OccurrenceRewriter();
    private final FileStore store;

    public RenameTransactionCoordinator(PbipSettings settings, DependencyGraphBuilder graphBuilder, FileStore store) {
        this.settings = settings;
        this.graphBuilder = graphBuilder;
        this.store = store;
    }

    /**
     * Применяет план, построенный по {@code graph}. После успеха граф инвалидируется.
     *
     * @throws ExternalMutationException файл изменен на диске после построения графа.
     * @throws PartialWriteException     запись не удалась, все записанные файлы восстановлены.
     * @throws RollbackException         запись не удалась и восстановить удалось не все.
     * @throws PbipException             VALIDATION_FAILED, если подготовленный результат неконсистентен.
     */
    public CommitResult commit(RenamePlan plan, DependencyGraph graph) throws PbipException {
        TransactionLog tx = new TransactionLog(String.join(", ", plan.report().mappings()));
        tx.transition(RenameState.SCANNED);
        try {
            snapshot(tx, graph, plan.files());

            DependencyGraph current = graph;
            for (SubstitutionPhase phase : plan.phases()) {
                OccurrenceRewriter.RewriteResult result = rewriter.rewrite(current, phase.renames());
                log.debug("Phase '{}': {} occurrence(s) in {} file(s)", phase.name(), result.total(), result.texts().size());
                current = rebuild(current.sources(), result.texts(), phase.name());
            }
            tx.transition(RenameState.STAGED);

            validate(plan, graph, current);
            tx.transition(RenameState.VALIDATED);

            return flush(tx, graph, current.sources(), plan.report().mappings(), plan.occurrences().size(), plan.report());
        } catch (PbipException e) {
            if (tx.state() != RenameState.ROLLED_BACK) {
                tx.transition(RenameState.ROLLED_BACK);
            }
            throw e;
        }
    }

    /**
     * Записывает готовые тексты (например, исправление кавычек в DAX) по той же схеме.
     */
    public CommitResult commitTexts(DependencyGraph graph, Map<Path, String> texts, String description) throws PbipException {
        TransactionLog tx = new TransactionLog(description);
        tx.transition(RenameState.SCANNED);
        try {
            snapshot(tx, graph, texts.keySet());
            DependencyGraph staged = rebuild(graph.sources(), texts, description);
            tx.transition(RenameState.STAGED);

            List<ResolutionIssue> introduced = ResolutionIssue.introduced(graph.issues(), staged.issues());
            if (!introduced.isEmpty()) {
                throw introducedIssues("edit introduces " + introduced.size() + " unresolved or ambiguous reference(s)", introduced);
            }
            tx.transition(RenameState.VALIDATED);
            return flush(tx, graph, staged.sources(), List.of(description), texts.size(), null);
        } catch (PbipException e) {
            if (tx.state() != RenameState.ROLLED_BACK) {
                tx.transition(RenameState.ROLLED_BACK);
            }
            throw e;
        }
    }

    // ============ Снимки ============

    private void snapshot(TransactionLog tx, DependencyGraph graph, Collection<Path> files) throws PbipException {
        for (Path path : files) {
            if (tx.snapshotOf(path) != null) {
                continue;
            }
            long expected = graph.fingerprint(path);
            byte[] bytes;
            try {
                bytes = store.read(path);
            } catch (NoSuchFileException e) {
                throw new ExternalMutationException(path, expected, -1);
            } catch (IOException e) {
                throw new PbipException(PbipErrorCode.FILE_NOT_READABLE,
                        Map.of("file", path.toString()), e).addFile(path);
            }
            long crc = FileUtils.crc32c(bytes);
            if (crc != expected) {
                throw new ExternalMutationException(path, expected, crc);
            }
            tx.snapshot(path, bytes, crc);
        }
    }

    // ============ Подготовка и проверка ============

    private DependencyGraph rebuild(ProjectSources sources, Map<Path, String> texts, String stage) throws PbipException {
        ProjectSources staged;
        try {
            staged = sources.withTexts(texts);
        } catch (IOException e) {
            throw validationFailed(stage + ": new text cannot be encoded in the file charset", e);
        }
        try {
            return graphBuilder.build(staged);
        } catch (PbipException e) {
            PbipException failure = validationFailed(stage + ": staged files do not parse", e);
            e.getFiles().forEach(failure::addFile);
            throw failure;
        }
    }

    private void validate(RenamePlan plan, DependencyGraph original, DependencyGraph staged) throws PbipException {
        for (Map.Entry<IdentifierKey, IdentifierKey> entry : plan.finalKeys().entrySet()) {
            if (!staged.symbols().contains(entry.getValue())) {
                throw validationFailed(entry.getKey() + " is missing under its new name " + entry.getValue(), null)
                        .addIdentifier(entry.getValue().toString());
            }
        }

        String prefix = IdentifierKey.fold(plan.placeholderPrefix());
        for (SourceFile file : staged.sources().files()) {
            SourceFile before = original.sources().get(file.path());
            if (countOf(IdentifierKey.fold(file.text()), prefix) > countOf(IdentifierKey.fold(before.text()), prefix)) {
                throw validationFailed("temporary name left in " + file.path().getFileName(), null)
                        .addFile(file.path());
            }
        }

        // С allowPartial допустимы только новые неразрешенные места, неоднозначные запрещены всегда
        boolean allowPartial = plan.request().allowPartial();
        List<ResolutionIssue> introduced = ResolutionIssue.introduced(original.issues(), staged.issues());
        List<ResolutionIssue> refused = introduced.stream()
                .filter(i -> !allowPartial || i.kind() == ResolutionIssue.IssueKind.AMBIGUOUS)
                .toList();
        if (!refused.isEmpty()) {
            throw introducedIssues("rename introduces " + refused.size() + " unresolved or ambiguous reference(s)", refused);
        }
        if (!introduced.isEmpty()) {
            log.warn("Partial rename leaves {} more unresolved reference(s)", introduced.size());
        }
    }

    private static PbipException introducedIssues(String reason, List<ResolutionIssue> issues) {
        PbipException failure = validationFailed(reason, null);
        for (ResolutionIssue issue : issues) {
            failure.addFile(issue.file());
            failure.addIdentifier(issue.spelled());
            failure.addSuggestion(issue.toString());
        }
        return failure;
    }

    private static int countOf(String text, String needle) {
        int count = 0;
        for (int i = text.indexOf(needle); i >= 0; i = text.indexOf(needle, i + needle.length())) {
            count++;
        }
        return count;
    }

    private static PbipException validationFailed(String reason, Throwable cause) {
        Map<String, Object> context = new LinkedHashMap<>();
        context.put("reason", reason);
        return new PbipException(PbipErrorCode.VALIDATION_FAILED, context, cause);
    }

    // ============ Запись ============

    private CommitResult flush(TransactionLog tx, DependencyGraph graph, ProjectSources staged, List<String> mappings,
                               int occurrences, ImpactReport report) throws PbipException {
        List<Path> changed = new ArrayList<>();
        for (SourceFile file : graph.sources().files()) {
            SourceFile next = staged.get(file.path());
            if (!next.sameBytes(file)) {
                changed.add(file.path());
                tx.stage(file.path(), next.bytes());
            }
        }
        snapshot(tx, graph, changed);
        Optional<Path> backup = backup(graph, changed);

        for (Path path : changed) {
            TransactionLog.Snapshot snapshot = tx.snapshotOf(path);
            try {
                long current = FileUtils.crc32c(store.read(path));
                if (current != snapshot.crc32c()) {
                    throw new ExternalMutationException(path, snapshot.crc32c(), current);
                }
                store.write(path, tx.staged().get(path));
                tx.markWritten(path);
                log.debug("Written {}", path);
            } catch (NoSuchFileException e) {
                rollback(tx, e);
                throw new ExternalMutationException(path, snapshot.crc32c(), -1);
            } catch (ExternalMutationException e) {
                rollback(tx, e);
                throw e;
            } catch (IOException e) {
                int restored = rollback(tx, e);
                throw new PartialWriteException(path, restored, e);
            }
        }

        tx.transition(RenameState.COMMITTED);
        graph.invalidate();
        log.info("Committed {} file(s){}", changed.size(), backup.map(b -> ", backup in " + b).orElse(""));
        return new CommitResult(changed, mappings, occurrences, backup, report);
    }

    /**
     * Восстанавливает записанные файлы из снимков.
     *
     * @return количество восстановленных файлов.
     * @throws RollbackException если хотя бы один файл восстановить не удалось.
     */
    private int rollback(TransactionLog tx, Exception cause) throws RollbackException {
        List<Path> unrestored = new ArrayList<>();
        int restored = 0;
        for (Path path : tx.written()) {
            try {
                store.write(path, tx.snapshotOf(path).bytes());
                restored++;
            } catch (IOException e) {
                cause.addSuppressed(e);
                unrestored.add(path);
            }
        }
        tx.transition(RenameState.ROLLED_BACK);
        if (!unrestored.isEmpty()) {
            log.error("Rollback failed for {} file(s): {}", unrestored.size(), unrestored);
            throw new RollbackException(unrestored, cause);
        }
        log.warn("Commit aborted, restored {} file(s): {}", restored, cause.getMessage());
        return restored;
    }

    private Optional<Path> backup(DependencyGraph graph, List<Path> files) throws PbipException {
        Optional<Path> directory = settings.getBackupDirectory();
        if (directory.isEmpty() || files.isEmpty()) {
            return Optional.empty();
        }
        Path root = graph.sources().project().root();
        Path target = directory.get().resolve(graph.sources().project().name() + "_" + LocalDateTime.now().format(BACKUP_STAMP));
        for (Path file : files) {
            Path relative = file.startsWith(root) ? root.relativize(file) : file.getFileName();
            try {
                store.copy(file, target.resolve(relative.toString()));
            } catch (IOException e) {
                Map<String, Object> context = new LinkedHashMap<>();
                context.put("reason", "backup failed");
                context.put("file", file.toString());
                throw new PbipException(PbipErrorCode.INTERNAL_ERROR, context, e);
            }
        }
        log.info("Backup of {} file(s) written to {}", files.size(), target);
        return Optional.of(target);
    }
}
