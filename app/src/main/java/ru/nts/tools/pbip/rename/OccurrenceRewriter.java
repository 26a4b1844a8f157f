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
import ru.nts.tools.pbip.core.TextEdit;
import ru.nts.tools.pbip.graph.DependencyGraph;
import ru.nts.tools.pbip.graph.IdentifierKey;
import ru.nts.tools.pbip.graph.ReferenceOccurrence;
import ru.nts.tools.pbip.report.BindingDocument;
import ru.nts.tools.pbip.report.JsonStringToken;
import ru.nts.tools.pbip.tmdl.TmdlDocument;

import java.nio.file.Path;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.IdentityHashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Применяет одну фазу подстановки к текстам файлов в памяти.
 *
 * <p>TMDL правится заменой фрагментов по смещениям. В JSON правится декодированное значение
 * строки, после чего строка кодируется заново целиком; строки со встроенным JSON
 * пересобираются от самых глубоких документов к корню.
 */
public class OccurrenceRewriter {

    private static final Logger log = LoggerFactory.getLogger(OccurrenceRewriter.class);

    /**
     * Результат фазы.
     *
     * @param texts  Новые тексты измененных файлов.
     * @param counts Количество перезаписанных мест по файлам.
     */
    public record RewriteResult(Map<Path, String> texts, Map<Path, Integer> counts) {

        public int total() {
            return counts.values().stream().mapToInt(Integer::intValue).sum();
        }
    }

    public RewriteResult rewrite(DependencyGraph graph, Map<IdentifierKey, String> renames) {
        Map<Path, List<TextEdit>> modelEdits = new LinkedHashMap<>();
        Map<JsonStringToken, List<TextEdit>> tokenEdits = new IdentityHashMap<>();
        Map<Path, Integer> counts = new LinkedHashMap<>();

        for (Map.Entry<IdentifierKey, String> rename : renames.entrySet()) {
            for (ReferenceOccurrence occurrence : graph.referencedBy(rename.getKey())) {
                TextEdit edit = occurrence.renameTo(rename.getValue());
                if (occurrence.hostToken() != null) {
                    tokenEdits.computeIfAbsent(occurrence.hostToken(), t -> new ArrayList<>()).add(edit);
                } else {
                    modelEdits.computeIfAbsent(occurrence.file(), f -> new ArrayList<>()).add(edit);
                }
                counts.merge(occurrence.file(), 1, Integer::sum);
            }
        }

        Map<Path, String> texts = new LinkedHashMap<>();
        modelEdits.forEach((path, edits) -> {
            TmdlDocument document = graph.modelDocuments().get(path);
            texts.put(path, document.write(edits));
        });
        texts.putAll(rewriteReports(tokenEdits));

        log.debug("Rewrote {} occurrence(s) in {} file(s)", counts.values().stream().mapToInt(Integer::intValue).sum(), texts.size());
        return new RewriteResult(texts, counts);
    }

    private static Map<Path, String> rewriteReports(Map<JsonStringToken, List<TextEdit>> tokenEdits) {
        Map<JsonStringToken, String> values = new IdentityHashMap<>();
        Map<BindingDocument, Boolean> dirty = new IdentityHashMap<>();
        for (Map.Entry<JsonStringToken, List<TextEdit>> entry : tokenEdits.entrySet()) {
            JsonStringToken token = entry.getKey();
            values.put(token, TextEdit.applyAll(token.value(), entry.getValue()));
            markDirty(token.owner(), dirty);
        }

        List<BindingDocument> documents = new ArrayList<>(dirty.keySet());
        documents.sort(Comparator.comparingInt(BindingDocument::depth).reversed());

        Map<Path, String> texts = new LinkedHashMap<>();
        for (BindingDocument document : documents) {
            String written = document.write(values);
            if (document.parentToken() != null) {
                values.put(document.parentToken(), written);
            } else {
                texts.put(document.file(), written);
            }
        }
        return texts;
    }

    private static void markDirty(BindingDocument document, Map<BindingDocument, Boolean> dirty) {
        for (BindingDocument current = document; current != null;
             current = current.parentToken() != null ? current.parentToken().owner() : null) {
            dirty.put(current, Boolean.TRUE);
        }
    }
}
