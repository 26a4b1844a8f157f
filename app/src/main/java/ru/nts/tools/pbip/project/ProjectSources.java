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
package ru.nts.tools.pbip.project;

import java.io.IOException;
import java.nio.file.Path;
import java.util.Collection;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.stream.Collectors;

/**
 * Упорядоченный набор файлов проекта. Порядок фиксирован: сначала файлы модели,
 * затем файлы отчета, внутри семейства по пути.
 *
 * <p>Набор может отражать диск или staged-состояние: {@link #withTexts(Map)}
 * возвращает новый набор с замененным содержимым, не трогая файлы.
 */
public final class ProjectSources {

    private final PbipProject project;
    private final Map<Path, SourceFile> files;
    private final boolean staged;

    public ProjectSources(PbipProject project, List<SourceFile> files) {
        this(project, toMap(files), false);
    }

    private ProjectSources(PbipProject project, Map<Path, SourceFile> files, boolean staged) {
        this.project = project;
        this.files = Collections.unmodifiableMap(files);
        this.staged = staged;
    }

    private static Map<Path, SourceFile> toMap(List<SourceFile> files) {
        Map<Path, SourceFile> map = new LinkedHashMap<>();
        files.stream()
                .sorted((a, b) -> {
                    int byFamily = a.family().compareTo(b.family());
                    return byFamily != 0 ? byFamily : a.path().compareTo(b.path());
                })
                .forEach(f -> map.put(f.path(), f));
        return map;
    }

    public PbipProject project() {
        return project;
    }

    public Collection<SourceFile> files() {
        return files.values();
    }

    public List<SourceFile> files(FileFamily family) {
        return files.values().stream().filter(f -> f.family() == family).collect(Collectors.toList());
    }

    public SourceFile get(Path path) {
        SourceFile file = files.get(path);
        if (file == null) {
            throw new IllegalArgumentException("File is not part of the project: " + path);
        }
        return file;
    }

    public int size() {
        return files.size();
    }

    public boolean isStaged() {
        return staged;
    }

    /**
     * Создает staged-набор, в котором указанные файлы имеют новый текст.
     */
    public ProjectSources withTexts(Map<Path, String> texts) throws IOException {
        if (texts.isEmpty()) {
            return this;
        }
        Map<Path, SourceFile> copy = new LinkedHashMap<>(files);
        for (Map.Entry<Path, String> entry : texts.entrySet()) {
            copy.put(entry.getKey(), get(entry.getKey()).withText(entry.getValue()));
        }
        return new ProjectSources(project, copy, true);
    }
}
