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

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import ru.nts.tools.pbip.core.FileUtils;
import ru.nts.tools.pbip.core.PathSanitizer;
import ru.nts.tools.pbip.core.PbipErrorCode;
import ru.nts.tools.pbip.core.PbipException;
import ru.nts.tools.pbip.core.PbipSettings;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;
import java.util.function.Predicate;
import java.util.stream.Collectors;
import java.util.stream.Stream;

/**
 * Находит PBIP-проект и читает его файлы.
 *
 * <p>Модель: все *.tmdl и *.tmd внутри {@code <Name>.SemanticModel}. Отчет: {@code report.json}
 * в корне {@code <Name>.Report} и все *.json внутри {@code definition/}.
 * Служебные папки {@code .pbi} не читаются.
 */
public class ProjectLoader {

    private static final Logger log = LoggerFactory.getLogger(ProjectLoader.class);

    public static final String SEMANTIC_MODEL_SUFFIX = ".SemanticModel";
    public static final String REPORT_SUFFIX = ".Report";

    private final PbipSettings settings;

    public ProjectLoader(PbipSettings settings) {
        this.settings = settings;
    }

    /**
     * Определяет расположение проекта по пути к .pbip файлу или к папке проекта.
     *
     * @throws PbipException PROJECT_NOT_FOUND, если модель не найдена или неоднозначна.
     */
    public PbipProject locate(Path input) throws PbipException {
        Path path = input.toAbsolutePath().normalize();
        Optional<Path> pbipFile = Optional.empty();
        Path root;

        if (Files.isRegularFile(path) && path.getFileName().toString().toLowerCase(Locale.ROOT).endsWith(".pbip")) {
            pbipFile = Optional.of(path);
            root = path.getParent();
        } else if (Files.isDirectory(path) && path.getFileName() != null
                && path.getFileName().toString().endsWith(SEMANTIC_MODEL_SUFFIX)) {
            root = path.getParent();
        } else if (Files.isDirectory(path)) {
            root = path;
        } else {
            throw new PbipException(PbipErrorCode.PROJECT_NOT_FOUND, "path", input.toString());
        }

        List<Path> models = listChildren(root, SEMANTIC_MODEL_SUFFIX);
        if (pbipFile.isEmpty()) {
            List<Path> pbips = listChildren(root, ".pbip");
            if (pbips.size() == 1) {
                pbipFile = Optional.of(pbips.get(0));
            }
        }

        Path model = selectModel(input, path, pbipFile, models);
        List<Path> reports = listChildren(root, REPORT_SUFFIX);

        PbipProject project = new PbipProject(root, pbipFile, model, reports);
        log.debug("Located project {} (model={}, reports={})", project.name(), model, reports.size());
        return project;
    }

    private Path selectModel(Path input, Path path, Optional<Path> pbipFile, List<Path> models) throws PbipException {
        if (path.getFileName() != null && path.getFileName().toString().endsWith(SEMANTIC_MODEL_SUFFIX)) {
            return path;
        }
        if (models.size() == 1) {
            return models.get(0);
        }
        if (pbipFile.isPresent()) {
            String base = pbipFile.get().getFileName().toString();
            base = base.substring(0, base.length() - ".pbip".length());
            for (Path model : models) {
                if (model.getFileName().toString().equalsIgnoreCase(base + SEMANTIC_MODEL_SUFFIX)) {
                    return model;
                }
            }
        }
        PbipException e = new PbipException(PbipErrorCode.PROJECT_NOT_FOUND,
                Map.of("path", input.toString(), "semanticModels", models.size()));
        models.forEach(e::addFile);
        if (models.size() > 1) {
            e.addSuggestion("Several *.SemanticModel folders found; pass the .pbip file or the model folder itself.");
        }
        throw e;
    }

    private List<Path> listChildren(Path root, String suffix) throws PbipException {
        try (Stream<Path> s = Files.list(root)) {
            return s.filter(p -> p.getFileName().toString().endsWith(suffix))
                    .sorted()
                    .collect(Collectors.toList());
        } catch (IOException e) {
            throw new PbipException(PbipErrorCode.FILE_NOT_READABLE, Map.of("file", root.toString()), e);
        }
    }

    /**
     * Читает все файлы модели и отчета проекта.
     */
    public ProjectSources load(PbipProject project) throws PbipException {
        List<SourceFile> files = new ArrayList<>();
        for (Path path : modelFiles(project)) {
            files.add(read(project, path, FileFamily.MODEL));
        }
        for (Path path : reportFiles(project)) {
            files.add(read(project, path, FileFamily.REPORT));
        }
        log.debug("Loaded {} files from {}", files.size(), project.root());
        return new ProjectSources(project, files);
    }

    /**
     * Список файлов модели проекта.
     */
    public List<Path> modelFiles(PbipProject project) throws PbipException {
        return walk(project.semanticModelDir(), p -> {
            String name = p.getFileName().toString().toLowerCase(Locale.ROOT);
            return name.endsWith(".tmdl") || name.endsWith(".tmd");
        });
    }

    /**
     * Список файлов отчета проекта.
     */
    public List<Path> reportFiles(PbipProject project) throws PbipException {
        List<Path> result = new ArrayList<>();
        for (Path reportDir : project.reportDirs()) {
            Path legacy = reportDir.resolve("report.json");
            if (Files.isRegularFile(legacy)) {
                result.add(legacy.toAbsolutePath().normalize());
            }
            Path definition = reportDir.resolve("definition");
            if (Files.isDirectory(definition)) {
                result.addAll(walk(definition, p -> p.getFileName().toString().toLowerCase(Locale.ROOT).endsWith(".json")));
            }
        }
        return result;
    }

    private List<Path> walk(Path dir, Predicate<Path> filter) throws PbipException {
        try (Stream<Path> s = Files.walk(dir)) {
            return s.filter(Files::isRegularFile)
                    .filter(p -> !isServicePath(dir, p))
                    .filter(filter)
                    .map(p -> p.toAbsolutePath().normalize())
                    .sorted()
                    .collect(Collectors.toList());
        } catch (IOException e) {
            throw new PbipException(PbipErrorCode.FILE_NOT_READABLE, Map.of("file", dir.toString()), e);
        }
    }

    private static boolean isServicePath(Path base, Path file) {
        for (Path part : base.relativize(file)) {
            if (part.toString().equals(".pbi")) {
                return true;
            }
        }
        return false;
    }

    private SourceFile read(PbipProject project, Path path, FileFamily family) throws PbipException {
        PathSanitizer.requireInside(project.root(), path);
        try {
            PathSanitizer.checkFileSize(path, settings.getMaxFileSizeBytes());
            return SourceFile.of(path, family, FileUtils.safeReadAllBytes(path));
        } catch (IOException e) {
            throw new PbipException(PbipErrorCode.FILE_NOT_READABLE,
                    Map.of("file", path.toString(), "reason", String.valueOf(e.getMessage())), e).addFile(path);
        }
    }
}
