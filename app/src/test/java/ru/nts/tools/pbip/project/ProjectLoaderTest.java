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

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;
import ru.nts.tools.pbip.TestProjects;
import ru.nts.tools.pbip.core.PbipErrorCode;
import ru.nts.tools.pbip.core.PbipException;
import ru.nts.tools.pbip.core.PbipSettings;

import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Тесты поиска проекта и чтения его файлов.
 */
class ProjectLoaderTest {

    @TempDir
    Path tempDir;

    private final ProjectLoader loader = new ProjectLoader(PbipSettings.defaults());

    @BeforeEach
    void setUp() throws Exception {
        TestProjects.createShop(tempDir);
    }

    // ===== Поиск проекта =====

    @Test
    void testLocate_ByPbipFile() throws Exception {
        PbipProject project = loader.locate(tempDir.resolve("Shop.pbip"));

        assertEquals("Shop", project.name());
        assertEquals(tempDir.resolve("Shop.pbip").toAbsolutePath().normalize(), project.pbipFile().orElseThrow());
        assertEquals(1, project.reportDirs().size());
    }

    @Test
    void testLocate_ByFolderAndModelFolder() throws Exception {
        PbipProject byRoot = loader.locate(tempDir);
        PbipProject byModel = loader.locate(tempDir.resolve("Shop.SemanticModel"));

        assertEquals(byRoot.semanticModelDir(), byModel.semanticModelDir());
        assertEquals(byRoot.root(), byModel.root());
    }

    @Test
    void testLocate_SeveralModelsChosenByPbipName() throws Exception {
        TestProjects.write(tempDir.resolve("Archive.SemanticModel/definition/model.tmdl"), "model Model\n");

        assertEquals("Shop", loader.locate(tempDir.resolve("Shop.pbip")).name());
        assertEquals("Archive", loader.locate(tempDir.resolve("Archive.SemanticModel")).name());
    }

    @Test
    void testLocate_SeveralModelsWithoutPbipFails() throws Exception {
        Files.delete(tempDir.resolve("Shop.pbip"));
        TestProjects.write(tempDir.resolve("Archive.SemanticModel/definition/model.tmdl"), "model Model\n");

        PbipException e = assertThrows(PbipException.class, () -> loader.locate(tempDir));
        assertEquals(PbipErrorCode.PROJECT_NOT_FOUND, e.getCode());
        assertEquals(2, e.getFiles().size());
    }

    @Test
    void testLocate_MissingPath() {
        PbipException e = assertThrows(PbipException.class, () -> loader.locate(tempDir.resolve("nowhere.pbip")));
        assertEquals(PbipErrorCode.PROJECT_NOT_FOUND, e.getCode());
    }

    // ===== Чтение файлов =====

    @Test
    void testLoad_ModelFilesFirstServiceFilesSkipped() throws Exception {
        TestProjects.write(tempDir.resolve("Shop.Report/definition/.pbi/cache.json"), "{}");
        TestProjects.write(tempDir.resolve("Shop.SemanticModel/definition/tables/notes.txt"), "not a model file");

        ProjectSources sources = loader.load(loader.locate(tempDir));

        List<SourceFile> model = sources.files(FileFamily.MODEL);
        List<SourceFile> report = sources.files(FileFamily.REPORT);
        assertEquals(4, model.size());
        assertEquals(3, report.size());
        assertTrue(report.stream().noneMatch(f -> f.path().toString().contains(".pbi")));
        assertEquals(FileFamily.MODEL, sources.files().iterator().next().family());
    }

    @Test
    void testLoad_FileTooLarge() throws Exception {
        ProjectLoader strict = new ProjectLoader(PbipSettings.builder().maxFileSizeBytes(64).build());

        PbipException e = assertThrows(PbipException.class, () -> strict.load(strict.locate(tempDir)));
        assertEquals(PbipErrorCode.FILE_TOO_LARGE, e.getCode());
        assertEquals(64L, e.getContext().get("maxAllowed"));
    }

    @Test
    void testWithTexts_OnlyChangedFilesDiffer() throws Exception {
        ProjectSources sources = loader.load(loader.locate(tempDir));
        Path sales = TestProjects.model(tempDir, "tables/Sales.tmdl").toAbsolutePath().normalize();
        Path customer = TestProjects.model(tempDir, "tables/Customer.tmdl").toAbsolutePath().normalize();

        ProjectSources staged = sources.withTexts(Map.of(
                sales, TestProjects.SALES_TMDL.replace("table Sales", "table Orders"),
                customer, TestProjects.CUSTOMER_TMDL));

        assertTrue(staged.isStaged());
        assertFalse(staged.get(sales).sameBytes(sources.get(sales)));
        assertSame(sources.get(customer), staged.get(customer));
        assertThrows(IllegalArgumentException.class, () -> staged.get(tempDir.resolve("other.tmdl")));
    }
}
