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
package ru.nts.tools.pbip.tools;

import ru.nts.tools.pbip.core.PbipException;
import ru.nts.tools.pbip.core.PbipSettings;
import ru.nts.tools.pbip.rename.PbipRenameEngine;

import java.nio.file.Path;
import java.util.HashMap;
import java.util.Map;

/**
 * Открытые движки по пути проекта. Сохраняет кеш графа между вызовами инструментов
 * (сканирование и последующее применение не разбирают проект дважды).
 */
public class ProjectEngines {

    private final PbipSettings settings;
    private final Map<Path, PbipRenameEngine> engines = new HashMap<>();

    public ProjectEngines(PbipSettings settings) {
        this.settings = settings;
    }

    public synchronized PbipRenameEngine get(String projectPath) throws PbipException {
        if (projectPath == null || projectPath.isBlank()) {
            throw new IllegalArgumentException("projectPath is required");
        }
        Path key = Path.of(projectPath).toAbsolutePath().normalize();
        PbipRenameEngine engine = engines.get(key);
        if (engine == null) {
            engine = PbipRenameEngine.open(key, settings);
            engines.put(key, engine);
        }
        return engine;
    }

    public PbipSettings getSettings() {
        return settings;
    }
}
