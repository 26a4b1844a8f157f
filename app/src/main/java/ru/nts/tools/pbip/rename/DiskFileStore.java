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

import ru.nts.tools.pbip.core.FileUtils;

import java.io.IOException;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;

/**
 * Файловая система с повторными попытками и записью через Safe Swap.
 */
public class DiskFileStore implements FileStore {

    @Override
    public byte[] read(Path path) throws IOException {
        return FileUtils.safeReadAllBytes(path);
    }

    @Override
    public void write(Path path, byte[] bytes) throws IOException {
        FileUtils.safeWrite(path, bytes);
    }

    @Override
    public void copy(Path source, Path target) throws IOException {
        FileUtils.ensureParentExists(target);
        FileUtils.safeCopy(source, target, StandardCopyOption.REPLACE_EXISTING, StandardCopyOption.COPY_ATTRIBUTES);
    }
}
