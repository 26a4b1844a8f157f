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
package ru.nts.tools.pbip.core;

import java.nio.file.Path;
import java.time.LocalDateTime;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Отслеживает изменения файлов, сделанные вне движка.
 *
 * <p>При построении графа для каждого файла регистрируется снапшот (CRC32C байтов).
 * Перед записью координатор сверяет текущую CRC с зарегистрированной: расхождение
 * означает, что файл изменили после сканирования.
 */
public class ExternalChangeTracker {

    /**
     * Снапшот файла на момент чтения.
     *
     * @param path      Абсолютный нормализованный путь.
     * @param crc32c    Контрольная сумма байтов.
     * @param size      Размер в байтах.
     * @param timestamp Время регистрации.
     */
    public record FileSnapshot(Path path, long crc32c, long size, LocalDateTime timestamp) {

        public boolean isChanged(long currentCrc) {
            return this.crc32c != currentCrc;
        }
    }

    /**
     * Результат проверки файла.
     */
    public record ExternalChangeResult(boolean hasExternalChange, FileSnapshot previousSnapshot,
                                       long currentCrc, String changeDescription) {

        public static ExternalChangeResult noChange() {
            return new ExternalChangeResult(false, null, 0, null);
        }

        public static ExternalChangeResult detected(FileSnapshot previous, long currentCrc) {
            String desc = String.format("External modification detected: %s (CRC: %X -> %X)",
                    previous.path().getFileName(), previous.crc32c(), currentCrc);
            return new ExternalChangeResult(true, previous, currentCrc, desc);
        }
    }

    private final Map<Path, FileSnapshot> snapshots = new ConcurrentHashMap<>();

    public void registerSnapshot(Path path, long crc32c, long size) {
        Path absPath = path.toAbsolutePath().normalize();
        snapshots.put(absPath, new FileSnapshot(absPath, crc32c, size, LocalDateTime.now()));
    }

    /**
     * Сравнивает текущую CRC файла со снапшотом.
     * Файл без снапшота считается неизмененным.
     */
    public ExternalChangeResult checkForExternalChange(Path path, long currentCrc) {
        FileSnapshot previous = snapshots.get(path.toAbsolutePath().normalize());
        if (previous == null || !previous.isChanged(currentCrc)) {
            return ExternalChangeResult.noChange();
        }
        return ExternalChangeResult.detected(previous, currentCrc);
    }

    public int getTrackedFilesCount() {
        return snapshots.size();
    }
}
