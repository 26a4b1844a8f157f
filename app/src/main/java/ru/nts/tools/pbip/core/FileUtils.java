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

import java.io.IOException;
import java.nio.file.CopyOption;
import java.nio.file.FileSystemException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;
import java.nio.file.StandardOpenOption;
import java.util.concurrent.TimeUnit;
import java.util.zip.CRC32C;

/**
 * Утилиты для надежной работы с файловой системой.
 * Все операции записи выполняются через Safe Swap (tmp + old), чтение с повторами
 * при временной блокировке файла другим процессом.
 */
public class FileUtils {

    private static final int MAX_RETRIES = 5;
    private static final long INITIAL_BACKOFF = 50; // ms

    private FileUtils() {
    }

    /**
     * Выполняет IO-операцию с механизмом повторов.
     */
    public static <T> T executeWithRetry(IORunnable<T> action) throws IOException {
        FileSystemException lastException = null;
        for (int i = 0; i < MAX_RETRIES; i++) {
            try {
                return action.run();
            } catch (FileSystemException e) {
                lastException = e;
                long backoff = INITIAL_BACKOFF * (long) Math.pow(2, i);
                try {
                    TimeUnit.MILLISECONDS.sleep(backoff);
                } catch (InterruptedException ie) {
                    Thread.currentThread().interrupt();
                    throw new IOException("Retry interrupted", ie);
                }
            }
        }
        throw lastException;
    }

    /**
     * Гарантирует существование родительской директории для указанного пути.
     */
    public static void ensureParentExists(Path path) throws IOException {
        Path parent = path.getParent();
        if (parent != null && !Files.exists(parent)) {
            Files.createDirectories(parent);
        }
    }

    /**
     * Безопасная запись байтов в файл с использованием алгоритма Safe Swap.
     * Байты записываются во временный файл, старая версия откладывается в .old
     * и возвращается на место, если финальное перемещение не удалось. При любом сбое
     * временный файл удаляется.
     */
    public static void safeWrite(Path path, byte[] bytes) throws IOException {
        ensureParentExists(path);
        Path tempFile = path.resolveSibling(path.getFileName() + ".tmp");
        Path backupFile = path.resolveSibling(path.getFileName() + ".old");

        executeWithRetry(() -> {
            try {
                Files.write(tempFile, bytes, StandardOpenOption.CREATE, StandardOpenOption.TRUNCATE_EXISTING);
                if (Files.exists(path)) {
                    Files.move(path, backupFile, StandardCopyOption.REPLACE_EXISTING);
                }
                try {
                    Files.move(tempFile, path, StandardCopyOption.REPLACE_EXISTING);
                } catch (IOException e) {
                    if (Files.exists(backupFile)) {
                        Files.move(backupFile, path, StandardCopyOption.REPLACE_EXISTING);
                    }
                    throw e;
                }
            } catch (IOException e) {
                // .tmp не должен оставаться рядом с файлом проекта
                try {
                    Files.deleteIfExists(tempFile);
                } catch (IOException cleanup) {
                    e.addSuppressed(cleanup);
                }
                throw e;
            }
            Files.deleteIfExists(backupFile);
            return null;
        });
    }

    /**
     * Безопасное копирование файла (используется для резервных копий перед коммитом).
     */
    public static void safeCopy(Path source, Path target, CopyOption... options) throws IOException {
        ensureParentExists(target);
        executeWithRetry(() -> {
            Files.copy(source, target, options);
            return null;
        });
    }

    /**
     * Безопасное чтение всех байтов файла.
     */
    public static byte[] safeReadAllBytes(Path path) throws IOException {
        return executeWithRetry(() -> Files.readAllBytes(path));
    }

    /**
     * Контрольная сумма содержимого для обнаружения внешних изменений.
     */
    public static long crc32c(byte[] bytes) {
        CRC32C crc = new CRC32C();
        crc.update(bytes, 0, bytes.length);
        return crc.getValue();
    }

    @FunctionalInterface
    public interface IORunnable<T> {
        T run() throws IOException;
    }
}
