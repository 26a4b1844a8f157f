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
import java.util.Optional;

/**
 * Настройки движка переименования.
 *
 * <p>Источники значений по убыванию приоритета: системные свойства {@code pbip.*},
 * переменные окружения {@code PBIP_*}, значения по умолчанию.
 */
public final class PbipSettings {

    public static final long DEFAULT_MAX_FILE_SIZE = 10 * 1024 * 1024;
    public static final String DEFAULT_PLACEHOLDER_PREFIX = "__pbip_tmp_";

    private final int parseThreads;
    private final long maxFileSizeBytes;
    private final Path backupDirectory;
    private final boolean allowPartialByDefault;
    private final String placeholderPrefix;

    private PbipSettings(Builder builder) {
        this.parseThreads = builder.parseThreads;
        this.maxFileSizeBytes = builder.maxFileSizeBytes;
        this.backupDirectory = builder.backupDirectory;
        this.allowPartialByDefault = builder.allowPartialByDefault;
        this.placeholderPrefix = builder.placeholderPrefix;
    }

    public static PbipSettings defaults() {
        return builder().build();
    }

    public static Builder builder() {
        return new Builder();
    }

    /**
     * Читает настройки из системных свойств и переменных окружения.
     *
     * @throws IllegalArgumentException если числовое значение не разбирается.
     */
    public static PbipSettings fromEnvironment() {
        Builder builder = builder();
        lookup("pbip.parseThreads", "PBIP_PARSE_THREADS")
                .ifPresent(v -> builder.parseThreads(parseInt("PBIP_PARSE_THREADS", v)));
        lookup("pbip.maxFileSize", "PBIP_MAX_FILE_SIZE")
                .ifPresent(v -> builder.maxFileSizeBytes(parseLong("PBIP_MAX_FILE_SIZE", v)));
        lookup("pbip.backupDir", "PBIP_BACKUP_DIR")
                .ifPresent(v -> builder.backupDirectory(Path.of(v)));
        lookup("pbip.allowPartial", "PBIP_ALLOW_PARTIAL")
                .ifPresent(v -> builder.allowPartialByDefault(Boolean.parseBoolean(v)));
        return builder.build();
    }

    private static Optional<String> lookup(String property, String env) {
        String value = System.getProperty(property);
        if (value == null || value.isBlank()) {
            value = System.getenv(env);
        }
        return value == null || value.isBlank() ? Optional.empty() : Optional.of(value.trim());
    }

    private static int parseInt(String name, String value) {
        try {
            return Integer.parseInt(value);
        } catch (NumberFormatException e) {
            throw new IllegalArgumentException(name + " must be an integer, got '" + value + "'", e);
        }
    }

    private static long parseLong(String name, String value) {
        try {
            return Long.parseLong(value);
        } catch (NumberFormatException e) {
            throw new IllegalArgumentException(name + " must be an integer, got '" + value + "'", e);
        }
    }

    public int getParseThreads() {
        return parseThreads;
    }

    public long getMaxFileSizeBytes() {
        return maxFileSizeBytes;
    }

    public Optional<Path> getBackupDirectory() {
        return Optional.ofNullable(backupDirectory);
    }

    public boolean isAllowPartialByDefault() {
        return allowPartialByDefault;
    }

    public String getPlaceholderPrefix() {
        return placeholderPrefix;
    }

    @Override
    public String toString() {
        return "PbipSettings{parseThreads=" + parseThreads + ", maxFileSizeBytes=" + maxFileSizeBytes
                + ", backupDirectory=" + backupDirectory + ", allowPartialByDefault=" + allowPartialByDefault
                + ", placeholderPrefix=" + placeholderPrefix + "}";
    }

    public static final class Builder {
        private int parseThreads = Math.max(1, Math.min(4, Runtime.getRuntime().availableProcessors()));
        private long maxFileSizeBytes = DEFAULT_MAX_FILE_SIZE;
        private Path backupDirectory;
        private boolean allowPartialByDefault;
        private String placeholderPrefix = DEFAULT_PLACEHOLDER_PREFIX;

        private Builder() {
        }

        public Builder parseThreads(int parseThreads) {
            if (parseThreads < 1) {
                throw new IllegalArgumentException("parseThreads must be >= 1");
            }
            this.parseThreads = parseThreads;
            return this;
        }

        public Builder maxFileSizeBytes(long maxFileSizeBytes) {
            if (maxFileSizeBytes < 1) {
                throw new IllegalArgumentException("maxFileSizeBytes must be positive");
            }
            this.maxFileSizeBytes = maxFileSizeBytes;
            return this;
        }

        public Builder backupDirectory(Path backupDirectory) {
            this.backupDirectory = backupDirectory;
            return this;
        }

        public Builder allowPartialByDefault(boolean allowPartialByDefault) {
            this.allowPartialByDefault = allowPartialByDefault;
            return this;
        }

        public Builder placeholderPrefix(String placeholderPrefix) {
            if (placeholderPrefix == null || !placeholderPrefix.matches("[A-Za-z_][A-Za-z0-9_]*")) {
                throw new IllegalArgumentException("placeholderPrefix must be a bare identifier");
            }
            this.placeholderPrefix = placeholderPrefix;
            return this;
        }

        public PbipSettings build() {
            return new PbipSettings(this);
        }
    }
}
