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

import java.nio.file.Path;
import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Журнал одного коммита: исходные байты и CRC32C затронутых файлов, подготовленные байты,
 * список уже записанных файлов и текущее состояние. Живет только в памяти.
 */
public class TransactionLog {

    private static final Logger log = LoggerFactory.getLogger(TransactionLog.class);

    private final String description;
    private final Map<Path, Snapshot> snapshots = new LinkedHashMap<>();
    private final Map<Path, byte[]> staged = new LinkedHashMap<>();
    private final List<Path> written = new ArrayList<>();
    private RenameState state = RenameState.REQUESTED;

    record Snapshot(byte[] bytes, long crc32c) {
    }

    public TransactionLog(String description) {
        this.description = description;
    }

    void transition(RenameState next) {
        log.info("Rename [{}]: {} -> {}", description, state, next);
        state = next;
    }

    void snapshot(Path path, byte[] bytes, long crc32c) {
        snapshots.put(path, new Snapshot(bytes, crc32c));
    }

    void stage(Path path, byte[] bytes) {
        staged.put(path, bytes);
    }

    void markWritten(Path path) {
        written.add(path);
    }

    Snapshot snapshotOf(Path path) {
        return snapshots.get(path);
    }

    Map<Path, byte[]> staged() {
        return Collections.unmodifiableMap(staged);
    }

    public List<Path> written() {
        return Collections.unmodifiableList(written);
    }

    public RenameState state() {
        return state;
    }

    public String description() {
        return description;
    }
}
