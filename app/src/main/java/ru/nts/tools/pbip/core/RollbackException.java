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
import java.util.List;
import java.util.Map;

/**
 * Restoring snapshots after a failed commit did not succeed for some files.
 * The listed files are the ones left in an unknown state.
 */
public class RollbackException extends PbipException {

    public RollbackException(List<Path> unrestored, Throwable cause) {
        super(PbipErrorCode.ROLLBACK_FAILED, Map.of("unrestored", unrestored.size()), cause);
        unrestored.forEach(this::addFile);
    }
}
