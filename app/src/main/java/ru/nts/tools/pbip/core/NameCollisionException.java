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

import java.util.Map;

/**
 * The resulting name set of a rename batch is not unique within a scope.
 * Raised before any write.
 */
public class NameCollisionException extends PbipException {

    public NameCollisionException(int collisions) {
        super(PbipErrorCode.NAME_COLLISION, Map.of("collisions", collisions));
    }
}
