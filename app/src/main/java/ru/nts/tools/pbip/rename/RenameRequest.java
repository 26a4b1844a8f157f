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

import java.util.List;

/**
 * Пакет переименований, применяемый как единое целое.
 *
 * @param mappings     Переименования.
 * @param allowPartial Исключать проблемные места вместо отказа.
 */
public record RenameRequest(List<RenameMapping> mappings, boolean allowPartial) {

    public RenameRequest {
        mappings = List.copyOf(mappings);
    }

    public static RenameRequest of(RenameMapping... mappings) {
        return new RenameRequest(List.of(mappings), false);
    }

    public RenameRequest withAllowPartial(boolean allow) {
        return new RenameRequest(mappings, allow);
    }
}
