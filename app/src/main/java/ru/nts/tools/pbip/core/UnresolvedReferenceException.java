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
 * Reference sites whose target could not be determined (unresolved or ambiguous).
 * The batch is refused unless the caller accepts partial scope.
 */
public class UnresolvedReferenceException extends PbipException {

    public UnresolvedReferenceException(PbipErrorCode code, int count) {
        super(code, Map.of("count", count));
    }

    public static UnresolvedReferenceException unresolved(int count) {
        return new UnresolvedReferenceException(PbipErrorCode.UNRESOLVED_REFERENCE, count);
    }

    public static UnresolvedReferenceException ambiguous(int count) {
        return new UnresolvedReferenceException(PbipErrorCode.AMBIGUOUS_REFERENCE, count);
    }
}
