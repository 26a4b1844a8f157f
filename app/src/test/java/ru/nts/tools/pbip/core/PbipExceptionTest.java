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

import org.junit.jupiter.api.Test;

import java.nio.file.Path;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Тесты форматирования ошибок.
 */
class PbipExceptionTest {

    @Test
    void testUserMessage_ContainsSolutionWithContext() {
        PbipException e = new PbipException(PbipErrorCode.IDENTIFIER_NOT_FOUND, "identifier", "Sales[Amout]");

        String message = e.toUserMessage();
        assertTrue(message.startsWith("[ERROR: IDENTIFIER_NOT_FOUND]"));
        assertTrue(message.contains("Check spelling of 'Sales[Amout]'"));
        assertEquals(message, e.getMessage());
    }

    @Test
    void testUnusedPlaceholdersAreCleared() {
        PbipException e = new PbipException(PbipErrorCode.PARTIAL_WRITE);
        assertTrue(e.toUserMessage().contains("permissions for ..."));
    }

    @Test
    void testNullContextValue() {
        PbipException e = new PbipException(PbipErrorCode.INVALID_REQUEST, "reason", null);
        assertEquals("null", e.getContext().get("reason"));
    }

    @Test
    void testFilesAndIdentifiersAreDeduplicated() {
        Path file = Path.of("Sales.tmdl");
        PbipException e = new PbipException(PbipErrorCode.NAME_COLLISION)
                .addFile(file).addFile(file)
                .addIdentifier("Sales").addIdentifier("Sales")
                .addSuggestion("rename one of them");

        assertEquals(List.of(file), e.getFiles());
        assertEquals(List.of("Sales"), e.getIdentifiers());
        assertTrue(e.toUserMessage().contains("* rename one of them"));
        assertTrue(e.toLogMessage().startsWith("[NAME_COLLISION]"));
    }

    @Test
    void testSpecializedExceptionsCarryCodes() {
        assertEquals(PbipErrorCode.EXTERNAL_MUTATION, new ExternalMutationException(Path.of("a.tmdl"), 1, 2).getCode());
        assertEquals(PbipErrorCode.ROLLBACK_FAILED, new RollbackException(List.of(Path.of("a.tmdl")), null).getCode());
        assertEquals(PbipErrorCode.AMBIGUOUS_REFERENCE, UnresolvedReferenceException.ambiguous(2).getCode());
        ModelParseException parse = new ModelParseException(Path.of("a.tmdl"), 3, 5, "Unrecognized line");
        assertEquals(3, parse.getLine());
        assertTrue(parse.toUserMessage().contains("a.tmdl:3"));
    }
}
