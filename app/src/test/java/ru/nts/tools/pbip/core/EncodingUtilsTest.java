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

import java.io.IOException;
import java.nio.charset.Charset;
import java.nio.charset.StandardCharsets;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Тесты определения кодировки и обратного кодирования с сохранением BOM.
 */
class EncodingUtilsTest {

    @Test
    void testDecode_Utf8WithoutBom() throws IOException {
        byte[] bytes = "table 'Продажи'\n".getBytes(StandardCharsets.UTF_8);
        EncodingUtils.TextFileContent content = EncodingUtils.decode(bytes);

        assertEquals(StandardCharsets.UTF_8, content.charset());
        assertEquals(0, content.bom().length);
        assertEquals("table 'Продажи'\n", content.content());
        assertArrayEquals(bytes, content.encode(content.content()));
    }

    @Test
    void testDecode_BomIsKeptOnEncode() throws IOException {
        byte[] body = "{\"Entity\": \"Sales\"}".getBytes(StandardCharsets.UTF_8);
        byte[] bytes = new byte[body.length + 3];
        bytes[0] = (byte) 0xEF;
        bytes[1] = (byte) 0xBB;
        bytes[2] = (byte) 0xBF;
        System.arraycopy(body, 0, bytes, 3, body.length);

        EncodingUtils.TextFileContent content = EncodingUtils.decode(bytes);
        assertEquals("{\"Entity\": \"Sales\"}", content.content());
        assertEquals(3, content.bom().length);

        byte[] encoded = content.encode("{\"Entity\": \"Orders\"}");
        assertEquals((byte) 0xEF, encoded[0]);
        assertEquals("{\"Entity\": \"Orders\"}", new String(encoded, 3, encoded.length - 3, StandardCharsets.UTF_8));
    }

    @Test
    void testDecode_BinaryRejected() {
        byte[] bytes = {'t', 'a', 0, 'b'};
        assertThrows(IOException.class, () -> EncodingUtils.decode(bytes));
    }

    @Test
    void testEncode_UnmappableCharacterRejected() {
        Charset latin1 = StandardCharsets.ISO_8859_1;
        IOException e = assertThrows(IOException.class, () -> EncodingUtils.encode("Продажи", latin1, new byte[0]));
        assertTrue(e.getMessage().contains(latin1.name()));
    }
}
