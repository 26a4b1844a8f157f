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

import org.mozilla.universalchardet.UniversalDetector;

import java.io.IOException;
import java.nio.ByteBuffer;
import java.nio.CharBuffer;
import java.nio.charset.CharacterCodingException;
import java.nio.charset.Charset;
import java.nio.charset.CharsetEncoder;
import java.nio.charset.CodingErrorAction;
import java.nio.charset.IllegalCharsetNameException;
import java.nio.charset.StandardCharsets;
import java.nio.charset.UnsupportedCharsetException;
import java.util.Arrays;

/**
 * Утилиты для определения кодировки и чтения файлов проекта.
 * Использует UniversalDetector (juniversalchardet) для автоматического определения Charset.
 *
 * <p>BOM отделяется от текста и хранится отдельно, чтобы запись после
 * переименования возвращала на диск ту же последовательность байтов.
 */
public class EncodingUtils {

    private static final byte[] NO_BOM = new byte[0];

    private EncodingUtils() {
    }

    /**
     * Результат декодирования текстового файла.
     *
     * @param content Содержимое файла без BOM.
     * @param charset Кодировка, использованная для декодирования байтов.
     * @param bom     Исходные байты BOM (пустой массив, если BOM не было).
     */
    public record TextFileContent(String content, Charset charset, byte[] bom) {

        /**
         * Кодирует новый текст в той же кодировке и с тем же BOM.
         */
        public byte[] encode(String text) throws IOException {
            return EncodingUtils.encode(text, charset, bom);
        }
    }

    /**
     * Декодирует байты файла. Порядок: BOM, валидный UTF-8, детектор, windows-1251.
     *
     * @throws IOException если содержимое похоже на бинарный файл.
     */
    public static TextFileContent decode(byte[] allBytes) throws IOException {
        Charset charset = charsetFromBom(allBytes);
        byte[] bom = NO_BOM;

        if (charset != null) {
            bom = Arrays.copyOf(allBytes, bomLength(allBytes, charset));
        } else if (isValidUtf8(allBytes)) {
            charset = StandardCharsets.UTF_8;
        } else {
            charset = detect(allBytes);
        }

        byte[] body = Arrays.copyOfRange(allBytes, bom.length, allBytes.length);

        // Проверка на бинарный файл (наличие NULL-байтов), кроме многобайтовых кодировок UTF
        if (!charset.name().startsWith("UTF-16") && !charset.name().startsWith("UTF-32")) {
            int checkLimit = Math.min(body.length, 8192);
            for (int i = 0; i < checkLimit; i++) {
                if (body[i] == 0) {
                    throw new IOException("Binary content detected (NULL bytes present).");
                }
            }
        }

        return new TextFileContent(new String(body, charset), charset, bom);
    }

    /**
     * Кодирует текст, отказываясь от несовместимых символов вместо их тихой замены.
     */
    public static byte[] encode(String text, Charset charset, byte[] bom) throws IOException {
        CharsetEncoder encoder = charset.newEncoder()
                .onMalformedInput(CodingErrorAction.REPORT)
                .onUnmappableCharacter(CodingErrorAction.REPORT);
        ByteBuffer buffer;
        try {
            buffer = encoder.encode(CharBuffer.wrap(text));
        } catch (CharacterCodingException e) {
            throw new IOException("Cannot write file in " + charset.name() + " encoding: "
                    + "new names contain characters this encoding cannot represent.", e);
        }
        byte[] result = new byte[bom.length + buffer.remaining()];
        System.arraycopy(bom, 0, result, 0, bom.length);
        buffer.get(result, bom.length, buffer.remaining());
        return result;
    }

    private static Charset detect(byte[] bytes) {
        UniversalDetector detector = new UniversalDetector(null);
        detector.handleData(bytes, 0, bytes.length);
        detector.dataEnd();
        String encoding = detector.getDetectedCharset();
        if (encoding != null) {
            try {
                return Charset.forName(encoding);
            } catch (IllegalCharsetNameException | UnsupportedCharsetException e) {
                // Неизвестное JVM имя кодировки, падаем на кириллическую по умолчанию
                return Charset.forName("windows-1251");
            }
        }
        return Charset.forName("windows-1251");
    }

    private static Charset charsetFromBom(byte[] b) {
        if (b.length >= 3 && (b[0] & 0xFF) == 0xEF && (b[1] & 0xFF) == 0xBB && (b[2] & 0xFF) == 0xBF) {
            return StandardCharsets.UTF_8;
        }
        if (b.length >= 4 && (b[0] & 0xFF) == 0xFF && (b[1] & 0xFF) == 0xFE && b[2] == 0 && b[3] == 0) {
            return Charset.forName("UTF-32LE");
        }
        if (b.length >= 4 && b[0] == 0 && b[1] == 0 && (b[2] & 0xFF) == 0xFE && (b[3] & 0xFF) == 0xFF) {
            return Charset.forName("UTF-32BE");
        }
        if (b.length >= 2 && (b[0] & 0xFF) == 0xFF && (b[1] & 0xFF) == 0xFE) {
            return StandardCharsets.UTF_16LE;
        }
        if (b.length >= 2 && (b[0] & 0xFF) == 0xFE && (b[1] & 0xFF) == 0xFF) {
            return StandardCharsets.UTF_16BE;
        }
        return null;
    }

    private static int bomLength(byte[] b, Charset charset) {
        String name = charset.name();
        if (name.equals("UTF-8")) return 3;
        if (name.startsWith("UTF-32")) return 4;
        return 2;
    }

    /**
     * Проверяет, является ли массив байтов валидной последовательностью UTF-8.
     */
    static boolean isValidUtf8(byte[] bytes) {
        int i = 0;
        while (i < bytes.length) {
            int b = bytes[i++] & 0xFF;
            if (b <= 0x7F) continue; // ASCII

            int count;
            if (b >= 0xC2 && b <= 0xDF) count = 1;
            else if (b >= 0xE0 && b <= 0xEF) count = 2;
            else if (b >= 0xF0 && b <= 0xF4) count = 3;
            else return false;

            if (i + count > bytes.length) return false;

            for (int j = 0; j < count; j++) {
                int next = bytes[i++] & 0xFF;
                if (next < 0x80 || next > 0xBF) return false;
            }
        }
        return true;
    }
}
