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
package ru.nts.tools.pbip.project;

import ru.nts.tools.pbip.core.EncodingUtils;
import ru.nts.tools.pbip.core.EncodingUtils.TextFileContent;
import ru.nts.tools.pbip.core.FileUtils;

import java.io.IOException;
import java.nio.charset.Charset;
import java.nio.file.Path;
import java.util.Arrays;

/**
 * Один файл проекта: исходные байты, декодированный текст и CRC32C.
 * Экземпляр неизменяем; новая версия текста создается через {@link #withText(String)}.
 */
public final class SourceFile {

    private final Path path;
    private final FileFamily family;
    private final byte[] bytes;
    private final TextFileContent content;
    private final long crc32c;

    private SourceFile(Path path, FileFamily family, byte[] bytes, TextFileContent content) {
        this.path = path;
        this.family = family;
        this.bytes = bytes;
        this.content = content;
        this.crc32c = FileUtils.crc32c(bytes);
    }

    public static SourceFile of(Path path, FileFamily family, byte[] bytes) throws IOException {
        return new SourceFile(path, family, bytes.clone(), EncodingUtils.decode(bytes));
    }

    /**
     * Кодирует новый текст в исходной кодировке с исходным BOM.
     */
    public SourceFile withText(String newText) throws IOException {
        if (newText.equals(content.content())) {
            return this;
        }
        byte[] encoded = content.encode(newText);
        return new SourceFile(path, family, encoded, new TextFileContent(newText, content.charset(), content.bom()));
    }

    public Path path() {
        return path;
    }

    public FileFamily family() {
        return family;
    }

    public String text() {
        return content.content();
    }

    public Charset charset() {
        return content.charset();
    }

    public byte[] bytes() {
        return bytes.clone();
    }

    public long crc32c() {
        return crc32c;
    }

    public boolean sameBytes(SourceFile other) {
        return Arrays.equals(bytes, other.bytes);
    }

    @Override
    public String toString() {
        return "SourceFile{" + path + ", " + family + ", " + content.charset().name() + ", crc=" + Long.toHexString(crc32c) + "}";
    }
}
