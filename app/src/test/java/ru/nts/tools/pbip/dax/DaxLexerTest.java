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
package ru.nts.tools.pbip.dax;

import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class DaxLexerTest {

    private static List<DaxToken> significant(String text) {
        return DaxLexer.tokenize(text).stream().filter(DaxToken::isSignificant).toList();
    }

    @Test
    void testQualifiedReference() {
        List<DaxToken> tokens = significant("SUM('Fact Sales'[Amount])");

        assertEquals(DaxTokenType.IDENTIFIER, tokens.get(0).type());
        assertEquals(DaxTokenType.QUOTED_TABLE, tokens.get(2).type());
        assertEquals("Fact Sales", tokens.get(2).name());
        assertEquals(DaxTokenType.BRACKETED, tokens.get(3).type());
        assertEquals("Amount", tokens.get(3).name());
        assertEquals(tokens.get(2).end(), tokens.get(3).start());
    }

    @Test
    void testEscapes() {
        List<DaxToken> tokens = significant("'Bob''s'[Net [USD]]] & \"say \"\"hi\"\"\"");

        assertEquals("Bob's", tokens.get(0).name());
        assertEquals("Net [USD]", tokens.get(1).name());
        assertEquals(DaxTokenType.STRING, tokens.get(3).type());
        assertTrue(tokens.get(3).terminated());
    }

    @Test
    void testCommentsAreNotSignificant() {
        List<DaxToken> tokens = significant("// Sales[Amount]\n-- old\n/* Sales */ [Total]");

        assertEquals(1, tokens.size());
        assertEquals("[Total]", tokens.get(0).text());
    }

    @Test
    void testUnterminatedTokens() {
        assertFalse(significant("'Sales").get(0).terminated());
        assertFalse(significant("[Amount").get(0).terminated());
        assertEquals("Amount", significant("[Amount").get(0).name());
        assertFalse(DaxLexer.tokenize("/* open").get(0).terminated());
    }

    @Test
    void testTokensCoverWholeText() {
        String text = "VAR x = CALCULATE([Total Sales], Sales[Region] = \"West\") RETURN x * 1.5";
        StringBuilder rebuilt = new StringBuilder();
        DaxLexer.tokenize(text).forEach(t -> rebuilt.append(t.text()));
        assertEquals(text, rebuilt.toString());
    }
}
