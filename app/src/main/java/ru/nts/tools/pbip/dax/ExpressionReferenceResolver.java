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

import ru.nts.tools.pbip.core.SourceSpan;
import ru.nts.tools.pbip.core.TextEdit;
import ru.nts.tools.pbip.graph.IdentifierKey;
import ru.nts.tools.pbip.graph.ModelIdentifier;
import ru.nts.tools.pbip.graph.ModelSymbolTable;
import ru.nts.tools.pbip.graph.NameEncoding;
import ru.nts.tools.pbip.graph.ReferenceOccurrence;
import ru.nts.tools.pbip.graph.ResolutionIssue;
import ru.nts.tools.pbip.graph.SyntacticForm;
import ru.nts.tools.pbip.tmdl.TmdlExpression;

import java.nio.file.Path;
import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.stream.Collectors;

/**
 * Извлекает из выражения DAX ссылки на таблицы, колонки и меры и сопоставляет их с моделью.
 *
 * <p>Распознаваемые формы:
 * <ul>
 *   <li>{@code 'Fact Sales'[Amount]} и {@code Sales[Amount]} (квалифицированные);</li>
 *   <li>{@code [Amount]} (голая ссылка: колонка своей таблицы или мера модели);</li>
 *   <li>{@code 'Fact Sales'} и {@code Sales} как аргумент-таблица.</li>
 * </ul>
 * Голая ссылка, которой соответствует больше одного идентификатора, не угадывается:
 * она становится проблемой {@code AMBIGUOUS}. Ссылка без цели становится {@code UNRESOLVED}.
 */
public class ExpressionReferenceResolver {

    private static final Set<String> KEYWORDS = Set.of("var", "return", "in", "not", "asc", "desc");

    private final ModelSymbolTable symbols;

    public ExpressionReferenceResolver(ModelSymbolTable symbols) {
        this.symbols = symbols;
    }

    /**
     * Анализирует выражение вне файла: смещения считаются от начала текста.
     */
    public ExpressionScan extractReferences(String expression, String owningTable) {
        return extractReferences(null, expression, new SourceSpan(0, expression.length(), 1, 1), owningTable);
    }

    public ExpressionScan extractReferences(Path file, TmdlExpression expression, String owningTable) {
        return extractReferences(file, expression.text(), expression.span(), owningTable);
    }

    /**
     * @param file        Файл выражения (для сообщений).
     * @param text        Текст выражения.
     * @param base        Положение текста в файле; смещения найденных ссылок сдвигаются на него.
     * @param owningTable Таблица, в которой объявлено выражение ({@code null}, если нет).
     */
    public ExpressionScan extractReferences(Path file, String text, SourceSpan base, String owningTable) {
        Session session = new Session(file, text, base, owningTable);
        session.run();
        return new ExpressionScan(session.occurrences, session.issues);
    }

    /**
     * Переписывает отдельное выражение по отображению идентификатор -> новое имя.
     * Правка каждого места строится той же {@link ReferenceOccurrence#renameTo}, что и при
     * переименовании в файлах проекта.
     */
    public String rewrite(String expression, String owningTable, Map<IdentifierKey, String> mapping) {
        List<TextEdit> edits = new ArrayList<>();
        for (ReferenceOccurrence occurrence : extractReferences(expression, owningTable).occurrences()) {
            String newName = mapping.get(occurrence.target());
            if (newName != null) {
                edits.add(occurrence.renameTo(newName));
            }
        }
        return TextEdit.applyAll(expression, edits);
    }

    private final class Session {
        private final Path file;
        private final String text;
        private final SourceSpan base;
        private final String owningTable;
        private final List<ReferenceOccurrence> occurrences = new ArrayList<>();
        private final List<ResolutionIssue> issues = new ArrayList<>();

        Session(Path file, String text, SourceSpan base, String owningTable) {
            this.file = file;
            this.text = text;
            this.base = base;
            this.owningTable = owningTable;
        }

        void run() {
            List<DaxToken> sig = DaxLexer.tokenize(text).stream()
                    .filter(DaxToken::isSignificant)
                    .collect(Collectors.toList());

            Set<String> varNames = new HashSet<>();
            for (int i = 0; i + 1 < sig.size(); i++) {
                if (sig.get(i).is(DaxTokenType.IDENTIFIER, "VAR") && sig.get(i + 1).type() == DaxTokenType.IDENTIFIER) {
                    varNames.add(IdentifierKey.fold(sig.get(i + 1).text()));
                }
            }

            for (int i = 0; i < sig.size(); i++) {
                DaxToken token = sig.get(i);
                DaxToken next = i + 1 < sig.size() ? sig.get(i + 1) : null;
                if (!token.terminated()) {
                    issues.add(ResolutionIssue.notAnalyzable(file, lineOf(token.start()), "expression",
                            token.text(), "Unterminated " + token.type().name().toLowerCase()));
                    continue;
                }
                switch (token.type()) {
                    case QUOTED_TABLE -> {
                        if (next != null && next.type() == DaxTokenType.BRACKETED && next.terminated()) {
                            qualified(token, next, true);
                            i++;
                        } else {
                            tableOnly(token, SyntacticForm.QUOTED_REFERENCE);
                        }
                    }
                    case IDENTIFIER -> {
                        boolean previousIsVar = i > 0 && sig.get(i - 1).is(DaxTokenType.IDENTIFIER, "VAR");
                        if (next != null && next.type() == DaxTokenType.BRACKETED && next.terminated()
                                && (next.start() == token.end() || isSpacedTableQualifier(token))) {
                            qualified(token, next, false);
                            i++;
                        } else if (next != null && next.is(DaxTokenType.OPERATOR, "(")) {
                            // вызов функции
                        } else if (!previousIsVar && !varNames.contains(IdentifierKey.fold(token.text()))
                                && symbols.table(token.text()).isPresent()) {
                            tableOnly(token, SyntacticForm.BARE_REFERENCE);
                        }
                    }
                    case BRACKETED -> bareMember(token);
                    default -> {
                    }
                }
            }
        }

        /**
         * {@code Sales [Amount]}: между таблицей и колонкой допустимы пробелы и комментарии.
         * Через пробел квалификатором считается только объявленная таблица, иначе
         * {@code RETURN [Total]} читалось бы как ссылка на таблицу RETURN.
         */
        private boolean isSpacedTableQualifier(DaxToken token) {
            return !KEYWORDS.contains(IdentifierKey.fold(token.text())) && symbols.table(token.text()).isPresent();
        }

        private void qualified(DaxToken tableToken, DaxToken memberToken, boolean quoted) {
            String tableName = tableToken.name();
            String memberName = memberToken.name();
            Optional<ModelIdentifier> table = symbols.table(tableName);
            if (table.isEmpty()) {
                issues.add(ResolutionIssue.unresolved(file, lineOf(tableToken.start()), "expression",
                        tableName, memberName, "Unknown table"));
                return;
            }
            SyntacticForm tableForm = quoted ? SyntacticForm.QUOTED_REFERENCE : SyntacticForm.QUALIFIED_REFERENCE;
            occurrences.add(occurrence(tableToken, table.get().key(), tableForm, NameEncoding.DAX_TABLE));

            List<ModelIdentifier> members = symbols.members(tableName, memberName);
            if (members.size() == 1) {
                occurrences.add(occurrence(memberToken, members.get(0).key(), SyntacticForm.QUALIFIED_REFERENCE, NameEncoding.DAX_MEMBER));
            } else if (members.isEmpty()) {
                issues.add(ResolutionIssue.unresolved(file, lineOf(memberToken.start()), "expression",
                        tableName, memberName, "Table has no column or measure with this name"));
            } else {
                issues.add(ResolutionIssue.ambiguous(file, lineOf(memberToken.start()), "expression",
                        tableName, memberName, keys(members)));
            }
        }

        private void tableOnly(DaxToken token, SyntacticForm form) {
            Optional<ModelIdentifier> table = symbols.table(token.name());
            if (table.isPresent()) {
                occurrences.add(occurrence(token, table.get().key(), form, NameEncoding.DAX_TABLE));
            } else {
                issues.add(ResolutionIssue.unresolved(file, lineOf(token.start()), "expression",
                        token.name(), null, "Unknown table"));
            }
        }

        private void bareMember(DaxToken token) {
            String name = token.name();
            List<ModelIdentifier> candidates = new ArrayList<>();
            if (owningTable != null) {
                symbols.column(owningTable, name).ifPresent(candidates::add);
            }
            candidates.addAll(symbols.measuresNamed(name));

            if (candidates.size() == 1) {
                occurrences.add(occurrence(token, candidates.get(0).key(), SyntacticForm.BARE_REFERENCE, NameEncoding.DAX_MEMBER));
            } else if (candidates.isEmpty()) {
                issues.add(ResolutionIssue.unresolved(file, lineOf(token.start()), "expression",
                        null, name, "No column of " + (owningTable != null ? "'" + owningTable + "'" : "the owning table")
                                + " and no measure with this name"));
            } else {
                issues.add(ResolutionIssue.ambiguous(file, lineOf(token.start()), "expression", null, name, keys(candidates)));
            }
        }

        private ReferenceOccurrence occurrence(DaxToken token, IdentifierKey target, SyntacticForm form, NameEncoding encoding) {
            SourceSpan span = new SourceSpan(base.start() + token.start(), base.start() + token.end(),
                    lineOf(token.start()), columnOf(token.start()));
            return new ReferenceOccurrence(file, span, target, form, encoding, null, token.text());
        }

        private int lineOf(int offset) {
            int line = base.line();
            for (int i = 0; i < offset; i++) {
                if (text.charAt(i) == '\n') {
                    line++;
                }
            }
            return line;
        }

        private int columnOf(int offset) {
            int lastNl = text.lastIndexOf('\n', offset - 1);
            return lastNl < 0 ? base.column() + offset : offset - lastNl;
        }

        private List<IdentifierKey> keys(List<ModelIdentifier> ids) {
            return ids.stream().map(ModelIdentifier::key).collect(Collectors.toList());
        }
    }
}
