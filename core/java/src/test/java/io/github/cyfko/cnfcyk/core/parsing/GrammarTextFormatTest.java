package io.github.cyfko.cnfcyk.core.parsing;

import io.github.cyfko.cnfcyk.core.GrammarFixtures;
import io.github.cyfko.cnfcyk.core.exception.GrammarSyntaxException;
import io.github.cyfko.cnfcyk.core.model.Grammar;
import io.github.cyfko.cnfcyk.core.model.Symbol;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.ValueSource;

import java.util.List;
import java.util.Set;

import static org.junit.jupiter.api.Assertions.*;

@DisplayName("GrammarTextFormat Tests")
class GrammarTextFormatTest {

    private static final Symbol S = Symbol.nonTerminal("S");

    @Nested
    @DisplayName("Parsing")
    class Parsing {

        @Test
        @DisplayName("Should classify left-hand sides as non-terminals and everything else as terminals")
        void shouldClassifySymbols() {
            Grammar grammar = GrammarFixtures.arithmetic();

            assertEquals(Symbol.nonTerminal("E"), grammar.getStartSymbol());
            assertEquals(Set.of("(", ")", "+", "*", "id"),
                    Set.copyOf(grammar.getTerminals().stream().map(Symbol::name).toList()));
            assertEquals(7, grammar.getNonTerminals().size());
            assertEquals(List.of(
                    List.of(Symbol.nonTerminal("E"), Symbol.nonTerminal("P"), Symbol.nonTerminal("T")),
                    List.of(Symbol.nonTerminal("T"))
            ), grammar.getProductions(Symbol.nonTerminal("E")));
        }

        @Test
        @DisplayName("Should read ε and empty alternatives as the empty right-hand side")
        void shouldReadEmptyAlternatives() {
            assertEquals(List.of(List.of(Symbol.terminal("a")), List.of()),
                    GrammarTextFormat.parse("S -> a |").getProductions(S));
            assertEquals(List.of(List.of()), GrammarTextFormat.parse("S -> ε").getProductions(S));
            assertEquals(List.of(List.of()), GrammarTextFormat.parse("S ->").getProductions(S));
        }

        @Test
        @DisplayName("Should ignore blank lines and lines without an arrow")
        void shouldIgnoreOtherLines() {
            Grammar grammar = GrammarTextFormat.parse("# balanced pairs\n\n   S -> a S b | ε   \nend");

            assertEquals(2, grammar.productionCount());
            assertEquals(Set.of(S), grammar.getNonTerminals());
        }

        @Test
        @DisplayName("Should accumulate alternatives of a repeated left-hand side")
        void shouldAccumulateAlternatives() {
            Grammar grammar = GrammarTextFormat.parse("S -> a\nA -> b\nS -> A");

            assertEquals(List.of(List.of(Symbol.terminal("a")), List.of(Symbol.nonTerminal("A"))),
                    grammar.getProductions(S));
            assertEquals(S, grammar.getStartSymbol());
        }

        @Test
        @DisplayName("Should return an empty grammar for text without rules")
        void shouldReturnEmptyGrammar() {
            Grammar grammar = GrammarTextFormat.parse("nothing here");

            assertNull(grammar.getStartSymbol());
            assertEquals(0, grammar.productionCount());
        }

        @ParameterizedTest
        @ValueSource(strings = {"-> a", "A B -> c", "S -> a ε", "ε -> a"})
        @DisplayName("Should reject malformed rule lines")
        void shouldRejectMalformedLines(String text) {
            assertThrows(GrammarSyntaxException.class, () -> GrammarTextFormat.parse(text));
        }

        @Test
        @DisplayName("Should report the line number of a malformed rule")
        void shouldReportLineNumber() {
            GrammarSyntaxException exception = assertThrows(GrammarSyntaxException.class,
                    () -> GrammarTextFormat.parse("S -> a\n\nS -> b ε"));

            assertEquals(3, exception.getLineNumber());
            assertTrue(exception.getMessage().startsWith("Line 3: "));
        }
    }

    @Nested
    @DisplayName("Formatting")
    class Formatting {

        @Test
        @DisplayName("Should write back the text it reads")
        void shouldWriteBack() {
            assertEquals(GrammarFixtures.OPTIONAL_PAIR, GrammarTextFormat.format(GrammarFixtures.optionalPair()));
            assertEquals(GrammarFixtures.ARITHMETIC, GrammarTextFormat.format(GrammarFixtures.arithmetic()));
        }

        @Test
        @DisplayName("Should write the start symbol first")
        void shouldWriteStartFirst() {
            Grammar grammar = new Grammar();
            grammar.addProduction(Symbol.nonTerminal("A"), List.of(Symbol.terminal("a")));
            grammar.addProduction(S, List.of(Symbol.nonTerminal("A"), Symbol.nonTerminal("A")));
            grammar.setStartSymbol(S);

            assertEquals("S -> A A\nA -> a", GrammarTextFormat.format(grammar));
        }
    }
}
