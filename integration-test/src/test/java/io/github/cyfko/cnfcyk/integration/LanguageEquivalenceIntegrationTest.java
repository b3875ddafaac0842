package io.github.cyfko.cnfcyk.integration;

import io.github.cyfko.cnfcyk.core.impl.CnfConverter;
import io.github.cyfko.cnfcyk.core.impl.CykParser;
import io.github.cyfko.cnfcyk.core.model.Grammar;
import io.github.cyfko.cnfcyk.core.model.Symbol;
import io.github.cyfko.cnfcyk.core.normalization.EpsilonEliminator;
import io.github.cyfko.cnfcyk.core.parsing.GrammarTextFormat;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.Arguments;
import org.junit.jupiter.params.provider.MethodSource;

import java.util.*;
import java.util.stream.Collectors;
import java.util.stream.Stream;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Checks conversion and recognition against a brute-force enumeration of each grammar's
 * language, up to a bounded sentence length.
 */
@DisplayName("Language Equivalence Integration Tests")
class LanguageEquivalenceIntegrationTest {

    static Stream<Arguments> grammars() {
        return Stream.of(
                Arguments.of("arithmetic", String.join("\n",
                        "E -> E P T | T",
                        "T -> T M F | F",
                        "F -> L E R | id",
                        "L -> (", "R -> )", "P -> +", "M -> *"), 5),
                Arguments.of("optional pair", "S -> A B\nA -> a | ε\nB -> b | ε", 6),
                Arguments.of("balanced parentheses", "S -> ( S ) S | ε", 6),
                Arguments.of("a^n b^n", "S -> a S b | a b", 6),
                Arguments.of("unit cycles and useless symbols", String.join("\n",
                        "S -> A | B C | ε",
                        "A -> B | a A",
                        "B -> A | b",
                        "C -> C c | D",
                        "D -> d D"), 6),
                Arguments.of("terminals mixed with nullable symbols", String.join("\n",
                        "S -> a B c D | D",
                        "B -> b | ε",
                        "D -> d D | ε"), 6),
                Arguments.of("nested nullable chain", String.join("\n",
                        "S -> X Y Z",
                        "X -> Y Y | x",
                        "Y -> Z | ε",
                        "Z -> z Z | ε"), 5)
        );
    }

    @ParameterizedTest(name = "{0}")
    @MethodSource("grammars")
    @DisplayName("Should preserve the bounded language through conversion")
    void shouldPreserveLanguage(String name, String text, int maxLength) {
        // Given
        Grammar grammar = GrammarTextFormat.parse(text);

        // When
        Grammar cnf = new CnfConverter().toCnf(grammar);

        // Then
        assertTrue(cnf.isInCnf(), () -> String.join("\n", cnf.cnfViolations()));
        assertEquals(BoundedLanguage.of(grammar, maxLength), BoundedLanguage.of(cnf, maxLength));
    }

    @ParameterizedTest(name = "{0}")
    @MethodSource("grammars")
    @DisplayName("Should accept exactly the sentences of the language")
    void shouldRecognizeExactlyTheLanguage(String name, String text, int maxLength) {
        // Given
        Grammar grammar = GrammarTextFormat.parse(text);
        Set<List<String>> expected = BoundedLanguage.of(grammar, maxLength);
        Set<String> alphabet = grammar.getTerminals().stream().map(Symbol::name).collect(Collectors.toSet());
        CykParser parser = new CykParser(new CnfConverter().toCnf(grammar));

        // When / Then
        for (List<String> sentence : BoundedLanguage.allSentences(alphabet, maxLength)) {
            assertEquals(expected.contains(sentence), parser.accepts(sentence), () -> "Sentence " + sentence);
        }
        assertEquals(expected.contains(List.of()), parser.acceptsEmpty());
    }

    @ParameterizedTest(name = "{0}")
    @MethodSource("grammars")
    @DisplayName("Should find exactly the non-terminals deriving the empty string")
    void shouldFindNullableSymbols(String name, String text, int maxLength) {
        Grammar grammar = GrammarTextFormat.parse(text);

        Set<Symbol> expected = new HashSet<>();
        BoundedLanguage.compute(grammar, 0).forEach((symbol, words) -> {
            if (!words.isEmpty()) {
                expected.add(symbol);
            }
        });

        assertEquals(expected, EpsilonEliminator.nullableSymbols(grammar));
    }

    @ParameterizedTest(name = "{0}")
    @MethodSource("grammars")
    @DisplayName("Should leave a converted grammar unchanged when converting it again")
    void shouldBeIdempotent(String name, String text, int maxLength) {
        CnfConverter converter = new CnfConverter();
        Grammar once = converter.toCnf(GrammarTextFormat.parse(text));

        Grammar twice = converter.toCnf(once);

        assertEquals(GrammarTextFormat.format(once), GrammarTextFormat.format(twice));
        assertEquals(once.getNonTerminals(), twice.getNonTerminals());
        assertEquals(once.getTerminals(), twice.getTerminals());
    }
}
