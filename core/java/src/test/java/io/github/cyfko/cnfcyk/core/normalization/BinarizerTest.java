package io.github.cyfko.cnfcyk.core.normalization;

import io.github.cyfko.cnfcyk.core.config.ConversionPolicy;
import io.github.cyfko.cnfcyk.core.model.Grammar;
import io.github.cyfko.cnfcyk.core.model.Symbol;
import io.github.cyfko.cnfcyk.core.parsing.GrammarTextFormat;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

@DisplayName("Binarizer Tests")
class BinarizerTest {

    private static final Symbol S = Symbol.nonTerminal("S");
    private static final Symbol A = Symbol.nonTerminal("A");
    private static final Symbol B = Symbol.nonTerminal("B");
    private static final Symbol C = Symbol.nonTerminal("C");
    private static final Symbol D = Symbol.nonTerminal("D");

    private static Grammar binarize(Grammar grammar) {
        return Binarizer.binarize(grammar, new FreshSymbolGenerator(grammar), ConversionPolicy.defaults());
    }

    @Test
    @DisplayName("Should split a long right-hand side into a right-branching chain")
    void shouldBuildRightBranchingChain() {
        // Given
        Grammar grammar = GrammarTextFormat.parse("S -> A B C D\nA -> a\nB -> b\nC -> c\nD -> d");

        // When
        Grammar result = binarize(grammar);

        // Then
        Symbol y0 = Symbol.nonTerminal("Y0");
        Symbol y1 = Symbol.nonTerminal("Y1");
        assertEquals(List.of(List.of(A, y0)), result.getProductions(S));
        assertEquals(List.of(List.of(B, y1)), result.getProductions(y0));
        assertEquals(List.of(List.of(C, D)), result.getProductions(y1));
        assertTrue(result.isInCnf());
    }

    @Test
    @DisplayName("Should lift terminals out of long right-hand sides with one proxy per terminal")
    void shouldLiftTerminals() {
        Grammar result = binarize(GrammarTextFormat.parse("S -> a S b | a b"));

        Symbol t0 = Symbol.nonTerminal("T0");
        Symbol t1 = Symbol.nonTerminal("T1");
        Symbol y2 = Symbol.nonTerminal("Y2");
        assertEquals(List.of(List.of(t0, y2), List.of(t0, t1)), result.getProductions(S));
        assertEquals(List.of(List.of(S, t1)), result.getProductions(y2));
        assertEquals(List.of(List.of(Symbol.terminal("a"))), result.getProductions(t0));
        assertEquals(List.of(List.of(Symbol.terminal("b"))), result.getProductions(t1));
        assertTrue(result.isInCnf());
    }

    @Test
    @DisplayName("Should not share chains between productions with identical suffixes")
    void shouldNotShareChains() {
        Grammar result = binarize(GrammarTextFormat.parse("S -> A B C | D B C\nA -> a\nB -> b\nC -> c\nD -> d"));

        assertEquals(List.of(List.of(A, Symbol.nonTerminal("Y0")), List.of(D, Symbol.nonTerminal("Y1"))),
                result.getProductions(S));
        assertEquals(result.getProductions(Symbol.nonTerminal("Y0")), result.getProductions(Symbol.nonTerminal("Y1")));
    }

    @Test
    @DisplayName("Should leave short right-hand sides untouched")
    void shouldKeepShortRightHandSides() {
        Grammar grammar = GrammarTextFormat.parse("S -> A B | a | ε\nA -> a\nB -> b");
        FreshSymbolGenerator generator = new FreshSymbolGenerator(grammar);

        Grammar result = Binarizer.binarize(grammar, generator, ConversionPolicy.defaults());

        assertEquals(grammar.getProductions(), result.getProductions());
        assertEquals(0, generator.counter());
    }
}
