package io.github.cyfko.cnfcyk.core.impl;

import io.github.cyfko.cnfcyk.core.GrammarFixtures;
import io.github.cyfko.cnfcyk.core.config.ConversionPolicy;
import io.github.cyfko.cnfcyk.core.exception.ConversionInvariantViolatedException;
import io.github.cyfko.cnfcyk.core.exception.GrammarComplexityException;
import io.github.cyfko.cnfcyk.core.model.*;
import io.github.cyfko.cnfcyk.core.parsing.GrammarTextFormat;
import io.github.cyfko.cnfcyk.core.spi.ConversionListener;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.ValueSource;
import org.mockito.InOrder;

import java.util.Collections;
import java.util.List;
import java.util.Set;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.*;

/**
 * Test suite for {@link CnfConverter}.
 * <p>
 * Covers the end results of the four-stage pipeline, idempotence on grammars already in
 * Chomsky Normal Form, policy handling and listener notifications.
 * </p>
 */
@DisplayName("CnfConverter Tests")
class CnfConverterTest {

    private final CnfConverter converter = new CnfConverter();

    @Nested
    @DisplayName("Conversion results")
    class Results {

        @Test
        @DisplayName("Should convert the arithmetic expression grammar")
        void shouldConvertArithmetic() {
            // Given
            Grammar grammar = GrammarFixtures.arithmetic();

            // When
            ConversionReport report = converter.convert(grammar);
            Grammar cnf = report.result();

            // Then
            assertTrue(cnf.isInCnf(), () -> String.join("\n", cnf.cnfViolations()));
            assertEquals(Symbol.nonTerminal("E"), cnf.getStartSymbol());
            assertTrue(report.nullableSymbols().isEmpty());
            assertEquals(Set.of(Symbol.nonTerminal("T"), Symbol.nonTerminal("F")),
                    report.unitClosure().get(Symbol.nonTerminal("E")));
            assertTrue(report.validateConversion().isValid());
        }

        @Test
        @DisplayName("Should keep the empty string on the start symbol only")
        void shouldIsolateEmptyString() {
            Grammar cnf = converter.toCnf(GrammarFixtures.optionalPair());

            Symbol start = cnf.getStartSymbol();
            assertTrue(cnf.isInCnf());
            assertTrue(cnf.getProductions(start).contains(List.of()));
            cnf.getProductions().forEach((left, rights) -> {
                if (!left.equals(start)) {
                    assertFalse(rights.contains(List.of()), "Empty right-hand side on " + left);
                }
            });
        }

        @Test
        @DisplayName("Should rename a nullable start symbol that appears on a right-hand side")
        void shouldRenameReferencedNullableStart() {
            Grammar cnf = converter.toCnf(GrammarFixtures.dyck());

            Symbol start = cnf.getStartSymbol();
            assertEquals("S0", start.name());
            assertTrue(cnf.isInCnf());
            assertTrue(cnf.getProductions(start).contains(List.of()));
        }

        @Test
        @DisplayName("Should lift terminals mixed into long right-hand sides")
        void shouldLiftTerminals() {
            Grammar cnf = converter.toCnf(GrammarTextFormat.parse("S -> a S b | a b"));

            assertTrue(cnf.isInCnf());
            assertEquals(Set.of(Symbol.terminal("a"), Symbol.terminal("b")), cnf.getTerminals());
        }

        @Test
        @DisplayName("Should use the configured fresh name prefixes")
        void shouldUseConfiguredPrefixes() {
            CnfConverter custom = new CnfConverter(ConversionPolicy.builder().chainPrefix("X").build());

            Grammar cnf = custom.toCnf(GrammarFixtures.arithmetic());

            assertTrue(cnf.getNonTerminals().contains(Symbol.nonTerminal("X0")));
            assertTrue(cnf.getNonTerminals().stream().noneMatch(s -> s.name().startsWith("Y")));
        }

        @Test
        @DisplayName("Should compute conversion statistics")
        void shouldComputeStats() {
            ConversionStats stats = converter.convert(GrammarFixtures.arithmetic()).stats();

            assertEquals(7, stats.originalNonTerminals());
            assertEquals(13, stats.finalNonTerminals());
            assertEquals(10, stats.originalProductions());
            assertEquals(19, stats.finalProductions());
            assertEquals(5, stats.originalTerminals());
            assertEquals(5, stats.finalTerminals());
            assertEquals(6, stats.nonTerminalsAdded());
            assertEquals(9, stats.productionsAdded());
            assertTrue(stats.inCnf());
        }

        @Test
        @DisplayName("Should leave the input grammar untouched")
        void shouldNotModifyInput() {
            Grammar grammar = GrammarFixtures.optionalPair();
            String before = grammar.describe();

            converter.toCnf(grammar);

            assertEquals(before, grammar.describe());
        }
    }

    @Nested
    @DisplayName("Idempotence")
    class Idempotence {

        @ParameterizedTest
        @ValueSource(strings = {
                GrammarFixtures.ARITHMETIC,
                GrammarFixtures.OPTIONAL_PAIR,
                GrammarFixtures.UNIT_CHAIN,
                GrammarFixtures.DYCK,
                "S -> a S b | a b"
        })
        @DisplayName("Should not change a grammar already in CNF")
        void shouldBeIdempotent(String text) {
            // Given
            Grammar once = converter.toCnf(GrammarTextFormat.parse(text));

            // When
            Grammar twice = converter.toCnf(once);

            // Then
            assertEquals(once.getStartSymbol(), twice.getStartSymbol());
            assertEquals(once.getTerminals(), twice.getTerminals());
            assertEquals(once.getNonTerminals(), twice.getNonTerminals());
            assertEquals(once.getProductions(), twice.getProductions());
        }
    }

    @Nested
    @DisplayName("Failures and policies")
    class Failures {

        @Test
        @DisplayName("Should fail when the start symbol generates nothing")
        void shouldFailOnNonGeneratingStart() {
            Grammar grammar = GrammarTextFormat.parse("S -> S a");

            ConversionInvariantViolatedException exception = assertThrows(
                    ConversionInvariantViolatedException.class, () -> converter.toCnf(grammar));

            assertEquals(List.of("start symbol 'S' has no productions"), exception.getViolations());
        }

        @Test
        @DisplayName("Should only notify when the policy tolerates a non-CNF result")
        void shouldToleratePerPolicy() {
            // Given
            ConversionListener listener = mock(ConversionListener.class);
            CnfConverter relaxed = new CnfConverter(ConversionPolicy.relaxed()).addListener(listener);

            // When
            ConversionReport report = relaxed.convert(GrammarTextFormat.parse("S -> S a"));

            // Then
            assertEquals(0, report.result().productionCount());
            assertFalse(report.validateConversion().isValid());
            verify(listener).onInvariantViolation(any(Grammar.class), eq(List.of("start symbol 'S' has no productions")));
        }

        @Test
        @DisplayName("Should require a start symbol")
        void shouldRequireStartSymbol() {
            Grammar grammar = new Grammar();
            grammar.addProduction(Symbol.nonTerminal("A"), List.of(Symbol.terminal("a")));

            assertThrows(IllegalArgumentException.class, () -> converter.toCnf(grammar));
        }

        @Test
        @DisplayName("Should refuse right-hand sides beyond the policy limit")
        void shouldRefuseLongRightHandSides() {
            Grammar grammar = GrammarTextFormat.parse("S -> A A A A A A A A A A A A A\nA -> a | ε");
            CnfConverter strict = new CnfConverter(ConversionPolicy.strict());

            assertThrows(GrammarComplexityException.class, () -> strict.toCnf(grammar));
            assertTrue(converter.toCnf(grammar).isInCnf());
        }

        @Test
        @DisplayName("Should convert long right-hand sides without nullable symbols under any policy")
        void shouldConvertLongRightHandSidesWithoutNullables() {
            // Given
            Grammar grammar = GrammarTextFormat.parse("S -> " + String.join(" ", Collections.nCopies(63, "a")));

            // When
            Grammar cnf = converter.toCnf(grammar);
            Grammar strictCnf = new CnfConverter(ConversionPolicy.strict()).toCnf(grammar);

            // Then
            assertTrue(cnf.isInCnf());
            assertTrue(strictCnf.isInCnf());
            CykParser parser = new CykParser(cnf);
            assertTrue(parser.accepts(Collections.nCopies(63, "a")));
            assertFalse(parser.accepts(Collections.nCopies(62, "a")));
        }
    }

    @Test
    @DisplayName("Should notify listeners after each stage, in pipeline order")
    void shouldNotifyListenersInOrder() {
        // Given
        ConversionListener listener = mock(ConversionListener.class);
        converter.addListener(listener);

        // When
        converter.toCnf(GrammarFixtures.arithmetic());

        // Then
        InOrder inOrder = inOrder(listener);
        inOrder.verify(listener).onStageCompleted(eq(ConversionStage.EPSILON_ELIMINATION), any(Grammar.class));
        inOrder.verify(listener).onStageCompleted(eq(ConversionStage.UNIT_ELIMINATION), any(Grammar.class));
        inOrder.verify(listener).onStageCompleted(eq(ConversionStage.USELESS_SYMBOL_ELIMINATION), any(Grammar.class));
        inOrder.verify(listener).onStageCompleted(eq(ConversionStage.BINARIZATION), any(Grammar.class));
        verify(listener, never()).onInvariantViolation(any(), any());
    }

    @Test
    @DisplayName("Should hand listeners snapshots they cannot use to alter the result")
    void shouldHandSnapshots() {
        ConversionListener listener = new ConversionListener() {
            @Override
            public void onStageCompleted(ConversionStage stage, Grammar snapshot) {
                snapshot.addProduction(Symbol.nonTerminal("Z"), List.of(Symbol.terminal("z")));
            }
        };

        Grammar cnf = new CnfConverter().addListener(listener).toCnf(GrammarFixtures.unitChain());

        assertFalse(cnf.getNonTerminals().contains(Symbol.nonTerminal("Z")));
        assertEquals(List.of(List.of(Symbol.terminal("c"))), cnf.getProductions(Symbol.nonTerminal("S")));
    }
}
