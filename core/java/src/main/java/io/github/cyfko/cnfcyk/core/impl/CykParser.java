package io.github.cyfko.cnfcyk.core.impl;

import io.github.cyfko.cnfcyk.core.api.Recognizer;
import io.github.cyfko.cnfcyk.core.config.ParserPolicy;
import io.github.cyfko.cnfcyk.core.exception.GrammarComplexityException;
import io.github.cyfko.cnfcyk.core.exception.GrammarNotInCnfException;
import io.github.cyfko.cnfcyk.core.model.*;

import java.time.Duration;
import java.util.*;
import java.util.logging.Logger;

/**
 * Cocke-Younger-Kasami recognizer over a grammar in Chomsky Normal Form.
 * <p>
 * Two indices are built once, at construction time, and only read afterwards:
 * </p>
 * <ul>
 *   <li><strong>terminal producers</strong>: terminal name → non-terminals {@code A} with {@code A -> terminal}</li>
 *   <li><strong>binary producers</strong>: ordered pair {@code (B, C)} → non-terminals {@code A} with {@code A -> B C}</li>
 * </ul>
 * <p>
 * Each {@link #parse(List)} call fills its own chart, so one parser can serve any number
 * of calls, from several threads.
 * </p>
 *
 * <h2>Derivation choice</h2>
 * <p>
 * A cell keeps one derivation per non-terminal: the first one found when split points are
 * visited in ascending order, then left symbols, right symbols and producers in symbol
 * order. For an ambiguous sentence the returned tree is therefore reproducible, but only
 * one of its trees is returned.
 * </p>
 *
 * <h2>Complexity</h2>
 * <ul>
 *   <li>Time: O(n³ · |N|²) for n tokens and |N| non-terminals</li>
 *   <li>Space: O(n² · |N|) for the chart</li>
 * </ul>
 *
 * <h2>Usage Example</h2>
 * <pre>{@code
 * CykParser parser = new CykParser(new CnfConverter().toCnf(grammar));
 * ParseResult result = parser.parse(List.of("id", "+", "id", "*", "id"));
 * if (result.accepted()) {
 *     System.out.println(result.tree().orElseThrow().render(result.chart().tokens()));
 * }
 * }</pre>
 *
 * @since 1.0.0
 */
public class CykParser implements Recognizer {

    private static final Logger log = Logger.getLogger(CykParser.class.getName());

    private final Grammar grammar;
    private final ParserPolicy policy;
    private final Map<String, SortedSet<Symbol>> terminalProducers = new HashMap<>();
    private final Set<String> terminalNames = new HashSet<>();
    private final Map<Symbol, Map<Symbol, SortedSet<Symbol>>> binaryProducers = new HashMap<>();
    private final boolean acceptsEmpty;

    public CykParser(Grammar grammar) {
        this(grammar, ParserPolicy.defaults());
    }

    /**
     * @param grammar grammar in Chomsky Normal Form; a copy is kept
     * @param policy  parser limits
     * @throws GrammarNotInCnfException if the grammar is not in CNF
     */
    public CykParser(Grammar grammar, ParserPolicy policy) {
        Objects.requireNonNull(grammar, "Grammar is required");
        this.policy = Objects.requireNonNull(policy, "Parser policy is required");

        List<String> violations = grammar.cnfViolations();
        if (!violations.isEmpty()) {
            throw new GrammarNotInCnfException(violations);
        }
        this.grammar = grammar.copy();

        this.grammar.getTerminals().forEach(t -> terminalNames.add(t.name()));
        Symbol start = this.grammar.getStartSymbol();
        boolean empty = false;
        for (var entry : this.grammar.getProductions().entrySet()) {
            Symbol left = entry.getKey();
            for (List<Symbol> right : entry.getValue()) {
                if (right.size() == 1) {
                    terminalProducers.computeIfAbsent(right.get(0).name(), k -> new TreeSet<>()).add(left);
                } else if (right.size() == 2) {
                    binaryProducers.computeIfAbsent(right.get(0), k -> new HashMap<>())
                            .computeIfAbsent(right.get(1), k -> new TreeSet<>())
                            .add(left);
                } else if (left.equals(start)) {
                    empty = true;
                }
            }
        }
        this.acceptsEmpty = empty;
    }

    /**
     * Recognizes {@code tokens}.
     * <p>
     * An empty sentence is rejected immediately, see {@link #acceptsEmpty()}. Tokens that are
     * not terminals of the grammar are logged and reported in the result; they seed no cell,
     * so every span covering them stays empty.
     * </p>
     *
     * @param tokens the sentence
     * @return the recognition outcome
     * @throws GrammarComplexityException if the sentence exceeds the policy's length limit
     */
    @Override
    public ParseResult parse(List<String> tokens) {
        Objects.requireNonNull(tokens, "Tokens are required");
        tokens.forEach(t -> Objects.requireNonNull(t, "Tokens cannot contain null"));
        if (tokens.size() > policy.maxSentenceLength()) {
            throw new GrammarComplexityException(String.format(
                    "Sentence too long (%d tokens, max: %d). Policy applied: %s",
                    tokens.size(), policy.maxSentenceLength(), policy.policyName()
            ));
        }

        long start = System.nanoTime();
        int n = tokens.size();

        List<String> unknownTokens = new ArrayList<>();
        for (String token : tokens) {
            if (!terminalNames.contains(token)) {
                unknownTokens.add(token);
            }
        }
        if (!unknownTokens.isEmpty()) {
            log.warning(() -> "Tokens not in the terminal set: " + unknownTokens);
        }

        List<List<TreeMap<Symbol, Derivation>>> rows = new ArrayList<>(n);
        for (int i = 0; i < n; i++) {
            List<TreeMap<Symbol, Derivation>> row = new ArrayList<>(n - i);
            for (int j = i; j < n; j++) {
                row.add(new TreeMap<>());
            }
            rows.add(row);
        }

        if (n > 0) {
            fillDiagonal(tokens, rows);
            fillInterior(n, rows);
        }

        CykChart chart = new CykChart(tokens, grammar.getStartSymbol(), rows);
        boolean accepted = chart.accepts();
        Optional<ParseTree> tree = chart.tree();
        Duration elapsed = Duration.ofNanos(System.nanoTime() - start);

        ParseInfo info = new ParseInfo(
                n,
                chart.filledEntryCount(),
                grammar.getProductions().size(),
                grammar.getTerminals().size(),
                grammar.getNonTerminals().size(),
                accepted,
                grammar.getStartSymbol()
        );

        log.fine(() -> String.format(
                "Parsed %d tokens in %d µs: %s",
                n, elapsed.toNanos() / 1_000, accepted ? "accepted" : "rejected"
        ));
        return new ParseResult(accepted, elapsed, tree, unknownTokens, chart, info);
    }

    @Override
    public boolean acceptsEmpty() {
        return acceptsEmpty;
    }

    /**
     * @return a copy of the grammar this parser recognizes
     */
    public Grammar getGrammar() {
        return grammar.copy();
    }

    public ParserPolicy getPolicy() {
        return policy;
    }

    private void fillDiagonal(List<String> tokens, List<List<TreeMap<Symbol, Derivation>>> rows) {
        for (int i = 0; i < tokens.size(); i++) {
            String token = tokens.get(i);
            SortedSet<Symbol> producers = terminalProducers.get(token);
            if (producers == null) continue;
            Symbol terminal = Symbol.terminal(token);
            TreeMap<Symbol, Derivation> cell = rows.get(i).get(0);
            for (Symbol producer : producers) {
                cell.put(producer, new Derivation.Lexical(terminal, token));
            }
        }
    }

    private void fillInterior(int n, List<List<TreeMap<Symbol, Derivation>>> rows) {
        for (int length = 2; length <= n; length++) {
            for (int i = 0; i + length - 1 < n; i++) {
                int j = i + length - 1;
                TreeMap<Symbol, Derivation> target = rows.get(i).get(j - i);

                for (int k = i; k < j; k++) {
                    TreeMap<Symbol, Derivation> leftCell = rows.get(i).get(k - i);
                    TreeMap<Symbol, Derivation> rightCell = rows.get(k + 1).get(j - k - 1);
                    if (leftCell.isEmpty() || rightCell.isEmpty()) continue;

                    for (Symbol left : leftCell.keySet()) {
                        Map<Symbol, SortedSet<Symbol>> byRight = binaryProducers.get(left);
                        if (byRight == null) continue;
                        for (Symbol right : rightCell.keySet()) {
                            SortedSet<Symbol> producers = byRight.get(right);
                            if (producers == null) continue;
                            for (Symbol producer : producers) {
                                // first derivation recorded for a producer wins
                                target.putIfAbsent(producer, new Derivation.Binary(left, right, k));
                            }
                        }
                    }
                }
            }
        }
    }
}
