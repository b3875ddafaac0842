package io.github.cyfko.cnfcyk.core.model;

import io.github.cyfko.cnfcyk.core.utils.GrammarFormatUtils;

import java.util.*;

/**
 * Filled CYK recognition table of one sentence, with its backpointers.
 * <p>
 * Cell {@code (i, j)}, {@code 0 <= i <= j < n}, holds the non-terminals deriving tokens
 * {@code i..j}, each mapped to the single {@link Derivation} kept for it. Cells with
 * {@code i > j} do not exist: {@link #cell(int, int)} returns an empty set for them.
 * A chart is owned by the {@link ParseResult} it belongs to and never changes once built.
 * </p>
 *
 * @since 1.0.0
 */
public final class CykChart {

    private final List<String> tokens;
    private final Symbol startSymbol;
    /** Row {@code i} holds the cells {@code (i, i)} to {@code (i, n - 1)}. */
    private final List<List<SortedMap<Symbol, Derivation>>> rows;

    /**
     * @param tokens      the parsed sentence
     * @param startSymbol start symbol of the grammar
     * @param rows        triangular table: {@code rows.get(i).get(j - i)} is cell {@code (i, j)}
     */
    public CykChart(List<String> tokens, Symbol startSymbol, List<? extends List<? extends SortedMap<Symbol, Derivation>>> rows) {
        this.tokens = List.copyOf(tokens);
        this.startSymbol = Objects.requireNonNull(startSymbol, "Start symbol is required");
        if (rows.size() != this.tokens.size()) {
            throw new IllegalArgumentException("Expected " + this.tokens.size() + " rows, got " + rows.size());
        }

        List<List<SortedMap<Symbol, Derivation>>> copy = new ArrayList<>(rows.size());
        for (int i = 0; i < rows.size(); i++) {
            List<? extends SortedMap<Symbol, Derivation>> row = rows.get(i);
            if (row.size() != this.tokens.size() - i) {
                throw new IllegalArgumentException("Row " + i + " must hold " + (this.tokens.size() - i) + " cells");
            }
            List<SortedMap<Symbol, Derivation>> rowCopy = new ArrayList<>(row.size());
            for (SortedMap<Symbol, Derivation> cell : row) {
                rowCopy.add(Collections.unmodifiableSortedMap(new TreeMap<>(cell)));
            }
            copy.add(Collections.unmodifiableList(rowCopy));
        }
        this.rows = Collections.unmodifiableList(copy);
    }

    public List<String> tokens() {
        return tokens;
    }

    public int size() {
        return tokens.size();
    }

    public Symbol startSymbol() {
        return startSymbol;
    }

    /**
     * @return the non-terminals deriving tokens {@code i..j}, in symbol order; empty when
     * {@code i > j} or an index is out of range
     */
    public SortedSet<Symbol> cell(int i, int j) {
        Optional<SortedMap<Symbol, Derivation>> entries = entries(i, j);
        if (entries.isEmpty()) {
            return Collections.emptySortedSet();
        }
        return Collections.unmodifiableSortedSet(new TreeSet<>(entries.get().keySet()));
    }

    public Optional<Derivation> derivation(int i, int j, Symbol symbol) {
        return entries(i, j).map(m -> m.get(symbol));
    }

    /**
     * @return {@code true} iff the start symbol derives the whole sentence
     */
    public boolean accepts() {
        return !tokens.isEmpty() && cell(0, tokens.size() - 1).contains(startSymbol);
    }

    public int filledEntryCount() {
        int count = 0;
        for (List<SortedMap<Symbol, Derivation>> row : rows) {
            for (SortedMap<Symbol, Derivation> cell : row) {
                count += cell.size();
            }
        }
        return count;
    }

    /**
     * Rebuilds the parse tree of the whole sentence from the backpointers, using an explicit
     * stack so that depth is not limited by the call stack.
     *
     * @return the tree rooted at the start symbol, empty when the sentence is rejected
     */
    public Optional<ParseTree> tree() {
        if (!accepts()) {
            return Optional.empty();
        }
        return Optional.of(buildTree(0, tokens.size() - 1, startSymbol));
    }

    /**
     * Counts the rules used by the tree of the whole sentence, keyed by rule text such as
     * {@code "E -> E Y0"}, in first-use order.
     *
     * @return rule usage, empty when the sentence is rejected
     */
    public Map<String, Integer> productionUsage() {
        Map<String, Integer> usage = new LinkedHashMap<>();
        if (!accepts()) {
            return usage;
        }

        Deque<int[]> pendingSpans = new ArrayDeque<>();
        Deque<Symbol> pendingSymbols = new ArrayDeque<>();
        pendingSpans.push(new int[]{0, tokens.size() - 1});
        pendingSymbols.push(startSymbol);
        while (!pendingSpans.isEmpty()) {
            int[] span = pendingSpans.pop();
            Symbol symbol = pendingSymbols.pop();
            Derivation derivation = rows.get(span[0]).get(span[1] - span[0]).get(symbol);

            if (derivation instanceof Derivation.Lexical lexical) {
                usage.merge(GrammarFormatUtils.formatProduction(symbol, List.of(lexical.terminal())), 1, Integer::sum);
            } else if (derivation instanceof Derivation.Binary binary) {
                usage.merge(GrammarFormatUtils.formatProduction(symbol, List.of(binary.left(), binary.right())), 1, Integer::sum);
                pendingSpans.push(new int[]{binary.split() + 1, span[1]});
                pendingSymbols.push(binary.right());
                pendingSpans.push(new int[]{span[0], binary.split()});
                pendingSymbols.push(binary.left());
            }
        }
        return usage;
    }

    /**
     * Text table with one row per start index, highest first, and one column per end index.
     *
     * @return the rendering
     */
    public String render() {
        int n = tokens.size();
        if (n == 0) {
            return "(empty chart)";
        }

        int width = 12;
        for (int i = 0; i < n; i++) {
            for (int j = i; j < n; j++) {
                width = Math.max(width, formatCell(i, j).length() + 2);
            }
        }

        StringBuilder sb = new StringBuilder();
        sb.append("Sentence: ").append(String.join(" ", tokens)).append('\n');
        sb.append("    ");
        for (int j = 0; j < n; j++) {
            sb.append(String.format("%" + width + "d", j));
        }
        for (int i = n - 1; i >= 0; i--) {
            sb.append('\n').append(String.format("%2d: ", i));
            for (int j = 0; j < n; j++) {
                sb.append(String.format("%" + width + "s", i <= j ? formatCell(i, j) : ""));
            }
        }
        return sb.toString();
    }

    private String formatCell(int i, int j) {
        return "{" + String.join(", ", GrammarFormatUtils.sortedNames(cell(i, j))) + "}";
    }

    private Optional<SortedMap<Symbol, Derivation>> entries(int i, int j) {
        if (i < 0 || j >= tokens.size() || i > j) {
            return Optional.empty();
        }
        return Optional.of(rows.get(i).get(j - i));
    }

    private ParseTree buildTree(int i, int j, Symbol symbol) {
        Deque<Frame> pending = new ArrayDeque<>();
        Deque<ParseTree> built = new ArrayDeque<>();
        pending.push(new Frame(i, j, symbol, false));

        while (!pending.isEmpty()) {
            Frame frame = pending.pop();
            Derivation derivation = rows.get(frame.i).get(frame.j - frame.i).get(frame.symbol);

            if (derivation instanceof Derivation.Lexical lexical) {
                ParseTree leaf = ParseTree.leaf(lexical.terminal(), frame.i);
                built.push(ParseTree.node(frame.symbol, frame.i, frame.j, List.of(leaf)));
            } else if (derivation instanceof Derivation.Binary binary) {
                if (frame.expanded) {
                    ParseTree right = built.pop();
                    ParseTree left = built.pop();
                    built.push(ParseTree.node(frame.symbol, frame.i, frame.j, List.of(left, right)));
                } else {
                    // left subtree is built first, so it sits below the right one
                    pending.push(new Frame(frame.i, frame.j, frame.symbol, true));
                    pending.push(new Frame(binary.split() + 1, frame.j, binary.right(), false));
                    pending.push(new Frame(frame.i, binary.split(), binary.left(), false));
                }
            } else {
                throw new IllegalStateException(String.format(
                        "No derivation recorded for '%s' over [%d, %d]", frame.symbol.name(), frame.i, frame.j
                ));
            }
        }
        return built.pop();
    }

    private record Frame(int i, int j, Symbol symbol, boolean expanded) {}
}
