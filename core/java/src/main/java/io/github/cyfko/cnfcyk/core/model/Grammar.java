package io.github.cyfko.cnfcyk.core.model;

import io.github.cyfko.cnfcyk.core.exception.UnclassifiedSymbolException;
import io.github.cyfko.cnfcyk.core.utils.GrammarFormatUtils;

import java.util.*;

/**
 * A context-free grammar: productions, terminal and non-terminal symbol sets, and a start
 * symbol.
 * <p>
 * Symbols are classified explicitly. The symbol-based API receives {@link Symbol} values
 * that already carry their {@link SymbolKind}; the name-based API resolves names against
 * symbols previously declared with {@link #declareTerminal(String)} or
 * {@link #declareNonTerminal(String)} and rejects any other name with an
 * {@link UnclassifiedSymbolException}.
 * </p>
 *
 * <h2>Usage Example</h2>
 * <pre>{@code
 * Grammar grammar = new Grammar();
 * grammar.declareTerminal("a");
 * grammar.declareTerminal("b");
 * grammar.declareNonTerminal("A");
 * grammar.declareNonTerminal("B");
 *
 * grammar.addProduction("S", List.of("A", "B"));
 * grammar.addProduction("A", List.of("a"));
 * grammar.addProduction("A", List.of());       // A -> ε
 * grammar.addProduction("B", List.of("b"));
 * grammar.setStartSymbol("S");
 *
 * List<GrammarError> errors = grammar.validate();
 * }</pre>
 *
 * <p>
 * A grammar is a mutable builder until it is handed to a converter or a recognizer. Both
 * work on a {@link #copy()} and never modify the instance they receive.
 * Instances are not thread-safe.
 * </p>
 *
 * @since 1.0.0
 */
public class Grammar {

    private final Map<Symbol, List<List<Symbol>>> productions = new LinkedHashMap<>();
    private final Set<Symbol> terminals = new LinkedHashSet<>();
    private final Set<Symbol> nonTerminals = new LinkedHashSet<>();
    private final Map<String, Symbol> declaredNames = new LinkedHashMap<>();
    private Symbol startSymbol;

    public Grammar() {}

    /**
     * Builds a grammar from fully computed parts.
     * <p>
     * Unlike the incremental API, the symbol sets are taken exactly as given: the start
     * symbol is <em>not</em> added to the non-terminals. Transformations use this to
     * produce a new grammar whose non-terminal set matches the surviving left-hand sides.
     * </p>
     *
     * @param startSymbol  start symbol, may be {@code null}
     * @param terminals    terminal symbols
     * @param nonTerminals non-terminal symbols
     * @param productions  right-hand sides by left-hand side, in iteration order
     * @return a new grammar
     * @throws IllegalArgumentException if a symbol has the wrong kind or a production
     *                                  refers to a symbol outside the given sets
     */
    public static Grammar of(Symbol startSymbol,
                             Collection<Symbol> terminals,
                             Collection<Symbol> nonTerminals,
                             Map<Symbol, ? extends List<? extends List<Symbol>>> productions) {
        Objects.requireNonNull(terminals, "Terminal set is required");
        Objects.requireNonNull(nonTerminals, "Non-terminal set is required");
        Objects.requireNonNull(productions, "Production map is required");

        Grammar grammar = new Grammar();
        for (Symbol terminal : terminals) {
            if (!terminal.isTerminal()) {
                throw new IllegalArgumentException("Not a terminal: " + terminal.name());
            }
            grammar.register(terminal);
        }
        for (Symbol nonTerminal : nonTerminals) {
            if (!nonTerminal.isNonTerminal()) {
                throw new IllegalArgumentException("Not a non-terminal: " + nonTerminal.name());
            }
            grammar.register(nonTerminal);
        }

        for (var entry : productions.entrySet()) {
            Symbol left = entry.getKey();
            if (!grammar.nonTerminals.contains(left)) {
                throw new IllegalArgumentException("Left-hand side is not a registered non-terminal: " + left.name());
            }
            List<List<Symbol>> rights = grammar.productions.computeIfAbsent(left, k -> new ArrayList<>());
            for (List<Symbol> right : entry.getValue()) {
                for (Symbol symbol : right) {
                    if (!grammar.terminals.contains(symbol) && !grammar.nonTerminals.contains(symbol)) {
                        throw new IllegalArgumentException(String.format(
                                "Production %s refers to unregistered symbol '%s'",
                                GrammarFormatUtils.formatProduction(left, right), symbol.name()
                        ));
                    }
                }
                rights.add(List.copyOf(right));
            }
        }

        if (startSymbol != null) {
            if (!startSymbol.isNonTerminal()) {
                throw new IllegalArgumentException("Start symbol must be a non-terminal: " + startSymbol.name());
            }
            grammar.startSymbol = startSymbol;
            grammar.declaredNames.putIfAbsent(startSymbol.name(), startSymbol);
        }
        return grammar;
    }

    // ==================== Construction ====================

    /**
     * Declares a terminal name for use with {@link #addProduction(String, List)}.
     *
     * @param name terminal name
     * @return the terminal symbol
     * @throws IllegalArgumentException if the name is already declared as a non-terminal
     */
    public Symbol declareTerminal(String name) {
        return declare(Symbol.terminal(name));
    }

    /**
     * Declares a non-terminal name for use with {@link #addProduction(String, List)}.
     *
     * @param name non-terminal name
     * @return the non-terminal symbol
     * @throws IllegalArgumentException if the name is already declared as a terminal
     */
    public Symbol declareNonTerminal(String name) {
        return declare(Symbol.nonTerminal(name));
    }

    /**
     * Appends {@code right} to the productions of {@code left} and registers every symbol
     * involved.
     *
     * @param left  left-hand side, must be a non-terminal
     * @param right right-hand side, empty for the empty string
     * @throws IllegalArgumentException if {@code left} is a terminal
     */
    public void addProduction(Symbol left, List<Symbol> right) {
        Objects.requireNonNull(left, "Left-hand side is required");
        Objects.requireNonNull(right, "Right-hand side is required");
        if (!left.isNonTerminal()) {
            throw new IllegalArgumentException("Left-hand side must be a non-terminal: " + left.name());
        }

        List<Symbol> copy = List.copyOf(right);
        register(left);
        copy.forEach(this::register);
        productions.computeIfAbsent(left, k -> new ArrayList<>()).add(copy);
    }

    /**
     * Name-based variant of {@link #addProduction(Symbol, List)}.
     * <p>
     * The left name is registered as a non-terminal. Every right name must already be
     * classified, either by a declaration or by an earlier production.
     * </p>
     *
     * @param left  left-hand side name
     * @param right right-hand side names
     * @throws UnclassifiedSymbolException if a right name was never classified
     * @throws IllegalArgumentException    if the left name is declared as a terminal
     */
    public void addProduction(String left, List<String> right) {
        Objects.requireNonNull(right, "Right-hand side is required");
        Symbol leftSymbol = resolveNonTerminal(left);

        List<Symbol> symbols = new ArrayList<>(right.size());
        for (String name : right) {
            Symbol symbol = declaredNames.get(name);
            if (symbol == null) {
                throw new UnclassifiedSymbolException(name);
            }
            symbols.add(symbol);
        }
        addProduction(leftSymbol, symbols);
    }

    /**
     * Designates the start symbol and registers it as a non-terminal.
     *
     * @param symbol start symbol, must be a non-terminal
     */
    public void setStartSymbol(Symbol symbol) {
        Objects.requireNonNull(symbol, "Start symbol is required");
        if (!symbol.isNonTerminal()) {
            throw new IllegalArgumentException("Start symbol must be a non-terminal: " + symbol.name());
        }
        register(symbol);
        this.startSymbol = symbol;
    }

    public void setStartSymbol(String name) {
        setStartSymbol(resolveNonTerminal(name));
    }

    /**
     * Removes one occurrence of {@code right} from the productions of {@code left}.
     * <p>
     * A non-terminal losing its last production is dropped from the production map and,
     * unless it is the start symbol, from the non-terminal set.
     * </p>
     *
     * @return {@code true} if a production was removed
     */
    public boolean removeProduction(Symbol left, List<Symbol> right) {
        List<List<Symbol>> rights = productions.get(left);
        if (rights == null || !rights.remove(right)) {
            return false;
        }
        if (rights.isEmpty()) {
            productions.remove(left);
            if (!left.equals(startSymbol)) {
                nonTerminals.remove(left);
            }
        }
        return true;
    }

    // ==================== Queries ====================

    public Symbol getStartSymbol() {
        return startSymbol;
    }

    public Set<Symbol> getTerminals() {
        return Collections.unmodifiableSet(terminals);
    }

    public Set<Symbol> getNonTerminals() {
        return Collections.unmodifiableSet(nonTerminals);
    }

    /**
     * @return a read-only snapshot of the productions, keyed by left-hand side in
     * insertion order
     */
    public Map<Symbol, List<List<Symbol>>> getProductions() {
        Map<Symbol, List<List<Symbol>>> snapshot = new LinkedHashMap<>();
        productions.forEach((left, rights) -> snapshot.put(left, List.copyOf(rights)));
        return Collections.unmodifiableMap(snapshot);
    }

    public List<List<Symbol>> getProductions(Symbol left) {
        List<List<Symbol>> rights = productions.get(left);
        return rights == null ? List.of() : Collections.unmodifiableList(rights);
    }

    public boolean hasProductions(Symbol left) {
        return productions.containsKey(left);
    }

    public int productionCount() {
        return productions.values().stream().mapToInt(List::size).sum();
    }

    /**
     * Looks up a symbol by name among the classified symbols.
     *
     * @param name symbol name
     * @return the first symbol registered under that name
     */
    public Optional<Symbol> findSymbol(String name) {
        return Optional.ofNullable(declaredNames.get(name));
    }

    /**
     * @return every name in use, terminals and non-terminals alike
     */
    public Set<String> symbolNames() {
        Set<String> names = new HashSet<>(declaredNames.keySet());
        terminals.forEach(t -> names.add(t.name()));
        nonTerminals.forEach(n -> names.add(n.name()));
        return names;
    }

    public boolean hasEpsilonProductions() {
        return productions.values().stream()
                .flatMap(List::stream)
                .anyMatch(List::isEmpty);
    }

    public boolean hasUnitProductions() {
        return productions.values().stream()
                .flatMap(List::stream)
                .anyMatch(Grammar::isUnit);
    }

    /**
     * @param right a right-hand side
     * @return {@code true} if it consists of exactly one non-terminal
     */
    public static boolean isUnit(List<Symbol> right) {
        return right.size() == 1 && right.get(0).isNonTerminal();
    }

    // ==================== Structural checks ====================

    /**
     * Checks the Chomsky Normal Form invariant: every right-hand side is one terminal, two
     * non-terminals, or empty on the start symbol only. A start symbol that owns no
     * production fails the check, and so does a start symbol owning the empty right-hand
     * side while appearing on some right-hand side.
     *
     * @return {@code true} if the grammar is in CNF
     */
    public boolean isInCnf() {
        return cnfViolations().isEmpty();
    }

    /**
     * Lists every reason for which {@link #isInCnf()} fails.
     *
     * @return violation descriptions, empty when the grammar is in CNF
     */
    public List<String> cnfViolations() {
        List<String> violations = new ArrayList<>();
        if (startSymbol == null) {
            violations.add("no start symbol");
            return violations;
        }
        if (!productions.containsKey(startSymbol)) {
            violations.add("start symbol '" + startSymbol.name() + "' has no productions");
        }

        for (var entry : productions.entrySet()) {
            Symbol left = entry.getKey();
            for (List<Symbol> right : entry.getValue()) {
                String rule = GrammarFormatUtils.formatProduction(left, right);
                switch (right.size()) {
                    case 0 -> {
                        if (!left.equals(startSymbol)) {
                            violations.add(rule + ": empty right-hand side on a non-start symbol");
                        } else if (appearsOnRightHandSide(startSymbol)) {
                            violations.add(rule + ": start symbol derives the empty string but appears on a right-hand side");
                        }
                    }
                    case 1 -> {
                        if (!right.get(0).isTerminal() || !terminals.contains(right.get(0))) {
                            violations.add(rule + ": single symbol is not a terminal");
                        }
                    }
                    case 2 -> {
                        for (Symbol symbol : right) {
                            if (!symbol.isNonTerminal() || !nonTerminals.contains(symbol)) {
                                violations.add(rule + ": '" + symbol.name() + "' is not a non-terminal");
                            }
                        }
                    }
                    default -> violations.add(rule + ": more than two symbols");
                }
            }
        }
        return violations;
    }

    /**
     * Reports structural problems without throwing, so that callers can decide whether
     * to proceed.
     *
     * @return the problems found, empty for a well-formed grammar
     */
    public List<GrammarError> validate() {
        List<GrammarError> errors = new ArrayList<>();

        if (startSymbol == null) {
            errors.add(new GrammarError(GrammarError.Code.MISSING_START_SYMBOL,
                    "No start symbol has been set"));
        }
        if (productions.isEmpty()) {
            errors.add(new GrammarError(GrammarError.Code.NO_PRODUCTIONS,
                    "The grammar has no productions"));
        }
        if (startSymbol != null && !productions.containsKey(startSymbol)) {
            errors.add(new GrammarError(GrammarError.Code.START_WITHOUT_PRODUCTIONS,
                    "Start symbol '" + startSymbol.name() + "' has no productions"));
        }

        Set<Symbol> undefined = new TreeSet<>();
        for (List<List<Symbol>> rights : productions.values()) {
            for (List<Symbol> right : rights) {
                for (Symbol symbol : right) {
                    if (symbol.isNonTerminal() && !productions.containsKey(symbol)) {
                        undefined.add(symbol);
                    }
                }
            }
        }
        for (Symbol symbol : undefined) {
            errors.add(new GrammarError(GrammarError.Code.UNDEFINED_NON_TERMINAL,
                    "Non-terminal '" + symbol.name() + "' is referenced but has no productions"));
        }

        Set<String> terminalNames = new TreeSet<>();
        terminals.forEach(t -> terminalNames.add(t.name()));
        for (Symbol nonTerminal : new TreeSet<>(nonTerminals)) {
            if (terminalNames.contains(nonTerminal.name())) {
                errors.add(new GrammarError(GrammarError.Code.CONFLICTING_SYMBOL_KIND,
                        "Name '" + nonTerminal.name() + "' is used both as a terminal and as a non-terminal"));
            }
        }
        return errors;
    }

    public GrammarStats stats() {
        return new GrammarStats(
                nonTerminals.size(),
                terminals.size(),
                productionCount(),
                productions.size(),
                startSymbol,
                isInCnf()
        );
    }

    // ==================== Copy & output ====================

    /**
     * @return a deep copy of the production map, the symbol sets and the start symbol
     */
    public Grammar copy() {
        Grammar copy = new Grammar();
        copy.terminals.addAll(terminals);
        copy.nonTerminals.addAll(nonTerminals);
        copy.declaredNames.putAll(declaredNames);
        productions.forEach((left, rights) -> copy.productions.put(left, new ArrayList<>(rights)));
        copy.startSymbol = startSymbol;
        return copy;
    }

    /**
     * Human readable dump: start symbol, sorted symbol lists, then productions grouped by
     * left-hand side in name order, {@code ε} standing for an empty right-hand side.
     *
     * @return the multi-line description
     */
    public String describe() {
        StringBuilder sb = new StringBuilder();
        sb.append("Start symbol: ").append(startSymbol == null ? "<none>" : startSymbol.name()).append('\n');
        sb.append("Non-terminals: ").append(GrammarFormatUtils.sortedNames(nonTerminals)).append('\n');
        sb.append("Terminals: ").append(GrammarFormatUtils.sortedNames(terminals)).append('\n');
        sb.append("Productions:");
        for (Symbol left : new TreeSet<>(productions.keySet())) {
            sb.append('\n').append("  ").append(left.name()).append(' ')
                    .append(GrammarFormatUtils.ARROW).append(' ')
                    .append(GrammarFormatUtils.formatAlternatives(productions.get(left)));
        }
        return sb.toString();
    }

    @Override
    public String toString() {
        StringBuilder sb = new StringBuilder("Grammar(start='")
                .append(startSymbol == null ? "" : startSymbol.name())
                .append("')");
        for (Symbol left : new TreeSet<>(productions.keySet())) {
            sb.append("\n  ").append(left.name()).append(" -> ")
                    .append(GrammarFormatUtils.formatAlternatives(productions.get(left)));
        }
        return sb.toString();
    }

    // ==================== Internals ====================

    private boolean appearsOnRightHandSide(Symbol symbol) {
        return productions.values().stream()
                .flatMap(List::stream)
                .anyMatch(right -> right.contains(symbol));
    }

    private Symbol declare(Symbol symbol) {
        Symbol existing = declaredNames.get(symbol.name());
        if (existing != null && existing.kind() != symbol.kind()) {
            throw new IllegalArgumentException(String.format(
                    "Symbol '%s' is already declared as %s", symbol.name(), existing.kind()
            ));
        }
        register(symbol);
        return symbol;
    }

    private Symbol resolveNonTerminal(String name) {
        Objects.requireNonNull(name, "Symbol name is required");
        Symbol existing = declaredNames.get(name);
        if (existing == null) {
            return declareNonTerminal(name);
        }
        if (!existing.isNonTerminal()) {
            throw new IllegalArgumentException("Symbol '" + name + "' is declared as a terminal");
        }
        return existing;
    }

    private void register(Symbol symbol) {
        if (symbol.isTerminal()) {
            terminals.add(symbol);
        } else {
            nonTerminals.add(symbol);
        }
        declaredNames.putIfAbsent(symbol.name(), symbol);
    }
}
