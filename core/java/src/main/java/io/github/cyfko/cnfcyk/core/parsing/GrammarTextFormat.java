package io.github.cyfko.cnfcyk.core.parsing;

import io.github.cyfko.cnfcyk.core.exception.GrammarSyntaxException;
import io.github.cyfko.cnfcyk.core.model.Grammar;
import io.github.cyfko.cnfcyk.core.model.Symbol;
import io.github.cyfko.cnfcyk.core.utils.GrammarFormatUtils;

import java.util.*;
import java.util.regex.Pattern;

/**
 * Reads and writes grammars in a line-oriented text notation.
 *
 * <h2>Syntax</h2>
 * <pre>
 * E -> E + T | T
 * T -> T * F | F
 * F -> ( E ) | id
 * A -> a | ε
 * </pre>
 * <ul>
 *   <li>One left-hand side per line, followed by {@code ->} and alternatives separated by {@code |}</li>
 *   <li>Symbols within an alternative are separated by whitespace</li>
 *   <li>{@code ε} alone, or an empty alternative, denotes the empty right-hand side</li>
 *   <li>Blank lines and lines without {@code ->} are ignored</li>
 *   <li>A left-hand side may appear on several lines; its alternatives accumulate</li>
 * </ul>
 *
 * <h2>Classification</h2>
 * <p>
 * Every name that appears as a left-hand side is a non-terminal, every other name is a
 * terminal. The first left-hand side is the start symbol.
 * </p>
 *
 * @since 1.0.0
 */
public final class GrammarTextFormat {

    private static final Pattern WHITESPACE = Pattern.compile("\\s+");

    private GrammarTextFormat() {}

    /**
     * Parses grammar text.
     *
     * @param text the grammar text
     * @return a new grammar; without any rule line, a grammar with no start symbol
     * @throws GrammarSyntaxException if a rule line is malformed
     */
    public static Grammar parse(String text) {
        Objects.requireNonNull(text, "Grammar text is required");

        List<RuleLine> rules = new ArrayList<>();
        String[] lines = text.split("\\R");
        for (int i = 0; i < lines.length; i++) {
            String line = lines[i].trim();
            int arrow = line.indexOf(GrammarFormatUtils.ARROW);
            if (line.isEmpty() || arrow < 0) {
                continue;
            }
            int lineNumber = i + 1;
            String left = line.substring(0, arrow).trim();
            if (left.isEmpty()) {
                throw new GrammarSyntaxException(lineNumber, "missing left-hand side");
            }
            if (WHITESPACE.matcher(left).find()) {
                throw new GrammarSyntaxException(lineNumber, "left-hand side '" + left + "' must be a single symbol");
            }
            if (left.equals(GrammarFormatUtils.EPSILON)) {
                throw new GrammarSyntaxException(lineNumber, "'ε' cannot be a left-hand side");
            }
            rules.add(new RuleLine(left, alternatives(lineNumber, line.substring(arrow + GrammarFormatUtils.ARROW.length()))));
        }

        Grammar grammar = new Grammar();
        if (rules.isEmpty()) {
            return grammar;
        }

        Set<String> nonTerminals = new LinkedHashSet<>();
        rules.forEach(rule -> nonTerminals.add(rule.left()));
        nonTerminals.forEach(grammar::declareNonTerminal);
        for (RuleLine rule : rules) {
            for (List<String> right : rule.alternatives()) {
                for (String name : right) {
                    if (!nonTerminals.contains(name)) {
                        grammar.declareTerminal(name);
                    }
                }
            }
        }

        grammar.setStartSymbol(rules.get(0).left());
        for (RuleLine rule : rules) {
            for (List<String> right : rule.alternatives()) {
                grammar.addProduction(rule.left(), right);
            }
        }
        return grammar;
    }

    /**
     * Writes a grammar in the notation read by {@link #parse(String)}: start symbol first,
     * other left-hand sides in insertion order, one line each.
     * <p>
     * Reading the output back yields the same productions when every non-terminal owns at
     * least one production, since classification is inferred from left-hand sides.
     * </p>
     *
     * @param grammar the grammar
     * @return the text, one line per left-hand side
     */
    public static String format(Grammar grammar) {
        Objects.requireNonNull(grammar, "Grammar is required");
        Map<Symbol, List<List<Symbol>>> productions = grammar.getProductions();

        List<Symbol> order = new ArrayList<>(productions.size());
        Symbol start = grammar.getStartSymbol();
        if (start != null && productions.containsKey(start)) {
            order.add(start);
        }
        for (Symbol left : productions.keySet()) {
            if (!left.equals(start)) {
                order.add(left);
            }
        }

        StringJoiner joiner = new StringJoiner("\n");
        for (Symbol left : order) {
            joiner.add(left.name() + " " + GrammarFormatUtils.ARROW + " "
                    + GrammarFormatUtils.formatAlternatives(productions.get(left)));
        }
        return joiner.toString();
    }

    private static List<List<String>> alternatives(int lineNumber, String body) {
        List<List<String>> alternatives = new ArrayList<>();
        for (String alternative : body.split(Pattern.quote(GrammarFormatUtils.ALTERNATIVE_SEPARATOR), -1)) {
            String trimmed = alternative.trim();
            if (trimmed.isEmpty() || trimmed.equals(GrammarFormatUtils.EPSILON)) {
                alternatives.add(List.of());
                continue;
            }
            List<String> names = Arrays.asList(WHITESPACE.split(trimmed));
            if (names.contains(GrammarFormatUtils.EPSILON)) {
                throw new GrammarSyntaxException(lineNumber, "'ε' must stand alone in an alternative");
            }
            alternatives.add(List.copyOf(names));
        }
        return alternatives;
    }

    private record RuleLine(String left, List<List<String>> alternatives) {}
}
