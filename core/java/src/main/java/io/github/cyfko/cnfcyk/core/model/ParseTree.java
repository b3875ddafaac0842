package io.github.cyfko.cnfcyk.core.model;

import java.util.*;

/**
 * Immutable parse tree node over an inclusive token span {@code [start, end]}.
 * <p>
 * Leaves ({@code isTerminal == true}) hold a matched token, span a single position and have
 * no children. Inner nodes hold a non-terminal and have one child (a leaf) or two children
 * (a binary rule), consistent with the CNF production that produced them. A tree shares
 * nothing with the chart it was built from.
 * </p>
 *
 * @param symbol     node symbol
 * @param start      first token index covered
 * @param end        last token index covered
 * @param isTerminal whether the node is a leaf holding a token
 * @param children   ordered children
 * @since 1.0.0
 */
public record ParseTree(Symbol symbol, int start, int end, boolean isTerminal, List<ParseTree> children) {

    public ParseTree {
        Objects.requireNonNull(symbol, "Symbol is required");
        if (start < 0 || end < start) {
            throw new IllegalArgumentException("Invalid span [" + start + ", " + end + "]");
        }
        children = List.copyOf(children);
        if (isTerminal && (start != end || !children.isEmpty())) {
            throw new IllegalArgumentException("A terminal node spans one token and has no children");
        }
    }

    public static ParseTree leaf(Symbol terminal, int position) {
        return new ParseTree(terminal, position, position, true, List.of());
    }

    public static ParseTree node(Symbol nonTerminal, int start, int end, List<ParseTree> children) {
        return new ParseTree(nonTerminal, start, end, false, children);
    }

    /**
     * @return the inclusive span as a two-element list {@code [start, end]}
     */
    public List<Integer> span() {
        return List.of(start, end);
    }

    /**
     * @return the token names at the leaves, left to right
     */
    public List<String> leafTokens() {
        List<String> tokens = new ArrayList<>(end - start + 1);
        Deque<ParseTree> pending = new ArrayDeque<>();
        pending.push(this);
        while (!pending.isEmpty()) {
            ParseTree node = pending.pop();
            if (node.isTerminal) {
                tokens.add(node.symbol.name());
            }
            for (int c = node.children.size() - 1; c >= 0; c--) {
                pending.push(node.children.get(c));
            }
        }
        return tokens;
    }

    /**
     * Plain nested structure {@code {symbol, span: [start, end], isTerminal, children: [...]}},
     * suitable for JSON serializers and renderers.
     *
     * @return a mutable map owned by the caller
     */
    public Map<String, Object> toMap() {
        Map<String, Object> map = new LinkedHashMap<>();
        map.put("symbol", symbol.name());
        map.put("span", span());
        map.put("isTerminal", isTerminal);
        List<Map<String, Object>> childMaps = new ArrayList<>(children.size());
        for (ParseTree child : children) {
            childMaps.add(child.toMap());
        }
        map.put("children", childMaps);
        return map;
    }

    /**
     * Indented text rendering, one node per line, each inner node followed by the tokens it
     * covers:
     * <pre>
     * E [id + id]
     *   E [id]
     *     id
     *   ...
     * </pre>
     *
     * @param tokens the parsed sentence
     * @return the rendering
     */
    public String render(List<String> tokens) {
        StringBuilder sb = new StringBuilder();
        Deque<Map.Entry<ParseTree, Integer>> pending = new ArrayDeque<>();
        pending.push(Map.entry(this, 0));
        while (!pending.isEmpty()) {
            var entry = pending.pop();
            ParseTree node = entry.getKey();
            int depth = entry.getValue();
            if (sb.length() > 0) sb.append('\n');
            sb.append("  ".repeat(depth)).append(node.symbol.name());
            if (!node.isTerminal) {
                sb.append(" [").append(String.join(" ", tokens.subList(node.start, node.end + 1))).append(']');
            }
            for (int c = node.children.size() - 1; c >= 0; c--) {
                pending.push(Map.entry(node.children.get(c), depth + 1));
            }
        }
        return sb.toString();
    }
}
