package io.github.cyfko.cnfcyk.core.model;

/**
 * The stages of the Chomsky Normal Form pipeline, in execution order.
 * The order is significant and never changes.
 *
 * @since 1.0.0
 */
public enum ConversionStage {

    EPSILON_ELIMINATION("Epsilon elimination",
            "Remove every empty right-hand side, keeping the empty string on the start symbol only"),

    UNIT_ELIMINATION("Unit production elimination",
            "Replace rules of the form A -> B, where B is a non-terminal, by the non-unit rules of B"),

    USELESS_SYMBOL_ELIMINATION("Useless symbol elimination",
            "Remove non-generating symbols first, then symbols unreachable from the start symbol"),

    BINARIZATION("Binarization",
            "Lift terminals out of long right-hand sides and split them into right-branching binary chains");

    private final String title;
    private final String description;

    ConversionStage(String title, String description) {
        this.title = title;
        this.description = description;
    }

    public String title() {
        return title;
    }

    public String description() {
        return description;
    }
}
