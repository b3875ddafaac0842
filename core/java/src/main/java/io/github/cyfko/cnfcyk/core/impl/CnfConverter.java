package io.github.cyfko.cnfcyk.core.impl;

import io.github.cyfko.cnfcyk.core.api.NormalFormConverter;
import io.github.cyfko.cnfcyk.core.config.ConversionPolicy;
import io.github.cyfko.cnfcyk.core.exception.ConversionInvariantViolatedException;
import io.github.cyfko.cnfcyk.core.model.ConversionReport;
import io.github.cyfko.cnfcyk.core.model.ConversionStage;
import io.github.cyfko.cnfcyk.core.model.Grammar;
import io.github.cyfko.cnfcyk.core.model.Symbol;
import io.github.cyfko.cnfcyk.core.normalization.*;
import io.github.cyfko.cnfcyk.core.spi.ConversionListener;

import java.util.*;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.logging.Logger;

/**
 * Four-stage Chomsky Normal Form converter.
 * <p>
 * The stages always run in this order, each one consuming the grammar produced by the
 * previous one:
 * </p>
 * <ol>
 *   <li>{@link EpsilonEliminator epsilon elimination}</li>
 *   <li>{@link UnitProductionEliminator unit production elimination}</li>
 *   <li>{@link UselessSymbolEliminator useless symbol elimination}</li>
 *   <li>{@link Binarizer binarization}</li>
 * </ol>
 * <p>
 * The result is then checked with {@link Grammar#isInCnf()}. A failing check raises a
 * {@link ConversionInvariantViolatedException} unless the policy disables
 * {@link ConversionPolicy#failOnInvariantViolation()}, in which case it is only logged.
 * </p>
 *
 * <h2>Usage Example</h2>
 * <pre>{@code
 * CnfConverter converter = new CnfConverter();
 * Grammar cnf = converter.toCnf(grammar);
 *
 * CykParser parser = new CykParser(cnf);
 * ParseResult result = parser.parse(List.of("id", "+", "id"));
 * }</pre>
 *
 * <h2>Thread Safety</h2>
 * <p>
 * A converter holds no per-run state: the fresh name counter is created for each run and
 * threaded through the stages. A single instance can convert grammars from several
 * threads, provided each grammar is not modified concurrently.
 * </p>
 *
 * @since 1.0.0
 */
public class CnfConverter implements NormalFormConverter {

    private static final Logger log = Logger.getLogger(CnfConverter.class.getName());

    private final ConversionPolicy policy;
    private final List<ConversionListener> listeners = new CopyOnWriteArrayList<>();

    public CnfConverter() {
        this(ConversionPolicy.defaults());
    }

    public CnfConverter(ConversionPolicy policy) {
        this.policy = Objects.requireNonNull(policy, "Conversion policy is required");
    }

    public CnfConverter addListener(ConversionListener listener) {
        listeners.add(Objects.requireNonNull(listener, "Listener is required"));
        return this;
    }

    public ConversionPolicy getPolicy() {
        return policy;
    }

    /**
     * {@inheritDoc}
     *
     * @throws IllegalArgumentException              if the grammar has no start symbol
     * @throws ConversionInvariantViolatedException if the result is not in CNF and the policy
     *                                              treats it as a failure
     */
    @Override
    public ConversionReport convert(Grammar grammar) {
        Objects.requireNonNull(grammar, "Grammar is required");
        if (grammar.getStartSymbol() == null) {
            throw new IllegalArgumentException("Grammar has no start symbol");
        }

        Grammar original = grammar.copy();
        FreshSymbolGenerator generator = new FreshSymbolGenerator(original);
        long start = System.nanoTime();

        log.fine(() -> "Converting grammar to CNF:\n" + original.describe());

        Set<Symbol> nullable = EpsilonEliminator.nullableSymbols(original);
        Grammar current = EpsilonEliminator.eliminate(original, generator, policy);
        completed(ConversionStage.EPSILON_ELIMINATION, current);

        Map<Symbol, Set<Symbol>> unitClosure = UnitProductionEliminator.unitClosure(current);
        current = UnitProductionEliminator.eliminate(current);
        completed(ConversionStage.UNIT_ELIMINATION, current);

        current = UselessSymbolEliminator.eliminate(current);
        completed(ConversionStage.USELESS_SYMBOL_ELIMINATION, current);

        current = Binarizer.binarize(current, generator, policy);
        completed(ConversionStage.BINARIZATION, current);

        List<String> violations = current.cnfViolations();
        if (!violations.isEmpty()) {
            Grammar result = current;
            listeners.forEach(l -> l.onInvariantViolation(result.copy(), violations));
            if (policy.failOnInvariantViolation()) {
                throw new ConversionInvariantViolatedException(violations);
            }
            log.warning(() -> "Converted grammar may not be in Chomsky Normal Form: " + violations);
        }

        ConversionReport report = new ConversionReport(original, current, nullable, unitClosure);
        long durationMs = (System.nanoTime() - start) / 1_000_000;
        log.fine(() -> String.format(
                "CNF conversion finished in %d ms: %s",
                durationMs, report.stats()
        ));
        return report;
    }

    private void completed(ConversionStage stage, Grammar grammar) {
        log.fine(() -> stage.title() + ":\n" + grammar.describe());
        for (ConversionListener listener : listeners) {
            listener.onStageCompleted(stage, grammar.copy());
        }
    }
}
