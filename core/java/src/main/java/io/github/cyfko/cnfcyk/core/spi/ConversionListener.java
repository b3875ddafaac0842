package io.github.cyfko.cnfcyk.core.spi;

import io.github.cyfko.cnfcyk.core.model.ConversionStage;
import io.github.cyfko.cnfcyk.core.model.Grammar;

import java.util.List;

/**
 * Observer of a Chomsky Normal Form conversion, for step-by-step reporting layers.
 * <p>
 * Callbacks run synchronously on the converting thread. Snapshots are copies: a listener
 * may keep or modify them without affecting the conversion.
 * </p>
 *
 * <pre>{@code
 * CnfConverter converter = new CnfConverter()
 *     .addListener(new ConversionListener() {
 *         @Override
 *         public void onStageCompleted(ConversionStage stage, Grammar snapshot) {
 *             System.out.println(stage.title() + "\n" + snapshot.describe());
 *         }
 *     });
 * }</pre>
 *
 * @since 1.0.0
 */
public interface ConversionListener {

    /**
     * Called after each stage, in pipeline order.
     *
     * @param stage    the stage that just ran
     * @param snapshot copy of the grammar produced by the stage
     */
    default void onStageCompleted(ConversionStage stage, Grammar snapshot) {}

    /**
     * Called when the converted grammar fails the CNF check, before the converter decides
     * whether to fail.
     *
     * @param result     copy of the converted grammar
     * @param violations CNF violations found
     */
    default void onInvariantViolation(Grammar result, List<String> violations) {}
}
