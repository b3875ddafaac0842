package io.github.cyfko.cnfcyk.core.exception;

/**
 * Base class of every exception raised by the grammar normalization and recognition
 * library.
 * <p>
 * All library exceptions are unchecked. Structural grammar problems are <em>not</em>
 * reported through exceptions: see {@link io.github.cyfko.cnfcyk.core.model.Grammar#validate()}.
 * </p>
 *
 * @since 1.0.0
 */
public class CnfCykException extends RuntimeException {

    public CnfCykException(String message) {
        super(message);
    }

    public CnfCykException(String message, Throwable cause) {
        super(message, cause);
    }
}
