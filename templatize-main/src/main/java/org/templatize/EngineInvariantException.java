package org.templatize;

/**
 * Thrown when the conversion engine detects a broken internal contract, for example an
 * empty leaf sequence. Never a user-facing condition.
 */
public class EngineInvariantException extends TemplatizeException {

    public EngineInvariantException(String message) {
        super(message);
    }
}
