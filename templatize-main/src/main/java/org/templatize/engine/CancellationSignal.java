package org.templatize.engine;

import org.templatize.OperationCanceledException;

/**
 * Cooperative cancellation, polled by the engine between stages and while flattening.
 */
@FunctionalInterface
public interface CancellationSignal {

    CancellationSignal NONE = () -> false;

    boolean isCancellationRequested();

    default void throwIfCancellationRequested(String stage) {
        if (isCancellationRequested()) {
            throw new OperationCanceledException(stage);
        }
    }
}
