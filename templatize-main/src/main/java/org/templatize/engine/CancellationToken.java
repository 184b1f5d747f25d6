package org.templatize.engine;

/**
 * A {@link CancellationSignal} that is flipped once, from any thread.
 */
public final class CancellationToken implements CancellationSignal {

    private volatile boolean cancelled;

    public void cancel() {
        cancelled = true;
    }

    @Override
    public boolean isCancellationRequested() {
        return cancelled;
    }
}
