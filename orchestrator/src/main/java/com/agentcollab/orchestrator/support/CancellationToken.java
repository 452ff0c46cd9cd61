package com.agentcollab.orchestrator.support;

import com.agentcollab.orchestrator.orchestration.ExecutionCancelledException;

import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Cooperative cancellation signal scoped to one team execution.
 *
 * Executors check it before every model and tool call. Code that blocks on a
 * call registers a callback with {@link #onCancel} (typically interrupting its
 * own thread) so a cancel also reaches calls already in flight.
 */
public final class CancellationToken {

    private volatile boolean cancelled;
    private volatile String  reason;
    private final Set<Runnable> callbacks = ConcurrentHashMap.newKeySet();

    /** Handle returned by {@link #onCancel}; closing it unregisters the callback. */
    @FunctionalInterface
    public interface Registration extends AutoCloseable {
        @Override
        void close();
    }

    public void cancel(String why) {
        synchronized (this) {
            if (cancelled) return;
            this.reason    = why;
            this.cancelled = true;
        }
        callbacks.forEach(Runnable::run);
    }

    public boolean isCancelled() {
        return cancelled;
    }

    public String reason() {
        return reason;
    }

    public void throwIfCancelled() {
        if (cancelled) {
            throw new ExecutionCancelledException(reason == null ? "Cancelled" : reason);
        }
    }

    /**
     * Run {@code callback} when the token is cancelled, or right away if it
     * already is.
     */
    public Registration onCancel(Runnable callback) {
        callbacks.add(callback);
        if (cancelled) {
            callback.run();
        }
        return () -> callbacks.remove(callback);
    }

    /**
     * Registration that interrupts the calling thread on cancel. The
     * interrupt flag is cleared again on close so a late interrupt cannot
     * leak into whatever the thread does next.
     */
    public Registration interruptOnCancel() {
        Interrupter interrupter = new Interrupter(Thread.currentThread());
        Registration reg = onCancel(interrupter);
        return () -> {
            interrupter.disarm();
            reg.close();
            if (Thread.currentThread() == interrupter.target && cancelled) {
                Thread.interrupted();
            }
        };
    }

    /**
     * Interrupts its target until disarmed. Both sides lock the instance, so
     * once {@link #disarm} returns no callback still running on a cancelling
     * thread can interrupt the target.
     */
    static final class Interrupter implements Runnable {
        final Thread target;
        private boolean armed = true;

        Interrupter(Thread target) {
            this.target = target;
        }

        @Override
        public synchronized void run() {
            if (armed) {
                target.interrupt();
            }
        }

        synchronized void disarm() {
            armed = false;
        }
    }
}
