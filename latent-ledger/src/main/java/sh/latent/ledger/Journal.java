// SPDX-License-Identifier: MIT OR Apache-2.0
package sh.latent.ledger;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.List;
import java.util.Objects;
import java.util.function.Supplier;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import sh.latent.core.DebugLogger;
import sh.latent.core.LogFormatter;
import sh.latent.core.error.LedgerException;

/**
 * Undo log that makes each ledger operation all-or-nothing.
 *
 * <p>Every component that mutates ledger state records the inverse of the mutation
 * with {@link #record(Runnable)}. A top-level operation runs inside
 * {@link #atomically(String, Supplier)}: if it throws, the recorded inverses are
 * replayed newest first and the exception is rethrown, so neither state nor events
 * from the failed operation remain.
 *
 * <p>Units nest. A nested unit (for example a transfer issued by a receiver
 * callback while a delivery is in progress) is a savepoint: its failure undoes only
 * its own mutations, and its success folds them into the enclosing unit. Commit
 * listeners run once, when the outermost unit completes.
 *
 * <p>Mutations recorded outside any unit are applied immediately with no way back.
 *
 * <p>Not thread-safe. Callers are expected to be sequenced externally, one
 * operation at a time.
 *
 * @since 0.1.0
 */
public final class Journal {

    private static final Logger log = LoggerFactory.getLogger(Journal.class);

    private final Deque<Runnable> undo = new ArrayDeque<>();
    private final List<Runnable> commitListeners = new ArrayList<>();
    private int depth;

    /**
     * Runs {@code body} as one atomic unit.
     *
     * @param operation name used in logs when the unit aborts
     * @param body      the work to perform
     * @param <T>       result type
     * @return the body's result
     */
    public <T> T atomically(final String operation, final Supplier<T> body) {
        Objects.requireNonNull(body, "body");
        final int mark = undo.size();
        depth++;
        final T result;
        try {
            result = body.get();
        } catch (RuntimeException | Error e) {
            final int undone = rollbackTo(mark);
            depth--;
            log.debug("{} aborted after {} mutation(s): {}", operation, undone, e.toString());
            DebugLogger.logLedger(LogFormatter.formatAbort(operation, reasonOf(e), undone));
            throw e;
        }
        depth--;
        if (depth == 0) {
            undo.clear();
            fireCommit();
        }
        return result;
    }

    /**
     * Runs {@code body} as one atomic unit.
     *
     * @param operation name used in logs when the unit aborts
     * @param body      the work to perform
     */
    public void atomically(final String operation, final Runnable body) {
        Objects.requireNonNull(body, "body");
        atomically(operation, () -> {
            body.run();
            return null;
        });
    }

    /**
     * Records the inverse of a mutation that has just been applied.
     *
     * @param inverse restores the state that existed before the mutation
     */
    public void record(final Runnable inverse) {
        Objects.requireNonNull(inverse, "inverse");
        if (depth > 0) {
            undo.push(inverse);
        }
    }

    /**
     * Registers a callback run after every outermost unit commits.
     *
     * @param listener the callback
     */
    public void onCommit(final Runnable listener) {
        commitListeners.add(Objects.requireNonNull(listener, "listener"));
    }

    /** Returns {@code true} while an atomic unit is running. */
    public boolean inUnit() {
        return depth > 0;
    }

    /** Number of inverses held for the units currently running. */
    public int pending() {
        return undo.size();
    }

    private int rollbackTo(final int mark) {
        int undone = 0;
        while (undo.size() > mark) {
            undo.pop().run();
            undone++;
        }
        return undone;
    }

    private void fireCommit() {
        // Copy: a listener may register further listeners.
        for (Runnable listener : List.copyOf(commitListeners)) {
            listener.run();
        }
    }

    private static String reasonOf(final Throwable e) {
        if (e instanceof LedgerException le) {
            return le.reason().name();
        }
        return e.getClass().getSimpleName();
    }
}
