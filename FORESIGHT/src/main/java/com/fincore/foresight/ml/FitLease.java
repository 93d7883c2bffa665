package com.fincore.foresight.ml;

/**
 * Permission for a running fit to publish its result.
 * <p>
 * The trainer revokes the lease when it abandons a fit. A model swaps in its new state
 * only through {@link #commit(Runnable)}, so once {@link #revoke()} has returned no
 * abandoned fit can overwrite the state it had before.
 */
public final class FitLease {

    private static final FitLease UNBOUNDED = new FitLease();

    private boolean revoked;

    /**
     * A lease that is never revoked, for fits run outside a training pass.
     */
    public static FitLease unbounded() {
        return UNBOUNDED;
    }

    public static FitLease open() {
        return new FitLease();
    }

    public synchronized void revoke() {
        revoked = true;
    }

    public synchronized boolean isRevoked() {
        return revoked;
    }

    /**
     * Run {@code publish} unless the lease has been revoked.
     *
     * @return {@code false} when revoked; {@code publish} did not run
     */
    synchronized boolean commit(Runnable publish) {
        if (revoked) {
            return false;
        }
        publish.run();
        return true;
    }
}
