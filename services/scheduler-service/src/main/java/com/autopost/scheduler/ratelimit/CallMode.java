package com.autopost.scheduler.ratelimit;

public enum CallMode {
    /**
     * A caller is waiting: capped waits, bounded attempts.
     */
    INTERACTIVE,
    /**
     * Background work: uncapped waits, retried until it succeeds or is interrupted.
     */
    BATCH
}
