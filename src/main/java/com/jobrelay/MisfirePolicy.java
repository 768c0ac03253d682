package com.jobrelay;

/**
 * What the cron scheduler does when one or more firings of a definition were missed.
 */
public enum MisfirePolicy {

    /**
     * Materialize a single catch-up job and fast-forward to the next future firing.
     */
    COLLAPSE,

    /**
     * Materialize one job per missed firing, bounded per evaluation tick.
     */
    BACKFILL
}
