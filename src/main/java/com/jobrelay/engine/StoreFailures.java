package com.jobrelay.engine;

import com.jobrelay.exception.StoreUnavailableException;
import org.springframework.dao.ConcurrencyFailureException;
import org.springframework.dao.DataAccessResourceFailureException;
import org.springframework.dao.RecoverableDataAccessException;
import org.springframework.dao.TransientDataAccessException;
import org.springframework.transaction.CannotCreateTransactionException;

/**
 * Classifies store exceptions into lost races, outages and everything else.
 */
public final class StoreFailures {

    private StoreFailures() {
    }

    /**
     * Row-level contention surfaced by the store while two writers race on the same job.
     */
    public static boolean isConflict(Throwable failure) {
        return failure instanceof ConcurrencyFailureException;
    }

    public static boolean isUnavailable(Throwable failure) {
        if (failure instanceof StoreUnavailableException) {
            return true;
        }
        if (isConflict(failure)) {
            return false;
        }
        return failure instanceof TransientDataAccessException
                || failure instanceof DataAccessResourceFailureException
                || failure instanceof RecoverableDataAccessException
                || failure instanceof CannotCreateTransactionException;
    }

    /**
     * Rethrows outages as {@link StoreUnavailableException}; anything else is returned unchanged for the caller to
     * throw.
     */
    public static RuntimeException translate(String operation, RuntimeException failure) {
        if (failure instanceof StoreUnavailableException) {
            return failure;
        }
        if (isUnavailable(failure)) {
            return new StoreUnavailableException("Job store unavailable during " + operation, failure);
        }
        return failure;
    }
}
