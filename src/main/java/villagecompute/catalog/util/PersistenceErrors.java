/*
 * Copyright (c) 2025 VillageCompute Inc. All rights reserved.
 */
package villagecompute.catalog.util;

import com.google.common.base.Throwables;
import jakarta.persistence.LockTimeoutException;
import jakarta.persistence.PessimisticLockException;
import org.hibernate.exception.ConstraintViolationException;
import org.hibernate.exception.LockAcquisitionException;

import java.sql.SQLException;

/**
 * Classifies persistence failures raised through Hibernate and the transaction manager.
 */
public final class PersistenceErrors {

    /**
     * SQLSTATE for unique constraint violations (PostgreSQL and H2).
     */
    private static final String UNIQUE_VIOLATION_SQLSTATE = "23505";

    private PersistenceErrors() {
        // Utility class, no instantiation
    }

    /**
     * Whether a unique constraint violation appears anywhere in the causal chain of {@code error}.
     *
     * @param error
     *            exception thrown by persist/flush/commit
     * @return {@code true} if the failure was a duplicate key
     */
    public static boolean isUniqueViolation(Throwable error) {
        for (Throwable cause : Throwables.getCausalChain(error)) {
            if (cause instanceof ConstraintViolationException cve
                    && UNIQUE_VIOLATION_SQLSTATE.equals(cve.getSQLState())) {
                return true;
            }
            if (cause instanceof SQLException sql && UNIQUE_VIOLATION_SQLSTATE.equals(sql.getSQLState())) {
                return true;
            }
        }
        return false;
    }

    /**
     * Whether {@code error} was caused by failing to acquire a row lock (timeout or deadlock victim).
     *
     * @param error
     *            exception thrown while locking or flushing
     * @return {@code true} if retrying later may succeed
     */
    public static boolean isLockFailure(Throwable error) {
        for (Throwable cause : Throwables.getCausalChain(error)) {
            if (cause instanceof LockTimeoutException || cause instanceof PessimisticLockException
                    || cause instanceof LockAcquisitionException
                    || cause instanceof org.hibernate.PessimisticLockException) {
                return true;
            }
        }
        return false;
    }
}
