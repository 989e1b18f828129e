package com.codeops.notebook.service;

import com.codeops.notebook.exception.OperationStep;
import com.codeops.notebook.exception.StoreException;
import org.springframework.dao.DataAccessException;
import org.springframework.dao.DataIntegrityViolationException;

import java.util.function.Supplier;

/**
 * Tags store calls with the step they belong to, so a data access failure surfaces as a
 * {@link StoreException} naming that step.
 */
final class StoreCalls {

    private StoreCalls() {}

    static <T> T call(OperationStep step, Supplier<T> action) {
        try {
            return action.get();
        } catch (DataAccessException e) {
            throw new StoreException(step, e);
        }
    }

    /**
     * Runs an insert guarded by a unique key. A key conflict, such as a concurrent insert of the
     * same row, surfaces as the exception from {@code onConflict}.
     */
    static <T> T insert(OperationStep step, Supplier<T> action, Supplier<? extends RuntimeException> onConflict) {
        try {
            return action.get();
        } catch (DataIntegrityViolationException e) {
            throw onConflict.get();
        } catch (DataAccessException e) {
            throw new StoreException(step, e);
        }
    }

    static void run(OperationStep step, Runnable action) {
        try {
            action.run();
        } catch (DataAccessException e) {
            throw new StoreException(step, e);
        }
    }
}
