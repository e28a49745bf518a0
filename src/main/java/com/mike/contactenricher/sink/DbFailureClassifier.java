package com.mike.contactenricher.sink;

import org.springframework.dao.DataAccessResourceFailureException;
import org.springframework.dao.DataIntegrityViolationException;
import org.springframework.dao.RecoverableDataAccessException;
import org.springframework.dao.TransientDataAccessException;
import org.springframework.transaction.CannotCreateTransactionException;

import java.sql.SQLRecoverableException;
import java.sql.SQLTransientException;

/**
 * Sorts database exceptions into the classes the write path reacts to differently.
 */
public final class DbFailureClassifier {

    private DbFailureClassifier() {
    }

    public static FailureClass classify(Throwable t) {
        for (Throwable cur = t; cur != null; cur = cur.getCause()) {
            if (cur instanceof DataIntegrityViolationException) {
                return FailureClass.INTEGRITY;
            }
            if (cur instanceof TransientDataAccessException
                    || cur instanceof RecoverableDataAccessException
                    || cur instanceof DataAccessResourceFailureException
                    || cur instanceof CannotCreateTransactionException
                    || cur instanceof SQLTransientException
                    || cur instanceof SQLRecoverableException) {
                return FailureClass.TRANSIENT;
            }
            if (cur.getCause() == cur) {
                break;
            }
        }
        return FailureClass.OTHER;
    }

    public static boolean isTransient(Throwable t) {
        return classify(t) == FailureClass.TRANSIENT;
    }
}
