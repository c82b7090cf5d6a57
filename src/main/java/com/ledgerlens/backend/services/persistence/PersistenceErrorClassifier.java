package com.ledgerlens.backend.services.persistence;

import java.sql.SQLException;

import org.springframework.dao.DataAccessResourceFailureException;
import org.springframework.dao.DataIntegrityViolationException;
import org.springframework.dao.DuplicateKeyException;
import org.springframework.dao.RecoverableDataAccessException;
import org.springframework.dao.TransientDataAccessException;
import org.springframework.stereotype.Component;
import org.springframework.transaction.CannotCreateTransactionException;

import com.ledgerlens.backend.exceptions.ConstraintKind;
import com.ledgerlens.backend.services.persistence.PersistenceError.ErrorKind;

/**
 * Maps database exceptions to {@link PersistenceError}s.
 *
 * <p>Constraint and data errors are final. Lost connections, lock and query timeouts and
 * deadlocks are retryable. The SQLState of the innermost {@link SQLException} decides
 * when Spring's exception type alone is not specific enough.</p>
 */
@Component
public class PersistenceErrorClassifier {

    public PersistenceError classify(Throwable error, Integer rowIndex) {
        String sqlState = sqlState(error);
        String message = rootMessage(error);

        if (error instanceof DuplicateKeyException) {
            return constraint(rowIndex, ConstraintKind.UNIQUE, message);
        }
        if (isRetryable(error, sqlState)) {
            return new PersistenceError(rowIndex, ErrorKind.CONNECTIVITY, null, true, message);
        }
        if (error instanceof DataIntegrityViolationException || isConstraintState(sqlState)) {
            return constraint(rowIndex, constraintKind(sqlState), message);
        }
        return new PersistenceError(rowIndex, ErrorKind.UNKNOWN, null, false, message);
    }

    static ConstraintKind constraintKind(String sqlState) {
        if (sqlState == null) return ConstraintKind.OTHER;
        switch (sqlState) {
            case "23505":
                return ConstraintKind.UNIQUE;
            case "23503":
            case "23506":
                return ConstraintKind.FOREIGN_KEY;
            case "23502":
                return ConstraintKind.NOT_NULL;
            case "23513":
            case "23514":
                return ConstraintKind.CHECK;
            default:
                return sqlState.startsWith("22") ? ConstraintKind.DATA : ConstraintKind.OTHER;
        }
    }

    private static boolean isRetryable(Throwable error, String sqlState) {
        if (error instanceof TransientDataAccessException
                || error instanceof RecoverableDataAccessException
                || error instanceof DataAccessResourceFailureException
                || error instanceof CannotCreateTransactionException) {
            return true;
        }
        if (sqlState == null) return false;
        // 08: connection exception, 40: transaction rollback (deadlock, serialization), 57014/HYT00: timeouts
        return sqlState.startsWith("08") || sqlState.startsWith("40")
                || sqlState.equals("57014") || sqlState.equals("HYT00") || sqlState.equals("55P03");
    }

    private static boolean isConstraintState(String sqlState) {
        return sqlState != null && (sqlState.startsWith("23") || sqlState.startsWith("22"));
    }

    private static PersistenceError constraint(Integer rowIndex, ConstraintKind kind, String message) {
        return new PersistenceError(rowIndex, ErrorKind.CONSTRAINT_VIOLATION, kind, false, message);
    }

    private static String sqlState(Throwable error) {
        String state = null;
        Throwable cur = error;
        while (cur != null) {
            if (cur instanceof SQLException sql && sql.getSQLState() != null) {
                state = sql.getSQLState();
            }
            cur = cur.getCause() == cur ? null : cur.getCause();
        }
        return state;
    }

    private static String rootMessage(Throwable error) {
        Throwable cur = error;
        while (cur.getCause() != null && cur.getCause() != cur) {
            cur = cur.getCause();
        }
        String message = cur.getMessage() != null ? cur.getMessage() : cur.getClass().getSimpleName();
        return message.length() > 300 ? message.substring(0, 300) : message;
    }
}
