package fr.lapetina.resilience.infrastructure.resilience;

import fr.lapetina.resilience.domain.error.ApplicationError;

import java.sql.SQLIntegrityConstraintViolationException;
import java.sql.SQLNonTransientConnectionException;
import java.sql.SQLTimeoutException;
import java.sql.SQLTransientConnectionException;
import java.util.Locale;
import java.util.concurrent.Callable;

/**
 * Translates raw data-access failures into DATABASE errors.
 *
 * Codes:
 * - DATA_INTEGRITY_VIOLATION: constraint violation
 * - DATABASE_CONNECTION: connection could not be obtained or was lost
 * - DATABASE_TIMEOUT: statement timed out
 * - DATABASE_ERROR: anything else
 *
 * Errors that are already typed pass through untouched.
 */
public final class DatabaseErrorTranslator {

    public static final String DATA_INTEGRITY_VIOLATION = "DATA_INTEGRITY_VIOLATION";
    public static final String DATABASE_CONNECTION = "DATABASE_CONNECTION";
    public static final String DATABASE_TIMEOUT = "DATABASE_TIMEOUT";
    public static final String DATABASE_ERROR = "DATABASE_ERROR";

    /**
     * Runs a data-access operation, translating its failures.
     *
     * @param operation description of the operation, e.g. {@code "insert property"}
     * @param table     table involved, may be null
     * @param call      the data-access call
     */
    public <T> T execute(String operation, String table, Callable<T> call) {
        try {
            return call.call();
        } catch (ApplicationError e) {
            throw e;
        } catch (Exception e) {
            throw translate(operation, table, e);
        }
    }

    public <T> T execute(String operation, Callable<T> call) {
        return execute(operation, null, call);
    }

    /**
     * Maps a failure to a DATABASE error with the matching code.
     */
    public ApplicationError translate(String operation, String table, Exception error) {
        String code = codeFor(error);
        String message = switch (code) {
            case DATA_INTEGRITY_VIOLATION -> "Data integrity violation in " + operation + ": " + error.getMessage();
            case DATABASE_CONNECTION -> "Database connection issue in " + operation + ": " + error.getMessage();
            case DATABASE_TIMEOUT -> "Database operation timeout in " + operation + ": " + error.getMessage();
            default -> "Database error in " + operation + ": " + error.getMessage();
        };
        return ApplicationError.database(operation, message, table, null, error, code);
    }

    static String codeFor(Throwable error) {
        for (Throwable current = error; current != null; current = current.getCause()) {
            if (current instanceof SQLIntegrityConstraintViolationException) {
                return DATA_INTEGRITY_VIOLATION;
            }
            if (current instanceof SQLTransientConnectionException
                    || current instanceof SQLNonTransientConnectionException) {
                return DATABASE_CONNECTION;
            }
            if (current instanceof SQLTimeoutException) {
                return DATABASE_TIMEOUT;
            }
        }
        String message = error.getMessage();
        if (message != null && message.toLowerCase(Locale.ROOT).contains("timeout")) {
            return DATABASE_TIMEOUT;
        }
        return DATABASE_ERROR;
    }
}
