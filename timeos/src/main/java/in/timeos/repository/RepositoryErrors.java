package in.timeos.repository;

import java.sql.SQLException;
import java.sql.SQLTransientConnectionException;

/**
 * Maps JDBC failures onto the repository exception types.
 */
final class RepositoryErrors {

    // SQLState class 08: connection exception
    private static final String CONNECTION_STATE_CLASS = "08";

    static RepositoryException wrap(String message, Exception e) {
        if (e instanceof RepositoryException re) {
            return re;
        }
        if (isConnectionFailure(e)) {
            return new StorageUnavailableException(message + ": database unavailable", e);
        }
        return new RepositoryException(message, e);
    }

    static boolean isConnectionFailure(Throwable e) {
        for (Throwable t = e; t != null; t = t.getCause()) {
            if (t instanceof SQLTransientConnectionException) {
                return true;
            }
            if (t instanceof SQLException sql && sql.getSQLState() != null
                    && sql.getSQLState().startsWith(CONNECTION_STATE_CLASS)) {
                return true;
            }
        }
        return false;
    }

    private RepositoryErrors() {}
}
