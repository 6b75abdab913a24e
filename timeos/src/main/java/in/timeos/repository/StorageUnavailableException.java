package in.timeos.repository;

/**
 * The database could not be reached at all. Sweeps never swallow this one.
 */
public class StorageUnavailableException extends RepositoryException {

    public StorageUnavailableException(String message, Throwable cause) {
        super(message, cause);
    }
}
