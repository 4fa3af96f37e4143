package sh.nebula.registry.store;

/**
 * Raised by a {@link RegistrationStore} when the backing store rejects or fails an operation.
 */
public class RegistryStoreException extends RuntimeException {

    public RegistryStoreException(String message) {
        super(message);
    }

    public RegistryStoreException(String message, Throwable cause) {
        super(message, cause);
    }

    public static RegistryStoreException operationFailed(String operation, Throwable cause) {
        return new RegistryStoreException("Registry store operation failed: " + operation, cause);
    }
}
