package mytrader.worker.store;

/**
 * Storage-layer failure of the task store. Always propagated to the caller.
 */
public class TaskStoreException extends RuntimeException {

    public TaskStoreException(String message) {
        super(message);
    }

    public TaskStoreException(String message, Throwable cause) {
        super(message, cause);
    }
}
