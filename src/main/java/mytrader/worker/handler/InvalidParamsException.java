package mytrader.worker.handler;

/**
 * Handler input that cannot be run. Handlers turn it into a failed task.
 */
public class InvalidParamsException extends Exception {

    public InvalidParamsException(String message) {
        super(message);
    }
}
