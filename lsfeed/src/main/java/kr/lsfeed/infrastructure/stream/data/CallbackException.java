package kr.lsfeed.infrastructure.stream.data;

/**
 * Wraps an exception thrown by an application callback during dispatch.
 * Logged at the dispatch boundary; never rethrown into the router loop.
 */
public class CallbackException extends RuntimeException {

    private final String callback;
    private final String target;

    public CallbackException(String callback, String target, Throwable cause) {
        super(String.format("[%s:%s] Callback failed: %s", target, callback, cause.getMessage()), cause);
        this.callback = callback;
        this.target = target;
    }

    /**
     * Identity of the callback that failed.
     */
    public String getCallback() {
        return callback;
    }

    /**
     * Subscription key or handler group the callback was registered on.
     */
    public String getTarget() {
        return target;
    }
}
