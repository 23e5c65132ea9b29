package express.mvp.controlbridge.client.error;

import express.mvp.controlbridge.client.BridgeException;
import express.mvp.controlbridge.client.protocol.FramingException;
import java.io.IOException;
import java.net.ConnectException;
import java.net.NoRouteToHostException;
import java.net.SocketException;
import java.net.SocketTimeoutException;
import java.net.UnknownHostException;
import java.nio.channels.ClosedChannelException;
import java.util.Locale;
import java.util.concurrent.CancellationException;
import java.util.concurrent.CompletionException;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.TimeoutException;
import javax.net.ssl.SSLException;

/**
 * Classifies exceptions into error categories for retry decisions.
 *
 * <h2>Classification Strategy</h2>
 *
 * <ol>
 *   <li>Unwrap {@link CompletionException} and {@link ExecutionException}
 *   <li>{@link BridgeException}: the category of its {@link
 *       express.mvp.controlbridge.client.BridgeError}
 *   <li>JVM and security errors are fatal
 *   <li>Network exception types, then timeout types, then malformed frames
 *   <li>Message analysis, then the cause chain
 *   <li>Default to UNKNOWN
 * </ol>
 *
 * @see ErrorCategory
 */
public final class ErrorClassifier {

    private ErrorClassifier() {
        // Utility class
    }

    /**
     * Classifies an exception into an error category.
     *
     * @param throwable the exception to classify
     * @return the error category
     */
    public static ErrorCategory classify(Throwable throwable) {
        if (throwable == null) {
            return ErrorCategory.UNKNOWN;
        }

        if ((throwable instanceof CompletionException || throwable instanceof ExecutionException)
                && throwable.getCause() != null) {
            return classify(throwable.getCause());
        }

        if (throwable instanceof BridgeException bridgeException) {
            return bridgeException.getError().category();
        }

        if (throwable instanceof VirtualMachineError
                || throwable instanceof LinkageError
                || throwable instanceof SecurityException
                || throwable instanceof RejectedExecutionException
                || throwable instanceof CancellationException) {
            return ErrorCategory.FATAL;
        }

        if (isNetworkError(throwable)) {
            return ErrorCategory.NETWORK;
        }

        if (throwable instanceof TimeoutException || throwable instanceof SocketTimeoutException) {
            return ErrorCategory.TRANSIENT;
        }

        if (throwable instanceof FramingException) {
            return ErrorCategory.PROTOCOL;
        }

        if (throwable instanceof InterruptedException) {
            return ErrorCategory.TRANSIENT;
        }

        ErrorCategory messageCategory = classifyByMessage(throwable);
        if (messageCategory != null) {
            return messageCategory;
        }

        Throwable cause = throwable.getCause();
        if (cause != null && cause != throwable) {
            return classify(cause);
        }

        return ErrorCategory.UNKNOWN;
    }

    private static boolean isNetworkError(Throwable t) {
        if (t instanceof ConnectException
                || t instanceof UnknownHostException
                || t instanceof NoRouteToHostException
                || t instanceof ClosedChannelException
                || t instanceof SocketException
                || t instanceof SSLException) {
            return true;
        }

        if (t instanceof IOException) {
            String lower = lowerMessage(t);
            return lower.contains("connection")
                    || lower.contains("socket")
                    || lower.contains("network");
        }

        return false;
    }

    private static ErrorCategory classifyByMessage(Throwable t) {
        String lower = lowerMessage(t);
        if (lower.isEmpty()) {
            return null;
        }

        if (lower.contains("timeout") || lower.contains("timed out")) {
            return ErrorCategory.TRANSIENT;
        }

        if (lower.contains("connection")
                && (lower.contains("reset")
                        || lower.contains("refused")
                        || lower.contains("closed")
                        || lower.contains("lost"))) {
            return ErrorCategory.NETWORK;
        }

        if (lower.contains("invalid")
                || lower.contains("malformed")
                || lower.contains("unexpected")) {
            return ErrorCategory.PROTOCOL;
        }

        return null;
    }

    private static String lowerMessage(Throwable t) {
        String msg = t.getMessage();
        return msg == null ? "" : msg.toLowerCase(Locale.ROOT);
    }

    /**
     * Returns a one-line description of the classification result, for logs.
     *
     * @param throwable the exception to describe
     * @return category, retryability, type and message
     */
    public static String describeError(Throwable throwable) {
        if (throwable == null) {
            return "null exception";
        }
        ErrorCategory category = classify(throwable);
        return category.name()
                + " retryable="
                + category.isRetryable()
                + " "
                + throwable.getClass().getSimpleName()
                + ": "
                + throwable.getMessage();
    }
}
