package express.mvp.controlbridge.client.protocol;

/**
 * Thrown when a WebSocket text frame is not a valid Engine.IO / Socket.IO packet.
 *
 * <p>Framing errors are per-frame: the offending frame is logged and dropped, the link stays up.
 *
 * @see SocketIoFrames
 */
public class FramingException extends RuntimeException {

    /**
     * Constructs a framing exception.
     *
     * @param message the detail message
     */
    public FramingException(String message) {
        super(message);
    }

    /**
     * Constructs a framing exception with a cause.
     *
     * @param message the detail message
     * @param cause the underlying cause
     */
    public FramingException(String message, Throwable cause) {
        super(message, cause);
    }
}
