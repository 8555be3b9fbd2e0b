package io.tokenfeed.gateway.dispatch;

/**
 * A frame has no recognized event type or lacks fields that its type requires.
 * The frame is dropped; the stream continues.
 */
public class MalformedFrameException extends RuntimeException {

    public MalformedFrameException(String message) {
        super(message);
    }

    public MalformedFrameException(String message, Throwable cause) {
        super(message, cause);
    }
}
