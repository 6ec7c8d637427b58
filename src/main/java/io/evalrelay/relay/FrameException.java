package io.evalrelay.relay;

import java.io.IOException;

/**
 * The byte stream no longer lines up with frame boundaries; the connection cannot be reused.
 */
public final class FrameException extends IOException {
    public FrameException(String message) {
        super(message);
    }
}
