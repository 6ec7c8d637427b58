package io.evalrelay.relay;

import java.io.EOFException;
import java.io.IOException;
import java.nio.ByteBuffer;
import java.nio.channels.SocketChannel;

/**
 * Length-prefixed frames: a 4-byte big-endian length followed by that many envelope bytes.
 */
final class FrameIO {
    static final int DEFAULT_MAX_FRAME_BYTES = 16 * 1024 * 1024;

    private FrameIO() {
    }

    static void writeFrame(SocketChannel channel, byte[] body) throws IOException {
        ByteBuffer buffer = ByteBuffer.allocate(Integer.BYTES + body.length);
        buffer.putInt(body.length);
        buffer.put(body);
        buffer.flip();
        while (buffer.hasRemaining()) {
            channel.write(buffer);
        }
    }

    /**
     * Returns {@code null} when the peer closed the stream on a frame boundary.
     */
    static byte[] readFrame(SocketChannel channel, int maxFrameBytes) throws IOException {
        ByteBuffer header = ByteBuffer.allocate(Integer.BYTES);
        if (!readFully(channel, header, true)) {
            return null;
        }
        header.flip();
        int length = header.getInt();
        if (length <= 0 || length > maxFrameBytes) {
            throw new FrameException("invalid frame length " + length + " (max " + maxFrameBytes + ")");
        }
        ByteBuffer body = ByteBuffer.allocate(length);
        readFully(channel, body, false);
        return body.array();
    }

    private static boolean readFully(SocketChannel channel, ByteBuffer buffer, boolean eofAllowedAtStart) throws IOException {
        while (buffer.hasRemaining()) {
            int read = channel.read(buffer);
            if (read == -1) {
                if (eofAllowedAtStart && buffer.position() == 0) {
                    return false;
                }
                throw new EOFException("stream closed inside a frame");
            }
        }
        return true;
    }
}
