package io.evalrelay.relay;

import io.evalrelay.codec.EnvelopeCodec;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.net.InetSocketAddress;
import java.nio.channels.ServerSocketChannel;
import java.nio.channels.SocketChannel;
import java.nio.file.Files;
import java.nio.file.Path;

/**
 * Listener side of the relay. One gateway session is served at a time.
 */
public final class RelayListener implements AutoCloseable {
    private static final Logger LOG = LoggerFactory.getLogger(RelayListener.class);

    private final RelayAddress requested;
    private final ServerSocketChannel server;
    private final EnvelopeCodec codec;
    private final int maxFrameBytes;

    private RelayListener(RelayAddress requested, ServerSocketChannel server, EnvelopeCodec codec, int maxFrameBytes) {
        this.requested = requested;
        this.server = server;
        this.codec = codec;
        this.maxFrameBytes = maxFrameBytes;
    }

    public static RelayListener bind(RelayAddress address, EnvelopeCodec codec) throws IOException {
        return bind(address, codec, FrameIO.DEFAULT_MAX_FRAME_BYTES);
    }

    public static RelayListener bind(RelayAddress address, EnvelopeCodec codec, int maxFrameBytes) throws IOException {
        if (address.kind() == RelayAddress.Kind.UNIX) {
            Path socketPath = address.path();
            if (socketPath.getParent() != null) {
                Files.createDirectories(socketPath.getParent());
            }
            // A previous responder that died without cleanup leaves the socket file behind.
            Files.deleteIfExists(socketPath);
        }
        ServerSocketChannel server = address.openServerChannel();
        try {
            server.bind(address.socketAddress());
        } catch (IOException e) {
            server.close();
            throw new IOException("Failed to bind relay listener at " + address, e);
        }
        RelayListener listener = new RelayListener(address, server, codec, maxFrameBytes);
        LOG.info("Relay listening at {}", listener.localAddress());
        return listener;
    }

    /**
     * Bound address; for TCP with port 0 this carries the port the OS picked.
     */
    public RelayAddress localAddress() {
        if (requested.kind() == RelayAddress.Kind.TCP) {
            try {
                if (server.getLocalAddress() instanceof InetSocketAddress inet) {
                    return RelayAddress.tcp(requested.host(), inet.getPort());
                }
            } catch (IOException e) {
                throw new IllegalStateException("Failed to read bound relay address", e);
            }
        }
        return requested;
    }

    public RelaySession acceptSession() throws IOException {
        SocketChannel client = server.accept();
        LOG.info("Gateway connected to {}", localAddress());
        return new RelaySession(client, codec, maxFrameBytes);
    }

    @Override
    public void close() throws IOException {
        try {
            server.close();
        } finally {
            if (requested.kind() == RelayAddress.Kind.UNIX) {
                Files.deleteIfExists(requested.path());
            }
        }
    }
}
