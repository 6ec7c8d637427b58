package io.evalrelay.relay;

import java.io.IOException;
import java.net.InetSocketAddress;
import java.net.SocketAddress;
import java.net.StandardProtocolFamily;
import java.net.UnixDomainSocketAddress;
import java.nio.channels.ServerSocketChannel;
import java.nio.channels.SocketChannel;
import java.nio.file.Path;

/**
 * Process-local endpoint both sides agree on: a Unix domain socket path or a loopback host:port.
 */
public record RelayAddress(
        Kind kind,
        String host,
        int port,
        Path path
) {
    public enum Kind {
        UNIX,
        TCP
    }

    public static RelayAddress unix(Path path) {
        return new RelayAddress(Kind.UNIX, null, -1, path.toAbsolutePath().normalize());
    }

    public static RelayAddress tcp(String host, int port) {
        if (port < 0 || port > 65_535) {
            throw new IllegalArgumentException("relay port out of range: " + port);
        }
        return new RelayAddress(Kind.TCP, host == null || host.isBlank() ? "127.0.0.1" : host.trim(), port, null);
    }

    public static RelayAddress parse(String raw) {
        if (raw == null || raw.isBlank()) {
            throw new IllegalArgumentException("relay address cannot be empty");
        }
        String value = raw.trim();
        if (value.startsWith("unix://")) {
            return unix(Path.of(value.substring("unix://".length())));
        }
        if (value.startsWith("unix:")) {
            return unix(Path.of(value.substring("unix:".length())));
        }
        if (value.startsWith("tcp://")) {
            value = value.substring("tcp://".length());
        }
        int colon = value.lastIndexOf(':');
        if (colon <= 0 || colon == value.length() - 1) {
            throw new IllegalArgumentException("relay address must be unix:<path> or host:port, got: " + raw);
        }
        String host = value.substring(0, colon);
        if (host.startsWith("[") && host.endsWith("]")) {
            host = host.substring(1, host.length() - 1);
        }
        int port;
        try {
            port = Integer.parseInt(value.substring(colon + 1));
        } catch (NumberFormatException e) {
            throw new IllegalArgumentException("relay port is not a number: " + raw, e);
        }
        return tcp(host, port);
    }

    public SocketAddress socketAddress() {
        return switch (kind) {
            case UNIX -> UnixDomainSocketAddress.of(path);
            case TCP -> new InetSocketAddress(host, port);
        };
    }

    SocketChannel openChannel() throws IOException {
        return switch (kind) {
            case UNIX -> SocketChannel.open(StandardProtocolFamily.UNIX);
            case TCP -> SocketChannel.open();
        };
    }

    ServerSocketChannel openServerChannel() throws IOException {
        return switch (kind) {
            case UNIX -> ServerSocketChannel.open(StandardProtocolFamily.UNIX);
            case TCP -> ServerSocketChannel.open();
        };
    }

    @Override
    public String toString() {
        return switch (kind) {
            case UNIX -> "unix:" + path;
            case TCP -> host + ":" + port;
        };
    }
}
