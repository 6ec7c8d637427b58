package io.evalrelay.gateway;

import io.evalrelay.relay.ConnectionUnavailableException;
import io.evalrelay.relay.RelayChannel;

/**
 * Opens the relay to the responder. Implementations retry until their grace period runs out.
 */
@FunctionalInterface
public interface RelayConnector {
    RelayChannel open() throws ConnectionUnavailableException;
}
