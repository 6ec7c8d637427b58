/**
 * Relay transport package.
 *
 * <p>Frames are exchanged over a Unix domain socket or loopback TCP connection.
 * {@link io.evalrelay.relay.RelayChannel} is the dialing side used by the gateway;
 * {@link io.evalrelay.relay.RelayListener} and {@link io.evalrelay.relay.RelaySession} are the
 * listening side used by the responder.
 */
package io.evalrelay.relay;
