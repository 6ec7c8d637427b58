/**
 * EvalRelay source tree root.
 *
 * <p>Primary entry points while reading code:
 *
 * <ul>
 *   <li>{@code io.evalrelay.Main} bootstraps the CLI process.</li>
 *   <li>{@code io.evalrelay.cli.EvalRelayCommand} maps commands to gateway and responder APIs.</li>
 *   <li>{@code io.evalrelay.gateway.Gateway} orders problems, enforces deadlines and writes results.</li>
 *   <li>{@code io.evalrelay.responder.Responder} dispatches relay calls to registered handlers.</li>
 *   <li>{@code io.evalrelay.relay.RelayChannel} is the framed request/response transport.</li>
 * </ul>
 */
package io.evalrelay;
