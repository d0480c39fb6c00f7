/**
 * Mock runner-registration service source tree root.
 *
 * <p>Primary entry points while reading code:
 *
 * <ul>
 *   <li>{@code io.runnermock.Main} bootstraps the CLI process.</li>
 *   <li>{@code io.runnermock.server.MockHttpServer} owns the loopback listener and its stop flag.</li>
 *   <li>{@code io.runnermock.server.MockApiDispatcher} routes requests, gates auth and counts them.</li>
 *   <li>{@code io.runnermock.state.ServiceState} is the only shared mutable state.</li>
 * </ul>
 */
package io.runnermock;
