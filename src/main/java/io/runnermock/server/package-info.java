/**
 * HTTP surface of the mock service.
 *
 * <p>{@link io.runnermock.server.MockEndpoints} declares the ordered route
 * table, {@link io.runnermock.server.MockApiDispatcher} evaluates it top to
 * bottom and {@link io.runnermock.server.MockHttpServer} feeds it exchanges.
 */
package io.runnermock.server;
