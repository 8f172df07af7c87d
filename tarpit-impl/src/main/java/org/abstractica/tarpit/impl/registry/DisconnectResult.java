package org.abstractica.tarpit.impl.registry;

/**
 * Result of a successful {@link MetricsRegistry#disconnect}.
 *
 * @param connections     live connection count after the disconnect
 * @param durationSeconds how long the connection was held, in whole seconds
 */
public record DisconnectResult(long connections, long durationSeconds) {}
