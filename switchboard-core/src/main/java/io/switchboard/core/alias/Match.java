package io.switchboard.core.alias;

/**
 * One alias that matched the requested model name.
 *
 * @param length number of characters of the alias name found in the input
 * @param exact {@code true} when the alias equals the input rather than being part of it
 */
public record Match(String provider, String alias, String target, int length, boolean exact) {
}
