package io.switchboard.core.provider;

@FunctionalInterface
public interface UpstreamCall<T> {
    T call(String apiKey);
}
