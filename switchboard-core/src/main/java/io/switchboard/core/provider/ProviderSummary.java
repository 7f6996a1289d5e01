package io.switchboard.core.provider;

import java.util.List;

/**
 * Printable view of a provider. Keys only appear as short hashes.
 */
public record ProviderSummary(
    String name,
    String authMode,
    int keyCount,
    List<String> keyHashes,
    String baseUrl,
    String apiFormat,
    boolean isDefault
) {
}
