package io.switchboard.core.provider;

import static org.assertj.core.api.Assertions.assertThat;

import org.junit.jupiter.api.Test;

class KeyHashesTest {

    @Test
    void shouldHashKeysToStableShortPrefix() {
        String hash = KeyHashes.shortHash("sk-test");

        assertThat(hash).hasSize(8).matches("[0-9a-f]{8}");
        assertThat(KeyHashes.shortHash("sk-test")).isEqualTo(hash);
        assertThat(KeyHashes.shortHash("sk-other")).isNotEqualTo(hash);
    }

    @Test
    void shouldLabelSpecialKeys() {
        assertThat(KeyHashes.shortHash(ProviderConfig.PASSTHROUGH_SENTINEL)).isEqualTo("PASSTHRU");
        assertThat(KeyHashes.shortHash("")).isEqualTo("none");
    }
}
