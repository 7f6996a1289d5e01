package io.switchboard.core.provider;

import static org.assertj.core.api.Assertions.assertThat;

import org.junit.jupiter.api.Test;

class RotationPolicyTest {

    @Test
    void shouldRotateOnAuthAndRateLimitStatuses() {
        assertThat(RotationPolicy.shouldRotate(401, "")).isTrue();
        assertThat(RotationPolicy.shouldRotate(403, null)).isTrue();
        assertThat(RotationPolicy.shouldRotate(429, "")).isTrue();
    }

    @Test
    void shouldRotateOnQuotaMarkersOnlyForClientErrors() {
        assertThat(RotationPolicy.shouldRotate(400, "Billing hard limit reached")).isTrue();
        assertThat(RotationPolicy.shouldRotate(402, "Quota Exceeded")).isTrue();
        assertThat(RotationPolicy.shouldRotate(400, "max_tokens too large")).isFalse();
        assertThat(RotationPolicy.shouldRotate(503, "insufficient_quota")).isFalse();
    }

    @Test
    void shouldNotRotateOnSuccessOrNotFound() {
        assertThat(RotationPolicy.shouldRotate(200, "billing")).isFalse();
        assertThat(RotationPolicy.shouldRotate(404, "model not found")).isFalse();
    }
}
