package io.switchboard.core.provider;

import static io.switchboard.core.provider.ProviderRegistryTest.passthrough;
import static io.switchboard.core.provider.ProviderRegistryTest.rotating;
import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import io.switchboard.core.error.AllKeysExhaustedException;
import io.switchboard.core.error.UpstreamHttpException;
import java.util.ArrayList;
import java.util.List;
import org.junit.jupiter.api.Test;

class KeyFailoverTest {

    private final KeyFailover failover = new KeyFailover();

    @Test
    void shouldRotateToNextKeyOnUnauthorized() {
        ProviderRegistry registry = new ProviderRegistry(List.of(rotating("openai", "k1", "k2", "k3")), "openai");
        AuthParams auth = registry.getClientAuth("openai", null);
        List<String> attempted = new ArrayList<>();

        String result = failover.execute(auth, key -> {
            attempted.add(key);
            if (!key.equals("k3")) {
                throw new UpstreamHttpException(401, "{\"error\":\"invalid key\"}");
            }
            return "ok";
        });

        assertThat(result).isEqualTo("ok");
        assertThat(attempted).containsExactly("k1", "k2", "k3");
    }

    @Test
    void shouldFailWhenEveryKeyIsRejected() {
        ProviderRegistry registry = new ProviderRegistry(List.of(rotating("openai", "k1", "k2")), "openai");
        AuthParams auth = registry.getClientAuth("openai", null);
        List<String> attempted = new ArrayList<>();

        assertThatThrownBy(() -> failover.execute(auth, key -> {
            attempted.add(key);
            throw new UpstreamHttpException(401, "unauthorized");
        }))
            .isInstanceOf(AllKeysExhaustedException.class)
            .hasCauseInstanceOf(UpstreamHttpException.class);
        assertThat(attempted).containsExactly("k1", "k2");
    }

    @Test
    void shouldRotateOnQuotaErrorInBody() {
        ProviderRegistry registry = new ProviderRegistry(List.of(rotating("openai", "k1", "k2")), "openai");
        AuthParams auth = registry.getClientAuth("openai", null);

        String result = failover.execute(auth, key -> {
            if (key.equals("k1")) {
                throw new UpstreamHttpException(400, "{\"error\":{\"code\":\"insufficient_quota\"}}");
            }
            return key;
        });

        assertThat(result).isEqualTo("k2");
    }

    @Test
    void shouldNotRotateOnServerError() {
        ProviderRegistry registry = new ProviderRegistry(List.of(rotating("openai", "k1", "k2")), "openai");
        AuthParams auth = registry.getClientAuth("openai", null);
        List<String> attempted = new ArrayList<>();

        assertThatThrownBy(() -> failover.execute(auth, key -> {
            attempted.add(key);
            throw new UpstreamHttpException(500, "boom");
        }))
            .isInstanceOf(UpstreamHttpException.class);
        assertThat(attempted).containsExactly("k1");
    }

    @Test
    void shouldCallPassthroughOnce() {
        ProviderRegistry registry = new ProviderRegistry(List.of(passthrough("anthropic")), "anthropic");
        AuthParams auth = registry.getClientAuth("anthropic", "client-key");
        List<String> attempted = new ArrayList<>();

        assertThatThrownBy(() -> failover.execute(auth, key -> {
            attempted.add(key);
            throw new UpstreamHttpException(401, "bad client key");
        }))
            .isInstanceOf(UpstreamHttpException.class);
        assertThat(attempted).containsExactly("client-key");
    }

    @Test
    void shouldExhaustSingleKeyProvider() {
        ProviderRegistry registry = new ProviderRegistry(List.of(rotating("openai", "only")), "openai");
        AuthParams auth = registry.getClientAuth("openai", null);

        assertThatThrownBy(() -> failover.execute(auth, key -> {
            throw new UpstreamHttpException(429, "slow down");
        }))
            .isInstanceOf(AllKeysExhaustedException.class);
    }
}
