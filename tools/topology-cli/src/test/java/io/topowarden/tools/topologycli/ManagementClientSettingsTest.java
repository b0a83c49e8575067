package io.topowarden.tools.topologycli;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import java.time.Duration;
import org.junit.jupiter.api.Test;

class ManagementClientSettingsTest {

    @Test
    void defaultsApplyWhenNothingIsSet() {
        ManagementClientSettings settings = ManagementClientSettings.defaults();

        assertThat(settings.connectTimeout()).isEqualTo(Duration.ofSeconds(5));
        assertThat(settings.requestTimeout()).isEqualTo(Duration.ofSeconds(30));
        assertThat(settings.maxRedirects()).isEqualTo(5);
    }

    @Test
    void nonPositiveTimeoutsFallBackToDefaults() {
        ManagementClientSettings settings = ManagementClientSettings.builder()
            .connectTimeout(Duration.ZERO)
            .requestTimeout(Duration.ofSeconds(-3))
            .build();

        assertThat(settings.connectTimeout()).isEqualTo(ManagementClientSettings.DEFAULT_CONNECT_TIMEOUT);
        assertThat(settings.requestTimeout()).isEqualTo(ManagementClientSettings.DEFAULT_REQUEST_TIMEOUT);
    }

    @Test
    void nullTimeoutFallsBackToDefault() {
        ManagementClientSettings settings = new ManagementClientSettings(null, Duration.ofSeconds(2), 0);

        assertThat(settings.connectTimeout()).isEqualTo(ManagementClientSettings.DEFAULT_CONNECT_TIMEOUT);
        assertThat(settings.requestTimeout()).isEqualTo(Duration.ofSeconds(2));
    }

    @Test
    void rejectsRedirectLimitOutOfRange() {
        assertThatThrownBy(() -> ManagementClientSettings.builder().maxRedirects(-1).build())
            .isInstanceOf(IllegalArgumentException.class)
            .hasMessageContaining("Max redirects");
        assertThatThrownBy(() -> ManagementClientSettings.builder().maxRedirects(21).build())
            .isInstanceOf(IllegalArgumentException.class);
    }
}
