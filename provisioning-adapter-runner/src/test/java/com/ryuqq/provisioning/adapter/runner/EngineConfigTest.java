package com.ryuqq.provisioning.adapter.runner;

import com.ryuqq.provisioning.core.model.RequestId;
import org.junit.jupiter.api.Test;

import java.io.IOException;
import java.io.InputStream;
import java.util.List;
import java.util.Properties;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

/**
 * EngineConfig 테스트.
 *
 * @author Provisioning Team
 * @since 1.0.0
 */
class EngineConfigTest {

    @Test
    void 기본값() {
        EngineConfig config = new EngineConfig();

        assertThat(config.approverEmails()).isEmpty();
        assertThat(config.portalBaseUrl()).isEqualTo("http://localhost:8000");
        assertThat(config.staleRetryLimit()).isEqualTo(3);
    }

    @Test
    void 클래스패스_properties_파일에서_로드() throws IOException {
        // given
        Properties properties = new Properties();
        try (InputStream in = getClass().getClassLoader().getResourceAsStream("provisioning-test.properties")) {
            assertThat(in).isNotNull();
            properties.load(in);
        }

        // when
        EngineConfig config = EngineConfig.fromProperties(properties);

        // then
        assertThat(config.approverEmails()).containsExactly("lead@example.com", "ops@example.com");
        assertThat(config.portalBaseUrl()).isEqualTo("https://portal.example.com");
        assertThat(config.staleRetryLimit()).isEqualTo(5);
        assertThat(config.requestLink(RequestId.of("req-42"))).isEqualTo("https://portal.example.com/requests/req-42");
    }

    @Test
    void 비어_있는_properties는_기본값() {
        EngineConfig config = EngineConfig.fromProperties(new Properties());

        assertThat(config).isEqualTo(new EngineConfig());
    }

    @Test
    void 잘못된_값은_거부() {
        Properties properties = new Properties();
        properties.setProperty(EngineConfig.STALE_RETRY_LIMIT_KEY, "many");

        assertThatThrownBy(() -> EngineConfig.fromProperties(properties))
            .isInstanceOf(IllegalArgumentException.class)
            .hasMessageContaining("must be an integer");
        assertThatThrownBy(() -> new EngineConfig().withStaleRetryLimit(0))
            .isInstanceOf(IllegalArgumentException.class)
            .hasMessageContaining("staleRetryLimit must be positive");
        assertThatThrownBy(() -> new EngineConfig().withPortalBaseUrl(" "))
            .isInstanceOf(IllegalArgumentException.class);
    }

    @Test
    void with_메서드는_새_인스턴스를_반환() {
        EngineConfig base = new EngineConfig();

        EngineConfig changed = base.withApproverEmails(List.of("a@example.com"));

        assertThat(base.approverEmails()).isEmpty();
        assertThat(changed.approverEmails()).containsExactly("a@example.com");
    }
}
