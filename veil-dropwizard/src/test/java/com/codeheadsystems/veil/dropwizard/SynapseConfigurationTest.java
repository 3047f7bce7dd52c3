package com.codeheadsystems.veil.dropwizard;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import com.codeheadsystems.veil.synapse.SynapseConfig;
import java.net.URI;
import java.time.Duration;
import org.junit.jupiter.api.Test;

class SynapseConfigurationTest {

  @Test
  void emptyBaseUrl_isDisabled() {
    SynapseConfiguration configuration = new SynapseConfiguration();

    assertThat(configuration.isEnabled()).isFalse();
    assertThatThrownBy(configuration::toSynapseConfig).isInstanceOf(IllegalStateException.class);
  }

  @Test
  void toSynapseConfig_carriesAllSettings() {
    SynapseConfiguration configuration = new SynapseConfiguration();
    configuration.setBaseUrl(" http://synapse:8008 ");
    configuration.setServerName("chat.example");
    configuration.setAdminToken("syt_admin");
    configuration.setRequestTimeoutSeconds(5);

    SynapseConfig config = configuration.toSynapseConfig();

    assertThat(config.baseUri()).isEqualTo(URI.create("http://synapse:8008"));
    assertThat(config.serverName()).isEqualTo("chat.example");
    assertThat(config.adminToken()).isEqualTo("syt_admin");
    assertThat(config.requestTimeout()).isEqualTo(Duration.ofSeconds(5));
  }
}
