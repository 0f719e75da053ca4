package com.codeheadsystems.qcheck.dropwizard;

import static org.assertj.core.api.Assertions.assertThat;

import com.codeheadsystems.qcheck.server.config.QcheckConfig;
import io.dropwizard.configuration.ResourceConfigurationSourceProvider;
import io.dropwizard.configuration.YamlConfigurationFactory;
import io.dropwizard.jackson.Jackson;
import io.dropwizard.jersey.validation.Validators;
import java.nio.file.Path;
import java.time.Duration;
import java.time.ZoneOffset;
import org.junit.jupiter.api.Test;

class QcheckConfigurationTest {

  private final YamlConfigurationFactory<QcheckConfiguration> factory =
      new YamlConfigurationFactory<>(QcheckConfiguration.class, Validators.newValidator(),
          Jackson.newObjectMapper(), "dw");

  @Test
  void defaultsMatchExcelUploads() {
    QcheckConfig config = new QcheckConfiguration().toQcheckConfig();

    assertThat(config.sessionTtl()).isEqualTo(Duration.ofHours(3));
    assertThat(config.allowedExtensions()).containsExactly("xlsx", "xls");
    assertThat(config.acceptedSignatures().get("xls")).containsExactly("OLE2", "BIFF2", "BIFF3", "BIFF4");
    assertThat(config.externalSheetUrlTemplate()).isEqualTo(QcheckConfig.DEFAULT_EXTERNAL_SHEET_URL);
  }

  @Test
  void testConfigurationParses() throws Exception {
    QcheckConfiguration configuration = factory.build(new ResourceConfigurationSourceProvider(), "test-config.yml");
    QcheckConfig config = configuration.toQcheckConfig();

    assertThat(config.uploadRoot()).isEqualTo(Path.of("target/qcheck-it/uploads"));
    assertThat(config.zoneId().normalized()).isEqualTo(ZoneOffset.UTC);
    assertThat(config.sheetRules()).hasSize(1);
    assertThat(config.sheetRules().get(0).numericColumns()).containsExactly("RA");
    assertThat(configuration.getLdap()).isNull();
    assertThat(configuration.getDatabase()).isNull();
    assertThat(configuration.getDevUsers().get("jane").toUser("jane").displayName()).isEqualTo("Jane Observer");
  }

  @Test
  void devUserWithoutDisplayNameUsesUsername() throws Exception {
    QcheckConfiguration configuration = factory.build(new ResourceConfigurationSourceProvider(), "test-config.yml");
    configuration.getDevUsers().get("jane").setDisplayName(null);

    assertThat(configuration.getDevUsers().get("jane").toUser("jane").displayName()).isEqualTo("jane");
  }
}
