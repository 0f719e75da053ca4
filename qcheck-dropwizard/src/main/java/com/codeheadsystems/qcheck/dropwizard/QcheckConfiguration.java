package com.codeheadsystems.qcheck.dropwizard;

import com.codeheadsystems.qcheck.dropwizard.config.DevUserConfiguration;
import com.codeheadsystems.qcheck.dropwizard.config.LdapConfiguration;
import com.codeheadsystems.qcheck.dropwizard.config.NotificationConfiguration;
import com.codeheadsystems.qcheck.server.auth.JdbcCredentialBackend;
import com.codeheadsystems.qcheck.server.check.SheetRule;
import com.codeheadsystems.qcheck.server.config.QcheckConfig;
import com.fasterxml.jackson.annotation.JsonProperty;
import io.dropwizard.core.Configuration;
import io.dropwizard.db.DataSourceFactory;
import io.dropwizard.util.Duration;
import jakarta.validation.Valid;
import jakarta.validation.constraints.NotEmpty;
import jakarta.validation.constraints.NotNull;
import java.nio.file.Path;
import java.time.ZoneId;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Dropwizard configuration for the queue file check gateway.
 * <p>
 * Credential backends are optional: {@code ldap} is the primary backend and {@code database}
 * the fallback. Any backend left unconfigured is replaced by an in-memory backend seeded from
 * {@code devUsers} (dev/test only). Without a {@code notification} block uploads are only logged.
 */
public class QcheckConfiguration extends Configuration {

  /**
   * How long a login stays valid.
   */
  @NotNull
  private Duration sessionTtl = Duration.hours(3);

  /**
   * Directory holding one JSON record per session.
   */
  @NotEmpty
  private String sessionDirectory = "sessions";

  /**
   * Root of the proposal-partitioned upload store.
   */
  @NotEmpty
  private String uploadRoot = "uploads";

  /**
   * Allowed file extensions and the content signatures each may carry, in display order.
   */
  @NotEmpty
  private Map<String, List<String>> acceptedSignatures = defaultSignatures();

  @Valid
  private List<SheetRule> sheetRules = new ArrayList<>();

  /**
   * Export URL for external sheets; {@code {0}} is the sheet name.
   */
  @NotEmpty
  private String externalSheetUrlTemplate = QcheckConfig.DEFAULT_EXTERNAL_SHEET_URL;

  /**
   * Zone for upload timestamps. Defaults to the system zone.
   */
  private String timeZone;

  @Valid
  private LdapConfiguration ldap;

  @Valid
  private DataSourceFactory database;

  /**
   * Lookup query for the database backend; parameters are username and password.
   */
  @NotEmpty
  private String databaseQuery = JdbcCredentialBackend.DEFAULT_QUERY;

  @Valid
  private NotificationConfiguration notification;

  @Valid
  private Map<String, DevUserConfiguration> devUsers = new LinkedHashMap<>();

  /**
   * The framework-free view of this configuration.
   *
   * @return the config
   */
  public QcheckConfig toQcheckConfig() {
    Map<String, Set<String>> signatures = new LinkedHashMap<>();
    acceptedSignatures.forEach((ext, sigs) -> signatures.put(ext, new LinkedHashSet<>(sigs)));
    return new QcheckConfig(sessionTtl.toJavaDuration(), Path.of(sessionDirectory), Path.of(uploadRoot),
        signatures, sheetRules, externalSheetUrlTemplate, zoneId());
  }

  public ZoneId zoneId() {
    return timeZone == null || timeZone.isBlank() ? ZoneId.systemDefault() : ZoneId.of(timeZone);
  }

  private static Map<String, List<String>> defaultSignatures() {
    Map<String, List<String>> map = new LinkedHashMap<>();
    QcheckConfig.EXCEL_SIGNATURES.forEach((ext, sigs) -> map.put(ext, new ArrayList<>(sigs)));
    return map;
  }

  @JsonProperty
  public Duration getSessionTtl() {
    return sessionTtl;
  }

  @JsonProperty
  public void setSessionTtl(Duration sessionTtl) {
    this.sessionTtl = sessionTtl;
  }

  @JsonProperty
  public String getSessionDirectory() {
    return sessionDirectory;
  }

  @JsonProperty
  public void setSessionDirectory(String sessionDirectory) {
    this.sessionDirectory = sessionDirectory;
  }

  @JsonProperty
  public String getUploadRoot() {
    return uploadRoot;
  }

  @JsonProperty
  public void setUploadRoot(String uploadRoot) {
    this.uploadRoot = uploadRoot;
  }

  @JsonProperty
  public Map<String, List<String>> getAcceptedSignatures() {
    return acceptedSignatures;
  }

  @JsonProperty
  public void setAcceptedSignatures(Map<String, List<String>> acceptedSignatures) {
    this.acceptedSignatures = acceptedSignatures;
  }

  @JsonProperty
  public List<SheetRule> getSheetRules() {
    return sheetRules;
  }

  @JsonProperty
  public void setSheetRules(List<SheetRule> sheetRules) {
    this.sheetRules = sheetRules;
  }

  @JsonProperty
  public String getExternalSheetUrlTemplate() {
    return externalSheetUrlTemplate;
  }

  @JsonProperty
  public void setExternalSheetUrlTemplate(String externalSheetUrlTemplate) {
    this.externalSheetUrlTemplate = externalSheetUrlTemplate;
  }

  @JsonProperty
  public String getTimeZone() {
    return timeZone;
  }

  @JsonProperty
  public void setTimeZone(String timeZone) {
    this.timeZone = timeZone;
  }

  @JsonProperty
  public LdapConfiguration getLdap() {
    return ldap;
  }

  @JsonProperty
  public void setLdap(LdapConfiguration ldap) {
    this.ldap = ldap;
  }

  @JsonProperty
  public DataSourceFactory getDatabase() {
    return database;
  }

  @JsonProperty
  public void setDatabase(DataSourceFactory database) {
    this.database = database;
  }

  @JsonProperty
  public String getDatabaseQuery() {
    return databaseQuery;
  }

  @JsonProperty
  public void setDatabaseQuery(String databaseQuery) {
    this.databaseQuery = databaseQuery;
  }

  @JsonProperty
  public NotificationConfiguration getNotification() {
    return notification;
  }

  @JsonProperty
  public void setNotification(NotificationConfiguration notification) {
    this.notification = notification;
  }

  @JsonProperty
  public Map<String, DevUserConfiguration> getDevUsers() {
    return devUsers;
  }

  @JsonProperty
  public void setDevUsers(Map<String, DevUserConfiguration> devUsers) {
    this.devUsers = devUsers;
  }
}
