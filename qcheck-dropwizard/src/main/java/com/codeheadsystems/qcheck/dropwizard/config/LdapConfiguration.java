package com.codeheadsystems.qcheck.dropwizard.config;

import com.codeheadsystems.qcheck.server.auth.LdapCredentialBackend;
import com.fasterxml.jackson.annotation.JsonProperty;
import io.dropwizard.util.Duration;
import jakarta.validation.constraints.NotEmpty;

/**
 * Directory server used as the primary credential backend.
 */
public class LdapConfiguration {

  @NotEmpty
  private String name = LdapCredentialBackend.DEFAULT_NAME;

  /**
   * Provider URL, e.g. {@code ldaps://ldap.example.org}.
   */
  @NotEmpty
  private String url;

  /**
   * Bind DN pattern where {@code {0}} is the username,
   * e.g. {@code uid={0},ou=People,dc=example,dc=org}.
   */
  @NotEmpty
  private String userDnPattern;

  @NotEmpty
  private String displayNameAttribute = LdapCredentialBackend.DEFAULT_DISPLAY_ATTRIBUTE;

  /**
   * Connect and read timeout. Unset means no timeout.
   */
  private Duration timeout;

  /**
   * Builds the backend.
   *
   * @return the backend
   */
  public LdapCredentialBackend build() {
    return new LdapCredentialBackend(name, url, userDnPattern, displayNameAttribute,
        timeout == null ? null : timeout.toJavaDuration());
  }

  @JsonProperty
  public String getName() {
    return name;
  }

  @JsonProperty
  public void setName(String name) {
    this.name = name;
  }

  @JsonProperty
  public String getUrl() {
    return url;
  }

  @JsonProperty
  public void setUrl(String url) {
    this.url = url;
  }

  @JsonProperty
  public String getUserDnPattern() {
    return userDnPattern;
  }

  @JsonProperty
  public void setUserDnPattern(String userDnPattern) {
    this.userDnPattern = userDnPattern;
  }

  @JsonProperty
  public String getDisplayNameAttribute() {
    return displayNameAttribute;
  }

  @JsonProperty
  public void setDisplayNameAttribute(String displayNameAttribute) {
    this.displayNameAttribute = displayNameAttribute;
  }

  @JsonProperty
  public Duration getTimeout() {
    return timeout;
  }

  @JsonProperty
  public void setTimeout(Duration timeout) {
    this.timeout = timeout;
  }
}
