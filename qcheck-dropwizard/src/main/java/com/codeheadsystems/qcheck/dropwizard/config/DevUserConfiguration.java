package com.codeheadsystems.qcheck.dropwizard.config;

import com.codeheadsystems.qcheck.server.auth.InMemoryCredentialBackend;
import com.fasterxml.jackson.annotation.JsonProperty;
import jakarta.validation.constraints.NotEmpty;

/**
 * A development user for the in-memory credential backend.
 */
public class DevUserConfiguration {

  @NotEmpty
  private String password;

  private String displayName;

  public InMemoryCredentialBackend.User toUser(String username) {
    return new InMemoryCredentialBackend.User(password, displayName == null ? username : displayName);
  }

  @JsonProperty
  public String getPassword() {
    return password;
  }

  @JsonProperty
  public void setPassword(String password) {
    this.password = password;
  }

  @JsonProperty
  public String getDisplayName() {
    return displayName;
  }

  @JsonProperty
  public void setDisplayName(String displayName) {
    this.displayName = displayName;
  }
}
