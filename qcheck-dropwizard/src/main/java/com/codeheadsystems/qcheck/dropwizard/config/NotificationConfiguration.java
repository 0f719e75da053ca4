package com.codeheadsystems.qcheck.dropwizard.config;

import com.codeheadsystems.qcheck.server.upload.MailSettings;
import com.fasterxml.jackson.annotation.JsonProperty;
import jakarta.validation.constraints.Max;
import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotEmpty;
import java.net.InetAddress;
import java.net.UnknownHostException;

/**
 * SMTP settings for upload notifications.
 */
public class NotificationConfiguration {

  /**
   * When false, notifications are only logged.
   */
  private boolean enabled = true;

  @NotEmpty
  private String smtpHost = "localhost";

  @Min(1)
  @Max(65535)
  private int smtpPort = 25;

  @NotEmpty
  private String sender;

  @NotEmpty
  private String recipient;

  /**
   * Host name quoted in messages next to the stored path. Defaults to this host's name.
   */
  private String serverName;

  /**
   * Builds the mail settings, resolving the server name if unset.
   *
   * @return the settings
   */
  public MailSettings toMailSettings() {
    return new MailSettings(smtpHost, smtpPort, sender, recipient,
        serverName == null || serverName.isBlank() ? localHostName() : serverName);
  }

  private static String localHostName() {
    try {
      return InetAddress.getLocalHost().getCanonicalHostName();
    } catch (UnknownHostException e) {
      return "localhost";
    }
  }

  @JsonProperty
  public boolean isEnabled() {
    return enabled;
  }

  @JsonProperty
  public void setEnabled(boolean enabled) {
    this.enabled = enabled;
  }

  @JsonProperty
  public String getSmtpHost() {
    return smtpHost;
  }

  @JsonProperty
  public void setSmtpHost(String smtpHost) {
    this.smtpHost = smtpHost;
  }

  @JsonProperty
  public int getSmtpPort() {
    return smtpPort;
  }

  @JsonProperty
  public void setSmtpPort(int smtpPort) {
    this.smtpPort = smtpPort;
  }

  @JsonProperty
  public String getSender() {
    return sender;
  }

  @JsonProperty
  public void setSender(String sender) {
    this.sender = sender;
  }

  @JsonProperty
  public String getRecipient() {
    return recipient;
  }

  @JsonProperty
  public void setRecipient(String recipient) {
    this.recipient = recipient;
  }

  @JsonProperty
  public String getServerName() {
    return serverName;
  }

  @JsonProperty
  public void setServerName(String serverName) {
    this.serverName = serverName;
  }
}
