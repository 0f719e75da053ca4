package com.codeheadsystems.qcheck.server.upload;

/**
 * SMTP settings for {@link MailNotifier}.
 *
 * @param smtpHost   the SMTP host
 * @param smtpPort   the SMTP port
 * @param sender     the From address
 * @param recipient  the To address, may be a comma-separated list
 * @param serverName host name quoted in the message body next to the stored path
 */
public record MailSettings(String smtpHost, int smtpPort, String sender, String recipient, String serverName) {
}
