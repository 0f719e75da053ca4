package com.codeheadsystems.qcheck.server.upload;

import jakarta.mail.Message;
import jakarta.mail.MessagingException;
import jakarta.mail.Session;
import jakarta.mail.Transport;
import jakarta.mail.internet.InternetAddress;
import jakarta.mail.internet.MimeMessage;
import java.nio.charset.StandardCharsets;
import java.time.ZoneId;
import java.time.format.DateTimeFormatter;
import java.util.Date;
import java.util.Locale;
import java.util.Properties;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * {@link Notifier} that e-mails a fixed recipient about every stored upload.
 */
public class MailNotifier implements Notifier {

  private static final Logger log = LoggerFactory.getLogger(MailNotifier.class);
  private static final DateTimeFormatter UPLOAD_TIME =
      DateTimeFormatter.ofPattern("EEE MMM d HH:mm:ss yyyy", Locale.ENGLISH);

  private final MailSettings settings;
  private final ZoneId zoneId;
  private final MessageSender sender;
  private final Session mailSession;

  public MailNotifier(MailSettings settings, ZoneId zoneId) {
    this(settings, zoneId, Transport::send);
  }

  /**
   * Instantiates a new Mail notifier.
   *
   * @param settings the SMTP settings
   * @param zoneId   zone used to print the upload time
   * @param sender   hands the finished message to the transport
   */
  public MailNotifier(MailSettings settings, ZoneId zoneId, MessageSender sender) {
    this.settings = settings;
    this.zoneId = zoneId;
    this.sender = sender;
    Properties properties = new Properties();
    properties.put("mail.smtp.host", settings.smtpHost());
    properties.put("mail.smtp.port", Integer.toString(settings.smtpPort()));
    this.mailSession = Session.getInstance(properties);
    log.info("MailNotifier({}:{} -> {})", settings.smtpHost(), settings.smtpPort(), settings.recipient());
  }

  @Override
  public void notifyStored(UploadNotice notice) {
    try {
      sender.send(message(notice));
      log.debug("Upload notification sent for {}", notice.file().destination());
    } catch (MessagingException e) {
      throw new NotificationException("Unable to send upload notification to " + settings.recipient(), e);
    }
  }

  MimeMessage message(UploadNotice notice) throws MessagingException {
    MimeMessage message = new MimeMessage(mailSession);
    message.setFrom(new InternetAddress(settings.sender()));
    message.setRecipients(Message.RecipientType.TO, InternetAddress.parse(settings.recipient()));
    message.setSubject(subject(notice), StandardCharsets.UTF_8.name());
    message.setText(body(notice), StandardCharsets.UTF_8.name());
    message.setSentDate(Date.from(notice.file().uploadedAt()));
    return message;
  }

  static String subject(UploadNotice notice) {
    return String.format("Queue spreadsheet for %s was %s",
        notice.file().proposalId(), notice.file().kind().verb());
  }

  String body(UploadNotice notice) {
    UploadedFile file = notice.file();
    return String.format("A queue spreadsheet for proposal %s was %s by %s user %s on %s. "
            + "Input was %s named %s. Output filename is %s:%s",
        file.proposalId(), file.kind().verb(), notice.backend(), notice.displayName(),
        UPLOAD_TIME.format(file.uploadedAt().atZone(zoneId)),
        file.kind().label(), file.inputName(), settings.serverName(), file.destination().toAbsolutePath());
  }

  /**
   * Seam over {@link Transport#send(Message)}.
   */
  @FunctionalInterface
  public interface MessageSender {
    void send(Message message) throws MessagingException;
  }
}
