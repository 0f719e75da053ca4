package com.codeheadsystems.qcheck.server.upload;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * {@link Notifier} that only logs. Used when mail is disabled.
 */
public class LoggingNotifier implements Notifier {

  private static final Logger log = LoggerFactory.getLogger(LoggingNotifier.class);

  @Override
  public void notifyStored(UploadNotice notice) {
    log.info("Proposal {}: {} {} by {} ({}) to {}",
        notice.file().proposalId(), notice.file().inputName(), notice.file().kind().verb(),
        notice.displayName(), notice.backend(), notice.file().destination());
  }
}
