package com.codeheadsystems.qcheck.server.upload;

/**
 * Tells someone that a file was stored. Delivery is best effort.
 */
public interface Notifier {

  /**
   * Sends the notification.
   *
   * @param notice what was stored and by whom
   * @throws NotificationException if it could not be sent
   */
  void notifyStored(UploadNotice notice);
}
