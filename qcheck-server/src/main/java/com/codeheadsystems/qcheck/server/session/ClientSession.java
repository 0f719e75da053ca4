package com.codeheadsystems.qcheck.server.session;

/**
 * Session fields exactly as presented by the client (cookies). Any field may be null.
 * Only {@code id} is used to find the persisted record; the rest are informational.
 *
 * @param id          presented session id
 * @param createdAt   presented creation timestamp, unparsed
 * @param expiresAt   presented expiry timestamp, unparsed
 * @param backend     presented backend name
 * @param displayName presented display name
 */
public record ClientSession(String id, String createdAt, String expiresAt, String backend,
                            String displayName) {

  public static final ClientSession NONE = new ClientSession(null, null, null, null, null);

  public static ClientSession ofId(String id) {
    return new ClientSession(id, null, null, null, null);
  }

  public boolean hasId() {
    return id != null && !id.isBlank();
  }
}
