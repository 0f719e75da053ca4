package com.codeheadsystems.qcheck.server.resource;

import com.codeheadsystems.qcheck.server.session.ClientSession;
import com.codeheadsystems.qcheck.server.session.Session;
import jakarta.ws.rs.core.NewCookie;
import java.net.URLDecoder;
import java.net.URLEncoder;
import java.nio.charset.StandardCharsets;
import java.time.Duration;
import java.time.Instant;

/**
 * Maps sessions to and from the cookies the browser keeps.
 */
public final class SessionCookies {

  public static final String ID = "qcheck_session_id";
  public static final String START = "qcheck_session_start";
  public static final String EXPIRES = "qcheck_session_expires";
  public static final String BACKEND = "qcheck_session_backend";
  public static final String USER = "qcheck_session_user";

  private static final String PATH = "/";

  private SessionCookies() {
  }

  /**
   * Cookies carrying a newly created session, living until it expires.
   *
   * @param session the session
   * @param now     the current time
   * @return the cookies
   */
  public static NewCookie[] issue(Session session, Instant now) {
    int maxAge = (int) Math.max(0, Duration.between(now, session.expiresAt()).getSeconds());
    return new NewCookie[]{
        cookie(ID, session.id(), maxAge),
        cookie(START, session.createdAt().toString(), maxAge),
        cookie(EXPIRES, session.expiresAt().toString(), maxAge),
        cookie(BACKEND, session.backend(), maxAge),
        cookie(USER, session.displayName(), maxAge)
    };
  }

  /**
   * Cookies that make the browser drop every session cookie.
   *
   * @return the cookies
   */
  public static NewCookie[] expire() {
    return new NewCookie[]{
        cookie(ID, "", 0),
        cookie(START, "", 0),
        cookie(EXPIRES, "", 0),
        cookie(BACKEND, "", 0),
        cookie(USER, "", 0)
    };
  }

  /**
   * Rebuilds what the client presented from raw cookie values.
   *
   * @return the client session
   */
  public static ClientSession read(String id, String start, String expires, String backend, String user) {
    return new ClientSession(decode(id), decode(start), decode(expires), decode(backend), decode(user));
  }

  private static NewCookie cookie(String name, String value, int maxAge) {
    return new NewCookie(name, encode(value), PATH, null, null, maxAge, false, true);
  }

  static String encode(String value) {
    return value == null ? "" : URLEncoder.encode(value, StandardCharsets.UTF_8);
  }

  static String decode(String value) {
    if (value == null || value.isEmpty()) {
      return null;
    }
    try {
      return URLDecoder.decode(value, StandardCharsets.UTF_8);
    } catch (IllegalArgumentException e) {
      return null;
    }
  }
}
