package com.codeheadsystems.qcheck.server.auth;

import java.text.MessageFormat;
import java.time.Duration;
import java.util.Hashtable;
import java.util.Optional;
import javax.naming.AuthenticationException;
import javax.naming.Context;
import javax.naming.NamingException;
import javax.naming.directory.Attribute;
import javax.naming.directory.Attributes;
import javax.naming.directory.DirContext;
import javax.naming.directory.InitialDirContext;
import javax.naming.ldap.Rdn;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * {@link CredentialBackend} that binds to a directory server as the user.
 * <p>
 * The bind DN is built from a {@link MessageFormat} pattern where {@code {0}} is the
 * escaped username. A successful bind is followed by a read of the display-name attribute
 * on the user's own entry.
 */
public class LdapCredentialBackend implements CredentialBackend {

  public static final String DEFAULT_NAME = "ldap";
  public static final String DEFAULT_DISPLAY_ATTRIBUTE = "cn";

  private static final Logger log = LoggerFactory.getLogger(LdapCredentialBackend.class);

  private final String name;
  private final String url;
  private final String userDnPattern;
  private final String displayNameAttribute;
  private final Duration timeout;

  /**
   * Instantiates a new LDAP backend.
   *
   * @param name                 the backend name
   * @param url                  the provider URL, e.g. {@code ldaps://ldap.example.org}
   * @param userDnPattern        the bind DN pattern, e.g. {@code uid={0},ou=People,dc=example,dc=org}
   * @param displayNameAttribute the attribute holding the display name
   * @param timeout              connect and read timeout, null for none
   */
  public LdapCredentialBackend(String name, String url, String userDnPattern,
                               String displayNameAttribute, Duration timeout) {
    this.name = name;
    this.url = url;
    this.userDnPattern = userDnPattern;
    this.displayNameAttribute = displayNameAttribute == null ? DEFAULT_DISPLAY_ATTRIBUTE : displayNameAttribute;
    this.timeout = timeout;
    log.info("LdapCredentialBackend({}, {})", name, url);
  }

  @Override
  public String name() {
    return name;
  }

  @Override
  public Optional<String> authenticate(String username, String secret) {
    // An empty password turns a bind into an anonymous bind, which most servers accept.
    if (secret == null || secret.isEmpty()) {
      return Optional.empty();
    }
    String userDn = userDn(username);
    DirContext context;
    try {
      context = connect(environment(userDn, secret));
    } catch (AuthenticationException e) {
      log.debug("Bind rejected for {}", userDn);
      return Optional.empty();
    } catch (NamingException e) {
      throw new BackendUnreachableException("Directory bind failed on " + name, e);
    }
    try {
      return Optional.of(readDisplayName(context, userDn, username));
    } catch (NamingException e) {
      // Bound, so the credentials are good.
      log.debug("Unable to read {} for {}: {}", displayNameAttribute, userDn, e.getMessage());
      return Optional.of(username);
    } finally {
      close(context);
    }
  }

  DirContext connect(Hashtable<String, Object> environment) throws NamingException {
    return new InitialDirContext(environment);
  }

  String userDn(String username) {
    return MessageFormat.format(userDnPattern, Rdn.escapeValue(username));
  }

  Hashtable<String, Object> environment(String userDn, String secret) {
    Hashtable<String, Object> env = new Hashtable<>();
    env.put(Context.INITIAL_CONTEXT_FACTORY, "com.sun.jndi.ldap.LdapCtxFactory");
    env.put(Context.PROVIDER_URL, url);
    env.put(Context.SECURITY_AUTHENTICATION, "simple");
    env.put(Context.SECURITY_PRINCIPAL, userDn);
    env.put(Context.SECURITY_CREDENTIALS, secret);
    if (timeout != null) {
      String millis = Long.toString(timeout.toMillis());
      env.put("com.sun.jndi.ldap.connect.timeout", millis);
      env.put("com.sun.jndi.ldap.read.timeout", millis);
    }
    return env;
  }

  private String readDisplayName(DirContext context, String userDn, String fallback)
      throws NamingException {
    Attributes attributes = context.getAttributes(userDn, new String[]{displayNameAttribute});
    Attribute attribute = attributes.get(displayNameAttribute);
    if (attribute == null || attribute.get() == null) {
      return fallback;
    }
    return attribute.get().toString();
  }

  private void close(DirContext context) {
    if (context == null) {
      return;
    }
    try {
      context.close();
    } catch (NamingException e) {
      log.debug("Ignoring failure closing directory context: {}", e.getMessage());
    }
  }
}
