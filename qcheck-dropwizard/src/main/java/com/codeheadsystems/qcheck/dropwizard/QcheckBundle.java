package com.codeheadsystems.qcheck.dropwizard;

import com.codeheadsystems.qcheck.dropwizard.config.DevUserConfiguration;
import com.codeheadsystems.qcheck.dropwizard.config.NotificationConfiguration;
import com.codeheadsystems.qcheck.dropwizard.health.DirectoryHealthCheck;
import com.codeheadsystems.qcheck.server.auth.CredentialAuthenticator;
import com.codeheadsystems.qcheck.server.auth.CredentialBackend;
import com.codeheadsystems.qcheck.server.auth.InMemoryCredentialBackend;
import com.codeheadsystems.qcheck.server.auth.JdbcCredentialBackend;
import com.codeheadsystems.qcheck.server.check.WorkbookChecker;
import com.codeheadsystems.qcheck.server.config.QcheckConfig;
import com.codeheadsystems.qcheck.server.content.ContentValidator;
import com.codeheadsystems.qcheck.server.content.PoiSignatureDetector;
import com.codeheadsystems.qcheck.server.manager.QcheckRequestManager;
import com.codeheadsystems.qcheck.server.report.ReportFormatter;
import com.codeheadsystems.qcheck.server.resource.QcheckPage;
import com.codeheadsystems.qcheck.server.resource.QcheckResource;
import com.codeheadsystems.qcheck.server.session.FileSessionStore;
import com.codeheadsystems.qcheck.server.session.SessionManager;
import com.codeheadsystems.qcheck.server.session.SessionStore;
import com.codeheadsystems.qcheck.server.source.ExternalSheetFetcher;
import com.codeheadsystems.qcheck.server.upload.LoggingNotifier;
import com.codeheadsystems.qcheck.server.upload.MailNotifier;
import com.codeheadsystems.qcheck.server.upload.Notifier;
import com.codeheadsystems.qcheck.server.upload.UploadManager;
import io.dropwizard.core.ConfiguredBundle;
import io.dropwizard.core.setup.Bootstrap;
import io.dropwizard.core.setup.Environment;
import io.dropwizard.db.ManagedDataSource;
import io.dropwizard.forms.MultiPartBundle;
import jakarta.inject.Inject;
import jakarta.inject.Singleton;
import java.io.IOException;
import java.io.UncheckedIOException;
import java.net.http.HttpClient;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Clock;
import java.time.Duration;
import java.util.LinkedHashMap;
import java.util.Map;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Dropwizard bundle that wires the queue file check gateway into a Dropwizard application.
 * <p>
 * Registers the multipart feature, the {@code /qcheck} resource and the storage health checks.
 * Requires a {@link QcheckConfiguration} in the application's YAML config.
 * <p>
 * Embed with everything built from the configuration:
 * <pre>{@code
 *   bootstrap.addBundle(new QcheckBundle<>());
 * }</pre>
 * <p>
 * Or supply your own session store and credential backends:
 * <pre>{@code
 *   bootstrap.addBundle(new QcheckBundle<>(mySessionStore, ldapBackend, databaseBackend));
 * }</pre>
 * Any credential backend that is neither supplied nor configured falls back to an in-memory
 * backend seeded from {@code devUsers}, which is for dev/test only.
 */
@Singleton
public class QcheckBundle<C extends QcheckConfiguration> implements ConfiguredBundle<C> {

  static final String DEV_PRIMARY = "dev-primary";
  static final String DEV_SECONDARY = "dev-secondary";

  private static final Logger log = LoggerFactory.getLogger(QcheckBundle.class);

  private final SessionStore sessionStore;
  private final CredentialBackend primary;
  private final CredentialBackend secondary;

  /**
   * Creates a bundle whose session store and credential backends come from the configuration.
   */
  public QcheckBundle() {
    this(null, null, null);
  }

  /**
   * Creates a bundle with the supplied session store and credential backends. Null arguments
   * are built from the configuration.
   *
   * @param sessionStore the session store
   * @param primary      the backend tried first
   * @param secondary    the fallback backend
   */
  @Inject
  public QcheckBundle(SessionStore sessionStore,
                      CredentialBackend primary,
                      CredentialBackend secondary) {
    this.sessionStore = sessionStore;
    this.primary = primary;
    this.secondary = secondary;
  }

  @Override
  public void initialize(Bootstrap<?> bootstrap) {
    bootstrap.addBundle(new MultiPartBundle());
  }

  @Override
  public void run(C configuration, Environment environment) {
    QcheckConfig config = configuration.toQcheckConfig();
    Clock clock = Clock.system(config.zoneId());
    createDirectory(config.sessionDirectory());
    createDirectory(config.uploadRoot());

    SessionStore store = sessionStore != null ? sessionStore : new FileSessionStore(config.sessionDirectory());
    SessionManager sessionManager = new SessionManager(store, config.sessionTtl(), clock);

    CredentialAuthenticator authenticator = buildAuthenticator(configuration, environment);

    ContentValidator contentValidator = new ContentValidator(config.acceptedSignatures(), new PoiSignatureDetector());
    UploadManager uploadManager = new UploadManager(config.uploadRoot(), buildNotifier(configuration), clock);
    QcheckRequestManager requestManager = new QcheckRequestManager(sessionManager, authenticator,
        contentValidator, new WorkbookChecker(config.sheetRules()), new ReportFormatter(), uploadManager);

    HttpClient httpClient = HttpClient.newBuilder()
        .followRedirects(HttpClient.Redirect.NORMAL)
        .connectTimeout(Duration.ofSeconds(10))
        .build();
    ExternalSheetFetcher fetcher = new ExternalSheetFetcher(httpClient, config.externalSheetUrlTemplate());

    environment.jersey().register(new QcheckResource(requestManager, fetcher,
        new QcheckPage(config.allowedExtensions()), clock));
    environment.healthChecks().register("session-directory", new DirectoryHealthCheck(config.sessionDirectory()));
    environment.healthChecks().register("upload-root", new DirectoryHealthCheck(config.uploadRoot()));
  }

  CredentialAuthenticator buildAuthenticator(C configuration, Environment environment) {
    CredentialBackend first = primary != null ? primary : buildPrimary(configuration);
    CredentialBackend second = secondary != null ? secondary : buildSecondary(configuration, environment);
    if (first instanceof InMemoryCredentialBackend || second instanceof InMemoryCredentialBackend) {
      log.warn("""
          #################################################################
          # WARNING: A credential backend is not configured. Falling back #
          # to in-memory development users from the configuration.        #
          # Do not use in production.                                     #
          #################################################################
          """);
    }
    return new CredentialAuthenticator(first, second);
  }

  private CredentialBackend buildPrimary(C configuration) {
    if (configuration.getLdap() != null) {
      return configuration.getLdap().build();
    }
    return devBackend(configuration, DEV_PRIMARY);
  }

  private CredentialBackend buildSecondary(C configuration, Environment environment) {
    if (configuration.getDatabase() != null) {
      ManagedDataSource dataSource = configuration.getDatabase().build(environment.metrics(), "qcheck-auth");
      environment.lifecycle().manage(dataSource);
      return new JdbcCredentialBackend(JdbcCredentialBackend.DEFAULT_NAME, dataSource,
          configuration.getDatabaseQuery());
    }
    return devBackend(configuration, DEV_SECONDARY);
  }

  private CredentialBackend devBackend(C configuration, String name) {
    Map<String, InMemoryCredentialBackend.User> users = new LinkedHashMap<>();
    for (Map.Entry<String, DevUserConfiguration> entry : configuration.getDevUsers().entrySet()) {
      users.put(entry.getKey(), entry.getValue().toUser(entry.getKey()));
    }
    return new InMemoryCredentialBackend(name, users);
  }

  private Notifier buildNotifier(C configuration) {
    NotificationConfiguration notification = configuration.getNotification();
    if (notification == null || !notification.isEnabled()) {
      log.info("Upload notifications are logged only");
      return new LoggingNotifier();
    }
    return new MailNotifier(notification.toMailSettings(), configuration.zoneId());
  }

  private static void createDirectory(Path directory) {
    try {
      Files.createDirectories(directory);
    } catch (IOException e) {
      throw new UncheckedIOException("Unable to create " + directory.toAbsolutePath(), e);
    }
  }
}
