package com.codeheadsystems.qcheck.server.manager;

import com.codeheadsystems.qcheck.model.Program;
import com.codeheadsystems.qcheck.model.Severity;
import com.codeheadsystems.qcheck.model.ValidationReport;
import com.codeheadsystems.qcheck.server.auth.AuthOutcome;
import com.codeheadsystems.qcheck.server.auth.CredentialAuthenticator;
import com.codeheadsystems.qcheck.server.check.SpreadsheetChecker;
import com.codeheadsystems.qcheck.server.content.ContentValidator;
import com.codeheadsystems.qcheck.server.content.ContentVerdict;
import com.codeheadsystems.qcheck.server.report.ReportFormatter;
import com.codeheadsystems.qcheck.server.session.ClientSession;
import com.codeheadsystems.qcheck.server.session.Session;
import com.codeheadsystems.qcheck.server.session.SessionManager;
import com.codeheadsystems.qcheck.server.source.Submission;
import com.codeheadsystems.qcheck.server.source.SubmissionException;
import com.codeheadsystems.qcheck.server.source.SubmissionSource;
import com.codeheadsystems.qcheck.server.upload.StoredUpload;
import com.codeheadsystems.qcheck.server.upload.UploadManager;
import com.codeheadsystems.qcheck.server.upload.UploadResult;
import jakarta.inject.Inject;
import jakarta.inject.Singleton;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Framework-agnostic request flow behind the check/upload page.
 * <p>
 * Each call resolves the presented session, handles logout and login, and then performs
 * at most one of listing, checking or uploading. Nothing is kept between calls.
 * <p>
 * <strong>Exception contract</strong> (callers should map these to HTTP responses):
 * <ul>
 *   <li>{@link IllegalArgumentException}: missing or malformed request fields, HTTP 400</li>
 * </ul>
 * Failed logins, expired sessions, rejected content and storage failures are reported in
 * the returned {@link RequestOutcome}, not thrown.
 */
@Singleton
public class QcheckRequestManager {

  private static final Logger log = LoggerFactory.getLogger(QcheckRequestManager.class);

  private final SessionManager sessionManager;
  private final CredentialAuthenticator credentialAuthenticator;
  private final ContentValidator contentValidator;
  private final SpreadsheetChecker spreadsheetChecker;
  private final ReportFormatter reportFormatter;
  private final UploadManager uploadManager;

  @Inject
  public QcheckRequestManager(final SessionManager sessionManager,
                              final CredentialAuthenticator credentialAuthenticator,
                              final ContentValidator contentValidator,
                              final SpreadsheetChecker spreadsheetChecker,
                              final ReportFormatter reportFormatter,
                              final UploadManager uploadManager) {
    log.info("QcheckRequestManager()");
    this.sessionManager = sessionManager;
    this.credentialAuthenticator = credentialAuthenticator;
    this.contentValidator = contentValidator;
    this.spreadsheetChecker = spreadsheetChecker;
    this.reportFormatter = reportFormatter;
    this.uploadManager = uploadManager;
  }

  /**
   * The valid session behind what the client presented, for rendering the page.
   *
   * @param clientSession the presented session
   * @return the session, or empty
   */
  public Optional<Session> currentSession(ClientSession clientSession) {
    return sessionManager.resolve(clientSession);
  }

  /**
   * Handles one request.
   *
   * @param request the request
   * @return the outcome
   * @throws IllegalArgumentException if a field the action needs is missing or malformed
   */
  public RequestOutcome handle(QcheckRequest request) {
    log.debug("handle({})", request);
    requireFields(request);
    Optional<Session> session = sessionManager.resolve(request.clientSession());

    // ── Logout ──────────────────────────────────────────────────────────────
    if (request.action() == RequestAction.LOGOUT) {
      session.ifPresent(sessionManager::invalidate);
      return new RequestOutcome(request.action(), null, false, true, null, request.proposalId(),
          List.of(), null, "You have been logged out.");
    }

    // ── Login ───────────────────────────────────────────────────────────────
    AuthOutcome authOutcome = null;
    boolean created = false;
    boolean wantsLogin = request.action() == RequestAction.LOGIN
        || (request.action() == RequestAction.UPLOAD && request.hasCredentials());
    if (session.isEmpty() && wantsLogin) {
      authOutcome = credentialAuthenticator.authenticate(request.username(), request.password());
      if (authOutcome.success()) {
        Session newSession = sessionManager.create(authOutcome.backend(), authOutcome.displayName());
        sessionManager.persist(newSession);
        session = Optional.of(newSession);
        created = true;
      }
    }

    String proposalId = request.proposalId() == null ? null : request.proposalId().trim();
    Session current = session.orElse(null);
    switch (request.action()) {
      case LIST_FILES:
        if (current == null) {
          return new RequestOutcome(request.action(), null, false, false, authOutcome, proposalId,
              List.of(), null, "Please log in to list uploaded files.");
        }
        List<StoredUpload> files = uploadManager.list(proposalId);
        return new RequestOutcome(request.action(), current, created, false, authOutcome, proposalId,
            List.of(), files, files.size() + " file(s) stored for " + proposalId + ".");
      case CHECK:
      case UPLOAD:
        List<SubmissionResult> results = new ArrayList<>();
        for (SubmissionSource source : request.sources()) {
          results.add(process(source, proposalId, request.action() == RequestAction.UPLOAD, current, authOutcome));
        }
        return new RequestOutcome(request.action(), current, created, false, authOutcome, proposalId,
            results, null, null);
      default:
        return new RequestOutcome(request.action(), current, created, false, authOutcome, proposalId,
            List.of(), null, loginNotice(authOutcome, current));
    }
  }

  // ── Check / upload ──────────────────────────────────────────────────────

  private SubmissionResult process(SubmissionSource source, String proposalId, boolean upload,
                                   Session session, AuthOutcome authOutcome) {
    Submission submission;
    try {
      submission = source.fetch();
    } catch (SubmissionException e) {
      log.debug("Submission unavailable: {}", e.getMessage());
      return SubmissionResult.fetchFailed(source.inputName(), e.getMessage());
    }
    ContentVerdict verdict = contentValidator.validate(submission.filename(), submission.content());
    if (!verdict.accepted()) {
      return SubmissionResult.contentRejected(submission.inputName(), verdict);
    }
    Map<String, Program> programs = Map.of(proposalId.toUpperCase(Locale.ROOT), Program.forProposal(proposalId));
    ValidationReport report = spreadsheetChecker.check(submission.content(), programs);
    UploadResult uploadResult = upload
        ? uploadManager.store(submission, proposalId, report, session, authOutcome)
        : null;
    return new SubmissionResult(submission.inputName(), null, verdict, report,
        reportFormatter.summary(report),
        reportFormatter.format(report, Severity.ERROR),
        reportFormatter.format(report, Severity.WARNING),
        uploadResult);
  }

  private static void requireFields(QcheckRequest request) {
    if (request.action() == null) {
      throw new IllegalArgumentException("An action is required");
    }
    switch (request.action()) {
      case LOGIN:
        if (!request.hasCredentials()) {
          throw new IllegalArgumentException("Username and password are required to log in");
        }
        break;
      case CHECK:
      case UPLOAD:
        UploadManager.requireProposalId(trimmed(request.proposalId()));
        if (request.sources().isEmpty()) {
          throw new IllegalArgumentException("Select a file or enter a sheet name");
        }
        break;
      case LIST_FILES:
        UploadManager.requireProposalId(trimmed(request.proposalId()));
        break;
      default:
        break;
    }
  }

  private static String trimmed(String value) {
    return value == null ? null : value.trim();
  }

  private static String loginNotice(AuthOutcome authOutcome, Session session) {
    if (authOutcome == null) {
      return session == null ? null : "Logged in as " + session.displayName() + ".";
    }
    return authOutcome.success()
        ? "Logged in as " + authOutcome.displayName() + " (" + authOutcome.backend() + ")."
        : "Login failed: " + authOutcome.failureReason();
  }
}
