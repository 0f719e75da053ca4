package com.codeheadsystems.qcheck.server.upload;

import com.codeheadsystems.qcheck.model.ValidationReport;
import com.codeheadsystems.qcheck.server.auth.AuthOutcome;
import com.codeheadsystems.qcheck.server.content.ContentValidator;
import com.codeheadsystems.qcheck.server.session.Session;
import com.codeheadsystems.qcheck.server.source.Submission;
import jakarta.inject.Inject;
import jakarta.inject.Singleton;
import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Clock;
import java.time.Instant;
import java.time.format.DateTimeFormatter;
import java.util.Comparator;
import java.util.List;
import java.util.Locale;
import java.util.regex.Pattern;
import java.util.stream.Stream;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Files checked spreadsheets under {@code <root>/<proposal>/}.
 * <p>
 * A file is only written when its report has no errors and the uploader is either in a
 * valid session or has just authenticated. The stored name is the submitted base name
 * with an upload timestamp (one-second resolution) appended, prefixed with the proposal
 * id when the base name does not already contain it. Two uploads of the same name in the
 * same second overwrite each other.
 */
@Singleton
public class UploadManager {

  private static final Logger log = LoggerFactory.getLogger(UploadManager.class);

  private static final Pattern PROPOSAL_ID = Pattern.compile("[A-Za-z0-9][A-Za-z0-9_-]*");
  private static final DateTimeFormatter TIMESTAMP = DateTimeFormatter.ofPattern("yyyyMMdd-HHmmss");

  private final Path root;
  private final Notifier notifier;
  private final Clock clock;

  /**
   * Instantiates a new Upload manager.
   *
   * @param root     the upload root
   * @param notifier told about every stored file
   * @param clock    source of upload timestamps and their zone
   */
  @Inject
  public UploadManager(final Path root, final Notifier notifier, final Clock clock) {
    this.root = root;
    this.notifier = notifier;
    this.clock = clock;
    log.info("UploadManager({})", root);
  }

  /**
   * Stores a submission if its report is clean and the uploader is authorized.
   *
   * @param submission  the checked submission
   * @param proposalId  the proposal to file it under
   * @param report      the submission's validation report
   * @param session     the uploader's valid session, null if there is none
   * @param authOutcome the result of a login attempted with this request, null if none was made
   * @return the result; nothing is written unless its status is {@link UploadStatus#STORED}
   * @throws IllegalArgumentException if the proposal id is malformed
   */
  public UploadResult store(Submission submission, String proposalId, ValidationReport report,
                            Session session, AuthOutcome authOutcome) {
    requireProposalId(proposalId);
    if (report.errorCount() > 0) {
      return UploadResult.rejected(UploadStatus.VALIDATION_ERRORS_PRESENT,
          "File was not uploaded because it has " + report.errorCount() + " error(s).");
    }
    boolean loggedIn = authOutcome != null && authOutcome.success();
    if (session == null && !loggedIn) {
      if (authOutcome != null) {
        return UploadResult.rejected(UploadStatus.AUTH_FAILED,
            "File was not uploaded: authentication failed (" + authOutcome.failureReason() + ").");
      }
      return UploadResult.rejected(UploadStatus.SESSION_EXPIRED,
          "File was not uploaded: please log in again.");
    }

    Instant now = clock.instant();
    String extension = ContentValidator.extensionOf(submission.filename());
    Path destination = root.resolve(proposalId).resolve(storedName(submission.filename(), proposalId, now));
    try {
      Files.createDirectories(destination.getParent());
      Files.write(destination, submission.content());
    } catch (IOException e) {
      log.error("Unable to store {} for proposal {} at {}", submission.filename(), proposalId, destination, e);
      return UploadResult.rejected(UploadStatus.STORAGE_FAILED,
          "File was not uploaded: it could not be saved on the server.");
    }
    UploadedFile file = new UploadedFile(submission.filename(), proposalId, extension, submission.content(),
        destination, now, submission.kind(), submission.inputName());
    log.info("Stored {} for proposal {} at {}", submission.inputName(), proposalId, destination);

    String backend = session != null ? session.backend() : authOutcome.backend();
    String displayName = session != null ? session.displayName() : authOutcome.displayName();
    try {
      notifier.notifyStored(new UploadNotice(file, backend, displayName));
    } catch (RuntimeException e) {
      log.warn("Upload notification for {} failed: {}", destination, e.getMessage());
    }
    return new UploadResult(UploadStatus.STORED, file,
        "File " + submission.inputName() + " was uploaded as " + destination.getFileName() + ".");
  }

  /**
   * Lists the files stored for a proposal, sorted by name.
   *
   * @param proposalId the proposal
   * @return the files, empty if none were ever stored
   * @throws IllegalArgumentException if the proposal id is malformed
   */
  public List<StoredUpload> list(String proposalId) {
    requireProposalId(proposalId);
    Path directory = root.resolve(proposalId);
    if (!Files.isDirectory(directory)) {
      return List.of();
    }
    try (Stream<Path> files = Files.list(directory)) {
      return files.filter(Files::isRegularFile)
          .map(UploadManager::describe)
          .sorted(Comparator.comparing(StoredUpload::name))
          .toList();
    } catch (IOException e) {
      throw new UncheckedIOException("Unable to list uploads for " + proposalId, e);
    }
  }

  String storedName(String filename, String proposalId, Instant now) {
    String base = ContentValidator.baseName(filename);
    String extension = ContentValidator.extensionOf(filename);
    if (!extension.isEmpty()) {
      base = base.substring(0, base.length() - extension.length() - 1);
    }
    String name = base + "_" + TIMESTAMP.format(now.atZone(clock.getZone()));
    if (!base.toUpperCase(Locale.ROOT).contains(proposalId.toUpperCase(Locale.ROOT))) {
      name = proposalId + "_" + name;
    }
    return extension.isEmpty() ? name : name + "." + extension;
  }

  public static void requireProposalId(String proposalId) {
    if (proposalId == null || !PROPOSAL_ID.matcher(proposalId).matches()) {
      throw new IllegalArgumentException("Invalid proposal id: " + proposalId);
    }
  }

  private static StoredUpload describe(Path path) {
    try {
      return new StoredUpload(path.getFileName().toString(), Files.size(path),
          Files.getLastModifiedTime(path).toInstant());
    } catch (IOException e) {
      throw new UncheckedIOException("Unable to read " + path, e);
    }
  }
}
