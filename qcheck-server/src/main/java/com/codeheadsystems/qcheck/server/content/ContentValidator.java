package com.codeheadsystems.qcheck.server.content;

import jakarta.inject.Inject;
import jakarta.inject.Singleton;
import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Set;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Verifies that a submitted file is what it claims to be.
 * <p>
 * The extension check and the content check are evaluated independently and each
 * contributes its own rejection message, so a mislabelled text file gets both.
 * When the extension itself is not allowed, the content is judged against every
 * signature any allowed extension accepts.
 */
@Singleton
public class ContentValidator {

  private static final Logger log = LoggerFactory.getLogger(ContentValidator.class);

  private final Map<String, Set<String>> acceptedSignatures;
  private final Set<String> anySignature;
  private final SignatureDetector signatureDetector;

  /**
   * Instantiates a new Content validator.
   *
   * @param acceptedSignatures allowed extensions (lower case, in display order) to their signatures
   * @param signatureDetector  the detector
   */
  @Inject
  public ContentValidator(final Map<String, Set<String>> acceptedSignatures,
                          final SignatureDetector signatureDetector) {
    this.acceptedSignatures = acceptedSignatures;
    this.signatureDetector = signatureDetector;
    Set<String> union = new LinkedHashSet<>();
    acceptedSignatures.values().forEach(union::addAll);
    this.anySignature = union;
    log.info("ContentValidator({})", acceptedSignatures.keySet());
  }

  /**
   * Checks a file.
   *
   * @param filename the name the client gave the file; directories are ignored
   * @param content  the bytes
   * @return the verdict
   */
  public ContentVerdict validate(String filename, byte[] content) {
    String extension = extensionOf(filename);
    String detected = signatureDetector.detect(content);
    boolean extensionOk = acceptedSignatures.containsKey(extension);
    Set<String> expected = extensionOk ? acceptedSignatures.get(extension) : anySignature;
    boolean contentOk = expected.contains(detected);

    List<String> rejections = new ArrayList<>();
    if (!extensionOk) {
      rejections.add(String.format("File extension '%s' is not a valid file type. Must be one of %s.",
          extension, String.join(", ", acceptedSignatures.keySet())));
    }
    if (!contentOk) {
      rejections.add(String.format(
          "File content type '%s' does not match the expected content for a .%s file (expected one of %s).",
          detected, extension, String.join(", ", expected)));
    }
    log.debug("validate({}) -> ext={}, signature={}, accepted={}",
        filename, extension, detected, rejections.isEmpty());
    return new ContentVerdict(extension, extensionOk, contentOk, detected, rejections);
  }

  /**
   * The lower-cased text after the last dot of the last path segment.
   *
   * @param filename the filename, may contain {@code /} or {@code \} separators
   * @return the extension, or an empty string if there is none
   */
  public static String extensionOf(String filename) {
    String base = baseName(filename);
    int dot = base.lastIndexOf('.');
    return dot < 0 ? "" : base.substring(dot + 1).toLowerCase(Locale.ROOT);
  }

  /**
   * The last path segment of a client-supplied filename.
   *
   * @param filename the filename
   * @return the base name, empty for null
   */
  public static String baseName(String filename) {
    if (filename == null) {
      return "";
    }
    int slash = Math.max(filename.lastIndexOf('/'), filename.lastIndexOf('\\'));
    return filename.substring(slash + 1);
  }
}
