package com.codeheadsystems.qcheck.server.session;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;
import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Optional;
import java.util.regex.Pattern;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * {@link SessionStore} that keeps one JSON file per session in a shared directory.
 * <p>
 * The file name is derived from the session id ({@code session_<id>.json}) so a record
 * can be found again from the id alone. There is no expiry sweep: dead records stay on
 * disk. Concurrent writers of the same id are not coordinated; the last write wins.
 */
public class FileSessionStore implements SessionStore {

  private static final Logger log = LoggerFactory.getLogger(FileSessionStore.class);

  private static final String PREFIX = "session_";
  private static final String SUFFIX = ".json";
  // Ids are hex digests; anything else could escape the directory.
  private static final Pattern ID_PATTERN = Pattern.compile("[A-Za-z0-9]{1,128}");

  private final Path directory;
  private final ObjectMapper objectMapper;

  /**
   * Creates a store with a private object mapper.
   *
   * @param directory where records are kept; created on first write
   */
  public FileSessionStore(Path directory) {
    this(directory, new ObjectMapper()
        .registerModule(new JavaTimeModule())
        .disable(SerializationFeature.WRITE_DATES_AS_TIMESTAMPS));
  }

  /**
   * Creates a store with the given object mapper, which must handle {@code java.time} types.
   *
   * @param directory    where records are kept; created on first write
   * @param objectMapper the mapper
   */
  public FileSessionStore(Path directory, ObjectMapper objectMapper) {
    this.directory = directory;
    this.objectMapper = objectMapper;
    log.info("FileSessionStore({})", directory);
  }

  @Override
  public void store(Session session) {
    if (!isWellFormed(session.id())) {
      throw new IllegalArgumentException("Malformed session id");
    }
    Path path = pathFor(session.id());
    try {
      Files.createDirectories(directory);
      Files.write(path, objectMapper.writeValueAsBytes(session));
      log.debug("Wrote session record {}", path);
    } catch (IOException e) {
      throw new UncheckedIOException("Unable to write session record " + path, e);
    }
  }

  @Override
  public Optional<Session> load(String id) {
    if (!isWellFormed(id)) {
      log.debug("Ignoring malformed session id");
      return Optional.empty();
    }
    Path path = pathFor(id);
    if (!Files.isRegularFile(path)) {
      return Optional.empty();
    }
    try {
      return Optional.of(objectMapper.readValue(Files.readAllBytes(path), Session.class));
    } catch (IOException e) {
      log.warn("Unreadable session record {}: {}", path, e.getMessage());
      return Optional.empty();
    }
  }

  /**
   * The directory holding the records.
   *
   * @return the directory
   */
  public Path directory() {
    return directory;
  }

  Path pathFor(String id) {
    return directory.resolve(PREFIX + id + SUFFIX);
  }

  private static boolean isWellFormed(String id) {
    return id != null && ID_PATTERN.matcher(id).matches();
  }
}
