package com.codeheadsystems.qcheck.dropwizard.health;

import com.codahale.metrics.health.HealthCheck;
import java.nio.file.Files;
import java.nio.file.Path;

/**
 * Health check that verifies a storage directory exists and is writable.
 * Registered once for the session directory and once for the upload root.
 */
public class DirectoryHealthCheck extends HealthCheck {

  private final Path directory;

  /**
   * Instantiates a new Directory health check.
   *
   * @param directory the directory
   */
  public DirectoryHealthCheck(Path directory) {
    this.directory = directory;
  }

  @Override
  protected Result check() {
    if (!Files.isDirectory(directory)) {
      return Result.unhealthy("%s is not a directory", directory.toAbsolutePath());
    }
    if (!Files.isWritable(directory)) {
      return Result.unhealthy("%s is not writable", directory.toAbsolutePath());
    }
    return Result.healthy("%s", directory.toAbsolutePath());
  }
}
