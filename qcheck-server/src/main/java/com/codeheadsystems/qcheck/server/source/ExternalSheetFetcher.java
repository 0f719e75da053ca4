package com.codeheadsystems.qcheck.server.source;

import jakarta.inject.Inject;
import jakarta.inject.Singleton;
import java.io.IOException;
import java.net.URI;
import java.net.URLEncoder;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.nio.charset.StandardCharsets;
import java.text.MessageFormat;
import java.time.Duration;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Downloads the {@code .xlsx} export of an external spreadsheet.
 * <p>
 * The export URL comes from a {@link MessageFormat} template where {@code {0}} is the
 * URL-encoded sheet name. Non-2xx responses, I/O errors and interruptions are all
 * surfaced as {@link SubmissionException}.
 */
@Singleton
public class ExternalSheetFetcher {

  private static final Logger log = LoggerFactory.getLogger(ExternalSheetFetcher.class);
  private static final Duration REQUEST_TIMEOUT = Duration.ofSeconds(30);

  private final HttpClient httpClient;
  private final String urlTemplate;

  /**
   * Instantiates a new External sheet fetcher.
   *
   * @param httpClient  the http client
   * @param urlTemplate the export URL template
   */
  @Inject
  public ExternalSheetFetcher(final HttpClient httpClient, final String urlTemplate) {
    log.info("ExternalSheetFetcher({})", urlTemplate);
    this.httpClient = httpClient;
    this.urlTemplate = urlTemplate;
  }

  /**
   * Downloads the sheet.
   *
   * @param sheetName the sheet name
   * @return the workbook bytes
   */
  public byte[] fetch(final String sheetName) {
    if (sheetName == null || sheetName.isBlank()) {
      throw new IllegalArgumentException("Sheet name is required");
    }
    URI uri = uriFor(sheetName);
    log.debug("fetch(sheetName={}) -> {}", sheetName, uri);
    try {
      HttpRequest request = HttpRequest.newBuilder()
          .uri(uri)
          .timeout(REQUEST_TIMEOUT)
          .GET()
          .build();
      HttpResponse<byte[]> response = httpClient.send(request, HttpResponse.BodyHandlers.ofByteArray());
      if (response.statusCode() < 200 || response.statusCode() >= 300) {
        throw new SubmissionException(
            "Sheet '" + sheetName + "' could not be downloaded (HTTP " + response.statusCode() + ")", null);
      }
      return response.body();
    } catch (IOException e) {
      throw new SubmissionException("Sheet '" + sheetName + "' could not be downloaded", e);
    } catch (InterruptedException e) {
      Thread.currentThread().interrupt();
      throw new SubmissionException("Download of sheet '" + sheetName + "' was interrupted", e);
    }
  }

  URI uriFor(String sheetName) {
    String encoded = URLEncoder.encode(sheetName.trim(), StandardCharsets.UTF_8);
    return URI.create(MessageFormat.format(urlTemplate, encoded));
  }
}
