package com.codeheadsystems.qcheck.server.upload;

import com.fasterxml.jackson.annotation.JsonProperty;
import java.time.Instant;

/**
 * A file already in the upload store.
 *
 * @param name         the stored file name
 * @param size         size in bytes
 * @param lastModified last modification time
 */
public record StoredUpload(
    @JsonProperty("name") String name,
    @JsonProperty("size") long size,
    @JsonProperty("lastModified") Instant lastModified) {
}
