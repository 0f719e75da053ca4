package com.codeheadsystems.qcheck.server.manager;

import com.codeheadsystems.qcheck.server.auth.AuthOutcome;
import com.codeheadsystems.qcheck.server.session.Session;
import com.codeheadsystems.qcheck.server.upload.StoredUpload;
import java.util.List;

/**
 * Everything the page needs after a request was handled.
 *
 * @param action         the action handled
 * @param session        the valid session after handling, null if there is none
 * @param sessionCreated whether {@code session} was created by this request
 * @param loggedOut      whether this request ended a session
 * @param authOutcome    the login attempted by this request, null if none
 * @param proposalId     the proposal the request was about, may be null
 * @param submissions    per-spreadsheet results for CHECK and UPLOAD
 * @param storedFiles    the listing for LIST_FILES, null otherwise
 * @param notice         a message for the user, may be null
 */
public record RequestOutcome(RequestAction action, Session session, boolean sessionCreated, boolean loggedOut,
                             AuthOutcome authOutcome, String proposalId, List<SubmissionResult> submissions,
                             List<StoredUpload> storedFiles, String notice) {

  public RequestOutcome {
    submissions = submissions == null ? List.of() : List.copyOf(submissions);
  }

  public boolean authenticated() {
    return session != null;
  }
}
