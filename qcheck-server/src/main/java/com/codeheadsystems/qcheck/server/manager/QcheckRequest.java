package com.codeheadsystems.qcheck.server.manager;

import com.codeheadsystems.qcheck.server.session.ClientSession;
import com.codeheadsystems.qcheck.server.source.SubmissionSource;
import java.util.List;

/**
 * A decoded form submission.
 *
 * @param action        what is asked for
 * @param clientSession the session the client presented
 * @param proposalId    the proposal, may be null
 * @param username      login username, may be null
 * @param password      login secret, may be null
 * @param sources       spreadsheets to check or upload
 */
public record QcheckRequest(RequestAction action, ClientSession clientSession, String proposalId,
                            String username, String password, List<SubmissionSource> sources) {

  public QcheckRequest {
    clientSession = clientSession == null ? ClientSession.NONE : clientSession;
    sources = sources == null ? List.of() : List.copyOf(sources);
  }

  public boolean hasCredentials() {
    return username != null && !username.isBlank() && password != null && !password.isBlank();
  }

  @Override
  public String toString() {
    // The password never leaves this record through logging.
    return "QcheckRequest[action=" + action + ", proposalId=" + proposalId + ", username=" + username
        + ", sources=" + sources.size() + "]";
  }
}
