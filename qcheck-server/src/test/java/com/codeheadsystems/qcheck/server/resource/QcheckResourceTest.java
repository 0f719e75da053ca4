package com.codeheadsystems.qcheck.server.resource;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.catchThrowableOfType;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

import com.codeheadsystems.qcheck.server.manager.QcheckRequest;
import com.codeheadsystems.qcheck.server.manager.QcheckRequestManager;
import com.codeheadsystems.qcheck.server.manager.RequestAction;
import com.codeheadsystems.qcheck.server.manager.RequestOutcome;
import com.codeheadsystems.qcheck.server.session.ClientSession;
import com.codeheadsystems.qcheck.server.session.Session;
import com.codeheadsystems.qcheck.server.source.ExternalSheetFetcher;
import com.codeheadsystems.qcheck.server.source.ExternalSheetSource;
import jakarta.ws.rs.WebApplicationException;
import jakarta.ws.rs.core.NewCookie;
import jakarta.ws.rs.core.Response;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.List;
import java.util.Optional;
import org.glassfish.jersey.media.multipart.FormDataMultiPart;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

@ExtendWith(MockitoExtension.class)
class QcheckResourceTest {

  private static final Instant NOW = Instant.parse("2022-03-01T10:15:30Z");
  private static final Session SESSION =
      new Session("abc123", NOW, NOW.plus(Duration.ofHours(3)), "ldap", "Jane Observer");

  @Mock private QcheckRequestManager requestManager;
  @Mock private ExternalSheetFetcher externalSheetFetcher;

  private QcheckResource resource;

  @BeforeEach
  void setUp() {
    resource = new QcheckResource(requestManager, externalSheetFetcher,
        new QcheckPage(List.of("xlsx", "xls")), Clock.fixed(NOW, ZoneOffset.UTC));
  }

  @Test
  void showRendersLoggedInUser() {
    when(requestManager.currentSession(any())).thenReturn(Optional.of(SESSION));

    String page = resource.show("abc123", null, null, "ldap", "Jane%20Observer");

    assertThat(page).contains("Logged in as Jane Observer (ldap)");
    ArgumentCaptor<ClientSession> captor = ArgumentCaptor.forClass(ClientSession.class);
    verify(requestManager).currentSession(captor.capture());
    assertThat(captor.getValue().id()).isEqualTo("abc123");
  }

  @Test
  void submitDecodesFormFields() {
    when(requestManager.handle(any())).thenReturn(outcome(RequestAction.CHECK, null, false, false));
    FormDataMultiPart form = new FormDataMultiPart()
        .field(QcheckResource.ACTION, "check")
        .field(QcheckResource.PROPOSAL, "GN-2022A-Q-1")
        .field(QcheckResource.SHEET_NAME, " 1AbCd ");

    Response response = resource.submit(form, null, null, null, null, null);

    assertThat(response.getStatus()).isEqualTo(200);
    assertThat(response.getCookies()).isEmpty();
    ArgumentCaptor<QcheckRequest> captor = ArgumentCaptor.forClass(QcheckRequest.class);
    verify(requestManager).handle(captor.capture());
    QcheckRequest request = captor.getValue();
    assertThat(request.action()).isEqualTo(RequestAction.CHECK);
    assertThat(request.proposalId()).isEqualTo("GN-2022A-Q-1");
    assertThat(request.clientSession().hasId()).isFalse();
    assertThat(request.sources()).singleElement()
        .isInstanceOfSatisfying(ExternalSheetSource.class, s -> assertThat(s.sheetName()).isEqualTo("1AbCd"));
  }

  @Test
  void newSessionIssuesCookies() {
    when(requestManager.handle(any())).thenReturn(outcome(RequestAction.LOGIN, SESSION, true, false));
    FormDataMultiPart form = new FormDataMultiPart()
        .field(QcheckResource.ACTION, "login")
        .field(QcheckResource.USERNAME, "jane")
        .field(QcheckResource.PASSWORD, "pw");

    Response response = resource.submit(form, null, null, null, null, null);

    NewCookie id = response.getCookies().get(SessionCookies.ID);
    assertThat(id.getValue()).isEqualTo("abc123");
    assertThat(id.getMaxAge()).isEqualTo(3 * 60 * 60);
    assertThat(id.isHttpOnly()).isTrue();
    assertThat(response.getCookies().get(SessionCookies.USER).getValue()).isEqualTo("Jane+Observer");
  }

  @Test
  void logoutExpiresCookies() {
    when(requestManager.handle(any())).thenReturn(outcome(RequestAction.LOGOUT, null, false, true));

    Response response = resource.submit(new FormDataMultiPart().field(QcheckResource.ACTION, "logout"),
        "abc123", null, null, null, null);

    assertThat(response.getCookies().get(SessionCookies.ID).getMaxAge()).isZero();
  }

  @Test
  void unknownActionIsBadRequest() {
    WebApplicationException e = catchThrowableOfType(
        () -> resource.submit(new FormDataMultiPart().field(QcheckResource.ACTION, "drop"), null, null, null, null, null),
        WebApplicationException.class);

    assertThat(e.getResponse().getStatus()).isEqualTo(400);
    assertThat((String) e.getResponse().getEntity()).contains("Unknown action: drop");
    verify(requestManager, never()).handle(any());
  }

  @Test
  void managerRejectionIsBadRequest() {
    when(requestManager.handle(any())).thenThrow(new IllegalArgumentException("Invalid proposal id: ../x"));

    WebApplicationException e = catchThrowableOfType(
        () -> resource.submit(new FormDataMultiPart().field(QcheckResource.ACTION, "check"), null, null, null, null, null),
        WebApplicationException.class);

    assertThat(e.getResponse().getStatus()).isEqualTo(400);
    assertThat((String) e.getResponse().getEntity()).contains("Invalid proposal id: ../x");
  }

  private static RequestOutcome outcome(RequestAction action, Session session, boolean created, boolean loggedOut) {
    return new RequestOutcome(action, session, created, loggedOut, null, null, List.of(), null, null);
  }
}
