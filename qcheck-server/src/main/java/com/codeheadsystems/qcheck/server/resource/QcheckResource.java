package com.codeheadsystems.qcheck.server.resource;

import com.codeheadsystems.qcheck.server.manager.QcheckRequest;
import com.codeheadsystems.qcheck.server.manager.QcheckRequestManager;
import com.codeheadsystems.qcheck.server.manager.RequestAction;
import com.codeheadsystems.qcheck.server.manager.RequestOutcome;
import com.codeheadsystems.qcheck.server.session.ClientSession;
import com.codeheadsystems.qcheck.server.source.ExternalSheetFetcher;
import com.codeheadsystems.qcheck.server.source.ExternalSheetSource;
import com.codeheadsystems.qcheck.server.source.LocalFileSource;
import com.codeheadsystems.qcheck.server.source.SubmissionSource;
import jakarta.inject.Inject;
import jakarta.inject.Singleton;
import jakarta.ws.rs.Consumes;
import jakarta.ws.rs.CookieParam;
import jakarta.ws.rs.GET;
import jakarta.ws.rs.POST;
import jakarta.ws.rs.Path;
import jakarta.ws.rs.Produces;
import jakarta.ws.rs.WebApplicationException;
import jakarta.ws.rs.core.MediaType;
import jakarta.ws.rs.core.Response;
import java.io.IOException;
import java.io.InputStream;
import java.time.Clock;
import java.util.ArrayList;
import java.util.List;
import org.glassfish.jersey.media.multipart.FormDataBodyPart;
import org.glassfish.jersey.media.multipart.FormDataMultiPart;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * JAX-RS resource serving the check/upload page.
 * <p>
 * Endpoints:
 * <ul>
 *   <li>{@code GET /qcheck}: the form, reflecting the current login</li>
 *   <li>{@code POST /qcheck}: a multipart form submission handled by {@link QcheckRequestManager}</li>
 * </ul>
 * Input errors become HTTP 400 pages; everything else, failed logins included, is a 200 page.
 */
@Singleton
@Path("/qcheck")
public class QcheckResource {

  static final String FILE = "file";
  static final String SHEET_NAME = "sheet_name";
  static final String PROPOSAL = "proposal";
  static final String USERNAME = "username";
  static final String PASSWORD = "password";
  static final String ACTION = "action";

  private static final Logger log = LoggerFactory.getLogger(QcheckResource.class);

  private final QcheckRequestManager requestManager;
  private final ExternalSheetFetcher externalSheetFetcher;
  private final QcheckPage page;
  private final Clock clock;

  /**
   * Instantiates a new Qcheck resource.
   *
   * @param requestManager       the request manager
   * @param externalSheetFetcher downloads sheets named in the form
   * @param page                 the page renderer
   * @param clock                used for cookie lifetimes
   */
  @Inject
  public QcheckResource(final QcheckRequestManager requestManager,
                        final ExternalSheetFetcher externalSheetFetcher,
                        final QcheckPage page,
                        final Clock clock) {
    this.requestManager = requestManager;
    this.externalSheetFetcher = externalSheetFetcher;
    this.page = page;
    this.clock = clock;
    log.info("QcheckResource({})", requestManager);
  }

  @GET
  @Produces(MediaType.TEXT_HTML)
  public String show(@CookieParam(SessionCookies.ID) final String id,
                     @CookieParam(SessionCookies.START) final String start,
                     @CookieParam(SessionCookies.EXPIRES) final String expires,
                     @CookieParam(SessionCookies.BACKEND) final String backend,
                     @CookieParam(SessionCookies.USER) final String user) {
    ClientSession clientSession = SessionCookies.read(id, start, expires, backend, user);
    return page.render(requestManager.currentSession(clientSession).orElse(null));
  }

  @POST
  @Consumes(MediaType.MULTIPART_FORM_DATA)
  @Produces(MediaType.TEXT_HTML)
  public Response submit(final FormDataMultiPart form,
                         @CookieParam(SessionCookies.ID) final String id,
                         @CookieParam(SessionCookies.START) final String start,
                         @CookieParam(SessionCookies.EXPIRES) final String expires,
                         @CookieParam(SessionCookies.BACKEND) final String backend,
                         @CookieParam(SessionCookies.USER) final String user) {
    ClientSession clientSession = SessionCookies.read(id, start, expires, backend, user);
    RequestOutcome outcome;
    try {
      QcheckRequest request = new QcheckRequest(
          RequestAction.fromFormValue(text(form, ACTION)),
          clientSession,
          text(form, PROPOSAL),
          text(form, USERNAME),
          text(form, PASSWORD),
          sources(form));
      outcome = requestManager.handle(request);
    } catch (IllegalArgumentException e) {
      log.debug("Bad request: {}", e.getMessage());
      throw new WebApplicationException(Response.status(Response.Status.BAD_REQUEST)
          .type(MediaType.TEXT_HTML)
          .entity(page.error(e.getMessage()))
          .build());
    }
    Response.ResponseBuilder response = Response.ok(page.render(outcome), MediaType.TEXT_HTML);
    if (outcome.loggedOut()) {
      response.cookie(SessionCookies.expire());
    } else if (outcome.sessionCreated()) {
      response.cookie(SessionCookies.issue(outcome.session(), clock.instant()));
    }
    return response.build();
  }

  private List<SubmissionSource> sources(FormDataMultiPart form) {
    List<SubmissionSource> sources = new ArrayList<>();
    List<FormDataBodyPart> files = form == null ? null : form.getFields(FILE);
    if (files != null) {
      for (FormDataBodyPart part : files) {
        String filename = part.getContentDisposition().getFileName();
        // Browsers send an empty part with no file name when nothing was selected.
        if (filename == null || filename.isEmpty()) {
          continue;
        }
        sources.add(new LocalFileSource(filename, read(part, filename)));
      }
    }
    String sheetName = text(form, SHEET_NAME);
    if (sheetName != null && !sheetName.isBlank()) {
      sources.add(new ExternalSheetSource(sheetName.trim(), externalSheetFetcher));
    }
    return sources;
  }

  private static byte[] read(FormDataBodyPart part, String filename) {
    try (InputStream in = part.getValueAs(InputStream.class)) {
      return in.readAllBytes();
    } catch (IOException e) {
      throw new IllegalArgumentException("Unable to read uploaded file " + filename, e);
    }
  }

  private static String text(FormDataMultiPart form, String name) {
    if (form == null) {
      return null;
    }
    FormDataBodyPart field = form.getField(name);
    return field == null ? null : field.getValue();
  }
}
