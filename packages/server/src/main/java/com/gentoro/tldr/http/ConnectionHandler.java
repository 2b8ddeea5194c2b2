package com.gentoro.tldr.http;

import com.gentoro.tldr.exception.BadRequestException;
import com.gentoro.tldr.exception.FramingException;
import com.gentoro.tldr.exception.JobRejectedException;
import com.gentoro.tldr.logging.LoggingService;
import java.io.InputStream;
import org.slf4j.Logger;

/**
 * Frames one request from a connection, routes it and turns client-attributable failures into
 * responses. Anything else propagates to the worker, which answers 500.
 */
public class ConnectionHandler {
  private static final Logger log = LoggingService.getLogger(ConnectionHandler.class);

  private final RequestFramer framer;
  private final Router router;

  public ConnectionHandler(RequestFramer framer, Router router) {
    this.framer = framer;
    this.router = router;
  }

  public HttpResponse handle(InputStream in) {
    HttpRequest request = null;
    try {
      RequestHead head = framer.readHead(in);
      request = new HttpRequest(head, () -> framer.readBody(head, in));
      HttpResponse response = router.route(request);
      log.debug("{} -> {}", request, response.status().code());
      return response;
    } catch (FramingException e) {
      if (e.isRespondable()) {
        log.warn("Rejecting request {}: {}", describe(request), e.getMessage());
      } else {
        log.debug("Peer went away: {}", e.getMessage());
      }
      return HttpResponse.text(HttpStatus.ofCode(e.failure().status()), e.getMessage());
    } catch (BadRequestException e) {
      log.info("Bad request {}: {}", describe(request), e.getMessage());
      return HttpResponse.text(HttpStatus.BAD_REQUEST, e.getMessage());
    } catch (JobRejectedException e) {
      return HttpResponse.text(HttpStatus.SERVICE_UNAVAILABLE, e.getMessage());
    }
  }

  private static String describe(HttpRequest request) {
    return request == null ? "<unframed>" : request.toString();
  }
}
