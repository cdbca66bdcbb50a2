package com.gentoro.gscmcp.actuator;

import com.gentoro.gscmcp.GscMcp;
import com.gentoro.gscmcp.utility.JacksonUtility;
import jakarta.servlet.http.HttpServlet;
import jakarta.servlet.http.HttpServletRequest;
import jakarta.servlet.http.HttpServletResponse;
import java.io.IOException;
import java.io.PrintWriter;
import java.util.LinkedHashMap;
import java.util.Map;
import org.eclipse.jetty.ee10.servlet.ServletHolder;

/**
 * Health endpoint at {@code /actuator/health}, modelled after Spring Boot's actuator.
 *
 * <p>Response body: {@code {"status":"UP","accounts":N}}
 */
public class ActuatorService {
  private static final org.slf4j.Logger log =
      com.gentoro.gscmcp.logging.LoggingService.getLogger(ActuatorService.class);

  public static final String HEALTH_PATH = "/actuator/health";

  private final GscMcp context;

  public ActuatorService(GscMcp context) {
    this.context = context;
  }

  /** Register the actuator servlet with the shared Jetty context handler. */
  public void register() {
    context
        .httpServer()
        .getContextHandler()
        .addServlet(new ServletHolder(new HealthServlet(context)), HEALTH_PATH);
    log.info("Actuator health endpoint registered at {}", HEALTH_PATH);
  }

  static Map<String, Object> health(GscMcp context) {
    Map<String, Object> body = new LinkedHashMap<>();
    body.put("status", "UP");
    body.put("accounts", context.accountRegistry().count());
    return body;
  }

  static class HealthServlet extends HttpServlet {
    private final transient GscMcp context;

    HealthServlet(GscMcp context) {
      this.context = context;
    }

    @Override
    protected void doGet(HttpServletRequest req, HttpServletResponse resp) throws IOException {
      resp.setStatus(200);
      resp.setContentType("application/json");
      try (PrintWriter out = resp.getWriter()) {
        out.println(JacksonUtility.getJsonMapper().writeValueAsString(health(context)));
      }
    }
  }
}
