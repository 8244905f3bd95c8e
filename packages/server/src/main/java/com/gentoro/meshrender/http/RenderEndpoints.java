package com.gentoro.meshrender.http;

import com.gentoro.meshrender.MeshRender;
import jakarta.servlet.MultipartConfigElement;
import java.time.Duration;
import org.eclipse.jetty.ee10.servlet.DefaultServlet;
import org.eclipse.jetty.ee10.servlet.ServletContextHandler;
import org.eclipse.jetty.ee10.servlet.ServletHolder;
import org.eclipse.jetty.ee10.websocket.server.config.JettyWebSocketServletContainerInitializer;

/**
 * Registers the public endpoints on the shared Jetty context:
 *
 * <ul>
 *   <li>{@code GET /} upload page
 *   <li>{@code POST /upload} submission
 *   <li>{@code /ws} job notifications
 *   <li>{@code GET /output/*} rendered images
 *   <li>{@code GET /health} queue and cache figures
 * </ul>
 */
public final class RenderEndpoints {
  private static final org.slf4j.Logger log =
      com.gentoro.meshrender.logging.LoggingService.getLogger(RenderEndpoints.class);

  public static final String WS_PATH = "/ws";

  private final MeshRender meshRender;

  public RenderEndpoints(MeshRender meshRender) {
    this.meshRender = meshRender;
  }

  public void register() {
    ServletContextHandler ctx = meshRender.httpServer().getContextHandler();

    ctx.addServlet(new ServletHolder(new IndexServlet()), "");

    long maxBytes =
        meshRender.configuration().getLong("upload.max-bytes", UploadServlet.DEFAULT_MAX_BYTES);
    ServletHolder upload =
        new ServletHolder(new UploadServlet(meshRender.submissions(), maxBytes));
    upload
        .getRegistration()
        .setMultipartConfig(
            new MultipartConfigElement(
                meshRender.storage().uploadsDir().toString(), maxBytes, maxBytes + 1024 * 1024, 0));
    ctx.addServlet(upload, "/upload");

    ServletHolder output = new ServletHolder("output", DefaultServlet.class);
    output.setInitParameter("baseResource", meshRender.storage().outputDir().toUri().toString());
    output.setInitParameter("dirAllowed", "false");
    output.setInitParameter("pathInfoOnly", "true");
    ctx.addServlet(output, "/output/*");

    ctx.addServlet(new ServletHolder(new HealthServlet(meshRender)), "/health");

    Duration idleTimeout =
        Duration.ofSeconds(
            meshRender.configuration().getLong("notifications.idle-timeout-seconds", 3600));
    JettyWebSocketServletContainerInitializer.configure(
        ctx,
        (servletContext, container) -> {
          container.setIdleTimeout(idleTimeout);
          container.addMapping(
              WS_PATH,
              (req, resp) ->
                  new NotificationSocket(
                      meshRender.correlationRegistry(), meshRender.submissions()));
        });

    log.debug("Registered upload, output, health and {} endpoints", WS_PATH);
  }
}
