package com.gentoro.meshrender.http;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ObjectNode;
import com.gentoro.meshrender.MeshRender;
import jakarta.servlet.http.HttpServlet;
import jakarta.servlet.http.HttpServletRequest;
import jakarta.servlet.http.HttpServletResponse;
import java.io.IOException;

/**
 * GET /health
 *
 * <p>Reports queue depth, cache size and the number of live channels and staged jobs.
 */
public final class HealthServlet extends HttpServlet {
  private final MeshRender meshRender;
  private final ObjectMapper mapper = new ObjectMapper();

  public HealthServlet(MeshRender meshRender) {
    this.meshRender = meshRender;
  }

  @Override
  protected void doGet(HttpServletRequest req, HttpServletResponse resp) throws IOException {
    ObjectNode node = mapper.createObjectNode();
    node.put("status", "UP");
    node.put("queueDepth", meshRender.workQueue().size());
    node.put("queueRemainingCapacity", meshRender.workQueue().remainingCapacity());
    node.put("cacheEntries", meshRender.dedupCache().size());
    node.put("registeredChannels", meshRender.correlationRegistry().size());
    node.put("stagedJobs", meshRender.submissions().stagedCount());
    node.put("inFlightJobs", meshRender.submissions().inFlightCount());

    resp.setStatus(200);
    resp.setContentType("application/json");
    resp.getWriter().write(mapper.writeValueAsString(node));
  }
}
