package com.gentoro.meshrender.http;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.Mockito.*;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.gentoro.meshrender.MeshRender;
import com.gentoro.meshrender.cache.DedupCache;
import com.gentoro.meshrender.notify.CorrelationRegistry;
import com.gentoro.meshrender.queue.WorkQueue;
import com.gentoro.meshrender.submission.SubmissionService;
import org.eclipse.jetty.ee10.servlet.ServletHolder;
import org.eclipse.jetty.ee10.servlet.ServletTester;
import org.eclipse.jetty.http.HttpTester;
import org.junit.jupiter.api.Test;

class HealthServletTest {

  @Test
  void reportsQueueCacheAndChannelFigures() throws Exception {
    MeshRender meshRender = mock(MeshRender.class);
    WorkQueue queue = mock(WorkQueue.class);
    when(queue.size()).thenReturn(3);
    when(queue.remainingCapacity()).thenReturn(97);
    DedupCache cache = mock(DedupCache.class);
    when(cache.size()).thenReturn(12);
    CorrelationRegistry registry = mock(CorrelationRegistry.class);
    when(registry.size()).thenReturn(2);
    SubmissionService submissions = mock(SubmissionService.class);
    when(submissions.stagedCount()).thenReturn(1);
    when(submissions.inFlightCount()).thenReturn(4);
    when(meshRender.workQueue()).thenReturn(queue);
    when(meshRender.dedupCache()).thenReturn(cache);
    when(meshRender.correlationRegistry()).thenReturn(registry);
    when(meshRender.submissions()).thenReturn(submissions);

    ServletTester tester = new ServletTester();
    tester.setContextPath("/");
    tester.getContext().addServlet(new ServletHolder(new HealthServlet(meshRender)), "/health");
    tester.start();
    try {
      HttpTester.Request req = HttpTester.newRequest();
      req.setMethod("GET");
      req.setURI("/health");
      req.setVersion("HTTP/1.1");
      req.setHeader("Host", "localhost");

      HttpTester.Response resp = HttpTester.parseResponse(tester.getResponses(req.generate()));

      assertEquals(200, resp.getStatus());
      JsonNode node = new ObjectMapper().readTree(resp.getContent());
      assertEquals("UP", node.get("status").asText());
      assertEquals(3, node.get("queueDepth").asInt());
      assertEquals(97, node.get("queueRemainingCapacity").asInt());
      assertEquals(12, node.get("cacheEntries").asInt());
      assertEquals(2, node.get("registeredChannels").asInt());
      assertEquals(1, node.get("stagedJobs").asInt());
      assertEquals(4, node.get("inFlightJobs").asInt());
    } finally {
      tester.stop();
    }
  }
}
