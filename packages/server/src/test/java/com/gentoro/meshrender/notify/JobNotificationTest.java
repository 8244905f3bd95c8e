package com.gentoro.meshrender.notify;

import static org.junit.jupiter.api.Assertions.*;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.junit.jupiter.api.Test;

class JobNotificationTest {
  private final ObjectMapper mapper = new ObjectMapper();

  @Test
  void completedCarriesTheLink() throws Exception {
    JsonNode node =
        mapper.readTree(
            mapper.writeValueAsString(JobNotification.completed("j1", "/output/output-x.png")));

    assertEquals("j1", node.get("jobId").asText());
    assertEquals("completed", node.get("status").asText());
    assertEquals("Rendering complete!", node.get("message").asText());
    assertEquals("/output/output-x.png", node.get("output").asText());
  }

  @Test
  void processingOmitsOutput() throws Exception {
    JsonNode node = mapper.readTree(mapper.writeValueAsString(JobNotification.processing("j1")));

    assertEquals("processing", node.get("status").asText());
    assertEquals("Processing your file...", node.get("message").asText());
    assertFalse(node.has("output"));
  }

  @Test
  void failedIncludesReasonWhenGiven() {
    assertEquals(
        "Failed to render file. Please try again. (Mesh has no extent)",
        JobNotification.failed("j1", "Mesh has no extent").message());
    assertEquals(
        "Failed to render file. Please try again.", JobNotification.failed("j1", null).message());
    assertTrue(JobNotification.failed("j1", null).status().isTerminal());
    assertFalse(JobNotification.processing("j1").status().isTerminal());
  }
}
