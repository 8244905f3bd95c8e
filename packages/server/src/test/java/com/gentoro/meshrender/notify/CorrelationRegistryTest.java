package com.gentoro.meshrender.notify;

import static org.junit.jupiter.api.Assertions.*;

import org.junit.jupiter.api.Test;

class CorrelationRegistryTest {

  private final CorrelationRegistry registry = new CorrelationRegistry();

  private NotificationSession session() {
    return new NotificationSession(
        new RecordingChannel(), registry, id -> JobActivator.Activation.ENQUEUED);
  }

  @Test
  void registerThenLookup() {
    NotificationSession s = session();

    registry.register("job-1", s);

    assertSame(s, registry.lookup("job-1").orElseThrow());
    assertSame(s, registry.sinkFor("job-1"));
    assertEquals(1, registry.size());
  }

  @Test
  void unknownJobGetsNoopSink() {
    assertTrue(registry.lookup("nobody").isEmpty());
    assertSame(NotificationSink.NOOP, registry.sinkFor("nobody"));
  }

  @Test
  void reRegisterReplacesPreviousBinding() {
    NotificationSession first = session();
    NotificationSession second = session();

    assertTrue(registry.register("job-1", first).isEmpty());
    assertSame(first, registry.register("job-1", second).orElseThrow());

    assertSame(second, registry.lookup("job-1").orElseThrow());
    assertEquals(1, registry.size());
  }

  @Test
  void registeringTheSameSessionAgainReplacesNothing() {
    NotificationSession s = session();
    registry.register("job-1", s);

    assertTrue(registry.register("job-1", s).isEmpty());
  }

  @Test
  void unregisterRemovesBinding() {
    registry.register("job-1", session());

    registry.unregister("job-1");

    assertTrue(registry.lookup("job-1").isEmpty());
    assertEquals(0, registry.size());
  }

  @Test
  void replacedSessionCannotEvictItsSuccessor() {
    NotificationSession first = session();
    NotificationSession second = session();
    registry.register("job-1", first);
    registry.register("job-1", second);

    assertFalse(registry.unregister("job-1", first));
    assertSame(second, registry.lookup("job-1").orElseThrow());

    assertTrue(registry.unregister("job-1", second));
    assertTrue(registry.lookup("job-1").isEmpty());
  }
}
