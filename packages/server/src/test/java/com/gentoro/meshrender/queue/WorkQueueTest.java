package com.gentoro.meshrender.queue;

import static org.junit.jupiter.api.Assertions.*;

import com.gentoro.meshrender.fingerprint.ContentFingerprint;
import java.nio.file.Path;
import java.time.Duration;
import java.time.Instant;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.Timeout;

class WorkQueueTest {

  static RenderJob job(String id) {
    var fp = ContentFingerprint.derive(id.getBytes());
    return new RenderJob(
        id, fp, Path.of("uploads", "input-" + fp + ".stl"), "output-" + fp + ".png", Instant.now());
  }

  @Test
  void defaultsToOneHundredSlots() {
    assertEquals(100, WorkQueue.DEFAULT_CAPACITY);
    WorkQueue queue = new WorkQueue(WorkQueue.DEFAULT_CAPACITY);
    assertEquals(100, queue.remainingCapacity());
  }

  @Test
  void rejectsNonPositiveCapacity() {
    assertThrows(IllegalArgumentException.class, () -> new WorkQueue(0));
  }

  @Test
  @Timeout(5)
  void deliversInFifoOrder() throws Exception {
    WorkQueue queue = new WorkQueue(3);
    queue.enqueue(job("a"));
    queue.enqueue(job("b"));
    queue.enqueue(job("c"));

    assertEquals(3, queue.size());
    assertEquals("a", queue.dequeue().id());
    assertEquals("b", queue.dequeue().id());
    assertEquals("c", queue.dequeue().id());
    assertEquals(0, queue.size());
  }

  @Test
  @Timeout(10)
  void enqueueBlocksWhileFullAndResumesAfterDequeue() throws Exception {
    WorkQueue queue = new WorkQueue(1);
    queue.enqueue(job("first"));

    CompletableFuture<Void> blocked =
        CompletableFuture.runAsync(
            () -> {
              try {
                queue.enqueue(job("second"));
              } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                throw new IllegalStateException(e);
              }
            });

    assertThrows(TimeoutException.class, () -> blocked.get(300, TimeUnit.MILLISECONDS));
    assertEquals(0, queue.remainingCapacity());

    assertEquals("first", queue.dequeue().id());
    blocked.get(Duration.ofSeconds(5).toMillis(), TimeUnit.MILLISECONDS);
    assertEquals("second", queue.dequeue().id());
  }

  @Test
  @Timeout(5)
  void dequeueWaitsForWork() throws Exception {
    WorkQueue queue = new WorkQueue(2);
    CompletableFuture<RenderJob> taken =
        CompletableFuture.supplyAsync(
            () -> {
              try {
                return queue.dequeue();
              } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                throw new IllegalStateException(e);
              }
            });

    assertThrows(TimeoutException.class, () -> taken.get(200, TimeUnit.MILLISECONDS));
    queue.enqueue(job("late"));

    assertEquals("late", taken.get(2, TimeUnit.SECONDS).id());
  }
}
