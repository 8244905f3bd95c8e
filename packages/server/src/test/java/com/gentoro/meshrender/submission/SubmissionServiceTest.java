package com.gentoro.meshrender.submission;

import static org.junit.jupiter.api.Assertions.*;

import com.gentoro.meshrender.cache.DedupCache;
import com.gentoro.meshrender.cache.JsonFileCacheStore;
import com.gentoro.meshrender.exception.IoException;
import com.gentoro.meshrender.fingerprint.ContentFingerprint;
import com.gentoro.meshrender.fingerprint.Fingerprint;
import com.gentoro.meshrender.notify.JobActivator.Activation;
import com.gentoro.meshrender.queue.RenderJob;
import com.gentoro.meshrender.queue.WorkQueue;
import com.gentoro.meshrender.storage.StorageLayout;
import java.io.ByteArrayInputStream;
import java.io.IOException;
import java.io.InputStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.time.ZoneId;
import java.time.ZoneOffset;
import java.util.stream.Stream;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

class SubmissionServiceTest {
  private static final byte[] MESH = "solid a\nendsolid a\n".getBytes();
  private static final byte[] OTHER_MESH = "solid b\nendsolid b\n".getBytes();

  @TempDir Path dir;

  private StorageLayout storage;
  private DedupCache cache;
  private WorkQueue queue;
  private MutableClock clock;
  private SubmissionService service;

  @BeforeEach
  void setUp() {
    storage = new StorageLayout(dir.resolve("uploads"), dir.resolve("output"));
    storage.ensureDirectories();
    cache = new DedupCache(new JsonFileCacheStore(dir.resolve("file_hashes.json")));
    cache.loadFromDurableStore();
    queue = new WorkQueue(10);
    clock = new MutableClock(Instant.parse("2024-01-01T00:00:00Z"));
    service = new SubmissionService(cache, queue, storage, Duration.ofSeconds(600), clock);
  }

  @AfterEach
  void tearDown() {
    service.close();
  }

  private SubmissionResult submit(byte[] content) {
    return service.submit(new ByteArrayInputStream(content));
  }

  private long uploadFiles() throws IOException {
    try (Stream<Path> files = Files.list(storage.uploadsDir())) {
      return files.count();
    }
  }

  @Test
  void newContentIsStagedButNotQueued() throws Exception {
    SubmissionResult result = submit(MESH);

    Fingerprint fp = ContentFingerprint.derive(MESH);
    assertFalse(result.isCached());
    assertNotNull(result.jobId());
    assertEquals(fp, result.fingerprint());
    assertEquals("/output/output-" + fp.hex() + ".png", result.outputLink());
    assertEquals(1, service.stagedCount());
    assertEquals(0, queue.size());

    RenderJob job = service.stagedJob(result.jobId()).orElseThrow();
    assertEquals(storage.inputPathFor(fp), job.inputPath());
    assertArrayEquals(MESH, Files.readAllBytes(job.inputPath()));
    assertEquals(1, uploadFiles());
  }

  @Test
  void cacheHitCreatesNoJob() throws Exception {
    Fingerprint fp = ContentFingerprint.derive(MESH);
    Files.write(storage.resolveOutput(storage.outputNameFor(fp)), new byte[] {1});
    cache.record(fp, storage.outputNameFor(fp));

    SubmissionResult result = submit(MESH);

    assertTrue(result.isCached());
    assertNull(result.jobId());
    assertEquals("/output/" + storage.outputNameFor(fp), result.outputLink());
    assertEquals(0, service.stagedCount());
    assertEquals(0, queue.size());
    assertEquals(0, uploadFiles());
  }

  @Test
  void cacheEntryWithMissingOutputIsRenderedAgain() {
    Fingerprint fp = ContentFingerprint.derive(MESH);
    cache.record(fp, storage.outputNameFor(fp));

    SubmissionResult result = submit(MESH);

    assertFalse(result.isCached());
    assertEquals(1, service.stagedCount());
  }

  @Test
  void cacheEntryOutsideOutputDirectoryIsRenderedAgain() throws Exception {
    Fingerprint fp = ContentFingerprint.derive(MESH);
    Files.writeString(dir.resolve("elsewhere.png"), "x");
    cache.record(fp, "../elsewhere.png");

    SubmissionResult result = submit(MESH);

    assertFalse(result.isCached());
    assertEquals(1, service.stagedCount());
  }

  @Test
  void identicalUploadsBeforeCompletionEachGetAJob() {
    SubmissionResult first = submit(MESH);
    SubmissionResult second = submit(MESH);

    assertNotEquals(first.jobId(), second.jobId());
    assertEquals(2, service.stagedCount());
  }

  @Test
  void activationMovesJobOntoTheQueueOnce() throws Exception {
    String jobId = submit(MESH).jobId();

    assertEquals(Activation.ENQUEUED, service.activate(jobId));
    assertEquals(1, queue.size());
    assertEquals(0, service.stagedCount());
    assertEquals(1, service.inFlightCount());

    assertEquals(Activation.IN_FLIGHT, service.activate(jobId));
    assertEquals(1, queue.size());

    assertEquals(Activation.UNKNOWN, service.activate("no-such-job"));
  }

  @Test
  void failedJobIsForgottenAndResubmissionStartsOver() throws Exception {
    String jobId = submit(MESH).jobId();
    service.activate(jobId);
    RenderJob job = queue.dequeue();

    service.onFinished(job, false);

    assertEquals(0, service.inFlightCount());
    assertFalse(Files.exists(job.inputPath()));
    assertEquals(Activation.UNKNOWN, service.activate(jobId));

    SubmissionResult again = submit(MESH);
    assertFalse(again.isCached());
    assertNotEquals(jobId, again.jobId());
    assertTrue(Files.exists(job.inputPath()));
  }

  @Test
  void failureKeepsInputSharedWithAnotherJob() throws Exception {
    String first = submit(MESH).jobId();
    submit(MESH);
    service.activate(first);
    RenderJob job = queue.dequeue();

    service.onFinished(job, false);

    assertTrue(Files.exists(job.inputPath()));
  }

  @Test
  void successfulJobLeavesTracking() throws Exception {
    String jobId = submit(MESH).jobId();
    service.activate(jobId);

    service.onFinished(queue.dequeue(), true);

    assertEquals(0, service.inFlightCount());
    assertEquals(Activation.UNKNOWN, service.activate(jobId));
  }

  @Test
  void unclaimedJobsExpire() throws Exception {
    String stale = submit(MESH).jobId();
    clock.advance(Duration.ofSeconds(400));
    String fresh = submit(OTHER_MESH).jobId();
    clock.advance(Duration.ofSeconds(200));

    assertEquals(1, service.sweepExpired());

    assertEquals(Activation.UNKNOWN, service.activate(stale));
    assertFalse(Files.exists(storage.inputPathFor(ContentFingerprint.derive(MESH))));
    assertEquals(Activation.ENQUEUED, service.activate(fresh));
  }

  @Test
  void expiryKeepsInputStillStagedByANewerJob() throws Exception {
    submit(MESH);
    clock.advance(Duration.ofSeconds(400));
    String newer = submit(MESH).jobId();
    clock.advance(Duration.ofSeconds(300));

    assertEquals(1, service.sweepExpired());

    assertTrue(Files.exists(storage.inputPathFor(ContentFingerprint.derive(MESH))));
    assertTrue(service.stagedJob(newer).isPresent());
  }

  @Test
  void unreadableUploadStagesNothing() throws Exception {
    InputStream broken =
        new InputStream() {
          @Override
          public int read() throws IOException {
            throw new IOException("client went away");
          }
        };

    assertThrows(IoException.class, () -> service.submit(broken));

    assertEquals(0, service.stagedCount());
    assertEquals(0, uploadFiles());
  }

  static final class MutableClock extends Clock {
    private Instant now;

    MutableClock(Instant start) {
      this.now = start;
    }

    void advance(Duration d) {
      now = now.plus(d);
    }

    @Override
    public ZoneId getZone() {
      return ZoneOffset.UTC;
    }

    @Override
    public Clock withZone(ZoneId zone) {
      return this;
    }

    @Override
    public Instant instant() {
      return now;
    }
  }
}
