package docbuild.jdbc;

import docbuild.jdbc.ScriptedSandbox.Outcome;
import docbuild.model.BuildAttempt;
import docbuild.model.BuildStatus;
import docbuild.model.QueueEntry;
import docbuild.model.Release;
import docbuild.model.SandboxPolicy;
import docbuild.worker.BuildWorkerPool.Step;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.sql.Connection;
import java.time.Instant;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class BuildExecutionScenarioTest {
  private DocBuildHarness h;

  @BeforeEach
  void setup() throws Exception {
    h = new DocBuildHarness();
  }

  @Test
  void flakyBuildSucceedsOnRetry() throws Exception {
    h.admin.enqueue("flaky", "0.3.1");
    h.sandbox.script("flaky", "0.3.1", Outcome.FAILURE, Outcome.SUCCESS);

    assertEquals(List.of(Step.FAILED, Step.SUCCEEDED), h.drain());

    List<BuildAttempt> attempts = h.queries.builds("flaky", "0.3.1");
    assertEquals(List.of(BuildStatus.FAILURE, BuildStatus.SUCCESS),
        attempts.stream().map(BuildAttempt::status).toList());
    assertEquals(BuildStatus.SUCCESS, h.queries.releaseStatus("flaky", "0.3.1").orElseThrow().status());
    assertEquals(attempts.get(1).finishedAt(),
        h.queries.releaseStatus("flaky", "0.3.1").orElseThrow().lastBuildTime());
    assertTrue(h.queries.queue().isEmpty());
    assertEquals(1, h.metrics.buildFailure.get());
    assertEquals(1, h.metrics.buildSuccess.get());
  }

  @Test
  void timeoutRecordsFailureWithLog() throws Exception {
    h.admin.enqueue("slow", "1.0.0");
    h.sandbox.script("slow", "1.0.0", Outcome.TIMEOUT);

    assertEquals(Step.FAILED, h.step());

    BuildAttempt attempt = h.queries.builds("slow", "1.0.0").get(0);
    assertEquals(BuildStatus.FAILURE, attempt.status());
    assertNotNull(attempt.finishedAt());
    assertTrue(attempt.output().contains("exceeded the time limit"), attempt.output());
    assertEquals(BuildStatus.FAILURE, h.queries.releaseStatus("slow", "1.0.0").orElseThrow().status());
    assertEquals(1, h.metrics.buildTimeout.get());
    assertEquals(1, h.sandbox.cleanups());

    QueueEntry entry = h.queries.queue().get(0);
    assertEquals(1, entry.attempts());
    assertNotNull(entry.lastAttempt());
  }

  @Test
  void memoryLimitStopsRemainingTargets() throws Exception {
    h.sandbox.extraTargets(List.of("i686-pc-windows-msvc"));
    h.admin.enqueue("hungry", "1.0.0");
    h.sandbox.script("hungry", "1.0.0", Outcome.OUT_OF_MEMORY);

    assertEquals(Step.FAILED, h.step());

    BuildAttempt attempt = h.queries.builds("hungry", "1.0.0").get(0);
    assertEquals(BuildStatus.FAILURE, attempt.status());
    assertTrue(attempt.output().contains("memory limit"), attempt.output());
    assertEquals(List.of("hungry@1.0.0:" + ScriptedSandbox.DEFAULT_TARGET), h.sandbox.builtTargets());
  }

  @Test
  void retryCeilingStopsDequeuingUntilReset() throws Exception {
    h.admin.enqueue("broken", "1.0.0");
    h.sandbox.script("broken", "1.0.0", Outcome.FAILURE, Outcome.FAILURE, Outcome.FAILURE);

    assertEquals(List.of(Step.FAILED, Step.FAILED, Step.EXHAUSTED), h.drain());

    QueueEntry entry = h.queries.queue().get(0);
    assertEquals(DocBuildHarness.MAX_ATTEMPTS, entry.attempts());
    assertTrue(h.queries.pendingCountByPriority().isEmpty());
    assertEquals(1, h.metrics.exhausted.get());
    assertEquals(3, h.queries.builds("broken", "1.0.0").size());

    assertTrue(h.admin.resetAttempts("broken", "1.0.0"));
    assertEquals(List.of(Step.SUCCEEDED), h.drain());
    assertEquals(BuildStatus.SUCCESS, h.queries.releaseStatus("broken", "1.0.0").orElseThrow().status());
  }

  @Test
  void pausedQueueKeepsEntries() throws Exception {
    h.admin.enqueue("foo", "1.0.0");
    h.admin.pauseQueue();

    assertTrue(h.admin.isQueuePaused());
    assertEquals(Step.PAUSED, h.step());
    assertTrue(h.queries.isQueued("foo", "1.0.0"));
    assertTrue(h.queries.builds("foo", "1.0.0").isEmpty());

    h.admin.resumeQueue();
    assertEquals(Step.SUCCEEDED, h.step());
  }

  @Test
  void unavailableSandboxDoesNotConsumeAttempt() throws Exception {
    h.admin.enqueue("foo", "1.0.0");
    h.sandbox.script("foo", "1.0.0", Outcome.UNAVAILABLE);

    assertEquals(Step.RELEASED, h.step());

    QueueEntry entry = h.queries.queue().get(0);
    assertEquals(0, entry.attempts());
    assertTrue(h.queries.builds("foo", "1.0.0").isEmpty());

    assertEquals(Step.SUCCEEDED, h.step());
  }

  @Test
  void sandboxLostMidBuildConcludesAttemptButKeepsQueueAttempt() throws Exception {
    h.admin.enqueue("foo", "1.0.0");
    h.sandbox.script("foo", "1.0.0", Outcome.LOST_MID_BUILD);

    assertEquals(Step.RELEASED, h.step());

    QueueEntry entry = h.queries.queue().get(0);
    assertEquals(0, entry.attempts());
    BuildAttempt lost = h.queries.builds("foo", "1.0.0").get(0);
    assertEquals(BuildStatus.FAILURE, lost.status());
    assertNotNull(lost.finishedAt());
    assertTrue(lost.output().contains("sandbox unavailable"), lost.output());
    assertEquals(1, h.sandbox.cleanups());
    assertEquals(1, h.metrics.buildFailure.get());

    assertEquals(Step.SUCCEEDED, h.step());
    assertEquals(2, h.queries.builds("foo", "1.0.0").size());
    assertEquals(BuildStatus.SUCCESS, h.queries.releaseStatus("foo", "1.0.0").orElseThrow().status());
  }

  @Test
  void attemptConcludedDuringBuildKeepsStoredResult() throws Exception {
    h.admin.enqueue("foo", "1.0.0");
    h.sandbox.duringBuild(request -> {
      long buildId = h.queries.builds(request.name(), request.version()).get(0).id();
      try (Connection conn = h.dataSource.getConnection()) {
        assertEquals(1, h.stores.builds().finish(conn, buildId, BuildStatus.FAILURE, null, Instant.now(),
            "concluded by another server"));
      }
    });

    assertEquals(Step.FAILED, h.step());

    BuildAttempt attempt = h.queries.builds("foo", "1.0.0").get(0);
    assertEquals(BuildStatus.FAILURE, attempt.status());
    assertEquals("concluded by another server", attempt.output());
    assertFalse(h.release("foo", "1.0.0").hasDocs());
    assertEquals(BuildStatus.FAILURE, h.queries.releaseStatus("foo", "1.0.0").orElseThrow().status());
    assertEquals(1, h.queries.queue().get(0).attempts());
    assertEquals(0, h.metrics.buildSuccess.get());
    assertEquals(1, h.metrics.buildFailure.get());
  }

  @Test
  void libraryWithoutDocsFails() throws Exception {
    h.admin.enqueue("nodocs", "1.0.0");
    h.sandbox.script("nodocs", "1.0.0", Outcome.NO_DOCS);

    assertEquals(Step.FAILED, h.step());

    Release release = h.release("nodocs", "1.0.0");
    assertFalse(release.hasDocs());
    assertEquals(BuildStatus.FAILURE, h.queries.releaseStatus("nodocs", "1.0.0").orElseThrow().status());
  }

  @Test
  void binaryWithoutDocsSucceeds() throws Exception {
    h.sandbox.library(false);
    h.admin.enqueue("cli-tool", "1.0.0");
    h.sandbox.script("cli-tool", "1.0.0", Outcome.NO_DOCS);

    assertEquals(Step.SUCCEEDED, h.step());

    Release release = h.release("cli-tool", "1.0.0");
    assertEquals(Boolean.FALSE, release.library());
    assertFalse(release.hasDocs());
  }

  @Test
  void successRecordsBuildOutputs() throws Exception {
    h.sandbox.extraTargets(List.of("i686-pc-windows-msvc", "aarch64-apple-darwin"));
    h.sandbox.toolchainVersion("rustc 1.81.0-nightly");
    h.admin.enqueue("multi", "1.0.0");

    assertEquals(Step.SUCCEEDED, h.step());

    Release release = h.release("multi", "1.0.0");
    assertEquals(ScriptedSandbox.DEFAULT_TARGET, release.defaultTarget());
    assertEquals(List.of(ScriptedSandbox.DEFAULT_TARGET, "i686-pc-windows-msvc", "aarch64-apple-darwin"),
        release.docTargets());
    assertEquals(80, release.documentedItems());
    assertEquals(100, release.totalItems());

    BuildAttempt attempt = h.queries.builds("multi", "1.0.0").get(0);
    assertEquals("rustc 1.81.0-nightly", attempt.toolchainVersion());
    assertEquals("docbuild-test", attempt.builderVersion());
    assertEquals("test-host", attempt.buildServer());
  }

  @Test
  void sandboxPolicyCapsTargets() throws Exception {
    h.sandbox.extraTargets(List.of("a-target", "b-target", "c-target"));
    h.admin.setSandboxPolicy(new SandboxPolicy("Big_Crate", null, null, 2));
    h.admin.enqueue("big-crate", "1.0.0");
    h.admin.enqueue("small", "1.0.0");

    h.drain();

    List<String> built = h.sandbox.builtTargets();
    assertEquals(2, built.stream().filter(t -> t.startsWith("big-crate@")).count());
    assertEquals(4, built.stream().filter(t -> t.startsWith("small@")).count());
    assertTrue(h.queries.builds("big-crate", "1.0.0").get(0).output().contains("target limit 2 reached"));
    assertEquals(1, h.admin.sandboxPolicies().size());
  }

  @Test
  void queueDepthIsReported() throws Exception {
    h.admin.enqueue("a", "1.0.0");
    h.admin.enqueue("b", "1.0.0");

    h.step();
    assertEquals(1, h.metrics.lastQueueDepth.get());
    h.step();
    assertEquals(0, h.metrics.lastQueueDepth.get());
  }
}
