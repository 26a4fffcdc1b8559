package docbuild.jdbc;

import docbuild.model.BuildStatus;
import docbuild.model.QueueEntry;
import docbuild.model.ReleaseMetadata;
import docbuild.priority.Priorities;
import docbuild.registry.IndexChange;
import docbuild.registry.IndexSynchronizer;
import docbuild.registry.RegistryIndexException;
import docbuild.registry.SyncResult;
import docbuild.worker.BuildWorkerPool;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.sql.Connection;
import java.time.Instant;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class RegistrySyncScenarioTest {
  private DocBuildHarness h;

  @BeforeEach
  void setup() throws Exception {
    h = new DocBuildHarness();
  }

  @Test
  void firstSyncAdoptsHeadWithoutQueueing() throws Exception {
    h.index.publish("serde", "1.0.0");

    SyncResult result = h.sync();

    assertEquals(SyncResult.Outcome.BASELINED, result.outcome());
    assertTrue(result.checkpointAdvanced());
    assertEquals(h.index.headReference(), h.admin.checkpoint().orElseThrow().reference());
    assertTrue(h.queries.queue().isEmpty());
  }

  @Test
  void newReleaseIsQueuedAtTopPriorityAndBuilt() throws Exception {
    h.baseline();
    h.index.publish("P", "1.2.0");

    SyncResult result = h.sync();

    assertEquals(SyncResult.Outcome.COMPLETED, result.outcome());
    assertEquals(1, result.enqueued());
    assertTrue(result.checkpointAdvanced());
    QueueEntry entry = h.queries.queue().get(0);
    assertEquals(Priorities.NEW_RELEASE, entry.priority());
    assertEquals(0, entry.attempts());

    assertEquals(List.of(BuildWorkerPool.Step.SUCCEEDED), h.drain());

    assertEquals(BuildStatus.SUCCESS, h.queries.releaseStatus("P", "1.2.0").orElseThrow().status());
    assertTrue(h.release("P", "1.2.0").hasDocs());
    assertTrue(h.queries.queue().isEmpty());
    assertEquals(1, h.metrics.enqueued.get());
  }

  @Test
  void repeatedSyncQueuesNothingNew() throws Exception {
    h.baseline();
    String before = h.index.headReference();
    h.index.publish("tokio", "1.0.0");
    h.index.publish("tokio", "1.1.0");
    assertEquals(2, h.sync().enqueued());

    SyncResult again = h.sync();
    assertEquals(0, again.enqueued());
    assertFalse(again.checkpointAdvanced());

    h.admin.setCheckpoint(before);
    SyncResult replayed = h.sync();
    assertEquals(0, replayed.enqueued());
    assertEquals(2, replayed.alreadyQueued());
    assertEquals(2, h.queries.queue().size());
  }

  @Test
  void replayOfBuiltReleaseUsesPriorityRules() throws Exception {
    h.baseline();
    String before = h.index.headReference();
    h.index.publish("aws-sdk-s3", "1.0.0");
    h.sync();
    h.drain();
    h.admin.addPriorityRule("aws-sdk-%", 20);

    h.admin.setCheckpoint(before);
    h.index.publish("aws-sdk-ec2", "1.0.0");
    h.sync();

    assertEquals(20, h.queries.queue().stream()
        .filter(e -> e.name().equals("aws-sdk-s3")).findFirst().orElseThrow().priority());
    assertEquals(Priorities.NEW_RELEASE, h.queries.queue().stream()
        .filter(e -> e.name().equals("aws-sdk-ec2")).findFirst().orElseThrow().priority(),
        "unseen releases ignore matching rules");
  }

  @Test
  void yankChangesMetadataWithoutRebuilding() throws Exception {
    h.baseline();
    h.index.publish("foo", "1.0.0");
    h.index.publish("foo", "2.0.0");
    h.sync();
    h.drain();
    long v1 = h.release("foo", "1.0.0").id();
    long v2 = h.release("foo", "2.0.0").id();
    assertEquals(v2, latestReleaseId("foo"));

    h.index.commit(IndexChange.yanked("foo", "2.0.0"));
    SyncResult yank = h.sync();

    assertEquals(1, yank.yankUpdates());
    assertEquals(0, yank.enqueued());
    assertTrue(h.release("foo", "2.0.0").yanked());
    assertEquals(v1, latestReleaseId("foo"));
    assertTrue(h.queries.queue().isEmpty());
    assertEquals(1, h.queries.builds("foo", "2.0.0").size());

    h.index.commit(IndexChange.unyanked("foo", "2.0.0"));
    h.sync();
    assertFalse(h.release("foo", "2.0.0").yanked());
    assertEquals(v2, latestReleaseId("foo"));
  }

  @Test
  void yankedOnArrivalIsStillBuilt() throws Exception {
    h.baseline();
    h.index.commit(IndexChange.added("foo", "1.0.0", new ReleaseMetadata(true, true, null, List.of())));

    assertEquals(1, h.sync().enqueued());
    h.drain();

    assertTrue(h.release("foo", "1.0.0").yanked());
    assertEquals(BuildStatus.SUCCESS, h.queries.releaseStatus("foo", "1.0.0").orElseThrow().status());
  }

  @Test
  void deletionsRemoveReleasesAndQueueEntries() throws Exception {
    h.baseline();
    h.index.publish("foo", "1.0.0");
    h.index.publish("foo", "2.0.0");
    h.index.publish("bar", "1.0.0");
    h.sync();
    h.drain();
    long v1 = h.release("foo", "1.0.0").id();

    h.index.commit(IndexChange.versionDeleted("foo", "2.0.0"));
    assertEquals(1, h.sync().deletions());
    assertTrue(h.queries.release("foo", "2.0.0").isEmpty());
    assertEquals(v1, latestReleaseId("foo"));

    h.index.publish("bar", "1.1.0");
    h.index.commit(IndexChange.packageDeleted("Bar"));
    SyncResult result = h.sync();
    assertEquals(1, result.deletions());
    assertTrue(h.queries.release("bar", "1.0.0").isEmpty());
    assertFalse(h.queries.isQueued("bar", "1.1.0"));
  }

  @Test
  void blacklistedPackagesAreSkipped() throws Exception {
    h.baseline();
    h.admin.addToBlacklist("evil_crate");
    h.index.publish("evil-crate", "1.0.0");
    h.index.publish("good", "1.0.0");

    SyncResult result = h.sync();

    assertEquals(1, result.enqueued());
    assertEquals(1, result.blacklisted());
    assertEquals(1, h.metrics.blacklistSkipped.get());
    assertFalse(h.queries.isQueued("evil-crate", "1.0.0"));
    assertTrue(h.queries.release("evil-crate", "1.0.0").isEmpty());
  }

  @Test
  void resetToHeadSkipsPendingChanges() throws Exception {
    h.baseline();
    h.index.publish("skipped", "1.0.0");

    String head = h.admin.resetCheckpointToHead();

    assertEquals(h.index.headReference(), head);
    assertEquals(0, h.sync().enqueued());
    assertTrue(h.queries.queue().isEmpty());
  }

  @Test
  void offlineIndexLeavesCheckpointAndLockUntouched() throws Exception {
    h.baseline();
    String checkpoint = h.admin.checkpoint().orElseThrow().reference();
    h.index.publish("foo", "1.0.0");
    h.index.setOffline(true);

    assertThrows(RegistryIndexException.class, h::sync);
    assertEquals(checkpoint, h.admin.checkpoint().orElseThrow().reference());

    h.index.setOffline(false);
    SyncResult result = h.sync();
    assertEquals(SyncResult.Outcome.COMPLETED, result.outcome());
    assertEquals(1, result.enqueued());
  }

  @Test
  void concurrentInstanceIsSkippedWhileLockIsHeld() throws Exception {
    h.baseline();
    h.index.publish("foo", "1.0.0");
    IndexSynchronizer other = IndexSynchronizer.builder()
        .connectionProvider(h.connectionProvider)
        .stores(h.stores)
        .index(h.index)
        .ownerId("sync-other")
        .build();
    try (Connection conn = h.dataSource.getConnection()) {
      Instant now = Instant.now();
      assertTrue(h.stores.checkpoints().tryLock(conn, "registry", "sync-other", now, now.minusSeconds(600)));
    }

    assertEquals(SyncResult.Outcome.SKIPPED_LOCKED, h.sync().outcome());
    assertEquals(SyncResult.Outcome.COMPLETED, other.synchronize().outcome());
    assertEquals(SyncResult.Outcome.COMPLETED, h.sync().outcome(), "lock released after the other run");
  }

  private Long latestReleaseId(String name) throws Exception {
    try (Connection conn = h.dataSource.getConnection()) {
      return h.stores.releases().findPackage(conn, name).orElseThrow().latestReleaseId();
    }
  }
}
