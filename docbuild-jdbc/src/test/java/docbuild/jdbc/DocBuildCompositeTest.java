package docbuild.jdbc;

import docbuild.DocBuild;
import docbuild.model.BuildStatus;
import docbuild.model.ReleaseStatus;
import docbuild.queue.RetryPolicy;
import docbuild.spi.DocBuildStores;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import javax.sql.DataSource;
import java.time.Duration;
import java.util.Optional;
import java.util.function.BooleanSupplier;

import static org.junit.jupiter.api.Assertions.*;

class DocBuildCompositeTest {
  private DataSource dataSource;
  private DataSourceConnectionProvider connectionProvider;
  private DocBuildStores stores;

  @BeforeEach
  void setup() throws Exception {
    dataSource = TestDatabase.h2();
    connectionProvider = new DataSourceConnectionProvider(dataSource);
    stores = JdbcStores.detect(connectionProvider.dataSource());
  }

  @Test
  void combinedInstanceBuildsNewReleases() throws Exception {
    FakeRegistryIndex index = new FakeRegistryIndex();
    RecordingMetrics metrics = new RecordingMetrics();
    try (DocBuild docBuild = DocBuild.combined()
        .connectionProvider(connectionProvider)
        .stores(stores)
        .index(index)
        .sandbox(new ScriptedSandbox())
        .retryPolicy(RetryPolicy.IMMEDIATE)
        .syncIntervalMs(100)
        .idleBackoffMs(20)
        .workerCount(2)
        .metrics(metrics)
        .build()) {

      awaitTrue(() -> checkpointPresent(docBuild), 5_000);

      index.publish("serde", "1.0.0");
      index.publish("tokio", "1.38.0");
      assertTrue(docBuild.notifyRegistryActivity());

      awaitTrue(() -> status(docBuild, "serde", "1.0.0").map(s -> s.status() == BuildStatus.SUCCESS).orElse(false),
          5_000);
      awaitTrue(() -> status(docBuild, "tokio", "1.38.0").map(s -> s.status() == BuildStatus.SUCCESS).orElse(false),
          5_000);
      awaitTrue(() -> docBuild.queries().queue().isEmpty(), 5_000);
      assertEquals(2, metrics.buildSuccess.get());
    }
  }

  @Test
  void watcherQueuesButNeverBuilds() throws Exception {
    FakeRegistryIndex index = new FakeRegistryIndex();
    try (DocBuild docBuild = DocBuild.watcher()
        .connectionProvider(connectionProvider)
        .stores(stores)
        .index(index)
        .syncIntervalMs(100)
        .build()) {

      awaitTrue(() -> checkpointPresent(docBuild), 5_000);
      index.publish("serde", "1.0.0");
      docBuild.notifyRegistryActivity();

      awaitTrue(() -> docBuild.queries().isQueued("serde", "1.0.0"), 5_000);
      assertTrue(docBuild.queries().builds("serde", "1.0.0").isEmpty());
    }
  }

  @Test
  void buildServerWithoutIndexRejectsSyncOperations() throws Exception {
    try (DocBuild docBuild = DocBuild.buildServer()
        .connectionProvider(connectionProvider)
        .stores(stores)
        .sandbox(new ScriptedSandbox())
        .workerCount(0)
        .build()) {

      assertFalse(docBuild.notifyRegistryActivity());
      assertThrows(IllegalStateException.class, docBuild::synchronizeNow);
      assertThrows(IllegalStateException.class, () -> docBuild.admin().resetCheckpointToHead());
      assertThrows(IllegalStateException.class, () -> docBuild.admin().checkConsistency(true));

      assertTrue(docBuild.admin().enqueue("serde", "1.0.0"));
      assertTrue(docBuild.queries().isQueued("serde", "1.0.0"));
      assertEquals(5, docBuild.queue().maxAttempts());
    }
  }

  @Test
  void builderCannotBeReused() {
    DocBuild.BuildServerBuilder builder = DocBuild.buildServer()
        .connectionProvider(connectionProvider)
        .stores(stores)
        .sandbox(new ScriptedSandbox())
        .workerCount(0);
    builder.build().close();

    assertThrows(IllegalStateException.class, builder::build);
  }

  @Test
  void missingRequiredComponentsAreRejected() {
    assertThrows(NullPointerException.class, () -> DocBuild.combined()
        .connectionProvider(connectionProvider)
        .stores(stores)
        .sandbox(new ScriptedSandbox())
        .build());
    assertThrows(NullPointerException.class, () -> DocBuild.buildServer()
        .stores(stores)
        .sandbox(new ScriptedSandbox())
        .build());
  }

  private static boolean checkpointPresent(DocBuild docBuild) {
    try {
      return docBuild.admin().checkpoint().isPresent();
    } catch (Exception e) {
      throw new AssertionError(e);
    }
  }

  private static Optional<ReleaseStatus> status(DocBuild docBuild, String name, String version) {
    return docBuild.queries().releaseStatus(name, version);
  }

  private static void awaitTrue(BooleanSupplier condition, long timeoutMs) throws InterruptedException {
    long deadline = System.nanoTime() + Duration.ofMillis(timeoutMs).toNanos();
    while (System.nanoTime() < deadline) {
      if (condition.getAsBoolean()) {
        return;
      }
      Thread.sleep(20);
    }
    fail("Condition not met within " + timeoutMs + "ms");
  }
}
