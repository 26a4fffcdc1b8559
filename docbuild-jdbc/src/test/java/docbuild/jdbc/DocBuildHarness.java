package docbuild.jdbc;

import docbuild.admin.BuildAdmin;
import docbuild.admin.BuildQueries;
import docbuild.executor.SandboxExecutor;
import docbuild.jdbc.dialect.Dialects;
import docbuild.model.Release;
import docbuild.queue.BuildQueue;
import docbuild.queue.RetryPolicy;
import docbuild.registry.IndexSynchronizer;
import docbuild.registry.SyncResult;
import docbuild.spi.DocBuildStores;
import docbuild.worker.BuildWorkerPool;

import javax.sql.DataSource;
import java.sql.SQLException;
import java.time.Duration;
import java.util.ArrayList;
import java.util.List;

/**
 * Wires every component against one in-memory database without starting
 * any background thread. Tests drive the cycles directly.
 */
final class DocBuildHarness {
  static final int MAX_ATTEMPTS = 3;
  static final String WORKER = "worker-1";

  final DataSource dataSource;
  final DataSourceConnectionProvider connectionProvider;
  final DocBuildStores stores;
  final FakeRegistryIndex index = new FakeRegistryIndex();
  final ScriptedSandbox sandbox = new ScriptedSandbox();
  final RecordingMetrics metrics = new RecordingMetrics();
  final BuildQueue queue;
  final IndexSynchronizer synchronizer;
  final SandboxExecutor executor;
  final BuildWorkerPool workers;
  final BuildAdmin admin;
  final BuildQueries queries;

  DocBuildHarness() throws Exception {
    dataSource = TestDatabase.h2();
    connectionProvider = new DataSourceConnectionProvider(dataSource);
    stores = JdbcStores.create(Dialects.get("h2"));
    queue = new BuildQueue(connectionProvider, stores, RetryPolicy.IMMEDIATE, MAX_ATTEMPTS);
    synchronizer = IndexSynchronizer.builder()
        .connectionProvider(connectionProvider)
        .stores(stores)
        .index(index)
        .ownerId("sync-test")
        .metrics(metrics)
        .build();
    executor = SandboxExecutor.builder()
        .connectionProvider(connectionProvider)
        .stores(stores)
        .sandbox(sandbox)
        .builderVersion("docbuild-test")
        .buildServer("test-host")
        .metrics(metrics)
        .build();
    workers = BuildWorkerPool.builder()
        .queue(queue)
        .executor(executor)
        .workerCount(1)
        .claimTimeout(Duration.ofMinutes(30))
        .metrics(metrics)
        .build();
    admin = new BuildAdmin(connectionProvider, stores, queue, index, "registry", null);
    queries = new BuildQueries(connectionProvider, stores, MAX_ATTEMPTS);
  }

  /** Establishes the checkpoint at the current index head. */
  SyncResult baseline() throws SQLException {
    return synchronizer.synchronize();
  }

  SyncResult sync() throws SQLException {
    return synchronizer.synchronize();
  }

  BuildWorkerPool.Step step() throws SQLException {
    return workers.processNext(WORKER);
  }

  /** Processes entries until the queue yields nothing, returning each step taken. */
  List<BuildWorkerPool.Step> drain() throws SQLException {
    List<BuildWorkerPool.Step> steps = new ArrayList<>();
    for (int i = 0; i < 100; i++) {
      BuildWorkerPool.Step step = step();
      if (step == BuildWorkerPool.Step.IDLE || step == BuildWorkerPool.Step.PAUSED) {
        return steps;
      }
      steps.add(step);
    }
    throw new IllegalStateException("queue did not drain: " + steps);
  }

  Release release(String name, String version) {
    return queries.release(name, version)
        .orElseThrow(() -> new AssertionError("no release " + name + " " + version));
  }
}
