package docbuild.jdbc;

import com.zaxxer.hikari.HikariConfig;
import com.zaxxer.hikari.HikariDataSource;
import docbuild.executor.SandboxExecutor;
import docbuild.model.BuildStatus;
import docbuild.model.Release;
import docbuild.queue.BuildQueue;
import docbuild.queue.RetryPolicy;
import docbuild.spi.DocBuildStores;
import docbuild.worker.BuildWorkerPool;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.sql.Connection;
import java.sql.SQLException;
import java.time.Duration;
import java.util.UUID;

import static org.junit.jupiter.api.Assertions.*;

class HikariCPIntegrationTest {
  private HikariDataSource hikariDs;
  private DataSourceConnectionProvider connectionProvider;
  private DocBuildStores stores;

  @BeforeEach
  void setup() throws Exception {
    HikariConfig config = new HikariConfig();
    config.setJdbcUrl("jdbc:h2:mem:hikari_" + UUID.randomUUID() + ";DB_CLOSE_DELAY=-1");
    config.setMaximumPoolSize(5);
    config.setMinimumIdle(1);
    config.setConnectionTimeout(250);
    config.setPoolName("docbuild-test-pool");

    hikariDs = new HikariDataSource(config);
    TestDatabase.applySchema(hikariDs, "/schema/h2.sql");
    connectionProvider = new DataSourceConnectionProvider(hikariDs);
    stores = JdbcStores.detect(hikariDs);
  }

  @AfterEach
  void tearDown() {
    if (hikariDs != null && !hikariDs.isClosed()) {
      hikariDs.close();
    }
  }

  @Test
  void workersReturnConnectionsToPool() throws Exception {
    ScriptedSandbox sandbox = new ScriptedSandbox();
    BuildQueue queue = new BuildQueue(connectionProvider, stores, RetryPolicy.IMMEDIATE, 5);
    SandboxExecutor executor = SandboxExecutor.builder()
        .connectionProvider(connectionProvider)
        .stores(stores)
        .sandbox(sandbox)
        .build();
    BuildWorkerPool workers = BuildWorkerPool.builder()
        .queue(queue)
        .executor(executor)
        .workerCount(1)
        .claimTimeout(Duration.ofMinutes(30))
        .build();

    for (int i = 0; i < 10; i++) {
      queue.enqueue("pooled-" + i, "1.0.0", 5, null);
    }
    for (int i = 0; i < 10; i++) {
      assertEquals(BuildWorkerPool.Step.SUCCEEDED, workers.processNext("w1"));
    }
    assertEquals(BuildWorkerPool.Step.IDLE, workers.processNext("w1"));

    assertEquals(0, hikariDs.getHikariPoolMXBean().getActiveConnections());
    try (Connection conn = hikariDs.getConnection()) {
      Release release = stores.releases().find(conn, "pooled-3", "1.0.0").orElseThrow();
      assertEquals(BuildStatus.SUCCESS, stores.statuses().find(conn, release.id()).orElseThrow().status());
    }
  }

  @Test
  void poolExhaustionSurfacesAsError() throws SQLException {
    Connection[] held = new Connection[5];
    for (int i = 0; i < held.length; i++) {
      held[i] = hikariDs.getConnection();
    }
    try {
      assertThrows(SQLException.class, () -> hikariDs.getConnection());
    } finally {
      for (Connection conn : held) {
        conn.close();
      }
    }
  }
}
