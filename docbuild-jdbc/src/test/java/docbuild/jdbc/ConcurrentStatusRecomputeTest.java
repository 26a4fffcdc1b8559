package docbuild.jdbc;

import docbuild.jdbc.dialect.Dialects;
import docbuild.model.BuildStatus;
import docbuild.model.ReleaseStatus;
import docbuild.spi.DocBuildStores;
import docbuild.status.StatusAggregator;
import org.h2.jdbcx.JdbcDataSource;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.sql.Connection;
import java.sql.Statement;
import java.time.Instant;
import java.time.temporal.ChronoUnit;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Two transactions concluding different attempts of one release at the same
 * time, each on its own connection.
 */
class ConcurrentStatusRecomputeTest {
  private JdbcDataSource dataSource;
  private DocBuildStores stores;
  private StatusAggregator aggregator;
  private ExecutorService other;
  private long releaseId;
  private long first;
  private long second;

  @BeforeEach
  void setUp() throws Exception {
    dataSource = TestDatabase.h2();
    stores = JdbcStores.create(Dialects.get("h2"));
    aggregator = new StatusAggregator(stores);
    other = Executors.newSingleThreadExecutor();
    try (Connection conn = dataSource.getConnection()) {
      releaseId = stores.releases().ensureRelease(conn, "foo", "1.0.0");
      first = stores.builds().insertInProgress(conn, releaseId, "v1", "host-a", Instant.now());
      second = stores.builds().insertInProgress(conn, releaseId, "v1", "host-b", Instant.now());
      aggregator.recompute(conn, releaseId);
    }
  }

  @AfterEach
  void tearDown() {
    other.shutdownNow();
  }

  @Test
  void laterRecomputeSeesEarlierConclusion() throws Exception {
    Instant successAt = Instant.now().truncatedTo(ChronoUnit.MILLIS);
    Future<ReleaseStatus> failing;
    try (Connection conn = dataSource.getConnection()) {
      conn.setAutoCommit(false);
      assertEquals(1, stores.builds().finish(conn, first, BuildStatus.SUCCESS, "rustc 1.80.0", successAt, "ok"));
      assertEquals(BuildStatus.SUCCESS, aggregator.recompute(conn, releaseId).status());

      failing = other.submit(() -> {
        try (Connection conn2 = dataSource.getConnection()) {
          try (Statement stmt = conn2.createStatement()) {
            stmt.execute("SET LOCK_TIMEOUT 10000");
          }
          conn2.setAutoCommit(false);
          stores.builds().finish(conn2, second, BuildStatus.FAILURE, "rustc 1.80.0",
              successAt.minusSeconds(1), "error");
          ReleaseStatus status = aggregator.recompute(conn2, releaseId);
          conn2.commit();
          return status;
        }
      });
      Thread.sleep(300);
      assertFalse(failing.isDone(), "recompute waits for the release lock");
      conn.commit();
    }

    ReleaseStatus seenByLater = failing.get(10, TimeUnit.SECONDS);
    assertEquals(BuildStatus.SUCCESS, seenByLater.status());
    try (Connection conn = dataSource.getConnection()) {
      ReleaseStatus stored = stores.statuses().find(conn, releaseId).orElseThrow();
      assertEquals(BuildStatus.SUCCESS, stored.status());
      assertEquals(successAt, stored.lastBuildTime());
      assertEquals(StatusAggregator.aggregate(releaseId, stores.builds().listForRelease(conn, releaseId)), stored);
    }
  }
}
