package docbuild.jdbc.store;

import docbuild.jdbc.JdbcStores;
import docbuild.jdbc.dialect.Dialects;
import docbuild.model.BuildStatus;
import docbuild.model.QueueEntry;
import docbuild.spi.DocBuildStores;
import org.h2.jdbcx.JdbcDataSource;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.io.IOException;
import java.io.InputStream;
import java.nio.charset.StandardCharsets;
import java.sql.Connection;
import java.sql.SQLException;
import java.sql.Statement;
import java.time.Duration;
import java.time.Instant;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.UUID;

import static org.junit.jupiter.api.Assertions.*;

class JdbcQueueStoreTest {
  private static final int MAX_ATTEMPTS = 3;

  private Connection conn;
  private DocBuildStores stores;

  @BeforeEach
  void setUp() throws Exception {
    JdbcDataSource dataSource = new JdbcDataSource();
    dataSource.setURL("jdbc:h2:mem:queue_" + UUID.randomUUID() + ";DB_CLOSE_DELAY=-1");
    conn = dataSource.getConnection();
    conn.setAutoCommit(true);
    try (Statement stmt = conn.createStatement()) {
      for (String sql : loadResource("/schema/h2.sql").split(";")) {
        if (!sql.isBlank()) {
          stmt.execute(sql.trim());
        }
      }
    }
    stores = JdbcStores.create(Dialects.get("h2"));
  }

  @AfterEach
  void tearDown() throws SQLException {
    conn.close();
  }

  private Optional<QueueEntry> claim(String owner) {
    Instant now = Instant.now();
    return stores.queue().claimNext(conn, owner, now, now.minus(Duration.ofMinutes(30)), MAX_ATTEMPTS);
  }

  @Test
  void enqueueIsFirstPriorityWins() {
    Instant now = Instant.now();
    assertTrue(stores.queue().enqueue(conn, "serde", "1.0.0", 0, null, now));
    assertFalse(stores.queue().enqueue(conn, "serde", "1.0.0", 20, "alt", now));

    QueueEntry entry = stores.queue().find(conn, "serde", "1.0.0").orElseThrow();
    assertEquals(0, entry.priority());
    assertEquals("alt", entry.registry());
    assertEquals(1, stores.queue().list(conn).size());
  }

  @Test
  void entriesAreKeyedByNormalizedName() {
    Instant now = Instant.now();
    assertTrue(stores.queue().enqueue(conn, "Foo_Bar", "1.0.0", 5, null, now));
    assertFalse(stores.queue().enqueue(conn, "foo-bar", "1.0.0", 5, null, now));

    assertTrue(stores.queue().isQueued(conn, "FOO-BAR", "1.0.0"));
    assertEquals("Foo_Bar", stores.queue().find(conn, "foo-bar", "1.0.0").orElseThrow().name());
  }

  @Test
  void claimsByPriorityThenInsertionOrder() {
    Instant now = Instant.now();
    stores.queue().enqueue(conn, "low", "1.0.0", 20, null, now);
    stores.queue().enqueue(conn, "first", "1.0.0", 5, null, now);
    stores.queue().enqueue(conn, "second", "1.0.0", 5, null, now);
    stores.queue().enqueue(conn, "urgent", "1.0.0", 0, null, now);

    assertEquals("urgent", claim("w1").orElseThrow().name());
    assertEquals("first", claim("w1").orElseThrow().name());
    assertEquals("second", claim("w1").orElseThrow().name());
    assertEquals("low", claim("w1").orElseThrow().name());
    assertTrue(claim("w1").isEmpty());
  }

  @Test
  void claimedEntryIsNotHandedOutTwice() {
    stores.queue().enqueue(conn, "foo", "1.0.0", 5, null, Instant.now());

    assertTrue(claim("w1").isPresent());
    assertTrue(claim("w2").isEmpty());
  }

  @Test
  void expiredClaimCanBeTakenOver() {
    stores.queue().enqueue(conn, "foo", "1.0.0", 5, null, Instant.now());
    assertTrue(claim("w1").isPresent());

    Instant later = Instant.now().plusSeconds(3600);
    Optional<QueueEntry> taken = stores.queue().claimNext(conn, "w2", later, later.minusSeconds(60), MAX_ATTEMPTS);

    assertTrue(taken.isPresent());
  }

  @Test
  void failureDefersEntryAndReleasesClaim() {
    stores.queue().enqueue(conn, "foo", "1.0.0", 5, null, Instant.now());
    QueueEntry entry = claim("w1").orElseThrow();
    Instant now = Instant.now();

    assertEquals(1, stores.queue().markFailed(conn, entry.id(), now, now.plusSeconds(600)));

    QueueEntry failed = stores.queue().find(conn, "foo", "1.0.0").orElseThrow();
    assertEquals(1, failed.attempts());
    assertNotNull(failed.lastAttempt());
    assertTrue(claim("w1").isEmpty(), "entry must wait for its retry time");

    Instant retryTime = now.plusSeconds(601);
    assertTrue(stores.queue()
        .claimNext(conn, "w1", retryTime, retryTime.minusSeconds(60), MAX_ATTEMPTS).isPresent());
  }

  @Test
  void exhaustedEntriesStayQueuedButAreNotClaimed() {
    stores.queue().enqueue(conn, "foo", "1.0.0", 5, null, Instant.now());
    stores.queue().enqueue(conn, "bar", "1.0.0", 5, null, Instant.now());
    long id = stores.queue().find(conn, "foo", "1.0.0").orElseThrow().id();
    for (int i = 0; i < MAX_ATTEMPTS; i++) {
      stores.queue().markFailed(conn, id, Instant.now(), Instant.now().minusSeconds(1));
    }

    assertEquals("bar", claim("w1").orElseThrow().name());
    assertTrue(claim("w1").isEmpty());
    assertTrue(stores.queue().isQueued(conn, "foo", "1.0.0"));
    assertEquals(Map.of(5, 1), stores.queue().pendingCountByPriority(conn, MAX_ATTEMPTS));

    assertEquals(1, stores.queue().resetAttempts(conn, "foo", "1.0.0"));
    assertEquals("foo", claim("w1").orElseThrow().name());
  }

  @Test
  void releaseClaimKeepsAttempts() {
    stores.queue().enqueue(conn, "foo", "1.0.0", 5, null, Instant.now());
    QueueEntry entry = claim("w1").orElseThrow();

    stores.queue().releaseClaim(conn, entry.id());

    QueueEntry again = claim("w2").orElseThrow();
    assertEquals(entry.id(), again.id());
    assertEquals(0, again.attempts());
  }

  @Test
  void succeededEntryIsDeleted() {
    stores.queue().enqueue(conn, "foo", "1.0.0", 5, null, Instant.now());
    QueueEntry entry = claim("w1").orElseThrow();

    assertEquals(1, stores.queue().markSucceeded(conn, entry.id()));
    assertFalse(stores.queue().isQueued(conn, "foo", "1.0.0"));
  }

  @Test
  void pendingCountsGroupByPriority() {
    Instant now = Instant.now();
    stores.queue().enqueue(conn, "a", "1", 0, null, now);
    stores.queue().enqueue(conn, "b", "1", 0, null, now);
    stores.queue().enqueue(conn, "c", "1", 20, null, now);

    Map<Integer, Integer> counts = stores.queue().pendingCountByPriority(conn, MAX_ATTEMPTS);

    assertEquals(List.of(0, 20), List.copyOf(counts.keySet()));
    assertEquals(2, counts.get(0));
    assertEquals(1, counts.get(20));
  }

  @Test
  void removeAndRemovePackage() {
    Instant now = Instant.now();
    stores.queue().enqueue(conn, "foo", "1.0.0", 5, null, now);
    stores.queue().enqueue(conn, "foo", "2.0.0", 5, null, now);
    stores.queue().enqueue(conn, "bar", "1.0.0", 5, null, now);

    assertEquals(1, stores.queue().remove(conn, "foo", "1.0.0"));
    assertEquals(1, stores.queue().removePackage(conn, "FOO"));
    assertEquals(List.of("bar"), stores.queue().list(conn).stream().map(QueueEntry::name).toList());
  }

  @Test
  void deprioritizeOnlyRaisesUrgentSiblings() {
    Instant now = Instant.now();
    stores.queue().enqueue(conn, "foo", "1.0.0", 0, null, now);
    stores.queue().enqueue(conn, "foo", "2.0.0", 0, null, now);
    stores.queue().enqueue(conn, "foo", "3.0.0", 20, null, now);

    assertEquals(1, stores.queue().deprioritizeOtherReleases(conn, "foo", "2.0.0", 1));

    assertEquals(1, stores.queue().find(conn, "foo", "1.0.0").orElseThrow().priority());
    assertEquals(0, stores.queue().find(conn, "foo", "2.0.0").orElseThrow().priority());
    assertEquals(20, stores.queue().find(conn, "foo", "3.0.0").orElseThrow().priority());
  }

  @Test
  void pruneRemovesEntriesSatisfiedByLaterSuccess() {
    Instant queuedAt = Instant.now().minusSeconds(60);
    stores.queue().enqueue(conn, "done", "1.0.0", 5, null, queuedAt);
    stores.queue().enqueue(conn, "stale", "1.0.0", 5, null, queuedAt);
    stores.queue().enqueue(conn, "failed", "1.0.0", 5, null, queuedAt);

    long done = stores.releases().ensureRelease(conn, "done", "1.0.0");
    long doneBuild = stores.builds().insertInProgress(conn, done, "v1", "srv", queuedAt.plusSeconds(1));
    stores.builds().finish(conn, doneBuild, BuildStatus.SUCCESS, "rustc", queuedAt.plusSeconds(5), "ok");

    long stale = stores.releases().ensureRelease(conn, "stale", "1.0.0");
    long staleBuild = stores.builds().insertInProgress(conn, stale, "v1", "srv", queuedAt.minusSeconds(30));
    stores.builds().finish(conn, staleBuild, BuildStatus.SUCCESS, "rustc", queuedAt.minusSeconds(10), "ok");

    long failed = stores.releases().ensureRelease(conn, "failed", "1.0.0");
    long failedBuild = stores.builds().insertInProgress(conn, failed, "v1", "srv", queuedAt.plusSeconds(1));
    stores.builds().finish(conn, failedBuild, BuildStatus.FAILURE, "rustc", queuedAt.plusSeconds(5), "err");

    assertEquals(1, stores.queue().pruneCompleted(conn));
    assertFalse(stores.queue().isQueued(conn, "done", "1.0.0"));
    assertTrue(stores.queue().isQueued(conn, "stale", "1.0.0"));
    assertTrue(stores.queue().isQueued(conn, "failed", "1.0.0"));
  }

  private static String loadResource(String path) throws IOException {
    try (InputStream is = JdbcQueueStoreTest.class.getResourceAsStream(path)) {
      if (is == null) throw new IOException("Resource not found: " + path);
      return new String(is.readAllBytes(), StandardCharsets.UTF_8);
    }
  }
}
