package docbuild.jdbc.store;

import docbuild.jdbc.JdbcStores;
import docbuild.jdbc.TestDatabase;
import docbuild.jdbc.dialect.Dialects;
import docbuild.model.PriorityRule;
import docbuild.model.SandboxPolicy;
import docbuild.spi.DocBuildStores;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.sql.Connection;
import java.sql.SQLException;
import java.time.Duration;
import java.util.List;
import java.util.Optional;

import static org.junit.jupiter.api.Assertions.*;

class JdbcConfigStoresTest {
  private Connection conn;
  private DocBuildStores stores;

  @BeforeEach
  void setUp() throws Exception {
    conn = TestDatabase.h2().getConnection();
    conn.setAutoCommit(true);
    stores = JdbcStores.create(Dialects.get("h2"));
  }

  @AfterEach
  void tearDown() throws SQLException {
    conn.close();
  }

  @Test
  void serviceConfigUpsert() {
    assertEquals(Optional.empty(), stores.serviceConfig().get(conn, "queue_locked"));

    stores.serviceConfig().set(conn, "queue_locked", "true");
    stores.serviceConfig().set(conn, "queue_locked", "false");

    assertEquals(Optional.of("false"), stores.serviceConfig().get(conn, "queue_locked"));
  }

  @Test
  void blacklistUsesNormalizedNames() {
    assertTrue(stores.blacklist().add(conn, "Bad_Crate"));
    assertFalse(stores.blacklist().add(conn, "bad-crate"));

    assertTrue(stores.blacklist().contains(conn, "BAD-CRATE"));
    assertEquals(List.of("bad-crate"), stores.blacklist().list(conn));

    assertTrue(stores.blacklist().remove(conn, "bad_crate"));
    assertFalse(stores.blacklist().remove(conn, "bad_crate"));
    assertFalse(stores.blacklist().contains(conn, "bad-crate"));
  }

  @Test
  void priorityRulesKeepInsertionOrder() {
    PriorityRule first = stores.priorityRules().add(conn, "aws-sdk-%", 20);
    PriorityRule second = stores.priorityRules().add(conn, "windows-%", 10);

    assertEquals(List.of(first, second), stores.priorityRules().list(conn));
    assertEquals("aws-sdk-%", first.pattern());
    assertEquals(20, first.priority());

    assertEquals(1, stores.priorityRules().remove(conn, "aws-sdk-%"));
    assertEquals(List.of(second), stores.priorityRules().list(conn));
  }

  @Test
  void priorityRuleRejectsEmptyPattern() {
    assertThrows(IllegalArgumentException.class, () -> stores.priorityRules().add(conn, "", 5));
  }

  @Test
  void sandboxPolicySaveReplaces() {
    stores.sandboxPolicies().save(conn, new SandboxPolicy("Big_Crate", 8L << 30, Duration.ofMinutes(30), null));
    stores.sandboxPolicies().save(conn, new SandboxPolicy("big-crate", null, Duration.ofHours(1), 2));

    SandboxPolicy policy = stores.sandboxPolicies().find(conn, "BIG_CRATE").orElseThrow();
    assertEquals("big-crate", policy.packageName());
    assertNull(policy.memoryBytes());
    assertEquals(Duration.ofHours(1), policy.timeout());
    assertEquals(2, policy.maxTargets());
    assertEquals(1, stores.sandboxPolicies().list(conn).size());

    assertEquals(1, stores.sandboxPolicies().remove(conn, "big_crate"));
    assertTrue(stores.sandboxPolicies().find(conn, "big-crate").isEmpty());
  }
}
