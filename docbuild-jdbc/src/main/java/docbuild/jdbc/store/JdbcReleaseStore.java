package docbuild.jdbc.store;

import docbuild.jdbc.JdbcTemplate;
import docbuild.jdbc.spi.Dialect;
import docbuild.model.BuildOutputs;
import docbuild.model.BuildStatus;
import docbuild.model.PackageInfo;
import docbuild.model.PackageNames;
import docbuild.model.Release;
import docbuild.model.ReleaseMetadata;
import docbuild.spi.ReleaseStore;

import java.sql.Connection;
import java.time.Instant;
import java.util.Arrays;
import java.util.List;
import java.util.Objects;
import java.util.Optional;

/**
 * JDBC store for the {@code packages} and {@code releases} tables.
 *
 * <p>Target lists are stored as comma-separated text.
 */
public final class JdbcReleaseStore implements ReleaseStore {
  private static final String RELEASE_COLUMNS =
      "r.id, r.package_id, p.name, r.version, r.yanked, r.library, r.dependencies, r.targets, "
          + "r.default_target, r.doc_targets, r.has_docs, r.documented_items, r.total_items";
  private static final String RELEASE_FROM =
      " FROM releases r JOIN packages p ON p.id = r.package_id";

  private static final JdbcTemplate.RowMapper<Release> RELEASE_ROW_MAPPER = rs -> new Release(
      rs.getLong("id"),
      rs.getLong("package_id"),
      rs.getString("name"),
      rs.getString("version"),
      rs.getBoolean("yanked"),
      JdbcTemplate.nullableBoolean(rs, "library"),
      rs.getString("dependencies"),
      splitList(rs.getString("targets")),
      rs.getString("default_target"),
      splitList(rs.getString("doc_targets")),
      rs.getBoolean("has_docs"),
      JdbcTemplate.nullableInt(rs, "documented_items"),
      JdbcTemplate.nullableInt(rs, "total_items"));

  private static final JdbcTemplate.RowMapper<PackageInfo> PACKAGE_ROW_MAPPER = rs -> new PackageInfo(
      rs.getLong("id"),
      rs.getString("name"),
      rs.getString("normalized_name"),
      JdbcTemplate.nullableLong(rs, "latest_release_id"),
      rs.getLong("downloads"));

  private final Dialect dialect;

  public JdbcReleaseStore(Dialect dialect) {
    this.dialect = Objects.requireNonNull(dialect, "dialect");
  }

  @Override
  public long ensureRelease(Connection conn, String name, String version) {
    Objects.requireNonNull(version, "version");
    String normalized = PackageNames.normalize(name);
    Instant now = Instant.now();
    dialect.insertIfAbsent(conn, "packages",
        List.of("name", "normalized_name", "downloads", "created_at"),
        List.of("normalized_name"),
        name.trim(), normalized, 0L, now);
    long packageId = packageId(conn, normalized)
        .orElseThrow(() -> new IllegalStateException("Package row missing after insert: " + normalized));
    dialect.insertIfAbsent(conn, "releases",
        List.of("package_id", "version", "yanked", "has_docs", "created_at"),
        List.of("package_id", "version"),
        packageId, version, false, false, now);
    return JdbcTemplate.queryOne(conn,
            "SELECT id FROM releases WHERE package_id=? AND version=?",
            rs -> rs.getLong("id"), packageId, version)
        .orElseThrow(() -> new IllegalStateException("Release row missing after insert: " + name + " " + version));
  }

  @Override
  public Optional<Release> find(Connection conn, String name, String version) {
    return JdbcTemplate.queryOne(conn,
        "SELECT " + RELEASE_COLUMNS + RELEASE_FROM + " WHERE p.normalized_name=? AND r.version=?",
        RELEASE_ROW_MAPPER, PackageNames.normalize(name), version);
  }

  @Override
  public Optional<Release> findById(Connection conn, long releaseId) {
    return JdbcTemplate.queryOne(conn,
        "SELECT " + RELEASE_COLUMNS + RELEASE_FROM + " WHERE r.id=?",
        RELEASE_ROW_MAPPER, releaseId);
  }

  @Override
  public boolean lockRelease(Connection conn, long releaseId) {
    return JdbcTemplate.queryOne(conn, "SELECT id FROM releases WHERE id=? FOR UPDATE",
        rs -> rs.getLong("id"), releaseId).isPresent();
  }

  @Override
  public Optional<PackageInfo> findPackage(Connection conn, String name) {
    return JdbcTemplate.queryOne(conn,
        "SELECT id, name, normalized_name, latest_release_id, downloads FROM packages WHERE normalized_name=?",
        PACKAGE_ROW_MAPPER, PackageNames.normalize(name));
  }

  @Override
  public void updateMetadata(Connection conn, long releaseId, ReleaseMetadata metadata) {
    String sql = "UPDATE releases SET yanked=?, library=COALESCE(?, library), "
        + "dependencies=COALESCE(?, dependencies), targets=COALESCE(?, targets) WHERE id=?";
    JdbcTemplate.update(conn, sql,
        metadata.yanked(), metadata.library(), metadata.dependencies(), joinList(metadata.targets()), releaseId);
  }

  @Override
  public int setYanked(Connection conn, String name, String version, boolean yanked) {
    String sql = "UPDATE releases SET yanked=? WHERE version=? AND package_id = "
        + "(SELECT id FROM packages WHERE normalized_name=?)";
    return JdbcTemplate.update(conn, sql, yanked, version, PackageNames.normalize(name));
  }

  @Override
  public void recordBuildOutputs(Connection conn, long releaseId, BuildOutputs outputs) {
    String sql = "UPDATE releases SET library=?, default_target=?, doc_targets=?, has_docs=?, "
        + "documented_items=?, total_items=? WHERE id=?";
    JdbcTemplate.update(conn, sql,
        outputs.library(), outputs.defaultTarget(), joinList(outputs.docTargets()), outputs.hasDocs(),
        outputs.documentedItems(), outputs.totalItems(), releaseId);
  }

  @Override
  public void refreshLatestRelease(Connection conn, String name) {
    String normalized = PackageNames.normalize(name);
    Optional<Long> packageId = packageId(conn, normalized);
    if (packageId.isEmpty()) {
      return;
    }
    Long latest = JdbcTemplate.queryOne(conn,
            "SELECT id FROM releases WHERE package_id=? AND yanked=? ORDER BY id DESC LIMIT 1",
            rs -> rs.getLong("id"), packageId.get(), false)
        .orElse(null);
    JdbcTemplate.update(conn, "UPDATE packages SET latest_release_id=? WHERE id=?", latest, packageId.get());
  }

  @Override
  public int deleteRelease(Connection conn, String name, String version) {
    String normalized = PackageNames.normalize(name);
    Optional<Long> releaseId = JdbcTemplate.queryOne(conn,
        "SELECT r.id" + RELEASE_FROM + " WHERE p.normalized_name=? AND r.version=?",
        rs -> rs.getLong("id"), normalized, version);
    if (releaseId.isEmpty()) {
      return 0;
    }
    long id = releaseId.get();
    JdbcTemplate.update(conn, "UPDATE packages SET latest_release_id=NULL WHERE latest_release_id=?", id);
    deleteReleaseRows(conn, id);
    return 1;
  }

  @Override
  public int deletePackage(Connection conn, String name) {
    String normalized = PackageNames.normalize(name);
    Optional<Long> packageId = packageId(conn, normalized);
    if (packageId.isEmpty()) {
      return 0;
    }
    JdbcTemplate.update(conn, "UPDATE packages SET latest_release_id=NULL WHERE id=?", packageId.get());
    List<Long> releaseIds = JdbcTemplate.query(conn,
        "SELECT id FROM releases WHERE package_id=?", rs -> rs.getLong("id"), packageId.get());
    for (long releaseId : releaseIds) {
      deleteReleaseRows(conn, releaseId);
    }
    return JdbcTemplate.update(conn, "DELETE FROM packages WHERE id=?", packageId.get());
  }

  @Override
  public List<Release> listAll(Connection conn) {
    return JdbcTemplate.query(conn,
        "SELECT " + RELEASE_COLUMNS + RELEASE_FROM + " ORDER BY p.normalized_name, r.id",
        RELEASE_ROW_MAPPER);
  }

  @Override
  public List<Long> listReleaseIds(Connection conn) {
    return JdbcTemplate.query(conn, "SELECT id FROM releases ORDER BY id", rs -> rs.getLong("id"));
  }

  @Override
  public List<Release> latestDocumentedReleases(Connection conn, int limit) {
    if (limit <= 0) {
      return List.of();
    }
    String sql = "SELECT " + RELEASE_COLUMNS + RELEASE_FROM
        + " JOIN release_build_status s ON s.release_id = r.id"
        + " WHERE p.latest_release_id = r.id AND s.status=? AND r.has_docs=?"
        + " ORDER BY s.last_build_time, r.id LIMIT ?";
    return JdbcTemplate.query(conn, sql, RELEASE_ROW_MAPPER, BuildStatus.SUCCESS.code(), true, limit);
  }

  private static Optional<Long> packageId(Connection conn, String normalizedName) {
    return JdbcTemplate.queryOne(conn,
        "SELECT id FROM packages WHERE normalized_name=?", rs -> rs.getLong("id"), normalizedName);
  }

  private static void deleteReleaseRows(Connection conn, long releaseId) {
    JdbcTemplate.update(conn, "DELETE FROM release_build_status WHERE release_id=?", releaseId);
    JdbcTemplate.update(conn, "DELETE FROM builds WHERE release_id=?", releaseId);
    JdbcTemplate.update(conn, "DELETE FROM releases WHERE id=?", releaseId);
  }

  static String joinList(List<String> values) {
    if (values == null || values.isEmpty()) {
      return null;
    }
    return String.join(",", values);
  }

  static List<String> splitList(String value) {
    if (value == null || value.isBlank()) {
      return List.of();
    }
    return Arrays.stream(value.split(","))
        .map(String::trim)
        .filter(s -> !s.isEmpty())
        .toList();
  }
}
