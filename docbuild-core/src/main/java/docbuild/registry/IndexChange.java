package docbuild.registry;

import docbuild.model.ReleaseMetadata;

import java.util.Objects;

/**
 * One change observed in the registry index.
 *
 * @param version  {@code null} for {@link Kind#PACKAGE_DELETED}
 * @param metadata registry facts for {@link Kind#RELEASE_ADDED}; for yank
 *                 changes only the yanked flag is meaningful
 */
public record IndexChange(Kind kind, String name, String version, ReleaseMetadata metadata) {

  public enum Kind {
    RELEASE_ADDED,
    YANKED,
    UNYANKED,
    VERSION_DELETED,
    PACKAGE_DELETED
  }

  public IndexChange {
    Objects.requireNonNull(kind, "kind");
    Objects.requireNonNull(name, "name");
    if (kind != Kind.PACKAGE_DELETED) {
      Objects.requireNonNull(version, "version");
    }
    if (metadata == null) {
      metadata = ReleaseMetadata.UNKNOWN;
    }
  }

  public static IndexChange added(String name, String version, ReleaseMetadata metadata) {
    return new IndexChange(Kind.RELEASE_ADDED, name, version, metadata);
  }

  public static IndexChange yanked(String name, String version) {
    return new IndexChange(Kind.YANKED, name, version,
        new ReleaseMetadata(true, null, null, null));
  }

  public static IndexChange unyanked(String name, String version) {
    return new IndexChange(Kind.UNYANKED, name, version, ReleaseMetadata.UNKNOWN);
  }

  public static IndexChange versionDeleted(String name, String version) {
    return new IndexChange(Kind.VERSION_DELETED, name, version, null);
  }

  public static IndexChange packageDeleted(String name) {
    return new IndexChange(Kind.PACKAGE_DELETED, name, null, null);
  }

  public boolean yanked() {
    return kind == Kind.YANKED || (kind == Kind.RELEASE_ADDED && metadata.yanked());
  }
}
