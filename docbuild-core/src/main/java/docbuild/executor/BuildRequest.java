package docbuild.executor;

import java.util.Objects;

/**
 * Identifies the release to build.
 *
 * @param registry registry of origin, {@code null} for the default registry
 */
public record BuildRequest(String name, String version, String registry) {

  public BuildRequest {
    Objects.requireNonNull(name, "name");
    Objects.requireNonNull(version, "version");
  }

  public static BuildRequest of(String name, String version) {
    return new BuildRequest(name, version, null);
  }
}
