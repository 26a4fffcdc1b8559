package docbuild.model;

/**
 * A package as tracked locally.
 *
 * @param latestReleaseId {@code null} until a release has been recorded
 */
public record PackageInfo(long id, String name, String normalizedName, Long latestReleaseId, long downloads) {}
