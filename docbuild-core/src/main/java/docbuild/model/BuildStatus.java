package docbuild.model;

/**
 * Lifecycle status of a single build attempt, and the aggregated status of a release.
 */
public enum BuildStatus {
  IN_PROGRESS("in_progress"),
  SUCCESS("success"),
  FAILURE("failure");

  private final String code;

  BuildStatus(String code) {
    this.code = code;
  }

  public String code() {
    return code;
  }

  public boolean isTerminal() {
    return this != IN_PROGRESS;
  }

  public static BuildStatus fromCode(String code) {
    for (BuildStatus status : values()) {
      if (status.code.equals(code)) {
        return status;
      }
    }
    throw new IllegalArgumentException("Unknown build status: " + code);
  }
}
