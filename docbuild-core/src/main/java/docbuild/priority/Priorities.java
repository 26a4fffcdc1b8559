package docbuild.priority;

/**
 * Named build priorities. Lower values are dequeued first.
 */
public final class Priorities {

  /** Releases never seen before a sync. */
  public static final int NEW_RELEASE = 0;

  /** Packages an operator pushed back behind fresh releases but ahead of the backlog. */
  public static final int DEPRIORITIZED = 1;

  /** Baseline for known releases that match no priority rule, and for manual enqueues. */
  public static final int DEFAULT = 5;

  /** Rebuilds of releases that failed because of a broken toolchain. */
  public static final int BROKEN_TOOLCHAIN = 10;

  /** Releases found missing by the consistency check. */
  public static final int CONSISTENCY_CHECK = 15;

  /** Continuous rebuilds with newer toolchains. */
  public static final int CONTINUOUS = 20;

  private Priorities() {}
}
