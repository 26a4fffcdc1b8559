package docbuild.executor;

import java.util.List;

/**
 * Decides whether a finished build counts as a success.
 *
 * <p>Only called when no limit was hit; timeouts and memory kills always fail.
 */
@FunctionalInterface
public interface DocumentationCheck {

  /**
   * Libraries must produce documentation for the default target; other
   * packages only need the default target to build.
   */
  DocumentationCheck DEFAULT = (metadata, defaultTarget, results) ->
      defaultTarget != null && defaultTarget.successful()
          && (!metadata.library() || defaultTarget.docsProduced());

  /**
   * @param defaultTarget result for the default target, {@code null} if it never ran
   * @param results       results for every target that ran, default first
   */
  boolean succeeded(PackageMetadata metadata, TargetResult defaultTarget, List<TargetResult> results);
}
