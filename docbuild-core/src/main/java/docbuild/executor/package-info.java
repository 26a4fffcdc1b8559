/**
 * Sandboxed documentation builds.
 *
 * <p>{@link docbuild.executor.SandboxExecutor} turns one queue entry into one
 * recorded build attempt. The {@link docbuild.executor.Sandbox} SPI does the
 * actual isolation; {@link docbuild.executor.ProcessSandbox} is the
 * process-based implementation. Limits come from
 * {@link docbuild.executor.SandboxLimits}, optionally widened per package.
 */
package docbuild.executor;
