/**
 * Registry-driven documentation builds.
 *
 * <p>{@link docbuild.DocBuild} is the entry point. Persistence is pluggable
 * through {@link docbuild.spi}; the registry through
 * {@link docbuild.registry.RegistryIndex}; build isolation through
 * {@link docbuild.executor.Sandbox}.
 */
package docbuild;
