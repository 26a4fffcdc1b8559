/**
 * Git-backed registry index. See {@link docbuild.registry.git.GitRegistryIndex}.
 */
package docbuild.registry.git;
