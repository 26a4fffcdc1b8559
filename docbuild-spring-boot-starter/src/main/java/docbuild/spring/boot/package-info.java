/**
 * Spring Boot auto-configuration for docbuild.
 *
 * @see docbuild.spring.boot.DocBuildAutoConfiguration
 * @see docbuild.spring.boot.DocBuildProperties
 */
package docbuild.spring.boot;
