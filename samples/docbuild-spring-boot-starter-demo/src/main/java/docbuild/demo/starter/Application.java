package docbuild.demo.starter;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

/**
 * Spring Boot Starter demo: a combined watcher and build server.
 *
 * <p>The starter wires everything from {@code application.yml}. Point
 * {@code DOCBUILD_INDEX} at a local clone of a registry index and
 * {@code DOCBUILD_WORK_ROOT} at a scratch directory.
 *
 * <p>Run with: mvn install -DskipTests && mvn -f samples/docbuild-spring-boot-starter-demo/pom.xml spring-boot:run
 *
 * <p>Endpoints:
 * POST /webhooks/registry                  - wake the synchronizer (signed when a secret is set)
 * GET  /releases/{name}/{version}/status   - aggregated build status
 * GET  /releases/{name}/{version}/builds   - build attempts, oldest first
 * GET  /queue                              - queue contents in dequeue order
 */
@SpringBootApplication
public class Application {

    public static void main(String[] args) {
        SpringApplication.run(Application.class, args);
    }
}
