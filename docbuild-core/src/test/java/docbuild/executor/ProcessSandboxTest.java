package docbuild.executor;

import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.condition.EnabledOnOs;
import org.junit.jupiter.api.condition.OS;
import org.junit.jupiter.api.io.TempDir;

import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Duration;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

@EnabledOnOs({OS.LINUX, OS.MAC})
class ProcessSandboxTest {
  private static final SandboxLimits LIMITS = SandboxLimits.DEFAULTS;

  @TempDir
  Path workRoot;

  private ProcessSandbox sandbox(String script) {
    return ProcessSandbox.builder()
        .command(List.of("sh", "-c", script))
        .workRoot(workRoot)
        .toolchainVersion("rustc 1.80.0")
        .targets(List.of("i686-unknown-linux-gnu"))
        .build();
  }

  @Test
  void successfulRunWithDocsIsReported() {
    ProcessSandbox sandbox = sandbox(
        "echo building {name} {version} for {target}; mkdir -p {outdir}/doc && touch {outdir}/doc/index.html");
    BuildRequest request = BuildRequest.of("Foo_Bar", "1.2.3");
    BuildLog log = new BuildLog(4096);

    sandbox.prepare(request, LIMITS);
    TargetResult result = sandbox.build(request, "x86_64-unknown-linux-gnu", LIMITS, Duration.ofSeconds(30), log);

    assertTrue(result.successful());
    assertTrue(result.docsProduced());
    assertEquals(0, result.exitCode());
    assertTrue(log.contents().contains("building Foo_Bar 1.2.3 for x86_64-unknown-linux-gnu"));
    assertTrue(Files.isDirectory(workRoot.resolve("foo-bar-1.2.3")));
  }

  @Test
  void successWithoutDocsIsNotDocsProduced() {
    ProcessSandbox sandbox = sandbox("exit 0");
    BuildRequest request = BuildRequest.of("foo", "1.0.0");

    sandbox.prepare(request, LIMITS);
    TargetResult result = sandbox.build(request, "x86_64-unknown-linux-gnu", LIMITS, Duration.ofSeconds(30), new BuildLog(1024));

    assertTrue(result.successful());
    assertFalse(result.docsProduced());
  }

  @Test
  void nonZeroExitFails() {
    ProcessSandbox sandbox = sandbox("echo error: could not compile >&2; exit 101");
    BuildRequest request = BuildRequest.of("foo", "1.0.0");
    BuildLog log = new BuildLog(1024);

    sandbox.prepare(request, LIMITS);
    TargetResult result = sandbox.build(request, "x86_64-unknown-linux-gnu", LIMITS, Duration.ofSeconds(30), log);

    assertFalse(result.successful());
    assertEquals(101, result.exitCode());
    assertFalse(result.memoryExceeded());
    assertTrue(log.contents().contains("could not compile"));
  }

  @Test
  void oomKillExitIsMemoryExceeded() {
    ProcessSandbox sandbox = sandbox("exit 137");
    BuildRequest request = BuildRequest.of("foo", "1.0.0");

    sandbox.prepare(request, LIMITS);
    TargetResult result = sandbox.build(request, "x86_64-unknown-linux-gnu", LIMITS, Duration.ofSeconds(30), new BuildLog(1024));

    assertTrue(result.memoryExceeded());
    assertFalse(result.successful());
  }

  @Test
  void runOutlivingBudgetIsTimedOut() {
    ProcessSandbox sandbox = sandbox("sleep 30");
    BuildRequest request = BuildRequest.of("foo", "1.0.0");

    sandbox.prepare(request, LIMITS);
    long start = System.nanoTime();
    TargetResult result = sandbox.build(request, "x86_64-unknown-linux-gnu", LIMITS, Duration.ofMillis(300), new BuildLog(1024));

    assertTrue(result.timedOut());
    assertFalse(result.successful());
    assertTrue(Duration.ofNanos(System.nanoTime() - start).compareTo(Duration.ofSeconds(20)) < 0);
  }

  @Test
  void placeholdersExpandLimits() {
    ProcessSandbox sandbox = sandbox("echo mem={memory} net={network}");
    BuildRequest request = BuildRequest.of("foo", "1.0.0");
    BuildLog log = new BuildLog(1024);

    sandbox.prepare(request, LIMITS);
    sandbox.build(request, "x86_64-unknown-linux-gnu", LIMITS, Duration.ofSeconds(30), log);

    assertTrue(log.contents().contains("mem=" + LIMITS.memoryBytes() + " net=none"));
  }

  @Test
  void inspectReportsConfiguredTargets() {
    PackageMetadata metadata = sandbox("true").inspect(BuildRequest.of("foo", "1.0.0"), LIMITS, new BuildLog(1));

    assertTrue(metadata.library());
    assertEquals("x86_64-unknown-linux-gnu", metadata.defaultTarget());
    assertEquals(List.of("i686-unknown-linux-gnu"), metadata.targets());
  }

  @Test
  void cleanupRemovesWorkDirectory() {
    ProcessSandbox sandbox = sandbox("mkdir -p {outdir}/doc && touch {outdir}/doc/index.html");
    BuildRequest request = BuildRequest.of("foo", "1.0.0");

    sandbox.prepare(request, LIMITS);
    sandbox.build(request, "x86_64-unknown-linux-gnu", LIMITS, Duration.ofSeconds(30), new BuildLog(1024));
    sandbox.cleanup(request);

    assertFalse(Files.exists(workRoot.resolve("foo-1.0.0")));
  }

  @Test
  void missingExecutableIsUnavailable() {
    ProcessSandbox sandbox = ProcessSandbox.builder()
        .command(List.of("/nonexistent/docbuild-runner"))
        .workRoot(workRoot)
        .toolchainVersion("rustc 1.80.0")
        .build();
    BuildRequest request = BuildRequest.of("foo", "1.0.0");

    sandbox.prepare(request, LIMITS);

    assertThrows(SandboxUnavailableException.class, () ->
        sandbox.build(request, "x86_64-unknown-linux-gnu", LIMITS, Duration.ofSeconds(5), new BuildLog(1024)));
  }

  @Test
  void builderRequiresCommand() {
    assertThrows(IllegalArgumentException.class, () -> ProcessSandbox.builder()
        .command(List.of())
        .workRoot(workRoot)
        .toolchainVersion("x")
        .build());
  }
}
