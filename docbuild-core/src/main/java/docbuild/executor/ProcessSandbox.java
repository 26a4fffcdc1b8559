package docbuild.executor;

import docbuild.model.PackageNames;
import docbuild.util.DaemonThreadFactory;

import java.io.BufferedReader;
import java.io.IOException;
import java.io.InputStreamReader;
import java.io.UncheckedIOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Duration;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.concurrent.TimeUnit;
import java.util.logging.Level;
import java.util.logging.Logger;
import java.util.stream.Stream;

/**
 * {@link Sandbox} that runs each target build as an external process,
 * typically a container runtime invocation.
 *
 * <p>The command template may use these placeholders:
 * <ul>
 *   <li>{@code {name}}, {@code {version}}, {@code {target}}</li>
 *   <li>{@code {workdir}}: per-release working directory</li>
 *   <li>{@code {outdir}}: {@code <workdir>/<target>}; documentation is expected in {@code <outdir>/doc}</li>
 *   <li>{@code {memory}}: memory limit in bytes</li>
 *   <li>{@code {network}}: {@code none} or {@code bridge}</li>
 * </ul>
 *
 * <p>A run that outlives its budget is destroyed forcibly. Exit status
 * {@value #OOM_KILL_EXIT} is reported as a memory-limit kill.
 */
public final class ProcessSandbox implements Sandbox {
  private static final Logger logger = Logger.getLogger(ProcessSandbox.class.getName());

  static final int OOM_KILL_EXIT = 137;

  private final List<String> command;
  private final Path workRoot;
  private final String toolchainVersion;
  private final String defaultTarget;
  private final List<String> targets;
  private final Map<String, String> environment;
  private final DaemonThreadFactory pumpThreads = new DaemonThreadFactory("docbuild-sandbox-output-");

  private ProcessSandbox(Builder builder) {
    Objects.requireNonNull(builder.command, "command");
    if (builder.command.isEmpty()) {
      throw new IllegalArgumentException("command must not be empty");
    }
    this.command = List.copyOf(builder.command);
    this.workRoot = Objects.requireNonNull(builder.workRoot, "workRoot");
    this.toolchainVersion = Objects.requireNonNull(builder.toolchainVersion, "toolchainVersion");
    this.defaultTarget = Objects.requireNonNull(builder.defaultTarget, "defaultTarget");
    this.targets = List.copyOf(builder.targets);
    this.environment = Map.copyOf(builder.environment);
  }

  public static Builder builder() {
    return new Builder();
  }

  @Override
  public String toolchainVersion() {
    return toolchainVersion;
  }

  @Override
  public void prepare(BuildRequest request, SandboxLimits limits) {
    try {
      Files.createDirectories(workDir(request));
    } catch (IOException e) {
      throw new SandboxUnavailableException("Cannot create work directory under " + workRoot, e);
    }
  }

  /**
   * Reports every package as a library building for the configured default
   * target and extra targets. Registry-provided facts override this.
   */
  @Override
  public PackageMetadata inspect(BuildRequest request, SandboxLimits limits, BuildLog log) {
    return new PackageMetadata(true, defaultTarget, targets);
  }

  @Override
  public TargetResult build(BuildRequest request, String target, SandboxLimits limits,
      Duration budget, BuildLog log) {
    Path outDir = workDir(request).resolve(target);
    List<String> args = expand(request, target, limits, outDir);
    Process process;
    try {
      Files.createDirectories(outDir);
      ProcessBuilder pb = new ProcessBuilder(args)
          .directory(workDir(request).toFile())
          .redirectErrorStream(true);
      pb.environment().putAll(environment);
      process = pb.start();
    } catch (IOException e) {
      throw new SandboxUnavailableException("Cannot start sandbox process " + args.get(0), e);
    }

    Thread pump = pumpThreads.newThread(() -> pumpOutput(process, log));
    pump.start();
    try {
      boolean finished = process.waitFor(budget.toMillis(), TimeUnit.MILLISECONDS);
      if (!finished) {
        process.destroyForcibly();
        process.waitFor(5, TimeUnit.SECONDS);
        pump.join(1000);
        return TargetResult.timedOut(target);
      }
      pump.join(1000);
    } catch (InterruptedException e) {
      process.destroyForcibly();
      Thread.currentThread().interrupt();
      throw new SandboxUnavailableException("Interrupted while building " + target, e);
    }

    int exit = process.exitValue();
    boolean memoryExceeded = exit == OOM_KILL_EXIT;
    boolean successful = exit == 0;
    boolean docs = successful && hasDocs(outDir.resolve("doc"));
    return new TargetResult(target, successful, docs, exit, false, memoryExceeded, null, null);
  }

  @Override
  public void cleanup(BuildRequest request) {
    Path dir = workDir(request);
    if (!Files.exists(dir)) {
      return;
    }
    try (Stream<Path> paths = Files.walk(dir)) {
      paths.sorted(Comparator.reverseOrder()).forEach(path -> {
        try {
          Files.deleteIfExists(path);
        } catch (IOException e) {
          throw new UncheckedIOException(e);
        }
      });
    } catch (IOException | UncheckedIOException e) {
      logger.log(Level.WARNING, "Failed to remove " + dir, e);
    }
  }

  Path workDir(BuildRequest request) {
    return workRoot.resolve(PackageNames.normalize(request.name()) + "-" + request.version());
  }

  private List<String> expand(BuildRequest request, String target, SandboxLimits limits, Path outDir) {
    List<String> args = new ArrayList<>(command.size());
    for (String part : command) {
      args.add(part
          .replace("{name}", request.name())
          .replace("{version}", request.version())
          .replace("{target}", target)
          .replace("{workdir}", workDir(request).toString())
          .replace("{outdir}", outDir.toString())
          .replace("{memory}", Long.toString(limits.memoryBytes()))
          .replace("{network}", limits.networking() ? "bridge" : "none"));
    }
    return args;
  }

  private static void pumpOutput(Process process, BuildLog log) {
    try (BufferedReader reader = new BufferedReader(
        new InputStreamReader(process.getInputStream(), StandardCharsets.UTF_8))) {
      String line;
      while ((line = reader.readLine()) != null) {
        log.line(line);
      }
    } catch (IOException e) {
      logger.log(Level.FINE, "Sandbox output stream closed", e);
    }
  }

  private static boolean hasDocs(Path docDir) {
    if (!Files.isDirectory(docDir)) {
      return false;
    }
    try (Stream<Path> entries = Files.list(docDir)) {
      return entries.findAny().isPresent();
    } catch (IOException e) {
      logger.log(Level.WARNING, "Cannot inspect " + docDir, e);
      return false;
    }
  }

  /** Builder for {@link ProcessSandbox}. */
  public static final class Builder {
    private List<String> command;
    private Path workRoot;
    private String toolchainVersion;
    private String defaultTarget = "x86_64-unknown-linux-gnu";
    private final List<String> targets = new ArrayList<>();
    private final Map<String, String> environment = new LinkedHashMap<>();

    private Builder() {}

    /** <b>Required.</b> Command template, one argument per element. */
    public Builder command(List<String> command) {
      this.command = command;
      return this;
    }

    /** <b>Required.</b> Directory under which per-release working directories are created. */
    public Builder workRoot(Path workRoot) {
      this.workRoot = workRoot;
      return this;
    }

    /** <b>Required.</b> */
    public Builder toolchainVersion(String toolchainVersion) {
      this.toolchainVersion = toolchainVersion;
      return this;
    }

    /** Optional. Defaults to {@code x86_64-unknown-linux-gnu}. */
    public Builder defaultTarget(String defaultTarget) {
      this.defaultTarget = defaultTarget;
      return this;
    }

    /** Optional. Extra targets built after the default one. */
    public Builder targets(List<String> targets) {
      this.targets.addAll(targets);
      return this;
    }

    /** Optional. Extra environment variables for every run. */
    public Builder environment(String key, String value) {
      this.environment.put(key, value);
      return this;
    }

    public ProcessSandbox build() {
      return new ProcessSandbox(this);
    }
  }
}
