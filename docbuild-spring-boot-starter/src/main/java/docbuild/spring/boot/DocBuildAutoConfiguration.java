package docbuild.spring.boot;

import docbuild.DocBuild;
import docbuild.admin.BuildAdmin;
import docbuild.admin.BuildQueries;
import docbuild.executor.DocumentationCheck;
import docbuild.executor.ProcessSandbox;
import docbuild.executor.Sandbox;
import docbuild.executor.SandboxLimits;
import docbuild.jdbc.DataSourceConnectionProvider;
import docbuild.jdbc.JdbcStores;
import docbuild.queue.ExponentialBackoffRetryPolicy;
import docbuild.queue.RetryPolicy;
import docbuild.registry.RegistryIndex;
import docbuild.registry.WebhookSignatureVerifier;
import docbuild.registry.git.GitRegistryIndex;
import docbuild.spi.ConnectionProvider;
import docbuild.spi.DocBuildStores;
import docbuild.spi.MetricsExporter;

import org.springframework.beans.factory.ObjectProvider;
import org.springframework.boot.autoconfigure.AutoConfiguration;
import org.springframework.boot.autoconfigure.condition.ConditionalOnBean;
import org.springframework.boot.autoconfigure.condition.ConditionalOnClass;
import org.springframework.boot.autoconfigure.condition.ConditionalOnMissingBean;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.boot.autoconfigure.jdbc.DataSourceAutoConfiguration;
import org.springframework.boot.autoconfigure.sql.init.SqlInitializationAutoConfiguration;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import javax.sql.DataSource;
import java.io.File;
import java.nio.file.Path;

/**
 * Auto-configuration for docbuild.
 *
 * <p>Wires a {@link DocBuild} composite from a {@link DataSource} and
 * {@link DocBuildProperties}. The registry index and the sandbox are taken
 * from the context when present; otherwise a git index is created when
 * {@code docbuild.sync.index-directory} is set and a process sandbox when
 * {@code docbuild.sandbox.work-root} is set.
 *
 * @see DocBuildProperties
 * @see DocBuildMicrometerAutoConfiguration
 */
@AutoConfiguration(after = {DataSourceAutoConfiguration.class, SqlInitializationAutoConfiguration.class})
@ConditionalOnClass(DocBuild.class)
@ConditionalOnBean(DataSource.class)
@EnableConfigurationProperties(DocBuildProperties.class)
public class DocBuildAutoConfiguration {

  @Bean
  @ConditionalOnMissingBean
  public DocBuildStores docBuildStores(DataSource dataSource) {
    return JdbcStores.detect(dataSource);
  }

  @Bean
  @ConditionalOnMissingBean(ConnectionProvider.class)
  public DataSourceConnectionProvider connectionProvider(DataSource dataSource) {
    return new DataSourceConnectionProvider(dataSource);
  }

  @Bean
  @ConditionalOnMissingBean(Sandbox.class)
  @ConditionalOnProperty(prefix = "docbuild.sandbox", name = "work-root")
  public ProcessSandbox processSandbox(DocBuildProperties props) {
    DocBuildProperties.Sandbox sandbox = props.getSandbox();
    if (sandbox.getCommand().isEmpty()) {
      throw new IllegalStateException("docbuild.sandbox.command must be set when docbuild.sandbox.work-root is");
    }
    if (sandbox.getToolchainVersion() == null || sandbox.getToolchainVersion().isBlank()) {
      throw new IllegalStateException("docbuild.sandbox.toolchain-version must be set");
    }
    return ProcessSandbox.builder()
        .command(sandbox.getCommand())
        .workRoot(Path.of(sandbox.getWorkRoot()))
        .toolchainVersion(sandbox.getToolchainVersion())
        .defaultTarget(sandbox.getDefaultTarget())
        .targets(sandbox.getTargets())
        .build();
  }

  @Bean
  @ConditionalOnMissingBean
  @ConditionalOnProperty(prefix = "docbuild.webhook", name = "secret")
  public WebhookSignatureVerifier webhookSignatureVerifier(DocBuildProperties props) {
    return new WebhookSignatureVerifier(props.getWebhook().getSecret());
  }

  @Bean(destroyMethod = "close")
  @ConditionalOnMissingBean
  public DocBuild docBuild(DocBuildProperties props,
      ConnectionProvider connectionProvider,
      DocBuildStores stores,
      ObjectProvider<RegistryIndex> indexProvider,
      ObjectProvider<Sandbox> sandboxProvider,
      ObjectProvider<DocumentationCheck> documentationCheckProvider,
      ObjectProvider<MetricsExporter> metricsProvider) {

    MetricsExporter metrics = metricsProvider.getIfAvailable();
    RegistryIndex index = indexProvider.getIfAvailable();
    Sandbox sandbox = sandboxProvider.getIfAvailable();
    DocumentationCheck documentationCheck = documentationCheckProvider.getIfAvailable();
    RetryPolicy retryPolicy = new ExponentialBackoffRetryPolicy(
        props.getRetry().getBaseDelayMs(), props.getRetry().getMaxDelayMs());
    DocBuildProperties.Sync sync = props.getSync();
    DocBuildProperties.Workers workers = props.getWorkers();
    DocBuildProperties.Reaper reaper = props.getReaper();
    DocBuildProperties.Rebuilds rebuilds = props.getRebuilds();

    return switch (props.getMode()) {
      case COMBINED -> {
        requireIndex(index);
        requireSandbox(sandbox);
        var builder = DocBuild.combined()
            .connectionProvider(connectionProvider)
            .stores(stores)
            .registry(props.getRegistry())
            .checkpointName(sync.getCheckpointName())
            .maxAttempts(props.getQueue().getMaxAttempts())
            .retryPolicy(retryPolicy)
            .index(index)
            .syncIntervalMs(sync.getIntervalMs())
            .syncLockTimeout(sync.getLockTimeout())
            .syncBatchSize(sync.getBatchSize())
            .sandbox(sandbox)
            .sandboxDefaults(sandboxLimits(props))
            .builderVersion(workers.getBuilderVersion())
            .workerCount(workers.getCount())
            .idleBackoffMs(workers.getIdleBackoffMs())
            .pausedBackoffMs(workers.getPausedBackoffMs())
            .drainTimeoutMs(workers.getDrainTimeoutMs())
            .reaper(reaper.getGrace(), reaper.getIntervalSeconds());
        if (workers.getBuildServerName() != null) {
          builder.buildServerName(workers.getBuildServerName());
        }
        if (workers.getClaimTimeout() != null) {
          builder.claimTimeout(workers.getClaimTimeout());
        }
        if (documentationCheck != null) {
          builder.documentationCheck(documentationCheck);
        }
        if (rebuilds.isEnabled()) {
          builder.rebuilds(rebuilds.getMaxQueued(), rebuilds.getIntervalSeconds());
        }
        if (metrics != null) {
          builder.metrics(metrics);
        }
        yield builder.build();
      }
      case WATCHER -> {
        requireIndex(index);
        var builder = DocBuild.watcher()
            .connectionProvider(connectionProvider)
            .stores(stores)
            .registry(props.getRegistry())
            .checkpointName(sync.getCheckpointName())
            .maxAttempts(props.getQueue().getMaxAttempts())
            .retryPolicy(retryPolicy)
            .index(index)
            .syncIntervalMs(sync.getIntervalMs())
            .syncLockTimeout(sync.getLockTimeout())
            .syncBatchSize(sync.getBatchSize());
        if (rebuilds.isEnabled()) {
          builder.rebuilds(rebuilds.getMaxQueued(), rebuilds.getIntervalSeconds());
        }
        if (metrics != null) {
          builder.metrics(metrics);
        }
        yield builder.build();
      }
      case BUILD_SERVER -> {
        requireSandbox(sandbox);
        var builder = DocBuild.buildServer()
            .connectionProvider(connectionProvider)
            .stores(stores)
            .registry(props.getRegistry())
            .checkpointName(sync.getCheckpointName())
            .maxAttempts(props.getQueue().getMaxAttempts())
            .retryPolicy(retryPolicy)
            .index(index)
            .sandbox(sandbox)
            .sandboxDefaults(sandboxLimits(props))
            .builderVersion(workers.getBuilderVersion())
            .workerCount(workers.getCount())
            .idleBackoffMs(workers.getIdleBackoffMs())
            .pausedBackoffMs(workers.getPausedBackoffMs())
            .drainTimeoutMs(workers.getDrainTimeoutMs())
            .reaper(reaper.getGrace(), reaper.getIntervalSeconds());
        if (workers.getBuildServerName() != null) {
          builder.buildServerName(workers.getBuildServerName());
        }
        if (workers.getClaimTimeout() != null) {
          builder.claimTimeout(workers.getClaimTimeout());
        }
        if (documentationCheck != null) {
          builder.documentationCheck(documentationCheck);
        }
        if (metrics != null) {
          builder.metrics(metrics);
        }
        yield builder.build();
      }
    };
  }

  @Bean
  @ConditionalOnMissingBean
  public BuildAdmin buildAdmin(DocBuild docBuild) {
    return docBuild.admin();
  }

  @Bean
  @ConditionalOnMissingBean
  public BuildQueries buildQueries(DocBuild docBuild) {
    return docBuild.queries();
  }

  private static SandboxLimits sandboxLimits(DocBuildProperties props) {
    DocBuildProperties.Sandbox sandbox = props.getSandbox();
    return new SandboxLimits(sandbox.getMemoryBytes(), sandbox.getTimeout(), sandbox.getMaxTargets(),
        sandbox.isNetworking(), sandbox.getMaxLogBytes());
  }

  private static void requireIndex(RegistryIndex index) {
    if (index == null) {
      throw new IllegalStateException(
          "A RegistryIndex bean or docbuild.sync.index-directory is required for this docbuild.mode");
    }
  }

  private static void requireSandbox(Sandbox sandbox) {
    if (sandbox == null) {
      throw new IllegalStateException(
          "A Sandbox bean or docbuild.sandbox.work-root is required for this docbuild.mode");
    }
  }

  /**
   * Git-backed registry index, only when the git module is on the classpath.
   */
  @Configuration(proxyBeanMethods = false)
  @ConditionalOnClass(GitRegistryIndex.class)
  @ConditionalOnProperty(prefix = "docbuild.sync", name = "index-directory")
  static class GitIndexConfiguration {

    @Bean(destroyMethod = "close")
    @ConditionalOnMissingBean(RegistryIndex.class)
    public GitRegistryIndex gitRegistryIndex(DocBuildProperties props) {
      DocBuildProperties.Sync sync = props.getSync();
      return GitRegistryIndex.builder()
          .directory(new File(sync.getIndexDirectory()))
          .ref(sync.getRef())
          .fetch(sync.isFetch())
          .remote(sync.getRemote())
          .build();
    }
  }
}
