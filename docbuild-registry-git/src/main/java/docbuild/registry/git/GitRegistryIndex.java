package docbuild.registry.git;

import com.fasterxml.jackson.databind.ObjectMapper;
import docbuild.model.ReleaseMetadata;
import docbuild.registry.IndexChange;
import docbuild.registry.IndexDiff;
import docbuild.registry.IndexSnapshot;
import docbuild.registry.RegistryIndex;
import docbuild.registry.RegistryIndexException;
import org.eclipse.jgit.api.Git;
import org.eclipse.jgit.api.errors.GitAPIException;
import org.eclipse.jgit.diff.DiffEntry;
import org.eclipse.jgit.diff.DiffFormatter;
import org.eclipse.jgit.lib.ObjectId;
import org.eclipse.jgit.lib.Repository;
import org.eclipse.jgit.revwalk.RevCommit;
import org.eclipse.jgit.revwalk.RevWalk;
import org.eclipse.jgit.treewalk.TreeWalk;
import org.eclipse.jgit.util.io.DisabledOutputStream;

import java.io.File;
import java.io.IOException;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * {@link RegistryIndex} over a local git clone of a sparse package index.
 *
 * <p>Every package has one file, named after the package, holding one JSON
 * line per version. References are commit ids. Changes are computed from the
 * tree diff between two commits, so only the touched package files are read.
 *
 * <p>When {@code fetch} is enabled the configured remote is fetched before
 * the head is resolved; set {@code ref} to the remote-tracking branch in that
 * case (for example {@code refs/remotes/origin/master}).
 *
 * <pre>{@code
 * try (GitRegistryIndex index = GitRegistryIndex.builder()
 *     .directory(new File("/var/lib/docbuild/index"))
 *     .ref("refs/remotes/origin/master")
 *     .fetch(true)
 *     .build()) {
 *   String head = index.headReference();
 * }
 * }</pre>
 */
public final class GitRegistryIndex implements RegistryIndex, AutoCloseable {
  private static final Logger logger = Logger.getLogger(GitRegistryIndex.class.getName());

  private final Git git;
  private final String ref;
  private final boolean fetch;
  private final String remote;
  private final ObjectMapper mapper;

  private GitRegistryIndex(Builder builder) {
    this.ref = builder.ref;
    this.fetch = builder.fetch;
    this.remote = builder.remote;
    this.mapper = builder.mapper;
    try {
      this.git = Git.open(builder.directory);
    } catch (IOException e) {
      throw new RegistryIndexException("Cannot open index repository at " + builder.directory, e);
    }
  }

  public static Builder builder() {
    return new Builder();
  }

  @Override
  public String headReference() {
    return resolveHead().name();
  }

  @Override
  public IndexDiff changesSince(String reference) {
    Objects.requireNonNull(reference, "reference");
    ObjectId head = resolveHead();
    if (head.name().equals(reference)) {
      return new IndexDiff(List.of(), reference);
    }
    Repository repository = git.getRepository();
    List<IndexChange> changes = new ArrayList<>();
    try (RevWalk walk = new RevWalk(repository);
         DiffFormatter formatter = new DiffFormatter(DisabledOutputStream.INSTANCE)) {
      RevCommit from = walk.parseCommit(ObjectId.fromString(reference));
      RevCommit to = walk.parseCommit(head);
      formatter.setRepository(repository);
      formatter.setDetectRenames(false);
      for (DiffEntry entry : formatter.scan(from.getTree(), to.getTree())) {
        collectChanges(repository, entry, changes);
      }
    } catch (IOException | IllegalArgumentException e) {
      throw new RegistryIndexException("Failed to diff index from " + reference + " to " + head.name(), e);
    }
    return new IndexDiff(changes, head.name());
  }

  @Override
  public IndexSnapshot snapshot() {
    ObjectId head = resolveHead();
    Repository repository = git.getRepository();
    List<IndexSnapshot.Entry> releases = new ArrayList<>();
    try (RevWalk walk = new RevWalk(repository);
         TreeWalk treeWalk = new TreeWalk(repository)) {
      RevCommit commit = walk.parseCommit(head);
      treeWalk.addTree(commit.getTree());
      treeWalk.setRecursive(true);
      while (treeWalk.next()) {
        String path = treeWalk.getPathString();
        if (!isPackageFile(path)) {
          continue;
        }
        IndexFile file = read(repository, path, treeWalk.getObjectId(0));
        for (IndexFile.Line line : file.versions().values()) {
          releases.add(new IndexSnapshot.Entry(line.name(), line.version(), line.yanked()));
        }
      }
    } catch (IOException e) {
      throw new RegistryIndexException("Failed to list index at " + head.name(), e);
    }
    return new IndexSnapshot(head.name(), releases);
  }

  @Override
  public void close() {
    git.close();
  }

  private ObjectId resolveHead() {
    if (fetch) {
      try {
        git.fetch().setRemote(remote).call();
      } catch (GitAPIException e) {
        throw new RegistryIndexException("Failed to fetch index from " + remote, e);
      }
    }
    try {
      ObjectId id = git.getRepository().resolve(ref + "^{commit}");
      if (id == null) {
        throw new RegistryIndexException("Index ref not found: " + ref);
      }
      return id;
    } catch (IOException e) {
      throw new RegistryIndexException("Failed to resolve index ref " + ref, e);
    }
  }

  private void collectChanges(Repository repository, DiffEntry entry, List<IndexChange> changes)
      throws IOException {
    switch (entry.getChangeType()) {
      case ADD, COPY -> {
        if (isPackageFile(entry.getNewPath())) {
          IndexFile added = read(repository, entry.getNewPath(), entry.getNewId().toObjectId());
          diffFiles(IndexFile.empty(), added, changes);
        }
      }
      case DELETE -> {
        if (isPackageFile(entry.getOldPath())) {
          changes.add(IndexChange.packageDeleted(packageName(repository, entry)));
        }
      }
      case MODIFY -> {
        if (isPackageFile(entry.getNewPath())) {
          IndexFile before = read(repository, entry.getOldPath(), entry.getOldId().toObjectId());
          IndexFile after = read(repository, entry.getNewPath(), entry.getNewId().toObjectId());
          if (after.isEmpty() && !before.isEmpty()) {
            changes.add(IndexChange.packageDeleted(before.versions().values().iterator().next().name()));
          } else {
            diffFiles(before, after, changes);
          }
        }
      }
      case RENAME -> logger.log(Level.WARNING, "Ignoring index rename {0} -> {1}",
          new Object[]{entry.getOldPath(), entry.getNewPath()});
    }
  }

  private static void diffFiles(IndexFile before, IndexFile after, List<IndexChange> changes) {
    for (IndexFile.Line line : after.versions().values()) {
      IndexFile.Line previous = before.get(line.version());
      if (previous == null) {
        changes.add(IndexChange.added(line.name(), line.version(),
            new ReleaseMetadata(line.yanked(), null, line.dependencies(), List.of())));
      } else if (previous.yanked() != line.yanked()) {
        changes.add(line.yanked()
            ? IndexChange.yanked(line.name(), line.version())
            : IndexChange.unyanked(line.name(), line.version()));
      }
    }
    for (Map.Entry<String, IndexFile.Line> old : before.versions().entrySet()) {
      if (after.get(old.getKey()) == null) {
        changes.add(IndexChange.versionDeleted(old.getValue().name(), old.getKey()));
      }
    }
  }

  private String packageName(Repository repository, DiffEntry entry) throws IOException {
    IndexFile before = read(repository, entry.getOldPath(), entry.getOldId().toObjectId());
    if (!before.isEmpty()) {
      return before.versions().values().iterator().next().name();
    }
    return fileName(entry.getOldPath());
  }

  private IndexFile read(Repository repository, String path, ObjectId blob) throws IOException {
    return IndexFile.parse(mapper, path, repository.open(blob).getBytes());
  }

  static boolean isPackageFile(String path) {
    String name = fileName(path);
    return !name.startsWith(".") && !path.equals("config.json");
  }

  private static String fileName(String path) {
    int slash = path.lastIndexOf('/');
    return slash < 0 ? path : path.substring(slash + 1);
  }

  public static final class Builder {
    private File directory;
    private String ref = "HEAD";
    private boolean fetch;
    private String remote = "origin";
    private ObjectMapper mapper = new ObjectMapper();

    private Builder() {
    }

    /** Working tree or bare repository directory of the index clone. */
    public Builder directory(File directory) {
      this.directory = directory;
      return this;
    }

    public Builder ref(String ref) {
      this.ref = ref;
      return this;
    }

    public Builder fetch(boolean fetch) {
      this.fetch = fetch;
      return this;
    }

    public Builder remote(String remote) {
      this.remote = remote;
      return this;
    }

    public Builder objectMapper(ObjectMapper mapper) {
      this.mapper = mapper;
      return this;
    }

    public GitRegistryIndex build() {
      Objects.requireNonNull(directory, "directory");
      Objects.requireNonNull(ref, "ref");
      Objects.requireNonNull(remote, "remote");
      Objects.requireNonNull(mapper, "mapper");
      if (ref.isBlank()) {
        throw new IllegalArgumentException("ref must not be blank");
      }
      return new GitRegistryIndex(this);
    }
  }
}
