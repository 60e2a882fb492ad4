package scriptsync.core.merge;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;
import java.util.Optional;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import scriptsync.core.git.GitPort;
import scriptsync.core.git.MergeFileResult;
import scriptsync.core.transform.LocalFile;
import scriptsync.core.workspace.LocalTree;

/**
 * Per-file merge through {@code git merge-file}. Each incoming file goes through:
 *
 * <ul>
 *   <li>NEW_REMOTE: no local copy, written as is.
 *   <li>UNCHANGED: local bytes equal the incoming bytes, skipped.
 *   <li>DIVERGED: three-way merge, ending CLEAN (merged text written) or CONFLICT (markers
 *       written, path reported).
 * </ul>
 *
 * <p>The merge base follows {@link MergeBase}.
 */
public class ThreeWayMergeStrategy implements MergeStrategy {
  private static final Logger log = LoggerFactory.getLogger(ThreeWayMergeStrategy.class);

  enum FileState {
    NEW_REMOTE,
    UNCHANGED,
    DIVERGED
  }

  private final GitPort gitPort;
  private final MergeBase mergeBase;

  public ThreeWayMergeStrategy(GitPort gitPort, MergeBase mergeBase) {
    this.gitPort = gitPort;
    this.mergeBase = mergeBase == null ? MergeBase.LOCAL_SNAPSHOT : mergeBase;
  }

  @Override
  public String name() {
    return "three-way";
  }

  @Override
  public MergeOutcome merge(MergeRequest request) {
    Path workDir = request.workDir();
    List<String> created = new ArrayList<>();
    List<String> merged = new ArrayList<>();
    List<String> unchanged = new ArrayList<>();
    List<MergeConflict> conflicts = new ArrayList<>();

    Path scratch = createScratchDir();
    try {
      for (LocalFile incoming : request.incoming()) {
        String path = incoming.relativePath();
        Optional<LocalFile> local = LocalTree.read(workDir, path);
        FileState state = classify(local.orElse(null), incoming);
        switch (state) {
          case NEW_REMOTE -> {
            LocalTree.write(workDir, path, incoming.content());
            created.add(path);
          }
          case UNCHANGED -> unchanged.add(path);
          case DIVERGED -> {
            byte[] localBytes = local.get().content();
            byte[] base = resolveBase(request, path, localBytes);
            MergeFileResult result = mergeFile(scratch, localBytes, base, incoming.content());
            LocalTree.write(workDir, path, result.mergedText().getBytes(StandardCharsets.UTF_8));
            if (result.isClean()) {
              merged.add(path);
            } else {
              log.info("Conflict in {} ({} hunk(s))", path, result.conflictCount());
              conflicts.add(ConflictMarkers.parse(path, result.mergedText()));
            }
          }
        }
      }
    } finally {
      LocalTree.deleteRecursively(scratch);
    }

    return new MergeOutcome(name(), created, merged, unchanged, conflicts);
  }

  static FileState classify(LocalFile local, LocalFile incoming) {
    if (local == null) {
      return FileState.NEW_REMOTE;
    }
    if (Arrays.equals(local.content(), incoming.content())) {
      return FileState.UNCHANGED;
    }
    return FileState.DIVERGED;
  }

  private byte[] resolveBase(MergeRequest request, String path, byte[] localBytes) {
    if (mergeBase == MergeBase.LAST_COMMIT && request.baseCommit() != null) {
      return gitPort
          .readFileAtCommit(request.workDir(), request.baseCommit(), path)
          .orElse(localBytes);
    }
    return localBytes;
  }

  private MergeFileResult mergeFile(Path scratch, byte[] local, byte[] base, byte[] remote) {
    try {
      Path localFile = Files.write(scratch.resolve("local"), local);
      Path baseFile = Files.write(scratch.resolve("base"), base);
      Path remoteFile = Files.write(scratch.resolve("remote"), remote);
      return gitPort.mergeFile(scratch, localFile, baseFile, remoteFile, "local", "remote");
    } catch (IOException e) {
      throw new UncheckedIOException("Failed to stage merge inputs.", e);
    }
  }

  private static Path createScratchDir() {
    try {
      return Files.createTempDirectory("scriptsync-merge-");
    } catch (IOException e) {
      throw new UncheckedIOException("Failed to create merge scratch directory.", e);
    }
  }
}
