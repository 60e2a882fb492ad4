package scriptsync.core.sync;

import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import scriptsync.core.breadcrumb.BreadcrumbRegistry;
import scriptsync.core.breadcrumb.NotLinkedException;
import scriptsync.core.merge.MergeConflictException;
import scriptsync.core.remote.RemoteFile;
import scriptsync.core.remote.RemoteStorePort;

/**
 * Syncs one or all linked sub-trees of a remote project. The remote listing is fetched once; a
 * failing sub-tree is recorded and the remaining ones still run.
 */
public class SyncProjectUseCase {
  private static final Logger log = LoggerFactory.getLogger(SyncProjectUseCase.class);

  private final RemoteStorePort remoteStore;
  private final BreadcrumbRegistry breadcrumbRegistry;
  private final SubtreeSynchronizer subtreeSynchronizer;

  public SyncProjectUseCase(
      RemoteStorePort remoteStore,
      BreadcrumbRegistry breadcrumbRegistry,
      SubtreeSynchronizer subtreeSynchronizer) {
    this.remoteStore = remoteStore;
    this.breadcrumbRegistry = breadcrumbRegistry;
    this.subtreeSynchronizer = subtreeSynchronizer;
  }

  public List<String> listSubtrees(String projectId) {
    requireProjectId(projectId);
    return breadcrumbRegistry.listSubtrees(remoteStore.list(projectId.trim()));
  }

  /**
   * @throws NotLinkedException when the requested sub-tree, or the project as a whole, has no
   *     breadcrumb
   */
  public SyncReport sync(SyncRequest request) {
    List<RemoteFile> remoteFiles = remoteStore.list(request.projectId());

    List<String> subtrees;
    if (request.subtreePath() != null) {
      String subtree = BreadcrumbRegistry.normalize(request.subtreePath());
      breadcrumbRegistry.requireBreadcrumb(remoteFiles, subtree);
      subtrees = List.of(subtree);
    } else {
      subtrees = breadcrumbRegistry.listSubtrees(remoteFiles);
      if (subtrees.isEmpty()) {
        throw new NotLinkedException("");
      }
    }

    log.info(
        "Syncing {} sub-tree(s) of project {} ({})",
        subtrees.size(),
        request.projectId(),
        request.direction().key());
    List<SubtreeSyncOutcome> outcomes = new ArrayList<>();
    for (String subtree : subtrees) {
      outcomes.add(syncOne(request, subtree, remoteFiles));
    }
    return aggregate(request.projectId(), outcomes);
  }

  private SubtreeSyncOutcome syncOne(
      SyncRequest request, String subtree, List<RemoteFile> remoteFiles) {
    try {
      SyncResult result = subtreeSynchronizer.sync(request, subtree, remoteFiles);
      if (!result.conflicts().isEmpty()) {
        String error =
            MergeConflictException.describe(Path.of(result.localPath()), result.conflicts());
        return SubtreeSyncOutcome.failed(subtree, result, error);
      }
      return SubtreeSyncOutcome.succeeded(result);
    } catch (MergeConflictException e) {
      log.warn("Sub-tree '{}' blocked by unresolved conflicts", display(subtree));
      SyncResult result = new SyncResult(subtree, null, null, 0, 0, 0, e.conflicts());
      return SubtreeSyncOutcome.failed(subtree, result, e.getMessage());
    } catch (RuntimeException e) {
      log.warn("Sub-tree '{}' failed: {}", display(subtree), e.getMessage(), e);
      return SubtreeSyncOutcome.failed(subtree, null, e.getMessage());
    }
  }

  private static SyncReport aggregate(String projectId, List<SubtreeSyncOutcome> outcomes) {
    int failures = 0;
    int pulled = 0;
    int pushed = 0;
    List<String> commands = new ArrayList<>();
    for (SubtreeSyncOutcome outcome : outcomes) {
      if (outcome.result() != null) {
        pulled += outcome.result().filesPulled();
        pushed += outcome.result().filesPushed();
      }
      if (!outcome.success()) {
        failures++;
        commands.add(
            "POST /api/sync {\"projectId\":\""
                + projectId
                + "\",\"subtreePath\":\""
                + outcome.subtreePath()
                + "\"}");
      }
    }

    int succeeded = outcomes.size() - failures;
    String message =
        "Synced " + succeeded + " sub-tree(s)" + (failures > 0 ? ", " + failures + " failed" : "");
    return new SyncReport(failures == 0, message, outcomes, pulled, pushed, commands);
  }

  private static String display(String subtree) {
    return subtree.isEmpty() ? "(root)" : subtree;
  }

  private static void requireProjectId(String projectId) {
    if (projectId == null || projectId.isBlank()) {
      throw new IllegalArgumentException("projectId must be non-blank.");
    }
  }
}
