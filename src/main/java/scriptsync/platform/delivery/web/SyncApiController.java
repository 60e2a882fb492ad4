package scriptsync.platform.delivery.web;

import jakarta.validation.Valid;
import jakarta.validation.constraints.NotBlank;
import java.util.List;
import org.springframework.http.HttpStatus;
import org.springframework.http.MediaType;
import org.springframework.http.ResponseEntity;
import org.springframework.validation.BindingResult;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RestController;
import scriptsync.core.breadcrumb.NotLinkedException;
import scriptsync.core.remote.RemoteStoreException;
import scriptsync.core.sync.SyncDirection;
import scriptsync.core.sync.SyncProjectUseCase;
import scriptsync.core.sync.SyncReport;
import scriptsync.core.sync.SyncRequest;

@RestController
public class SyncApiController {
  private final SyncProjectUseCase syncProjectUseCase;

  public SyncApiController(SyncProjectUseCase syncProjectUseCase) {
    this.syncProjectUseCase = syncProjectUseCase;
  }

  @PostMapping(
      path = "/api/sync",
      consumes = MediaType.APPLICATION_JSON_VALUE,
      produces = MediaType.APPLICATION_JSON_VALUE)
  public ResponseEntity<?> sync(
      @Valid @RequestBody SyncApiRequest request, BindingResult bindingResult) {
    if (bindingResult.hasErrors()) {
      return ResponseEntity.badRequest().body(new ErrorResponse(firstError(bindingResult)));
    }

    SyncRequest syncRequest;
    try {
      syncRequest =
          new SyncRequest(
              request.projectId(),
              request.subtreePath(),
              SyncDirection.fromJson(request.direction()),
              Boolean.TRUE.equals(request.forceOverwrite()),
              !Boolean.FALSE.equals(request.autoCommit()));
    } catch (IllegalArgumentException e) {
      return ResponseEntity.badRequest().body(new ErrorResponse(e.getMessage()));
    }

    try {
      SyncReport report = syncProjectUseCase.sync(syncRequest);
      return ResponseEntity.status(report.success() ? HttpStatus.OK : HttpStatus.CONFLICT)
          .body(report);
    } catch (NotLinkedException e) {
      return ResponseEntity.status(HttpStatus.NOT_FOUND).body(new ErrorResponse(e.getMessage()));
    } catch (RemoteStoreException e) {
      return ResponseEntity.status(HttpStatus.BAD_GATEWAY).body(new ErrorResponse(e.getMessage()));
    } catch (IllegalArgumentException e) {
      return ResponseEntity.badRequest().body(new ErrorResponse(e.getMessage()));
    }
  }

  @GetMapping(path = "/api/projects/{projectId}/subtrees", produces = MediaType.APPLICATION_JSON_VALUE)
  public ResponseEntity<?> subtrees(@PathVariable("projectId") String projectId) {
    try {
      return ResponseEntity.ok(
          new SubtreesResponse(projectId, syncProjectUseCase.listSubtrees(projectId)));
    } catch (RemoteStoreException e) {
      return ResponseEntity.status(HttpStatus.BAD_GATEWAY).body(new ErrorResponse(e.getMessage()));
    }
  }

  static String firstError(BindingResult bindingResult) {
    if (bindingResult.getFieldError() != null) {
      return "Field `"
          + bindingResult.getFieldError().getField()
          + "` "
          + bindingResult.getFieldError().getDefaultMessage()
          + ".";
    }
    return "Invalid request.";
  }

  public record SyncApiRequest(
      @NotBlank String projectId,
      String subtreePath,
      String direction,
      Boolean forceOverwrite,
      Boolean autoCommit) {}

  public record SubtreesResponse(String projectId, List<String> subtrees) {}

  public record ErrorResponse(String error) {}
}
