package scriptsync.platform.delivery.web;

import jakarta.validation.Valid;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import java.util.List;
import java.util.function.Supplier;
import org.springframework.http.HttpStatus;
import org.springframework.http.MediaType;
import org.springframework.http.ResponseEntity;
import org.springframework.validation.BindingResult;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RestController;
import scriptsync.core.breadcrumb.NotLinkedException;
import scriptsync.core.git.HookRejectedException;
import scriptsync.core.remote.RemoteStoreException;
import scriptsync.core.write.AtomicFileWriteUseCase;
import scriptsync.core.write.RollbackFailedException;
import scriptsync.core.write.StaleWriteException;
import scriptsync.core.write.WriteFileCommand;
import scriptsync.core.write.WriteResult;

@RestController
public class FileWriteApiController {
  private final AtomicFileWriteUseCase atomicFileWriteUseCase;

  public FileWriteApiController(AtomicFileWriteUseCase atomicFileWriteUseCase) {
    this.atomicFileWriteUseCase = atomicFileWriteUseCase;
  }

  @PostMapping(
      path = "/api/files/write",
      consumes = MediaType.APPLICATION_JSON_VALUE,
      produces = MediaType.APPLICATION_JSON_VALUE)
  public ResponseEntity<?> write(
      @Valid @RequestBody WriteApiRequest request, BindingResult bindingResult) {
    if (bindingResult.hasErrors()) {
      return ResponseEntity.badRequest()
          .body(new ErrorResponse(SyncApiController.firstError(bindingResult), null));
    }
    return execute(
        () ->
            atomicFileWriteUseCase.write(
                new WriteFileCommand(
                    request.projectId(),
                    request.subtreePath(),
                    request.path(),
                    request.content(),
                    request.changeReason())));
  }

  @PostMapping(
      path = "/api/files/delete",
      consumes = MediaType.APPLICATION_JSON_VALUE,
      produces = MediaType.APPLICATION_JSON_VALUE)
  public ResponseEntity<?> delete(
      @Valid @RequestBody DeleteApiRequest request, BindingResult bindingResult) {
    if (bindingResult.hasErrors()) {
      return ResponseEntity.badRequest()
          .body(new ErrorResponse(SyncApiController.firstError(bindingResult), null));
    }
    return execute(
        () ->
            atomicFileWriteUseCase.delete(
                new WriteFileCommand(
                    request.projectId(),
                    request.subtreePath(),
                    request.path(),
                    null,
                    request.changeReason())));
  }

  private ResponseEntity<?> execute(Supplier<WriteResult> action) {
    try {
      return ResponseEntity.ok(action.get());
    } catch (StaleWriteException e) {
      return ResponseEntity.status(HttpStatus.CONFLICT).body(new ErrorResponse(e.getMessage(), null));
    } catch (HookRejectedException e) {
      return ResponseEntity.status(HttpStatus.UNPROCESSABLE_ENTITY)
          .body(new ErrorResponse(e.getMessage(), null));
    } catch (RollbackFailedException e) {
      return ResponseEntity.status(HttpStatus.INTERNAL_SERVER_ERROR)
          .body(new ErrorResponse(e.getMessage(), e.recoveryCommands()));
    } catch (RemoteStoreException e) {
      return ResponseEntity.status(HttpStatus.BAD_GATEWAY).body(new ErrorResponse(e.getMessage(), null));
    } catch (NotLinkedException e) {
      return ResponseEntity.status(HttpStatus.NOT_FOUND).body(new ErrorResponse(e.getMessage(), null));
    } catch (IllegalArgumentException e) {
      return ResponseEntity.badRequest().body(new ErrorResponse(e.getMessage(), null));
    }
  }

  public record WriteApiRequest(
      @NotBlank String projectId,
      String subtreePath,
      @NotBlank String path,
      @NotNull String content,
      String changeReason) {}

  public record DeleteApiRequest(
      @NotBlank String projectId, String subtreePath, @NotBlank String path, String changeReason) {}

  public record ErrorResponse(String error, List<String> recoveryCommands) {}
}
