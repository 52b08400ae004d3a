package se.alipsa.lgtrefactor.core;

import org.jetbrains.annotations.Nullable;
import se.alipsa.lgtrefactor.core.model.WorkspaceEdit;

import java.util.Objects;
import java.util.Optional;

/** Outcome of one refactoring command. */
public final class RefactorResult {

  public enum Status { APPLIED, CANCELLED, NOT_APPLICABLE, FAILED }

  private final Status status;
  private final String message;
  private final @Nullable WorkspaceEdit edit;

  private RefactorResult(Status status, String message, @Nullable WorkspaceEdit edit) {
    this.status = Objects.requireNonNull(status);
    this.message = Objects.requireNonNull(message);
    this.edit = edit;
  }

  public static RefactorResult applied(WorkspaceEdit edit, String message) {
    return new RefactorResult(Status.APPLIED, message, Objects.requireNonNull(edit));
  }

  public static RefactorResult cancelled() {
    return new RefactorResult(Status.CANCELLED, "Cancelled", null);
  }

  public static RefactorResult notApplicable(String message) {
    return new RefactorResult(Status.NOT_APPLICABLE, message, null);
  }

  public static RefactorResult failed(String message) {
    return new RefactorResult(Status.FAILED, message, null);
  }

  public Status getStatus() { return status; }

  public String getMessage() { return message; }

  /** The edit that was handed to the host, for applied results. */
  public Optional<WorkspaceEdit> getEdit() { return Optional.ofNullable(edit); }

  public boolean isApplied() { return status == Status.APPLIED; }

  @Override
  public String toString() {
    return status + ": " + message;
  }
}
