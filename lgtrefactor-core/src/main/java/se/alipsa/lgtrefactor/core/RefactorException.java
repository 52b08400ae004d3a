package se.alipsa.lgtrefactor.core;

/**
 * A refactoring that was offered cannot be completed. Nothing has been applied when this is
 * thrown.
 */
public class RefactorException extends Exception {

  private static final long serialVersionUID = 1L;

  public enum Reason {
    /** A downstream invariant failed: no locations, malformed directive, invalid selection or input. */
    PRECONDITION,
    /** The host failed: a file could not be read or the edit batch was rejected. */
    HOST
  }

  private final Reason reason;

  public RefactorException(Reason reason, String message) {
    super(message);
    this.reason = reason;
  }

  public RefactorException(Reason reason, String message, Throwable cause) {
    super(message, cause);
    this.reason = reason;
  }

  public static RefactorException precondition(String message) {
    return new RefactorException(Reason.PRECONDITION, message);
  }

  public static RefactorException host(String message, Throwable cause) {
    return new RefactorException(Reason.HOST, message, cause);
  }

  public Reason getReason() {
    return reason;
  }
}
