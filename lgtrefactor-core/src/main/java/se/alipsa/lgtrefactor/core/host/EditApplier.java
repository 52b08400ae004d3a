package se.alipsa.lgtrefactor.core.host;

import se.alipsa.lgtrefactor.core.model.WorkspaceEdit;

/** Applies a multi-file edit batch atomically: either every edit lands or none does. */
@FunctionalInterface
public interface EditApplier {
  boolean applyEdits(WorkspaceEdit edit);
}
