package se.alipsa.lgtrefactor.core.model;

import java.util.Optional;

/** Every refactoring the engine offers, with the command id the host binds to it. */
public enum RefactorKind {
  ADD_ARGUMENT("addArgument", "Add argument to predicate/non-terminal"),
  REMOVE_ARGUMENT("removeArgument", "Remove argument from predicate/non-terminal"),
  REORDER_ARGUMENTS("reorderArguments", "Reorder predicate/non-terminal arguments"),
  ADD_PARAMETER("addParameter", "Add parameter to entity"),
  REMOVE_PARAMETER("removeParameter", "Remove parameter from entity"),
  REORDER_PARAMETERS("reorderParameters", "Reorder entity parameters"),
  EXTRACT_TO_FILE("extractToFile", "Extract to new Logtalk file"),
  EXTRACT_TO_ENTITY("extractToEntity", "Extract to new Logtalk entity"),
  EXTRACT_TO_EXISTING_ENTITY("extractToExistingEntity", "Move to existing Logtalk entity"),
  EXTRACT_PREDICATE("extractPredicate", "Extract predicate"),
  EXTRACT_PROTOCOL("extractProtocol", "Extract protocol"),
  CONVERT_ENTITY_TYPE("convertEntityType", "Convert entity type"),
  INLINE_VARIABLE("inlineVariable", "Inline variable"),
  UNIFY_WITH_NEW_VARIABLE("unifyWithNewVariable", "Unify with new variable"),
  INCREMENT_NUMBERED_VARIABLES("incrementNumberedVariables", "Increment numbered variables"),
  DECREMENT_NUMBERED_VARIABLES("decrementNumberedVariables", "Decrement numbered variables"),
  SPLIT_DIRECTIVE("splitDirective", "Split directive into one directive per element"),
  SORT_DIRECTIVE("sortDirective", "Sort directive list"),
  REPLACE_MAGIC_NUMBER("replaceMagicNumber", "Replace magic number"),
  REPLACE_INCLUDE_WITH_CONTENT("replaceIncludeWithContent", "Replace include/1 directive with file contents"),
  REPLACE_WITH_INCLUDE("replaceWithInclude", "Replace with include/1 directive");

  public static final String COMMAND_PREFIX = "logtalk.refactor.";

  private final String command;
  private final String title;

  RefactorKind(String command, String title) {
    this.command = command;
    this.title = title;
  }

  public String commandId() {
    return COMMAND_PREFIX + command;
  }

  public String title() {
    return title;
  }

  public static Optional<RefactorKind> fromCommandId(String commandId) {
    for (RefactorKind k : values()) {
      if (k.commandId().equals(commandId)) return Optional.of(k);
    }
    return Optional.empty();
  }
}
