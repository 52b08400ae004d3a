package se.alipsa.lgtrefactor.core.model;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * A batch of text edits over one or more documents, plus files to create.
 * Edits for the same document never overlap; adding one that would is rejected.
 */
public final class WorkspaceEdit {

  private final Map<String, List<TextEdit>> editsByUri = new LinkedHashMap<>();
  private final Map<String, String> createdFiles = new LinkedHashMap<>();

  public WorkspaceEdit add(String uri, TextEdit edit) {
    Objects.requireNonNull(uri, "uri");
    Objects.requireNonNull(edit, "edit");
    List<TextEdit> edits = editsByUri.computeIfAbsent(uri, k -> new ArrayList<>());
    for (TextEdit existing : edits) {
      if (conflicts(existing.getRange(), edit.getRange())) {
        throw new IllegalArgumentException("Edit " + edit + " overlaps " + existing + " in " + uri);
      }
    }
    edits.add(edit);
    return this;
  }

  public WorkspaceEdit addAll(String uri, List<TextEdit> edits) {
    for (TextEdit e : edits) add(uri, e);
    return this;
  }

  /** Schedule creation of a new file; edits for that uri apply to the created content. */
  public WorkspaceEdit createFile(String uri, String content) {
    if (createdFiles.putIfAbsent(Objects.requireNonNull(uri), Objects.requireNonNull(content)) != null) {
      throw new IllegalArgumentException("File " + uri + " is already scheduled for creation");
    }
    return this;
  }

  public Map<String, List<TextEdit>> getEdits() {
    Map<String, List<TextEdit>> copy = new LinkedHashMap<>();
    editsByUri.forEach((k, v) -> copy.put(k, List.copyOf(v)));
    return Collections.unmodifiableMap(copy);
  }

  public List<TextEdit> editsFor(String uri) {
    List<TextEdit> edits = editsByUri.get(uri);
    return edits == null ? List.of() : List.copyOf(edits);
  }

  public Map<String, String> getCreatedFiles() {
    return Collections.unmodifiableMap(createdFiles);
  }

  public boolean isEmpty() {
    return createdFiles.isEmpty() && editsByUri.values().stream().allMatch(List::isEmpty);
  }

  public int size() {
    return editsByUri.values().stream().mapToInt(List::size).sum();
  }

  private static boolean conflicts(Range a, Range b) {
    // two edits starting at the same place have no defined order
    return a.overlaps(b) || a.start.equals(b.start);
  }

  @Override
  public String toString() {
    return "WorkspaceEdit{edits=" + editsByUri + ", created=" + createdFiles.keySet() + "}";
  }
}
