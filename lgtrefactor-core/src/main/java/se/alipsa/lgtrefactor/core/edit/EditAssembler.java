package se.alipsa.lgtrefactor.core.edit;

import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import se.alipsa.lgtrefactor.core.host.Document;
import se.alipsa.lgtrefactor.core.model.TextEdit;
import se.alipsa.lgtrefactor.core.model.WorkspaceEdit;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/** Groups line edits per document and builds the multi-file batch handed to the host. */
public final class EditAssembler {

  private static final Logger logger = LogManager.getLogger(EditAssembler.class);

  private final Map<String, LineEditBuffer> buffers = new LinkedHashMap<>();
  private final Map<String, String> createdFiles = new LinkedHashMap<>();

  /** The buffer for {@code doc}; the first document opened for a uri wins. */
  public LineEditBuffer buffer(Document doc) {
    return buffers.computeIfAbsent(doc.uri(), k -> new LineEditBuffer(doc));
  }

  public void createFile(String uri, String content) {
    if (createdFiles.putIfAbsent(uri, content) != null) {
      throw new IllegalStateException("File " + uri + " is already being created");
    }
  }

  public boolean isEmpty() {
    return createdFiles.isEmpty() && buffers.values().stream().allMatch(LineEditBuffer::isEmpty);
  }

  public WorkspaceEdit toWorkspaceEdit() {
    WorkspaceEdit edit = new WorkspaceEdit();
    createdFiles.forEach(edit::createFile);
    for (Map.Entry<String, LineEditBuffer> e : buffers.entrySet()) {
      List<TextEdit> edits = e.getValue().toTextEdits();
      for (TextEdit te : edits) {
        logger.debug("Edit {}: {}", e.getKey(), te);
      }
      edit.addAll(e.getKey(), edits);
    }
    return edit;
  }
}
