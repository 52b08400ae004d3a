package se.alipsa.lgtrefactor.workspace;

import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import se.alipsa.lgtrefactor.core.host.EditApplier;
import se.alipsa.lgtrefactor.core.host.TextDocument;
import se.alipsa.lgtrefactor.core.model.TextEdit;
import se.alipsa.lgtrefactor.core.model.WorkspaceEdit;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.AtomicMoveNotSupportedException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * Applies a {@link WorkspaceEdit} to files on disk, all or nothing. New contents are computed
 * first, written to temporary siblings, and then moved over the targets. When a move fails the
 * files already replaced are restored and created files are removed.
 */
public final class FileEditApplier implements EditApplier {

  private static final Logger logger = LogManager.getLogger(FileEditApplier.class);

  private final DocumentStore store;

  public FileEditApplier(DocumentStore store) {
    this.store = Objects.requireNonNull(store);
  }

  @Override
  public boolean applyEdits(WorkspaceEdit edit) {
    Map<String, String> contents;
    try {
      contents = computeContents(edit);
    } catch (IOException | RuntimeException e) {
      logger.warn("Cannot compute edited contents: {}", e.getMessage(), e);
      return false;
    }

    List<Pending> pending = new ArrayList<>();
    try {
      for (Map.Entry<String, String> e : contents.entrySet()) {
        pending.add(stage(e.getKey(), e.getValue(), edit.getCreatedFiles().containsKey(e.getKey())));
      }
    } catch (IOException e) {
      logger.warn("Failed to stage edits: {}", e.getMessage(), e);
      pending.forEach(Pending::discard);
      return false;
    }

    List<Pending> committed = new ArrayList<>();
    for (Pending p : pending) {
      try {
        p.commit();
        committed.add(p);
      } catch (IOException e) {
        logger.error("Failed to write {}, rolling back {} file(s)", p.target, committed.size(), e);
        for (int i = committed.size() - 1; i >= 0; i--) committed.get(i).rollback();
        pending.forEach(Pending::discard);
        return false;
      }
    }

    for (Map.Entry<String, String> e : contents.entrySet()) {
      if (store.isOpen(e.getKey())) store.put(e.getKey(), e.getValue());
    }
    logger.debug("Applied {} edit(s) over {} file(s)", edit.size(), contents.size());
    return true;
  }

  private Map<String, String> computeContents(WorkspaceEdit edit) throws IOException {
    Map<String, String> contents = new LinkedHashMap<>();
    for (Map.Entry<String, String> created : edit.getCreatedFiles().entrySet()) {
      if (store.exists(created.getKey())) {
        throw new IOException("File to create already exists: " + created.getKey());
      }
      contents.put(created.getKey(), created.getValue());
    }
    for (Map.Entry<String, List<TextEdit>> e : edit.getEdits().entrySet()) {
      if (e.getValue().isEmpty()) continue;
      String uri = e.getKey();
      String base = contents.containsKey(uri) ? contents.get(uri) : store.read(uri);
      contents.put(uri, TextDocument.of(uri, base).applyEdits(e.getValue()));
    }
    return contents;
  }

  private static Pending stage(String uri, String content, boolean created) throws IOException {
    Path target = DocumentStore.toPath(uri).toAbsolutePath();
    Path dir = target.getParent();
    Files.createDirectories(dir);
    byte[] original = created ? null : Files.readAllBytes(target);
    Path temp = Files.createTempFile(dir, "." + target.getFileName(), ".tmp");
    Files.writeString(temp, content, StandardCharsets.UTF_8);
    return new Pending(target, temp, original);
  }

  /** One file waiting to be moved into place. */
  private static final class Pending {
    private final Path target;
    private final Path temp;
    private final byte[] original;

    Pending(Path target, Path temp, byte[] original) {
      this.target = target;
      this.temp = temp;
      this.original = original;
    }

    void commit() throws IOException {
      try {
        Files.move(temp, target, StandardCopyOption.REPLACE_EXISTING, StandardCopyOption.ATOMIC_MOVE);
      } catch (AtomicMoveNotSupportedException e) {
        Files.move(temp, target, StandardCopyOption.REPLACE_EXISTING);
      }
    }

    void rollback() {
      try {
        if (original == null) {
          Files.deleteIfExists(target);
        } else {
          Files.write(target, original);
        }
      } catch (IOException e) {
        logger.error("Could not restore {}", target, e);
      }
    }

    void discard() {
      try {
        Files.deleteIfExists(temp);
      } catch (IOException e) {
        logger.warn("Could not delete temporary file {}", temp, e);
      }
    }
  }
}
