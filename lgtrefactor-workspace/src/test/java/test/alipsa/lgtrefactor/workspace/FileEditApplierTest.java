package test.alipsa.lgtrefactor.workspace;

import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;
import se.alipsa.lgtrefactor.core.model.Position;
import se.alipsa.lgtrefactor.core.model.Range;
import se.alipsa.lgtrefactor.core.model.TextEdit;
import se.alipsa.lgtrefactor.core.model.WorkspaceEdit;
import se.alipsa.lgtrefactor.workspace.DocumentStore;
import se.alipsa.lgtrefactor.workspace.FileEditApplier;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.stream.Stream;

import static org.junit.jupiter.api.Assertions.*;

class FileEditApplierTest {

  @Test
  void appliesEditsAcrossFilesAndCreatesNewOnes(@TempDir Path dir) throws IOException {
    Path a = write(dir, "a.lgt", "foo(1).\nbar.\n");
    Path b = write(dir, "b.lgt", "run :- foo(1).\n");
    DocumentStore store = new DocumentStore();
    FileEditApplier applier = new FileEditApplier(store);

    WorkspaceEdit edit = new WorkspaceEdit()
        .add(a.toUri().toString(), new TextEdit(Range.of(0, 0, 0, 6), "foo(2)"))
        .add(b.toUri().toString(), new TextEdit(Range.of(0, 7, 0, 13), "foo(2)"))
        .createFile(dir.resolve("sub/c.lgt").toUri().toString(), "c.\n");

    assertTrue(applier.applyEdits(edit));
    assertEquals("foo(2).\nbar.\n", Files.readString(a));
    assertEquals("run :- foo(2).\n", Files.readString(b));
    assertEquals("c.\n", Files.readString(dir.resolve("sub/c.lgt")));
    assertNoTempFiles(dir);
  }

  @Test
  void editsOpenBufferAndSyncsStore(@TempDir Path dir) throws IOException {
    Path a = write(dir, "a.lgt", "old.\n");
    String uri = a.toUri().toString();
    DocumentStore store = new DocumentStore();
    store.put(uri, "unsaved.\n");

    assertTrue(new FileEditApplier(store).applyEdits(
        new WorkspaceEdit().add(uri, TextEdit.insert(new Position(1, 0), "more.\n"))));

    assertEquals("unsaved.\nmore.\n", store.get(uri));
    assertEquals("unsaved.\nmore.\n", Files.readString(a));
  }

  @Test
  void failedBatchChangesNothing(@TempDir Path dir) throws IOException {
    Path a = write(dir, "a.lgt", "a.\n");
    WorkspaceEdit edit = new WorkspaceEdit()
        .add(a.toUri().toString(), new TextEdit(Range.of(0, 0, 0, 1), "b"))
        .add(dir.resolve("missing.lgt").toUri().toString(), TextEdit.insert(new Position(0, 0), "x"));

    assertFalse(new FileEditApplier(new DocumentStore()).applyEdits(edit));
    assertEquals("a.\n", Files.readString(a));
    assertFalse(Files.exists(dir.resolve("missing.lgt")));
    assertNoTempFiles(dir);
  }

  @Test
  void refusesToOverwriteOnCreate(@TempDir Path dir) throws IOException {
    Path a = write(dir, "a.lgt", "keep.\n");
    WorkspaceEdit edit = new WorkspaceEdit().createFile(a.toUri().toString(), "replaced.\n");

    assertFalse(new FileEditApplier(new DocumentStore()).applyEdits(edit));
    assertEquals("keep.\n", Files.readString(a));
  }

  @Test
  void keepsCrlfLineEndings(@TempDir Path dir) throws IOException {
    Path a = write(dir, "a.lgt", "a.\r\nb.\r\n");
    WorkspaceEdit edit = new WorkspaceEdit().add(a.toUri().toString(), TextEdit.insert(new Position(1, 0), "x.\n"));

    assertTrue(new FileEditApplier(new DocumentStore()).applyEdits(edit));
    assertEquals("a.\r\nx.\r\nb.\r\n", Files.readString(a));
  }

  private static Path write(Path dir, String name, String text) throws IOException {
    Path p = dir.resolve(name);
    Files.writeString(p, text);
    return p;
  }

  private static void assertNoTempFiles(Path dir) throws IOException {
    try (Stream<Path> files = Files.walk(dir)) {
      assertTrue(files.noneMatch(p -> p.getFileName().toString().endsWith(".tmp")));
    }
  }
}
