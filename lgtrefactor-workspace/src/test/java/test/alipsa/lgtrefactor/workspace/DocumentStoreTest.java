package test.alipsa.lgtrefactor.workspace;

import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;
import se.alipsa.lgtrefactor.core.host.Document;
import se.alipsa.lgtrefactor.workspace.DocumentStore;

import java.nio.file.Files;
import java.nio.file.NoSuchFileException;
import java.nio.file.Path;

import static org.junit.jupiter.api.Assertions.*;

class DocumentStoreTest {

  @Test
  void openBufferWinsOverDisk(@TempDir Path dir) throws Exception {
    Path file = dir.resolve("a.lgt");
    Files.writeString(file, "on_disk.\n");
    String uri = file.toUri().toString();
    DocumentStore store = new DocumentStore();

    assertEquals("on_disk.", store.open(uri).lineAt(0));

    store.put(uri, "in_editor.\n");
    Document doc = store.open(uri);
    assertEquals("in_editor.", doc.lineAt(0));
    assertEquals(2, doc.lineCount());
    assertTrue(store.isOpen(uri));

    store.remove(uri);
    assertEquals("on_disk.", store.open(uri).lineAt(0));
  }

  @Test
  void existsCoversBuffersAndFiles(@TempDir Path dir) throws Exception {
    Path file = dir.resolve("a.lgt");
    Files.writeString(file, "a.\n");
    DocumentStore store = new DocumentStore();
    String unsaved = dir.resolve("unsaved.lgt").toUri().toString();

    assertTrue(store.exists(file.toUri().toString()));
    assertFalse(store.exists(unsaved));
    store.put(unsaved, "b.\n");
    assertTrue(store.exists(unsaved));
    assertFalse(store.exists(dir.toUri().toString()));
  }

  @Test
  void missingFileIsNoSuchFile(@TempDir Path dir) {
    DocumentStore store = new DocumentStore();
    String uri = dir.resolve("missing.lgt").toUri().toString();
    assertThrows(NoSuchFileException.class, () -> store.open(uri));
  }

  @Test
  void plainPathsAreAccepted(@TempDir Path dir) throws Exception {
    Path file = dir.resolve("p.lgt");
    Files.writeString(file, "p.\n");
    assertEquals(file, DocumentStore.toPath(file.toString()));
    assertEquals(file, DocumentStore.toPath(file.toUri().toString()));
    assertEquals("p.", new DocumentStore().open(file.toString()).lineAt(0));
  }
}
