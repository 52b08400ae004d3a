package se.alipsa.lgtrefactor.workspace;

import org.jetbrains.annotations.Nullable;
import se.alipsa.lgtrefactor.core.host.Document;
import se.alipsa.lgtrefactor.core.host.DocumentProvider;
import se.alipsa.lgtrefactor.core.host.TextDocument;

import java.io.IOException;
import java.net.URI;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.NoSuchFileException;
import java.nio.file.Path;
import java.util.Map;
import java.util.Objects;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Text of the documents open in the editor. Documents that are not open are read from disk, so a
 * refactoring sees the editor buffer where there is one and the saved file everywhere else.
 */
public final class DocumentStore implements DocumentProvider {
  private final Map<String, String> byUri = new ConcurrentHashMap<>();

  public void put(String uri, String text) {
    byUri.put(Objects.requireNonNull(uri), Objects.requireNonNull(text));
  }

  /** Text of an open document, null when it is not open. */
  public @Nullable String get(String uri) {
    return byUri.get(uri);
  }

  public boolean isOpen(String uri) {
    return byUri.containsKey(uri);
  }

  public void remove(String uri) {
    byUri.remove(uri);
  }

  @Override
  public Document open(String uri) throws IOException {
    String text = byUri.get(uri);
    if (text == null) {
      text = read(uri);
    }
    return TextDocument.of(uri, text);
  }

  @Override
  public boolean exists(String uri) {
    if (byUri.containsKey(uri)) return true;
    try {
      return Files.isRegularFile(toPath(uri));
    } catch (IllegalArgumentException e) {
      return false;
    }
  }

  /** Current text: the editor buffer when open, the file content otherwise. */
  String read(String uri) throws IOException {
    String open = byUri.get(uri);
    if (open != null) return open;
    Path path = toPath(uri);
    if (!Files.isRegularFile(path)) throw new NoSuchFileException(uri);
    return Files.readString(path, StandardCharsets.UTF_8);
  }

  /** {@code file:} URIs and plain paths both map to a file system path. */
  public static Path toPath(String uri) {
    if (uri.startsWith("file:")) {
      return Path.of(URI.create(uri));
    }
    return Path.of(uri);
  }
}
