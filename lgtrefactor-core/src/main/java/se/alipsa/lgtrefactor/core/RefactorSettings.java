package se.alipsa.lgtrefactor.core;

import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.jetbrains.annotations.Nullable;
import se.alipsa.lgtrefactor.core.model.EntityKind;

import java.io.IOException;
import java.io.InputStream;
import java.io.Reader;
import java.io.UncheckedIOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.Properties;

/**
 * Refactoring settings. Values come from the bundled {@value #DEFAULTS_RESOURCE}, then an
 * optional user properties file, then {@code lgtrefactor.*} system properties.
 */
public final class RefactorSettings {

  private static final Logger logger = LogManager.getLogger(RefactorSettings.class);

  public static final String DEFAULTS_RESOURCE = "lgtrefactor-defaults.properties";
  public static final String PREFIX = "lgtrefactor.";

  public static final String AUTHOR = PREFIX + "author";
  public static final String INDENT = PREFIX + "indent";
  public static final String ENTITY_VERSION = PREFIX + "entity.version";
  public static final String INCLUDE_EXTENSIONS = PREFIX + "include.extensions";
  public static final String ARGUMENT_DESCRIPTION = PREFIX + "argument.description";
  public static final String ENTITY_COMMENT = PREFIX + "entity.comment";

  private final Properties props;

  private RefactorSettings(Properties props) {
    this.props = props;
  }

  /** Bundled defaults only. */
  public static RefactorSettings defaults() {
    return new RefactorSettings(loadDefaults());
  }

  /** Defaults overridden by {@code overrides}. */
  public static RefactorSettings of(Properties overrides) {
    Properties p = loadDefaults();
    p.putAll(overrides);
    return new RefactorSettings(p);
  }

  /** Defaults, then the user file when present, then system properties. */
  public static RefactorSettings load(@Nullable Path userFile) {
    Properties p = loadDefaults();
    if (userFile != null && Files.isRegularFile(userFile)) {
      try (Reader reader = Files.newBufferedReader(userFile, StandardCharsets.UTF_8)) {
        p.load(reader);
        logger.debug("Loaded settings from {}", userFile);
      } catch (IOException e) {
        logger.warn("Could not read settings file {}, using defaults", userFile, e);
      }
    }
    for (String name : System.getProperties().stringPropertyNames()) {
      if (name.startsWith(PREFIX)) p.setProperty(name, System.getProperty(name));
    }
    return new RefactorSettings(p);
  }

  private static Properties loadDefaults() {
    Properties p = new Properties();
    try (InputStream in = RefactorSettings.class.getClassLoader().getResourceAsStream(DEFAULTS_RESOURCE)) {
      if (in == null) throw new IllegalStateException(DEFAULTS_RESOURCE + " missing from the classpath");
      p.load(in);
    } catch (IOException e) {
      throw new UncheckedIOException("Failed to read " + DEFAULTS_RESOURCE, e);
    }
    return p;
  }

  public RefactorSettings with(String key, String value) {
    Properties p = new Properties();
    p.putAll(props);
    p.setProperty(key, value);
    return new RefactorSettings(p);
  }

  public String get(String key, String fallback) {
    return props.getProperty(key, fallback);
  }

  /** Author for generated entity info; "Author" when unset. */
  public String author() {
    String a = get(AUTHOR, "").trim();
    return a.isEmpty() ? "Author" : a;
  }

  /** One level of indentation, tab by default. Accepts {@code \t} escapes. */
  public String indent() {
    return get(INDENT, "\t").replace("\\t", "\t");
  }

  public String entityVersion() {
    return get(ENTITY_VERSION, "1:0:0").trim();
  }

  /** Extensions tried, in order, when resolving an include/1 file without one. */
  public List<String> includeExtensions() {
    List<String> exts = new ArrayList<>();
    for (String e : get(INCLUDE_EXTENSIONS, "lgt,logtalk,pl,prolog").split(",")) {
      String t = e.trim().toLowerCase(Locale.ROOT);
      if (t.startsWith(".")) t = t.substring(1);
      if (!t.isEmpty()) exts.add(t);
    }
    return exts;
  }

  /** Description written for new {@code arguments} entries. */
  public String argumentDescription() {
    return get(ARGUMENT_DESCRIPTION, "");
  }

  /** Comment for generated entity info, {@code {kind}} replaced by the entity keyword. */
  public String entityComment(EntityKind kind) {
    return get(ENTITY_COMMENT, "Extracted {kind} entity").replace("{kind}", kind.keyword());
  }
}
