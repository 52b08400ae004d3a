package se.alipsa.lgtrefactor.core.refactor.extract;

import se.alipsa.lgtrefactor.core.RefactorSettings;
import se.alipsa.lgtrefactor.core.model.EntityKind;

import java.time.Clock;
import java.time.LocalDate;

/** Source text of a new entity with an info/1 directive. */
public final class EntityTemplate {

  private EntityTemplate() {}

  /**
   * @param identifier the entity identifier as written, e.g. {@code stack} or {@code stack(_T_)}
   * @param body code placed between the info directive and the closing directive, may be empty
   */
  public static String render(EntityKind kind, String identifier, String body, RefactorSettings settings, Clock clock) {
    String indent = settings.indent();
    StringBuilder sb = new StringBuilder();
    sb.append(":- ").append(kind.keyword()).append('(').append(identifier).append(").\n\n");
    sb.append(indent).append(":- info([\n");
    sb.append(indent).append(indent).append("version is ").append(settings.entityVersion()).append(",\n");
    sb.append(indent).append(indent).append("author is ").append(quote(settings.author())).append(",\n");
    sb.append(indent).append(indent).append("date is ").append(LocalDate.now(clock)).append(",\n");
    sb.append(indent).append(indent).append("comment is ").append(quote(settings.entityComment(kind))).append('\n');
    sb.append(indent).append("]).\n\n");
    if (!body.isBlank()) sb.append(body).append("\n\n");
    sb.append(kind.endDirective()).append("\n");
    return sb.toString();
  }

  static String quote(String text) {
    return "'" + text.replace("'", "''") + "'";
  }
}
