package se.alipsa.lgtrefactor.core.model;

import java.util.Locale;
import java.util.Optional;
import java.util.Set;

/** The three entity kinds and the relations each one may declare in its opening directive. */
public enum EntityKind {
  OBJECT(Set.of("implements", "imports", "extends", "instantiates", "specializes")),
  PROTOCOL(Set.of("extends")),
  CATEGORY(Set.of("implements", "extends", "complements"));

  /** Every relation keyword any entity kind may declare. */
  public static final Set<String> ALL_RELATIONS =
      Set.of("implements", "imports", "extends", "instantiates", "specializes", "complements");

  private final Set<String> relations;

  EntityKind(Set<String> relations) {
    this.relations = relations;
  }

  public String keyword() {
    return name().toLowerCase(Locale.ROOT);
  }

  /** The keyword with its indefinite article: "an object", "a protocol". */
  public String withArticle() {
    return (this == OBJECT ? "an " : "a ") + keyword();
  }

  public String endDirective() {
    return ":- end_" + keyword() + ".";
  }

  public boolean supportsRelation(String relation) {
    return relations.contains(relation);
  }

  public static Optional<EntityKind> fromKeyword(String keyword) {
    for (EntityKind k : values()) {
      if (k.keyword().equals(keyword)) return Optional.of(k);
    }
    return Optional.empty();
  }
}
