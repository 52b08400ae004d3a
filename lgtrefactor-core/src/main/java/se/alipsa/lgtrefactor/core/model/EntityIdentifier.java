package se.alipsa.lgtrefactor.core.model;

import java.util.List;
import java.util.Objects;

/** Entity name plus its parameters, kept as the source text of each parameter term. */
public final class EntityIdentifier {
  private final String name;
  private final List<String> parameters;

  public EntityIdentifier(String name, List<String> parameters) {
    this.name = Objects.requireNonNull(name, "name");
    this.parameters = List.copyOf(parameters);
  }

  public String getName() { return name; }

  public List<String> getParameters() { return parameters; }

  public int arity() { return parameters.size(); }

  public boolean isParametric() { return !parameters.isEmpty(); }

  /** Indicator-like form used in messages, e.g. {@code stack/1}. */
  public String indicator() { return name + "/" + parameters.size(); }

  public String render() {
    return parameters.isEmpty() ? name : name + "(" + String.join(", ", parameters) + ")";
  }

  @Override
  public boolean equals(Object o) {
    if (this == o) return true;
    if (!(o instanceof EntityIdentifier that)) return false;
    return name.equals(that.name) && parameters.equals(that.parameters);
  }

  @Override
  public int hashCode() {
    return Objects.hash(name, parameters);
  }

  @Override
  public String toString() {
    return render();
  }
}
