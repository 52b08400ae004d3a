package se.alipsa.lgtrefactor.core.locate;

import org.jetbrains.annotations.Nullable;
import se.alipsa.lgtrefactor.core.model.Location;

import java.util.List;
import java.util.Optional;

/** Aggregated, deduplicated locations of one symbol. */
public final class References {
  private final @Nullable Location declaration;
  private final @Nullable Location definition;
  private final List<Location> locations;

  References(@Nullable Location declaration, @Nullable Location definition, List<Location> locations) {
    this.declaration = declaration;
    this.definition = definition;
    this.locations = List.copyOf(locations);
  }

  public Optional<Location> getDeclaration() { return Optional.ofNullable(declaration); }

  public Optional<Location> getDefinition() { return Optional.ofNullable(definition); }

  /** Declaration first, then definition, implementations and call sites; unique per file and line. */
  public List<Location> getLocations() { return locations; }

  public boolean isEmpty() { return locations.isEmpty(); }

  public boolean isDeclaration(Location location) {
    return declaration != null && declaration.getUri().equals(location.getUri())
        && declaration.getLine() == location.getLine();
  }

  @Override
  public String toString() {
    return "References{declaration=" + declaration + ", definition=" + definition + ", " + locations.size() + " locations}";
  }
}
