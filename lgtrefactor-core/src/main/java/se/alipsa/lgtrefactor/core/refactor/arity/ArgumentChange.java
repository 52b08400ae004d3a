package se.alipsa.lgtrefactor.core.refactor.arity;

import se.alipsa.lgtrefactor.core.scan.ArgumentList;

import java.util.Arrays;
import java.util.Objects;
import java.util.Optional;

/**
 * A positional change to an argument or parameter list: insert at a position, remove a
 * position, or permute. Positions given to the factories are 1-based, as the user types them.
 */
public abstract class ArgumentChange {

  public static ArgumentChange insert(int position, String value) {
    return new Insert(position, value);
  }

  public static ArgumentChange remove(int position) {
    return new Remove(position);
  }

  /** {@code newOrder[i]} is the 1-based old position of the argument placed at new position {@code i + 1}. */
  public static ArgumentChange reorder(int[] newOrder) {
    return new Reorder(newOrder);
  }

  public abstract int newArity(int arity);

  public abstract boolean isIdentity();

  /** Apply to a list holding the pre-change arguments. */
  public abstract void applyTo(ArgumentList args);

  /** The same change inserting {@code value} instead; removals and permutations are unaffected. */
  public ArgumentChange forValue(String value) {
    return this;
  }

  /** The value an insertion adds; empty for removals and permutations. */
  public Optional<String> insertedValue() {
    return Optional.empty();
  }

  /** {@code name(Args)} for the changed list, or the bare name when no arguments remain. */
  public String render(String name, ArgumentList args) {
    if (args.isEmpty()) return name;
    return name + "(" + args.render() + ")";
  }

  /** Apply and render in one step; {@code args} is modified. */
  public String rewrite(String name, ArgumentList args) {
    applyTo(args);
    return render(name, args);
  }

  /** Past-tense summary for messages, e.g. "added argument Y at position 2". */
  public abstract String describe();

  static final class Insert extends ArgumentChange {
    private final int position;
    private final String value;

    Insert(int position, String value) {
      if (position < 1) throw new IllegalArgumentException("Position must be at least 1: " + position);
      this.position = position;
      this.value = Objects.requireNonNull(value);
    }

    public int getPosition() { return position; }

    public String getValue() { return value; }

    @Override public int newArity(int arity) { return arity + 1; }

    @Override public boolean isIdentity() { return false; }

    @Override
    public void applyTo(ArgumentList args) {
      args.insert(Math.min(position, args.size() + 1) - 1, value);
    }

    @Override
    public ArgumentChange forValue(String newValue) {
      return new Insert(position, newValue);
    }

    @Override
    public Optional<String> insertedValue() {
      return Optional.of(value);
    }

    @Override public String describe() { return "added argument " + value + " at position " + position; }
  }

  static final class Remove extends ArgumentChange {
    private final int position;

    Remove(int position) {
      if (position < 1) throw new IllegalArgumentException("Position must be at least 1: " + position);
      this.position = position;
    }

    public int getPosition() { return position; }

    @Override public int newArity(int arity) { return arity - 1; }

    @Override public boolean isIdentity() { return false; }

    @Override
    public void applyTo(ArgumentList args) {
      args.remove(position - 1);
    }

    @Override public String describe() { return "removed argument at position " + position; }
  }

  static final class Reorder extends ArgumentChange {
    private final int[] order;

    Reorder(int[] newOrder) {
      this.order = newOrder.clone();
      boolean[] seen = new boolean[order.length];
      for (int p : order) {
        if (p < 1 || p > order.length || seen[p - 1]) {
          throw new IllegalArgumentException("Not a permutation of 1.." + order.length + ": " + Arrays.toString(newOrder));
        }
        seen[p - 1] = true;
      }
    }

    @Override public int newArity(int arity) { return arity; }

    @Override
    public boolean isIdentity() {
      for (int i = 0; i < order.length; i++) {
        if (order[i] != i + 1) return false;
      }
      return true;
    }

    @Override
    public void applyTo(ArgumentList args) {
      int[] zeroBased = new int[order.length];
      for (int i = 0; i < order.length; i++) zeroBased[i] = order[i] - 1;
      args.reorder(zeroBased);
    }

    @Override public String describe() { return "reordered arguments to " + Arrays.toString(order); }
  }
}
