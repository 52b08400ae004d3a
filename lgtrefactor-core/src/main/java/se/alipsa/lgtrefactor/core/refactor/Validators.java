package se.alipsa.lgtrefactor.core.refactor;

import org.jetbrains.annotations.Nullable;
import se.alipsa.lgtrefactor.core.host.UserInput;
import se.alipsa.lgtrefactor.core.scan.VariableScanner;

import java.util.regex.Pattern;

/** Input validators shared by the refactoring prompts. */
public final class Validators {

  private static final Pattern ATOM = Pattern.compile("^[a-z][a-zA-Z0-9_]*$");
  private static final Pattern FILE_NAME = Pattern.compile("^[a-zA-Z0-9_\\-.]+$");

  private Validators() {}

  public static UserInput.Validator variableName() {
    return v -> VariableScanner.isValidVariableName(v.trim())
        ? null : "Must be a valid variable name (start with an uppercase letter or underscore)";
  }

  /** Entity and predicate names: an unquoted atom. */
  public static UserInput.Validator atomName() {
    return v -> ATOM.matcher(v.trim()).matches()
        ? null : "Must start with a lowercase letter and contain only letters, digits and underscores";
  }

  public static UserInput.Validator fileName() {
    return v -> FILE_NAME.matcher(v.trim()).matches()
        ? null : "File name may only contain letters, digits, underscores, hyphens and dots";
  }

  public static UserInput.Validator positionBetween(int min, int max) {
    return v -> {
      int p = parseInt(v);
      return p >= min && p <= max ? null : "Position must be a number between " + min + " and " + max;
    };
  }

  public static UserInput.Validator permutationOf(int n) {
    return v -> parsePermutation(v, n) != null ? null
        : "Enter each position 1.." + n + " exactly once, separated by commas";
  }

  /** Parse a comma separated 1-based permutation of {@code 1..n}, or {@code null} if it is not one. */
  public static int @Nullable [] parsePermutation(String text, int n) {
    String[] parts = text.split(",");
    if (parts.length != n) return null;
    int[] order = new int[n];
    boolean[] seen = new boolean[n];
    for (int i = 0; i < n; i++) {
      int p = parseInt(parts[i]);
      if (p < 1 || p > n || seen[p - 1]) return null;
      seen[p - 1] = true;
      order[i] = p;
    }
    return order;
  }

  /** The integer value of {@code text}, or -1 when it is not a non-negative integer. */
  public static int parseInt(String text) {
    String t = text.trim();
    if (t.isEmpty() || t.length() > 9) return -1;
    for (int i = 0; i < t.length(); i++) {
      if (!Character.isDigit(t.charAt(i))) return -1;
    }
    return Integer.parseInt(t);
  }
}
