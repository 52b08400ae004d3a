package se.alipsa.lgtrefactor.core.host;

import org.jetbrains.annotations.Nullable;

import java.util.List;
import java.util.Optional;

/** User prompts. An empty result means the user cancelled. */
public interface UserInput {

  Optional<String> promptChoice(String title, List<String> options);

  Optional<String> promptText(String prompt, String placeholder, Validator validator);

  /** Returns an error message for invalid input, or {@code null} when the value is acceptable. */
  @FunctionalInterface
  interface Validator {
    @Nullable String validate(String value);

    Validator ANY = value -> null;
  }

  /** Always cancels; for hosts without interactive input. */
  UserInput CANCEL = new UserInput() {
    @Override public Optional<String> promptChoice(String title, List<String> options) { return Optional.empty(); }
    @Override public Optional<String> promptText(String prompt, String placeholder, Validator validator) { return Optional.empty(); }
  };
}
