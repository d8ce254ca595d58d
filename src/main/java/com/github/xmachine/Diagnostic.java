package com.github.xmachine;

import java.util.Objects;

/**
 * A non-fatal finding of a generation run. Generation carries on after reporting it.
 */
public final class Diagnostic {

  public static enum Kind {
    // a declared state has no discovered path from the initial state
    UNREACHABLE_STATE,
    // the control automaton is partial and no robustness tests were requested for the gaps
    INCOMPLETE_SPECIFICATION,
    // a search ran out of budget before it could settle its query
    EXPLORATION_BUDGET_EXHAUSTED;
  }

  private final Kind kind;
  private final String state;
  private final String input;
  private final String message;

  Diagnostic(final Kind kind, final String state, final String input, final String message) {
    this.kind = kind;
    this.state = state;
    this.input = input;
    this.message = message;
  }

  public Kind getKind() {
    return kind;
  }

  /**
   * Label of the state concerned, null if the finding is not about a single state.
   */
  public String getState() {
    return state;
  }

  /**
   * The input concerned, null if the finding is not about a single transition.
   */
  public String getInput() {
    return input;
  }

  public String getMessage() {
    return message;
  }

  @Override
  public boolean equals(Object obj) {
    if (this == obj) {
      return true;
    }
    if (!(obj instanceof Diagnostic)) {
      return false;
    }
    Diagnostic other = (Diagnostic) obj;
    return kind == other.kind && Objects.equals(state, other.state)
        && Objects.equals(input, other.input) && Objects.equals(message, other.message);
  }

  @Override
  public int hashCode() {
    return Objects.hash(kind, state, input, message);
  }

  @Override
  public String toString() {
    return kind + " [state=" + state + ", input=" + input + "] " + message;
  }
}
