package com.github.xmachine;

import java.util.Objects;

/**
 * What a single step of a machine shows to the outside: either the produced output or the fact
 * that the input was rejected. Test cases carry one observation per input.
 */
public final class Observation<O> {
  private final boolean rejected;
  private final O output;

  private Observation(final boolean rejected, final O output) {
    this.rejected = rejected;
    this.output = output;
  }

  public static <O> Observation<O> of(final O output) {
    return new Observation<>(false, output);
  }

  public static <O> Observation<O> rejected() {
    return new Observation<>(true, null);
  }

  static <O> Observation<O> from(final ProcessingResult<?, O, ?> result) {
    return result.isAccepted() ? of(result.getOutput()) : rejected();
  }

  public boolean isRejected() {
    return rejected;
  }

  public O getOutput() {
    return output;
  }

  @Override
  public boolean equals(Object o) {
    if (this == o) {
      return true;
    }
    if (!(o instanceof Observation)) {
      return false;
    }
    Observation<?> other = (Observation<?>) o;
    return rejected == other.rejected && Objects.equals(output, other.output);
  }

  @Override
  public int hashCode() {
    return Objects.hash(rejected, output);
  }

  @Override
  public String toString() {
    return rejected ? "REJECTED" : String.valueOf(output);
  }
}
