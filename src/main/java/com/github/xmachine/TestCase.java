package com.github.xmachine;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Objects;

/**
 * One generated test: an input sequence applied from the initial configuration, and the
 * observation expected after each input.
 */
public final class TestCase<I, O> {
  private final String name;
  private final TestKind kind;
  private final List<I> inputs;
  private final List<Observation<O>> expectedOutputs;

  TestCase(final String name, final TestKind kind, final List<I> inputs,
      final List<Observation<O>> expectedOutputs) {
    if (inputs.size() != expectedOutputs.size()) {
      throw new IllegalArgumentException("Expected one observation per input: " + inputs + " vs "
          + expectedOutputs);
    }
    this.name = name;
    this.kind = kind;
    this.inputs = Collections.unmodifiableList(new ArrayList<>(inputs));
    this.expectedOutputs = Collections.unmodifiableList(new ArrayList<>(expectedOutputs));
  }

  TestCase<I, O> rename(final String name) {
    return new TestCase<>(name, kind, inputs, expectedOutputs);
  }

  public String getName() {
    return name;
  }

  public TestKind getKind() {
    return kind;
  }

  public List<I> getInputs() {
    return inputs;
  }

  public List<Observation<O>> getExpectedOutputs() {
    return expectedOutputs;
  }

  public int length() {
    return inputs.size();
  }

  /**
   * Index of the first observation that differs from the expected one, or -1 when all match. A
   * shorter observed list diverges at its end.
   */
  public int firstDivergence(final List<Observation<O>> observed) {
    for (int index = 0; index < expectedOutputs.size(); index++) {
      if (index >= observed.size() || !expectedOutputs.get(index).equals(observed.get(index))) {
        return index;
      }
    }
    return observed.size() > expectedOutputs.size() ? expectedOutputs.size() : -1;
  }

  @Override
  public boolean equals(Object obj) {
    if (this == obj) {
      return true;
    }
    if (!(obj instanceof TestCase)) {
      return false;
    }
    TestCase<?, ?> other = (TestCase<?, ?>) obj;
    return kind == other.kind && Objects.equals(name, other.name)
        && Objects.equals(inputs, other.inputs)
        && Objects.equals(expectedOutputs, other.expectedOutputs);
  }

  @Override
  public int hashCode() {
    return Objects.hash(name, kind, inputs, expectedOutputs);
  }

  @Override
  public String toString() {
    return name + " [" + kind + "] " + inputs + " -> " + expectedOutputs;
  }
}
