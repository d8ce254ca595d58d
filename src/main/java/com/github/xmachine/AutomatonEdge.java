package com.github.xmachine;

import java.util.Collections;
import java.util.List;
import java.util.Objects;

/**
 * A control-level transition (from, input, output, to) of an extracted automaton.
 *
 * The primary edge of a (from, input) pair is the one observed along the shortest path; further
 * edges for the same pair are alternatives taken only under other memory values. The witness is the
 * shortest input sequence, ending with the edge's input, that exercises the edge.
 */
public final class AutomatonEdge<S, I, O> {
  private final S from;
  private final I input;
  private final O output;
  private final S to;
  private final boolean primary;
  private final List<I> witness;

  AutomatonEdge(final S from, final I input, final O output, final S to, final boolean primary,
      final List<I> witness) {
    this.from = from;
    this.input = input;
    this.output = output;
    this.to = to;
    this.primary = primary;
    this.witness = Collections.unmodifiableList(witness);
  }

  public S getFrom() {
    return from;
  }

  public I getInput() {
    return input;
  }

  public O getOutput() {
    return output;
  }

  public S getTo() {
    return to;
  }

  public boolean isPrimary() {
    return primary;
  }

  public List<I> getWitness() {
    return witness;
  }

  boolean sameLabel(final O output, final S to) {
    return Objects.equals(this.output, output) && Objects.equals(this.to, to);
  }

  @Override
  public boolean equals(Object obj) {
    if (this == obj) {
      return true;
    }
    if (!(obj instanceof AutomatonEdge)) {
      return false;
    }
    AutomatonEdge<?, ?, ?> other = (AutomatonEdge<?, ?, ?>) obj;
    return primary == other.primary && Objects.equals(from, other.from)
        && Objects.equals(input, other.input) && Objects.equals(output, other.output)
        && Objects.equals(to, other.to) && Objects.equals(witness, other.witness);
  }

  @Override
  public int hashCode() {
    return Objects.hash(from, input, output, to, primary, witness);
  }

  @Override
  public String toString() {
    return from + " --" + input + "/" + output + "--> " + to + (primary ? "" : " [guarded]");
  }
}
