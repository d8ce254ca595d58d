package com.github.xmachine;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * An input sequence together with the configurations it passes through and the outputs it
 * produces when replayed from the initial configuration. configurations has one element more than
 * inputs: the start configuration.
 */
public final class Witness<S, I, O, M> {
  private final List<I> inputs;
  private final List<O> outputs;
  private final List<Configuration<S, M>> configurations;

  private Witness(final List<I> inputs, final List<O> outputs,
      final List<Configuration<S, M>> configurations) {
    this.inputs = Collections.unmodifiableList(inputs);
    this.outputs = Collections.unmodifiableList(outputs);
    this.configurations = Collections.unmodifiableList(configurations);
  }

  /**
   * Unwind the parent chain of a search node.
   */
  static <S, I, O, M> Witness<S, I, O, M> of(final SearchNode<S, I, O, M> node) {
    final List<I> inputs = new ArrayList<>(node.getDepth());
    final List<O> outputs = new ArrayList<>(node.getDepth());
    final List<Configuration<S, M>> configurations = new ArrayList<>(node.getDepth() + 1);
    for (SearchNode<S, I, O, M> current = node; current != null; current = current.getParent()) {
      configurations.add(current.getConfiguration());
      if (current.getParent() != null) {
        inputs.add(current.getInput());
        outputs.add(current.getOutput());
      }
    }
    Collections.reverse(inputs);
    Collections.reverse(outputs);
    Collections.reverse(configurations);
    return new Witness<>(inputs, outputs, configurations);
  }

  public List<I> getInputs() {
    return inputs;
  }

  public List<O> getOutputs() {
    return outputs;
  }

  public List<Configuration<S, M>> getConfigurations() {
    return configurations;
  }

  public Configuration<S, M> getFinalConfiguration() {
    return configurations.get(configurations.size() - 1);
  }

  public int length() {
    return inputs.size();
  }

  @Override
  public String toString() {
    return "Witness [inputs=" + inputs + ", outputs=" + outputs + ", final="
        + getFinalConfiguration() + "]";
  }
}
