package com.github.xmachine;

/**
 * A configuration discovered by a search, linked to the node it was reached from. Witness prefixes
 * are shared through the parent pointers instead of copying input lists on every branch.
 */
final class SearchNode<S, I, O, M> {
  private final Configuration<S, M> configuration;
  private final SearchNode<S, I, O, M> parent;
  private final I input;
  private final O output;
  private final int depth;

  static <S, I, O, M> SearchNode<S, I, O, M> root(final Configuration<S, M> configuration) {
    return new SearchNode<>(configuration, null, null, null, 0);
  }

  private SearchNode(final Configuration<S, M> configuration, final SearchNode<S, I, O, M> parent,
      final I input, final O output, final int depth) {
    this.configuration = configuration;
    this.parent = parent;
    this.input = input;
    this.output = output;
    this.depth = depth;
  }

  SearchNode<S, I, O, M> child(final I input, final O output,
      final Configuration<S, M> configuration) {
    return new SearchNode<>(configuration, this, input, output, depth + 1);
  }

  Configuration<S, M> getConfiguration() {
    return configuration;
  }

  SearchNode<S, I, O, M> getParent() {
    return parent;
  }

  I getInput() {
    return input;
  }

  O getOutput() {
    return output;
  }

  int getDepth() {
    return depth;
  }

  Witness<S, I, O, M> toWitness() {
    return Witness.of(this);
  }

  @Override
  public String toString() {
    return "SearchNode [configuration=" + configuration + ", depth=" + depth + "]";
  }
}
