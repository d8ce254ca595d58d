package com.github.xmachine;

/**
 * Outcome of one configuration search. An exhausted search says nothing about reachability; only
 * {@link Outcome#UNREACHABLE} is a proof.
 */
public final class ExplorationResult<S, I, O, M> {

  public static enum Outcome {
    // goal met, witness is of minimum length
    FOUND,
    // frontier emptied without any configuration being cut off by the budget
    UNREACHABLE,
    // the budget cut the search short
    EXHAUSTED;
  }

  private final Outcome outcome;
  private final SearchNode<S, I, O, M> node;
  private final Witness<S, I, O, M> witness;
  private final int exploredConfigurations;
  private final ExplorationBudget budget;

  ExplorationResult(final Outcome outcome, final SearchNode<S, I, O, M> node,
      final int exploredConfigurations, final ExplorationBudget budget) {
    this.outcome = outcome;
    this.node = node;
    this.witness = node == null ? null : node.toWitness();
    this.exploredConfigurations = exploredConfigurations;
    this.budget = budget;
  }

  public Outcome getOutcome() {
    return outcome;
  }

  public boolean isFound() {
    return outcome == Outcome.FOUND;
  }

  public boolean isExhausted() {
    return outcome == Outcome.EXHAUSTED;
  }

  /**
   * Null unless the outcome is FOUND.
   */
  public Witness<S, I, O, M> getWitness() {
    return witness;
  }

  SearchNode<S, I, O, M> getNode() {
    return node;
  }

  public int getExploredConfigurations() {
    return exploredConfigurations;
  }

  public ExplorationBudget getBudget() {
    return budget;
  }

  @Override
  public String toString() {
    return "ExplorationResult [outcome=" + outcome + ", witness=" + witness
        + ", exploredConfigurations=" + exploredConfigurations + ", budget=" + budget + "]";
  }
}
