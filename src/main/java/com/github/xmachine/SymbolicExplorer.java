package com.github.xmachine;

import java.util.ArrayDeque;
import java.util.Deque;
import java.util.HashSet;
import java.util.List;
import java.util.Objects;
import java.util.Set;

import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import com.github.xmachine.ExplorationResult.Outcome;

/**
 * Memory-aware breadth-first search over (state, memory) configurations.
 *
 * Notes:<br>
 * 1. the frontier is a strict FIFO queue and inputs are tried in alphabet order, so the first
 * witness found is of minimum length and ties go to the lexicographically smallest input
 * sequence. Never reorder it.<br>
 *
 * 2. configurations are deduplicated on equality, so cycles in the control graph or in memory do
 * not cause re-expansion. Memory may still be unbounded, which is why every search carries an
 * {@link ExplorationBudget}. Running out of budget is reported as {@link Outcome#EXHAUSTED}, never
 * as {@link Outcome#UNREACHABLE}.<br>
 *
 * 3. values are not solved for symbolically. Every guard is evaluated on concrete memory reached
 * by simulation.<br>
 *
 * 4. one instance may serve concurrent searches; all per-search data lives on the stack.<br>
 */
public final class SymbolicExplorer<S, I, O, M> {
  private static final Logger logger = LogManager.getLogger(SymbolicExplorer.class.getSimpleName());

  private final ModelOracle<S, I, O, M> oracle;
  private final GenerationStatistics statistics;

  public SymbolicExplorer(final XMachine<S, I, O, M> machine) throws XMachineException {
    this(new ModelOracle<>(machine, true, null), null);
  }

  SymbolicExplorer(final ModelOracle<S, I, O, M> oracle, final GenerationStatistics statistics) {
    this.oracle = oracle;
    this.statistics = statistics;
  }

  /**
   * Reachability mode: shortest input sequence, ending with the given input, whose last step is
   * accepted from the given state.
   */
  public ExplorationResult<S, I, O, M> findEnabling(final S state, final I input,
      final ExplorationBudget budget) throws XMachineException {
    final ExplorationResult<S, I, O, M> result = search(node -> {
      final Configuration<S, M> configuration = node.getConfiguration();
      if (!Objects.equals(configuration.getState(), state)) {
        return null;
      }
      final ProcessingResult<S, O, M> probe = oracle.apply(configuration, input);
      if (probe.isRejected()) {
        return null;
      }
      return node.child(input, probe.getOutput(),
          oracle.configuration(probe.getNextState(), probe.getMemory()));
    }, budget, null);
    if (logger.isDebugEnabled()) {
      logger.debug(String.format("Enabling search for (%s, %s): %s", state, input, result));
    }
    return result;
  }

  /**
   * Witness synthesis mode: shortest input sequence reaching any configuration of the given state.
   */
  public ExplorationResult<S, I, O, M> findState(final S state, final ExplorationBudget budget)
      throws XMachineException {
    final ExplorationResult<S, I, O, M> result = search(
        node -> Objects.equals(node.getConfiguration().getState(), state) ? node : null, budget,
        null);
    if (logger.isDebugEnabled()) {
      logger.debug(String.format("State search for %s: %s", state, result));
    }
    return result;
  }

  /**
   * Enumerate the whole reachable configuration space within the budget, reporting every probe of
   * the processing function to the listener in BFS order. There is no goal, so the outcome is
   * either UNREACHABLE (the space was enumerated completely) or EXHAUSTED.
   */
  ExplorationResult<S, I, O, M> explore(final ExplorationBudget budget,
      final ProbeListener<S, I, O, M> listener) throws XMachineException {
    return search(null, budget, listener);
  }

  private ExplorationResult<S, I, O, M> search(final Goal<S, I, O, M> goal,
      final ExplorationBudget budget, final ProbeListener<S, I, O, M> listener)
      throws XMachineException {
    final List<I> inputs = oracle.inputs();
    final Set<Configuration<S, M>> seen = new HashSet<>();
    final Deque<SearchNode<S, I, O, M>> frontier = new ArrayDeque<>();
    final SearchNode<S, I, O, M> root = SearchNode.root(oracle.initialConfiguration());
    seen.add(root.getConfiguration());
    frontier.add(root);
    boolean truncated = false;

    while (!frontier.isEmpty()) {
      final SearchNode<S, I, O, M> node = frontier.poll();
      if (goal != null) {
        final SearchNode<S, I, O, M> reached = goal.test(node);
        if (reached != null) {
          return finish(Outcome.FOUND, reached, seen.size(), budget);
        }
      }
      final boolean expandable = node.getDepth() < budget.getMaxDepth();
      for (int inputIndex = 0; inputIndex < inputs.size(); inputIndex++) {
        final I input = inputs.get(inputIndex);
        final ProcessingResult<S, O, M> result = oracle.apply(node.getConfiguration(), input);
        if (listener != null) {
          listener.probed(node, inputIndex, result);
        }
        if (result.isRejected()) {
          continue;
        }
        final Configuration<S, M> next =
            oracle.configuration(result.getNextState(), result.getMemory());
        if (seen.contains(next)) {
          continue;
        }
        if (!expandable || seen.size() >= budget.getMaxConfigurations()) {
          truncated = true;
          continue;
        }
        seen.add(next);
        frontier.add(node.child(input, result.getOutput(), next));
      }
    }
    return finish(truncated ? Outcome.EXHAUSTED : Outcome.UNREACHABLE, null, seen.size(), budget);
  }

  private ExplorationResult<S, I, O, M> finish(final Outcome outcome,
      final SearchNode<S, I, O, M> node, final int explored, final ExplorationBudget budget) {
    if (statistics != null) {
      statistics.searches.incrementAndGet();
      statistics.configurationsExplored.addAndGet(explored);
      if (outcome == Outcome.EXHAUSTED) {
        statistics.exhaustedSearches.incrementAndGet();
      }
    }
    return new ExplorationResult<>(outcome, node, explored, budget);
  }

  /**
   * Returns the node that satisfies the goal, possibly one step beyond the tested node, or null.
   */
  @FunctionalInterface
  private static interface Goal<S, I, O, M> {
    SearchNode<S, I, O, M> test(final SearchNode<S, I, O, M> node) throws XMachineException;
  }

  /**
   * Callback for every apply() issued while expanding a node.
   */
  @FunctionalInterface
  static interface ProbeListener<S, I, O, M> {
    void probed(final SearchNode<S, I, O, M> node, final int inputIndex,
        final ProcessingResult<S, O, M> result) throws XMachineException;
  }

}
