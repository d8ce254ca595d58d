package com.github.xmachine;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.TreeMap;
import java.util.concurrent.Callable;

import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import com.github.xmachine.Diagnostic.Kind;

/**
 * Projects an {@link XMachine} onto its finite control automaton.
 *
 * The configuration space is explored breadth-first once, and every probe of the processing
 * function is recorded per (state, input). The first accepted probe of a pair, which lies on the
 * shortest path with ties broken by input order, becomes its primary transition. Different outcomes
 * seen under other memory values are kept as guarded alternatives.
 *
 * When that exploration runs out of budget, the states it never met and the (state, input) pairs
 * it never saw accepted are settled with dedicated searches under a larger budget, one goal per
 * state or pair, on the worker pool.
 */
final class AutomatonExtractor<S, I, O, M> {
  private static final Logger logger =
      LogManager.getLogger(AutomatonExtractor.class.getSimpleName());

  private final ModelOracle<S, I, O, M> oracle;
  private final SymbolicExplorer<S, I, O, M> explorer;
  private final GeneratorConfiguration config;
  private final GoalExecutor executor;

  AutomatonExtractor(final ModelOracle<S, I, O, M> oracle,
      final SymbolicExplorer<S, I, O, M> explorer, final GeneratorConfiguration config,
      final GoalExecutor executor) {
    this.oracle = oracle;
    this.explorer = explorer;
    this.config = config;
    this.executor = executor;
  }

  ControlAutomaton<S, I, O> extract(final List<Diagnostic> diagnostics) throws XMachineException {
    final List<S> states = oracle.states();
    final List<I> inputs = oracle.inputs();
    final ProbeTable table = new ProbeTable(states.size(), inputs.size());

    // 1. one sweep over the whole configuration space
    final ExplorationResult<S, I, O, M> sweep =
        explorer.explore(config.explorationBudget(), table::record);
    final boolean exhaustive = !sweep.isExhausted();
    for (int state = 0; state < states.size(); state++) {
      if (table.seeds.get(state) != null) {
        table.probed.set(state, true);
      }
    }
    logger.info(String.format("Explored %d configurations, %s", sweep.getExploredConfigurations(),
        exhaustive ? "configuration space closed" : "budget exhausted"));

    // 2. conditionally reachable states get their own search before being given up on
    final Map<Integer, ExplorationResult<S, I, O, M>> stateSearches = new LinkedHashMap<>();
    if (!exhaustive) {
      final Map<Integer, Callable<ExplorationResult<S, I, O, M>>> goals = new LinkedHashMap<>();
      for (int state = 0; state < states.size(); state++) {
        if (table.seeds.get(state) == null) {
          final S target = states.get(state);
          goals.put(state, () -> explorer.findState(target, config.retryBudget()));
        }
      }
      stateSearches.putAll(executor.run(goals));
      for (final Map.Entry<Integer, ExplorationResult<S, I, O, M>> search : stateSearches
          .entrySet()) {
        if (search.getValue().isFound()) {
          table.seed(search.getKey(), search.getValue().getNode());
        }
      }
    }

    // 3. probe newly seeded states, settle unresolved pairs, repeat until nothing new turns up
    final boolean[] resolved = new boolean[states.size()];
    while (true) {
      table.seedEdgeTargets();
      probeSeeds(table);
      final List<Integer> fresh = new ArrayList<>();
      for (int state = 0; state < states.size(); state++) {
        if (table.seeds.get(state) != null && !resolved[state]) {
          resolved[state] = true;
          fresh.add(state);
        }
      }
      if (exhaustive || fresh.isEmpty()) {
        break;
      }
      resolvePairs(fresh, table, diagnostics);
    }

    // 4. whatever is still unseeded is unreachable
    for (int state = 0; state < states.size(); state++) {
      if (table.seeds.get(state) != null) {
        continue;
      }
      final String label = oracle.machine().label(states.get(state));
      final ExplorationResult<S, I, O, M> search = stateSearches.get(state);
      if (search != null && search.isExhausted()) {
        report(diagnostics, new Diagnostic(Kind.EXPLORATION_BUDGET_EXHAUSTED, label, null,
            "No witness reaching the state within " + search.getBudget()));
        report(diagnostics, new Diagnostic(Kind.UNREACHABLE_STATE, label, null,
            "No path from the initial state discovered within " + search.getBudget()
                + "; excluded from the state cover"));
      } else {
        report(diagnostics, new Diagnostic(Kind.UNREACHABLE_STATE, label, null,
            "Proven unreachable: the reachable configuration space was enumerated completely"
                + "; excluded from the state cover"));
      }
    }

    final ControlAutomaton<S, I, O> automaton = table.build();
    logger.info(String.format("Extracted control automaton with %d of %d states and %d edges",
        automaton.size(), states.size(), automaton.getEdges().size()));
    return automaton;
  }

  private void probeSeeds(final ProbeTable table) throws XMachineException {
    for (int state = 0; state < table.probed.size(); state++) {
      final SearchNode<S, I, O, M> seed = table.seeds.get(state);
      if (seed == null || table.probed.get(state)) {
        continue;
      }
      table.probed.set(state, true);
      for (int input = 0; input < oracle.inputs().size(); input++) {
        final I probe = oracle.inputs().get(input);
        table.record(seed, input, oracle.apply(seed.getConfiguration(), probe));
      }
    }
  }

  private void resolvePairs(final List<Integer> states, final ProbeTable table,
      final List<Diagnostic> diagnostics) throws XMachineException {
    final Map<List<Integer>, Callable<ExplorationResult<S, I, O, M>>> goals =
        new LinkedHashMap<>();
    for (final int state : states) {
      for (int input = 0; input < oracle.inputs().size(); input++) {
        if (table.probes(state, input).branches.isEmpty()) {
          final S target = oracle.states().get(state);
          final I trigger = oracle.inputs().get(input);
          goals.put(Arrays.asList(state, input),
              () -> explorer.findEnabling(target, trigger, config.retryBudget()));
        }
      }
    }
    if (goals.isEmpty()) {
      return;
    }
    logger.info(String.format("Settling %d transitions not enabled during exploration",
        goals.size()));
    for (final Map.Entry<List<Integer>, ExplorationResult<S, I, O, M>> search : executor.run(goals)
        .entrySet()) {
      final int state = search.getKey().get(0);
      final int input = search.getKey().get(1);
      final ExplorationResult<S, I, O, M> result = search.getValue();
      if (result.isFound()) {
        table.branch(state, input, result.getNode());
      } else if (result.isExhausted()) {
        report(diagnostics,
            new Diagnostic(Kind.EXPLORATION_BUDGET_EXHAUSTED,
                oracle.machine().label(oracle.states().get(state)),
                String.valueOf(oracle.inputs().get(input)),
                "Could not decide whether the transition is enabled within " + result.getBudget()));
      }
    }
  }

  private static void report(final List<Diagnostic> diagnostics, final Diagnostic diagnostic) {
    logger.warn(diagnostic.toString());
    diagnostics.add(diagnostic);
  }

  /**
   * Everything learnt about the processing function, indexed by declared state and input.
   */
  private final class ProbeTable {
    private final List<SearchNode<S, I, O, M>> seeds = new ArrayList<>();
    private final List<Boolean> probed = new ArrayList<>();
    private final List<List<Probes>> probes = new ArrayList<>();

    private ProbeTable(final int states, final int inputs) {
      for (int state = 0; state < states; state++) {
        seeds.add(null);
        probed.add(false);
        final List<Probes> row = new ArrayList<>(inputs);
        for (int input = 0; input < inputs; input++) {
          row.add(new Probes());
        }
        probes.add(row);
      }
    }

    private Probes probes(final int state, final int input) {
      return probes.get(state).get(input);
    }

    private void seed(final int state, final SearchNode<S, I, O, M> node) {
      if (seeds.get(state) == null) {
        seeds.set(state, node);
      }
    }

    private void record(final SearchNode<S, I, O, M> node, final int input,
        final ProcessingResult<S, O, M> result) {
      final int state = oracle.stateIndex(node.getConfiguration().getState());
      seed(state, node);
      if (result.isRejected()) {
        probes(state, input).reject(node);
        return;
      }
      branch(state, input, node.child(oracle.inputs().get(input), result.getOutput(),
          oracle.configuration(result.getNextState(), result.getMemory())));
    }

    private void branch(final int state, final int input, final SearchNode<S, I, O, M> end) {
      probes(state, input).branch(end);
    }

    /**
     * States only ever seen as transition targets are seeded with the shallowest configuration a
     * transition ended in, ties going to the smaller input sequence.
     */
    private void seedEdgeTargets() {
      final Comparator<List<I>> order = ConformanceTestGenerator.sequenceOrder(oracle.inputs());
      boolean changed = true;
      while (changed) {
        changed = false;
        final Map<Integer, SearchNode<S, I, O, M>> best = new LinkedHashMap<>();
        for (int state = 0; state < seeds.size(); state++) {
          if (seeds.get(state) == null) {
            continue;
          }
          for (final Probes pair : probes.get(state)) {
            for (final SearchNode<S, I, O, M> end : pair.branches) {
              final int target = oracle.stateIndex(end.getConfiguration().getState());
              if (seeds.get(target) != null) {
                continue;
              }
              final SearchNode<S, I, O, M> known = best.get(target);
              if (known == null || end.getDepth() < known.getDepth()
                  || (end.getDepth() == known.getDepth() && order
                      .compare(end.toWitness().getInputs(), known.toWitness().getInputs()) < 0)) {
                best.put(target, end);
              }
            }
          }
        }
        for (final Map.Entry<Integer, SearchNode<S, I, O, M>> target : best.entrySet()) {
          seeds.set(target.getKey(), target.getValue());
          changed = true;
        }
      }
    }

    private ControlAutomaton<S, I, O> build() {
      final List<S> declared = oracle.states();
      final List<I> inputs = oracle.inputs();
      final int[] ids = new int[declared.size()];
      final List<S> states = new ArrayList<>();
      final List<String> labels = new ArrayList<>();
      final List<List<I>> access = new ArrayList<>();
      for (int state = 0; state < declared.size(); state++) {
        ids[state] = ControlAutomaton.UNDEFINED;
        if (seeds.get(state) != null) {
          ids[state] = states.size();
          states.add(declared.get(state));
          labels.add(oracle.machine().label(declared.get(state)));
          access.add(seeds.get(state).toWitness().getInputs());
        }
      }

      final List<List<ControlAutomaton.Cell<I, O>>> cells = new ArrayList<>();
      final List<AutomatonEdge<S, I, O>> edges = new ArrayList<>();
      for (int state = 0; state < declared.size(); state++) {
        if (ids[state] == ControlAutomaton.UNDEFINED) {
          continue;
        }
        final List<ControlAutomaton.Cell<I, O>> row = new ArrayList<>(inputs.size());
        for (int input = 0; input < inputs.size(); input++) {
          final Probes pair = probes(state, input);
          int successor = ControlAutomaton.UNDEFINED;
          O output = null;
          int enablingDepth = -1;
          for (int index = 0; index < pair.branches.size(); index++) {
            final SearchNode<S, I, O, M> end = pair.branches.get(index);
            final S to = end.getConfiguration().getState();
            if (index == 0) {
              successor = ids[oracle.stateIndex(to)];
              output = end.getOutput();
              enablingDepth = end.getDepth() - 1;
            }
            edges.add(new AutomatonEdge<>(declared.get(state), inputs.get(input), end.getOutput(),
                to, index == 0, end.toWitness().getInputs()));
          }
          row.add(new ControlAutomaton.Cell<>(successor, output, pair.rejectingAccesses(
              enablingDepth)));
        }
        cells.add(row);
      }
      return new ControlAutomaton<>(states, labels, inputs,
          ids[oracle.stateIndex(oracle.machine().initialState())], cells, access, edges);
    }
  }

  /**
   * Outcomes of one (state, input) pair: the first node for every distinct (output, next state),
   * and the first rejecting configuration found at every depth.
   */
  private final class Probes {
    private final List<SearchNode<S, I, O, M>> branches = new ArrayList<>();
    private final Map<Integer, SearchNode<S, I, O, M>> rejections = new TreeMap<>();

    private void branch(final SearchNode<S, I, O, M> end) {
      for (final SearchNode<S, I, O, M> branch : branches) {
        if (Objects.equals(branch.getOutput(), end.getOutput()) && Objects
            .equals(branch.getConfiguration().getState(), end.getConfiguration().getState())) {
          return;
        }
      }
      branches.add(end);
    }

    private void reject(final SearchNode<S, I, O, M> node) {
      if (!rejections.containsKey(node.getDepth())) {
        rejections.put(node.getDepth(), node);
      }
    }

    /**
     * The shortest rejecting prefix, followed by the first one as deep as the primary transition's
     * source when that differs. The latter is where a guard on the memory the transition needs
     * turns the input away.
     */
    private List<List<I>> rejectingAccesses(final int enablingDepth) {
      final List<List<I>> accesses = new ArrayList<>();
      if (rejections.isEmpty()) {
        return accesses;
      }
      final SearchNode<S, I, O, M> shortest = rejections.values().iterator().next();
      accesses.add(shortest.toWitness().getInputs());
      final SearchNode<S, I, O, M> enabling = rejections.get(enablingDepth);
      if (enabling != null && enabling != shortest) {
        accesses.add(enabling.toWitness().getInputs());
      }
      return accesses;
    }
  }

}
