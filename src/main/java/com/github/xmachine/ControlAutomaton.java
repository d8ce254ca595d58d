package com.github.xmachine;

import java.util.ArrayList;
import java.util.Collections;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

import net.automatalib.automata.transducers.impl.compact.CompactMealy;
import net.automatalib.words.Alphabet;
import net.automatalib.words.impl.Alphabets;

/**
 * The finite control automaton of an {@link XMachine}: reachable states under dense integer ids (in
 * declared order), one {@link Cell} per (state, input) holding the primary successor and output,
 * and the full edge list. Memory is abstracted away.
 *
 * An undefined (state, input) pair behaves as a rejecting self-loop, which is exactly how a machine
 * reacts to a rejected input.
 */
public final class ControlAutomaton<S, I, O> {
  static final int UNDEFINED = -1;

  private final List<S> states;
  private final List<String> labels;
  private final List<I> inputs;
  private final Map<S, Integer> stateIds = new HashMap<>();
  private final Map<I, Integer> inputIds = new HashMap<>();
  private final int initial;
  private final List<List<Cell<I, O>>> cells;
  private final List<List<I>> accessSequences;
  private final List<AutomatonEdge<S, I, O>> edges;

  ControlAutomaton(final List<S> states, final List<String> labels, final List<I> inputs,
      final int initial, final List<List<Cell<I, O>>> cells,
      final List<List<I>> accessSequences, final List<AutomatonEdge<S, I, O>> edges) {
    this.states = Collections.unmodifiableList(new ArrayList<>(states));
    this.labels = Collections.unmodifiableList(new ArrayList<>(labels));
    this.inputs = inputs;
    this.initial = initial;
    this.cells = Collections.unmodifiableList(new ArrayList<>(cells));
    this.accessSequences = Collections.unmodifiableList(new ArrayList<>(accessSequences));
    this.edges = Collections.unmodifiableList(new ArrayList<>(edges));
    for (int id = 0; id < states.size(); id++) {
      stateIds.put(states.get(id), id);
    }
    for (int id = 0; id < inputs.size(); id++) {
      inputIds.put(inputs.get(id), id);
    }
  }

  public int size() {
    return states.size();
  }

  public List<S> getStates() {
    return states;
  }

  public List<I> getInputs() {
    return inputs;
  }

  public S getInitialState() {
    return states.get(initial);
  }

  int initialId() {
    return initial;
  }

  public S state(final int id) {
    return states.get(id);
  }

  /**
   * Dense id of a state, -1 if the state is not part of the automaton.
   */
  public int idOf(final S state) {
    final Integer id = stateIds.get(state);
    return id == null ? UNDEFINED : id;
  }

  public String label(final int id) {
    return labels.get(id);
  }

  public boolean isDefined(final int state, final int input) {
    return cell(state, input).isDefined();
  }

  public int successor(final int state, final int input) {
    return cell(state, input).getSuccessor();
  }

  public O output(final int state, final int input) {
    return cell(state, input).getOutput();
  }

  /**
   * What the automaton shows for an input, rejection included.
   */
  Observation<O> observe(final int state, final int input) {
    return isDefined(state, input) ? Observation.of(output(state, input)) : Observation.rejected();
  }

  /**
   * Successor under the completion rule: an undefined transition stays put.
   */
  int next(final int state, final int input) {
    return isDefined(state, input) ? successor(state, input) : state;
  }

  List<Observation<O>> run(final int start, final List<I> sequence) {
    final List<Observation<O>> observations = new ArrayList<>(sequence.size());
    int current = start;
    for (final I symbol : sequence) {
      final int input = inputIds.get(symbol);
      observations.add(observe(current, input));
      current = next(current, input);
    }
    return observations;
  }

  /**
   * Shortest concrete input sequence from the initial configuration reaching the state.
   */
  public List<I> getAccessSequence(final int state) {
    return accessSequences.get(state);
  }

  /**
   * Input prefixes leading to configurations of the state that reject the input, shortest first.
   * Empty if no such configuration was discovered.
   */
  List<List<I>> getRejectingAccesses(final int state, final int input) {
    return cell(state, input).getRejectingAccesses();
  }

  public List<AutomatonEdge<S, I, O>> getEdges() {
    return edges;
  }

  public boolean isComplete() {
    return undefinedTransitions().isEmpty();
  }

  /**
   * (state id, input index) pairs without any control-level transition, in table order.
   */
  List<int[]> undefinedTransitions() {
    final List<int[]> undefined = new ArrayList<>();
    for (int state = 0; state < states.size(); state++) {
      for (int input = 0; input < inputs.size(); input++) {
        if (!isDefined(state, input)) {
          undefined.add(new int[] {state, input});
        }
      }
    }
    return undefined;
  }

  /**
   * The automaton as a complete Mealy machine over observations, state ids preserved. Undefined
   * pairs become self-loops that output a rejection.
   */
  CompactMealy<I, Observation<O>> toMealy() {
    final Alphabet<I> alphabet = Alphabets.fromList(inputs);
    final CompactMealy<I, Observation<O>> mealy = new CompactMealy<>(alphabet);
    for (int state = 0; state < states.size(); state++) {
      mealy.addState();
    }
    mealy.setInitialState(Integer.valueOf(initial));
    for (int state = 0; state < states.size(); state++) {
      for (int input = 0; input < inputs.size(); input++) {
        mealy.addTransition(Integer.valueOf(state), inputs.get(input),
            Integer.valueOf(next(state, input)), observe(state, input));
      }
    }
    return mealy;
  }

  private Cell<I, O> cell(final int state, final int input) {
    return cells.get(state).get(input);
  }

  @Override
  public String toString() {
    return "ControlAutomaton [states=" + labels + ", initial=" + labels.get(initial) + ", edges="
        + edges + "]";
  }

  /**
   * Everything known about one (state, input) pair: the primary transition, if any, and where the
   * pair was seen rejected.
   */
  static final class Cell<I, O> {
    private final int successor;
    private final O output;
    private final List<List<I>> rejectingAccesses;

    Cell(final int successor, final O output, final List<List<I>> rejectingAccesses) {
      this.successor = successor;
      this.output = output;
      this.rejectingAccesses = Collections.unmodifiableList(new ArrayList<>(rejectingAccesses));
    }

    boolean isDefined() {
      return successor != UNDEFINED;
    }

    int getSuccessor() {
      return successor;
    }

    O getOutput() {
      return output;
    }

    List<List<I>> getRejectingAccesses() {
      return rejectingAccesses;
    }
  }
}
