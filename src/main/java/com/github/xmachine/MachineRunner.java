package com.github.xmachine;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.List;

import com.github.xmachine.XMachineException.Code;

/**
 * Runs an {@link XMachine} one input at a time from its initial configuration.
 *
 * A rejected input leaves state and memory untouched; the machine just refuses to move. The runner
 * replays generated tests against the model to compute expected outputs, and a consumer can use it
 * to run the same tests against a second model, e.g. a mutant, and compare.
 *
 * Not thread-safe. Use one runner per thread.
 */
public final class MachineRunner<S, I, O, M> {
  // route history is bounded
  static final int maxRouteLength = 100;

  private final XMachine<S, I, O, M> machine;
  private final Deque<S> route = new ArrayDeque<>();
  private S state;
  private M memory;
  private int steps;

  public MachineRunner(final XMachine<S, I, O, M> machine) {
    this.machine = machine;
    reset();
  }

  public void reset() {
    state = machine.initialState();
    memory = machine.initialMemory();
    steps = 0;
    route.clear();
    route.addLast(state);
  }

  /**
   * Apply one input. A null result from the machine is a broken model, reported as
   * {@link Code#INVALID_MODEL} the same way the generator reports it.
   */
  public Observation<O> step(final I input) throws XMachineException {
    final ProcessingResult<S, O, M> result =
        machine.apply(state, machine.copyMemory(memory), input);
    if (result == null) {
      throw new XMachineException(Code.INVALID_MODEL,
          String.format("Processing returned null for (state=%s, memory=%s, input=%s)", state,
              memory, input));
    }
    steps++;
    if (result.isRejected()) {
      return Observation.rejected();
    }
    state = result.getNextState();
    memory = result.getMemory();
    route.addLast(state);
    if (route.size() > maxRouteLength) {
      route.removeFirst();
    }
    return Observation.of(result.getOutput());
  }

  /**
   * Reset, then step through all inputs.
   */
  public List<Observation<O>> run(final List<I> inputs) throws XMachineException {
    reset();
    final List<Observation<O>> observations = new ArrayList<>(inputs.size());
    for (final I input : inputs) {
      observations.add(step(input));
    }
    return observations;
  }

  public S getState() {
    return state;
  }

  public M getMemory() {
    return memory;
  }

  public Configuration<S, M> getConfiguration() {
    return Configuration.of(machine, state, memory);
  }

  public int getSteps() {
    return steps;
  }

  /**
   * The last visited states, oldest first, at most {@link #maxRouteLength} of them.
   */
  public List<S> getRoute() {
    return new ArrayList<>(route);
  }

  @Override
  public String toString() {
    return "MachineRunner [state=" + state + ", memory=" + memory + ", steps=" + steps + "]";
  }
}
