package com.github.xmachine;

import java.util.ArrayList;
import java.util.Collections;
import java.util.HashMap;
import java.util.HashSet;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Set;

import com.github.xmachine.XMachineException.Code;

/**
 * The single gateway through which the generator talks to a machine model. It validates the model
 * once up front, hands a private memory copy to every apply() call, optionally invokes apply()
 * twice to catch non-deterministic models and counts queries.
 *
 * Thread-safe as long as the wrapped machine is, which is part of the {@link XMachine} contract.
 */
final class ModelOracle<S, I, O, M> {
  private final XMachine<S, I, O, M> machine;
  private final List<S> states;
  private final List<I> inputs;
  private final Map<S, Integer> stateIndex = new HashMap<>();
  private final boolean verifyDeterminism;
  private final GenerationStatistics statistics;

  ModelOracle(final XMachine<S, I, O, M> machine, final boolean verifyDeterminism,
      final GenerationStatistics statistics) throws XMachineException {
    if (machine == null) {
      throw new XMachineException(Code.INVALID_MODEL, "Machine model cannot be null");
    }
    this.machine = machine;
    this.verifyDeterminism = verifyDeterminism;
    this.statistics = statistics;
    this.inputs = validateAlphabet(machine.inputAlphabet());
    this.states = validateStates(machine.states(), machine.initialState());
    for (int i = 0; i < states.size(); i++) {
      stateIndex.put(states.get(i), i);
    }
  }

  XMachine<S, I, O, M> machine() {
    return machine;
  }

  List<S> states() {
    return states;
  }

  List<I> inputs() {
    return inputs;
  }

  int stateIndex(final S state) {
    final Integer index = stateIndex.get(state);
    return index == null ? -1 : index;
  }

  Configuration<S, M> initialConfiguration() {
    return Configuration.of(machine, machine.initialState(), machine.initialMemory());
  }

  Configuration<S, M> configuration(final S state, final M memory) {
    return Configuration.of(machine, state, memory);
  }

  ProcessingResult<S, O, M> apply(final Configuration<S, M> configuration, final I input)
      throws XMachineException {
    return apply(configuration.getState(), configuration.getMemory(), input);
  }

  ProcessingResult<S, O, M> apply(final S state, final M memory, final I input)
      throws XMachineException {
    final ProcessingResult<S, O, M> result = invoke(state, memory, input);
    if (verifyDeterminism) {
      final ProcessingResult<S, O, M> again = invoke(state, memory, input);
      if (!sameOutcome(result, again)) {
        throw new XMachineException(Code.NON_DETERMINISTIC_MODEL,
            String.format(
                "Non-deterministic processing for (state=%s, memory=%s, input=%s): %s vs %s",
                state, memory, input, result, again));
      }
    }
    if (result.isAccepted() && !stateIndex.containsKey(result.getNextState())) {
      throw new XMachineException(Code.INVALID_MODEL,
          String.format("Processing (state=%s, memory=%s, input=%s) moved to undeclared state %s",
              state, memory, input, result.getNextState()));
    }
    return result;
  }

  /**
   * Expected observations of an input sequence run from the initial configuration. Same semantics
   * as {@link MachineRunner}: a rejected input leaves the configuration as it was.
   */
  List<Observation<O>> replay(final List<I> sequence) throws XMachineException {
    final List<Observation<O>> observations = new ArrayList<>(sequence.size());
    Configuration<S, M> current = initialConfiguration();
    for (final I input : sequence) {
      final ProcessingResult<S, O, M> result = apply(current, input);
      observations.add(Observation.from(result));
      if (result.isAccepted()) {
        current = configuration(result.getNextState(), result.getMemory());
      }
    }
    return observations;
  }

  private ProcessingResult<S, O, M> invoke(final S state, final M memory, final I input)
      throws XMachineException {
    if (statistics != null) {
      statistics.modelQueries.incrementAndGet();
    }
    final ProcessingResult<S, O, M> result;
    try {
      result = machine.apply(state, machine.copyMemory(memory), input);
    } catch (RuntimeException problem) {
      throw new XMachineException(Code.MODEL_FAILURE,
          String.format("Processing failed for (state=%s, memory=%s, input=%s)", state, memory,
              input),
          problem);
    }
    if (result == null) {
      throw new XMachineException(Code.INVALID_MODEL,
          String.format("Processing returned null for (state=%s, memory=%s, input=%s)", state,
              memory, input));
    }
    return result;
  }

  private boolean sameOutcome(final ProcessingResult<S, O, M> first,
      final ProcessingResult<S, O, M> second) {
    if (first.isAccepted() != second.isAccepted()) {
      return false;
    }
    if (first.isRejected()) {
      return true;
    }
    return Objects.equals(first.getOutput(), second.getOutput())
        && Objects.equals(first.getNextState(), second.getNextState())
        && Objects.equals(machine.memoryKey(first.getMemory()),
            machine.memoryKey(second.getMemory()));
  }

  private static <I> List<I> validateAlphabet(final List<I> alphabet) throws XMachineException {
    if (alphabet == null || alphabet.isEmpty()) {
      throw new XMachineException(Code.MALFORMED_ALPHABET, "Input alphabet is null or empty");
    }
    final Set<I> seen = new HashSet<>();
    for (final I input : alphabet) {
      if (input == null) {
        throw new XMachineException(Code.MALFORMED_ALPHABET,
            "Input alphabet contains a null symbol: " + alphabet);
      }
      if (!seen.add(input)) {
        throw new XMachineException(Code.MALFORMED_ALPHABET,
            "Input alphabet contains duplicate symbol " + input + ": " + alphabet);
      }
    }
    return Collections.unmodifiableList(new ArrayList<>(alphabet));
  }

  private static <S> List<S> validateStates(final List<S> declared, final S initialState)
      throws XMachineException {
    if (declared == null || declared.isEmpty()) {
      throw new XMachineException(Code.INVALID_MODEL, "Declared states are null or empty");
    }
    final Set<S> seen = new HashSet<>();
    for (final S state : declared) {
      if (state == null || !seen.add(state)) {
        throw new XMachineException(Code.INVALID_MODEL,
            "Declared states contain a null or duplicate state: " + declared);
      }
    }
    if (initialState == null || !seen.contains(initialState)) {
      throw new XMachineException(Code.INVALID_MODEL,
          "Initial state " + initialState + " is not one of the declared states " + declared);
    }
    return Collections.unmodifiableList(new ArrayList<>(declared));
  }

}
