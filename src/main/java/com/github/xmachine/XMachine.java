package com.github.xmachine;

import java.util.List;

/**
 * A Stream X-Machine: a finite state machine extended with typed memory and guarded,
 * output-producing transitions. This is the only contract the generator consumes; any type that
 * implements it can be handed to a {@link TestSuiteGenerator}.
 *
 * Notes for implementors:<br>
 * 1. {@link #apply(Object, Object, Object)} must be deterministic. For a fixed (state, memory,
 * input) triple it returns the same result every time. The generator verifies this and aborts
 * otherwise.<br>
 *
 * 2. the machine is read-only while a generation run is in progress and may be called from several
 * worker threads at once.<br>
 *
 * 3. memory handed to apply() is always a private copy obtained through
 * {@link #copyMemory(Object)}. Immutable memory types need not override it. Mutable ones must,
 * otherwise exploration branches would observe each other's updates.<br>
 *
 * 4. memory values are deduplicated through {@link #memoryKey(Object)}, which by default is the
 * memory itself and then needs a proper equals/hashCode.<br>
 *
 * @param <S> state type (Q)
 * @param <I> input symbol type (Sigma)
 * @param <O> output symbol type (Gamma)
 * @param <M> memory type (M)
 */
public interface XMachine<S, I, O, M> {

  /**
   * q0
   */
  S initialState();

  /**
   * m0
   */
  M initialMemory();

  /**
   * All declared states. States that cannot be reached from q0 are reported by the generator.
   */
  List<S> states();

  /**
   * The finite input alphabet, or the candidate inputs tried at every configuration when the real
   * alphabet is unbounded. The order of this list is the tie-breaking order of every generated
   * artifact.
   */
  List<I> inputAlphabet();

  /**
   * The processing relation. Returns {@link ProcessingResult#rejected()} when no guard holds.
   */
  ProcessingResult<S, O, M> apply(final S state, final M memory, final I input);

  default M copyMemory(final M memory) {
    return memory;
  }

  default Object memoryKey(final M memory) {
    return memory;
  }

  /**
   * Display label of a state, used by graph exports and test names.
   */
  default String label(final S state) {
    return String.valueOf(state);
  }

}
