package com.github.xmachine;

import java.util.Objects;

/**
 * A (state, memory) pair, the unit of exploration. Two configurations are equal iff their states
 * are equal and their memory keys are equal. The memory itself is never mutated after the
 * configuration is created.
 */
public final class Configuration<S, M> {
  private final S state;
  private final M memory;
  private final Object memoryKey;

  private Configuration(final S state, final M memory, final Object memoryKey) {
    this.state = state;
    this.memory = memory;
    this.memoryKey = memoryKey;
  }

  static <S, M> Configuration<S, M> of(final XMachine<S, ?, ?, M> machine, final S state,
      final M memory) {
    return new Configuration<>(state, memory, machine.memoryKey(memory));
  }

  public S getState() {
    return state;
  }

  public M getMemory() {
    return memory;
  }

  @Override
  public boolean equals(Object o) {
    if (this == o) {
      return true;
    }
    if (!(o instanceof Configuration)) {
      return false;
    }
    Configuration<?, ?> other = (Configuration<?, ?>) o;
    return Objects.equals(state, other.state) && Objects.equals(memoryKey, other.memoryKey);
  }

  @Override
  public int hashCode() {
    return Objects.hash(state, memoryKey);
  }

  @Override
  public String toString() {
    return "(" + state + ", " + memory + ")";
  }
}
