package com.github.xmachine;

/**
 * What a generated test case checks.
 */
public enum TestKind {
  // output behavior matches the model (W-Method and guard coverage)
  CONFORMANCE,
  // an input that is not accepted in a configuration is rejected, nothing else happens
  ROBUSTNESS;
}
