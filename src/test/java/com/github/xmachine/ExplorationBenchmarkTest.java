package com.github.xmachine;

import org.openjdk.jmh.annotations.Benchmark;

import com.github.xmachine.GeneratorConfiguration.GeneratorConfigurationBuilder;
import com.github.xmachine.KeypadDoorMachine.DoorState;
import com.github.xmachine.TestSuiteGenerator.TestSuiteGeneratorBuilder;

public class ExplorationBenchmarkTest {

  @Benchmark
  public void testPinSearch() throws XMachineException {
    final SymbolicExplorer<DoorState, String, String, String> explorer =
        new SymbolicExplorer<>(new KeypadDoorMachine());
    final ExplorationResult<DoorState, String, String, String> result = explorer.findEnabling(
        DoorState.LOCKED, KeypadDoorMachine.ENTER, new ExplorationBudget(32, 100_000));
    result.getWitness();
  }

  @Benchmark
  public void testKeypadSuite() throws XMachineException {
    final GeneratorConfiguration config =
        GeneratorConfigurationBuilder.newBuilder().workerThreads(2).build();
    final TestSuite<DoorState, String, String> suite =
        TestSuiteGeneratorBuilder.newBuilder(new KeypadDoorMachine()).config(config).build()
            .generate();
    suite.render();
  }

  public static void main(String args[]) throws XMachineException {
    ExplorationBenchmarkTest test = new ExplorationBenchmarkTest();
    test.testPinSearch();
    test.testKeypadSuite();
  }

}
