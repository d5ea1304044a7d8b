package io.github.panghy.roundengine.simulation;

import io.github.panghy.roundengine.error.InvalidArgumentException;
import io.github.panghy.roundengine.hazard.RunType;
import io.github.panghy.roundengine.outcome.OutcomeEvent;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;

public class SimulationResultsTest {

  @Test
  public void testDerivedRates() {
    SimulationResults results = new SimulationResults(100, 40, 45, 46, 11, 25, 2, 2.0);
    assertEquals(0.40, results.winRate());
    assertEquals(0.80, results.effectiveRtp());
    assertEquals(45, results.eventCount(OutcomeEvent.HIT_A));
    assertEquals(0.11, results.eventFrequency(OutcomeEvent.MISS));
    assertEquals(0.25, results.rareEventRate());
    assertEquals(0.02, results.secondEventRate());
  }

  @Test
  public void testMergeWeightsByTrials() {
    SimulationResults small = new SimulationResults(10, 10, 5, 5, 0, 0, 0, 2.0);
    SimulationResults large = new SimulationResults(90, 0, 45, 45, 0, 0, 0, 2.0);
    SimulationResults merged = small.merge(large);
    assertEquals(100, merged.trials());
    // Not the 0.5 an average of the two win rates would give
    assertEquals(0.10, merged.winRate());
  }

  @Test
  public void testMergeRejectsDifferentPayout() {
    SimulationResults a = new SimulationResults(10, 5, 5, 5, 0, 0, 0, 2.0);
    SimulationResults b = new SimulationResults(10, 5, 5, 5, 0, 0, 0, 1.9);
    assertThrows(InvalidArgumentException.class, () -> a.merge(b));
  }

  @Test
  public void testRejectsInconsistentCounts() {
    assertThrows(IllegalArgumentException.class, () -> new SimulationResults(0, 0, 0, 0, 0, 0, 0, 2.0));
    assertThrows(IllegalArgumentException.class, () -> new SimulationResults(10, 11, 5, 5, 0, 0, 0, 2.0));
    assertThrows(IllegalArgumentException.class, () -> new SimulationResults(10, 5, -1, 5, 0, 0, 0, 2.0));
    assertThrows(IllegalArgumentException.class, () -> new SimulationResults(10, 5, 5, 5, 0, -1, 0, 2.0));
    assertThrows(IllegalArgumentException.class, () -> new SimulationResults(10, 5, 5, 5, 0, 0, 11, 2.0));
    assertThrows(IllegalArgumentException.class, () -> new SimulationResults(10, 5, 5, 5, 0, 0, 0, Double.NaN));
  }

  @Test
  public void testHazardRejectsInconsistentCounts() {
    assertThrows(IllegalArgumentException.class, () -> new HazardSimulationResults(0, 0, 0, 0, 0, 0, 0.0, 1));
    assertThrows(IllegalArgumentException.class, () -> new HazardSimulationResults(10, -1, 0, 3, 5, 2, 0.0, 1));
    assertThrows(IllegalArgumentException.class, () -> new HazardSimulationResults(10, 5, -4, 3, 5, 2, 5.5, 1));
    assertThrows(IllegalArgumentException.class, () -> new HazardSimulationResults(10, 5, 5, -3, 5, 2, 5.5, 1));
    assertThrows(IllegalArgumentException.class,
        () -> new HazardSimulationResults(10, 5, 5, 3, 5, 2, Double.POSITIVE_INFINITY, 1));
    assertThrows(IllegalArgumentException.class, () -> new HazardSimulationResults(10, 5, 5, 3, 5, 2, 5.5, -1));
  }

  @Test
  public void testToString() {
    SimulationResults results = new SimulationResults(4, 2, 2, 2, 0, 1, 0, 2.0);
    assertThat(results.toString())
        .startsWith("SimulationResults{trials=4, winRate=0.5000, effectiveRtp=1.0000");
  }

  @Test
  public void testHazardResults() {
    HazardSimulationResults results = new HazardSimulationResults(10, 6, 22, 3, 5, 2, 6 * 1.331, 3);
    assertEquals(4, results.losses());
    assertEquals(0.6, results.winRate());
    assertEquals(0.4, results.lossRate());
    assertEquals(2.2, results.averageSteps(), 1e-12);
    assertEquals(0.7986, results.effectiveRtp(), 1e-9);
    assertEquals(5, results.runTypeCount(RunType.MEDIUM));
    assertEquals(0.2, results.runTypeFrequency(RunType.LONG));
  }

  @Test
  public void testHazardMerge() {
    HazardSimulationResults a = new HazardSimulationResults(10, 6, 22, 3, 5, 2, 6.0, 0);
    HazardSimulationResults b = new HazardSimulationResults(5, 5, 0, 1, 1, 3, 5.0, 0);
    HazardSimulationResults merged = a.merge(b);
    assertEquals(new HazardSimulationResults(15, 11, 22, 4, 6, 5, 11.0, 0), merged);
    assertThrows(InvalidArgumentException.class,
        () -> a.merge(new HazardSimulationResults(5, 5, 5, 1, 1, 3, 5.5, 1)));
    assertThat(merged.toString()).startsWith("HazardSimulationResults{trials=15, cashOutAfterSteps=0");
  }
}
