package io.github.panghy.roundengine.simulation;

import io.github.panghy.roundengine.error.InvalidArgumentException;
import io.github.panghy.roundengine.hazard.HazardEngine;
import io.github.panghy.roundengine.hazard.HazardTuning;
import io.github.panghy.roundengine.hazard.RunType;
import io.github.panghy.roundengine.outcome.OutcomeEngine;
import io.github.panghy.roundengine.outcome.OutcomeEvent;
import io.github.panghy.roundengine.outcome.OutcomeTuning;
import io.github.panghy.roundengine.outcome.RoundResolution;
import io.github.panghy.roundengine.outcome.Side;
import io.github.panghy.roundengine.random.DeterministicRandomSource;
import io.github.panghy.roundengine.random.RandomSource;

import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.logging.Logger;

import static io.github.panghy.roundengine.util.LoggingUtil.error;
import static io.github.panghy.roundengine.util.LoggingUtil.info;

/**
 * Drives the engines for many rounds and aggregates the outcome statistics.
 *
 * <p>The harness is a black-box client: it uses only the public engine
 * operations a game controller uses, so properties it measures (win rate,
 * effective RTP, event frequencies) hold for production sessions too. It is
 * also the executable check of {@link OutcomeTuning#expectedRtp()}.</p>
 *
 * <p>Every run is deterministic in its seed. Large runs can be split across
 * independent seeded sessions with {@link #simulateParallel(long, List)}, or
 * with {@link #simulateParallel(long, long, int)}, which derives the session
 * seeds from one base seed.</p>
 */
public final class SimulationHarness {

  private static final Logger LOGGER = Logger.getLogger(SimulationHarness.class.getName());

  /**
   * Seed of the reference calibration run.
   */
  public static final long DEFAULT_SEED = 0x5EEDC0DEL;

  /**
   * Trial count of the reference calibration run.
   */
  public static final long DEFAULT_TRIALS = 200_000;

  private SimulationHarness() {
    // Prevent instantiation
  }

  /**
   * Simulates discrete rounds with the default tuning table.
   *
   * @param trials Number of rounds, positive
   * @param seed   Seed of the session
   * @return The aggregated results
   */
  public static SimulationResults simulate(long trials, long seed) {
    return simulate(trials, seed, OutcomeTuning.defaults());
  }

  /**
   * Simulates discrete rounds. A single source seeds both the engine and the
   * simulated player, who backs a uniformly random side every round.
   *
   * @param trials Number of rounds, positive
   * @param seed   Seed of the session
   * @param tuning The tuning table
   * @return The aggregated results
   * @throws InvalidArgumentException if trials is not positive
   */
  public static SimulationResults simulate(long trials, long seed, OutcomeTuning tuning) {
    requirePositiveTrials(trials);
    RandomSource random = new DeterministicRandomSource(seed);
    OutcomeEngine engine = new OutcomeEngine(random, tuning);

    long wins = 0;
    long[] eventCounts = new long[OutcomeEvent.values().length];
    long rareEvents = 0;
    long secondEvents = 0;
    for (long i = 0; i < trials; i++) {
      Side selectedSide = random.chance(0.5) ? Side.A : Side.B;
      RoundResolution resolution = engine.resolveRound(selectedSide);
      if (resolution.selectedSideWins()) {
        wins++;
      }
      if (resolution.rareEventTriggered()) {
        rareEvents++;
      }
      eventCounts[resolution.firstEvent().ordinal()]++;
      if (resolution.secondEventTriggered()) {
        secondEvents++;
        eventCounts[resolution.secondEvent().ordinal()]++;
      }
    }

    SimulationResults results = new SimulationResults(trials, wins,
        eventCounts[OutcomeEvent.HIT_A.ordinal()],
        eventCounts[OutcomeEvent.HIT_B.ordinal()],
        eventCounts[OutcomeEvent.MISS.ordinal()],
        rareEvents, secondEvents, tuning.payoutMultiple());
    info(LOGGER, "Simulated seed " + random.getSeedHex() + ": " + results
        + " (expected RTP " + tuning.expectedRtp() + ")");
    return results;
  }

  /**
   * Simulates one independent session per seed with the default tuning table.
   *
   * @param trialsPerSession Rounds per session, positive
   * @param seeds            One seed per session, not empty
   * @return The merged results
   */
  public static SimulationResults simulateParallel(long trialsPerSession, List<Long> seeds) {
    return simulateParallel(trialsPerSession, seeds, OutcomeTuning.defaults());
  }

  /**
   * Simulates one independent session per seed on a worker pool and merges the
   * counts. The merged result equals merging sequential runs of the same seeds.
   *
   * @param trialsPerSession Rounds per session, positive
   * @param seeds            One seed per session, not empty
   * @param tuning           The tuning table
   * @return The merged results
   * @throws InvalidArgumentException if trialsPerSession is not positive or seeds is empty
   */
  public static SimulationResults simulateParallel(long trialsPerSession, List<Long> seeds, OutcomeTuning tuning) {
    requirePositiveTrials(trialsPerSession);
    if (seeds == null || seeds.isEmpty()) {
      throw new InvalidArgumentException("seeds", "At least one seed is required");
    }
    int workers = Math.min(seeds.size(), Runtime.getRuntime().availableProcessors());
    ExecutorService executor = Executors.newFixedThreadPool(workers);
    try {
      List<CompletableFuture<SimulationResults>> sessions = new ArrayList<>(seeds.size());
      for (Long seed : seeds) {
        sessions.add(CompletableFuture.supplyAsync(() -> simulate(trialsPerSession, seed, tuning), executor));
      }
      SimulationResults merged = null;
      for (CompletableFuture<SimulationResults> session : sessions) {
        SimulationResults results = session.join();
        merged = merged == null ? results : merged.merge(results);
      }
      info(LOGGER, "Merged " + seeds.size() + " sessions: " + merged);
      return merged;
    } catch (CompletionException e) {
      error(LOGGER, "Parallel simulation failed", e.getCause());
      if (e.getCause() instanceof RuntimeException) {
        throw (RuntimeException) e.getCause();
      }
      throw e;
    } finally {
      executor.shutdownNow();
    }
  }

  /**
   * Simulates {@code sessions} independent sessions whose seeds are derived
   * from one base seed, with the default tuning table.
   *
   * @param trialsPerSession Rounds per session, positive
   * @param baseSeed         Seed the session seeds are derived from
   * @param sessions         Number of sessions, positive
   * @return The merged results
   */
  public static SimulationResults simulateParallel(long trialsPerSession, long baseSeed, int sessions) {
    return simulateParallel(trialsPerSession, baseSeed, sessions, OutcomeTuning.defaults());
  }

  /**
   * Simulates {@code sessions} independent sessions whose seeds are derived
   * from one base seed. Session {@code i} is seeded with the child source
   * {@code "session-i"} of the base source, so a session can be replayed on
   * its own from {@link #sessionSeeds(long, int)}.
   *
   * @param trialsPerSession Rounds per session, positive
   * @param baseSeed         Seed the session seeds are derived from
   * @param sessions         Number of sessions, positive
   * @param tuning           The tuning table
   * @return The merged results
   * @throws InvalidArgumentException if trialsPerSession or sessions is not positive
   */
  public static SimulationResults simulateParallel(long trialsPerSession, long baseSeed, int sessions,
                                                   OutcomeTuning tuning) {
    return simulateParallel(trialsPerSession, sessionSeeds(baseSeed, sessions), tuning);
  }

  /**
   * Derives the seeds of the sessions of a parallel run.
   *
   * @param baseSeed Seed the session seeds are derived from
   * @param sessions Number of sessions, positive
   * @return One seed per session, in session order
   * @throws InvalidArgumentException if sessions is not positive
   */
  public static List<Long> sessionSeeds(long baseSeed, int sessions) {
    if (sessions <= 0) {
      throw new InvalidArgumentException("sessions", "Session count must be positive: " + sessions);
    }
    RandomSource base = new DeterministicRandomSource(baseSeed);
    List<Long> seeds = new ArrayList<>(sessions);
    for (int i = 0; i < sessions; i++) {
      seeds.add(base.createChild("session-" + i).getSeed());
    }
    return seeds;
  }

  /**
   * Simulates hazard rounds with the default tuning table.
   *
   * @param trials            Number of rounds, positive
   * @param seed              Seed of the session
   * @param cashOutAfterSteps Safe steps after which the player cashes out
   * @return The aggregated results
   */
  public static HazardSimulationResults simulateHazard(long trials, long seed, int cashOutAfterSteps) {
    return simulateHazard(trials, seed, cashOutAfterSteps, HazardTuning.defaults());
  }

  /**
   * Simulates hazard rounds for a player who steps until either a danger
   * event ends the round or {@code cashOutAfterSteps} steps are safe. Streak
   * state carries over from round to round as in a live session.
   *
   * @param trials            Number of rounds, positive
   * @param seed              Seed of the session
   * @param cashOutAfterSteps Safe steps after which the player cashes out, non-negative
   * @param tuning            The tuning table
   * @return The aggregated results
   * @throws InvalidArgumentException if trials is not positive or cashOutAfterSteps is negative
   */
  public static HazardSimulationResults simulateHazard(long trials, long seed, int cashOutAfterSteps,
                                                       HazardTuning tuning) {
    requirePositiveTrials(trials);
    if (cashOutAfterSteps < 0) {
      throw new InvalidArgumentException("cashOutAfterSteps",
          "Cash-out step cannot be negative: " + cashOutAfterSteps);
    }
    RandomSource random = new DeterministicRandomSource(seed);
    HazardEngine engine = new HazardEngine(random, tuning);
    double payoutOnCashOut = engine.payoutMultiple(cashOutAfterSteps);

    long wins = 0;
    long stepsPlayed = 0;
    long[] runTypeCounts = new long[RunType.values().length];
    double totalPayout = 0.0;
    for (long i = 0; i < trials; i++) {
      runTypeCounts[engine.startRound().ordinal()]++;
      boolean danger = false;
      for (int step = 0; step < cashOutAfterSteps && !danger; step++) {
        stepsPlayed++;
        danger = engine.isDanger(step);
      }
      if (danger) {
        engine.onRoundLost();
      } else {
        engine.onRoundWon();
        wins++;
        totalPayout += payoutOnCashOut;
      }
    }

    HazardSimulationResults results = new HazardSimulationResults(trials, wins, stepsPlayed,
        runTypeCounts[RunType.SHORT.ordinal()],
        runTypeCounts[RunType.MEDIUM.ordinal()],
        runTypeCounts[RunType.LONG.ordinal()],
        totalPayout, cashOutAfterSteps);
    info(LOGGER, "Simulated hazard seed " + random.getSeedHex() + ": " + results);
    return results;
  }

  private static void requirePositiveTrials(long trials) {
    if (trials <= 0) {
      throw new InvalidArgumentException("trials", "Trial count must be positive: " + trials);
    }
  }
}
