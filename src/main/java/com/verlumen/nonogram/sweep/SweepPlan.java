package com.verlumen.nonogram.sweep;

import com.google.common.collect.ImmutableList;
import com.google.common.collect.ImmutableMap;
import com.verlumen.nonogram.discovery.MutationStrategy;
import com.verlumen.nonogram.discovery.SolverConfig;
import java.util.List;

/** Builds labelled configuration grids for sweeps. */
public final class SweepPlan {
  public static final ImmutableList<Double> ANOVA_CROSSOVER_RATES =
      ImmutableList.of(0.3, 0.6, 0.9);
  public static final ImmutableList<Double> ANOVA_MUTATION_RATES =
      ImmutableList.of(0.1, 0.2, 0.3);
  public static final ImmutableList<Integer> ANOVA_SLIDE_TRIES = ImmutableList.of(3, 5, 7);
  public static final ImmutableList<Long> ANOVA_SEEDS =
      ImmutableList.of(11L, 13L, 17L, 19L, 23L, 29L, 31L, 37L, 41L, 43L);

  /**
   * Full factorial design over the three factors, with segment-slide mutation so that the slide
   * factor takes effect. Labels read like {@code cx=0.3 mut=0.1 slides=3}.
   */
  public static ImmutableMap<String, SolverConfig> factorial(
      SolverConfig base,
      List<Double> crossoverRates,
      List<Double> mutationRates,
      List<Integer> slideTries) {
    ImmutableMap.Builder<String, SolverConfig> configurations = ImmutableMap.builder();
    for (double crossoverRate : crossoverRates) {
      for (double mutationRate : mutationRates) {
        for (int slides : slideTries) {
          configurations.put(
              String.format("cx=%s mut=%s slides=%d", crossoverRate, mutationRate, slides),
              base.toBuilder()
                  .setCrossoverRate(crossoverRate)
                  .setMutationRate(mutationRate)
                  .setSlideTries(slides)
                  .setMutationStrategy(MutationStrategy.SEGMENT_SLIDE)
                  .build());
        }
      }
    }
    return configurations.buildOrThrow();
  }

  /** The 27-configuration design of the hyperparameter study. */
  public static ImmutableMap<String, SolverConfig> anova(SolverConfig base) {
    return factorial(base, ANOVA_CROSSOVER_RATES, ANOVA_MUTATION_RATES, ANOVA_SLIDE_TRIES);
  }

  private SweepPlan() {}
}
