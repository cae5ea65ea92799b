package com.verlumen.nonogram.sweep;

import static com.google.common.truth.Truth.assertThat;

import com.google.common.collect.ImmutableList;
import com.google.common.collect.ImmutableMap;
import com.verlumen.nonogram.discovery.MutationStrategy;
import com.verlumen.nonogram.discovery.SolverConfig;
import org.junit.Test;
import org.junit.runner.RunWith;
import org.junit.runners.JUnit4;

@RunWith(JUnit4.class)
public class SweepPlanTest {
  @Test
  public void anova_coversTheFullFactorialDesign() {
    ImmutableMap<String, SolverConfig> configurations = SweepPlan.anova(SolverConfig.defaults());

    assertThat(configurations).hasSize(27);
    assertThat(configurations).containsKey("cx=0.3 mut=0.1 slides=3");
    assertThat(configurations).containsKey("cx=0.9 mut=0.3 slides=7");
    assertThat(SweepPlan.ANOVA_SEEDS).hasSize(10);
  }

  @Test
  public void factorial_appliesFactorsOverBase() {
    SolverConfig base = SolverConfig.builder().setPopulationSize(64).build();

    ImmutableMap<String, SolverConfig> configurations =
        SweepPlan.factorial(
            base, ImmutableList.of(0.5), ImmutableList.of(0.2), ImmutableList.of(4));

    SolverConfig config = configurations.get("cx=0.5 mut=0.2 slides=4");
    assertThat(config.populationSize()).isEqualTo(64);
    assertThat(config.crossoverRate()).isEqualTo(0.5);
    assertThat(config.mutationRate()).isEqualTo(0.2);
    assertThat(config.slideTries()).isEqualTo(4);
    assertThat(config.mutationStrategy()).isEqualTo(MutationStrategy.SEGMENT_SLIDE);
  }
}
