package com.verlumen.nonogram.discovery;

import static com.google.common.base.Preconditions.checkArgument;

import io.jenetics.Alterer;
import io.jenetics.AltererResult;
import io.jenetics.Chromosome;
import io.jenetics.Genotype;
import io.jenetics.IntegerGene;
import io.jenetics.Phenotype;
import io.jenetics.util.ISeq;
import io.jenetics.util.RandomRegistry;
import io.jenetics.util.Seq;
import java.util.ArrayList;
import java.util.List;
import java.util.random.RandomGenerator;

/**
 * Recombines offspring by exchanging whole rows. Rows are whole chromosomes, so children always
 * keep the parents' dimensions.
 *
 * <p>Each individual is picked as a first parent with the crossover rate and paired with a random
 * partner; both are replaced by the two complementary children. Individuals never picked stay
 * copies of their selected parent.
 */
final class RowCrossover implements Alterer<IntegerGene, Integer> {
  private final double crossoverRate;
  private final CrossoverStrategy strategy;

  RowCrossover(double crossoverRate, CrossoverStrategy strategy) {
    checkArgument(
        crossoverRate >= 0.0 && crossoverRate <= 1.0,
        "Crossover rate must be in [0, 1]: %s",
        crossoverRate);
    this.crossoverRate = crossoverRate;
    this.strategy = strategy;
  }

  @Override
  public AltererResult<IntegerGene, Integer> alter(
      Seq<Phenotype<IntegerGene, Integer>> population, long generation) {
    RandomGenerator random = RandomRegistry.random();
    List<Phenotype<IntegerGene, Integer>> offspring = new ArrayList<>(population.asList());
    int alterations = 0;
    if (offspring.size() < 2) {
      return new AltererResult<>(ISeq.of(offspring), 0);
    }

    for (int first = 0; first < offspring.size(); first++) {
      if (random.nextDouble() >= crossoverRate) {
        continue;
      }
      int second = random.nextInt(offspring.size() - 1);
      if (second >= first) {
        second++;
      }
      Genotype<IntegerGene> a = offspring.get(first).genotype();
      Genotype<IntegerGene> b = offspring.get(second).genotype();
      boolean[] exchanged = exchangedRows(a.length(), random);

      List<Chromosome<IntegerGene>> childA = new ArrayList<>(a.length());
      List<Chromosome<IntegerGene>> childB = new ArrayList<>(b.length());
      int swaps = 0;
      for (int row = 0; row < a.length(); row++) {
        if (exchanged[row]) {
          childA.add(b.get(row));
          childB.add(a.get(row));
          swaps++;
        } else {
          childA.add(a.get(row));
          childB.add(b.get(row));
        }
      }
      if (swaps > 0) {
        offspring.set(first, Phenotype.of(Genotype.of(childA), generation));
        offspring.set(second, Phenotype.of(Genotype.of(childB), generation));
        alterations += swaps;
      }
    }
    return new AltererResult<>(ISeq.of(offspring), alterations);
  }

  /** Marks the rows a single pairing exchanges. */
  boolean[] exchangedRows(int rows, RandomGenerator random) {
    CrossoverStrategy pairing = strategy;
    if (pairing == CrossoverStrategy.MIXED) {
      pairing =
          random.nextBoolean()
              ? CrossoverStrategy.UNIFORM_ROWS
              : CrossoverStrategy.TWO_POINT_ROWS;
    }
    return pairing == CrossoverStrategy.TWO_POINT_ROWS && rows > 1
        ? twoPoint(rows, random)
        : uniform(rows, random);
  }

  private static boolean[] uniform(int rows, RandomGenerator random) {
    boolean[] exchanged = new boolean[rows];
    for (int row = 0; row < rows; row++) {
      exchanged[row] = random.nextDouble() < GAConstants.ROW_SWAP_PROBABILITY;
    }
    return exchanged;
  }

  /** Rows in {@code [low, high]} for two random cut points. */
  private static boolean[] twoPoint(int rows, RandomGenerator random) {
    int low = random.nextInt(rows);
    int high = random.nextInt(rows);
    if (low > high) {
      int swap = low;
      low = high;
      high = swap;
    }
    boolean[] exchanged = new boolean[rows];
    for (int row = low; row <= high; row++) {
      exchanged[row] = true;
    }
    return exchanged;
  }
}
