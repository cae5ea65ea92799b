package com.verlumen.nonogram.discovery;

import io.jenetics.Genotype;
import io.jenetics.IntegerGene;
import io.jenetics.Phenotype;
import io.jenetics.engine.Evaluator;
import io.jenetics.util.ISeq;
import io.jenetics.util.Seq;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.Callable;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Future;
import java.util.function.Function;

/**
 * Scatters the scoring of not-yet-evaluated individuals over an executor and gathers the scores
 * in population order. Each task reads one genotype and the shared, immutable puzzle, so no
 * synchronization is needed beyond the final gather.
 */
final class ParallelEvaluator implements Evaluator<IntegerGene, Integer> {
  private final Function<? super Genotype<IntegerGene>, Integer> fitnessFunction;
  private final ExecutorService executor;

  ParallelEvaluator(
      Function<? super Genotype<IntegerGene>, Integer> fitnessFunction, ExecutorService executor) {
    this.fitnessFunction = fitnessFunction;
    this.executor = executor;
  }

  @Override
  public ISeq<Phenotype<IntegerGene, Integer>> eval(
      Seq<Phenotype<IntegerGene, Integer>> population) {
    List<Callable<Integer>> tasks = new ArrayList<>();
    for (Phenotype<IntegerGene, Integer> individual : population) {
      if (!individual.isEvaluated()) {
        Genotype<IntegerGene> genotype = individual.genotype();
        tasks.add(() -> fitnessFunction.apply(genotype));
      }
    }
    List<Future<Integer>> scores = invokeAll(tasks);

    List<Phenotype<IntegerGene, Integer>> evaluated = new ArrayList<>(population.length());
    int next = 0;
    for (Phenotype<IntegerGene, Integer> individual : population) {
      if (individual.isEvaluated()) {
        evaluated.add(individual);
      } else {
        evaluated.add(individual.withFitness(await(scores.get(next++))));
      }
    }
    return ISeq.of(evaluated);
  }

  private List<Future<Integer>> invokeAll(List<Callable<Integer>> tasks) {
    try {
      return executor.invokeAll(tasks);
    } catch (InterruptedException e) {
      Thread.currentThread().interrupt();
      throw new IllegalStateException("Interrupted while evaluating the population", e);
    }
  }

  private static Integer await(Future<Integer> score) {
    try {
      return score.get();
    } catch (InterruptedException e) {
      Thread.currentThread().interrupt();
      throw new IllegalStateException("Interrupted while evaluating the population", e);
    } catch (ExecutionException e) {
      throw new IllegalStateException("Fitness evaluation failed", e.getCause());
    }
  }
}
