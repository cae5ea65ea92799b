package com.verlumen.nonogram.discovery;

import com.google.common.util.concurrent.ThreadFactoryBuilder;
import com.google.inject.AbstractModule;
import com.google.inject.Provides;
import com.google.inject.Singleton;
import com.verlumen.nonogram.fitness.FitnessEvaluator;
import com.verlumen.nonogram.fitness.SegmentAlignmentEvaluator;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;

/** Wires up the genetic search in the Guice DI context. */
public final class DiscoveryModule extends AbstractModule {
  public static DiscoveryModule create() {
    return new DiscoveryModule();
  }

  private DiscoveryModule() {}

  @Override
  protected void configure() {
    bind(FitnessCalculator.class).to(FitnessCalculatorImpl.class);
    bind(GAEngineFactory.class).to(GAEngineFactoryImpl.class);
    bind(GenotypeConverter.class).to(GenotypeConverterImpl.class);
    bind(GeneticAlgorithmOrchestrator.class).to(GeneticAlgorithmOrchestratorImpl.class);
  }

  @Provides
  FitnessEvaluator provideFitnessEvaluator() {
    return SegmentAlignmentEvaluator.create();
  }

  @Provides
  @Singleton
  @EvaluationExecutor
  ExecutorService provideEvaluationExecutor() {
    return Executors.newFixedThreadPool(
        Runtime.getRuntime().availableProcessors(),
        new ThreadFactoryBuilder().setNameFormat("nonogram-eval-%d").setDaemon(true).build());
  }

  @Provides
  @Singleton
  @RunExecutor
  ExecutorService provideRunExecutor() {
    return Executors.newCachedThreadPool(
        new ThreadFactoryBuilder().setNameFormat("nonogram-run-%d").setDaemon(true).build());
  }
}
