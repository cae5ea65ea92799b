package com.verlumen.nonogram.discovery;

import com.verlumen.nonogram.convergence.GenerationStats;
import java.util.concurrent.CompletableFuture;

final class RunHandleImpl implements RunHandle {
  private final GeneticSearch search;
  private final CompletableFuture<SolveResult> completion;

  RunHandleImpl(GeneticSearch search, CompletableFuture<SolveResult> completion) {
    this.search = search;
    this.completion = completion;
  }

  @Override
  public void cancel() {
    search.cancel();
  }

  @Override
  public RunState state() {
    return search.state();
  }

  @Override
  public long seed() {
    return search.seed();
  }

  @Override
  public Iterable<GenerationStats> progress() {
    return search.tracker().progress();
  }

  @Override
  public SolveResult result() {
    return completion.join();
  }
}
