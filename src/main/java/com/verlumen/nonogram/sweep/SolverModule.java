package com.verlumen.nonogram.sweep;

import com.google.inject.AbstractModule;
import com.verlumen.nonogram.discovery.DiscoveryModule;

/** Wires up the run coordinator on top of the genetic search. */
public final class SolverModule extends AbstractModule {
  public static SolverModule create() {
    return new SolverModule();
  }

  private SolverModule() {}

  @Override
  protected void configure() {
    bind(RunCoordinator.class).to(RunCoordinatorImpl.class);

    install(DiscoveryModule.create());
  }
}
