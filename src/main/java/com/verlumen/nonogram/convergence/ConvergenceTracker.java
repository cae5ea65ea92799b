package com.verlumen.nonogram.convergence;

import static com.google.common.base.Preconditions.checkNotNull;
import static com.google.common.base.Preconditions.checkState;

import com.google.common.collect.AbstractIterator;
import com.google.common.collect.ImmutableList;
import java.util.Iterator;
import java.util.List;
import java.util.concurrent.CopyOnWriteArrayList;

/**
 * Append-only log of {@link GenerationStats} for one run.
 *
 * <p>There is a single writer, the engine's generation loop. Readers never block it: the log is
 * copy-on-write, and {@link #progress()} readers wait on this tracker's monitor only for entries
 * that have not been recorded yet.
 */
public final class ConvergenceTracker {
  private final List<GenerationStats> history = new CopyOnWriteArrayList<>();
  private volatile boolean closed;

  /** Appends the statistics of the next generation. */
  public void record(GenerationStats stats) {
    checkNotNull(stats, "Stats cannot be null");
    checkState(!closed, "Tracker is closed");
    synchronized (this) {
      history.add(stats);
      notifyAll();
    }
  }

  /** Marks the run as terminal; pending {@link #progress()} iterations then finish. */
  public void close() {
    synchronized (this) {
      closed = true;
      notifyAll();
    }
  }

  public boolean isClosed() {
    return closed;
  }

  public int size() {
    return history.size();
  }

  /** Immutable copy of everything recorded so far. */
  public ImmutableList<GenerationStats> snapshot() {
    return ImmutableList.copyOf(history);
  }

  /**
   * Returns a lazy view of the log. Every call to {@link Iterable#iterator()} starts again from the
   * first generation; while the run is live, {@code hasNext()} waits for the next generation, and
   * the iteration ends once the tracker is closed and drained.
   */
  public Iterable<GenerationStats> progress() {
    return this::newProgressIterator;
  }

  private Iterator<GenerationStats> newProgressIterator() {
    return new AbstractIterator<GenerationStats>() {
      private int next;

      @Override
      protected GenerationStats computeNext() {
        try {
          if (!awaitEntry(next)) {
            return endOfData();
          }
        } catch (InterruptedException e) {
          Thread.currentThread().interrupt();
          return endOfData();
        }
        return history.get(next++);
      }
    };
  }

  /** Waits until entry {@code index} exists; returns false if the log closed without it. */
  private boolean awaitEntry(int index) throws InterruptedException {
    if (index < history.size()) {
      return true;
    }
    synchronized (this) {
      while (index >= history.size() && !closed) {
        wait();
      }
      return index < history.size();
    }
  }
}
