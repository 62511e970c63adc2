package org.hypertrace.core.query.planner.catalog;

import static java.util.Objects.requireNonNull;

import com.google.common.collect.ImmutableList;
import java.util.ArrayList;
import java.util.Collection;
import java.util.List;
import java.util.concurrent.locks.ReadWriteLock;
import java.util.concurrent.locks.ReentrantReadWriteLock;
import lombok.extern.slf4j.Slf4j;

/**
 * Append-only catalog filled while the series metadata is loaded, then only read from. Readers
 * never observe a partially applied {@link #registerAll}.
 */
@Slf4j
public class InMemorySeriesCatalog implements SeriesCatalog {

  private final ReadWriteLock lock = new ReentrantReadWriteLock();
  private final List<Series> series = new ArrayList<>();

  public void register(Series newSeries) {
    requireNonNull(newSeries, "series");
    lock.writeLock().lock();
    try {
      series.add(newSeries);
    } finally {
      lock.writeLock().unlock();
    }
  }

  public void registerAll(Collection<Series> newSeries) {
    List<Series> copy = ImmutableList.copyOf(newSeries);
    lock.writeLock().lock();
    try {
      series.addAll(copy);
    } finally {
      lock.writeLock().unlock();
    }
    if (log.isDebugEnabled()) {
      log.debug("Registered {} series, catalog size is now {}", copy.size(), size());
    }
  }

  public int size() {
    lock.readLock().lock();
    try {
      return series.size();
    } finally {
      lock.readLock().unlock();
    }
  }

  @Override
  public List<Series> snapshot() {
    lock.readLock().lock();
    try {
      return ImmutableList.copyOf(series);
    } finally {
      lock.readLock().unlock();
    }
  }
}
