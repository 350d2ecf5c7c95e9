package org.scriptonbasestar.contentcache.store.pressure;

import org.scriptonbasestar.contentcache.store.cache.SBContentCache;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;

/**
 * Periodically forwards a memory pressure reading to a cache.
 *
 * <pre>{@code
 * try (HeapMemoryPressureMonitor monitor = new HeapMemoryPressureMonitor(cache, Duration.ofSeconds(10))) {
 *     monitor.start();
 *     ...
 * }
 * }</pre>
 *
 * @author archmagece
 * @since 2025-02
 */
public class HeapMemoryPressureMonitor implements AutoCloseable {

	private static final Logger log = LoggerFactory.getLogger(HeapMemoryPressureMonitor.class);

	private final SBContentCache cache;
	private final MemoryPressureSource source;
	private final Duration interval;
	// start/close 가 executor 생성과 종료를 같은 락 아래에서 본다
	private final Object lifecycleLock = new Object();
	private final AtomicBoolean started = new AtomicBoolean(false);
	private final AtomicBoolean closed = new AtomicBoolean(false);
	private volatile ScheduledExecutorService executor;

	public HeapMemoryPressureMonitor(SBContentCache cache, Duration interval) {
		this(cache, MemoryPressureSource.heap(), interval);
	}

	public HeapMemoryPressureMonitor(SBContentCache cache, MemoryPressureSource source, Duration interval) {
		if (cache == null) {
			throw new IllegalArgumentException("cache must not be null");
		}
		if (source == null) {
			throw new IllegalArgumentException("source must not be null");
		}
		if (interval == null || interval.isZero() || interval.isNegative()) {
			throw new IllegalArgumentException("interval must be positive");
		}
		this.cache = cache;
		this.source = source;
		this.interval = interval;
	}

	/**
	 * Starts periodic sampling. Calling it again has no effect.
	 */
	public void start() {
		synchronized (lifecycleLock) {
			if (closed.get()) {
				throw new IllegalStateException("Monitor already closed");
			}
			if (!started.compareAndSet(false, true)) {
				return;
			}
			executor = Executors.newSingleThreadScheduledExecutor(r -> {
				Thread t = new Thread(r, "SBContentCache-PressureMonitor");
				t.setDaemon(true);
				return t;
			});
			long periodMillis = Math.max(1, interval.toMillis());
			executor.scheduleAtFixedRate(this::sampleQuietly, periodMillis, periodMillis, TimeUnit.MILLISECONDS);
		}
		log.debug("Memory pressure monitor started for cache '{}' with interval {}", cache.getName(), interval);
	}

	/**
	 * Reads the source once and forwards the value to the cache.
	 *
	 * @return the sampled pressure
	 */
	public double sample() {
		double pressure = source.currentPressure();
		log.trace("Sampled memory pressure {} for cache '{}'", pressure, cache.getName());
		cache.setMemoryPressure(pressure);
		return pressure;
	}

	private void sampleQuietly() {
		try {
			sample();
		} catch (RuntimeException e) {
			log.warn("Memory pressure sampling failed for cache '{}'", cache.getName(), e);
		}
	}

	public boolean isRunning() {
		return started.get() && !closed.get();
	}

	public Duration getInterval() {
		return interval;
	}

	/**
	 * @return true when no sampling thread is left running (never started, or shut down)
	 */
	boolean isExecutorShutdown() {
		ScheduledExecutorService current = executor;
		return current == null || current.isShutdown();
	}

	@Override
	public void close() {
		ScheduledExecutorService current;
		synchronized (lifecycleLock) {
			if (!closed.compareAndSet(false, true)) {
				return;
			}
			current = executor;
		}
		if (current == null) {
			return;
		}
		log.debug("Shutting down memory pressure monitor for cache '{}'", cache.getName());
		current.shutdown();
		try {
			if (!current.awaitTermination(5, TimeUnit.SECONDS)) {
				log.warn("Pressure monitor did not terminate in time, forcing shutdown");
				current.shutdownNow();
			}
		} catch (InterruptedException e) {
			log.warn("Interrupted while waiting for pressure monitor termination", e);
			current.shutdownNow();
			Thread.currentThread().interrupt();
		}
	}
}
