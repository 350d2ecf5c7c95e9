package org.scriptonbasestar.contentcache.store.pressure;

import org.junit.After;
import org.junit.Before;
import org.junit.Test;
import org.scriptonbasestar.contentcache.store.cache.SBContentCache;

import java.time.Duration;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.CyclicBarrier;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;

import static org.junit.Assert.*;

/**
 * HeapMemoryPressureMonitor 테스트
 *
 * @author archmagece
 * @since 2025-02
 */
public class HeapMemoryPressureMonitorTest {

	private SBContentCache cache;

	@Before
	public void setUp() {
		cache = new SBContentCache(1000);
	}

	@After
	public void tearDown() {
		cache.close();
	}

	@Test
	public void testSampleForwardsPressure() {
		try (HeapMemoryPressureMonitor monitor =
				 new HeapMemoryPressureMonitor(cache, () -> 0.42, Duration.ofMinutes(1))) {

			double sampled = monitor.sample();

			assertEquals(0.42, sampled, 0.0);
			assertEquals(0.42, cache.getMemoryPressure(), 0.0);
		}
	}

	@Test
	public void testHeapSourceIsWithinRange() {
		double pressure = MemoryPressureSource.heap().currentPressure();

		assertTrue(pressure >= 0.0);
		assertTrue(pressure <= 1.0);
	}

	@Test
	public void testScheduledSamplingSurvivesFailures() throws InterruptedException {
		AtomicInteger calls = new AtomicInteger();
		CountDownLatch latch = new CountDownLatch(3);
		MemoryPressureSource flaky = () -> {
			latch.countDown();
			if (calls.incrementAndGet() == 1) {
				throw new IllegalStateException("sensor unavailable");
			}
			return 0.1;
		};

		try (HeapMemoryPressureMonitor monitor =
				 new HeapMemoryPressureMonitor(cache, flaky, Duration.ofMillis(20))) {
			monitor.start();
			assertTrue(monitor.isRunning());

			// 첫 실행이 실패해도 이후 실행은 계속된다
			assertTrue(latch.await(5, TimeUnit.SECONDS));
		}
		assertEquals(0.1, cache.getMemoryPressure(), 0.0);
	}

	@Test
	public void testCloseStopsMonitor() {
		HeapMemoryPressureMonitor monitor = new HeapMemoryPressureMonitor(cache, () -> 0.0, Duration.ofSeconds(1));
		monitor.start();

		monitor.close();

		assertFalse(monitor.isRunning());
	}

	@Test
	public void testCloseRacingStartLeavesNoRunningExecutor() throws Exception {
		for (int i = 0; i < 200; i++) {
			HeapMemoryPressureMonitor monitor = new HeapMemoryPressureMonitor(cache, () -> 0.0, Duration.ofMinutes(1));
			CyclicBarrier barrier = new CyclicBarrier(2);
			Thread starter = new Thread(() -> {
				try {
					barrier.await();
					monitor.start();
				} catch (IllegalStateException e) {
					// close 가 먼저 실행됨
				} catch (Exception e) {
					throw new AssertionError(e);
				}
			});
			starter.start();
			barrier.await();
			monitor.close();
			starter.join(5_000);

			// Then - 어느 쪽이 먼저든 executor 는 남지 않는다
			assertFalse(starter.isAlive());
			assertTrue(monitor.isExecutorShutdown());
			assertFalse(monitor.isRunning());
		}
	}

	@Test(expected = IllegalStateException.class)
	public void testStartAfterCloseRejected() {
		HeapMemoryPressureMonitor monitor = new HeapMemoryPressureMonitor(cache, () -> 0.0, Duration.ofSeconds(1));
		monitor.close();

		monitor.start();
	}

	@Test(expected = IllegalArgumentException.class)
	public void testZeroIntervalRejected() {
		new HeapMemoryPressureMonitor(cache, () -> 0.0, Duration.ZERO);
	}
}
