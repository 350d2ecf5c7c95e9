package org.scriptonbasestar.contentcache.store.cache;

import org.junit.After;
import org.junit.Before;
import org.junit.Test;
import org.scriptonbasestar.contentcache.core.strategy.CachePriority;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.Random;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;

import static org.junit.Assert.*;

/**
 * 동시 접근 시 불변식 테스트
 *
 * @author archmagece
 * @since 2025-02
 */
public class SBContentCacheConcurrencyTest {

	private static final int THREADS = 8;
	private static final int OPERATIONS = 5_000;

	private SBContentCache cache;
	private ExecutorService executor;

	@Before
	public void setUp() {
		// minIdleTime 0: 모든 항목이 즉시 축출 대상이 되어 make-space 경로가 자주 실행된다
		cache = SBContentCache.builder()
			.maxSize(4 * 1024)
			.minIdleTime(Duration.ZERO)
			.cleanupInterval(Duration.ZERO)
			.build();
		executor = Executors.newFixedThreadPool(THREADS);
	}

	@After
	public void tearDown() {
		executor.shutdownNow();
		cache.close();
	}

	@Test
	public void testMixedWorkloadKeepsInvariants() throws Exception {
		CountDownLatch start = new CountDownLatch(1);
		List<Future<?>> futures = new ArrayList<>();
		CachePriority[] priorities = CachePriority.values();

		for (int t = 0; t < THREADS; t++) {
			final int seed = t;
			futures.add(executor.submit(() -> {
				Random random = new Random(seed);
				start.await();
				for (int i = 0; i < OPERATIONS; i++) {
					String key = "asset-" + random.nextInt(200);
					int op = random.nextInt(10);
					if (op < 4) {
						cache.insert(key, new byte[1 + random.nextInt(256)], priorities[random.nextInt(priorities.length)]);
					} else if (op < 8) {
						cache.get(key);
					} else if (op == 8) {
						cache.remove(key);
					} else {
						switch (random.nextInt(4)) {
							case 0:
								cache.cleanupExpired();
								break;
							case 1:
								cache.setMemoryPressure(random.nextDouble());
								break;
							case 2:
								cache.optimize();
								break;
							default:
								cache.getStats();
								break;
						}
					}
				}
				return null;
			}));
		}

		start.countDown();
		for (Future<?> future : futures) {
			future.get(60, TimeUnit.SECONDS);
		}

		assertTrue(cache.isConsistent());
		assertEquals(cache.size(), cache.recencyKeys().size());
		long requests = cache.metrics().requestCount();
		assertEquals(cache.metrics().hitCount() + cache.metrics().missCount(), requests);
		assertTrue(requests > 0);
	}

	@Test
	public void testConcurrentReadersSeeConsistentData() throws Exception {
		for (int i = 0; i < 50; i++) {
			cache.insert("k" + i, new byte[]{(byte) i});
		}
		List<Future<?>> futures = new ArrayList<>();

		for (int t = 0; t < THREADS; t++) {
			futures.add(executor.submit(() -> {
				for (int i = 0; i < 1_000; i++) {
					int k = i % 50;
					byte[] data = cache.get("k" + k).orElseThrow(() -> new AssertionError("missing k" + k));
					assertEquals((byte) k, data[0]);
				}
			}));
		}

		// 작업 스레드의 AssertionError 는 Future.get() 에서 ExecutionException 으로 드러난다
		for (Future<?> future : futures) {
			future.get(30, TimeUnit.SECONDS);
		}
		assertEquals(THREADS * 1_000L, cache.metrics().hitCount());
	}
}
