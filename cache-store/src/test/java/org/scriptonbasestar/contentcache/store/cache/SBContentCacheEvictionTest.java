package org.scriptonbasestar.contentcache.store.cache;

import org.junit.After;
import org.junit.Before;
import org.junit.Test;
import org.scriptonbasestar.contentcache.core.entry.CacheEntry;
import org.scriptonbasestar.contentcache.core.strategy.CachePriority;
import org.scriptonbasestar.contentcache.core.strategy.EvictionPolicy;
import org.scriptonbasestar.contentcache.store.ManualTicker;

import java.time.Duration;
import java.util.Arrays;

import static org.junit.Assert.*;

/**
 * 크기 압박에 의한 축출 테스트
 *
 * @author archmagece
 * @since 2025-02
 */
public class SBContentCacheEvictionTest {

	private ManualTicker ticker;
	private SBContentCache cache;

	@Before
	public void setUp() {
		ticker = new ManualTicker();
		cache = SBContentCache.builder()
			.maxSize(100)
			.ticker(ticker)
			.build();
	}

	@After
	public void tearDown() {
		cache.close();
	}

	@Test
	public void testLruEviction() {
		// Given - 30 bytes x 3
		cache.insert("a", new byte[30]);
		cache.insert("b", new byte[30]);
		cache.insert("c", new byte[30]);
		ticker.advance(Duration.ofSeconds(301));

		// When - a 접근 후 d 삽입
		cache.get("a");
		cache.insert("d", new byte[30]);

		// Then
		assertTrue(cache.contains("a"));  // 최근 접근
		assertTrue(cache.contains("d"));  // 새로 삽입
		assertFalse(cache.contains("b"));
		assertFalse(cache.contains("c"));
		assertEquals(60, cache.getMemoryUsage());
		assertEquals(2, cache.metrics().evictionCount());
		assertEquals(Arrays.asList("d", "a"), cache.recencyKeys());
		assertTrue(cache.isConsistent());
	}

	@Test
	public void testRecentlyUsedEntriesAreNotEvictable() {
		// 아무도 최소 idle 시간을 넘기지 않음
		cache.insert("a", new byte[30]);
		cache.insert("b", new byte[30]);
		cache.insert("c", new byte[30]);

		cache.insert("d", new byte[30]);

		// 삽입은 항상 성공하고 용량을 일시적으로 초과할 수 있다
		assertEquals(4, cache.size());
		assertEquals(120, cache.getMemoryUsage());
		assertTrue(cache.isConsistent());
	}

	@Test
	public void testPriorityProtection() {
		cache.insert("low", new byte[30], CachePriority.LOW);
		cache.insert("high", new byte[30], CachePriority.HIGH);
		cache.insert("critical", new byte[30], CachePriority.CRITICAL);

		cache.insert("new", new byte[40]);

		assertTrue(cache.contains("critical"));
		assertTrue(cache.contains("high"));
		assertFalse(cache.contains("low"));
		assertTrue(cache.contains("new"));
		assertEquals(100, cache.getMemoryUsage());
	}

	@Test
	public void testHighPriorityEvictedOnceIdleLongEnough() {
		cache.insert("high", new byte[30], CachePriority.HIGH);
		cache.insert("normal", new byte[30]);
		cache.insert("critical", new byte[30], CachePriority.CRITICAL);
		ticker.advance(Duration.ofMinutes(11));

		cache.insert("new", new byte[40]);

		// spaceToFree = 90 - 60 + 40 = 70: high(30) + normal(30)은 부족, critical은 25분 필요
		assertFalse(cache.contains("high"));
		assertFalse(cache.contains("normal"));
		assertTrue(cache.contains("critical"));
		assertTrue(cache.contains("new"));
	}

	@Test
	public void testCriticalWaitsLongerThanNormal() {
		// Given - tail 부터 critical, normal, high
		cache.insert("critical", new byte[30], CachePriority.CRITICAL);
		cache.insert("normal", new byte[30]);
		cache.insert("high", new byte[30], CachePriority.HIGH);
		ticker.advance(Duration.ofMinutes(2));

		// When - 2분 idle: 어떤 항목도 축출 대상이 아니다
		cache.insert("first", new byte[40]);

		// Then
		assertTrue(cache.contains("critical"));
		assertTrue(cache.contains("normal"));
		assertTrue(cache.contains("high"));
		assertEquals(130, cache.getMemoryUsage());

		// When - 6분 idle: normal(5분)만 대상, high 10분, critical 25분
		cache.remove("first");
		ticker.advance(Duration.ofMinutes(4));
		cache.insert("second", new byte[40]);

		// Then
		assertTrue(cache.contains("critical"));
		assertFalse(cache.contains("normal"));
		assertTrue(cache.contains("high"));
		assertEquals(100, cache.getMemoryUsage());
	}

	@Test
	public void testEvictionWalksFromTail() {
		cache.insert("a", new byte[25]);
		cache.insert("b", new byte[25]);
		cache.insert("c", new byte[25]);
		ticker.advance(Duration.ofMinutes(6));
		cache.get("a");
		// order: a c b, tail = b

		cache.insert("d", new byte[30]);

		// target 60, spaceToFree = 75 - 60 + 30 = 45 -> b, c
		assertEquals(Arrays.asList("d", "a"), cache.recencyKeys());
		assertEquals(55, cache.getMemoryUsage());
	}

	@Test
	public void testInsertedKeyIsNeverEvicted() {
		cache.insert("a", new byte[50], CachePriority.LOW);
		cache.insert("b", new byte[40], CachePriority.LOW);

		// 같은 키 교체: a는 제외되고 b만 축출 대상
		cache.insert("a", new byte[60], CachePriority.LOW);

		assertTrue(cache.contains("a"));
		assertFalse(cache.contains("b"));
		assertEquals(60, cache.getMemoryUsage());
		assertTrue(cache.isConsistent());
	}

	@Test
	public void testOversizedItemIsStillInserted() {
		cache.insert("huge", new byte[500]);

		assertTrue(cache.contains("huge"));
		assertEquals(500, cache.getMemoryUsage());
		assertEquals(5.0, cache.utilization(), 0.0001);
	}

	@Test
	public void testNoEvictionBelowTarget() {
		cache.insert("a", new byte[50], CachePriority.LOW);

		// 50 <= target(60): 아무것도 축출하지 않음
		cache.insert("b", new byte[60]);

		assertTrue(cache.contains("a"));
		assertTrue(cache.contains("b"));
		assertEquals(0, cache.metrics().evictionCount());
	}

	@Test
	public void testMaxEntriesHintTriggersReclaim() {
		try (SBContentCache hinted = SBContentCache.builder()
			.maxSize(1000)
			.maxEntries(3)
			.cleanupThreshold(1.0)
			.cleanupTarget(0.05)
			.ticker(ticker)
			.build()) {

			hinted.insert("a", new byte[20], CachePriority.LOW);
			hinted.insert("b", new byte[20], CachePriority.LOW);
			hinted.insert("c", new byte[20], CachePriority.LOW);

			// 항목 수 힌트 도달 -> target 50, spaceToFree = 60 - 50 + 20 = 30
			hinted.insert("d", new byte[20], CachePriority.LOW);

			assertFalse(hinted.contains("a"));
			assertFalse(hinted.contains("b"));
			assertTrue(hinted.contains("c"));
			assertTrue(hinted.contains("d"));
		}
	}

	@Test
	public void testCustomEvictionPolicy() {
		EvictionPolicy evictAll = new EvictionPolicy() {
			@Override
			public boolean isEvictable(CacheEntry entry, long nowNanos) {
				return true;
			}

			@Override
			public boolean isExpired(CacheEntry entry, long nowNanos) {
				return false;
			}
		};

		try (SBContentCache custom = SBContentCache.builder()
			.maxSize(100)
			.evictionPolicy(evictAll)
			.ticker(ticker)
			.build()) {

			custom.insert("a", new byte[30], CachePriority.CRITICAL);
			custom.insert("b", new byte[30], CachePriority.CRITICAL);
			custom.insert("c", new byte[30], CachePriority.CRITICAL);
			custom.insert("d", new byte[30], CachePriority.CRITICAL);

			// 기본 정책이라면 CRITICAL은 idle 0에서 축출되지 않는다
			assertFalse(custom.contains("a"));
			assertFalse(custom.contains("b"));
			assertTrue(custom.contains("c"));
			assertTrue(custom.contains("d"));
			assertSame(evictAll, custom.getEvictionPolicy());
		}
	}
}
