package org.scriptonbasestar.contentcache.store.metrics;

import org.junit.Test;

import java.time.Duration;

import static org.junit.Assert.*;

/**
 * CacheStats 테스트
 *
 * @author archmagece
 * @since 2025-02
 */
public class CacheStatsTest {

	@Test
	public void testDerivedValues() {
		CacheStats stats = new CacheStats(3, 1, 5, 2, 600, 1000, 3, Duration.ofSeconds(42), 0.25);

		assertEquals(4, stats.totalRequests());
		assertEquals(0.75, stats.hitRate(), 0.0001);
		assertEquals(0.25, stats.missRate(), 0.0001);
		assertEquals(0.6, stats.utilization(), 0.0001);
		assertEquals(200, stats.averageEntrySize());
		assertEquals(Duration.ofSeconds(42), stats.oldestEntryAge());
	}

	@Test
	public void testEmptyCacheHasNoDivisionByZero() {
		CacheStats stats = new CacheStats(0, 0, 0, 0, 0, 1000, 0, Duration.ZERO, 0.0);

		assertEquals(0.0, stats.hitRate(), 0.0);
		assertEquals(1.0, stats.missRate(), 0.0);
		assertEquals(0, stats.averageEntrySize());
		assertEquals(0.0, stats.utilization(), 0.0);
	}

	@Test
	public void testMissRateComplementsHitRate() {
		CacheStats allHits = new CacheStats(5, 0, 1, 0, 10, 1000, 1, Duration.ZERO, 0.0);
		CacheStats allMisses = new CacheStats(0, 5, 0, 0, 0, 1000, 0, Duration.ZERO, 0.0);

		assertEquals(0.0, allHits.missRate(), 0.0);
		assertEquals(1.0, allMisses.missRate(), 0.0);
	}
}
