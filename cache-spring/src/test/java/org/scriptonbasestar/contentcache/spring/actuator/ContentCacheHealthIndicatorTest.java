package org.scriptonbasestar.contentcache.spring.actuator;

import org.junit.After;
import org.junit.Before;
import org.junit.Test;
import org.scriptonbasestar.contentcache.store.cache.SBContentCache;
import org.scriptonbasestar.contentcache.store.metrics.CacheHealthCheck;
import org.springframework.boot.actuate.health.Health;
import org.springframework.boot.actuate.health.Status;

import static org.junit.Assert.*;

/**
 * ContentCacheHealthIndicator 테스트
 *
 * @author archmagece
 * @since 2025-02
 */
public class ContentCacheHealthIndicatorTest {

	private SBContentCache cache;
	private ContentCacheHealthIndicator indicator;

	@Before
	public void setUp() {
		cache = SBContentCache.builder()
			.name("test-cache")
			.maxSize(1000)
			.build();
		indicator = new ContentCacheHealthIndicator(cache);
	}

	@After
	public void tearDown() {
		cache.close();
	}

	@Test
	public void testHealthyCache() {
		// Given - 70% 히트율
		cache.insert("a", new byte[100]);
		for (int i = 0; i < 70; i++) {
			cache.get("a");
		}
		for (int i = 0; i < 30; i++) {
			cache.get("missing");
		}

		// When
		Health health = indicator.health();

		// Then
		assertEquals(Status.UP, health.getStatus());
		assertEquals("test-cache", health.getDetails().get("cacheName"));
		assertEquals(100L, health.getDetails().get("requestCount"));
		assertEquals(70L, health.getDetails().get("hitCount"));
		assertEquals("70.00%", health.getDetails().get("hitRate"));
		assertEquals(1, health.getDetails().get("entryCount"));
		assertEquals(100L, health.getDetails().get("memoryUsed"));
		assertEquals(1000L, health.getDetails().get("maxSize"));
		assertEquals("10.00%", health.getDetails().get("utilization"));
		assertNull(health.getDetails().get("warnings"));
	}

	@Test
	public void testLowHitRateStaysUpWithWarning() {
		// Given - 30% 히트율
		cache.insert("a", new byte[10]);
		for (int i = 0; i < 30; i++) {
			cache.get("a");
		}
		for (int i = 0; i < 70; i++) {
			cache.get("missing");
		}

		// When
		Health health = indicator.health();

		// Then
		assertEquals(Status.UP, health.getStatus());
		String[] warnings = (String[]) health.getDetails().get("warnings");
		assertNotNull(warnings);
		assertEquals(1, warnings.length);
		assertTrue(warnings[0].startsWith("Low hit rate"));
	}

	@Test
	public void testHighMemoryPressureIsDown() {
		// Given
		cache.setMemoryPressure(0.95);

		// When
		Health health = indicator.health();

		// Then
		assertEquals(Status.DOWN, health.getStatus());
		String[] errors = (String[]) health.getDetails().get("errors");
		assertNotNull(errors);
		assertTrue(errors[0].startsWith("High memory pressure"));
		assertEquals(0.95, (Double) health.getDetails().get("memoryPressure"), 0.0001);
	}

	@Test
	public void testFewRequestsReportedAsInfo() {
		// Given
		cache.get("missing");

		// When
		Health health = indicator.health();

		// Then
		assertEquals(Status.UP, health.getStatus());
		assertNotNull(health.getDetails().get("info"));
		assertNull(health.getDetails().get("errors"));
	}

	@Test
	public void testCustomThresholds() {
		// Given
		ContentCacheHealthIndicator relaxed = new ContentCacheHealthIndicator(cache, CacheHealthCheck.HealthThresholds.RELAXED);
		cache.setMemoryPressure(0.92);

		// Then - RELAXED 는 0.95 까지 허용
		assertEquals(Status.UP, relaxed.health().getStatus());
		assertEquals(Status.DOWN, indicator.health().getStatus());
	}

	@Test(expected = IllegalArgumentException.class)
	public void testNullCache() {
		new ContentCacheHealthIndicator(null);
	}
}
