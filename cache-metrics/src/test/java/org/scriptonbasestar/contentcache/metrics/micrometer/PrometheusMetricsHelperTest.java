package org.scriptonbasestar.contentcache.metrics.micrometer;

import io.micrometer.prometheus.PrometheusMeterRegistry;
import org.junit.Test;
import org.scriptonbasestar.contentcache.store.cache.SBContentCache;

import java.util.Arrays;

import static org.junit.Assert.*;

/**
 * PrometheusMetricsHelper 테스트
 *
 * @author archmagece
 * @since 2025-02
 */
public class PrometheusMetricsHelperTest {

	@Test
	public void testCreatePrometheusRegistry() {
		PrometheusMeterRegistry registry = PrometheusMetricsHelper.createPrometheusRegistry();

		assertNotNull(registry);
	}

	@Test
	public void testBindCache() {
		PrometheusMeterRegistry registry = PrometheusMetricsHelper.createPrometheusRegistry();
		try (SBContentCache cache = SBContentCache.builder().name("users").maxSize(1024).build()) {

			MicrometerContentCacheBinder binder = PrometheusMetricsHelper.bindCache(cache, registry);

			assertEquals("users", binder.getCacheName());
			assertSame(cache, binder.getCache());
		}
	}

	@Test
	public void testScrapeMetrics() {
		// Given
		PrometheusMeterRegistry registry = PrometheusMetricsHelper.createPrometheusRegistry();
		try (SBContentCache cache = SBContentCache.builder().name("test-cache").maxSize(1024).build()) {
			PrometheusMetricsHelper.bindCache(cache, registry);

			// When
			cache.insert("a", new byte[64]);
			cache.get("a");
			cache.get("a");
			cache.get("b");
			String prometheusFormat = PrometheusMetricsHelper.scrapeMetrics(registry);

			// Then
			assertTrue(prometheusFormat.contains("cache_hits_total"));
			assertTrue(prometheusFormat.contains("cache_misses_total"));
			assertTrue(prometheusFormat.contains("cache_memory_used_bytes"));
			assertTrue(prometheusFormat.contains("test-cache"));
		}
	}

	@Test
	public void testBindCaches() {
		PrometheusMeterRegistry registry = PrometheusMetricsHelper.createPrometheusRegistry();
		try (SBContentCache first = SBContentCache.builder().name("cache1").maxSize(1024).build();
			 SBContentCache second = SBContentCache.builder().name("cache2").maxSize(1024).build()) {

			MicrometerContentCacheBinder[] binders =
				PrometheusMetricsHelper.bindCaches(Arrays.asList(first, second), registry);

			assertEquals(2, binders.length);
			String scrape = registry.scrape();
			assertTrue(scrape.contains("cache1"));
			assertTrue(scrape.contains("cache2"));
		}
	}
}
