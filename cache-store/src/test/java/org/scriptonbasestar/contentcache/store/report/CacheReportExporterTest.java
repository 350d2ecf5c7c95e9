package org.scriptonbasestar.contentcache.store.report;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonMappingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.junit.Before;
import org.junit.Test;
import org.scriptonbasestar.contentcache.core.exception.SBCacheReportException;
import org.scriptonbasestar.contentcache.store.metrics.CacheStats;

import java.time.Duration;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

import static org.junit.Assert.*;

/**
 * CacheReportExporter 테스트
 *
 * @author archmagece
 * @since 2025-02
 */
public class CacheReportExporterTest {

	private CacheReportExporter exporter;
	private CacheStats stats;

	@Before
	public void setUp() {
		exporter = new CacheReportExporter();
		stats = new CacheStats(1, 1, 1, 0, 512, 1024, 1, Duration.ofSeconds(5), 0.5);
	}

	@Test
	public void testTextSections() {
		List<HotEntry> hot = Collections.singletonList(
			new HotEntry("textures/grass.png", 12, 0.4, 512, Duration.ofSeconds(3)));

		String report = exporter.export(stats, hot);

		assertTrue(report.startsWith("=== Cache Report ===\n"));
		assertTrue(report.contains("Total requests: 2\n"));
		assertTrue(report.contains("Hits: 1 (50.00%)\n"));
		assertTrue(report.contains("Misses: 1 (50.00%)\n"));
		assertTrue(report.contains("Memory usage: 512 / 1024 bytes (50.0%)\n"));
		assertTrue(report.contains("Average entry size: 512 bytes\n"));
		assertTrue(report.contains("Oldest entry age: PT5S\n"));
		assertTrue(report.contains("Memory pressure: 50.0%\n"));
		assertTrue(report.contains("textures/grass.png: 12 accesses, 0.40 Hz, 512 bytes, idle PT3S\n"));
		assertTrue(report.contains("=== Snapshot ===\n{"));
	}

	@Test
	public void testEmptyCacheReportsFullMissRate() {
		CacheStats empty = new CacheStats(0, 0, 0, 0, 0, 1024, 0, Duration.ZERO, 0.0);

		String report = exporter.export(empty, Collections.emptyList());

		assertTrue(report.contains("Total requests: 0\n"));
		assertTrue(report.contains("Hits: 0 (0.00%)\n"));
		assertTrue(report.contains("Misses: 0 (100.00%)\n"));
	}

	@Test
	public void testHotEntriesAreLimited() {
		List<HotEntry> hot = new ArrayList<>();
		for (int i = 0; i < 15; i++) {
			hot.add(new HotEntry("key-" + i, 100 - i, 1.0, 10, Duration.ZERO));
		}

		String report = exporter.export(stats, hot);

		assertTrue(report.contains("key-9:"));
		assertFalse(report.contains("key-10:"));
	}

	@Test
	public void testJsonSnapshot() throws Exception {
		String json = exporter.toJson(stats);

		JsonNode node = new ObjectMapper().readTree(json);
		assertEquals(1, node.get("hits").asLong());
		assertEquals(2, node.get("totalRequests").asLong());
		assertEquals(512, node.get("currentSize").asLong());
		assertEquals(5000, node.get("oldestEntryAgeMillis").asLong());
		assertEquals(0.5, node.get("memoryPressure").asDouble(), 0.0001);
		assertNull(node.get("hitRate"));
	}

	@Test
	public void testSerialisationFailureIsWrapped() {
		ObjectMapper failing = new ObjectMapper() {
			@Override
			public String writeValueAsString(Object value) throws JsonProcessingException {
				throw new JsonMappingException(null, "boom");
			}
		};
		CacheReportExporter failingExporter = new CacheReportExporter(failing);

		try {
			failingExporter.export(stats, Collections.emptyList());
			fail("Expected SBCacheReportException");
		} catch (SBCacheReportException e) {
			assertTrue(e.getCause() instanceof JsonProcessingException);
		}
	}

	@Test(expected = IllegalArgumentException.class)
	public void testNullObjectMapperRejected() {
		new CacheReportExporter(null);
	}
}
