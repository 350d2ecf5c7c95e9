package org.scriptonbasestar.contentcache.store.report;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.scriptonbasestar.contentcache.core.exception.SBCacheReportException;
import org.scriptonbasestar.contentcache.store.metrics.CacheStats;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.List;
import java.util.Locale;

/**
 * 캐시 보고서 생성기
 * 사람이 읽는 텍스트 보고서와 JSON 스냅샷을 만듭니다.
 *
 * <p>출력 예시:</p>
 * <pre>
 * === Cache Report ===
 * Total requests: 2
 * Hits: 1 (50.00%)
 * Misses: 1 (50.00%)
 * ...
 * === Hot Entries (top 10) ===
 * textures/grass.png: 12 accesses, 0.40 Hz, 4096 bytes, idle PT3S
 * === Snapshot ===
 * {"timestamp":...,"hits":1,...}
 * </pre>
 *
 * @author archmagece
 * @since 2025-02
 */
public class CacheReportExporter {

	private static final Logger log = LoggerFactory.getLogger(CacheReportExporter.class);

	public static final int HOT_ENTRY_LIMIT = 10;

	private final ObjectMapper objectMapper;

	public CacheReportExporter() {
		this(new ObjectMapper());
	}

	/**
	 * @param objectMapper Jackson ObjectMapper
	 */
	public CacheReportExporter(ObjectMapper objectMapper) {
		if (objectMapper == null) {
			throw new IllegalArgumentException("ObjectMapper must not be null");
		}
		this.objectMapper = objectMapper;
	}

	/**
	 * 텍스트 보고서를 생성합니다.
	 *
	 * @param stats 캐시 스냅샷
	 * @param hotEntries 접근 횟수 내림차순으로 정렬된 항목
	 * @return 보고서
	 * @throws SBCacheReportException 스냅샷 직렬화 실패 시
	 */
	public String export(CacheStats stats, List<HotEntry> hotEntries) {
		StringBuilder sb = new StringBuilder();
		sb.append("=== Cache Report ===\n");
		sb.append("Total requests: ").append(stats.totalRequests()).append('\n');
		sb.append("Hits: ").append(stats.hits())
			.append(" (").append(format("%.2f", stats.hitRate() * 100)).append("%)\n");
		sb.append("Misses: ").append(stats.misses())
			.append(" (").append(format("%.2f", stats.missRate() * 100)).append("%)\n");
		sb.append("Entries: ").append(stats.entryCount()).append('\n');
		sb.append("Memory usage: ").append(stats.currentSize()).append(" / ").append(stats.maxSize())
			.append(" bytes (").append(format("%.1f", stats.utilization() * 100)).append("%)\n");
		sb.append("Average entry size: ").append(stats.averageEntrySize()).append(" bytes\n");
		sb.append("Oldest entry age: ").append(stats.oldestEntryAge()).append('\n');
		sb.append("Memory pressure: ").append(format("%.1f", stats.memoryPressure() * 100)).append("%\n");
		sb.append('\n');

		sb.append("=== Hot Entries (top ").append(HOT_ENTRY_LIMIT).append(") ===\n");
		int written = 0;
		for (HotEntry entry : hotEntries) {
			if (written++ >= HOT_ENTRY_LIMIT) {
				break;
			}
			sb.append(entry.getKey()).append(": ")
				.append(entry.getAccessCount()).append(" accesses, ")
				.append(format("%.2f", entry.getAccessFrequency())).append(" Hz, ")
				.append(entry.getSize()).append(" bytes, idle ")
				.append(entry.getIdleTime()).append('\n');
		}
		sb.append('\n');

		sb.append("=== Snapshot ===\n");
		sb.append(toJson(stats)).append('\n');
		return sb.toString();
	}

	/**
	 * 스냅샷을 JSON 한 줄로 직렬화합니다.
	 *
	 * @param stats 캐시 스냅샷
	 * @return JSON 문자열
	 * @throws SBCacheReportException 직렬화 실패 시
	 */
	public String toJson(CacheStats stats) {
		try {
			return objectMapper.writeValueAsString(stats);
		} catch (JsonProcessingException e) {
			log.error("Failed to serialise cache stats snapshot", e);
			throw new SBCacheReportException("Failed to serialise cache stats snapshot", e);
		}
	}

	private static String format(String pattern, double value) {
		return String.format(Locale.ROOT, pattern, value);
	}
}
