package org.scriptonbasestar.contentcache.store.metrics;

import com.fasterxml.jackson.annotation.JsonAutoDetect;
import com.fasterxml.jackson.annotation.JsonPropertyOrder;

import java.time.Duration;
import java.time.Instant;

/**
 * 캐시 상태의 불변 스냅샷
 *
 * 호출 시점의 카운터와 크기 정보를 복사해 둡니다. 캐시 상태의 근거가 되지 않으며
 * 보고서 출력과 모니터링에만 사용됩니다. JSON 직렬화는 필드 기준입니다.
 *
 * @author archmagece
 * @since 2025-02
 */
@JsonAutoDetect(
	fieldVisibility = JsonAutoDetect.Visibility.ANY,
	getterVisibility = JsonAutoDetect.Visibility.NONE,
	isGetterVisibility = JsonAutoDetect.Visibility.NONE
)
@JsonPropertyOrder({
	"timestamp", "hits", "misses", "insertions", "evictions", "totalRequests",
	"currentSize", "maxSize", "entryCount", "averageEntrySize", "oldestEntryAgeMillis", "memoryPressure"
})
public class CacheStats {

	private final long timestamp;
	private final long hits;
	private final long misses;
	private final long insertions;
	private final long evictions;
	private final long totalRequests;
	private final long currentSize;
	private final long maxSize;
	private final int entryCount;
	private final long averageEntrySize;
	private final long oldestEntryAgeMillis;
	private final double memoryPressure;

	public CacheStats(
		long hits,
		long misses,
		long insertions,
		long evictions,
		long currentSize,
		long maxSize,
		int entryCount,
		Duration oldestEntryAge,
		double memoryPressure
	) {
		this.timestamp = System.currentTimeMillis();
		this.hits = hits;
		this.misses = misses;
		this.insertions = insertions;
		this.evictions = evictions;
		this.totalRequests = hits + misses;
		this.currentSize = currentSize;
		this.maxSize = maxSize;
		this.entryCount = entryCount;
		this.averageEntrySize = entryCount == 0 ? 0 : currentSize / entryCount;
		this.oldestEntryAgeMillis = oldestEntryAge == null ? 0 : oldestEntryAge.toMillis();
		this.memoryPressure = memoryPressure;
	}

	/**
	 * @return 스냅샷 생성 시간 (epoch milliseconds)
	 */
	public long timestamp() {
		return timestamp;
	}

	public Instant instant() {
		return Instant.ofEpochMilli(timestamp);
	}

	public long hits() {
		return hits;
	}

	public long misses() {
		return misses;
	}

	public long insertions() {
		return insertions;
	}

	public long evictions() {
		return evictions;
	}

	public long totalRequests() {
		return totalRequests;
	}

	public long currentSize() {
		return currentSize;
	}

	public long maxSize() {
		return maxSize;
	}

	public int entryCount() {
		return entryCount;
	}

	public long averageEntrySize() {
		return averageEntrySize;
	}

	public Duration oldestEntryAge() {
		return Duration.ofMillis(oldestEntryAgeMillis);
	}

	public double memoryPressure() {
		return memoryPressure;
	}

	/**
	 * @return 히트율 (0.0 ~ 1.0), 요청이 없으면 0.0
	 */
	public double hitRate() {
		return totalRequests == 0 ? 0.0 : (double) hits / totalRequests;
	}

	/**
	 * {@code 1 - hitRate()}. 요청이 없으면 1.0 (리포트의 빈 캐시는 100% 미스로 표시된다).
	 * 실시간 카운터인 {@link CacheMetrics#missRate()} 는 요청이 없을 때 0.0 을 반환한다.
	 *
	 * @return 미스율 (0.0 ~ 1.0)
	 */
	public double missRate() {
		return 1.0 - hitRate();
	}

	/**
	 * @return 사용률 (currentSize / maxSize), maxSize가 0이면 0.0
	 */
	public double utilization() {
		return maxSize <= 0 ? 0.0 : (double) currentSize / maxSize;
	}

	@Override
	public String toString() {
		return String.format(
			"CacheStats{requests=%d, hits=%d, misses=%d, hitRate=%.2f%%, entries=%d, size=%d/%d, pressure=%.2f}",
			totalRequests, hits, misses, hitRate() * 100, entryCount, currentSize, maxSize, memoryPressure
		);
	}
}
