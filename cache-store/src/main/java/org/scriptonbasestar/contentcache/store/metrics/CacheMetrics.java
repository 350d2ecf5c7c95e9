package org.scriptonbasestar.contentcache.store.metrics;

import java.util.concurrent.atomic.AtomicLong;

/**
 * 콘텐츠 캐시의 누적 카운터.
 *
 * 캐시 락과 분리된 영역으로, AtomicLong만 사용하므로 어떤 스레드에서든 락 없이 읽을 수 있습니다.
 * 카운터는 clear() 이후에도 유지되며 {@link #reset()}으로만 초기화됩니다.
 *
 * @author archmagece
 * @since 2025-02
 */
public class CacheMetrics {

	private final AtomicLong hitCount = new AtomicLong(0);
	private final AtomicLong missCount = new AtomicLong(0);
	private final AtomicLong insertionCount = new AtomicLong(0);
	private final AtomicLong evictionCount = new AtomicLong(0);

	/**
	 * 캐시 히트 횟수를 증가시킵니다.
	 */
	public void recordHit() {
		hitCount.incrementAndGet();
	}

	/**
	 * 캐시 미스 횟수를 증가시킵니다.
	 */
	public void recordMiss() {
		missCount.incrementAndGet();
	}

	/**
	 * 삽입(교체 포함)을 기록합니다.
	 */
	public void recordInsertion() {
		insertionCount.incrementAndGet();
	}

	/**
	 * 캐시 항목 제거를 기록합니다.
	 *
	 * @param count 제거된 항목 수
	 */
	public void recordEviction(int count) {
		evictionCount.addAndGet(count);
	}

	public long hitCount() {
		return hitCount.get();
	}

	public long missCount() {
		return missCount.get();
	}

	/**
	 * 총 요청 횟수를 반환합니다 (히트 + 미스).
	 *
	 * @return 총 요청 횟수
	 */
	public long requestCount() {
		return hitCount.get() + missCount.get();
	}

	public long insertionCount() {
		return insertionCount.get();
	}

	public long evictionCount() {
		return evictionCount.get();
	}

	/**
	 * 캐시 히트율을 계산합니다.
	 *
	 * @return 히트율 (0.0 ~ 1.0), 요청이 없으면 0.0
	 */
	public double hitRate() {
		long hits = hitCount.get();
		long requests = hits + missCount.get();
		return requests == 0 ? 0.0 : (double) hits / requests;
	}

	/**
	 * 캐시 미스율을 계산합니다.
	 * 요청이 없으면 0.0 이다. 스냅샷인 {@link CacheStats#missRate()} 는 이 경우 1.0 을 반환한다.
	 *
	 * @return 미스율 (0.0 ~ 1.0), 요청이 없으면 0.0
	 */
	public double missRate() {
		long misses = missCount.get();
		long requests = hitCount.get() + misses;
		return requests == 0 ? 0.0 : (double) misses / requests;
	}

	/**
	 * 모든 통계를 초기화합니다.
	 */
	public void reset() {
		hitCount.set(0);
		missCount.set(0);
		insertionCount.set(0);
		evictionCount.set(0);
	}

	@Override
	public String toString() {
		return String.format(
			"CacheMetrics{requests=%d, hits=%d, misses=%d, hitRate=%.2f%%, insertions=%d, evictions=%d}",
			requestCount(),
			hitCount(),
			missCount(),
			hitRate() * 100,
			insertionCount(),
			evictionCount()
		);
	}
}
