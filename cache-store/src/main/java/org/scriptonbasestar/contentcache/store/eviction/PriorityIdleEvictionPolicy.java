package org.scriptonbasestar.contentcache.store.eviction;

import org.scriptonbasestar.contentcache.core.entry.CacheEntry;
import org.scriptonbasestar.contentcache.core.strategy.CachePriority;
import org.scriptonbasestar.contentcache.core.strategy.EvictionPolicy;
import org.scriptonbasestar.contentcache.core.util.TimeCheckerUtil;

import java.time.Duration;
import java.util.EnumMap;
import java.util.Map;

/**
 * Default eviction policy: priority-weighted idle time plus absolute age.
 * <p>
 * Under size pressure an entry is evictable once it has been idle for
 * {@code minIdleTime * priority.retentionMultiplier()}. {@link CachePriority#LOW} entries are
 * always evictable. The idle-expiry sweep drops any entry older than {@code maxAge} and LOW
 * entries idle for more than twice {@code minIdleTime}.
 * </p>
 *
 * <h4>Example (minIdleTime = 5 min):</h4>
 * <pre>
 * NORMAL idle 6 min   → evictable
 * HIGH   idle 6 min   → kept (needs 10 min)
 * CRITICAL idle 26 min → evictable
 * LOW    idle 0       → evictable
 * </pre>
 *
 * @author archmagece
 * @since 2025-02
 */
public class PriorityIdleEvictionPolicy implements EvictionPolicy {

	private final Duration minIdleTime;
	private final Duration maxAge;
	private final Duration lowPriorityExpiry;
	private final Map<CachePriority, Duration> requiredIdle;

	public PriorityIdleEvictionPolicy(Duration minIdleTime, Duration maxAge) {
		if (minIdleTime == null || minIdleTime.isNegative()) {
			throw new IllegalArgumentException("minIdleTime must not be null or negative");
		}
		if (maxAge == null || maxAge.isNegative()) {
			throw new IllegalArgumentException("maxAge must not be null or negative");
		}
		this.minIdleTime = minIdleTime;
		this.maxAge = maxAge;
		this.lowPriorityExpiry = TimeCheckerUtil.scale(minIdleTime, 2.0);
		this.requiredIdle = new EnumMap<>(CachePriority.class);
		for (CachePriority priority : CachePriority.values()) {
			requiredIdle.put(priority, TimeCheckerUtil.scale(minIdleTime, priority.retentionMultiplier()));
		}
	}

	@Override
	public boolean isEvictable(CacheEntry entry, long nowNanos) {
		if (entry.getPriority() == CachePriority.LOW) {
			return true;
		}
		return TimeCheckerUtil.hasElapsed(entry.getLastAccessed(), nowNanos, requiredIdle(entry.getPriority()));
	}

	@Override
	public boolean isExpired(CacheEntry entry, long nowNanos) {
		if (TimeCheckerUtil.hasExceeded(entry.getCreatedAt(), nowNanos, maxAge)) {
			return true;
		}
		return entry.getPriority() == CachePriority.LOW
			&& TimeCheckerUtil.hasExceeded(entry.getLastAccessed(), nowNanos, lowPriorityExpiry);
	}

	/**
	 * @param priority entry priority
	 * @return idle time an entry of this priority needs before it can be evicted for space
	 */
	public Duration requiredIdle(CachePriority priority) {
		return requiredIdle.get(priority);
	}

	public Duration getMinIdleTime() {
		return minIdleTime;
	}

	public Duration getMaxAge() {
		return maxAge;
	}

	@Override
	public String toString() {
		return "PriorityIdleEvictionPolicy{minIdleTime=" + minIdleTime + ", maxAge=" + maxAge + "}";
	}
}
