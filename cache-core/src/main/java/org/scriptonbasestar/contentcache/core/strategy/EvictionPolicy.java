package org.scriptonbasestar.contentcache.core.strategy;

import org.scriptonbasestar.contentcache.core.entry.CacheEntry;

/**
 * Decision logic for removing cached entries.
 * <p>
 * Implementations are pure: they only inspect the entry and the supplied timestamp and never
 * mutate cache state. The cache calls them while holding its internal lock, so they must be
 * fast and must not call back into the cache.
 * </p>
 *
 * @author archmagece
 * @since 2025-02
 */
public interface EvictionPolicy {

	/**
	 * Called while reclaiming space, for candidates walked from the least recently used end.
	 *
	 * @param entry     the candidate entry
	 * @param nowNanos  current ticker reading
	 * @return true if the entry may be removed to free space
	 */
	boolean isEvictable(CacheEntry entry, long nowNanos);

	/**
	 * Called by the periodic idle-expiry sweep for every entry.
	 *
	 * @param entry     the entry to check
	 * @param nowNanos  current ticker reading
	 * @return true if the entry is stale and should be dropped regardless of size pressure
	 */
	boolean isExpired(CacheEntry entry, long nowNanos);
}
