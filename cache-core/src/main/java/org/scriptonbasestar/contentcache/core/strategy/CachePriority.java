package org.scriptonbasestar.contentcache.core.strategy;

/**
 * Retention priority of a cached entry.
 * <p>
 * Priority never makes an entry permanently un-evictable. It scales the minimum idle time an
 * entry must reach before it becomes an eviction candidate under size pressure.
 * </p>
 * <p>
 * The minimum idle time is multiplied, not divided, by the multiplier. Dividing would make
 * CRITICAL entries the first to go.
 * </p>
 *
 * <h3>Retention multipliers:</h3>
 * <table border="1">
 * <tr>
 *   <th>Priority</th>
 *   <th>Multiplier</th>
 *   <th>Required idle (minIdleTime = 5 min)</th>
 * </tr>
 * <tr><td>LOW</td><td>0.5</td><td>always evictable</td></tr>
 * <tr><td>NORMAL</td><td>1.0</td><td>5 min</td></tr>
 * <tr><td>HIGH</td><td>2.0</td><td>10 min</td></tr>
 * <tr><td>CRITICAL</td><td>5.0</td><td>25 min</td></tr>
 * </table>
 *
 * <h3>Usage Example:</h3>
 * <pre>{@code
 * cache.insert("ui/atlas.png", bytes, CachePriority.CRITICAL);
 * cache.insert("sfx/footstep.ogg", bytes, CachePriority.LOW);
 * }</pre>
 *
 * @author archmagece
 * @since 2025-02
 */
public enum CachePriority {

	/**
	 * Cheap to reload. Evictable regardless of idle time and also swept by the idle-expiry pass.
	 */
	LOW(0.5),

	/**
	 * Default priority.
	 */
	NORMAL(1.0),

	/**
	 * Frequently needed assets; must stay idle twice as long before eviction.
	 */
	HIGH(2.0),

	/**
	 * Assets whose absence stalls the caller (fonts, UI atlases).
	 */
	CRITICAL(5.0);

	private final double retentionMultiplier;

	CachePriority(double retentionMultiplier) {
		this.retentionMultiplier = retentionMultiplier;
	}

	/**
	 * Scaling factor applied to the minimum idle time before an entry of this priority
	 * becomes an eviction candidate.
	 *
	 * @return retention multiplier, always positive
	 */
	public double retentionMultiplier() {
		return retentionMultiplier;
	}
}
