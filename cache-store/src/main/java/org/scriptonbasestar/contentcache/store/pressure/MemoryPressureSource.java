package org.scriptonbasestar.contentcache.store.pressure;

import java.lang.management.ManagementFactory;
import java.lang.management.MemoryUsage;

/**
 * Supplies a memory pressure reading in [0, 1].
 *
 * @author archmagece
 * @since 2025-02
 */
@FunctionalInterface
public interface MemoryPressureSource {

	double currentPressure();

	/**
	 * JVM heap used / max. Falls back to committed when the heap has no defined maximum.
	 *
	 * @return heap based source
	 */
	static MemoryPressureSource heap() {
		return () -> {
			MemoryUsage usage = ManagementFactory.getMemoryMXBean().getHeapMemoryUsage();
			long limit = usage.getMax() > 0 ? usage.getMax() : usage.getCommitted();
			if (limit <= 0) {
				return 0.0;
			}
			return Math.min(1.0, (double) usage.getUsed() / limit);
		};
	}
}
