package org.scriptonbasestar.contentcache.store.metrics;

import org.scriptonbasestar.contentcache.store.cache.SBContentCache;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;

/**
 * 캐시 헬스체크 유틸리티
 *
 * 캐시 스냅샷을 임계값과 비교해 건강 상태를 평가합니다.
 * 낮은 히트율과 높은 사용률은 경고, 임계값을 넘는 메모리 압력은 에러, 적은 요청 수는 정보로 분류됩니다.
 *
 * @author archmagece
 * @since 2025-02
 */
public class CacheHealthCheck {

	private final SBContentCache cache;
	private final HealthThresholds thresholds;

	/**
	 * 기본 임계값으로 헬스체크 생성
	 *
	 * @param cache 대상 캐시
	 */
	public CacheHealthCheck(SBContentCache cache) {
		this(cache, HealthThresholds.DEFAULT);
	}

	/**
	 * 커스텀 임계값으로 헬스체크 생성
	 *
	 * @param cache 대상 캐시
	 * @param thresholds 건강 임계값
	 */
	public CacheHealthCheck(SBContentCache cache, HealthThresholds thresholds) {
		if (cache == null) {
			throw new IllegalArgumentException("Cache must not be null");
		}
		if (thresholds == null) {
			throw new IllegalArgumentException("Thresholds must not be null");
		}
		this.cache = cache;
		this.thresholds = thresholds;
	}

	/**
	 * 캐시의 현재 상태를 평가합니다.
	 *
	 * @return 건강 상태 결과
	 */
	public HealthStatus check() {
		return evaluate(cache.getStats(), thresholds);
	}

	/**
	 * 캐시가 건강한지 확인합니다.
	 *
	 * @return 건강하면 true
	 */
	public boolean isHealthy() {
		return check().isHealthy();
	}

	public HealthThresholds thresholds() {
		return thresholds;
	}

	/**
	 * 스냅샷 하나를 평가합니다.
	 *
	 * @param stats 캐시 스냅샷
	 * @param thresholds 건강 임계값
	 * @return 건강 상태 결과
	 */
	public static HealthStatus evaluate(CacheStats stats, HealthThresholds thresholds) {
		HealthStatus.Builder builder = new HealthStatus.Builder();

		// 요청이 충분할 때만 히트율을 본다
		long requests = stats.totalRequests();
		if (requests < thresholds.minRequests) {
			builder.addInfo(String.format(
				"Low request count: %d (threshold: %d)",
				requests, thresholds.minRequests
			));
		} else if (stats.hitRate() < thresholds.minHitRate) {
			builder.addWarning(String.format(
				"Low hit rate: %.2f%% (threshold: %.2f%%)",
				stats.hitRate() * 100, thresholds.minHitRate * 100
			));
		}

		// 사용률 검사
		double utilization = stats.utilization();
		if (utilization > thresholds.maxUtilization) {
			builder.addWarning(String.format(
				"High utilization: %.2f%% (threshold: %.2f%%)",
				utilization * 100, thresholds.maxUtilization * 100
			));
		}

		// 메모리 압력 검사
		double pressure = stats.memoryPressure();
		if (pressure > thresholds.maxMemoryPressure) {
			builder.addError(String.format(
				"High memory pressure: %.2f (threshold: %.2f)",
				pressure, thresholds.maxMemoryPressure
			));
		}

		return builder.build();
	}

	/**
	 * 건강 임계값 설정
	 */
	public static class HealthThresholds {

		/**
		 * 기본 임계값
		 */
		public static final HealthThresholds DEFAULT = new HealthThresholds(
			0.5,    // minHitRate: 50%
			0.9,    // maxUtilization: 90%
			0.9,    // maxMemoryPressure
			10      // minRequests
		);

		/**
		 * 엄격한 임계값
		 */
		public static final HealthThresholds STRICT = new HealthThresholds(
			0.8,    // minHitRate: 80%
			0.8,    // maxUtilization: 80%
			0.8,    // maxMemoryPressure
			100     // minRequests
		);

		/**
		 * 느슨한 임계값
		 */
		public static final HealthThresholds RELAXED = new HealthThresholds(
			0.3,    // minHitRate: 30%
			0.95,   // maxUtilization: 95%
			0.95,   // maxMemoryPressure
			5       // minRequests
		);

		public final double minHitRate;
		public final double maxUtilization;
		public final double maxMemoryPressure;
		public final long minRequests;

		public HealthThresholds(
			double minHitRate,
			double maxUtilization,
			double maxMemoryPressure,
			long minRequests
		) {
			this.minHitRate = minHitRate;
			this.maxUtilization = maxUtilization;
			this.maxMemoryPressure = maxMemoryPressure;
			this.minRequests = minRequests;
		}
	}

	/**
	 * 건강 상태 결과
	 */
	public static class HealthStatus {

		private final boolean healthy;
		private final String[] errors;
		private final String[] warnings;
		private final String[] info;

		private HealthStatus(boolean healthy, String[] errors, String[] warnings, String[] info) {
			this.healthy = healthy;
			this.errors = errors;
			this.warnings = warnings;
			this.info = info;
		}

		/**
		 * @return 에러가 없으면 true
		 */
		public boolean isHealthy() {
			return healthy;
		}

		public String[] errors() {
			return errors;
		}

		public String[] warnings() {
			return warnings;
		}

		public String[] info() {
			return info;
		}

		@Override
		public String toString() {
			StringBuilder sb = new StringBuilder();
			sb.append("HealthStatus{healthy=").append(healthy);
			if (errors.length > 0) {
				sb.append(", errors=").append(Arrays.toString(errors));
			}
			if (warnings.length > 0) {
				sb.append(", warnings=").append(Arrays.toString(warnings));
			}
			if (info.length > 0) {
				sb.append(", info=").append(Arrays.toString(info));
			}
			sb.append("}");
			return sb.toString();
		}

		static class Builder {
			private final List<String> errors = new ArrayList<>();
			private final List<String> warnings = new ArrayList<>();
			private final List<String> info = new ArrayList<>();

			Builder addError(String message) {
				errors.add(message);
				return this;
			}

			Builder addWarning(String message) {
				warnings.add(message);
				return this;
			}

			Builder addInfo(String message) {
				info.add(message);
				return this;
			}

			HealthStatus build() {
				return new HealthStatus(
					errors.isEmpty(),
					errors.toArray(new String[0]),
					warnings.toArray(new String[0]),
					info.toArray(new String[0])
				);
			}
		}
	}
}
