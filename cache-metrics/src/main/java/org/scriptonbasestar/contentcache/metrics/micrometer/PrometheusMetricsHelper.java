package org.scriptonbasestar.contentcache.metrics.micrometer;

import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.prometheus.PrometheusConfig;
import io.micrometer.prometheus.PrometheusMeterRegistry;
import org.scriptonbasestar.contentcache.store.cache.SBContentCache;

import java.util.Collection;

/**
 * Prometheus 메트릭 간편 설정 헬퍼
 *
 * <p>사용 예시:</p>
 * <pre>{@code
 * PrometheusMeterRegistry registry = PrometheusMetricsHelper.createPrometheusRegistry();
 * PrometheusMetricsHelper.bindCache(cache, registry);
 *
 * String prometheusFormat = registry.scrape();
 * }</pre>
 *
 * @author archmagece
 * @since 2025-02
 */
public class PrometheusMetricsHelper {

	/**
	 * 기본 설정으로 Prometheus 레지스트리를 생성합니다.
	 *
	 * @return PrometheusMeterRegistry
	 */
	public static PrometheusMeterRegistry createPrometheusRegistry() {
		return new PrometheusMeterRegistry(PrometheusConfig.DEFAULT);
	}

	/**
	 * 커스텀 설정으로 Prometheus 레지스트리를 생성합니다.
	 *
	 * @param config Prometheus 설정
	 * @return PrometheusMeterRegistry
	 */
	public static PrometheusMeterRegistry createPrometheusRegistry(PrometheusConfig config) {
		return new PrometheusMeterRegistry(config);
	}

	/**
	 * 캐시를 MeterRegistry에 바인딩합니다. 캐시 이름이 태그로 사용됩니다.
	 *
	 * @param cache 캐시
	 * @param meterRegistry 메터 레지스트리
	 * @return 바인더
	 */
	public static MicrometerContentCacheBinder bindCache(SBContentCache cache, MeterRegistry meterRegistry) {
		if (meterRegistry == null) {
			throw new IllegalArgumentException("MeterRegistry must not be null");
		}
		MicrometerContentCacheBinder binder = new MicrometerContentCacheBinder(cache);
		binder.bindTo(meterRegistry);
		return binder;
	}

	/**
	 * 여러 캐시를 한번에 바인딩합니다.
	 *
	 * @param caches 캐시 목록 (이름이 서로 달라야 함)
	 * @param meterRegistry 메터 레지스트리
	 * @return 바인더 배열
	 */
	public static MicrometerContentCacheBinder[] bindCaches(Collection<SBContentCache> caches, MeterRegistry meterRegistry) {
		return caches.stream()
			.map(cache -> bindCache(cache, meterRegistry))
			.toArray(MicrometerContentCacheBinder[]::new);
	}

	/**
	 * Prometheus 스크래핑 포맷으로 메트릭을 출력합니다.
	 *
	 * @param registry Prometheus 레지스트리
	 * @return Prometheus 포맷 문자열
	 */
	public static String scrapeMetrics(PrometheusMeterRegistry registry) {
		return registry.scrape();
	}

	private PrometheusMetricsHelper() {
		// 유틸리티 클래스
	}
}
