package org.scriptonbasestar.contentcache.core.util;

import lombok.experimental.UtilityClass;
import lombok.extern.slf4j.Slf4j;

import java.time.Duration;

/**
 * Ticker 기반 경과 시간 계산 유틸리티
 *
 * @author archmagece
 * @since 2025-02
 */
@Slf4j
@UtilityClass
public class TimeCheckerUtil {

	/**
	 * ticker 로 잴 수 있는 가장 긴 시간 (약 292년)
	 */
	public static final Duration MAX_TICKER_DURATION = Duration.ofNanos(Long.MAX_VALUE);

	/**
	 * 두 ticker 값 사이의 경과 시간을 반환합니다. 역전된 값은 0으로 취급합니다.
	 *
	 * @param sinceNanos 시작 시점 (nanoseconds)
	 * @param nowNanos 현재 시점 (nanoseconds)
	 * @return 경과 시간, 음수가 되지 않음
	 */
	public static Duration elapsed(long sinceNanos, long nowNanos) {
		long diff = nowNanos - sinceNanos;
		return diff <= 0 ? Duration.ZERO : Duration.ofNanos(diff);
	}

	/**
	 * 시작 시점으로부터 threshold 이상 지났는지 확인합니다.
	 *
	 * @param sinceNanos 시작 시점 (nanoseconds)
	 * @param nowNanos 현재 시점 (nanoseconds)
	 * @param threshold 기준 시간
	 * @return 경과 시간이 threshold 이상이면 true
	 */
	public static boolean hasElapsed(long sinceNanos, long nowNanos, Duration threshold) {
		Duration elapsed = elapsed(sinceNanos, nowNanos);
		if (log.isTraceEnabled()) {
			log.trace("hasElapsed 비교 - elapsed : {}, threshold : {}", elapsed, threshold);
		}
		return elapsed.compareTo(threshold) >= 0;
	}

	/**
	 * 시작 시점으로부터 threshold 를 초과해서 지났는지 확인합니다.
	 *
	 * @param sinceNanos 시작 시점 (nanoseconds)
	 * @param nowNanos 현재 시점 (nanoseconds)
	 * @param threshold 기준 시간
	 * @return 경과 시간이 threshold 보다 크면 true
	 */
	public static boolean hasExceeded(long sinceNanos, long nowNanos, Duration threshold) {
		return elapsed(sinceNanos, nowNanos).compareTo(threshold) > 0;
	}

	/**
	 * Duration 에 배수를 곱합니다. 배수는 양수여야 합니다.
	 * 결과는 {@link #MAX_TICKER_DURATION} 에서 포화됩니다.
	 *
	 * @param base 기준 시간
	 * @param multiplier 배수
	 * @return 곱해진 시간 (나노초 단위 반올림)
	 */
	public static Duration scale(Duration base, double multiplier) {
		if (multiplier <= 0) {
			throw new IllegalArgumentException("multiplier must be positive: " + multiplier);
		}
		if (base.compareTo(MAX_TICKER_DURATION) >= 0) {
			return MAX_TICKER_DURATION;
		}
		// Math.round 는 long 범위를 넘으면 Long.MAX_VALUE 로 포화
		return Duration.ofNanos(Math.round(base.toNanos() * multiplier));
	}
}
