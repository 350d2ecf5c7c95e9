package org.scriptonbasestar.contentcache.core.exception;

/**
 * Thrown when a cache report or statistics snapshot cannot be serialized.
 *
 * @author archmagece
 * @since 2025-02
 */
public class SBCacheReportException extends RuntimeException {

	public SBCacheReportException(String message) {
		super(message);
	}

	public SBCacheReportException(String message, Throwable cause) {
		super(message, cause);
	}

	public SBCacheReportException(Throwable cause) {
		super(cause);
	}
}
