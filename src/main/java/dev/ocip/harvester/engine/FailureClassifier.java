package dev.ocip.harvester.engine;

import dev.ocip.harvester.model.FailureReason;
import dev.ocip.harvester.portal.PortalException;
import java.util.Locale;
import java.util.concurrent.TimeoutException;

/** Maps exceptions to ledger failure reasons */
public final class FailureClassifier {

	private FailureClassifier() {}

	public static FailureReason classify(Throwable error) {
		if (error == null) {
			return FailureReason.UNKNOWN;
		}
		if (error instanceof PortalException portalException && portalException.reason() != null) {
			return portalException.reason();
		}
		if (error instanceof TimeoutException) {
			return FailureReason.TIMEOUT;
		}
		String message = error.getMessage() == null ? "" : error.getMessage().toLowerCase(Locale.ROOT);
		if (message.contains("timeout") || message.contains("timed out")) {
			return FailureReason.TIMEOUT;
		}
		if (message.contains("429") || message.contains("rate limit") || message.contains("too many requests")) {
			return FailureReason.RATE_LIMITED;
		}
		return FailureReason.UNKNOWN;
	}

	/** Retries spent before a failure became terminal */
	public static int retriesOf(Throwable error) {
		if (error instanceof RetriesExhaustedException exhausted) {
			return exhausted.attempts() - 1;
		}
		return 0;
	}
}
