package dev.ocip.harvester.engine;

import static org.assertj.core.api.Assertions.*;

import dev.ocip.harvester.model.FailureReason;
import dev.ocip.harvester.portal.PageUnavailableException;
import dev.ocip.harvester.portal.TransientPortalException;
import java.util.concurrent.TimeoutException;
import org.junit.jupiter.api.Test;

class FailureClassifierTest {

	@Test
	void testPortalExceptionsKeepTheirReason() {
		// When/Then
		assertThat(FailureClassifier.classify(new PageUnavailableException("gone")))
				.isEqualTo(FailureReason.PAGE_UNAVAILABLE);
		assertThat(FailureClassifier.classify(TransientPortalException.renderFailure("blank")))
				.isEqualTo(FailureReason.RENDER_FAILURE);
	}

	@Test
	void testOtherExceptionsByMessage() {
		// When/Then
		assertThat(FailureClassifier.classify(new TimeoutException())).isEqualTo(FailureReason.TIMEOUT);
		assertThat(FailureClassifier.classify(new IllegalStateException("Navigation timed out")))
				.isEqualTo(FailureReason.TIMEOUT);
		assertThat(FailureClassifier.classify(new RuntimeException("HTTP 429"))).isEqualTo(FailureReason.RATE_LIMITED);
		assertThat(FailureClassifier.classify(new RuntimeException("Too Many Requests")))
				.isEqualTo(FailureReason.RATE_LIMITED);
		assertThat(FailureClassifier.classify(new RuntimeException())).isEqualTo(FailureReason.UNKNOWN);
		assertThat(FailureClassifier.classify(null)).isEqualTo(FailureReason.UNKNOWN);
	}

	@Test
	void testRetriesOf() {
		// When/Then
		assertThat(FailureClassifier.retriesOf(new RetriesExhaustedException(3, TransientPortalException.timeout("x"))))
				.isEqualTo(2);
		assertThat(FailureClassifier.retriesOf(new PageUnavailableException("gone"))).isZero();
	}
}
