package org.javai.dbresilience.ops.log4j;

import java.time.Duration;
import org.apache.logging.log4j.Level;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.apache.logging.log4j.Marker;
import org.apache.logging.log4j.MarkerManager;
import org.javai.dbresilience.Failure;
import org.javai.dbresilience.ops.OpReporter;

/**
 * Reports retries and terminal failures using Log4j2.
 *
 * <p>Each retried attempt produces exactly two lines:
 * <pre>
 * [Retry] executeQuery attempt 1/3 failed: Connection refused
 * [Retry] Waiting 532ms before retry...
 * </pre>
 *
 * <p>Terminal failures are logged at WARN when transient (retries exhausted) and at ERROR when
 * permanent. Logging faults are contained here and never reach the caller.
 */
public class Log4jOpReporter implements OpReporter {

	public static final String DEFAULT_LOGGER_NAME = "org.javai.dbresilience.OpReporter";

	static final Marker FAILURE_MARKER = MarkerManager.getMarker("FAILURE");
	static final Marker RETRY_MARKER = MarkerManager.getMarker("RETRY");
	static final Marker BACKOFF_MARKER = MarkerManager.getMarker("BACKOFF");

	private final Logger logger;

	/**
	 * Creates a Log4jOpReporter using the default logger name.
	 */
	public Log4jOpReporter() {
		this(LogManager.getLogger(DEFAULT_LOGGER_NAME));
	}

	/**
	 * Creates a Log4jOpReporter with a custom logger name.
	 *
	 * @param loggerName the logger name
	 */
	public Log4jOpReporter(String loggerName) {
		this(LogManager.getLogger(loggerName));
	}

	/**
	 * Creates a Log4jOpReporter with a specific logger instance.
	 *
	 * @param logger the Log4j logger to use
	 */
	public Log4jOpReporter(Logger logger) {
		this.logger = logger;
	}

	@Override
	public void report(Failure failure) {
		try {
			logger.atLevel(failure.isTransient() ? Level.WARN : Level.ERROR)
				.withMarker(FAILURE_MARKER)
				.log(formatFailureMessage(failure));
		} catch (RuntimeException e) {
			// Reporting should not break the application
		}
	}

	@Override
	public void reportRetryAttempt(Failure failure, int attemptNumber, int maxAttempts) {
		try {
			logger.atWarn()
				.withMarker(RETRY_MARKER)
				.log("[Retry] {} attempt {}/{} failed: {}",
					failure.operation(),
					attemptNumber,
					maxAttempts,
					failure.message());
		} catch (RuntimeException e) {
			// Reporting should not break the application
		}
	}

	@Override
	public void reportBackoff(Failure failure, int attemptNumber, Duration delay) {
		try {
			logger.atInfo()
				.withMarker(BACKOFF_MARKER)
				.log("[Retry] Waiting {}ms before retry...", delay.toMillis());
		} catch (RuntimeException e) {
			// Reporting should not break the application
		}
	}

	private static String formatFailureMessage(Failure failure) {
		return """
			Failure in operation [%s] on resource [%s] after %d attempt(s): %s \
			| type=%s, reason=%s%s\
			""".formatted(
				failure.operation(),
				failure.resource(),
				failure.attempts(),
				failure.message(),
				failure.classification().type(),
				failure.classification().reason(),
				failure.diagnosticCode().map(code -> ", sqlState=" + code).orElse("")
			).trim();
	}
}
