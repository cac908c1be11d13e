package org.javai.dbresilience.ops;

import java.time.Duration;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collection;
import java.util.List;
import org.javai.dbresilience.Failure;

/**
 * An {@link OpReporter} that delegates to multiple reporters.
 *
 * <p>All configured reporters receive every call. If a reporter throws, the exception is
 * caught and printed to stderr, and the remaining reporters still run. Nothing propagates to
 * the caller.
 *
 * <pre>{@code
 * OpReporter reporter = CompositeOpReporter.of(
 *     new Log4jOpReporter(),
 *     new MetricsOpReporter("orders")
 * );
 * }</pre>
 */
public final class CompositeOpReporter implements OpReporter {

	private final List<OpReporter> reporters;

	private CompositeOpReporter(List<OpReporter> reporters) {
		this.reporters = List.copyOf(reporters);
	}

	/**
	 * Creates a composite reporter from the given reporters.
	 *
	 * @param reporters the reporters to delegate to
	 * @return a composite that fans out to all given reporters
	 */
	public static CompositeOpReporter of(OpReporter... reporters) {
		return new CompositeOpReporter(Arrays.asList(reporters));
	}

	/**
	 * Creates a composite reporter from a collection of reporters.
	 *
	 * @param reporters the reporters to delegate to
	 * @return a composite that fans out to all given reporters
	 */
	public static CompositeOpReporter of(Collection<? extends OpReporter> reporters) {
		return new CompositeOpReporter(new ArrayList<>(reporters));
	}

	@Override
	public void report(Failure failure) {
		for (OpReporter reporter : reporters) {
			try {
				reporter.report(failure);
			} catch (Exception e) {
				logReporterError("report", reporter, e);
			}
		}
	}

	@Override
	public void reportRetryAttempt(Failure failure, int attemptNumber, int maxAttempts) {
		for (OpReporter reporter : reporters) {
			try {
				reporter.reportRetryAttempt(failure, attemptNumber, maxAttempts);
			} catch (Exception e) {
				logReporterError("reportRetryAttempt", reporter, e);
			}
		}
	}

	@Override
	public void reportBackoff(Failure failure, int attemptNumber, Duration delay) {
		for (OpReporter reporter : reporters) {
			try {
				reporter.reportBackoff(failure, attemptNumber, delay);
			} catch (Exception e) {
				logReporterError("reportBackoff", reporter, e);
			}
		}
	}

	/**
	 * Returns the number of reporters in this composite.
	 */
	public int size() {
		return reporters.size();
	}

	private static void logReporterError(String method, OpReporter reporter, Exception e) {
		try {
			System.err.println("OpReporter." + method + " failed for " +
				reporter.getClass().getName() + ": " + e.getMessage());
		} catch (RuntimeException ignored) {
			// stderr itself is broken; there is nowhere left to report
		}
	}
}
