package markbridge.loss;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;

/**
 * Collects loss records for a single conversion run. Ids are assigned in creation
 * order: L0001, L0002, ...
 */
public final class LossTracker {
	private static final Logger log = LoggerFactory.getLogger(LossTracker.class);
	private static final int MAX_SNIPPET = 200;

	private final List<LossRecord> losses = new ArrayList<>();
	private final Set<String> warnings = new LinkedHashSet<>();
	private int sequence;

	public LossRecord record(LossKind kind, String name, String message, String snippet, String context) {
		sequence++;
		String id = String.format("L%04d", sequence);
		LossRecord loss = new LossRecord(id, kind, name, message, truncate(snippet), context);
		losses.add(loss);
		log.debug("loss {} [{}] {}", id, kind.id(), message);
		return loss;
	}

	/** Position to roll back to when a subtree's work is discarded. */
	public int checkpoint() {
		return losses.size();
	}

	/** Drops the records created after {@code checkpoint}; their ids are reused. */
	public void rollback(int checkpoint) {
		while (losses.size() > checkpoint) {
			losses.remove(losses.size() - 1);
		}
		sequence = checkpoint;
	}

	public void warn(String message) {
		warnings.add(message);
	}

	public List<LossRecord> losses() {
		return List.copyOf(losses);
	}

	public int size() {
		return losses.size();
	}

	public LossReport report(String sourceLang, String targetLang) {
		return new LossReport(sourceLang, targetLang, List.copyOf(losses), List.copyOf(warnings));
	}

	private static String truncate(String snippet) {
		if (snippet == null || snippet.length() <= MAX_SNIPPET) {
			return snippet;
		}
		return snippet.substring(0, MAX_SNIPPET) + "...";
	}
}
