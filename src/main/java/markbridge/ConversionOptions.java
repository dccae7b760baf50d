package markbridge;

import java.time.Duration;
import java.util.EnumSet;
import java.util.Properties;
import java.util.Set;

/**
 * Per-conversion configuration.
 *
 * Recognized property keys: {@code max-macro-depth}, {@code max-loop-iterations},
 * {@code max-call-depth}, {@code features}, {@code allow-no-gain},
 * {@code math-only}, {@code loss-comments}, {@code document-wrapper},
 * {@code repair-timeout-ms}.
 */
public record ConversionOptions(
		int maxMacroDepth,
		int maxLoopIterations,
		int maxCallDepth,
		Set<Feature> features,
		boolean allowNoGain,
		boolean mathOnly,
		boolean lossComments,
		boolean documentWrapper,
		Duration repairTimeout) {

	public static final int DEFAULT_MAX_MACRO_DEPTH = 64;
	public static final int DEFAULT_MAX_LOOP_ITERATIONS = 1000;
	public static final int DEFAULT_MAX_CALL_DEPTH = 64;
	public static final Duration DEFAULT_REPAIR_TIMEOUT = Duration.ofSeconds(60);

	public ConversionOptions {
		if (maxMacroDepth < 1) {
			throw new IllegalArgumentException("max-macro-depth must be positive: " + maxMacroDepth);
		}
		if (maxLoopIterations < 0) {
			throw new IllegalArgumentException("max-loop-iterations must not be negative: " + maxLoopIterations);
		}
		if (maxCallDepth < 1) {
			throw new IllegalArgumentException("max-call-depth must be positive: " + maxCallDepth);
		}
		features = features.isEmpty() ? Set.of() : Set.copyOf(EnumSet.copyOf(features));
	}

	public static ConversionOptions defaults() {
		return builder().build();
	}

	public static Builder builder() {
		return new Builder();
	}

	public boolean enabled(Feature feature) {
		return features.contains(feature);
	}

	public Builder toBuilder() {
		Builder b = new Builder();
		b.maxMacroDepth = maxMacroDepth;
		b.maxLoopIterations = maxLoopIterations;
		b.maxCallDepth = maxCallDepth;
		b.features = features.isEmpty() ? EnumSet.noneOf(Feature.class) : EnumSet.copyOf(features);
		b.allowNoGain = allowNoGain;
		b.mathOnly = mathOnly;
		b.lossComments = lossComments;
		b.documentWrapper = documentWrapper;
		b.repairTimeout = repairTimeout;
		return b;
	}

	/**
	 * Reads options from properties; missing keys keep their defaults.
	 */
	public static ConversionOptions fromProperties(Properties props) {
		Builder b = builder();
		String v = props.getProperty("max-macro-depth");
		if (v != null) {
			b.maxMacroDepth(parseInt("max-macro-depth", v));
		}
		v = props.getProperty("max-loop-iterations");
		if (v != null) {
			b.maxLoopIterations(parseInt("max-loop-iterations", v));
		}
		v = props.getProperty("max-call-depth");
		if (v != null) {
			b.maxCallDepth(parseInt("max-call-depth", v));
		}
		v = props.getProperty("features");
		if (v != null) {
			EnumSet<Feature> set = EnumSet.noneOf(Feature.class);
			for (String part : v.split(",")) {
				if (!part.isBlank()) {
					set.add(Feature.parse(part));
				}
			}
			b.features(set);
		}
		v = props.getProperty("allow-no-gain");
		if (v != null) {
			b.allowNoGain(parseBoolean("allow-no-gain", v));
		}
		v = props.getProperty("math-only");
		if (v != null) {
			b.mathOnly(parseBoolean("math-only", v));
		}
		v = props.getProperty("loss-comments");
		if (v != null) {
			b.lossComments(parseBoolean("loss-comments", v));
		}
		v = props.getProperty("document-wrapper");
		if (v != null) {
			b.documentWrapper(parseBoolean("document-wrapper", v));
		}
		v = props.getProperty("repair-timeout-ms");
		if (v != null) {
			b.repairTimeout(Duration.ofMillis(parseInt("repair-timeout-ms", v)));
		}
		return b.build();
	}

	private static int parseInt(String key, String value) {
		try {
			return Integer.parseInt(value.trim());
		} catch (NumberFormatException ex) {
			throw new IllegalArgumentException("invalid integer for " + key + ": " + value, ex);
		}
	}

	private static boolean parseBoolean(String key, String value) {
		String v = value.trim();
		if (v.equalsIgnoreCase("true")) {
			return true;
		}
		if (v.equalsIgnoreCase("false")) {
			return false;
		}
		throw new IllegalArgumentException("invalid boolean for " + key + ": " + value);
	}

	public static final class Builder {
		private int maxMacroDepth = DEFAULT_MAX_MACRO_DEPTH;
		private int maxLoopIterations = DEFAULT_MAX_LOOP_ITERATIONS;
		private int maxCallDepth = DEFAULT_MAX_CALL_DEPTH;
		private Set<Feature> features = EnumSet.allOf(Feature.class);
		private boolean allowNoGain;
		private boolean mathOnly;
		private boolean lossComments = true;
		private boolean documentWrapper;
		private Duration repairTimeout = DEFAULT_REPAIR_TIMEOUT;

		public Builder maxMacroDepth(int value) {
			this.maxMacroDepth = value;
			return this;
		}

		public Builder maxLoopIterations(int value) {
			this.maxLoopIterations = value;
			return this;
		}

		public Builder maxCallDepth(int value) {
			this.maxCallDepth = value;
			return this;
		}

		public Builder features(Set<Feature> value) {
			this.features = value;
			return this;
		}

		public Builder allowNoGain(boolean value) {
			this.allowNoGain = value;
			return this;
		}

		public Builder mathOnly(boolean value) {
			this.mathOnly = value;
			return this;
		}

		public Builder lossComments(boolean value) {
			this.lossComments = value;
			return this;
		}

		public Builder documentWrapper(boolean value) {
			this.documentWrapper = value;
			return this;
		}

		public Builder repairTimeout(Duration value) {
			this.repairTimeout = value;
			return this;
		}

		public ConversionOptions build() {
			return new ConversionOptions(maxMacroDepth, maxLoopIterations, maxCallDepth, features, allowNoGain,
					mathOnly, lossComments, documentWrapper, repairTimeout);
		}
	}
}
