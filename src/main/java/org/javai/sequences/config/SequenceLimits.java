package org.javai.sequences.config;

/**
 * Bounds applied to every sequence.
 *
 * <h2>Usage</h2>
 * <pre>{@code
 * // Process-wide limits, read once from META-INF/sequence-limits.yml
 * SequenceLimits limits = SequenceLimits.global();
 *
 * // Custom limits
 * SequenceLimits limits = SequenceLimits.builder()
 *         .maxIndentationLevel(4)
 *         .build();
 * }</pre>
 *
 * @param maxLabelLength maximum number of characters in a sequence label
 * @param maxIndentationLevel maximum nesting depth of IF, WHILE and TRY blocks
 */
public record SequenceLimits(
		int maxLabelLength,
		int maxIndentationLevel
) {

	public static final int DEFAULT_MAX_LABEL_LENGTH = 64;

	public static final int DEFAULT_MAX_INDENTATION_LEVEL = 20;

	public SequenceLimits {
		if (maxLabelLength <= 0) {
			throw new IllegalArgumentException("maxLabelLength must be positive");
		}
		if (maxIndentationLevel <= 0) {
			throw new IllegalArgumentException("maxIndentationLevel must be positive");
		}
	}

	/**
	 * Creates limits with the compiled-in default values.
	 */
	public static SequenceLimits defaults() {
		return new SequenceLimits(DEFAULT_MAX_LABEL_LENGTH, DEFAULT_MAX_INDENTATION_LEVEL);
	}

	/**
	 * The process-wide limits. They are loaded on first access from the classpath resource
	 * {@value SequenceLimitsLoader#DEFAULT_RESOURCE} (or the defaults if it is absent) and never change
	 * afterwards.
	 */
	public static SequenceLimits global() {
		return GlobalHolder.INSTANCE;
	}

	public static Builder builder() {
		return new Builder();
	}

	private static final class GlobalHolder {
		static final SequenceLimits INSTANCE = new SequenceLimitsLoader()
				.loadResourceOrDefaults(SequenceLimitsLoader.DEFAULT_RESOURCE, SequenceLimits.class.getClassLoader());
	}

	/**
	 * Builder for {@link SequenceLimits}.
	 */
	public static class Builder {
		private int maxLabelLength = DEFAULT_MAX_LABEL_LENGTH;
		private int maxIndentationLevel = DEFAULT_MAX_INDENTATION_LEVEL;

		private Builder() {}

		public Builder maxLabelLength(int maxLabelLength) {
			this.maxLabelLength = maxLabelLength;
			return this;
		}

		public Builder maxIndentationLevel(int maxIndentationLevel) {
			this.maxIndentationLevel = maxIndentationLevel;
			return this;
		}

		public SequenceLimits build() {
			return new SequenceLimits(maxLabelLength, maxIndentationLevel);
		}
	}
}
