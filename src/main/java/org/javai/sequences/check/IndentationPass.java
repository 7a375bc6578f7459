package org.javai.sequences.check;

import java.util.List;
import java.util.Objects;
import java.util.Optional;
import org.javai.sequences.Step;

/**
 * Assigns an indentation level to every step in a single forward sweep.
 * <p>
 * The pass never throws on malformed input. Every step receives a level in
 * {@code [0, maxIndentationLevel]} and only the first nesting error found is reported.
 * Levels that are already correct are not written again, so re-running the pass over an unchanged list
 * only reads it.
 */
public final class IndentationPass {

	static final String NOT_NESTED_CORRECTLY = "Steps are not nested correctly";
	static final String UNMATCHED_END =
			"Steps are not nested correctly (every END must correspond to one IF, TRY, or WHILE)";
	static final String MISSING_END =
			"Steps are not nested correctly (there must be one END for each IF, TRY, WHILE)";

	private final int maxIndentationLevel;

	public IndentationPass(int maxIndentationLevel) {
		if (maxIndentationLevel <= 0) {
			throw new IllegalArgumentException("maxIndentationLevel must be positive");
		}
		this.maxIndentationLevel = maxIndentationLevel;
	}

	/**
	 * Sets the indentation level of each step.
	 *
	 * @param steps the steps in program order
	 * @return the first nesting error encountered, or empty if the steps are nested correctly
	 */
	public Optional<String> apply(List<Step> steps) {
		Objects.requireNonNull(steps, "steps must not be null");
		FirstError error = new FirstError();
		int level = 0;

		for (Step step : steps) {
			int stepLevel;

			switch (step.getType()) {
				case IF, TRY, WHILE -> {
					stepLevel = level;
					++level;
				}
				case CATCH, ELSE, ELSE_IF -> stepLevel = level - 1;
				case END -> {
					stepLevel = level - 1;
					--level;
				}
				default -> stepLevel = level; // ACTION
			}

			if (stepLevel < 0) {
				stepLevel = 0;
				error.record(NOT_NESTED_CORRECTLY);
			}

			if (step.getIndentationLevel() != stepLevel) {
				step.setIndentationLevel(stepLevel);
			}

			if (level < 0) {
				level = 0;
				error.record(UNMATCHED_END);
			}
			else if (level > maxIndentationLevel) {
				level = maxIndentationLevel;
				error.record("Steps are nested too deeply (max. level: " + maxIndentationLevel + ")");
			}
		}

		if (level != 0) {
			error.record(MISSING_END);
		}

		return error.get();
	}

	public int getMaxIndentationLevel() {
		return maxIndentationLevel;
	}

	/**
	 * Error slot that is written at most once.
	 */
	private static final class FirstError {
		private String message;

		void record(String candidate) {
			if (message == null) {
				message = candidate;
			}
		}

		Optional<String> get() {
			return Optional.ofNullable(message);
		}
	}
}
