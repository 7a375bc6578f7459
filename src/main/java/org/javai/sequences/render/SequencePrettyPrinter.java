package org.javai.sequences.render;

import java.util.List;
import java.util.Objects;
import org.javai.sequences.Sequence;
import org.javai.sequences.Step;

/**
 * Renders a sequence as indented text, one step per line.
 * <pre>
 * TRY
 *     ACTION
 * CATCH
 * END
 * </pre>
 * Uses the levels of the last indentation pass. Steps without a level are printed flush left.
 */
public class SequencePrettyPrinter {

	private final int indentSize;
	private final boolean numbered;

	public SequencePrettyPrinter() {
		this(4, false);
	}

	public SequencePrettyPrinter(int indentSize, boolean numbered) {
		if (indentSize < 0) {
			throw new IllegalArgumentException("indentSize must be non-negative");
		}
		this.indentSize = indentSize;
		this.numbered = numbered;
	}

	public String print(Sequence sequence) {
		Objects.requireNonNull(sequence, "sequence must not be null");
		return print(sequence.getSteps());
	}

	public String print(List<Step> steps) {
		Objects.requireNonNull(steps, "steps must not be null");
		StringBuilder output = new StringBuilder();
		int width = String.valueOf(steps.size()).length();

		for (int i = 0; i < steps.size(); i++) {
			Step step = steps.get(i);
			if (numbered) {
				String number = String.valueOf(i + 1);
				output.append(" ".repeat(width - number.length())).append(number).append(": ");
			}
			int level = Math.max(step.getIndentationLevel(), 0);
			output.append(" ".repeat(level * indentSize))
					.append(step.getType().keyword())
					.append('\n');
		}

		return output.toString();
	}
}
