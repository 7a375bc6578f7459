package org.javai.sequences.testsupport;

import java.util.ArrayList;
import java.util.List;
import org.javai.sequences.Sequence;
import org.javai.sequences.Step;
import org.javai.sequences.StepType;
import org.javai.sequences.config.SequenceLimits;

/**
 * Builds step lists from comma separated keywords, e.g. {@code "IF, ACTION, ELSE IF, ACTION, END"}.
 */
public final class Steps {

	private Steps() {
	}

	public static List<Step> of(String keywords) {
		List<Step> steps = new ArrayList<>();
		if (keywords.isBlank()) {
			return steps;
		}
		for (String keyword : keywords.split(",")) {
			steps.add(new Step(StepType.fromKeyword(keyword)));
		}
		return steps;
	}

	public static Sequence sequence(String keywords) {
		return sequence(keywords, SequenceLimits.defaults());
	}

	public static Sequence sequence(String keywords, SequenceLimits limits) {
		Sequence sequence = new Sequence("test sequence", limits);
		for (Step step : of(keywords)) {
			sequence.addStep(step);
		}
		return sequence;
	}

	public static List<Integer> levels(List<Step> steps) {
		return steps.stream().map(Step::getIndentationLevel).toList();
	}

	public static List<Integer> levels(Sequence sequence) {
		return levels(sequence.getSteps());
	}
}
