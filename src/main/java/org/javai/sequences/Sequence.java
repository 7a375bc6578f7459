package org.javai.sequences;

import java.util.ArrayList;
import java.util.Collections;
import java.util.Iterator;
import java.util.List;
import java.util.Objects;
import java.util.Optional;
import org.javai.sequences.check.IndentationPass;
import org.javai.sequences.check.SyntaxChecker;
import org.javai.sequences.config.SequenceLimits;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * A labeled, ordered list of steps describing one automatable procedure.
 * <p>
 * The sequence owns its steps: every step handed in is copied, and copying a sequence copies all of its
 * steps. After each edit the indentation levels are recomputed, so they always reflect the current step
 * list even when it is malformed.
 * <p>
 * A sequence is well-formed if the indentation pass reports no error and every IF, WHILE and TRY
 * construct is complete. Call {@link #validate()} before handing the sequence to an executor.
 * <p>
 * Instances are not thread-safe. Once a sequence has been validated and is no longer edited,
 * {@link #validate()} only reads it and may be called from several threads.
 *
 * <pre>
 * Sequence sequence = new Sequence("open valve");
 * sequence.addStep(new Step(StepType.TRY));
 * sequence.addStep(new Step(StepType.ACTION));
 * sequence.addStep(new Step(StepType.CATCH));
 * sequence.addStep(new Step(StepType.END));
 * sequence.validate();
 * </pre>
 */
public class Sequence implements Iterable<Step> {

	private static final Logger logger = LoggerFactory.getLogger(Sequence.class);

	private final SequenceLimits limits;
	private final IndentationPass indentationPass;
	private final List<Step> steps = new ArrayList<>();
	private String label;
	private String indentationError;

	/**
	 * Creates an empty sequence bounded by {@link SequenceLimits#global()}.
	 *
	 * @throws SequenceException if the label is empty or too long
	 */
	public Sequence(String label) {
		this(label, SequenceLimits.global());
	}

	/**
	 * Creates an empty sequence bounded by the given limits.
	 *
	 * @throws SequenceException if the label is empty or too long
	 */
	public Sequence(String label, SequenceLimits limits) {
		this.limits = Objects.requireNonNull(limits, "limits must not be null");
		checkLabel(label);
		this.label = label;
		this.indentationPass = new IndentationPass(limits.maxIndentationLevel());
	}

	/**
	 * Copy constructor. The copy shares no step with the original.
	 */
	public Sequence(Sequence other) {
		Objects.requireNonNull(other, "sequence must not be null");
		this.limits = other.limits;
		this.indentationPass = other.indentationPass;
		this.label = other.label;
		this.indentationError = other.indentationError;
		for (Step step : other.steps) {
			this.steps.add(new Step(step));
		}
	}

	public String getLabel() {
		return label;
	}

	/**
	 * @throws SequenceException if the label is empty or too long
	 */
	public void setLabel(String label) {
		checkLabel(label);
		this.label = label;
	}

	public SequenceLimits getLimits() {
		return limits;
	}

	/**
	 * Appends a copy of the step.
	 */
	public void addStep(Step step) {
		steps.add(copyOf(step));
		indent();
	}

	/**
	 * Inserts a copy of the step before the step currently at {@code index}.
	 *
	 * @throws IndexOutOfBoundsException if {@code index} is not in {@code [0, size()]}
	 */
	public void insertStep(int index, Step step) {
		Step copy = copyOf(step);
		Objects.checkIndex(index, steps.size() + 1);
		steps.add(index, copy);
		indent();
	}

	/**
	 * Replaces the step at {@code index} with a copy of the given step.
	 *
	 * @return the step that was replaced
	 * @throws IndexOutOfBoundsException if {@code index} is not in {@code [0, size())}
	 */
	public Step replaceStep(int index, Step step) {
		Step copy = copyOf(step);
		Objects.checkIndex(index, steps.size());
		Step previous = steps.set(index, copy);
		indent();
		return previous;
	}

	/**
	 * Removes the step at {@code index}.
	 *
	 * @return the removed step
	 * @throws IndexOutOfBoundsException if {@code index} is not in {@code [0, size())}
	 */
	public Step removeStep(int index) {
		Objects.checkIndex(index, steps.size());
		Step removed = steps.remove(index);
		indent();
		return removed;
	}

	public Step getStep(int index) {
		return steps.get(index);
	}

	/**
	 * Unmodifiable view of the steps in program order.
	 */
	public List<Step> getSteps() {
		return Collections.unmodifiableList(steps);
	}

	public int size() {
		return steps.size();
	}

	public boolean isEmpty() {
		return steps.isEmpty();
	}

	@Override
	public Iterator<Step> iterator() {
		return getSteps().iterator();
	}

	/**
	 * The nesting error found when the indentation levels were last computed, if any.
	 */
	public Optional<String> getIndentationError() {
		return Optional.ofNullable(indentationError);
	}

	/**
	 * Recomputes the indentation levels and checks that every control construct is complete.
	 * On return every step carries a valid indentation level.
	 *
	 * @throws SequenceException describing the first nesting or syntax error found
	 */
	public void validate() {
		indent();

		if (indentationError != null) {
			logger.debug("Sequence '{}' is not nested correctly: {}", label, indentationError);
			throw new SequenceException(indentationError);
		}

		try {
			new SyntaxChecker(steps).check();
		}
		catch (SequenceException e) {
			logger.debug("Sequence '{}' failed syntax check: {}", label, e.getMessage());
			throw e;
		}

		logger.debug("Sequence '{}' with {} steps is well-formed", label, steps.size());
	}

	/**
	 * Boolean form of {@link #validate()}.
	 */
	public boolean isValid() {
		try {
			validate();
			return true;
		}
		catch (SequenceException e) {
			return false;
		}
	}

	@Override
	public String toString() {
		return "Sequence[label=" + label + ", steps=" + steps.size() + "]";
	}

	private void indent() {
		String error = indentationPass.apply(steps).orElse(null);
		if (!Objects.equals(error, indentationError)) {
			indentationError = error;
		}
	}

	private void checkLabel(String label) {
		if (label == null || label.isEmpty()) {
			throw new SequenceException("Sequence label may not be empty");
		}
		if (label.length() > limits.maxLabelLength()) {
			throw new SequenceException(
					"Label \"" + label + "\" is too long (>" + limits.maxLabelLength() + " characters)");
		}
	}

	private static Step copyOf(Step step) {
		return new Step(Objects.requireNonNull(step, "step must not be null"));
	}
}
