package org.javai.sequences.check;

import java.util.List;
import java.util.Objects;
import org.javai.sequences.SequenceException;
import org.javai.sequences.Step;
import org.javai.sequences.StepType;

/**
 * Recursive-descent checker for the control constructs of an indented step list.
 * <p>
 * Grammar checked per construct:
 * <ul>
 *   <li>{@code IF body (ELSE IF body)* (ELSE body)? END}</li>
 *   <li>{@code TRY body CATCH body END}</li>
 *   <li>{@code WHILE body END}</li>
 * </ul>
 * Block boundaries are located through the indentation levels, so the steps must have been through an
 * {@link IndentationPass} that reported no error. The check stops at the first violation, which is
 * reported as a {@link SequenceException} naming the 1-based step number.
 */
public final class SyntaxChecker {

	static final String ERROR_PREFIX = "[syntax check] Step ";

	private final List<Step> steps;

	public SyntaxChecker(List<Step> steps) {
		this.steps = Objects.requireNonNull(steps, "steps must not be null");
	}

	/**
	 * Checks the whole step list.
	 *
	 * @throws SequenceException on the first structural violation
	 */
	public void check() {
		check(0, steps.size());
	}

	/**
	 * Checks the steps in {@code [begin, end)} as a self-contained block.
	 *
	 * @throws SequenceException on the first structural violation
	 */
	public void check(int begin, int end) {
		int index = begin;

		while (index < end) {
			StepType type = steps.get(index).getType();
			switch (type) {
				case ACTION -> index++;
				case WHILE -> index = checkWhile(index, end);
				case TRY -> index = checkTry(index, end);
				case IF -> index = checkIf(index, end);
				case CATCH -> throw syntaxError(index, "CATCH without matching TRY");
				case ELSE_IF -> throw syntaxError(index, "ELSE IF without matching IF");
				case ELSE -> throw syntaxError(index, "ELSE without matching IF");
				case END -> throw syntaxError(index, "END without matching IF/WHILE/TRY");
				default -> throw syntaxError(index, "Unexpected step type");
			}
		}
	}

	private int checkWhile(int begin, int end) {
		int blockEnd = findBoundary(begin + 1, end, begin);

		if (blockEnd == end || steps.get(blockEnd).getType() != StepType.END) {
			throw syntaxError(begin, "WHILE without matching END");
		}

		check(begin + 1, blockEnd);

		return blockEnd + 1;
	}

	private int checkTry(int begin, int end) {
		int catchIndex = findBoundary(begin + 1, end, begin);

		if (catchIndex == end || steps.get(catchIndex).getType() != StepType.CATCH) {
			throw syntaxError(begin, "TRY without matching CATCH");
		}

		check(begin + 1, catchIndex);

		int catchBlockEnd = findBoundary(catchIndex + 1, end, begin);

		if (catchBlockEnd == end || steps.get(catchBlockEnd).getType() != StepType.END) {
			throw syntaxError(begin, "TRY...CATCH without matching END");
		}

		check(catchIndex + 1, catchBlockEnd);

		return catchBlockEnd + 1;
	}

	private int checkIf(int begin, int end) {
		boolean elseFound = false;
		int clauseStart = begin;

		while (true) {
			int boundary = findBoundary(clauseStart + 1, end, begin);

			if (boundary == end) {
				throw syntaxError(begin, "IF without matching END");
			}

			check(clauseStart + 1, boundary);

			switch (steps.get(boundary).getType()) {
				case ELSE_IF -> {
					if (elseFound) {
						throw syntaxError(boundary, "ELSE IF after ELSE clause");
					}
				}
				case ELSE -> {
					if (elseFound) {
						throw syntaxError(boundary, "Duplicate ELSE clause");
					}
					elseFound = true;
				}
				case END -> {
					return boundary + 1;
				}
				default -> throw syntaxError(boundary, "Unfinished IF construct");
			}

			clauseStart = boundary;
		}
	}

	/**
	 * The body of the construct opened at {@code opener} ends at the first step that is indented less
	 * than the body itself.
	 */
	private int findBoundary(int from, int end, int opener) {
		return BlockScanner.findEndOfIndentedBlock(steps, from, end, steps.get(opener).getIndentationLevel() + 1);
	}

	private SequenceException syntaxError(int index, String message) {
		return new SequenceException(ERROR_PREFIX + (index + 1) + ": " + message);
	}
}
