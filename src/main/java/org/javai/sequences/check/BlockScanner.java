package org.javai.sequences.check;

import java.util.List;
import org.javai.sequences.Step;

/**
 * Finds block boundaries in a flat, indented step list.
 */
public final class BlockScanner {

	private BlockScanner() {
	}

	/**
	 * Returns the index of the first step in {@code [from, to)} whose indentation level is lower than
	 * {@code targetLevel}, or {@code to} if the block does not close within the range.
	 */
	public static int findEndOfIndentedBlock(List<Step> steps, int from, int to, int targetLevel) {
		for (int i = from; i < to; i++) {
			if (steps.get(i).getIndentationLevel() < targetLevel) {
				return i;
			}
		}
		return to;
	}
}
