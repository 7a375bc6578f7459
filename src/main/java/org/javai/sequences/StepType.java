package org.javai.sequences;

import java.util.Locale;

/**
 * Kind of a {@link Step}.
 * ACTION   - a plain action executed by the scripting runtime.
 * IF, WHILE, TRY - open a block.
 * ELSE_IF, ELSE, CATCH - clauses that split the block of their opener.
 * END      - closes the innermost open block.
 */
public enum StepType {
	ACTION("ACTION"),
	IF("IF"),
	ELSE_IF("ELSE IF"),
	ELSE("ELSE"),
	WHILE("WHILE"),
	TRY("TRY"),
	CATCH("CATCH"),
	END("END");

	private final String keyword;

	StepType(String keyword) {
		this.keyword = keyword;
	}

	/**
	 * The keyword used when a step of this type is displayed.
	 */
	public String keyword() {
		return keyword;
	}

	public boolean opensBlock() {
		return this == IF || this == WHILE || this == TRY;
	}

	public boolean isClause() {
		return this == ELSE_IF || this == ELSE || this == CATCH;
	}

	public boolean closesBlock() {
		return this == END;
	}

	/**
	 * Resolves a keyword such as {@code "else if"} or {@code "CATCH"} to its step type.
	 * Matching is case-insensitive; {@code ELSEIF}, {@code ELSE_IF} and {@code ELSE IF} all denote
	 * {@link #ELSE_IF}.
	 *
	 * @throws IllegalArgumentException if the keyword is null or unknown
	 */
	public static StepType fromKeyword(String keyword) {
		if (keyword == null) {
			throw new IllegalArgumentException("Step keyword cannot be null");
		}
		String normalized = keyword.trim().toUpperCase(Locale.ROOT).replaceAll("^ELSE[\\s_]*IF$", "ELSE IF");
		for (StepType type : values()) {
			if (type.keyword.equals(normalized)) {
				return type;
			}
		}
		throw new IllegalArgumentException("Unknown step keyword: '" + keyword + "'");
	}
}
