package org.javai.sequences;

import java.util.Objects;

/**
 * One instruction of a {@link Sequence}: either a plain action or a control-flow marker.
 * <p>
 * The type is fixed at construction. The indentation level is assigned by the indentation pass each
 * time the owning sequence is edited or validated; until then it holds {@link #UNASSIGNED_LEVEL}.
 * Steps compare by identity since the level changes over their lifetime.
 */
public final class Step {

	/**
	 * Level reported by a step that has not been through an indentation pass yet.
	 */
	public static final int UNASSIGNED_LEVEL = -1;

	private final StepType type;
	private int indentationLevel = UNASSIGNED_LEVEL;

	public Step(StepType type) {
		this.type = Objects.requireNonNull(type, "type must not be null");
	}

	/**
	 * Copy constructor. The copy starts with the same indentation level as the original.
	 */
	public Step(Step other) {
		Objects.requireNonNull(other, "step must not be null");
		this.type = other.type;
		this.indentationLevel = other.indentationLevel;
	}

	public StepType getType() {
		return type;
	}

	public int getIndentationLevel() {
		return indentationLevel;
	}

	public boolean hasIndentationLevel() {
		return indentationLevel != UNASSIGNED_LEVEL;
	}

	/**
	 * @throws IllegalArgumentException if the level is negative
	 */
	public void setIndentationLevel(int indentationLevel) {
		if (indentationLevel < 0) {
			throw new IllegalArgumentException("Indentation level must be non-negative, got " + indentationLevel);
		}
		this.indentationLevel = indentationLevel;
	}

	@Override
	public String toString() {
		return "Step[" + type.keyword() + ", level=" + indentationLevel + "]";
	}
}
