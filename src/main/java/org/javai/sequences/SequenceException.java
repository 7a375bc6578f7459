package org.javai.sequences;

/**
 * Exception thrown when a sequence is malformed.
 *
 * <p>This exception is thrown when:</p>
 * <ul>
 *   <li>a sequence label is empty or too long</li>
 *   <li>the steps are not nested correctly or are nested too deeply</li>
 *   <li>a control construct (IF, WHILE, TRY) violates its grammar</li>
 * </ul>
 */
public class SequenceException extends RuntimeException {

	public SequenceException(String message) {
		super(message);
	}

	public SequenceException(String message, Throwable cause) {
		super(message, cause);
	}
}
