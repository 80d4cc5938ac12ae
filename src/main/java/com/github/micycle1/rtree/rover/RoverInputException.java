package com.github.micycle1.rtree.rover;

/**
 * Signals malformed or inconsistent rover input.
 */
public class RoverInputException extends Exception {

	private static final long serialVersionUID = 1L;

	public enum Kind {
		INVALID_ROVER_POSITION("initial rover position is outside the arena"),
		INVALID_DUST_POSITION("dust is outside the arena"),
		INVALID_MOVE("invalid rover move instruction"),
		INVALID_COORDINATE_FORMAT("invalid coordinate line format"),
		INVALID_NUMBER("invalid coordinate"),
		INPUT_ERROR("read error"),
		UNEXPECTED_EOF("unexpected end of file");

		private final String description;

		Kind(String description) {
			this.description = description;
		}

		public String getDescription() {
			return description;
		}
	}

	private final Kind kind;
	private final int lineNumber;

	/**
	 * @param kind       the condition
	 * @param lineNumber 1-based number of the offending line, 0 if the error is
	 *                   not tied to a line
	 */
	public RoverInputException(Kind kind, int lineNumber) {
		this(kind, lineNumber, null);
	}

	public RoverInputException(Kind kind, int lineNumber, Throwable cause) {
		super(cause == null ? kind.getDescription() : kind.getDescription() + " (" + cause.getMessage() + ")", cause);
		this.kind = kind;
		this.lineNumber = lineNumber;
	}

	public Kind getKind() {
		return kind;
	}

	public int getLineNumber() {
		return lineNumber;
	}
}
