package com.github.micycle1.rtree.rover;

import com.github.micycle1.rtree.Coordinates;
import com.github.micycle1.rtree.Point;

/**
 * A single rover move instruction.
 */
public enum RoverMove {

	NORTH('N', 0, 1), EAST('E', 1, 0), SOUTH('S', 0, -1), WEST('W', -1, 0);

	private final char symbol;
	private final Point<Integer> vector;

	RoverMove(char symbol, int dx, int dy) {
		this.symbol = symbol;
		this.vector = Point.of(dx, dy);
	}

	/**
	 * Parses an instruction character: one of {@code N}, {@code E}, {@code S},
	 * {@code W}.
	 *
	 * @return the move, or {@code null} for any other character
	 */
	public static RoverMove parse(char c) {
		for (RoverMove move : values()) {
			if (move.symbol == c) {
				return move;
			}
		}
		return null;
	}

	public char getSymbol() {
		return symbol;
	}

	/**
	 * Returns the unit vector of this move.
	 */
	public Point<Integer> asVector() {
		return vector;
	}

	/**
	 * Returns {@code position} moved one step in this direction.
	 */
	public Point<Integer> apply(Point<Integer> position) {
		return position.translate(vector, Coordinates.INTEGER);
	}
}
