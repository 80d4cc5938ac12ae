package com.github.micycle1.rtree.rover;

import java.util.List;

import com.github.micycle1.rtree.Point;

/**
 * The parsed contents of a rover input file.
 */
public final class RoverInput {

	private final Point<Integer> gridTop;
	private final Point<Integer> rover;
	private final List<Point<Integer>> dust;
	private final List<RoverMove> moves;

	public RoverInput(Point<Integer> gridTop, Point<Integer> rover, List<Point<Integer>> dust, List<RoverMove> moves) {
		this.gridTop = gridTop;
		this.rover = rover;
		this.dust = List.copyOf(dust);
		this.moves = List.copyOf(moves);
	}

	/** Top-right corner of the arena; the bottom-left is the origin. */
	public Point<Integer> getGridTop() {
		return gridTop;
	}

	public Point<Integer> getRover() {
		return rover;
	}

	public List<Point<Integer>> getDust() {
		return dust;
	}

	public List<RoverMove> getMoves() {
		return moves;
	}
}
