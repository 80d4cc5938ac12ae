package com.github.micycle1.rtree.rover;

import java.util.List;
import java.util.Map;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.github.micycle1.rtree.Coordinates;
import com.github.micycle1.rtree.Point;
import com.github.micycle1.rtree.RTree;
import com.github.micycle1.rtree.Tile;
import com.github.micycle1.rtree.rover.RoverInputException.Kind;

/**
 * A rectangular arena with dusty cells and a rover cleaning them as it moves.
 */
public class GameMap {

	private static final Logger log = LoggerFactory.getLogger(GameMap.class);

	private static final Point<Integer> ORIGIN = Point.of(0, 0);

	private final Point<Integer> gridTop;
	private final RTree<Integer, Cell> dustMap;
	private Point<Integer> rover;

	/**
	 * Creates the arena spanning from the origin to {@code gridTop}.
	 *
	 * @throws RoverInputException if the rover or any dust lies outside the arena
	 */
	public GameMap(Point<Integer> gridTop, Point<Integer> rover, List<Point<Integer>> dust) throws RoverInputException {
		Tile<Integer> arena = new Tile<>(ORIGIN, gridTop);
		if (!rover.partialCompare(arena).isLessOrEqual()) {
			throw new RoverInputException(Kind.INVALID_ROVER_POSITION, 0);
		}
		this.gridTop = gridTop;
		this.rover = rover;
		this.dustMap = new RTree<>(Coordinates.INTEGER);
		for (Point<Integer> p : dust) {
			if (!p.partialCompare(arena).isLessOrEqual()) {
				throw new RoverInputException(Kind.INVALID_DUST_POSITION, 0);
			}
			dustMap.insert(p, Cell.DUST);
		}
		log.debug("Indexed {} dusty cells covering {}", dustMap.size(), dustMap.getEnvelope());
	}

	public static GameMap of(RoverInput input) throws RoverInputException {
		return new GameMap(input.getGridTop(), input.getRover(), input.getDust());
	}

	public Point<Integer> getRoverPosition() {
		return rover;
	}

	/**
	 * Returns whether {@code position} still holds dust.
	 */
	public boolean isDusty(Point<Integer> position) {
		return dustMap.find(position).map(cell -> cell == Cell.DUST).orElse(false);
	}

	/**
	 * Moves the rover one step. A move that would leave the arena is ignored.
	 *
	 * @return the rover position after the move
	 */
	Point<Integer> move(RoverMove move) {
		Point<Integer> next = move.apply(rover);
		if (next.partialCompare(gridTop).isLessOrEqual() && next.partialCompare(ORIGIN).isGreaterOrEqual()) {
			rover = next;
		}
		return rover;
	}

	/**
	 * Moves the rover along {@code moves}, cleaning every dusty cell it steps on.
	 * The starting cell is not cleaned.
	 *
	 * @return the number of cells cleaned
	 */
	public int moveAlong(List<RoverMove> moves) {
		int cleaned = 0;
		for (RoverMove move : moves) {
			Point<Integer> position = move(move);
			Map.Entry<Point<Integer>, Cell> cell = dustMap.findMut(position).orElse(null);
			if (cell != null && cell.setValue(Cell.CLEAN) == Cell.DUST) {
				cleaned++;
			}
		}
		log.info("Rover stopped at {} after {} moves, {} cells cleaned", rover, moves.size(), cleaned);
		return cleaned;
	}
}
