package com.github.micycle1.rtree.rover;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.util.ArrayList;
import java.util.List;

import org.junit.jupiter.api.Test;

import com.github.micycle1.rtree.Point;
import com.github.micycle1.rtree.rover.RoverInputException.Kind;

public class GameMapTest {

	private static List<RoverMove> moves(String path) {
		List<RoverMove> moves = new ArrayList<>();
		for (char c : path.toCharArray()) {
			moves.add(RoverMove.parse(c));
		}
		return moves;
	}

	@Test
	public void testRoverOutsideArena() {
		RoverInputException e = assertThrows(RoverInputException.class, () -> new GameMap(Point.of(5, 5), Point.of(6, 0), List.of()));
		assertEquals(Kind.INVALID_ROVER_POSITION, e.getKind());
	}

	@Test
	public void testDustOutsideArena() {
		RoverInputException e = assertThrows(RoverInputException.class,
				() -> new GameMap(Point.of(5, 5), Point.of(0, 0), List.of(Point.of(1, 1), Point.of(2, 9))));
		assertEquals(Kind.INVALID_DUST_POSITION, e.getKind());
	}

	@Test
	public void testArenaCornersAreInside() throws RoverInputException {
		GameMap map = new GameMap(Point.of(5, 5), Point.of(5, 5), List.of(Point.of(0, 0), Point.of(0, 5), Point.of(5, 0)));
		assertTrue(map.isDusty(Point.of(0, 5)));
		assertFalse(map.isDusty(Point.of(5, 5)));
	}

	@Test
	public void testCleaningPath() throws RoverInputException {
		GameMap map = new GameMap(Point.of(5, 5), Point.of(2, 1), List.of(Point.of(0, 1), Point.of(2, 2), Point.of(3, 2)));

		assertEquals(2, map.moveAlong(moves("NNESEESWNWW")));
		assertEquals(Point.of(2, 2), map.getRoverPosition());
		assertFalse(map.isDusty(Point.of(2, 2)));
		assertFalse(map.isDusty(Point.of(3, 2)));
		assertTrue(map.isDusty(Point.of(0, 1)));
	}

	@Test
	public void testMovesLeavingArenaAreIgnored() throws RoverInputException {
		GameMap map = new GameMap(Point.of(2, 2), Point.of(0, 0), List.of());

		assertEquals(Point.of(0, 0), map.move(RoverMove.SOUTH));
		assertEquals(Point.of(0, 0), map.move(RoverMove.WEST));
		assertEquals(0, map.moveAlong(moves("NNNNEEE")));
		assertEquals(Point.of(2, 2), map.getRoverPosition());
	}

	@Test
	public void testStartingCellIsOnlyCleanedWhenRevisited() throws RoverInputException {
		GameMap map = new GameMap(Point.of(3, 3), Point.of(1, 1), List.of(Point.of(1, 1)));
		assertTrue(map.isDusty(Point.of(1, 1)));

		assertEquals(1, map.moveAlong(moves("NS")));
		assertFalse(map.isDusty(Point.of(1, 1)));
		// already clean
		assertEquals(0, map.moveAlong(moves("NS")));
	}

	@Test
	public void testRoverMoveParse() {
		assertEquals(RoverMove.NORTH, RoverMove.parse('N'));
		assertEquals(RoverMove.EAST, RoverMove.parse('E'));
		assertEquals(RoverMove.SOUTH, RoverMove.parse('S'));
		assertEquals(RoverMove.WEST, RoverMove.parse('W'));
		assertNull(RoverMove.parse('n'));
		assertEquals(Point.of(-1, 0), RoverMove.WEST.asVector());
		assertEquals(Point.of(3, 4), RoverMove.NORTH.apply(Point.of(3, 3)));
	}
}
