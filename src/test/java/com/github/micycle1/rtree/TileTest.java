package com.github.micycle1.rtree;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.util.List;

import org.junit.jupiter.api.Test;
import org.locationtech.jts.geom.Envelope;

public class TileTest {

	private static Tile<Integer> tile(int x0, int y0, int x1, int y1) {
		return new Tile<>(Point.of(x0, y0), Point.of(x1, y1));
	}

	@Test
	public void testInvalidCornersAreRejected() {
		assertThrows(IllegalArgumentException.class, () -> tile(5, 5, 4, 4));
		assertThrows(IllegalArgumentException.class, () -> tile(5, 0, 0, 10));
		assertThrows(IllegalArgumentException.class, () -> tile(0, 5, 5, 0));
	}

	@Test
	public void testDegenerateTileEqualsItsPoint() {
		Point<Integer> p1 = Point.of(10, 10);

		assertEquals(PartialOrdering.EQUAL, tile(10, 10, 10, 10).partialCompare(p1));
		assertTrue(tile(10, 10, 10, 10).isDegenerate());
		// not degenerate: contains the point instead
		assertEquals(PartialOrdering.GREATER, tile(10, 10, 10, 11).partialCompare(p1));
		assertEquals(PartialOrdering.LESS, tile(11, 10, 11, 10).partialCompare(p1));
	}

	@Test
	public void testContainmentOfPoints() {
		Tile<Integer> square = tile(0, 0, 10, 10);
		assertEquals(PartialOrdering.GREATER, square.partialCompare(Point.of(5, 5)));
		assertEquals(PartialOrdering.LESS, square.partialCompare(Point.of(15, 5)));

		Tile<Integer> t = tile(5, 5, 15, 15);
		assertEquals(PartialOrdering.GREATER, t.partialCompare(Point.of(5, 8)));
		assertEquals(PartialOrdering.GREATER, t.partialCompare(Point.of(15, 10)));
		assertEquals(PartialOrdering.GREATER, t.partialCompare(Point.of(15, 15)));
		assertEquals(PartialOrdering.GREATER, t.partialCompare(Point.of(5, 5)));
		assertEquals(PartialOrdering.GREATER, t.partialCompare(Point.of(7, 11)));
		assertEquals(PartialOrdering.LESS, t.partialCompare(Point.of(7, 22)));
		assertEquals(PartialOrdering.LESS, t.partialCompare(Point.of(4, 4)));

		Tile<Integer> small = tile(10, 10, 11, 11);
		assertTrue(small.partialCompare(Point.of(10, 10)).isGreaterOrEqual());
		assertEquals(PartialOrdering.GREATER, small.partialCompare(Point.of(11, 11)));
	}

	@Test
	public void testNestingOrder() {
		Tile<Integer> outer = tile(0, 0, 10, 10);
		Tile<Integer> inner = tile(1, 1, 2, 2);

		assertEquals(PartialOrdering.EQUAL, outer.partialCompare(tile(0, 0, 10, 10)));
		assertEquals(PartialOrdering.LESS, inner.partialCompare(outer));
		assertEquals(PartialOrdering.GREATER, outer.partialCompare(inner));
		assertEquals(PartialOrdering.GREATER, outer.partialCompare(tile(0, 0, 10, 3))); // shared edges
		assertEquals(PartialOrdering.INCOMPARABLE, tile(0, 0, 5, 5).partialCompare(tile(3, 3, 8, 8)));
		assertEquals(PartialOrdering.INCOMPARABLE, tile(3, 3, 8, 8).partialCompare(tile(0, 0, 5, 5)));
		assertEquals(PartialOrdering.INCOMPARABLE, tile(0, 0, 1, 1).partialCompare(tile(5, 5, 6, 6)));
	}

	@Test
	public void testVerticalCompare() {
		Tile<Integer> t1 = tile(4, 5, 7, 8);

		Tile<Integer> t2 = tile(7, 8, 9, 9);
		assertEquals(PartialOrdering.LESS, t1.verticalCompare(t2));
		assertEquals(PartialOrdering.GREATER, t2.verticalCompare(t1));

		t2 = tile(4, 5, 6, 6);
		assertEquals(PartialOrdering.EQUAL, t1.verticalCompare(t2));
		assertEquals(PartialOrdering.EQUAL, t2.verticalCompare(t1));

		t2 = tile(3, 5, 9, 6);
		assertEquals(PartialOrdering.EQUAL, t1.verticalCompare(t2));
		assertEquals(PartialOrdering.EQUAL, t2.verticalCompare(t1));
	}

	@Test
	public void testHorizontalCompare() {
		Tile<Integer> low = tile(0, 0, 5, 2);
		Tile<Integer> high = tile(0, 3, 5, 6);

		assertEquals(PartialOrdering.LESS, low.horizontalCompare(high));
		assertEquals(PartialOrdering.GREATER, high.horizontalCompare(low));
		assertEquals(PartialOrdering.EQUAL, low.horizontalCompare(tile(9, 1, 9, 1)));
	}

	@Test
	public void testUnion() {
		Tile<Integer> t1 = tile(4, 5, 7, 8);
		Tile<Integer> t2 = tile(4, 5, 6, 6);

		Tile<Integer> t3 = t1.union(t2);
		assertTrue(t3.partialCompare(t1).isGreaterOrEqual());
		assertTrue(t3.partialCompare(t2).isGreaterOrEqual());

		assertEquals(tile(-3, 0, 9, 12), tile(0, 0, 1, 12).union(tile(-3, 2, 9, 4)));
	}

	@Test
	public void testBounding() {
		assertNull(Tile.bounding(List.<Tile<Integer>>of()));
		Tile<Integer> covered = Tile.bounding(List.of(Tile.of(Point.of(3, 1)), Tile.of(Point.of(0, 4)), tile(1, 1, 2, 2)));
		assertEquals(tile(0, 1, 3, 4), covered);
	}

	@Test
	public void testToEnvelope() {
		Envelope env = tile(1, 2, 3, 4).toEnvelope();
		assertEquals(new Envelope(1, 3, 2, 4), env);
		assertTrue(env.contains(2, 3));
	}
}
