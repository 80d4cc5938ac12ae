package com.github.micycle1.rtree;

import java.util.Iterator;
import java.util.Objects;

import org.locationtech.jts.geom.Envelope;

/**
 * A closed, axis-aligned rectangle given by its bottom-left and top-right
 * corners. A tile whose corners coincide is degenerate and stands for a single
 * point.
 *
 * @param <C> the axis value type
 */
public final class Tile<C extends Number & Comparable<C>> {

	private final Point<C> bottom;
	private final Point<C> top;

	/**
	 * Creates a tile from its corners.
	 *
	 * @param bottom the bottom-left corner
	 * @param top    the top-right corner
	 * @throws IllegalArgumentException if {@code bottom} lies above or right of
	 *                                  {@code top} on either axis
	 */
	public Tile(Point<C> bottom, Point<C> top) {
		if (!bottom.partialCompare(top).isLessOrEqual()) {
			throw new IllegalArgumentException("Bottom corner " + bottom + " is not below top corner " + top);
		}
		this.bottom = bottom;
		this.top = top;
	}

	/**
	 * Creates the degenerate tile reduced to {@code point}.
	 */
	public static <C extends Number & Comparable<C>> Tile<C> of(Point<C> point) {
		return new Tile<>(point, point);
	}

	/**
	 * Returns the smallest tile covering every tile of {@code tiles}, or
	 * {@code null} when there are none.
	 */
	public static <C extends Number & Comparable<C>> Tile<C> bounding(Iterable<Tile<C>> tiles) {
		Iterator<Tile<C>> it = tiles.iterator();
		if (!it.hasNext()) {
			return null;
		}
		Tile<C> result = it.next();
		while (it.hasNext()) {
			result = result.union(it.next());
		}
		return result;
	}

	public Point<C> getBottomLeft() {
		return bottom;
	}

	public Point<C> getTopRight() {
		return top;
	}

	public boolean isDegenerate() {
		return bottom.equals(top);
	}

	/**
	 * Returns the smallest tile including both tiles.
	 */
	public Tile<C> union(Tile<C> other) {
		Point<C> b = new Point<>(min(bottom.getX(), other.bottom.getX()), min(bottom.getY(), other.bottom.getY()));
		Point<C> t = new Point<>(max(top.getX(), other.top.getX()), max(top.getY(), other.top.getY()));
		return new Tile<>(b, t);
	}

	/**
	 * Orders two tiles by their x intervals.
	 *
	 * @return {@code LESS} or {@code GREATER} when both ends of this interval lie
	 *         strictly before, respectively after, the ends of the other one;
	 *         {@code EQUAL} otherwise
	 */
	public PartialOrdering verticalCompare(Tile<C> other) {
		return intervalCompare(bottom.getX().compareTo(other.bottom.getX()), top.getX().compareTo(other.top.getX()));
	}

	/**
	 * Orders two tiles by their y intervals, as {@link #verticalCompare(Tile)}.
	 */
	public PartialOrdering horizontalCompare(Tile<C> other) {
		return intervalCompare(bottom.getY().compareTo(other.bottom.getY()), top.getY().compareTo(other.top.getY()));
	}

	private static PartialOrdering intervalCompare(int low, int high) {
		if (low < 0 && high < 0) {
			return PartialOrdering.LESS;
		} else if (low > 0 && high > 0) {
			return PartialOrdering.GREATER;
		}
		return PartialOrdering.EQUAL;
	}

	/**
	 * Containment order against a point.
	 *
	 * @return {@code EQUAL} if this tile is degenerate at {@code point},
	 *         {@code GREATER} if the closed tile contains it, {@code LESS} if the
	 *         point lies outside
	 */
	public PartialOrdering partialCompare(Point<C> point) {
		if (isDegenerate() && bottom.equals(point)) {
			return PartialOrdering.EQUAL;
		}
		if (point.partialCompare(bottom).isGreaterOrEqual() && point.partialCompare(top).isLessOrEqual()) {
			return PartialOrdering.GREATER;
		}
		return PartialOrdering.LESS;
	}

	/**
	 * Nesting order between tiles. A tile is greater than another if it contains
	 * it. Tiles that overlap without one nesting in the other are
	 * {@code INCOMPARABLE}.
	 */
	public PartialOrdering partialCompare(Tile<C> other) {
		if (equals(other)) {
			return PartialOrdering.EQUAL;
		}
		if (bottom.partialCompare(other.bottom).isGreaterOrEqual() && top.partialCompare(other.top).isLessOrEqual()) {
			return PartialOrdering.LESS;
		}
		if (bottom.partialCompare(other.bottom).isLessOrEqual() && top.partialCompare(other.top).isGreaterOrEqual()) {
			return PartialOrdering.GREATER;
		}
		return PartialOrdering.INCOMPARABLE;
	}

	/**
	 * Converts this tile into a JTS envelope.
	 */
	public Envelope toEnvelope() {
		return new Envelope(bottom.getX().doubleValue(), top.getX().doubleValue(), bottom.getY().doubleValue(), top.getY().doubleValue());
	}

	private static <C extends Comparable<C>> C min(C a, C b) {
		return a.compareTo(b) <= 0 ? a : b;
	}

	private static <C extends Comparable<C>> C max(C a, C b) {
		return a.compareTo(b) >= 0 ? a : b;
	}

	@Override
	public boolean equals(Object obj) {
		if (this == obj) {
			return true;
		}
		if (!(obj instanceof Tile)) {
			return false;
		}
		Tile<?> other = (Tile<?>) obj;
		return bottom.equals(other.bottom) && top.equals(other.top);
	}

	@Override
	public int hashCode() {
		return Objects.hash(bottom, top);
	}

	@Override
	public String toString() {
		return "Tile[" + bottom + " - " + top + "]";
	}
}
