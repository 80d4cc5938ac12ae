package com.github.micycle1.rtree;

import java.util.Objects;

/**
 * An immutable location in the 2D plane.
 * <p>
 * Points are partially ordered by dominance: a point is greater than another
 * when it is greater on one axis and not smaller on the other. Points that are
 * greater on one axis but smaller on the other are
 * {@link PartialOrdering#INCOMPARABLE incomparable}.
 *
 * @param <C> the axis value type
 */
public final class Point<C extends Number & Comparable<C>> {

	private final C x;
	private final C y;

	public Point(C x, C y) {
		this.x = Objects.requireNonNull(x, "x");
		this.y = Objects.requireNonNull(y, "y");
	}

	public static <C extends Number & Comparable<C>> Point<C> of(C x, C y) {
		return new Point<>(x, y);
	}

	public C getX() {
		return x;
	}

	public C getY() {
		return y;
	}

	/**
	 * Orders two points by their x coordinates only.
	 */
	public int verticalCompare(Point<C> other) {
		return x.compareTo(other.x);
	}

	/**
	 * Orders two points by their y coordinates only.
	 */
	public int horizontalCompare(Point<C> other) {
		return y.compareTo(other.y);
	}

	/**
	 * Dominance order. When one axis ties, the other axis decides; when both axes
	 * differ they must differ in the same direction, otherwise the points are
	 * incomparable.
	 */
	public PartialOrdering partialCompare(Point<C> other) {
		int cx = x.compareTo(other.x);
		int cy = y.compareTo(other.y);
		if (cx == 0) {
			return PartialOrdering.of(cy);
		} else if (cy == 0) {
			return PartialOrdering.of(cx);
		} else if (cx < 0 && cy < 0) {
			return PartialOrdering.LESS;
		} else if (cx > 0 && cy > 0) {
			return PartialOrdering.GREATER;
		}
		return PartialOrdering.INCOMPARABLE;
	}

	/**
	 * Containment seen from the point: the exact inverse of
	 * {@link Tile#partialCompare(Point)}. A point inside the tile is
	 * {@link PartialOrdering#LESS LESS} than it.
	 */
	public PartialOrdering partialCompare(Tile<C> tile) {
		return tile.partialCompare(this).reverse();
	}

	/**
	 * Vector addition: returns this point translated by {@code vector}.
	 */
	public Point<C> translate(Point<C> vector, Coordinate<C> coordinate) {
		return new Point<>(coordinate.add(x, vector.x), coordinate.add(y, vector.y));
	}

	@Override
	public boolean equals(Object obj) {
		if (this == obj) {
			return true;
		}
		if (!(obj instanceof Point)) {
			return false;
		}
		Point<?> other = (Point<?>) obj;
		return x.equals(other.x) && y.equals(other.y);
	}

	@Override
	public int hashCode() {
		return Objects.hash(x, y);
	}

	@Override
	public String toString() {
		return "(" + x + ", " + y + ")";
	}
}
