package com.github.micycle1.rtree;

import java.util.Objects;

/**
 * An infinite vertical or horizontal line, used to classify tiles and points
 * when a node is split. Lines are never stored in the tree.
 *
 * @param <C> the axis value type
 */
public final class Line<C extends Number & Comparable<C>> {

	public enum Axis {
		/** A line of constant x. */
		VERTICAL,
		/** A line of constant y. */
		HORIZONTAL
	}

	private final Axis axis;
	private final C value;

	private Line(Axis axis, C value) {
		this.axis = axis;
		this.value = Objects.requireNonNull(value);
	}

	public static <C extends Number & Comparable<C>> Line<C> vertical(C x) {
		return new Line<>(Axis.VERTICAL, x);
	}

	public static <C extends Number & Comparable<C>> Line<C> horizontal(C y) {
		return new Line<>(Axis.HORIZONTAL, y);
	}

	/**
	 * Returns the line of the given axis passing through {@code point}.
	 */
	public static <C extends Number & Comparable<C>> Line<C> through(Axis axis, Point<C> point) {
		return new Line<>(axis, axis == Axis.VERTICAL ? point.getX() : point.getY());
	}

	public Axis getAxis() {
		return axis;
	}

	public C getValue() {
		return value;
	}

	public boolean isVertical() {
		return axis == Axis.VERTICAL;
	}

	public boolean isHorizontal() {
		return axis == Axis.HORIZONTAL;
	}

	/**
	 * Classifies a tile against this line.
	 *
	 * @return {@code EQUAL} if the line crosses the closed tile, {@code LESS} if
	 *         the line lies strictly before it, {@code GREATER} if strictly after
	 */
	public PartialOrdering partialCompare(Tile<C> tile) {
		int low = value.compareTo(project(tile.getBottomLeft()));
		int high = value.compareTo(project(tile.getTopRight()));
		if (low < 0 && high < 0) {
			return PartialOrdering.LESS;
		} else if (low > 0 && high > 0) {
			return PartialOrdering.GREATER;
		}
		return PartialOrdering.EQUAL;
	}

	/**
	 * Classifies a point against this line: {@code EQUAL} iff the point lies on
	 * it, otherwise the side of the line relative to the point.
	 */
	public PartialOrdering partialCompare(Point<C> point) {
		return PartialOrdering.of(value.compareTo(project(point)));
	}

	private C project(Point<C> point) {
		return axis == Axis.VERTICAL ? point.getX() : point.getY();
	}

	@Override
	public boolean equals(Object obj) {
		if (this == obj) {
			return true;
		}
		if (!(obj instanceof Line)) {
			return false;
		}
		Line<?> other = (Line<?>) obj;
		return axis == other.axis && value.equals(other.value);
	}

	@Override
	public int hashCode() {
		return Objects.hash(axis, value);
	}

	@Override
	public String toString() {
		return (isVertical() ? "x = " : "y = ") + value;
	}
}
