package com.github.micycle1.rtree;

/**
 * Result of comparing two geometric objects under a partial order.
 * <p>
 * Unlike {@link java.util.Comparator}, two objects may be
 * {@link #INCOMPARABLE}: neither ordering holds and they are not equal. Callers
 * must handle that outcome explicitly.
 *
 * @author Michael Carleton
 */
public enum PartialOrdering {

	LESS, EQUAL, GREATER,
	/**
	 * No relation holds between the two operands.
	 */
	INCOMPARABLE;

	/**
	 * Maps the sign of a {@link Comparable#compareTo(Object)} result to an
	 * ordering.
	 */
	public static PartialOrdering of(int comparison) {
		if (comparison < 0) {
			return LESS;
		} else if (comparison > 0) {
			return GREATER;
		}
		return EQUAL;
	}

	/**
	 * Swaps {@link #LESS} and {@link #GREATER}; the other outcomes are their own
	 * inverse.
	 */
	public PartialOrdering reverse() {
		switch (this) {
			case LESS:
				return GREATER;
			case GREATER:
				return LESS;
			default:
				return this;
		}
	}

	public boolean isLessOrEqual() {
		return this == LESS || this == EQUAL;
	}

	public boolean isGreaterOrEqual() {
		return this == GREATER || this == EQUAL;
	}
}
