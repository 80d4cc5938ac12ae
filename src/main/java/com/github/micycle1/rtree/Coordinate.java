package com.github.micycle1.rtree;

/**
 * Arithmetic over the scalar type used for axis values. Any integer-like
 * {@link Number} that is totally ordered can serve as a coordinate once it has
 * an implementation of this interface (see {@link Coordinates}).
 *
 * @param <C> the axis value type
 */
public interface Coordinate<C extends Number & Comparable<C>> {

	C zero();

	C one();

	C add(C a, C b);

	C subtract(C a, C b);

	C multiply(C a, C b);

	default int compare(C a, C b) {
		return a.compareTo(b);
	}
}
