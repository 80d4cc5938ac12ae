package com.github.micycle1.rtree;

/**
 * {@link Coordinate} implementations for the boxed integral types. Arithmetic
 * wraps on overflow, as the primitive operators do.
 */
public final class Coordinates {

	public static final Coordinate<Integer> INTEGER = new Coordinate<>() {
		@Override
		public Integer zero() {
			return 0;
		}

		@Override
		public Integer one() {
			return 1;
		}

		@Override
		public Integer add(Integer a, Integer b) {
			return a + b;
		}

		@Override
		public Integer subtract(Integer a, Integer b) {
			return a - b;
		}

		@Override
		public Integer multiply(Integer a, Integer b) {
			return a * b;
		}
	};

	public static final Coordinate<Long> LONG = new Coordinate<>() {
		@Override
		public Long zero() {
			return 0L;
		}

		@Override
		public Long one() {
			return 1L;
		}

		@Override
		public Long add(Long a, Long b) {
			return a + b;
		}

		@Override
		public Long subtract(Long a, Long b) {
			return a - b;
		}

		@Override
		public Long multiply(Long a, Long b) {
			return a * b;
		}
	};

	public static final Coordinate<Short> SHORT = new Coordinate<>() {
		@Override
		public Short zero() {
			return 0;
		}

		@Override
		public Short one() {
			return 1;
		}

		@Override
		public Short add(Short a, Short b) {
			return (short) (a + b);
		}

		@Override
		public Short subtract(Short a, Short b) {
			return (short) (a - b);
		}

		@Override
		public Short multiply(Short a, Short b) {
			return (short) (a * b);
		}
	};

	public static final Coordinate<Byte> BYTE = new Coordinate<>() {
		@Override
		public Byte zero() {
			return 0;
		}

		@Override
		public Byte one() {
			return 1;
		}

		@Override
		public Byte add(Byte a, Byte b) {
			return (byte) (a + b);
		}

		@Override
		public Byte subtract(Byte a, Byte b) {
			return (byte) (a - b);
		}

		@Override
		public Byte multiply(Byte a, Byte b) {
			return (byte) (a * b);
		}
	};

	private Coordinates() {
	}
}
