package com.github.micycle1.rtree;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;

import org.locationtech.jts.geom.Envelope;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * RTree spatial index over points with integral coordinates.
 * <p>
 * Each stored point is bound to one value. Lookups and insertions descend a
 * hierarchy of nested bounding tiles, picking at each level the first child
 * whose tile contains the query point. Sibling tiles never overlap, so at most
 * one child qualifies.
 * <p>
 * The tree is not thread-safe. Concurrent callers must serialize every
 * {@link #insert(Point, Object) insert} against all other calls.
 *
 * @param <C> the axis value type
 * @param <V> the type of value bound to each point
 * @author Michael Carleton
 */
public class RTree<C extends Number & Comparable<C>, V> {

	private static final Logger log = LoggerFactory.getLogger(RTree.class);

	public static final int DEFAULT_FILL_FACTOR = 4;

	private final Coordinate<C> coordinate;
	private final int fillFactor;
	Node<C, V> root;
	private int size;

	/**
	 * Creates an empty tree with the {@link #DEFAULT_FILL_FACTOR default fill
	 * factor}.
	 *
	 * @param coordinate arithmetic of the axis value type
	 */
	public RTree(Coordinate<C> coordinate) {
		this(coordinate, DEFAULT_FILL_FACTOR);
	}

	/**
	 * Creates an empty tree.
	 *
	 * @param coordinate arithmetic of the axis value type
	 * @param fillFactor maximum number of children of an interior node, at least 2
	 */
	public RTree(Coordinate<C> coordinate, int fillFactor) {
		if (fillFactor < 2) {
			throw new IllegalArgumentException("Fill factor must be at least 2, got " + fillFactor);
		}
		this.coordinate = Objects.requireNonNull(coordinate);
		this.fillFactor = fillFactor;
	}

	/**
	 * Binds {@code value} to {@code point}, replacing any previous binding.
	 * <p>
	 * The tree accepts any point; bounds checking against a logical arena is the
	 * caller's concern.
	 *
	 * @param point the location
	 * @param value the value, not null
	 * @return the value previously bound to {@code point}, or {@code null} if the
	 *         point was not stored
	 */
	public V insert(Point<C> point, V value) {
		Objects.requireNonNull(point, "point");
		Objects.requireNonNull(value, "value");
		if (root == null) {
			root = new Leaf<>(point, value);
			size++;
			return null;
		}

		Insertion<C, V> result = root.insert(point, value, fillFactor, coordinate);
		if (result.overflow != null) {
			// The root split (or is a leaf that met a new point): grow the tree by one level.
			List<Node<C, V>> children = new ArrayList<>(fillFactor + 1);
			children.add(result.overflow);
			children.add(root);
			root = new Interior<>(children);
			log.debug("Grew new root covering {}", root.coverage());
		}
		if (result.previous == null) {
			size++;
		}
		return result.previous;
	}

	/**
	 * Looks up the value bound to exactly {@code point}.
	 */
	public Optional<V> find(Point<C> point) {
		return findLeaf(point).map(Leaf::getValue);
	}

	/**
	 * Looks up the stored entry for exactly {@code point}. The entry is live:
	 * {@link Map.Entry#setValue(Object) setValue} replaces the bound value in
	 * place without restructuring the tree.
	 */
	public Optional<Map.Entry<Point<C>, V>> findMut(Point<C> point) {
		return findLeaf(point).<Map.Entry<Point<C>, V>>map(leaf -> leaf);
	}

	private Optional<Leaf<C, V>> findLeaf(Point<C> point) {
		Objects.requireNonNull(point, "point");
		return root == null ? Optional.empty() : Optional.ofNullable(root.find(point));
	}

	/**
	 * Returns the number of points stored.
	 */
	public int size() {
		return size;
	}

	public boolean isEmpty() {
		return root == null;
	}

	public int getFillFactor() {
		return fillFactor;
	}

	/**
	 * Returns the smallest tile covering every stored point, if any.
	 */
	public Optional<Tile<C>> getCoverage() {
		return root == null ? Optional.empty() : Optional.of(root.coverage());
	}

	/**
	 * Returns the coverage of the tree as a JTS envelope; the envelope is null
	 * (empty) when the tree is.
	 */
	public Envelope getEnvelope() {
		return root == null ? new Envelope() : root.coverage().toEnvelope();
	}

	/**
	 * Chooses the line along which the children with the given tiles are split.
	 * <p>
	 * For each axis, the tiles are sorted by the coordinate of their bottom-left
	 * corner and the line is put just before the tile at index
	 * {@code fillFactor}, so that tile and any tile starting at the same
	 * coordinate move to the new sibling. The cost of a line is the number of
	 * tiles it crosses; the cheaper line wins and ties go to the vertical one. An
	 * axis on which all tiles start at the same coordinate cannot separate them
	 * and is never chosen.
	 *
	 * @throws IndexOutOfBoundsException if there are not more than
	 *                                   {@code fillFactor} tiles
	 */
	static <C extends Number & Comparable<C>> Line<C> sweep(List<Tile<C>> tiles, int fillFactor, Coordinate<C> coordinate) {
		Line<C> vertical = sweepLine(tiles, Line.Axis.VERTICAL, fillFactor, coordinate);
		Line<C> horizontal = sweepLine(tiles, Line.Axis.HORIZONTAL, fillFactor, coordinate);

		if (vertical == null && horizontal == null) {
			// only possible if the tiles overlap, which siblings never do
			throw new IllegalStateException("Tiles " + tiles + " share their bottom-left corner and cannot be split");
		}
		if (vertical == null) {
			return horizontal;
		}
		if (horizontal == null) {
			return vertical;
		}
		return straddleCost(tiles, horizontal) < straddleCost(tiles, vertical) ? horizontal : vertical;
	}

	private static <C extends Number & Comparable<C>> Line<C> sweepLine(List<Tile<C>> tiles, Line.Axis axis, int fillFactor,
			Coordinate<C> coordinate) {
		Comparator<Tile<C>> order = axis == Line.Axis.VERTICAL ? (a, b) -> a.getBottomLeft().verticalCompare(b.getBottomLeft())
				: (a, b) -> a.getBottomLeft().horizontalCompare(b.getBottomLeft());
		List<Tile<C>> sorted = new ArrayList<>(tiles);
		sorted.sort(order);

		Line<C> first = Line.through(axis, sorted.get(0).getBottomLeft());
		Line<C> split = Line.through(axis, sorted.get(fillFactor).getBottomLeft());
		if (first.equals(split)) {
			return null;
		}
		C value = coordinate.subtract(split.getValue(), coordinate.one());
		return axis == Line.Axis.VERTICAL ? Line.vertical(value) : Line.horizontal(value);
	}

	/**
	 * Number of tiles crossed by {@code line}.
	 */
	static <C extends Number & Comparable<C>> int straddleCost(List<Tile<C>> tiles, Line<C> line) {
		int cost = 0;
		for (Tile<C> tile : tiles) {
			if (line.partialCompare(tile) == PartialOrdering.EQUAL) {
				cost++;
			}
		}
		return cost;
	}

	/* ===================== Supporting Classes ==================== */

	/**
	 * A tree node: either a {@link Leaf} holding one point and its value, or an
	 * {@link Interior} node holding children and the tile covering them. A node
	 * owns its children; there are no parent references.
	 */
	abstract static class Node<C extends Number & Comparable<C>, V> {

		/**
		 * The smallest tile covering the whole subtree.
		 */
		abstract Tile<C> coverage();

		/**
		 * Containment order of this node's extent against a point: {@code GREATER}
		 * or {@code EQUAL} when the point is inside the extent.
		 */
		PartialOrdering partialCompare(Point<C> point) {
			return coverage().partialCompare(point);
		}

		/**
		 * Side of {@code line} on which this node lies: {@code LESS} if strictly
		 * before it, {@code GREATER} if strictly after, {@code EQUAL} if crossed.
		 */
		PartialOrdering partialCompare(Line<C> line) {
			return line.partialCompare(coverage()).reverse();
		}

		/**
		 * Inserts into the subtree, returning the replaced value (if any) and the
		 * overflow sibling that the caller must adopt (if any).
		 */
		abstract Insertion<C, V> insert(Point<C> point, V value, int fillFactor, Coordinate<C> coordinate);

		/**
		 * Keeps in this node whatever lies before or on {@code line} and returns what
		 * lies after it as a new node, or {@code null} if nothing does.
		 */
		abstract Node<C, V> partition(Line<C> line, int fillFactor, Coordinate<C> coordinate);

		/**
		 * Returns the leaf stored at exactly {@code point}, or {@code null}.
		 */
		abstract Leaf<C, V> find(Point<C> point);
	}

	static final class Leaf<C extends Number & Comparable<C>, V> extends Node<C, V> implements Map.Entry<Point<C>, V> {

		final Point<C> point;
		V value;

		Leaf(Point<C> point, V value) {
			this.point = point;
			this.value = value;
		}

		@Override
		Tile<C> coverage() {
			return Tile.of(point);
		}

		@Override
		Insertion<C, V> insert(Point<C> point, V value, int fillFactor, Coordinate<C> coordinate) {
			if (this.point.equals(point)) {
				V previous = this.value;
				this.value = value;
				return new Insertion<>(previous, null);
			}
			// only reachable when this leaf is the root
			return new Insertion<>(null, new Leaf<>(point, value));
		}

		@Override
		Node<C, V> partition(Line<C> line, int fillFactor, Coordinate<C> coordinate) {
			return null; // a leaf on the line stays on the left
		}

		@Override
		Leaf<C, V> find(Point<C> point) {
			return this.point.equals(point) ? this : null;
		}

		@Override
		public Point<C> getKey() {
			return point;
		}

		@Override
		public V getValue() {
			return value;
		}

		@Override
		public V setValue(V value) {
			Objects.requireNonNull(value, "value");
			V previous = this.value;
			this.value = value;
			return previous;
		}

		@Override
		public String toString() {
			return "Leaf: " + point + " -> " + value;
		}
	}

	static final class Interior<C extends Number & Comparable<C>, V> extends Node<C, V> {

		Tile<C> coverage;
		List<Node<C, V>> children;

		Interior(List<Node<C, V>> children) {
			this.children = children;
			this.coverage = Tile.bounding(coverages(children));
		}

		@Override
		Tile<C> coverage() {
			return coverage;
		}

		@Override
		Insertion<C, V> insert(Point<C> point, V value, int fillFactor, Coordinate<C> coordinate) {
			Node<C, V> child = firstContaining(point);
			V previous = null;
			Node<C, V> adopted;
			if (child != null) {
				Insertion<C, V> result = child.insert(point, value, fillFactor, coordinate);
				if (result.overflow == null) {
					return result;
				}
				previous = result.previous;
				adopted = result.overflow;
			} else {
				// No subtree contains the point: it becomes a leaf of this node.
				adopted = new Leaf<>(point, value);
			}
			children.add(adopted);
			coverage = coverage.union(adopted.coverage());
			return new Insertion<>(previous, splitNode(fillFactor, coordinate));
		}

		/**
		 * If this node has more than {@code fillFactor} children, splits it and
		 * returns the new sibling.
		 */
		Node<C, V> splitNode(int fillFactor, Coordinate<C> coordinate) {
			if (children.size() <= fillFactor) {
				return null;
			}
			Line<C> line = sweep(coverages(children), fillFactor, coordinate);
			log.trace("Splitting {} children of {} along {}", children.size(), coverage, line);
			return partition(line, fillFactor, coordinate);
		}

		@Override
		Node<C, V> partition(Line<C> line, int fillFactor, Coordinate<C> coordinate) {
			List<Node<C, V>> left = new ArrayList<>(fillFactor + 1);
			List<Node<C, V>> right = new ArrayList<>(fillFactor + 1);

			for (Node<C, V> child : children) {
				switch (child.partialCompare(line)) {
					case LESS:
						left.add(child);
						break;
					case GREATER:
						right.add(child);
						break;
					case EQUAL:
						// The child straddles the line: split its subtree too.
						Node<C, V> remainder = child.partition(line, fillFactor, coordinate);
						left.add(child);
						if (remainder != null) {
							right.add(remainder);
						}
						break;
					default:
						throw new IllegalStateException("Line " + line + " cannot classify " + child.coverage());
				}
			}

			children = left;
			coverage = Tile.bounding(coverages(left));

			if (right.isEmpty()) {
				return null;
			}
			if (right.size() == 1) {
				return right.get(0);
			}
			Interior<C, V> sibling = new Interior<>(right);
			Node<C, V> extra = sibling.splitNode(fillFactor, coordinate);
			if (extra == null) {
				return sibling;
			}
			List<Node<C, V>> halves = new ArrayList<>(fillFactor + 1);
			halves.add(sibling);
			halves.add(extra);
			return new Interior<>(halves);
		}

		@Override
		Leaf<C, V> find(Point<C> point) {
			Node<C, V> child = firstContaining(point);
			return child == null ? null : child.find(point);
		}

		private Node<C, V> firstContaining(Point<C> point) {
			for (Node<C, V> child : children) {
				if (child.partialCompare(point).isGreaterOrEqual()) {
					return child;
				}
			}
			return null;
		}

		@Override
		public String toString() {
			return "Interior(children=" + children.size() + "): " + coverage;
		}
	}

	/**
	 * Outcome of inserting into a subtree.
	 */
	static final class Insertion<C extends Number & Comparable<C>, V> {
		final V previous;
		final Node<C, V> overflow;

		Insertion(V previous, Node<C, V> overflow) {
			this.previous = previous;
			this.overflow = overflow;
		}
	}

	static <C extends Number & Comparable<C>, V> List<Tile<C>> coverages(List<Node<C, V>> nodes) {
		List<Tile<C>> tiles = new ArrayList<>(nodes.size());
		for (Node<C, V> node : nodes) {
			tiles.add(node.coverage());
		}
		return tiles;
	}
}
