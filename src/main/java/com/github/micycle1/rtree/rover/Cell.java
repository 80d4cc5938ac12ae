package com.github.micycle1.rtree.rover;

/**
 * State of an indexed arena cell.
 */
public enum Cell {
	DUST, CLEAN
}
