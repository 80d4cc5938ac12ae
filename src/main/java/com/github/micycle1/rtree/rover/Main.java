package com.github.micycle1.rtree.rover;

import java.io.BufferedReader;
import java.io.InputStreamReader;
import java.io.PrintStream;
import java.nio.charset.StandardCharsets;

import com.github.micycle1.rtree.Point;

/**
 * Command-line entry point: reads rover input from standard input, then prints
 * the final rover position and the number of cleaned cells.
 */
public final class Main {

	private Main() {
	}

	public static void main(String[] args) {
		BufferedReader in = new BufferedReader(new InputStreamReader(System.in, StandardCharsets.UTF_8));
		int status = run(in, System.out, System.err);
		if (status != 0) {
			System.exit(status);
		}
	}

	/**
	 * Runs the simulation over {@code in}.
	 *
	 * @return the process exit status
	 */
	static int run(BufferedReader in, PrintStream out, PrintStream err) {
		RoverInputParser parser = new RoverInputParser(in);
		RoverInput input;
		try {
			input = parser.parse();
		} catch (RoverInputException e) {
			err.println("Parsing error at line " + e.getLineNumber() + ": " + e.getMessage());
			return 1;
		}

		GameMap map;
		try {
			map = GameMap.of(input);
		} catch (RoverInputException e) {
			err.println("Format error: " + e.getMessage());
			return 1;
		}

		int cleaned = map.moveAlong(input.getMoves());
		Point<Integer> rover = map.getRoverPosition();
		out.println(rover.getX() + " " + rover.getY());
		out.println(cleaned);
		return 0;
	}
}
