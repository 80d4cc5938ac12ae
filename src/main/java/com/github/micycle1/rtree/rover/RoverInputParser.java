package com.github.micycle1.rtree.rover;

import java.io.BufferedReader;
import java.io.IOException;
import java.util.ArrayList;
import java.util.List;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.github.micycle1.rtree.Point;
import com.github.micycle1.rtree.rover.RoverInputException.Kind;

/**
 * Reads rover input, one record per line:
 * <ol>
 * <li>the top-right corner of the arena,</li>
 * <li>the initial rover position,</li>
 * <li>zero or more dust positions,</li>
 * <li>the rover moves, as a string of {@code N}, {@code E}, {@code S} and
 * {@code W}.</li>
 * </ol>
 * A coordinate line holds two unsigned 16-bit numbers separated by a single
 * whitespace character, {@code y} first. Dust lines end at the first line that
 * does not start with a digit.
 */
public class RoverInputParser {

	private static final Logger log = LoggerFactory.getLogger(RoverInputParser.class);

	private static final int MAX_COORDINATE = 0xFFFF;

	private final BufferedReader reader;
	private String peeked;
	private boolean hasPeeked;
	private int lineNumber;

	public RoverInputParser(BufferedReader reader) {
		this.reader = reader;
	}

	/**
	 * Number of lines consumed so far.
	 */
	public int getLineNumber() {
		return lineNumber;
	}

	public RoverInput parse() throws RoverInputException {
		Point<Integer> gridTop = parseCoordinate();
		Point<Integer> rover = parseCoordinate();
		List<Point<Integer>> dust = parseDust();
		List<RoverMove> moves = parseMoves();
		log.debug("Parsed arena {}, rover {}, {} dust positions and {} moves", gridTop, rover, dust.size(), moves.size());
		return new RoverInput(gridTop, rover, dust, moves);
	}

	private Point<Integer> parseCoordinate() throws RoverInputException {
		String line = nextLine();
		String[] words = line.split("\\s", -1);
		if (words.length != 2) {
			throw new RoverInputException(Kind.INVALID_COORDINATE_FORMAT, lineNumber);
		}
		int y = parseNumber(words[0]);
		int x = parseNumber(words[1]);
		return Point.of(x, y);
	}

	private int parseNumber(String word) throws RoverInputException {
		try {
			int value = Integer.parseInt(word);
			if (value < 0 || value > MAX_COORDINATE || word.startsWith("-")) {
				throw new NumberFormatException("number out of range: \"" + word + "\"");
			}
			return value;
		} catch (NumberFormatException e) {
			throw new RoverInputException(Kind.INVALID_NUMBER, lineNumber, e);
		}
	}

	private List<Point<Integer>> parseDust() throws RoverInputException {
		List<Point<Integer>> dust = new ArrayList<>();
		while (true) {
			String line = peekLine();
			if (line.isEmpty()) {
				throw new RoverInputException(Kind.INVALID_COORDINATE_FORMAT, lineNumber + 1);
			}
			char first = line.charAt(0);
			if (first < '0' || first > '9') {
				return dust; // start of the moves
			}
			dust.add(parseCoordinate());
		}
	}

	private List<RoverMove> parseMoves() throws RoverInputException {
		String line = nextLine();
		List<RoverMove> moves = new ArrayList<>(line.length());
		for (int i = 0; i < line.length(); i++) {
			RoverMove move = RoverMove.parse(line.charAt(i));
			if (move == null) {
				throw new RoverInputException(Kind.INVALID_MOVE, lineNumber);
			}
			moves.add(move);
		}
		return moves;
	}

	private String nextLine() throws RoverInputException {
		String line = peekLine();
		peeked = null;
		hasPeeked = false;
		lineNumber++;
		return line;
	}

	private String peekLine() throws RoverInputException {
		if (!hasPeeked) {
			try {
				peeked = reader.readLine();
			} catch (IOException e) {
				throw new RoverInputException(Kind.INPUT_ERROR, lineNumber + 1, e);
			}
			hasPeeked = true;
		}
		if (peeked == null) {
			throw new RoverInputException(Kind.UNEXPECTED_EOF, lineNumber + 1);
		}
		return peeked;
	}
}
