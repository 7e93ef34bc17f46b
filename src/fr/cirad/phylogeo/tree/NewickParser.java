/*******************************************************************************
 * PhyloGeo - Parsimony-based reconstruction of ancestral locations
 * Copyright (C) 2016 - 2019, <CIRAD> <IRD>
 *
 * This program is free software: you can redistribute it and/or modify it under
 * the terms of the GNU Affero General Public License, version 3 as published by
 * the Free Software Foundation.
 *
 * This program is distributed in the hope that it will be useful, but WITHOUT
 * ANY WARRANTY; without even the implied warranty of MERCHANTABILITY or FITNESS
 * FOR A PARTICULAR PURPOSE. See the GNU Affero General Public License for more
 * details.
 *
 * See <http://www.gnu.org/licenses/agpl.html> for details about GNU General
 * Public License V3.
 *******************************************************************************/
package fr.cirad.phylogeo.tree;

import java.io.File;
import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.List;

import org.apache.commons.lang.StringUtils;
import org.apache.log4j.Logger;

/**
 * Builds a tree out of a Newick string such as "((a:0.1,b:0.2)c:0.05,d:0.3);".
 *
 * Every node description is made of an optional parenthesized children list,
 * an optional label and an optional ":length" suffix. Children are split at
 * commas found outside nested parentheses and keep their left-to-right order.
 *
 * The parser works on index ranges of the input string and uses an explicit
 * stack, so its cost is linear in the input size whatever the tree depth.
 */
public class NewickParser {

	private static final Logger LOG = Logger.getLogger(NewickParser.class);

	public static final char TERMINATOR = ';';

	private static final int FRAGMENT_LENGTH = 30;

	private final String input;

	private Node root;

	public NewickParser(String input) {
		this.input = input;
	}

	/**
	 * Convenience method parsing a string in one call.
	 *
	 * @param newick the Newick string, including its terminator
	 * @return the root of the parsed tree
	 */
	public static Node parse(String newick) {
		return new NewickParser(newick).parse();
	}

	/**
	 * Parses the whole contents of a file, which may span several lines.
	 *
	 * @param newickFile the file to read
	 * @return the root of the parsed tree
	 * @throws IOException if the file cannot be read
	 */
	public static Node parse(File newickFile) throws IOException {
		return parse(new String(Files.readAllBytes(newickFile.toPath()), StandardCharsets.UTF_8));
	}

	public Node getRoot() {
		return root;
	}

	/**
	 * @return the root of the parsed tree
	 * @throws NewickParseException if the input is not a well-formed Newick string
	 */
	public Node parse() {
		if (StringUtils.isBlank(input))
			throw new NewickParseException("Newick string is empty", 0);

		int end = input.length();
		while (Character.isWhitespace(input.charAt(end - 1)))
			end--;
		if (input.charAt(end - 1) != TERMINATOR)
			throw new NewickParseException("Newick string does not end with '" + TERMINATOR + "': " + fragment(Math.max(0, end - FRAGMENT_LENGTH), end), end - 1);
		end--;
		if (isBlank(0, end))
			throw new NewickParseException("Newick string contains no tree", 0);

		int[] matchingParentheses = matchParentheses(end);

		// each frame holds the [from, to) range of a node description and the node's parent
		Deque<Object[]> stack = new ArrayDeque<>();
		stack.push(new Object[] {0, end, null});
		root = null;
		int nodeCount = 0;
		while (!stack.isEmpty()) {
			Object[] frame = stack.pop();
			int from = (Integer) frame[0], to = (Integer) frame[1];
			Node parent = (Node) frame[2];

			while (from < to && Character.isWhitespace(input.charAt(from)))
				from++;
			while (to > from && Character.isWhitespace(input.charAt(to - 1)))
				to--;

			int tailStart = from, childrenFrom = -1, childrenTo = -1;
			if (from < to && input.charAt(from) == '(') {
				childrenFrom = from + 1;
				childrenTo = matchingParentheses[from];
				tailStart = childrenTo + 1;
			}

			Node node = createNode(tailStart, to, parent);
			if (parent == null)
				root = node;
			nodeCount++;

			if (childrenFrom != -1 && !isBlank(childrenFrom, childrenTo)) {
				List<int[]> childRanges = splitChildren(childrenFrom, childrenTo, matchingParentheses);
				for (int i = childRanges.size() - 1; i >= 0; i--)	// pushed backwards so that the leftmost child gets created first
					stack.push(new Object[] {childRanges.get(i)[0], childRanges.get(i)[1], node});
			}
		}

		LOG.debug("Parsed Newick tree with " + nodeCount + " nodes from " + end + " characters");
		return root;
	}

	/**
	 * Checks that parentheses are balanced and records, for each opening one, the position of its closing counterpart.
	 */
	private int[] matchParentheses(int end) {
		int[] matching = new int[end];
		Deque<Integer> openings = new ArrayDeque<>();
		for (int i = 0; i < end; i++) {
			char c = input.charAt(i);
			if (c == '(')
				openings.push(i);
			else if (c == ')') {
				if (openings.isEmpty())
					throw new NewickParseException("Unmatched ')' at position " + i + ": " + fragment(i, i + FRAGMENT_LENGTH), i);
				matching[openings.pop()] = i;
			}
			else if (c == TERMINATOR)
				throw new NewickParseException("Unexpected '" + TERMINATOR + "' at position " + i + ", only one tree per string is supported", i);
		}
		if (!openings.isEmpty()) {
			int unclosed = openings.peekLast();
			throw new NewickParseException("Unclosed '(' at position " + unclosed + ": " + fragment(unclosed, unclosed + FRAGMENT_LENGTH), unclosed);
		}
		return matching;
	}

	/**
	 * Splits a children list at the commas found at nesting depth 0. Nested groups are skipped in one jump.
	 */
	private List<int[]> splitChildren(int from, int to, int[] matchingParentheses) {
		List<int[]> ranges = new ArrayList<>();
		int start = from;
		for (int i = from; i < to; i++) {
			char c = input.charAt(i);
			if (c == '(')
				i = matchingParentheses[i];
			else if (c == ',') {
				ranges.add(new int[] {start, i});
				start = i + 1;
			}
		}
		ranges.add(new int[] {start, to});
		return ranges;
	}

	/**
	 * Reads the "label:length" part following a node's children (if any) and creates the node.
	 */
	private Node createNode(int from, int to, Node parent) {
		for (int i = from; i < to; i++) {
			char c = input.charAt(i);
			if (c == '(' || c == ')')
				throw new NewickParseException("Unexpected '" + c + "' at position " + i + ": " + fragment(i, i + FRAGMENT_LENGTH), i);
		}

		String description = input.substring(from, to);
		int colonPos = description.indexOf(':');
		String label = StringUtils.trimToNull(colonPos == -1 ? description : description.substring(0, colonPos));
		Double edgeLength = null;
		if (colonPos != -1) {
			String lengthString = description.substring(colonPos + 1).trim();
			try {
				edgeLength = Double.parseDouble(lengthString);
			}
			catch (NumberFormatException nfe) {
				throw new NewickParseException("Invalid edge length '" + lengthString + "' at position " + (from + colonPos + 1) + " for node " + (label == null ? "with no label" : "'" + label + "'"), from + colonPos + 1, nfe);
			}
			if (edgeLength.isNaN() || edgeLength.isInfinite())
				throw new NewickParseException("Invalid edge length '" + lengthString + "' at position " + (from + colonPos + 1), from + colonPos + 1);
			if (edgeLength < 0)
				LOG.warn("Negative edge length " + lengthString + " found for node " + (label == null ? "at position " + from : "'" + label + "'"));
		}

		return parent == null ? new Node(label, edgeLength) : parent.addChild(label, edgeLength);
	}

	private boolean isBlank(int from, int to) {
		for (int i = from; i < to; i++)
			if (!Character.isWhitespace(input.charAt(i)))
				return false;
		return true;
	}

	private String fragment(int from, int to) {
		return "'" + input.substring(Math.max(0, from), Math.min(input.length(), to)) + "'";
	}
}
