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

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.io.File;
import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

@DisplayName("Newick parsing")
class NewickParserTest {

	private static List<String> leafLabels(Node root) {
		List<String> labels = new ArrayList<>();
		for (Node leaf : root.getLeaves())
			labels.add(leaf.getLabel());
		return labels;
	}

	@Test
	@DisplayName("A lone label makes a single-leaf tree")
	void testSingleLeaf() {
		Node root = NewickParser.parse("A;");
		assertEquals("A", root.getLabel());
		assertTrue(root.isLeaf());
		assertTrue(root.isRoot());
		assertNull(root.getEdgeLengthToParent());
	}

	@Test
	@DisplayName("Children keep their order, labels and lengths")
	void testRootWithLeaves() {
		Node root = NewickParser.parse("(A:0.1,B:0.2,C)R;");
		assertEquals("R", root.getLabel());
		assertEquals(3, root.getChildren().size());
		assertEquals(List.of("A", "B", "C"), leafLabels(root));
		assertEquals(0.1, root.getChildren().get(0).getEdgeLengthToParent(), 1e-12);
		assertEquals(0.2, root.getChildren().get(1).getEdgeLengthToParent(), 1e-12);
		assertNull(root.getChildren().get(2).getEdgeLengthToParent());
		for (Node child : root.getChildren())
			assertEquals(root, child.getParent());
	}

	@Test
	@DisplayName("Unlabelled internal nodes and whitespace are supported")
	void testNestedWithWhitespace() {
		Node root = NewickParser.parse(" ( (A , B ) : 0.5 , C:1e-3 ) ;\n");
		assertNull(root.getLabel());
		Node internal = root.getChildren().get(0);
		assertNull(internal.getLabel());
		assertEquals(0.5, internal.getEdgeLengthToParent(), 1e-12);
		assertEquals(List.of("A", "B", "C"), leafLabels(root));
		assertEquals(0.001, root.getChildren().get(1).getEdgeLengthToParent(), 1e-12);
	}

	@Test
	@DisplayName("Empty children block yields a childless node")
	void testEmptyChildren() {
		Node root = NewickParser.parse("()X;");
		assertEquals("X", root.getLabel());
		assertTrue(root.isLeaf());
	}

	@Test
	@DisplayName("Malformed strings are rejected")
	void testErrors() {
		assertThrows(NewickParseException.class, () -> NewickParser.parse(""));
		assertThrows(NewickParseException.class, () -> NewickParser.parse("   "));
		assertThrows(NewickParseException.class, () -> NewickParser.parse("(A,B)"));
		assertThrows(NewickParseException.class, () -> NewickParser.parse(";"));
		assertThrows(NewickParseException.class, () -> NewickParser.parse("((A,B);"));
		assertThrows(NewickParseException.class, () -> NewickParser.parse("(A,B));"));
		assertThrows(NewickParseException.class, () -> NewickParser.parse("(A:x,B);"));
		assertThrows(NewickParseException.class, () -> NewickParser.parse("(A,B)C(D);"));
		assertThrows(NewickParseException.class, () -> NewickParser.parse("(A,B);(C,D);"));
		assertThrows(NewickParseException.class, () -> NewickParser.parse("(A:Infinity,B:1);"));
		assertThrows(NewickParseException.class, () -> NewickParser.parse("(A:-Infinity,B:1);"));
		assertThrows(NewickParseException.class, () -> NewickParser.parse("(A:NaN,B:1);"));
	}

	@Test
	@DisplayName("Error position points at the offending character")
	void testErrorPosition() {
		NewickParseException e = assertThrows(NewickParseException.class, () -> NewickParser.parse("(A,B));"));
		assertEquals(5, e.getPosition());
	}

	@Test
	@DisplayName("Serializing a parsed tree gives back the same string")
	void testRoundTrip() {
		String newick = "((A:0.1,B:0.25)AB:0.5,(C:1,D:2.125)CD:0.75)root;";
		assertEquals(newick, NewickParser.parse(newick).serialize(true, true));
		assertEquals("((A,B)AB,(C,D)CD)root", NewickParser.parse(newick).serialize(false, false));
	}

	@Test
	@DisplayName("Edge lengths survive a write and re-read at full precision")
	void testRoundTripPrecision() {
		double[] lengths = {0.30000000000000004, 1e-20, 2.5e-17, 1.23456789e-10, 0.12345678901234568, 123456789.123};
		StringBuilder sb = new StringBuilder("(");
		for (int i = 0; i < lengths.length; i++)
			sb.append(i == 0 ? "" : ",").append("L").append(i).append(':').append(lengths[i]);
		sb.append(");");

		String written = NewickParser.parse(sb.toString()).serialize(true, true);
		assertFalse(written.contains("E"));
		Node reread = NewickParser.parse(written);
		for (int i = 0; i < lengths.length; i++)
			assertEquals(lengths[i], reread.getChildren().get(i).getEdgeLengthToParent(), 0);
	}

	@Test
	@DisplayName("Negative lengths are kept")
	void testNegativeLength() {
		Node root = NewickParser.parse("(A:-0.5,B:1);");
		assertEquals(-0.5, root.getChildren().get(0).getEdgeLengthToParent(), 1e-12);
	}

	@Test
	@DisplayName("Very deep caterpillar trees do not overflow the stack")
	void testDeepTree() {
		int depth = 100000;
		StringBuilder sb = new StringBuilder();
		for (int i = 0; i < depth; i++)
			sb.append('(');
		sb.append("L0");
		for (int i = 1; i <= depth; i++)
			sb.append(",L").append(i).append(')');
		sb.append(';');

		Node root = NewickParser.parse(sb.toString());
		assertEquals(depth + 1, root.getLeaves().size());
		assertEquals(2 * depth + 1, root.preorder().size());
		assertEquals(sb.toString(), root.serialize(false, true));
	}

	@Test
	@DisplayName("Trees may be read from multi-line files")
	void testParseFile(@TempDir Path tempDir) throws IOException {
		File file = tempDir.resolve("tree.nwk").toFile();
		Files.write(file.toPath(), "((A,B),\n(C,D));\n".getBytes(StandardCharsets.UTF_8));
		assertEquals(List.of("A", "B", "C", "D"), leafLabels(NewickParser.parse(file)));
	}
}
