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
package fr.cirad.phylogeo.sankoff;

import static org.junit.jupiter.api.Assertions.assertArrayEquals;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertNotSame;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertSame;
import static org.junit.jupiter.api.Assertions.assertThrows;

import java.io.File;
import java.io.IOException;
import java.net.URISyntaxException;
import java.util.ArrayList;
import java.util.Collections;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Properties;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import fr.cirad.phylogeo.dist.DistanceMatrix;
import fr.cirad.phylogeo.tools.PhylogeoConfig;
import fr.cirad.phylogeo.tree.NewickParser;
import fr.cirad.phylogeo.tree.Node;

@DisplayName("Sankoff reconstruction")
class SankoffReconstructorTest {

	private static final String[] NUCLEOTIDES = {"A", "C", "G", "T"};
	private static final double[][] NUCLEOTIDE_COSTS = {{0, 2, 1, 2}, {2, 0, 2, 1}, {1, 2, 0, 2}, {2, 1, 2, 0}};

	private static final String[] ABCD = {"A", "B", "C", "D"};
	private static final double[][] ASYMMETRIC_COSTS = {{0, 2, 3, 1}, {1, 0, 3, 2}, {2, 4, 0, 2}, {2, 1, 1, 0}};

	private static TipMapping identityMapping(String... states) {
		Map<String, String> mapping = new HashMap<>();
		for (String state : states)
			mapping.put(state, state);
		return new TipMapping(mapping);
	}

	@Test
	@DisplayName("Forward pass computes the root cost vector")
	void testForwardPass() {
		Node root = NewickParser.parse("(((A,C),G),(C,G));");
		SankoffReconstructor reconstructor = new SankoffReconstructor(root, new DistanceMatrix(NUCLEOTIDES, NUCLEOTIDE_COSTS), identityMapping(NUCLEOTIDES));
		reconstructor.forwardPass();
		assertArrayEquals(new double[] {6, 6, 5, 8}, root.getStateCosts(), 1e-9);
		assertEquals(5, reconstructor.getParsimonyScore(), 1e-9);
	}

	@Test
	@DisplayName("Backward pass picks the cheapest states top-down")
	void testBackwardPass() {
		Node root = NewickParser.parse("(((A,C),G),(C,G));");
		new SankoffReconstructor(root, new DistanceMatrix(NUCLEOTIDES, NUCLEOTIDE_COSTS), identityMapping(NUCLEOTIDES)).reconstruct();
		assertEquals("G", root.getLabel());
		assertEquals("G", root.getState());
		assertEquals(2, root.getStateIndex());
		for (Node child : root.getChildren())
			assertEquals("G", child.getLabel());
		for (Node leaf : root.getLeaves())
			assertEquals(leaf.getLabel(), leaf.getState());
	}

	@Test
	@DisplayName("Asymmetric costs are read from parent to child")
	void testAsymmetricMatrix() {
		Node root = NewickParser.parse("(A,(B,C));");
		SankoffReconstructor reconstructor = new SankoffReconstructor(root, new DistanceMatrix(ABCD, ASYMMETRIC_COSTS), identityMapping(ABCD));
		reconstructor.reconstruct();
		assertArrayEquals(new double[] {3, 4, 6, 4}, root.getStateCosts(), 1e-9);
		assertEquals("A", root.getLabel());

		List<String> childLabels = new ArrayList<>();
		for (Node child : root.getChildren())
			childLabels.add(child.getLabel());
		Collections.sort(childLabels);
		assertEquals(List.of("A", "D"), childLabels);
	}

	@Test
	@DisplayName("Existing internal labels are kept, only states are assigned")
	void testInternalLabelsKept() {
		Node root = NewickParser.parse("((A,C)n1,G)n0;");
		new SankoffReconstructor(root, new DistanceMatrix(NUCLEOTIDES, NUCLEOTIDE_COSTS), identityMapping(NUCLEOTIDES)).reconstruct();
		assertEquals("n0", root.getLabel());
		assertEquals("n1", root.getChildren().get(0).getLabel());
		assertEquals("A", root.getChildren().get(0).getState());
	}

	@Test
	@DisplayName("Exact ties go to the state listed first")
	void testTieBreak() {
		Node root = NewickParser.parse("(x,y);");
		DistanceMatrix dm = new DistanceMatrix(new String[] {"P", "Q"}, new double[][] {{0, 1}, {1, 0}});
		Map<String, String> tips = new HashMap<>();
		tips.put("x", "Q");
		tips.put("y", "P");
		new SankoffReconstructor(root, dm, new TipMapping(tips)).reconstruct();
		assertEquals("P", root.getState());
	}

	@Test
	@DisplayName("Leaves are mapped to states through their labels")
	void testTipMapping() {
		Node root = NewickParser.parse("((s1,s2),(s3,s4));");
		Map<String, String> tips = new HashMap<>();
		tips.put("s1", "C");
		tips.put("s2", "C");
		tips.put("s3", "C");
		tips.put("s4", "T");
		SankoffReconstructor reconstructor = new SankoffReconstructor(root, new DistanceMatrix(NUCLEOTIDES, NUCLEOTIDE_COSTS), new TipMapping(tips));
		reconstructor.reconstruct();
		assertEquals("C", root.getState());
		assertEquals("s4", root.getChildren().get(1).getChildren().get(1).getLabel());
		assertEquals("T", root.getChildren().get(1).getChildren().get(1).getState());
		assertEquals(1, reconstructor.getParsimonyScore(), 1e-9);
	}

	@Test
	@DisplayName("Unmapped leaves or unknown states are rejected before any change")
	void testMappingErrors() {
		DistanceMatrix dm = new DistanceMatrix(NUCLEOTIDES, NUCLEOTIDE_COSTS);
		Node root = NewickParser.parse("(A,(C,X));");
		assertThrows(TipMappingException.class, () -> new SankoffReconstructor(root, dm, identityMapping(NUCLEOTIDES)));
		assertNull(root.getStateCosts());

		Map<String, String> tips = new HashMap<>();
		tips.put("A", "A");
		tips.put("C", "C");
		tips.put("X", "Z");
		assertThrows(TipMappingException.class, () -> new SankoffReconstructor(root, dm, new TipMapping(tips)));

		assertThrows(TipMappingException.class, () -> new SankoffReconstructor(NewickParser.parse("(A,());"), dm, identityMapping(NUCLEOTIDES)));
	}

	@Test
	@DisplayName("Calls out of order or on an empty tree are refused")
	void testIllegalUsage() {
		DistanceMatrix dm = new DistanceMatrix(NUCLEOTIDES, NUCLEOTIDE_COSTS);
		assertThrows(IllegalArgumentException.class, () -> new SankoffReconstructor(null, dm, identityMapping(NUCLEOTIDES)));

		SankoffReconstructor reconstructor = new SankoffReconstructor(NewickParser.parse("(A,C);"), dm, identityMapping(NUCLEOTIDES));
		assertThrows(IllegalStateException.class, reconstructor::backwardPass);
		assertThrows(IllegalStateException.class, reconstructor::getParsimonyScore);
		assertThrows(IllegalStateException.class, reconstructor::buildStateTree);
	}

	@Test
	@DisplayName("A single-leaf tree keeps its observed state at zero cost")
	void testSingleLeaf() {
		Node root = NewickParser.parse("G;");
		SankoffReconstructor reconstructor = new SankoffReconstructor(root, new DistanceMatrix(NUCLEOTIDES, NUCLEOTIDE_COSTS), identityMapping(NUCLEOTIDES));
		reconstructor.reconstruct();
		assertEquals("G", root.getState());
		assertEquals(0, reconstructor.getParsimonyScore(), 0);
	}

	@Test
	@DisplayName("State tree labels every node with its location and leaves the original untouched")
	void testStateTree() {
		Node root = NewickParser.parse("((a:1,b:2)x:0.5,c:3);");
		Map<String, String> tips = new HashMap<>();
		tips.put("a", "A");
		tips.put("b", "A");
		tips.put("c", "T");
		SankoffReconstructor reconstructor = new SankoffReconstructor(root, new DistanceMatrix(NUCLEOTIDES, NUCLEOTIDE_COSTS), new TipMapping(tips));
		assertSame(root, reconstructor.reconstruct());

		Node stateTree = reconstructor.buildStateTree();
		assertNotSame(root, stateTree);
		assertEquals("((A:1,A:2)A:0.5,T:3)A;", stateTree.serialize(true, true));
		assertEquals("((a:1,b:2)x:0.5,c:3)A;", root.serialize(true, true));
		assertEquals(1, stateTree.getTransitions().size());
	}

	@Test
	@DisplayName("Inputs are loaded from files using configured delimiters")
	void testFromFiles() throws IOException, URISyntaxException {
		File newick = new File(getClass().getResource("/tree.nwk").toURI());
		File matrix = new File(getClass().getResource("/distances.csv").toURI());
		File tips = new File(getClass().getResource("/tipdata.tsv").toURI());
		SankoffReconstructor reconstructor = SankoffReconstructor.fromFiles(newick, matrix, tips, new PhylogeoConfig(new Properties()));
		Node root = reconstructor.reconstruct();
		assertEquals(5, root.getLeaves().size());
		assertEquals("LAX", root.getState());
		assertEquals("LAX", root.getChildren().get(0).getState());
		assertEquals(4, reconstructor.getParsimonyScore(), 1e-9);
	}

	@Test
	@DisplayName("Very deep trees are reconstructed without recursion")
	void testDeepTree() {
		int depth = 50000;
		Node root = new Node(null);
		Node node = root;
		Map<String, String> tips = new HashMap<>();
		for (int i = 0; i < depth; i++) {
			node.addChild("L" + i, 1d);
			tips.put("L" + i, NUCLEOTIDES[i % 4]);
			node = node.addChild(null, 1d);
		}
		node.setLabel("last");
		tips.put("last", "A");

		SankoffReconstructor reconstructor = new SankoffReconstructor(root, new DistanceMatrix(NUCLEOTIDES, NUCLEOTIDE_COSTS), new TipMapping(tips));
		reconstructor.reconstruct();
		for (Node n : root.preorder())
			if (n.getState() == null)
				throw new AssertionError("Node " + n.getLabel() + " was left without state");
		assertEquals(2 * depth + 1, root.preorder().size());
	}
}
