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

import java.io.File;
import java.io.IOException;
import java.util.Arrays;
import java.util.List;

import org.apache.log4j.Logger;

import fr.cirad.phylogeo.dist.DistanceMatrix;
import fr.cirad.phylogeo.tools.PhylogeoConfig;
import fr.cirad.phylogeo.tree.NewickParser;
import fr.cirad.phylogeo.tree.Node;

/**
 * Most-parsimonious ancestral state reconstruction according to Sankoff's algorithm.
 *
 * The forward (postorder) pass computes, for every node and every candidate state s,
 * the minimal cost of the subtree below the node given that the node is in state s:
 * <pre>
 * cost[s] = sum over children c of min over t of (cost_c[t] + d(s, t))
 * </pre>
 * The backward (preorder) pass then assigns the root its cheapest state and every
 * other node the state minimizing cost[s] + d(parentState, s). Exact ties are
 * resolved in favour of the state coming first in the distance matrix header.
 *
 * The tree is annotated in place. Internal nodes with no label get their state as label.
 */
public class SankoffReconstructor {

	private static final Logger LOG = Logger.getLogger(SankoffReconstructor.class);

	private final Node root;
	private final DistanceMatrix distanceMatrix;
	private final int nStateCount;

	private final double[][] rows;		// rows[from][to]
	private final double[][] columns;	// columns[to][from]

	private final List<Node> postorder;
	private boolean fForwardPassDone = false;

	/**
	 * Validates tip states and initializes every node's cost vector. Nothing is
	 * modified if a tip cannot be resolved.
	 *
	 * @param root the root of the tree to annotate
	 * @param distanceMatrix transition costs between states
	 * @param tipMapping observed state of each leaf
	 * @throws IllegalArgumentException if the tree is empty
	 * @throws TipMappingException if a leaf has no label, no mapped state, or a state unknown to the matrix
	 */
	public SankoffReconstructor(Node root, DistanceMatrix distanceMatrix, TipMapping tipMapping) {
		if (root == null)
			throw new IllegalArgumentException("Unable to reconstruct states on an empty tree");
		this.root = root;
		this.distanceMatrix = distanceMatrix;
		this.nStateCount = distanceMatrix.getSize();
		this.rows = distanceMatrix.getRows();
		this.columns = distanceMatrix.getColumns();
		this.postorder = root.postorder();

		int[] tipStates = resolveTipStates(tipMapping);

		int nLeafIndex = 0;
		for (Node node : postorder) {
			double[] costs = new double[nStateCount];
			if (node.isLeaf()) {
				Arrays.fill(costs, Double.POSITIVE_INFINITY);
				costs[tipStates[nLeafIndex++]] = 0;
			}
			node.setStateCosts(costs);
			node.setState(-1, null);
		}
	}

	/**
	 * Loads the tree, distance matrix and tip mapping files, using the delimiters found in the configuration.
	 *
	 * @throws IOException if a file cannot be read
	 */
	public static SankoffReconstructor fromFiles(File newickFile, File distanceMatrixFile, File tipMappingFile, PhylogeoConfig config) throws IOException {
		Node root = NewickParser.parse(newickFile);
		DistanceMatrix distanceMatrix = DistanceMatrix.read(distanceMatrixFile, config.getMatrixDelimiter());
		TipMapping tipMapping = TipMapping.read(tipMappingFile, config.getTipMappingDelimiter());
		return new SankoffReconstructor(root, distanceMatrix, tipMapping);
	}

	/**
	 * @return the state index of each leaf, in postorder
	 */
	private int[] resolveTipStates(TipMapping tipMapping) {
		int[] tipStates = new int[postorder.size()];
		int nLeafIndex = 0;
		for (Node node : postorder) {
			if (!node.isLeaf())
				continue;
			String label = node.getLabel();
			if (label == null)
				throw new TipMappingException("Found a leaf with no label, unable to find its state");
			String state = tipMapping.getState(label);
			if (state == null)
				throw new TipMappingException("Leaf '" + label + "' has no entry in tip mapping");
			if (!distanceMatrix.contains(state))
				throw new TipMappingException("State '" + state + "' of leaf '" + label + "' is not part of the distance matrix header");
			tipStates[nLeafIndex++] = distanceMatrix.getIndex(state);
		}
		return Arrays.copyOf(tipStates, nLeafIndex);
	}

	/**
	 * Runs both passes.
	 *
	 * @return the tree's root, now annotated
	 */
	public Node reconstruct() {
		long before = System.currentTimeMillis();
		forwardPass();
		backwardPass();
		LOG.debug("Reconstructed states of " + postorder.size() + " nodes over " + nStateCount + " states in " + (System.currentTimeMillis() - before) / 1000d + "s, parsimony score: " + getParsimonyScore());
		return root;
	}

	/**
	 * Computes internal nodes' cost vectors, children before parents.
	 */
	public void forwardPass() {
		double[] childContribution = new double[nStateCount];
		int[] finiteStates = new int[nStateCount];
		for (Node node : postorder) {
			if (node.isLeaf())
				continue;

			double[] costs = node.getStateCosts();
			Arrays.fill(costs, 0);
			for (Node child : node.getChildren()) {
				addChildContribution(child.getStateCosts(), costs, childContribution, finiteStates);
			}
		}
		fForwardPassDone = true;
	}

	/**
	 * Adds min over t of (childCosts[t] + d(s, t)) to costs[s], for every s.
	 * Only the child's finite states are visited (a single one for a leaf), and each of
	 * them is spread over the whole state axis through a contiguous column of the matrix.
	 */
	private void addChildContribution(double[] childCosts, double[] costs, double[] contribution, int[] finiteStates) {
		int nFiniteCount = 0;
		for (int t = 0; t < nStateCount; t++)
			if (childCosts[t] != Double.POSITIVE_INFINITY)
				finiteStates[nFiniteCount++] = t;

		Arrays.fill(contribution, Double.POSITIVE_INFINITY);
		for (int k = 0; k < nFiniteCount; k++) {
			int t = finiteStates[k];
			double childCost = childCosts[t];
			double[] toT = columns[t];
			for (int s = 0; s < nStateCount; s++) {
				double candidate = childCost + toT[s];
				if (candidate < contribution[s])
					contribution[s] = candidate;
			}
		}

		for (int s = 0; s < nStateCount; s++)
			costs[s] += contribution[s];
	}

	/**
	 * Assigns states, parents before children. Requires the forward pass.
	 *
	 * @throws IllegalStateException if the forward pass has not been run
	 */
	public void backwardPass() {
		if (!fForwardPassDone)
			throw new IllegalStateException("Forward pass must be performed before backward pass");

		for (int i = postorder.size() - 1; i >= 0; i--) {	// parents always come after their children in postorder
			Node node = postorder.get(i);
			double[] costs = node.getStateCosts();
			int chosen;
			if (node.isLeaf())
				chosen = observedState(costs);
			else if (node == root)
				chosen = argMin(costs, null);
			else
				chosen = argMin(costs, rows[node.getParent().getStateIndex()]);

			String state = distanceMatrix.getLabel(chosen);
			node.setState(chosen, state);
			if (node.getLabel() == null)
				node.setLabel(state);
		}
	}

	/**
	 * @return the first index minimizing costs[s] (+ transitionCosts[s] if provided)
	 */
	private int argMin(double[] costs, double[] transitionCosts) {
		int best = 0;
		double bestCost = Double.POSITIVE_INFINITY;
		for (int s = 0; s < nStateCount; s++) {
			double cost = transitionCosts == null ? costs[s] : costs[s] + transitionCosts[s];
			if (cost < bestCost) {
				bestCost = cost;
				best = s;
			}
		}
		return best;
	}

	private int observedState(double[] costs) {
		for (int s = 0; s < nStateCount; s++)
			if (costs[s] == 0)
				return s;
		throw new IllegalStateException("Leaf cost vector holds no observed state");
	}

	/**
	 * @return the minimal total cost of the tree, i.e. the smallest root cost
	 * @throws IllegalStateException if the forward pass has not been run
	 */
	public double getParsimonyScore() {
		if (!fForwardPassDone)
			throw new IllegalStateException("Parsimony score is only known after the forward pass");
		double[] costs = root.getStateCosts();
		return costs[argMin(costs, null)];
	}

	/**
	 * Builds a copy of the reconstructed tree where every node, leaves included, is
	 * labelled with its state. This is the form hotspots and transitions are computed on.
	 *
	 * @return the root of the copy
	 * @throws IllegalStateException if states have not been assigned yet
	 */
	public Node buildStateTree() {
		if (root.getState() == null)
			throw new IllegalStateException("States have not been reconstructed yet");
		Node stateTree = root.copyTree();
		for (Node node : stateTree.preorder())
			node.setLabel(node.getState());
		return stateTree;
	}

	public Node getRoot() {
		return root;
	}

	public DistanceMatrix getDistanceMatrix() {
		return distanceMatrix;
	}
}
