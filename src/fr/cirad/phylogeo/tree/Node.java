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

import java.text.DecimalFormat;
import java.text.DecimalFormatSymbols;
import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Collections;
import java.util.Deque;
import java.util.IdentityHashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Objects;

/**
 * A vertex of a rooted phylogenetic tree.
 *
 * A node owns its children; the parent reference is only a back-pointer used for
 * upward navigation. All traversals use explicit stacks so that very unbalanced
 * (caterpillar-like) trees can be handled whatever their depth.
 *
 * Once a tree has gone through state reconstruction each node also carries the
 * cost vector computed for it, the index of the chosen state and that state's label.
 *
 * @author SEMPERE
 */
public class Node {

	public static final String HOTSPOT_HEADER = "location,no. of outgoing flights";

	private static final DecimalFormat df;

	static {
		DecimalFormatSymbols otherSymbols = new DecimalFormatSymbols(Locale.US);
		otherSymbols.setDecimalSeparator('.');
		df = new DecimalFormat("0.#", otherSymbols);
		df.setMaximumFractionDigits(340);	// all significant digits of any double, never in scientific notation
	}

	private String label;
	private final Double edgeLengthToParent;
	private final List<Node> children = new ArrayList<>();
	private Node parent;

	private double[] stateCosts;
	private int stateIndex = -1;
	private String state;

	public Node(String label) {
		this(label, null);
	}

	public Node(String label, Double edgeLengthToParent) {
		this.label = label;
		this.edgeLengthToParent = edgeLengthToParent;
	}

	public String getLabel() {
		return label;
	}

	public void setLabel(String label) {
		this.label = label;
	}

	public Double getEdgeLengthToParent() {
		return edgeLengthToParent;
	}

	public Node getParent() {
		return parent;
	}

	/**
	 * @return an unmodifiable view of the children, in insertion order
	 */
	public List<Node> getChildren() {
		return Collections.unmodifiableList(children);
	}

	/**
	 * @return the live cost vector (not a copy): the reconstructor fills it in place during its forward pass
	 */
	public double[] getStateCosts() {
		return stateCosts;
	}

	/**
	 * @param stateCosts the cost vector, stored as is and later updated in place by the reconstructor
	 */
	public void setStateCosts(double[] stateCosts) {
		this.stateCosts = stateCosts;
	}

	public int getStateIndex() {
		return stateIndex;
	}

	public String getState() {
		return state;
	}

	public void setState(int stateIndex, String state) {
		this.stateIndex = stateIndex;
		this.state = state;
	}

	/**
	 * Creates a new node and appends it to this node's children.
	 *
	 * @param label the child's label, may be null
	 * @param edgeLength the length of the edge leading to the child, may be null
	 * @return the created child
	 */
	public Node addChild(String label, Double edgeLength) {
		Node child = new Node(label, edgeLength);
		attach(child);
		return child;
	}

	/**
	 * Appends an existing node (and its subtree) to this node's children. If the node
	 * is currently attached elsewhere it is detached from its previous parent first.
	 *
	 * @param child the node to attach
	 * @throws IllegalArgumentException if child is this node or one of its ancestors
	 */
	public void addChildNode(Node child) {
		for (Node ancestor = this; ancestor != null; ancestor = ancestor.parent)
			if (ancestor == child)
				throw new IllegalArgumentException("Attaching node '" + child.label + "' under '" + label + "' would create a cycle");

		if (child.parent != null)
			child.parent.children.remove(child);
		attach(child);
	}

	/* freshly created nodes cannot be ancestors, no need to walk up the tree for them */
	private void attach(Node child) {
		child.parent = this;
		children.add(child);
	}

	/**
	 * Detaches a child and the whole subtree below it. The subtree itself is left
	 * untouched and becomes an independent tree rooted at the removed child.
	 *
	 * @param child the child to remove
	 * @throws IllegalArgumentException if the node is not a child of this one
	 */
	public void pruneChild(Node child) {
		for (int i = 0; i < children.size(); i++)
			if (children.get(i) == child) {
				children.remove(i);
				child.parent = null;
				return;
			}
		throw new IllegalArgumentException("Node '" + (child == null ? null : child.label) + "' is not a child of '" + label + "'");
	}

	public boolean isLeaf() {
		return children.isEmpty();
	}

	public boolean isRoot() {
		return parent == null;
	}

	public Node getRoot() {
		Node node = this;
		while (node.parent != null)
			node = node.parent;
		return node;
	}

	/**
	 * @return nodes of the subtree rooted here, parents before children, siblings left to right
	 */
	public List<Node> preorder() {
		List<Node> result = new ArrayList<>();
		Deque<Node> stack = new ArrayDeque<>();
		stack.push(this);
		while (!stack.isEmpty()) {
			Node node = stack.pop();
			result.add(node);
			for (int i = node.children.size() - 1; i >= 0; i--)
				stack.push(node.children.get(i));
		}
		return result;
	}

	/**
	 * @return nodes of the subtree rooted here, children (left to right) before parents
	 */
	public List<Node> postorder() {
		// reversed "root, right-to-left children" order is exactly the left-to-right postorder
		List<Node> result = new ArrayList<>();
		Deque<Node> stack = new ArrayDeque<>();
		stack.push(this);
		while (!stack.isEmpty()) {
			Node node = stack.pop();
			result.add(node);
			for (Node child : node.children)
				stack.push(child);
		}
		Collections.reverse(result);
		return result;
	}

	/**
	 * @return leaves below this node (this node itself if it is a leaf), depth-first, left to right
	 */
	public List<Node> getLeaves() {
		List<Node> leaves = new ArrayList<>();
		for (Node node : preorder())
			if (node.isLeaf())
				leaves.add(node);
		return leaves;
	}

	/**
	 * Builds the Newick representation of the subtree rooted at this node.
	 *
	 * @param withEdgeLengths whether to append ":length" to nodes that have one
	 * @param withTerminator whether to end the string with ';'
	 * @return the Newick string
	 */
	public String serialize(boolean withEdgeLengths, boolean withTerminator) {
		StringBuilder sb = new StringBuilder();
		// each frame is a node and the index of the next child to write
		Deque<Object[]> stack = new ArrayDeque<>();
		stack.push(new Object[] {this, 0});
		while (!stack.isEmpty()) {
			Object[] frame = stack.peek();
			Node node = (Node) frame[0];
			int nextChild = (Integer) frame[1];
			if (node.isLeaf() || nextChild == node.children.size()) {
				if (!node.isLeaf())
					sb.append(')');
				node.appendNodeDescription(sb, withEdgeLengths);
				stack.pop();
				continue;
			}
			sb.append(nextChild == 0 ? '(' : ',');
			frame[1] = nextChild + 1;
			stack.push(new Object[] {node.children.get(nextChild), 0});
		}
		if (withTerminator)
			sb.append(';');
		return sb.toString();
	}

	private void appendNodeDescription(StringBuilder sb, boolean withEdgeLength) {
		if (label != null)
			sb.append(label);
		if (withEdgeLength && edgeLengthToParent != null)
			sb.append(':').append(formatEdgeLength(edgeLengthToParent));
	}

	public static String formatEdgeLength(double length) {
		return df.format(length);
	}

	/**
	 * Deep-copies the subtree rooted at this node into a new, independent tree.
	 * Labels, edge lengths and state annotations are copied; cost vectors are cloned.
	 *
	 * @return the root of the copy
	 */
	public Node copyTree() {
		Map<Node, Node> copies = new IdentityHashMap<>();
		for (Node node : preorder()) {
			Node copy = new Node(node.label, node.edgeLengthToParent);
			copy.stateCosts = node.stateCosts == null ? null : node.stateCosts.clone();
			copy.stateIndex = node.stateIndex;
			copy.state = node.state;
			if (node != this)
				copies.get(node.parent).attach(copy);
			copies.put(node, copy);
		}
		return copies.get(this);
	}

	/**
	 * Counts, for each label, the edges leading from a node carrying that label to a
	 * child carrying a different one. A label occurring at several nodes sees its
	 * counts summed up.
	 *
	 * @return label to number of outgoing label changes, in order of first occurrence
	 */
	public Map<String, Integer> computeHotspots() {
		Map<String, Integer> hotspots = new LinkedHashMap<>();
		for (Node node : preorder()) {
			if (node.isLeaf())
				continue;
			int changes = 0;
			for (Node child : node.children)
				if (!Objects.equals(node.label, child.label))
					changes++;
			hotspots.merge(node.label, changes, Integer::sum);
		}
		return hotspots;
	}

	/**
	 * @return hotspot counts as CSV text, highest counts first (ties keep their order of first occurrence)
	 */
	public String getHotspots() {
		List<Map.Entry<String, Integer>> entries = new ArrayList<>(computeHotspots().entrySet());
		entries.sort(Map.Entry.<String, Integer>comparingByValue().reversed());	// List.sort is stable

		StringBuilder sb = new StringBuilder(HOTSPOT_HEADER).append("\n");
		for (Map.Entry<String, Integer> entry : entries)
			sb.append(entry.getKey() == null ? "" : entry.getKey()).append(",").append(entry.getValue()).append("\n");
		return sb.toString();
	}

	/**
	 * @return edges whose two ends carry different labels, in preorder of their child node
	 */
	public List<Transition> getTransitions() {
		List<Transition> transitions = new ArrayList<>();
		for (Node node : preorder())
			if (node != this && !Objects.equals(node.parent.label, node.label))
				transitions.add(new Transition(node.parent.label, node.label, node.edgeLengthToParent));
		return transitions;
	}

	/**
	 * Renders the subtree as an indented outline, one node per line.
	 */
	@Override
	public String toString() {
		StringBuilder sb = new StringBuilder();
		Deque<Object[]> stack = new ArrayDeque<>();	// node, prefix, isLastSibling
		stack.push(new Object[] {this, "", true});
		while (!stack.isEmpty()) {
			Object[] item = stack.pop();
			Node node = (Node) item[0];
			String prefix = (String) item[1];
			boolean isLast = (Boolean) item[2];
			sb.append(prefix).append(isLast ? "└─ " : "├─ ").append(node.label).append("\n");
			String childPrefix = prefix + (isLast ? "   " : "│  ");
			for (int i = node.children.size() - 1; i >= 0; i--)
				stack.push(new Object[] {node.children.get(i), childPrefix, i == node.children.size() - 1});
		}
		return sb.toString();
	}
}
