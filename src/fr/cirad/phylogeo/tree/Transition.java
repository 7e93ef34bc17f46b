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

/**
 * An edge along which the label changes, e.g. a migration from one location to another.
 */
public class Transition {

	private final String from;
	private final String to;
	private final Double edgeLength;

	public Transition(String from, String to, Double edgeLength) {
		this.from = from;
		this.to = to;
		this.edgeLength = edgeLength;
	}

	public String getFrom() {
		return from;
	}

	public String getTo() {
		return to;
	}

	public Double getEdgeLength() {
		return edgeLength;
	}

	@Override
	public String toString() {
		return from + " -> " + to + (edgeLength == null ? "" : " (" + Node.formatEdgeLength(edgeLength) + ")");
	}
}
