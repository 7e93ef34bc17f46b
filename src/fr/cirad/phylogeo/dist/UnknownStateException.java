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
package fr.cirad.phylogeo.dist;

/**
 * Thrown when a distance is requested for a state label absent from the matrix header.
 */
public class UnknownStateException extends RuntimeException {

	private static final long serialVersionUID = 7285316398145023950L;

	private final String state;

	public UnknownStateException(String state) {
		super("Unknown state '" + state + "': not part of the distance matrix header");
		this.state = state;
	}

	public String getState() {
		return state;
	}
}
