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
 * Thrown when a distance matrix is inconsistent: non-square, header and matrix
 * sizes differing, duplicate or missing labels, unreadable costs.
 */
public class DistanceMatrixException extends RuntimeException {

	private static final long serialVersionUID = -5460721395542098121L;

	public DistanceMatrixException(String message) {
		super(message);
	}

	public DistanceMatrixException(String message, Throwable cause) {
		super(message, cause);
	}
}
