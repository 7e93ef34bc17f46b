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

/**
 * Thrown when observed tip states cannot be resolved: a leaf missing from the tip
 * mapping, a state missing from the distance matrix, or an unreadable mapping line.
 */
public class TipMappingException extends RuntimeException {

	private static final long serialVersionUID = -2231978803468750519L;

	public TipMappingException(String message) {
		super(message);
	}
}
