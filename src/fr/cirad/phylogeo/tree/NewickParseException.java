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
 * Thrown when a Newick string is malformed: missing terminator, unbalanced
 * parentheses, misplaced text or unreadable edge length.
 */
public class NewickParseException extends RuntimeException {

	private static final long serialVersionUID = 3148810524327703447L;

	private final int position;

	public NewickParseException(String message, int position) {
		super(message);
		this.position = position;
	}

	public NewickParseException(String message, int position, Throwable cause) {
		super(message, cause);
		this.position = position;
	}

	/**
	 * @return the offset in the parsed text where the problem was detected, -1 if not applicable
	 */
	public int getPosition() {
		return position;
	}
}
