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
package fr.cirad.phylogeo.exporting;

import java.io.IOException;
import java.io.OutputStream;

import fr.cirad.phylogeo.sankoff.SankoffReconstructor;
import fr.cirad.phylogeo.tools.PhylogeoConfig;

/**
 * Writes one kind of output out of a completed state reconstruction.
 */
public interface IReconstructionExportHandler {

	/** The line separator. */
	String LINE_SEPARATOR = "\n";

	/**
	 * @return the unique name identifying this export format
	 */
	String getExportFormatName();

	String getExportFormatDescription();

	/**
	 * @return the extension given to files written by this handler
	 */
	String getExportDataFileExtension();

	/**
	 * Writes this handler's output for a reconstruction whose states have been assigned.
	 *
	 * @param os where to write, left open
	 * @param reconstruction the reconstruction to export
	 * @param config settings possibly affecting the output
	 * @throws IOException if writing fails
	 */
	void exportData(OutputStream os, SankoffReconstructor reconstruction, PhylogeoConfig config) throws IOException;
}
