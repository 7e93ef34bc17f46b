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
import java.nio.charset.StandardCharsets;

import fr.cirad.phylogeo.sankoff.SankoffReconstructor;
import fr.cirad.phylogeo.tools.PhylogeoConfig;

/**
 * The Class ReconstructedNewickExportHandler.
 */
public class ReconstructedNewickExportHandler implements IReconstructionExportHandler {

	@Override
	public String getExportFormatName() {
		return "NEWICK";
	}

	@Override
	public String getExportFormatDescription() {
		return "Exports the reconstructed tree in Newick format, each node (tips included) being labelled with its location";
	}

	@Override
	public String getExportDataFileExtension() {
		return "nwk";
	}

	@Override
	public void exportData(OutputStream os, SankoffReconstructor reconstruction, PhylogeoConfig config) throws IOException {
		String newick = reconstruction.buildStateTree().serialize(config.isExportWithEdgeLengths(), true);
		os.write((newick + LINE_SEPARATOR).getBytes(StandardCharsets.UTF_8));
	}
}
