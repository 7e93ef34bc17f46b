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
 * Exports, for each location, the number of outgoing location changes found in the reconstructed tree.
 */
public class HotspotExportHandler implements IReconstructionExportHandler {

	@Override
	public String getExportFormatName() {
		return "HOTSPOTS";
	}

	@Override
	public String getExportFormatDescription() {
		return "Exports a CSV file counting, for each location, the edges leading from it to another location, most frequent first";
	}

	@Override
	public String getExportDataFileExtension() {
		return "csv";
	}

	@Override
	public void exportData(OutputStream os, SankoffReconstructor reconstruction, PhylogeoConfig config) throws IOException {
		os.write(reconstruction.buildStateTree().getHotspots().getBytes(StandardCharsets.UTF_8));
	}
}
