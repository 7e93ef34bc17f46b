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

import org.apache.commons.lang.StringUtils;

import fr.cirad.phylogeo.sankoff.SankoffReconstructor;
import fr.cirad.phylogeo.tools.PhylogeoConfig;
import fr.cirad.phylogeo.tree.Node;

/**
 * Exports a two-column table giving each node's label and reconstructed location, in preorder.
 */
public class StateAnnotationExportHandler implements IReconstructionExportHandler {

	public static final String HEADER = "label\tlocation";

	@Override
	public String getExportFormatName() {
		return "ANNOTATION";
	}

	@Override
	public String getExportFormatDescription() {
		return "Exports a tab-separated file listing every node's label along with its reconstructed location";
	}

	@Override
	public String getExportDataFileExtension() {
		return "tsv";
	}

	@Override
	public void exportData(OutputStream os, SankoffReconstructor reconstruction, PhylogeoConfig config) throws IOException {
		StringBuilder sb = new StringBuilder(HEADER).append(LINE_SEPARATOR);
		for (Node node : reconstruction.getRoot().preorder())
			sb.append(StringUtils.defaultString(node.getLabel())).append("\t").append(StringUtils.defaultString(node.getState())).append(LINE_SEPARATOR);
		os.write(sb.toString().getBytes(StandardCharsets.UTF_8));
	}
}
