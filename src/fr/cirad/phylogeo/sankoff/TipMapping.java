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

import java.io.BufferedReader;
import java.io.File;
import java.io.IOException;
import java.io.Reader;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Set;

import org.apache.commons.lang.StringUtils;
import org.apache.log4j.Logger;

/**
 * Observed state of each tree tip, e.g. the airport where each sequence was sampled.
 */
public class TipMapping {

	private static final Logger LOG = Logger.getLogger(TipMapping.class);

	public static final String DEFAULT_DELIMITER = "\t";

	private final Map<String, String> statesByLeaf;

	public TipMapping(Map<String, String> statesByLeaf) {
		this.statesByLeaf = Collections.unmodifiableMap(new LinkedHashMap<>(statesByLeaf));
	}

	/**
	 * Reads a delimited tip file whose first line is a header. Each following
	 * line holds a leaf label then its state; further fields are ignored.
	 *
	 * @param file the file to read (UTF-8)
	 * @param delimiter the field delimiter
	 * @return the mapping
	 * @throws IOException if the file cannot be read
	 */
	public static TipMapping read(File file, String delimiter) throws IOException {
		try (BufferedReader reader = Files.newBufferedReader(file.toPath(), StandardCharsets.UTF_8)) {
			TipMapping mapping = read(reader, delimiter);
			LOG.debug("Loaded " + mapping.size() + " tip states from " + file.getName());
			return mapping;
		}
	}

	public static TipMapping read(Reader in, String delimiter) throws IOException {
		BufferedReader reader = in instanceof BufferedReader ? (BufferedReader) in : new BufferedReader(in);
		Map<String, String> statesByLeaf = new LinkedHashMap<>();
		String line = reader.readLine();	// header
		int nLineNumber = 1;
		while ((line = reader.readLine()) != null) {
			nLineNumber++;
			if (StringUtils.isBlank(line))
				continue;

			String[] fields = StringUtils.splitByWholeSeparatorPreserveAllTokens(line, delimiter);
			if (fields.length < 2 || StringUtils.isBlank(fields[1]))
				throw new TipMappingException("Line " + nLineNumber + " of tip mapping has no state: '" + line + "'");
			String previous = statesByLeaf.put(fields[0], fields[1].trim());
			if (previous != null && !previous.equals(fields[1].trim()))
				LOG.warn("Leaf '" + fields[0] + "' is listed more than once in tip mapping, keeping state found on line " + nLineNumber + ": " + fields[1].trim());
		}
		return new TipMapping(statesByLeaf);
	}

	/**
	 * Maps every observed state through a dictionary, e.g. from airports to their countries.
	 *
	 * @param dictionary state translations
	 * @return a new mapping holding the translated states
	 * @throws TipMappingException if a state has no translation
	 */
	public TipMapping translate(Map<String, String> dictionary) {
		Map<String, String> translated = new LinkedHashMap<>();
		for (Map.Entry<String, String> entry : statesByLeaf.entrySet()) {
			String newState = dictionary.get(entry.getValue());
			if (newState == null)
				throw new TipMappingException("No translation found for state '" + entry.getValue() + "' of leaf '" + entry.getKey() + "'");
			translated.put(entry.getKey(), newState);
		}
		return new TipMapping(translated);
	}

	/**
	 * @return the leaf's state, or null if the leaf is not mapped
	 */
	public String getState(String leafLabel) {
		return statesByLeaf.get(leafLabel);
	}

	public boolean contains(String leafLabel) {
		return statesByLeaf.containsKey(leafLabel);
	}

	public Set<String> getLeafLabels() {
		return statesByLeaf.keySet();
	}

	public int size() {
		return statesByLeaf.size();
	}
}
