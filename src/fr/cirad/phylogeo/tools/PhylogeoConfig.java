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
package fr.cirad.phylogeo.tools;

import java.io.IOException;
import java.io.InputStream;
import java.util.ArrayList;
import java.util.List;
import java.util.Properties;

import org.apache.commons.lang.StringUtils;
import org.apache.log4j.Logger;

import fr.cirad.phylogeo.dist.DistanceMatrix;
import fr.cirad.phylogeo.sankoff.TipMapping;

/**
 * Settings read from a properties file found on the classpath. Any entry may be
 * overridden by a JVM system property of the same name (e.g. -Dmatrix.delimiter=;).
 */
public class PhylogeoConfig {

	private static final Logger LOG = Logger.getLogger(PhylogeoConfig.class);

	public static final String DEFAULT_RESOURCE = "phylogeo.properties";

	public static final String MATRIX_DELIMITER = "matrix.delimiter";
	public static final String TIP_MAPPING_DELIMITER = "tipMapping.delimiter";
	public static final String EXPORT_WITH_EDGE_LENGTHS = "export.withEdgeLengths";
	public static final String EXPORT_DEFAULT_FORMATS = "export.defaultFormats";

	private final Properties properties;

	public PhylogeoConfig(Properties properties) {
		this.properties = properties;
	}

	/**
	 * Loads the default resource. A missing resource yields an empty configuration,
	 * in which case built-in defaults apply.
	 */
	public static PhylogeoConfig load() throws IOException {
		return load(DEFAULT_RESOURCE);
	}

	public static PhylogeoConfig load(String resourceName) throws IOException {
		Properties properties = new Properties();
		try (InputStream is = PhylogeoConfig.class.getClassLoader().getResourceAsStream(resourceName)) {
			if (is == null)
				LOG.warn("Configuration resource " + resourceName + " not found, using defaults");
			else
				properties.load(is);
		}
		return new PhylogeoConfig(properties);
	}

	public String get(String key) {
		String value = System.getProperty(key);
		return value != null ? value : properties.getProperty(key);
	}

	public String get(String key, String defaultValue) {
		String value = get(key);
		return value != null ? value : defaultValue;
	}

	public boolean getBoolean(String key, boolean defaultValue) {
		String value = get(key);
		return StringUtils.isBlank(value) ? defaultValue : Boolean.parseBoolean(value.trim());
	}

	public String getMatrixDelimiter() {
		return get(MATRIX_DELIMITER, DistanceMatrix.DEFAULT_DELIMITER);
	}

	public String getTipMappingDelimiter() {
		return get(TIP_MAPPING_DELIMITER, TipMapping.DEFAULT_DELIMITER);
	}

	public boolean isExportWithEdgeLengths() {
		return getBoolean(EXPORT_WITH_EDGE_LENGTHS, true);
	}

	public List<String> getDefaultExportFormats() {
		List<String> formats = new ArrayList<>();
		for (String format : StringUtils.split(get(EXPORT_DEFAULT_FORMATS, "NEWICK,ANNOTATION,HOTSPOTS"), ','))
			if (!StringUtils.isBlank(format))
				formats.add(format.trim());
		return formats;
	}
}
