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

import java.io.BufferedReader;
import java.io.File;
import java.io.IOException;
import java.io.Reader;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

import org.apache.commons.lang.StringUtils;
import org.apache.log4j.Logger;

import cern.colt.matrix.tdouble.DoubleMatrix2D;
import cern.colt.matrix.tdouble.impl.DenseDoubleMatrix2D;

/**
 * Square table of transition costs between labelled states (e.g. locations).
 *
 * The matrix is not assumed to be symmetric: getDistance(a, b) is the cost of
 * going from state a (row) to state b (column). Labels are resolved through an
 * index built once, and index-based access goes straight to a primitive array.
 *
 * Tabular files look like:
 * <pre>
 * "",A,B,C
 * A,0,2.5,1
 * B,2.5,0,4
 * C,1,4,0
 * </pre>
 * The first field of each line is a row name and is ignored.
 */
public class DistanceMatrix {

	private static final Logger LOG = Logger.getLogger(DistanceMatrix.class);

	public static final String DEFAULT_DELIMITER = ",";

	private String[] header;
	private Map<String, Integer> headerIndex;
	private final DoubleMatrix2D matrix;
	private final double[][] rows;	// same contents as matrix, for the hot path

	public DistanceMatrix(String[] header, double[][] matrix) {
		this(header, toColtMatrix(header, matrix));
	}

	public DistanceMatrix(List<String> header, double[][] matrix) {
		this(header == null ? null : header.toArray(new String[header.size()]), matrix);
	}

	public DistanceMatrix(String[] header, DoubleMatrix2D matrix) {
		if (header == null || header.length == 0)
			throw new DistanceMatrixException("Distance matrix header is empty");
		if (matrix.rows() != matrix.columns())
			throw new DistanceMatrixException("Distance matrix is not square: " + matrix.rows() + " rows, " + matrix.columns() + " columns");
		if (matrix.rows() != header.length)
			throw new DistanceMatrixException("Distance matrix header has " + header.length + " labels but matrix has " + matrix.rows() + " rows");

		this.headerIndex = buildIndex(header);
		this.header = header.clone();
		this.matrix = matrix.copy();
		this.rows = this.matrix.toArray();

		for (int i = 0; i < rows.length; i++)
			for (int j = 0; j < rows.length; j++)
				if (Double.isNaN(rows[i][j]))
					throw new DistanceMatrixException("Distance from '" + header[i] + "' to '" + header[j] + "' is not a number");
	}

	private static DoubleMatrix2D toColtMatrix(String[] header, double[][] matrix) {
		if (matrix == null || matrix.length == 0)
			throw new DistanceMatrixException("Distance matrix is empty");
		for (int i = 0; i < matrix.length; i++)
			if (matrix[i] == null || matrix[i].length != matrix.length)
				throw new DistanceMatrixException("Distance matrix is not square: row " + (header != null && i < header.length ? "'" + header[i] + "'" : "#" + i) + " has " + (matrix[i] == null ? 0 : matrix[i].length) + " columns, " + matrix.length + " expected");
		return new DenseDoubleMatrix2D(matrix);
	}

	private static Map<String, Integer> buildIndex(String[] labels) {
		Map<String, Integer> index = new HashMap<>();
		for (int i = 0; i < labels.length; i++) {
			if (StringUtils.isBlank(labels[i]))
				throw new DistanceMatrixException("Distance matrix header contains an empty label at position " + i);
			Integer previous = index.put(labels[i], i);
			if (previous != null)
				throw new DistanceMatrixException("Distance matrix header contains label '" + labels[i] + "' twice (positions " + previous + " and " + i + ")");
		}
		return index;
	}

	/**
	 * Reads a delimited distance matrix file.
	 *
	 * @param file the file to read (UTF-8)
	 * @param delimiter the field delimiter
	 * @return the matrix
	 * @throws IOException if the file cannot be read
	 */
	public static DistanceMatrix read(File file, String delimiter) throws IOException {
		long before = System.currentTimeMillis();
		try (BufferedReader reader = Files.newBufferedReader(file.toPath(), StandardCharsets.UTF_8)) {
			DistanceMatrix dm = read(reader, delimiter);
			LOG.debug("Loaded " + dm.getSize() + " x " + dm.getSize() + " distance matrix from " + file.getName() + " in " + (System.currentTimeMillis() - before) / 1000d + "s");
			return dm;
		}
	}

	/**
	 * Reads delimited distance matrix contents: one header line then one line per state.
	 * The first field of every line is ignored. Blank lines are skipped.
	 *
	 * @param in the contents, left open
	 * @param delimiter the field delimiter
	 * @return the matrix
	 * @throws IOException if reading fails
	 */
	public static DistanceMatrix read(Reader in, String delimiter) throws IOException {
		BufferedReader reader = in instanceof BufferedReader ? (BufferedReader) in : new BufferedReader(in);
		String[] header = null;
		List<double[]> matrixRows = new ArrayList<>();
		String line;
		int nLineNumber = 0;
		while ((line = reader.readLine()) != null) {
			nLineNumber++;
			if (StringUtils.isBlank(line))
				continue;

			String[] fields = StringUtils.splitByWholeSeparatorPreserveAllTokens(line, delimiter);
			if (header == null) {
				if (fields.length < 2)
					throw new DistanceMatrixException("Distance matrix header (line " + nLineNumber + ") contains no state label");
				header = new String[fields.length - 1];
				for (int i = 1; i < fields.length; i++)
					header[i - 1] = unquote(fields[i]);
				continue;
			}

			if (fields.length != header.length + 1)
				throw new DistanceMatrixException("Line " + nLineNumber + " of distance matrix has " + (fields.length - 1) + " values, " + header.length + " expected");
			double[] row = new double[header.length];
			for (int i = 1; i < fields.length; i++) {
				String value = unquote(fields[i]);
				try {
					row[i - 1] = Double.parseDouble(value);
				}
				catch (NumberFormatException nfe) {
					throw new DistanceMatrixException("Invalid distance '" + value + "' on line " + nLineNumber + " of distance matrix (column '" + header[i - 1] + "')", nfe);
				}
			}
			matrixRows.add(row);
		}

		if (header == null)
			throw new DistanceMatrixException("Distance matrix contents are empty");
		if (matrixRows.size() != header.length)
			throw new DistanceMatrixException("Distance matrix header has " + header.length + " labels but " + matrixRows.size() + " rows were found");
		return new DistanceMatrix(header, matrixRows.toArray(new double[matrixRows.size()][]));
	}

	private static String unquote(String field) {
		return StringUtils.remove(field, '"').trim();
	}

	/**
	 * @param from the state the transition starts from (row)
	 * @param to the state the transition ends in (column)
	 * @return the cost of the transition
	 * @throws UnknownStateException if either label is not part of the header
	 */
	public double getDistance(String from, String to) {
		return rows[getIndex(from)][getIndex(to)];
	}

	public double getDistanceByIndex(int fromIndex, int toIndex) {
		return rows[fromIndex][toIndex];
	}

	/**
	 * @throws UnknownStateException if the label is not part of the header
	 */
	public int getIndex(String label) {
		Integer index = headerIndex.get(label);
		if (index == null)
			throw new UnknownStateException(label);
		return index;
	}

	public boolean contains(String label) {
		return headerIndex.containsKey(label);
	}

	public String getLabel(int index) {
		return header[index];
	}

	public List<String> getHeader() {
		return Collections.unmodifiableList(Arrays.asList(header));
	}

	/**
	 * Renames the states. The new labels must be unique and as many as the current ones.
	 */
	public void setHeader(String[] names) {
		if (names == null || names.length != header.length)
			throw new DistanceMatrixException("New header has " + (names == null ? 0 : names.length) + " labels, " + header.length + " expected");
		headerIndex = buildIndex(names);
		header = names.clone();
	}

	/**
	 * @return the number of states, i.e. the number of rows (and columns)
	 */
	public int getSize() {
		return header.length;
	}

	/**
	 * @return a copy of the underlying matrix
	 */
	public DoubleMatrix2D getMatrix() {
		return matrix.copy();
	}

	/**
	 * @return a copy of the costs as rows: result[from][to]
	 */
	public double[][] getRows() {
		return matrix.toArray();
	}

	/**
	 * @return a copy of the costs as columns: result[to][from]
	 */
	public double[][] getColumns() {
		return matrix.viewDice().toArray();
	}
}
