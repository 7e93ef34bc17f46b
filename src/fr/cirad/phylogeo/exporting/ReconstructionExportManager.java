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
import java.lang.reflect.Modifier;
import java.util.Collection;
import java.util.TreeMap;
import java.util.zip.ZipEntry;
import java.util.zip.ZipOutputStream;

import org.apache.log4j.Logger;
import org.springframework.beans.factory.config.BeanDefinition;
import org.springframework.context.annotation.ClassPathScanningCandidateComponentProvider;
import org.springframework.core.type.filter.AssignableTypeFilter;

import fr.cirad.phylogeo.sankoff.SankoffReconstructor;
import fr.cirad.phylogeo.tools.PhylogeoConfig;

/**
 * Finds available export handlers and bundles their outputs into zip archives.
 */
public class ReconstructionExportManager {

	private static final Logger LOG = Logger.getLogger(ReconstructionExportManager.class);

	public static final String HANDLER_BASE_PACKAGE = "fr.cirad.phylogeo";

	private static TreeMap<String, IReconstructionExportHandler> exportHandlers = null;

	/**
	 * Scans the classpath for concrete IReconstructionExportHandler implementations (once).
	 *
	 * @return the export handlers, by format name
	 */
	public static synchronized TreeMap<String, IReconstructionExportHandler> getExportHandlers()
	{
		if (exportHandlers == null)
		{
			exportHandlers = new TreeMap<String, IReconstructionExportHandler>();
			ClassPathScanningCandidateComponentProvider provider = new ClassPathScanningCandidateComponentProvider(false);
			provider.addIncludeFilter(new AssignableTypeFilter(IReconstructionExportHandler.class));
			for (BeanDefinition component : provider.findCandidateComponents(HANDLER_BASE_PACKAGE))
			{
				try
				{
					Class<?> cls = Class.forName(component.getBeanClassName());
					if (cls.isInterface() || Modifier.isAbstract(cls.getModifiers()))
						continue;

					IReconstructionExportHandler exportHandler = (IReconstructionExportHandler) cls.getConstructor().newInstance();
					String sFormat = exportHandler.getExportFormatName();
					IReconstructionExportHandler previouslyFoundExportHandler = exportHandlers.get(sFormat);
					if (previouslyFoundExportHandler != null)
					{
						if (exportHandler.getClass().isAssignableFrom(previouslyFoundExportHandler.getClass()))
						{
							LOG.debug(previouslyFoundExportHandler.getClass().getName() + " implementation was preferred to " + exportHandler.getClass().getName() + " to handle exporting to " + sFormat + " format");
							continue;
						}
						else if (previouslyFoundExportHandler.getClass().isAssignableFrom(exportHandler.getClass()))
							LOG.debug(exportHandler.getClass().getName() + " implementation was preferred to " + previouslyFoundExportHandler.getClass().getName() + " to handle exporting to " + sFormat + " format");
						else
						{
							LOG.warn("Unable to choose between " + previouslyFoundExportHandler.getClass().getName() + " and " + exportHandler.getClass().getName() + ". Keeping first found: " + previouslyFoundExportHandler.getClass().getName());
							continue;
						}
					}
					exportHandlers.put(sFormat, exportHandler);
				}
				catch (ReflectiveOperationException e)
				{
					LOG.warn("Unable to instantiate export handler " + component.getBeanClassName(), e);
				}
			}
			LOG.debug("Found " + exportHandlers.size() + " export handlers: " + exportHandlers.keySet());
		}
		return exportHandlers;
	}

	/**
	 * @throws IllegalArgumentException if no handler supports the format
	 */
	public static IReconstructionExportHandler getExportHandler(String format)
	{
		IReconstructionExportHandler handler = getExportHandlers().get(format);
		if (handler == null)
			throw new IllegalArgumentException("Unsupported export format: " + format + " (available formats: " + getExportHandlers().keySet() + ")");
		return handler;
	}

	/**
	 * Exports a reconstruction to the formats configured by default.
	 */
	public static void exportArchive(OutputStream outputStream, String exportName, SankoffReconstructor reconstruction, PhylogeoConfig config) throws IOException
	{
		exportArchive(outputStream, exportName, reconstruction, config.getDefaultExportFormats(), config);
	}

	/**
	 * Writes a zip archive holding one entry per requested format, named exportName.extension.
	 *
	 * @param outputStream where to write the archive, finished but left open
	 * @param exportName the base name of archive entries
	 * @param reconstruction a reconstruction whose states have been assigned
	 * @param formats the export format names
	 * @param config the configuration
	 * @throws IOException if writing fails
	 * @throws IllegalArgumentException if a format is not supported
	 */
	public static void exportArchive(OutputStream outputStream, String exportName, SankoffReconstructor reconstruction, Collection<String> formats, PhylogeoConfig config) throws IOException
	{
		for (String format : formats)
			getExportHandler(format);	// fail before writing anything

		long before = System.currentTimeMillis();
		ZipOutputStream zos = new ZipOutputStream(outputStream);
		for (String format : formats)
		{
			IReconstructionExportHandler handler = getExportHandler(format);
			zos.putNextEntry(new ZipEntry(exportName + "." + handler.getExportDataFileExtension()));
			handler.exportData(zos, reconstruction, config);
			zos.closeEntry();
		}
		zos.finish();
		LOG.debug("Exported " + formats + " for " + exportName + " in " + (System.currentTimeMillis() - before) / 1000d + "s");
	}
}
