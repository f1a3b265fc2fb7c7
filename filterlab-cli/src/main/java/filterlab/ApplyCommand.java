/*-
 * #%L
 * This file is part of FilterLab.
 * %%
 * Copyright (C) 2024 - 2026 FilterLab developers
 * %%
 * FilterLab is free software: you can redistribute it and/or modify
 * it under the terms of the GNU General Public License as
 * published by the Free Software Foundation, either version 3 of the
 * License, or (at your option) any later version.
 *
 * FilterLab is distributed in the hope that it will be useful,
 * but WITHOUT ANY WARRANTY; without even the implied warranty of
 * MERCHANTABILITY or FITNESS FOR A PARTICULAR PURPOSE.  See the
 * GNU General Public License for more details.
 *
 * You should have received a copy of the GNU General Public License
 * along with FilterLab.  If not, see <https://www.gnu.org/licenses/>.
 * #L%
 */

package filterlab;

import java.io.File;
import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.util.Locale;
import java.util.concurrent.Callable;
import java.util.concurrent.ExecutionException;

import javax.imageio.ImageIO;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.google.gson.JsonParseException;

import filterlab.lib.awt.images.BufferedImageTools;
import filterlab.lib.common.GeneralTools;
import filterlab.lib.filters.PixelFilters;
import filterlab.lib.filters.PixelTransform;
import filterlab.lib.plugins.CommandLineProgressMonitor;
import filterlab.lib.processing.FilterTaskRunner;
import picocli.CommandLine.Command;
import picocli.CommandLine.Option;
import picocli.CommandLine.Parameters;

/**
 * Apply a single filter to an image file, and write the result to a new file.
 */
@Command(name = "apply", description = "Applies a filter to an input image.", sortOptions = false)
class ApplyCommand implements Callable<Integer> {

	private static final Logger logger = LoggerFactory.getLogger(ApplyCommand.class);

	static final String DEFAULT_FORMAT = "png";

	@Parameters(index = "0", paramLabel = "input", description = "Path of the image to filter.")
	private File inputFile;

	@Parameters(index = "1", paramLabel = "output", description = {
			"Path of the output image.",
			"The format is determined by the extension (default=png)."
	})
	private File outputFile;

	@Option(names = {"-f", "--filter"}, paramLabel = "name", description = {
			"Name of the filter to apply, using its default parameters.",
			"Use the 'list' command to see the available names."
	})
	private String filterName;

	@Option(names = {"--filter-json"}, paramLabel = "file", description = "Path of a JSON file describing the filter to apply.")
	private File filterJson;

	@Option(names = {"--seed"}, description = "Seed for the random number generator (only used by the glass filter).")
	private Long seed;

	@Option(names = {"--overwrite"}, defaultValue = "false",
			description = "Overwrite any existing file with the same name as the output (default=false).")
	private boolean overwrite = false;

	@Option(names = {"-h", "--help"}, usageHelp = true, description = "Show this help message and exit.")
	private boolean usageHelpRequested;

	@Override
	public Integer call() {
		if ((filterName == null) == (filterJson == null)) {
			logger.error("Exactly one of --filter or --filter-json must be specified");
			return 1;
		}
		if (!inputFile.isFile()) {
			logger.error("Input file {} does not exist", inputFile);
			return 1;
		}
		if (outputFile.exists() && !overwrite) {
			logger.error("Output file {} exists! Use --overwrite to replace it", outputFile);
			return 1;
		}
		if (inputFile.getAbsoluteFile().equals(outputFile.getAbsoluteFile())) {
			logger.error("Input and output files are the same!");
			return 1;
		}

		String format = GeneralTools.getExtension(outputFile).map(ext -> ext.substring(1)).orElse(DEFAULT_FORMAT);
		if (!ImageIO.getImageWritersByFormatName(format).hasNext()) {
			logger.error("Unsupported output format '{}'", format);
			return 1;
		}

		try {
			PixelTransform transform = createTransform();

			var img = ImageIO.read(inputFile);
			if (img == null) {
				logger.error("Unable to read {} - format not supported", inputFile);
				return 1;
			}
			var source = BufferedImageTools.toPixelGrid(img);
			logger.info("Applying {} to {} ({}x{})", PixelFilters.getTypeLabel(transform), inputFile.getName(),
					source.getWidth(), source.getHeight());

			var monitor = new CommandLineProgressMonitor();
			try (var runner = new FilterTaskRunner()) {
				var result = runner.submit(source, transform, monitor).get();
				if (result.isEmpty()) {
					logger.warn("Filter was cancelled, no output written");
					return 1;
				}
				if (result.get().isEmpty()) {
					logger.error("Cannot write an empty image to {}", outputFile);
					return 1;
				}
				var outputParent = outputFile.getAbsoluteFile().getParentFile();
				if (outputParent != null && !outputParent.isDirectory())
					Files.createDirectories(outputParent.toPath());
				if (!ImageIO.write(BufferedImageTools.toBufferedImage(result.get()), format, outputFile)) {
					logger.error("No writer found for format '{}'", format);
					return 1;
				}
			}
			logger.info("Written {}", outputFile.getAbsolutePath());
			return 0;
		} catch (InterruptedException e) {
			Thread.currentThread().interrupt();
			logger.error("Interrupted while applying filter", e);
		} catch (ExecutionException e) {
			logger.error("Error applying filter: " + e.getCause().getLocalizedMessage(), e.getCause());
		} catch (IOException e) {
			logger.error("Error reading or writing image: " + e.getLocalizedMessage(), e);
		} catch (JsonParseException | IllegalArgumentException e) {
			logger.error(e.getLocalizedMessage(), e);
		}
		return 1;
	}

	private PixelTransform createTransform() throws IOException {
		if (filterJson != null) {
			if (seed != null)
				logger.warn("--seed is ignored when reading a filter from JSON");
			var json = Files.readString(filterJson.toPath(), StandardCharsets.UTF_8);
			return PixelFilters.fromJson(json);
		}
		var transform = PixelFilters.create(filterName);
		if (seed != null) {
			if ("glass".equals(filterName.trim().toLowerCase(Locale.ROOT)))
				return PixelFilters.Geometric.glass(seed);
			logger.warn("--seed is ignored for filter '{}'", filterName);
		}
		return transform;
	}

}
