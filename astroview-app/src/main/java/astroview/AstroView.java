/*-
 * #%L
 * This file is part of AstroView.
 * %%
 * Copyright (C) 2025 AstroView developers
 * %%
 * AstroView is free software: you can redistribute it and/or modify
 * it under the terms of the GNU General Public License as
 * published by the Free Software Foundation, either version 3 of the
 * License, or (at your option) any later version.
 * 
 * AstroView is distributed in the hope that it will be useful,
 * but WITHOUT ANY WARRANTY; without even the implied warranty of
 * MERCHANTABILITY or FITNESS FOR A PARTICULAR PURPOSE.  See the
 * GNU General Public License for more details.
 * 
 * You should have received a copy of the GNU General Public License 
 * along with AstroView.  If not, see <https://www.gnu.org/licenses/>.
 * #L%
 */

package astroview;

import java.io.IOException;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.Locale;
import java.util.concurrent.Callable;

import javax.imageio.ImageIO;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import astroview.app.logging.LogManager;
import astroview.app.logging.LogManager.LogLevel;
import astroview.lib.awt.common.BufferedImageTools;
import astroview.lib.common.AstroViewPrefs;
import astroview.lib.common.GeneralTools;
import astroview.lib.images.ImageLayer;
import astroview.lib.modules.ModuleControls;
import astroview.lib.modules.ModuleLoader;
import astroview.lib.modules.ModuleRegistry;
import astroview.lib.modules.OperationRequest;
import astroview.lib.modules.OperationRequests;
import astroview.lib.modules.ProcessingUnit;
import astroview.lib.session.LayerListener;
import astroview.lib.session.ProcessingOrchestrator;
import astroview.lib.session.SessionContext;
import picocli.CommandLine;
import picocli.CommandLine.ArgGroup;
import picocli.CommandLine.Command;
import picocli.CommandLine.IVersionProvider;
import picocli.CommandLine.Model.CommandSpec;
import picocli.CommandLine.Option;
import picocli.CommandLine.Spec;

/**
 * Main AstroView launcher.
 * <p>
 * This discovers the available processing units, then either lists them or loads a single image,
 * applies one operation and writes the processed result.
 */
@Command(name = "astroview", mixinStandardHelpOptions = true, versionProvider = AstroView.VersionProvider.class,
	description = "Load an astronomical image, apply one operation and write the processed image.",
	footer = {"", "Copyright(c) AstroView developers (2025)"})
public class AstroView implements Callable<Integer> {

	private static final Logger logger = LoggerFactory.getLogger(AstroView.class);

	@Spec
	private CommandSpec spec;

	@Option(names = {"--modules"}, description = "Directory containing module subdirectories (default = ${DEFAULT-VALUE}).", paramLabel = "dir")
	private Path modulesDirectory = AstroViewPrefs.getModulesDirectory();

	@Option(names = {"--list"}, description = "List the available modules and their operations, then exit.")
	private boolean list;

	@Option(names = {"-m", "--module"}, description = {"Name of the module to use.",
			"If omitted, the first module supporting the image format is used."}, paramLabel = "module")
	private String moduleName;

	@Option(names = {"-i", "--image"}, description = "Path to the image to process.", paramLabel = "image")
	private Path imagePath;

	@ArgGroup(exclusive = true, multiplicity = "0..1")
	private RequestOptions requestOptions;

	@Option(names = {"-o", "--output"}, description = {"Path for the processed image.",
			"The format is determined by the extension (e.g. png, tif)."}, paramLabel = "output")
	private Path outputPath;

	@Option(names = {"-l", "--log"}, description = {"Log level (default = INFO).", "Options: ${COMPLETION-CANDIDATES}"})
	private LogLevel logLevel = LogLevel.INFO;

	static class RequestOptions {

		@Option(names = {"-p", "--params"}, required = true, description = {"Operation request as JSON,",
				"e.g. {\"operation\": \"Gaussian Blur\", \"sigma\": 2.0}"}, paramLabel = "json")
		String json;

		@Option(names = {"--operation"}, required = true, description = "Name of an operation to apply with its default parameters.", paramLabel = "name")
		String operation;

	}

	/**
	 * Main class to launch AstroView.
	 * @param args
	 */
	public static void main(String[] args) {
		int exitCode = createCommandLine().execute(args);
		if (exitCode != 0)
			logger.warn("Calling System.exit with exit code {}", exitCode);
		System.exit(exitCode);
	}

	/**
	 * Create the command line used to parse and execute arguments.
	 * @return
	 */
	static CommandLine createCommandLine() {
		var cmd = new CommandLine(new AstroView());
		cmd.setCaseInsensitiveEnumValuesAllowed(true);
		cmd.setExpandAtFiles(false);
		cmd.setExitCodeExceptionMapper(t -> 1);
		return cmd;
	}

	@Override
	public Integer call() {
		if (logLevel != null)
			LogManager.setRootLogLevel(logLevel);

		var registry = new ModuleRegistry();
		new ModuleLoader().discoverAndRegister(registry, modulesDirectory);

		if (list) {
			listModules(registry);
			return 0;
		}

		if (imagePath == null) {
			logger.error("No image specified, please type -h to display help message");
			return 1;
		}

		var unit = selectModule(registry);
		if (unit == null)
			return 1;
		var controls = registry.activateModule(unit.getName()).orElse(null);

		var orchestrator = new ProcessingOrchestrator(registry, new SessionContext());
		orchestrator.addLayerListener(new LoggingLayerListener());

		var loaded = orchestrator.loadImage(imagePath);
		if (!loaded.isSuccess()) {
			logger.error(loaded.getMessage());
			return 1;
		}

		OperationRequest request;
		try {
			request = createRequest(controls);
		} catch (IllegalArgumentException e) {
			logger.error(e.getLocalizedMessage());
			return 1;
		}
		if (request == null) {
			logger.info("No operation requested, image loaded successfully");
			return 0;
		}

		var outcome = orchestrator.applyProcessing(request);
		if (!outcome.isSuccess()) {
			logger.error(outcome.getMessage());
			return 1;
		}
		if (outputPath == null) {
			logger.info("No output path specified, processed image will not be written");
			return 0;
		}
		try {
			writeLayer(outcome.getLayer().orElseThrow(), outputPath);
		} catch (IOException e) {
			logger.error("Unable to write " + outputPath + ": " + e.getLocalizedMessage(), e);
			return 1;
		}
		return 0;
	}

	private void listModules(ModuleRegistry registry) {
		var out = spec.commandLine().getOut();
		if (registry.size() == 0) {
			out.println("No modules found");
			out.flush();
			return;
		}
		for (var name : registry.getModuleNames()) {
			var unit = registry.getModule(name).orElseThrow();
			out.println(name + " " + unit.getSupportedFormats());
			var controls = unit.createControls();
			for (var operation : controls.getOperationNames()) {
				var params = controls.getParameters(operation).getKeyValueParameters();
				if (params.isEmpty())
					out.println("  " + operation);
				else
					out.println("  " + operation + " " + params);
			}
		}
		out.flush();
	}

	private ProcessingUnit selectModule(ModuleRegistry registry) {
		if (moduleName != null) {
			var unit = registry.getModule(moduleName).orElse(null);
			if (unit == null)
				logger.error("No module named '{}', available modules are {}", moduleName, registry.getModuleNames());
			return unit;
		}
		var candidates = registry.findModulesForFile(imagePath);
		if (candidates.isEmpty()) {
			logger.error("No module supports {}", imagePath.getFileName());
			return null;
		}
		if (candidates.size() > 1)
			logger.debug("{} modules support {}, using {}", candidates.size(), imagePath.getFileName(), candidates.get(0).getName());
		return candidates.get(0);
	}

	private OperationRequest createRequest(ModuleControls controls) {
		if (requestOptions == null)
			return null;
		if (requestOptions.json != null)
			return OperationRequests.fromJson(requestOptions.json);
		if (controls == null)
			throw new IllegalArgumentException("No controls available for operation '" + requestOptions.operation + "'");
		return controls.buildRequest(requestOptions.operation);
	}

	/**
	 * Write the pixels of a layer to a file, using the file extension to choose the format.
	 * @param layer
	 * @param path
	 * @throws IOException if the image could not be written, or there is no writer for the format
	 */
	static void writeLayer(ImageLayer layer, Path path) throws IOException {
		var format = GeneralTools.getFormatToken(path).orElse("png").toLowerCase(Locale.ROOT);
		if ("tif".equals(format))
			format = "tiff";
		var img = BufferedImageTools.toBufferedImage(layer.getBuffer());
		if (!ImageIO.write(img, format, path.toFile()))
			throw new IOException("No ImageIO writer available for '" + format + "'");
		logger.info("{} written to {}", layer.getLayerName(), path);
	}

	static class LoggingLayerListener implements LayerListener {

		@Override
		public void clearLayers() {
			logger.debug("Clearing layers");
		}

		@Override
		public void layerUpdated(ImageLayer layer) {
			logger.debug("Layer updated: {} {}", layer.getLayerName(), layer.getBuffer());
		}

	}

	static class VersionProvider implements IVersionProvider {

		@Override
		public String[] getVersion() throws Exception {
			var strings = new ArrayList<String>();
			var version = AstroView.class.getPackage().getImplementationVersion();
			strings.add(version == null ? "Unknown AstroView version!" : "AstroView v" + version);
			strings.add("Java " + System.getProperty("java.version"));
			return strings.toArray(String[]::new);
		}

	}

}
