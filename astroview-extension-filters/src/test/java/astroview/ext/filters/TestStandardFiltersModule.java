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

package astroview.ext.filters;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.awt.image.BufferedImage;
import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import java.util.Locale;

import javax.imageio.ImageIO;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import astroview.lib.images.LayerName;
import astroview.lib.images.PixelType;
import astroview.lib.modules.ModuleLoader;
import astroview.lib.modules.ModuleRegistry;
import astroview.lib.modules.OperationRequests;
import astroview.lib.modules.ProcessingException;
import astroview.lib.session.ProcessingOrchestrator;
import astroview.lib.session.SessionContext;

@SuppressWarnings("javadoc")
public class TestStandardFiltersModule {

	@TempDir
	Path tempDir;

	private ModuleRegistry registry;
	private ProcessingOrchestrator orchestrator;

	@BeforeEach
	public void setUp() {
		registry = new ModuleRegistry();
		new ModuleLoader().loadFromClasspath().forEach(r -> r.getUnit().ifPresent(registry::registerModule));
		orchestrator = new ProcessingOrchestrator(registry, new SessionContext());
	}

	private Path writeGray(String name, int width, int height, int value) throws IOException {
		var img = new BufferedImage(width, height, BufferedImage.TYPE_BYTE_GRAY);
		for (int y = 0; y < height; y++) {
			for (int x = 0; x < width; x++)
				img.getRaster().setSample(x, y, 0, value);
		}
		var path = tempDir.resolve(name);
		ImageIO.write(img, "png", path.toFile());
		return path;
	}

	@Test
	public void test_discovered() {
		assertTrue(registry.getModuleNames().contains(StandardFiltersModule.NAME));
		var unit = registry.getModule(StandardFiltersModule.NAME).orElseThrow();
		assertEquals(List.of(
				OperationRequests.CONTRAST_STRETCHING,
				OperationRequests.GAUSSIAN_BLUR,
				OperationRequests.MEDIAN_FILTER,
				OperationRequests.SOBEL_EDGE_DETECTION,
				OperationRequests.GAMMA_CORRECTION,
				OperationRequests.CONVOLUTION), unit.getOperationNames());
		assertTrue(unit.supportsFile(Path.of("moon.JPEG")));
		assertFalse(unit.supportsFile(Path.of("moon.fits")));
	}

	@Test
	public void test_flatImageContrastStretch() throws IOException {
		var path = writeGray("gray.png", 10, 10, 128);
		registry.activateModule(StandardFiltersModule.NAME);
		assertTrue(orchestrator.loadImage(path).isSuccess());

		var outcome = orchestrator.applyProcessing(OperationRequests.contrastStretch(0, 255));
		assertTrue(outcome.isSuccess());
		var layer = outcome.getLayer().orElseThrow();
		assertEquals(LayerName.PROCESSED, layer.getLayerName());
		assertEquals(128, layer.getBuffer().getMinValue());
		assertEquals(128, layer.getBuffer().getMaxValue());
	}

	@Test
	public void test_allOperationsWithDefaults() throws IOException, ProcessingException {
		var unit = new StandardFiltersModule();
		var result = unit.loadImage(writeGray("gray.png", 12, 8, 90));
		assertTrue(result.isSuccess());
		var controls = unit.createControls();
		for (var op : controls.getOperationNames()) {
			var request = controls.buildRequest(op);
			var output = unit.processImage(result.getBuffer(), result.getMetadata(), request);
			assertEquals(PixelType.UINT8, output.getPixelType());
			assertEquals(12, output.getWidth());
			assertEquals(8, output.getHeight());
		}
	}

	@Test
	public void test_kernelFromControls() throws IOException, ProcessingException {
		var unit = new StandardFiltersModule();
		var buffer = unit.loadImage(writeGray("gray.png", 4, 4, 10)).getBuffer();
		var controls = unit.createControls();
		assertTrue(controls.getParameters(OperationRequests.CONVOLUTION).setStringValue("kernel", "0 0 0; 0 3 0; 0 0 0", Locale.US));
		var output = unit.processImage(buffer, null, controls.buildRequest(OperationRequests.CONVOLUTION));
		assertEquals(30, output.getMaxValue());
	}

	@Test
	public void test_invalidParameters() throws IOException {
		var unit = new StandardFiltersModule();
		var buffer = unit.loadImage(writeGray("gray.png", 4, 4, 10)).getBuffer();
		assertThrows(ProcessingException.class, () -> unit.processImage(buffer, null, OperationRequests.gaussianBlur(0)));
		assertThrows(ProcessingException.class, () -> unit.processImage(buffer, null, OperationRequests.gammaCorrection(-1)));
		assertThrows(ProcessingException.class, () -> unit.processImage(buffer, null, OperationRequests.histogramEqualization()));
		assertThrows(ProcessingException.class, () -> unit.processImage(buffer, null,
				OperationRequests.fromJson("{\"operation\": \"Convolution\", \"kernel\": [[1, 2], [3, 4]]}")));
	}

	@Test
	public void test_rgbSobel() throws IOException, ProcessingException {
		var img = new BufferedImage(6, 6, BufferedImage.TYPE_INT_RGB);
		for (int y = 0; y < 6; y++) {
			for (int x = 3; x < 6; x++)
				img.setRGB(x, y, 0x646464);
		}
		var path = tempDir.resolve("edge.png");
		ImageIO.write(img, "png", path.toFile());

		var unit = new StandardFiltersModule();
		var result = unit.loadImage(path);
		assertEquals(3, result.getBuffer().nChannels());
		var output = unit.processImage(result.getBuffer(), result.getMetadata(), OperationRequests.sobelEdges());
		assertTrue(output.isSingleChannel());
		assertEquals(0, output.getValue(0, 2, 0));
		assertEquals(255, output.getValue(2, 2, 0));
	}

	@Test
	public void test_loadFailure() throws IOException {
		var unit = new StandardFiltersModule();
		var path = tempDir.resolve("notes.png");
		Files.writeString(path, "Not an image");
		var result = unit.loadImage(path);
		assertFalse(result.isSuccess());
		assertTrue(result.getMetadata().isEmpty());
	}

}
