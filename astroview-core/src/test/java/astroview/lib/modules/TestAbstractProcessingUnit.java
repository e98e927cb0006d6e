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

package astroview.lib.modules;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertInstanceOf;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.awt.image.BufferedImage;
import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Set;

import javax.imageio.ImageIO;

import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import astroview.lib.images.ImageBuffer;
import astroview.lib.images.ImageMetadata;

@SuppressWarnings("javadoc")
public class TestAbstractProcessingUnit {

	@TempDir
	Path tempDir;

	@Test
	public void test_formats() {
		var unit = new StubProcessingUnit();
		assertEquals(Set.of("png", "gif"), unit.getSupportedFormats());
		assertTrue(unit.supportsFile(Path.of("image.png")));
		assertFalse(unit.supportsFile(Path.of("image.tif")));
	}

	@Test
	public void test_loadImage() throws IOException {
		var img = new BufferedImage(6, 4, BufferedImage.TYPE_BYTE_GRAY);
		img.getRaster().setSample(1, 1, 0, 99);
		var path = tempDir.resolve("gray.png");
		ImageIO.write(img, "png", path.toFile());

		var result = new StubProcessingUnit().loadImage(path);
		assertTrue(result.isSuccess());
		assertEquals("gray.png", result.getMetadata().getName());
		assertEquals(6, result.getBuffer().getWidth());
		assertEquals(99, result.getBuffer().getValue(1, 1, 0));
		assertTrue(result.getSessionId().isEmpty());
	}

	@Test
	public void test_loadFailures() throws IOException {
		var unit = new StubProcessingUnit();

		var missing = unit.loadImage(tempDir.resolve("missing.png"));
		assertFalse(missing.isSuccess());
		assertNull(missing.getBuffer());
		assertTrue(missing.getMetadata().isEmpty());

		assertFalse(unit.loadImage(null).isSuccess());
		assertFalse(unit.loadImage(tempDir).isSuccess());

		// ImageIO returns null for unknown content
		var corrupt = Files.writeString(tempDir.resolve("corrupt.png"), "Not an image");
		var result = unit.loadImage(corrupt);
		assertFalse(result.isSuccess());
		assertTrue(result.getMessage().contains("corrupt.png"));
	}

	@Test
	public void test_processImage() throws ProcessingException {
		var unit = new StubProcessingUnit();
		var buffer = ImageBuffer.createUint8(2, 2, 1, 2, 3, 4);
		var result = unit.processImage(buffer, ImageMetadata.empty(), OperationRequests.contrastStretch(0, 200));
		assertEquals(200, result.getMinValue());
		assertEquals(200, result.getMaxValue());
		// Null metadata is accepted
		assertEquals(buffer, unit.processImage(buffer, null, OperationRequests.gammaCorrection(0.5)));
	}

	@Test
	public void test_processImageFailures() {
		var unit = new StubProcessingUnit();
		var buffer = ImageBuffer.createUint8(2, 2, 1, 2, 3, 4);
		assertThrows(ProcessingException.class, () -> unit.processImage(buffer, null, null));
		assertThrows(ProcessingException.class, () -> unit.processImage(buffer, null, OperationRequests.histogramEqualization()));
		var e = assertThrows(ProcessingException.class, () -> unit.processImage(buffer, null, OperationRequests.gammaCorrection(-1)));
		assertInstanceOf(IllegalArgumentException.class, e.getCause());
		// Other unchecked exceptions are propagated
		assertThrows(UnsupportedOperationException.class, () -> unit.processImage(buffer, null, OperationRequests.sobelEdges()));
	}

	@Test
	public void test_controls() {
		var controls = new StubProcessingUnit().createControls();
		assertEquals(StubProcessingUnit.NAME, controls.getModuleName());
		assertThrows(IllegalArgumentException.class, () -> controls.getParameters(OperationRequests.CONVOLUTION));

		controls.getParameters(OperationRequests.GAMMA_CORRECTION).setStringValue("gamma", "2.2", null);
		var request = controls.buildRequest(OperationRequests.GAMMA_CORRECTION);
		assertEquals(2.2, ((OperationRequests.GammaCorrection)request).getGamma(), 1e-9);

		var stretch = (OperationRequests.ContrastStretch)controls.buildRequest(OperationRequests.CONTRAST_STRETCHING);
		assertEquals(0, stretch.getNewMin());
		assertEquals(255, stretch.getNewMax());
	}

}
