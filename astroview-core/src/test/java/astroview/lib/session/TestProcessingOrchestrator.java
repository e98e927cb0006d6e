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

package astroview.lib.session;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertInstanceOf;
import static org.junit.jupiter.api.Assertions.assertSame;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.awt.image.BufferedImage;
import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;

import javax.imageio.ImageIO;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import astroview.lib.images.ImageLayer;
import astroview.lib.images.LayerName;
import astroview.lib.modules.ModuleRegistry;
import astroview.lib.modules.OperationRequests;
import astroview.lib.modules.StubProcessingUnit;
import astroview.lib.session.ProcessingOutcome.ErrorType;

@SuppressWarnings("javadoc")
public class TestProcessingOrchestrator {

	@TempDir
	Path tempDir;

	private ModuleRegistry registry;
	private SessionContext session;
	private ProcessingOrchestrator orchestrator;
	private RecordingListener listener;
	private Path imagePath;

	@BeforeEach
	public void setUp() throws IOException {
		registry = new ModuleRegistry();
		registry.registerModule(new StubProcessingUnit());
		session = new SessionContext();
		orchestrator = new ProcessingOrchestrator(registry, session);
		listener = new RecordingListener();
		orchestrator.addLayerListener(listener);

		var img = new BufferedImage(10, 10, BufferedImage.TYPE_BYTE_GRAY);
		for (int y = 0; y < 10; y++) {
			for (int x = 0; x < 10; x++)
				img.getRaster().setSample(x, y, 0, 128);
		}
		imagePath = tempDir.resolve("gray.png");
		ImageIO.write(img, "png", imagePath.toFile());
	}

	@Test
	public void test_noActiveModule() {
		var outcome = orchestrator.loadImage(imagePath);
		assertFalse(outcome.isSuccess());
		assertEquals(ErrorType.NO_ACTIVE_MODULE, outcome.getErrorType());

		outcome = orchestrator.applyProcessing(OperationRequests.contrastStretch(0, 255));
		assertEquals(ErrorType.NO_ACTIVE_MODULE, outcome.getErrorType());
		assertTrue(listener.events.isEmpty());
	}

	@Test
	public void test_noImage() {
		registry.activateModule(StubProcessingUnit.NAME);
		var outcome = orchestrator.applyProcessing(OperationRequests.contrastStretch(0, 255));
		assertFalse(outcome.isSuccess());
		assertEquals(ErrorType.NO_IMAGE, outcome.getErrorType());
		assertTrue(listener.events.isEmpty());
	}

	@Test
	public void test_loadImage() {
		registry.activateModule(StubProcessingUnit.NAME);
		var outcome = orchestrator.loadImage(imagePath);
		assertTrue(outcome.isSuccess());
		var layer = outcome.getLayer().orElseThrow();
		assertEquals(LayerName.ORIGINAL, layer.getLayerName());
		assertEquals("gray.png", layer.getMetadata().getName());
		assertSame(layer, session.getImage().orElseThrow());
		assertEquals(List.of("clear", "Original"), listener.events);
	}

	@Test
	public void test_loadFailureKeepsSession() throws IOException {
		registry.activateModule(StubProcessingUnit.NAME);
		var original = orchestrator.loadImage(imagePath).getLayer().orElseThrow();
		listener.events.clear();

		var corrupt = Files.writeString(tempDir.resolve("corrupt.png"), "Not an image");
		var outcome = orchestrator.loadImage(corrupt);
		assertEquals(ErrorType.LOAD_FAILED, outcome.getErrorType());
		assertTrue(outcome.getLayer().isEmpty());
		assertSame(original, session.getImage().orElseThrow());
		assertTrue(listener.events.isEmpty());
	}

	@Test
	public void test_applyProcessing() {
		registry.activateModule(StubProcessingUnit.NAME);
		var original = orchestrator.loadImage(imagePath).getLayer().orElseThrow();

		var outcome = orchestrator.applyProcessing(OperationRequests.contrastStretch(0, 200));
		assertTrue(outcome.isSuccess());
		var processed = outcome.getLayer().orElseThrow();
		assertEquals(LayerName.PROCESSED, processed.getLayerName());
		assertEquals(original.getSessionId(), processed.getSessionId());
		assertEquals("gray.png", processed.getMetadata().getName());
		assertEquals(200, processed.getBuffer().getMaxValue());

		// The original is untouched, so processing can be repeated
		assertSame(original, session.getImage().orElseThrow());
		assertEquals(128, original.getBuffer().getMaxValue());
		assertEquals(LayerName.ORIGINAL, original.getLayerName());

		var outcome2 = orchestrator.applyProcessing(OperationRequests.contrastStretch(0, 100));
		assertEquals(100, outcome2.getLayer().orElseThrow().getBuffer().getMaxValue());
		assertEquals(List.of("clear", "Original", "Processed", "Processed"), listener.events);
	}

	@Test
	public void test_processingFailures() {
		registry.activateModule(StubProcessingUnit.NAME);
		var original = orchestrator.loadImage(imagePath).getLayer().orElseThrow();
		listener.events.clear();

		// Invalid parameter
		var outcome = orchestrator.applyProcessing(OperationRequests.gammaCorrection(-1));
		assertEquals(ErrorType.PROCESSING_FAILED, outcome.getErrorType());
		assertTrue(outcome.getCause().isPresent());

		// Unsupported operation
		outcome = orchestrator.applyProcessing(OperationRequests.histogramEqualization());
		assertEquals(ErrorType.PROCESSING_FAILED, outcome.getErrorType());

		// Unchecked exception within the unit
		outcome = orchestrator.applyProcessing(OperationRequests.sobelEdges());
		assertEquals(ErrorType.PROCESSING_FAILED, outcome.getErrorType());
		assertInstanceOf(UnsupportedOperationException.class, outcome.getCause().orElseThrow());

		assertTrue(listener.events.isEmpty());
		assertSame(original, session.getImage().orElseThrow());
	}

	@Test
	public void test_listenerExceptions() {
		orchestrator.addLayerListener(new LayerListener() {
			@Override
			public void clearLayers() {
				throw new IllegalStateException("Clear failed");
			}

			@Override
			public void layerUpdated(ImageLayer layer) {
				throw new IllegalStateException("Update failed");
			}
		});
		var last = new RecordingListener();
		orchestrator.addLayerListener(last);
		registry.activateModule(StubProcessingUnit.NAME);

		assertTrue(orchestrator.loadImage(imagePath).isSuccess());
		assertEquals(List.of("clear", "Original"), last.events);

		orchestrator.removeLayerListener(last);
		assertTrue(orchestrator.applyProcessing(OperationRequests.contrastStretch(0, 255)).isSuccess());
		assertEquals(List.of("clear", "Original"), last.events);
	}

	private static class RecordingListener implements LayerListener {

		private final List<String> events = new ArrayList<>();

		@Override
		public void clearLayers() {
			events.add("clear");
		}

		@Override
		public void layerUpdated(ImageLayer layer) {
			events.add(layer.getLayerName().getDisplayName());
		}

	}

}
