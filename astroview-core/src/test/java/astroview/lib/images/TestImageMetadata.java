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

package astroview.lib.images;

import static org.junit.jupiter.api.Assertions.assertArrayEquals;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertTrue;

import org.junit.jupiter.api.Test;

@SuppressWarnings("javadoc")
public class TestImageMetadata {

	@Test
	public void test_wellKnownKeys() {
		var metadata = ImageMetadata.builder()
				.name("moon.png")
				.layerName(LayerName.ORIGINAL)
				.contrastLimits(0, 255)
				.build();
		assertEquals("moon.png", metadata.getName());
		assertEquals(LayerName.ORIGINAL, metadata.getLayerName());
		assertEquals("Original", metadata.getString(ImageMetadata.KEY_LAYER_NAME));
		assertArrayEquals(new double[] {0, 255}, metadata.getContrastLimits());
		assertEquals(3, metadata.size());
	}

	@Test
	public void test_emptyMetadata() {
		var metadata = ImageMetadata.empty();
		assertTrue(metadata.isEmpty());
		assertNull(metadata.getName());
		assertNull(metadata.getLayerName());
		assertNull(metadata.getContrastLimits());
	}

	@Test
	public void test_derivedMetadataIsNotAliased() {
		var original = ImageMetadata.builder()
				.name("moon.png")
				.contrastLimits(10, 200)
				.put("exposure", 0.5)
				.build();

		var processed = original.withLayerName(LayerName.PROCESSED);
		assertEquals(LayerName.PROCESSED, processed.getLayerName());
		assertNull(original.getLayerName());
		assertFalse(original.containsKey(ImageMetadata.KEY_LAYER_NAME));

		double[] limits = original.getContrastLimits();
		limits[0] = -1;
		assertArrayEquals(new double[] {10, 200}, original.getContrastLimits());
		assertArrayEquals(new double[] {10, 200}, processed.getContrastLimits());

		var copy = original.toBuilder().build();
		assertEquals(original, copy);
		assertEquals(original.hashCode(), copy.hashCode());
	}

	@Test
	public void test_putNullRemoves() {
		var metadata = ImageMetadata.builder()
				.name("moon.png")
				.put("comment", "first")
				.put("comment", null)
				.build();
		assertFalse(metadata.containsKey("comment"));
		assertEquals(1, metadata.size());
	}

}
