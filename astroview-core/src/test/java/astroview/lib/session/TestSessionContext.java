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
import static org.junit.jupiter.api.Assertions.assertNotEquals;
import static org.junit.jupiter.api.Assertions.assertNotNull;
import static org.junit.jupiter.api.Assertions.assertSame;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import org.junit.jupiter.api.Test;

import astroview.lib.images.ImageBuffer;
import astroview.lib.images.ImageMetadata;
import astroview.lib.images.LayerName;
import astroview.lib.images.SessionId;

@SuppressWarnings("javadoc")
public class TestSessionContext {

	@Test
	public void test_setImage() {
		var session = new SessionContext();
		assertFalse(session.hasImage());
		assertTrue(session.getImage().isEmpty());

		var buffer = ImageBuffer.createUint8(1, 1, 42);
		var layer = session.setImage(buffer, ImageMetadata.builder().name("moon.png").build(), null);
		assertNotNull(layer.getSessionId());
		assertEquals(LayerName.ORIGINAL, layer.getLayerName());
		assertEquals("moon.png", layer.getMetadata().getName());
		assertSame(layer, session.getImage().orElseThrow());

		// New images get new ids unless one is provided
		var layer2 = session.setImage(buffer, null, null);
		assertNotEquals(layer.getSessionId(), layer2.getSessionId());
		var id = SessionId.of("session-1");
		assertEquals(id, session.setImage(buffer, null, id).getSessionId());

		session.clear();
		assertFalse(session.hasImage());
	}

	@Test
	public void test_sessionIds() {
		assertNotEquals(SessionId.create(), SessionId.create());
		assertEquals(SessionId.of("abc"), SessionId.of("abc"));
		assertEquals("abc", SessionId.of("abc").getId());
		assertThrows(IllegalArgumentException.class, () -> SessionId.of(" "));
	}

}
