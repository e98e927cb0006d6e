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

import java.util.Objects;
import java.util.UUID;

/**
 * Opaque identifier for one image load event.
 * <p>
 * An original image and all the processed images derived from it share the same session id.
 */
public final class SessionId {

	private final String id;

	private SessionId(String id) {
		this.id = id;
	}

	/**
	 * Create a new, random session id.
	 * @return
	 */
	public static SessionId create() {
		return new SessionId(UUID.randomUUID().toString());
	}

	/**
	 * Create a session id from an existing identifier, e.g. one supplied by a loader.
	 * @param id
	 * @return
	 */
	public static SessionId of(String id) {
		Objects.requireNonNull(id, "Session id must not be null");
		if (id.isBlank())
			throw new IllegalArgumentException("Session id must not be blank");
		return new SessionId(id);
	}

	/**
	 * Get the identifier as a string.
	 * @return
	 */
	public String getId() {
		return id;
	}

	@Override
	public String toString() {
		return id;
	}

	@Override
	public int hashCode() {
		return id.hashCode();
	}

	@Override
	public boolean equals(Object obj) {
		if (this == obj)
			return true;
		if (!(obj instanceof SessionId other))
			return false;
		return id.equals(other.id);
	}

}
