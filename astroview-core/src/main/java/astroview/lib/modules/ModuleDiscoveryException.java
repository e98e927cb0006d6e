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

/**
 * Exception thrown when a module source cannot provide a {@link ProcessingUnit}.
 * This is never propagated out of discovery; instead, it is recorded in a {@link DiscoveryResult}.
 */
public class ModuleDiscoveryException extends Exception {

	private static final long serialVersionUID = 1L;

	/**
	 * Constructor with a message.
	 * @param message
	 */
	public ModuleDiscoveryException(String message) {
		super(message);
	}

	/**
	 * Constructor with a message and cause.
	 * @param message
	 * @param cause
	 */
	public ModuleDiscoveryException(String message, Throwable cause) {
		super(message, cause);
	}

}
