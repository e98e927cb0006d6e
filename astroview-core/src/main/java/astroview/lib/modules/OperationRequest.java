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
 * A request to apply one operation, with the parameters that operation needs.
 * <p>
 * Each operation has its own implementation carrying only its own typed fields;
 * see {@link OperationRequests} for the available requests, and for conversion to and from JSON.
 */
public interface OperationRequest {

	/**
	 * Get the name of the requested operation, e.g. "Gaussian Blur".
	 * This is unique within a {@link ProcessingUnit}, and is the value of the 'operation' field when the request is serialized.
	 * @return
	 */
	String getOperationName();

}
