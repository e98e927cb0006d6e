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

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import astroview.lib.modules.parameters.ParameterList;

/**
 * Description of the controls for a {@link ProcessingUnit}: the operations it offers,
 * and the adjustable parameters for each of them.
 * <p>
 * This does not depend upon any user interface toolkit. A viewer can display the parameter lists
 * (with their prompts, default values and bounds), and then call {@link #buildRequest(String)}
 * to create the request for the operation chosen by the user.
 */
public class ModuleControls {

	private final String moduleName;
	private final Map<String, ParameterList> operations = new LinkedHashMap<>();

	/**
	 * Constructor.
	 * @param moduleName name of the processing unit these controls belong to
	 */
	public ModuleControls(String moduleName) {
		this.moduleName = moduleName;
	}

	/**
	 * Add an operation, with its parameters.
	 * @param operation the operation name
	 * @param params the parameters; may be null or empty if the operation has no parameters
	 * @return this instance
	 */
	public ModuleControls addOperation(String operation, ParameterList params) {
		operations.put(operation, params == null ? new ParameterList() : params);
		return this;
	}

	/**
	 * Name of the processing unit these controls belong to.
	 * @return
	 */
	public String getModuleName() {
		return moduleName;
	}

	/**
	 * Get the operation names, in the order they were added.
	 * @return
	 */
	public List<String> getOperationNames() {
		return Collections.unmodifiableList(new ArrayList<>(operations.keySet()));
	}

	/**
	 * Get the parameters for an operation. The list is 'live', so parameter values may be set directly.
	 * @param operation
	 * @return the parameters
	 * @throws IllegalArgumentException if the operation is unknown
	 */
	public ParameterList getParameters(String operation) {
		var params = operations.get(operation);
		if (params == null)
			throw new IllegalArgumentException("Unknown operation '" + operation + "' for " + moduleName);
		return params;
	}

	/**
	 * Create a request for an operation, using the current parameter values.
	 * @param operation
	 * @return
	 * @throws IllegalArgumentException if the operation is unknown, or its parameters cannot be converted to a request
	 */
	public OperationRequest buildRequest(String operation) {
		return OperationRequests.fromParameters(operation, getParameters(operation));
	}

	@Override
	public String toString() {
		return "ModuleControls [" + moduleName + ": " + operations.keySet() + "]";
	}

}
