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

import java.nio.file.Path;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Registry of available {@link ProcessingUnit ProcessingUnits}, keyed by name, tracking the single active unit.
 * <p>
 * Methods are synchronized, so that units can be registered from a loading thread while the active
 * unit is queried from elsewhere.
 */
public class ModuleRegistry {

	private static final Logger logger = LoggerFactory.getLogger(ModuleRegistry.class);

	private final Map<String, ProcessingUnit> modules = new LinkedHashMap<>();

	private ProcessingUnit activeModule;

	/**
	 * Register a unit using its name.
	 * <p>
	 * If a unit has already been registered with the same name it is replaced, and a warning is logged.
	 * If the replaced unit was active, the new unit becomes active instead.
	 *
	 * @param unit
	 * @return the unit that was replaced, or null if the name was not already in use
	 * @throws IllegalArgumentException if the unit's name is null or blank
	 */
	public synchronized ProcessingUnit registerModule(ProcessingUnit unit) {
		Objects.requireNonNull(unit, "Unit must not be null");
		var name = unit.getName();
		if (name == null || name.isBlank())
			throw new IllegalArgumentException("Module name must not be null or blank (" + unit.getClass().getName() + ")");
		var previous = modules.put(name, unit);
		if (previous != null && previous != unit) {
			logger.warn("Module '{}' already registered - overwriting", name);
			logger.debug("Replaced {} with {}", previous, unit);
			if (activeModule == previous)
				activeModule = unit;
		} else
			logger.debug("Registered module '{}'", name);
		return previous;
	}

	/**
	 * Get the names of all registered units, in registration order.
	 * @return
	 */
	public synchronized List<String> getModuleNames() {
		return List.copyOf(modules.keySet());
	}

	/**
	 * Get a registered unit by name.
	 * @param name
	 * @return
	 */
	public synchronized Optional<ProcessingUnit> getModule(String name) {
		return Optional.ofNullable(modules.get(name));
	}

	/**
	 * Activate a registered unit.
	 * <p>
	 * If no unit is registered with the name, the currently active unit remains active.
	 * Activating the unit that is already active succeeds, and has no other effect.
	 *
	 * @param name
	 * @return the controls for the unit, or an empty optional if the unit was not found
	 */
	public synchronized Optional<ModuleControls> activateModule(String name) {
		var module = modules.get(name);
		if (module == null) {
			logger.warn("Module '{}' not found", name);
			return Optional.empty();
		}
		var controls = module.createControls();
		if (activeModule != module) {
			activeModule = module;
			logger.info("Module '{}' activated", name);
		} else
			logger.debug("Module '{}' is already active", name);
		return Optional.of(controls);
	}

	/**
	 * Get the active unit.
	 * @return
	 */
	public synchronized Optional<ProcessingUnit> getActiveModule() {
		return Optional.ofNullable(activeModule);
	}

	/**
	 * Get all registered units that report support for a file.
	 * @param path
	 * @return
	 */
	public synchronized List<ProcessingUnit> findModulesForFile(Path path) {
		List<ProcessingUnit> list = new ArrayList<>();
		for (var module : modules.values()) {
			if (module.supportsFile(path))
				list.add(module);
		}
		return list;
	}

	/**
	 * Number of registered units.
	 * @return
	 */
	public synchronized int size() {
		return modules.size();
	}

}
