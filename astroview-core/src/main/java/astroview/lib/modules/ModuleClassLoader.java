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

import java.net.URL;
import java.net.URLClassLoader;

/**
 * {@link ClassLoader} for one module loaded from the modules directory.
 * <p>
 * Each module gets its own loader, so that a module's classes and dependencies are isolated from
 * those of other modules. Classes not found in the module's jars are requested from the parent.
 */
public class ModuleClassLoader extends URLClassLoader {

	static {
		ClassLoader.registerAsParallelCapable();
	}

	private final String moduleName;

	/**
	 * Constructor.
	 * @param moduleName name of the module (usually the directory name)
	 * @param urls jars to search, starting with the module jar
	 * @param parent parent class loader
	 */
	public ModuleClassLoader(String moduleName, URL[] urls, ClassLoader parent) {
		super("module-" + moduleName, urls, parent);
		this.moduleName = moduleName;
	}

	/**
	 * Name of the module associated with this loader.
	 * @return
	 */
	public String getModuleName() {
		return moduleName;
	}

	@Override
	public String toString() {
		return "ModuleClassLoader [" + moduleName + "]";
	}

}
