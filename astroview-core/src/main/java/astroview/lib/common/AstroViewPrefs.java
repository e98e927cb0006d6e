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

package astroview.lib.common;

import java.nio.file.Path;
import java.nio.file.Paths;

/**
 * Core AstroView preferences. These are not persistent: defaults come from system properties,
 * and may be overridden at runtime (e.g. by the launcher's command line options).
 */
public class AstroViewPrefs {

	/**
	 * System property used to specify the directory that is scanned for processing modules.
	 */
	public static final String PROP_MODULES_DIRECTORY = "astroview.modules";

	/**
	 * System property that, when set to 'true', disables scanning the modules directory.
	 * Modules available on the classpath are still loaded.
	 */
	public static final String PROP_NO_MODULES = "astroview.nomodules";

	private static Path modulesDirectory = null;

	/**
	 * Get the directory that should be scanned for processing modules.
	 * <p>
	 * If this has not been set explicitly, the {@link #PROP_MODULES_DIRECTORY} system property is used,
	 * falling back to {@code ~/.astroview/modules}.
	 * @return
	 */
	public static synchronized Path getModulesDirectory() {
		if (modulesDirectory != null)
			return modulesDirectory;
		var prop = System.getProperty(PROP_MODULES_DIRECTORY);
		if (!GeneralTools.blankString(prop, true))
			return Paths.get(prop.trim());
		return Paths.get(System.getProperty("user.home"), ".astroview", "modules");
	}

	/**
	 * Set the directory that should be scanned for processing modules.
	 * @param path the directory, or null to revert to the default
	 */
	public static synchronized void setModulesDirectory(Path path) {
		modulesDirectory = path;
	}

	/**
	 * Query whether the modules directory should be scanned, based upon the {@link #PROP_NO_MODULES} property.
	 * @return
	 */
	public static boolean isModuleDirectoryScanEnabled() {
		return !"true".equalsIgnoreCase(System.getProperty(PROP_NO_MODULES));
	}

}
