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

import java.io.BufferedReader;
import java.io.IOException;
import java.io.InputStreamReader;
import java.lang.reflect.InvocationTargetException;
import java.lang.reflect.Modifier;
import java.net.URL;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.Iterator;
import java.util.List;
import java.util.ServiceConfigurationError;
import java.util.ServiceLoader;
import java.util.jar.JarFile;
import java.util.stream.Collectors;
import java.util.stream.Stream;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import astroview.lib.common.AstroViewPrefs;

/**
 * Discovers {@link ProcessingUnit ProcessingUnits}, both on the classpath and in a modules directory.
 * <p>
 * Units on the classpath are found with a {@link ServiceLoader}.
 * <p>
 * Within a modules directory, each module lives in its own subdirectory. A subdirectory named {@code name}
 * must contain a jar named {@code <name>_module.jar} (with any '-' in the name replaced by '_'),
 * which lists exactly one implementation in {@code META-INF/services/astroview.lib.modules.ProcessingUnit}.
 * Any other jars in the subdirectory are treated as dependencies of the module.
 * <p>
 * Every module source is handled independently: failures are logged and recorded as a {@link DiscoveryResult},
 * and never prevent other modules from being loaded.
 */
public class ModuleLoader {

	private static final Logger logger = LoggerFactory.getLogger(ModuleLoader.class);

	/**
	 * Path within a jar of the service file listing the processing unit implementation.
	 */
	public static final String SERVICE_FILE = "META-INF/services/" + ProcessingUnit.class.getName();

	private final ClassLoader parent;

	/**
	 * Create a loader that uses the class loader of this class as the parent.
	 */
	public ModuleLoader() {
		this(ModuleLoader.class.getClassLoader());
	}

	/**
	 * Create a loader with the specified parent class loader.
	 * @param parent
	 */
	public ModuleLoader(ClassLoader parent) {
		this.parent = parent;
	}

	/**
	 * Get the name of the jar expected within a module directory.
	 * @param directoryName
	 * @return
	 */
	public static String getModuleJarName(String directoryName) {
		return directoryName.replace('-', '_') + "_module.jar";
	}

	/**
	 * Find all processing units on the classpath.
	 * @return one result per provider found
	 */
	public List<DiscoveryResult> loadFromClasspath() {
		List<DiscoveryResult> results = new ArrayList<>();
		Iterator<ProcessingUnit> iterator = ServiceLoader.load(ProcessingUnit.class, parent).iterator();
		int count = 0;
		while (true) {
			String source = "classpath[" + count++ + "]";
			try {
				if (!iterator.hasNext())
					break;
				var unit = iterator.next();
				results.add(DiscoveryResult.success(source, unit));
			} catch (ServiceConfigurationError | LinkageError e) {
				var exception = new ModuleDiscoveryException("Unable to load processing unit: " + e.getLocalizedMessage(), e);
				logger.warn("Could not load module from classpath: {}", e.getLocalizedMessage());
				logger.debug(e.getLocalizedMessage(), e);
				results.add(DiscoveryResult.failure(source, exception));
			}
		}
		return results;
	}

	/**
	 * Find all processing units in subdirectories of a modules directory.
	 * @param directory
	 * @return one result per subdirectory
	 */
	public List<DiscoveryResult> loadFromDirectory(Path directory) {
		if (directory == null || !Files.exists(directory)) {
			logger.debug("No modules directory exists at {}", directory);
			return List.of();
		}
		if (!Files.isDirectory(directory)) {
			logger.error("Invalid modules directory! '{}' is not a directory.", directory);
			return List.of();
		}
		List<Path> subdirs;
		try (Stream<Path> stream = Files.list(directory)) {
			subdirs = stream
					.filter(Files::isDirectory)
					.filter(p -> !p.getFileName().toString().startsWith("__") && !p.getFileName().toString().startsWith("."))
					.sorted(Comparator.comparing(p -> p.getFileName().toString()))
					.collect(Collectors.toList());
		} catch (IOException e) {
			logger.error("Unable to list modules directory " + directory + ": " + e.getLocalizedMessage(), e);
			return List.of();
		}
		List<DiscoveryResult> results = new ArrayList<>();
		for (var dir : subdirs)
			results.add(loadModule(dir));
		return results;
	}

	/**
	 * Load a single module from its directory.
	 * @param moduleDirectory
	 * @return
	 */
	public DiscoveryResult loadModule(Path moduleDirectory) {
		var name = moduleDirectory.getFileName().toString();
		try {
			var unit = createUnit(moduleDirectory);
			logger.info("Loaded module: {} (from {})", unit.getClass().getName(), name);
			return DiscoveryResult.success(name, unit);
		} catch (ModuleDiscoveryException e) {
			logger.warn("Could not load module {}: {}", name, e.getLocalizedMessage());
			if (e.getCause() != null)
				logger.debug(e.getLocalizedMessage(), e);
			return DiscoveryResult.failure(name, e);
		}
	}

	private ProcessingUnit createUnit(Path moduleDirectory) throws ModuleDiscoveryException {
		var name = moduleDirectory.getFileName().toString();
		var jar = moduleDirectory.resolve(getModuleJarName(name));
		if (!Files.isRegularFile(jar))
			throw new ModuleDiscoveryException("No module jar found (expected " + jar.getFileName() + ")");

		String className = readServiceEntry(jar);

		var loader = new ModuleClassLoader(name, getJarUrls(moduleDirectory, jar), parent);
		try {
			Class<?> cls = Class.forName(className, true, loader);
			if (!ProcessingUnit.class.isAssignableFrom(cls))
				throw new ModuleDiscoveryException(className + " does not implement " + ProcessingUnit.class.getSimpleName());
			if (cls.isInterface() || Modifier.isAbstract(cls.getModifiers()))
				throw new ModuleDiscoveryException(className + " is not a concrete class");
			return cls.asSubclass(ProcessingUnit.class).getDeclaredConstructor().newInstance();
		} catch (ModuleDiscoveryException e) {
			closeQuietly(loader);
			throw e;
		} catch (ClassNotFoundException e) {
			closeQuietly(loader);
			throw new ModuleDiscoveryException("Class " + className + " not found", e);
		} catch (InvocationTargetException e) {
			closeQuietly(loader);
			var cause = e.getCause() == null ? e : e.getCause();
			throw new ModuleDiscoveryException("Unable to create " + className + ": " + cause.getLocalizedMessage(), cause);
		} catch (ReflectiveOperationException | RuntimeException | LinkageError e) {
			closeQuietly(loader);
			throw new ModuleDiscoveryException("Unable to create " + className + ": " + e.getLocalizedMessage(), e);
		}
	}

	/**
	 * Read the single implementation class name listed in a jar's service file.
	 */
	private static String readServiceEntry(Path jar) throws ModuleDiscoveryException {
		List<String> classNames = new ArrayList<>();
		try (var jarFile = new JarFile(jar.toFile())) {
			var entry = jarFile.getJarEntry(SERVICE_FILE);
			if (entry == null)
				throw new ModuleDiscoveryException(jar.getFileName() + " does not contain " + SERVICE_FILE);
			try (var reader = new BufferedReader(new InputStreamReader(jarFile.getInputStream(entry), StandardCharsets.UTF_8))) {
				String line;
				while ((line = reader.readLine()) != null) {
					int ind = line.indexOf('#');
					if (ind >= 0)
						line = line.substring(0, ind);
					line = line.trim();
					if (!line.isEmpty())
						classNames.add(line);
				}
			}
		} catch (IOException e) {
			throw new ModuleDiscoveryException("Unable to read " + jar.getFileName() + ": " + e.getLocalizedMessage(), e);
		}
		if (classNames.isEmpty())
			throw new ModuleDiscoveryException(jar.getFileName() + " does not list a processing unit");
		if (classNames.size() > 1)
			throw new ModuleDiscoveryException(jar.getFileName() + " lists " + classNames.size() + " processing units, but exactly one is required");
		return classNames.get(0);
	}

	private static URL[] getJarUrls(Path moduleDirectory, Path moduleJar) throws ModuleDiscoveryException {
		List<URL> urls = new ArrayList<>();
		try (Stream<Path> stream = Files.list(moduleDirectory)) {
			urls.add(moduleJar.toUri().toURL());
			var dependencies = stream
					.filter(p -> Files.isRegularFile(p) && p.getFileName().toString().toLowerCase().endsWith(".jar"))
					.filter(p -> !p.equals(moduleJar))
					.sorted()
					.collect(Collectors.toList());
			for (var dep : dependencies) {
				logger.debug("Adding dependency {} for module {}", dep.getFileName(), moduleDirectory.getFileName());
				urls.add(dep.toUri().toURL());
			}
		} catch (IOException e) {
			throw new ModuleDiscoveryException("Unable to list jars in " + moduleDirectory + ": " + e.getLocalizedMessage(), e);
		}
		return urls.toArray(URL[]::new);
	}

	private static void closeQuietly(ModuleClassLoader loader) {
		try {
			loader.close();
		} catch (IOException e) {
			logger.debug("Error closing " + loader + ": " + e.getLocalizedMessage(), e);
		}
	}

	/**
	 * Discover processing units on the classpath and in the modules directory specified by {@link AstroViewPrefs},
	 * registering all that are found.
	 * @param registry
	 * @return all discovery results, including failures
	 */
	public List<DiscoveryResult> discoverAndRegister(ModuleRegistry registry) {
		return discoverAndRegister(registry, AstroViewPrefs.getModulesDirectory());
	}

	/**
	 * Discover processing units on the classpath and in a modules directory, registering all that are found.
	 * <p>
	 * The directory is not scanned if the {@link AstroViewPrefs#PROP_NO_MODULES} system property is set.
	 *
	 * @param registry
	 * @param modulesDirectory the directory to scan; may be null to use the classpath only
	 * @return all discovery results, including failures
	 */
	public List<DiscoveryResult> discoverAndRegister(ModuleRegistry registry, Path modulesDirectory) {
		long startTime = System.currentTimeMillis();
		List<DiscoveryResult> results = new ArrayList<>(loadFromClasspath());
		if (modulesDirectory != null) {
			if (AstroViewPrefs.isModuleDirectoryScanEnabled())
				results.addAll(loadFromDirectory(modulesDirectory));
			else
				logger.info("Modules directory will be skipped - '{}' system property is set", AstroViewPrefs.PROP_NO_MODULES);
		}
		int nLoaded = 0;
		for (int i = 0; i < results.size(); i++) {
			var result = results.get(i);
			var unit = result.getUnit().orElse(null);
			if (unit == null)
				continue;
			try {
				registry.registerModule(unit);
				nLoaded++;
			} catch (RuntimeException | LinkageError e) {
				logger.warn("Could not register module from {}: {}", result.getSource(), e.getLocalizedMessage());
				logger.debug(e.getLocalizedMessage(), e);
				var exception = new ModuleDiscoveryException("Unable to register processing unit: " + e.getLocalizedMessage(), e);
				results.set(i, DiscoveryResult.failure(result.getSource(), exception));
			}
		}
		long endTime = System.currentTimeMillis();
		logger.info("Discovered {} module(s), {} failed ({} ms)", nLoaded, results.size() - nLoaded, endTime - startTime);
		return results;
	}

}
