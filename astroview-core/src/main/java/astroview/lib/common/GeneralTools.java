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

import java.io.File;
import java.nio.file.Path;
import java.util.Collection;
import java.util.List;
import java.util.Locale;
import java.util.Objects;
import java.util.Optional;

/**
 * Collection of static methods that are useful in various places throughout the software.
 */
public final class GeneralTools {

	/**
	 * Multipart extensions that should be retained as a whole, rather than only using the part after the final dot.
	 */
	private static final List<String> DEFAULT_EXTENSIONS = List.of(
			".ome.tif", ".ome.tiff", ".fits.gz", ".tar.gz"
			);

	// Suppress default constructor for non-instantiability
	private GeneralTools() {
		throw new AssertionError();
	}

	/**
	 * Get the extension from a file, including the dot.
	 * @param file
	 * @return
	 * @see #getExtension(String)
	 */
	public static Optional<String> getExtension(File file) {
		Objects.requireNonNull(file);
		return getExtension(file.getName());
	}

	/**
	 * Get the extension from a path, including the dot.
	 * @param path
	 * @return
	 * @see #getExtension(String)
	 */
	public static Optional<String> getExtension(Path path) {
		Objects.requireNonNull(path);
		var name = path.getFileName();
		return name == null ? Optional.empty() : getExtension(name.toString());
	}

	/**
	 * Get extension from a filename. Some implementation notes:
	 * <ul>
	 * <li>This is <i>generally</i> 'the final dot and beyond', but a few multipart extensions
	 * (e.g. ".ome.tif", ".fits.gz") are returned in full.</li>
	 * <li>The dot is included as the first character.</li>
	 * <li>If a dot is the final character then no extension is returned.</li>
	 * <li>The extension is returned in lower case.</li>
	 * </ul>
	 * @param name
	 * @return
	 */
	public static Optional<String> getExtension(String name) {
		Objects.requireNonNull(name);
		var lower = name.toLowerCase(Locale.ROOT);
		String ext = null;
		for (var temp : DEFAULT_EXTENSIONS) {
			if (lower.endsWith(temp)) {
				ext = temp;
				break;
			}
		}
		if (ext == null) {
			int ind = lower.lastIndexOf(".");
			if (ind >= 0) {
				ext = lower.substring(ind);
				// Check we only have letters & digits
				if (!ext.matches(".\\w*"))
					ext = null;
			}
		}
		return ext == null || ext.equals(".") ? Optional.empty() : Optional.of(ext);
	}

	/**
	 * Get the format token for a path, i.e. the lower-case extension without the leading dot.
	 * This is the form used when processing units report their supported formats.
	 * @param path
	 * @return the format token, or an empty optional if the path has no extension
	 */
	public static Optional<String> getFormatToken(Path path) {
		return getExtension(path).map(ext -> ext.substring(1));
	}

	/**
	 * Get the file name with extension removed.
	 * @param name
	 * @return
	 */
	public static String getNameWithoutExtension(String name) {
		var ext = getExtension(name).orElse(null);
		return ext == null ? name : name.substring(0, name.length() - ext.length());
	}

	/**
	 * Returns true if the path has one of the specified format tokens (case-insensitive, no leading dot).
	 * @param path
	 * @param formats
	 * @return
	 */
	public static boolean hasFormat(Path path, Collection<String> formats) {
		var token = getFormatToken(path).orElse(null);
		if (token == null)
			return false;
		for (var format : formats) {
			if (token.equalsIgnoreCase(format))
				return true;
			// Handle multipart tokens such as 'ome.tif', where 'tif' is supported
			if (token.endsWith("." + format.toLowerCase(Locale.ROOT)))
				return true;
		}
		return false;
	}

	/**
	 * Check if a string is blank, i.e. it is null or its length is 0.
	 * @param s
	 * @param trim If true, any string will be trimmed before its length checked.
	 * @return True if the string is null or empty.
	 */
	public static boolean blankString(final String s, final boolean trim) {
		return s == null || (trim ? s.trim().length() == 0 : s.length() == 0);
	}

	/**
	 * Clip a value to be within a specific range.
	 *
	 * @param value
	 * @param min
	 * @param max
	 * @return
	 */
	public static int clipValue(final int value, final int min, final int max) {
		return value < min ? min : (value > max ? max : value);
	}

	/**
	 * Clip a value to be within a specific range.
	 *
	 * @param value
	 * @param min
	 * @param max
	 * @return
	 */
	public static double clipValue(final double value, final double min, final double max) {
		return value < min ? min : (value > max ? max : value);
	}

}
