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

package astroview.lib.modules.parameters;

import java.util.Locale;

/**
 * Interface defining a single parameter that a processing unit exposes to a user.
 * <p>
 * A parameter is GUI-independent: it stores a prompt, a default value, an optional current value
 * and optional help text. A user interface (or a command line) is responsible for displaying it.
 *
 * @param <S> type of the parameter value
 */
public interface Parameter<S> {

	/**
	 * Get a default value to use if the Parameter has not been otherwise set.
	 * @return
	 */
	public S getDefaultValue();

	/**
	 * Set the Parameter to have a specified value.
	 * @param value
	 * @return true if the value was valid and has been set, false otherwise
	 */
	public boolean setValue(S value);

	/**
	 * Set the value using a string; implementing classes need to parse this.
	 * @param locale locale used for parsing numbers; may be null to use the default
	 * @param value
	 * @return true if the value could be parsed and set, false otherwise
	 */
	public boolean setStringValue(Locale locale, String value);

	/**
	 * Reset the value to null, so that the default is used.
	 */
	public void resetValue();

	/**
	 * Get the current set value (may be null).
	 * @return
	 * @see #getValueOrDefault()
	 */
	public S getValue();

	/**
	 * Get the current set value, or the default if no value has been set.
	 * @return
	 */
	public S getValueOrDefault();

	/**
	 * Get some prompt text that may be displayed to a user.
	 * @return
	 */
	public String getPrompt();

	/**
	 * Query if a specified value would be valid for this parameter.
	 * @param value
	 * @return true if the value would be valid, false otherwise
	 */
	public boolean isValidInput(S value);

	/**
	 * Create a new Parameter with the same text and value.
	 * @return
	 */
	public Parameter<S> duplicate();

	/**
	 * Query whether getHelpText() returns a meaningful String (as opposed to null).
	 * @return
	 */
	public default boolean hasHelpText() {
		return getHelpText() != null;
	}

	/**
	 * Get a description of the meaning of the Parameter; may be displayed e.g. as a tooltip.
	 * @return
	 */
	public String getHelpText();

}
