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
 * Parameter to represent a String value, e.g. a list of numbers entered as text.
 */
public class StringParameter extends AbstractParameter<String> {

	StringParameter(String prompt, String defaultValue, String value, String helpText) {
		super(prompt, defaultValue, value, helpText);
	}

	/**
	 * All non-null strings are valid.
	 */
	@Override
	public boolean isValidInput(String value) {
		return value != null;
	}

	@Override
	public boolean setStringValue(Locale locale, String value) {
		return setValue(value);
	}

	@Override
	public Parameter<String> duplicate() {
		return new StringParameter(getPrompt(), getDefaultValue(), getValue(), getHelpText());
	}

}
