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
 * A parameter that does not accept any input.
 * This is used to display text, such as a title or a short description of an operation.
 */
public class EmptyParameter extends AbstractParameter<String> {

	private final boolean isTitle;

	EmptyParameter(String prompt, boolean isTitle) {
		super(prompt, null, null, null);
		this.isTitle = isTitle;
	}

	/**
	 * Returns true if the parameter should be considered a title. It may therefore be displayed differently.
	 * @return
	 */
	public boolean isTitle() {
		return isTitle;
	}

	/**
	 * Always returns false.
	 */
	@Override
	public boolean isValidInput(String value) {
		return false;
	}

	@Override
	public boolean setStringValue(Locale locale, String value) {
		return false;
	}

	@Override
	public String toString() {
		return getPrompt();
	}

	@Override
	public Parameter<String> duplicate() {
		return new EmptyParameter(getPrompt(), isTitle);
	}

}
