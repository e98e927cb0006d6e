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

abstract class AbstractParameter<S> implements Parameter<S> {

	private final String prompt;
	private final S defaultValue;
	private final String helpText;

	protected S value;

	AbstractParameter(String prompt, S defaultValue, S value, String helpText) {
		this.prompt = prompt;
		this.defaultValue = defaultValue;
		this.value = value;
		this.helpText = helpText;
	}

	@Override
	public S getDefaultValue() {
		return defaultValue;
	}

	@Override
	public S getValue() {
		return value;
	}

	@Override
	public void resetValue() {
		value = null;
	}

	@Override
	public S getValueOrDefault() {
		return value == null ? defaultValue : value;
	}

	@Override
	public String getPrompt() {
		return prompt;
	}

	@Override
	public boolean setValue(S value) {
		if (value == null || !isValidInput(value))
			return false;
		this.value = value;
		return true;
	}

	@Override
	public String getHelpText() {
		return helpText;
	}

	@Override
	public String toString() {
		return getPrompt() + ": " + getValueOrDefault();
	}

}
