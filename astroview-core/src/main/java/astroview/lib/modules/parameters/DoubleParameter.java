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

/**
 * Parameter to represent a floating point numeric value.
 */
public class DoubleParameter extends NumericParameter<Double> {

	DoubleParameter(String prompt, Double defaultValue, String unit, double minValue, double maxValue, Double value, String helpText) {
		super(prompt, defaultValue, unit, minValue, maxValue, value, helpText);
	}

	@Override
	public boolean setDoubleValue(double val) {
		return setValue(val);
	}

	@Override
	public Parameter<Double> duplicate() {
		return new DoubleParameter(getPrompt(), getDefaultValue(), getUnit(), getLowerBound(), getUpperBound(), getValue(), getHelpText());
	}

}
