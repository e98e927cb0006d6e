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

import java.text.NumberFormat;
import java.text.ParseException;
import java.util.Locale;

/**
 * Abstract parameter to represent a numeric value, with optional lower and upper bounds.
 *
 * @param <S>
 */
public abstract class NumericParameter<S extends Number> extends AbstractParameter<S> {

	private final String unit;
	private final double minValue;
	private final double maxValue;

	NumericParameter(String prompt, S defaultValue, String unit, double minValue, double maxValue, S value, String helpText) {
		super(prompt, defaultValue, value, helpText);
		if (Double.isNaN(minValue))
			minValue = Double.NEGATIVE_INFINITY;
		if (Double.isNaN(maxValue))
			maxValue = Double.POSITIVE_INFINITY;
		if (minValue > maxValue)
			throw new IllegalArgumentException("Invalid range " + minValue + "-" + maxValue + ": minValue must be <= maxValue");
		this.unit = unit;
		this.minValue = minValue;
		this.maxValue = maxValue;
	}

	/**
	 * Retrieve the lower bound. May be Double.NEGATIVE_INFINITY if the parameter has no lower bound.
	 * @return
	 */
	public double getLowerBound() {
		return minValue;
	}

	/**
	 * Retrieve the upper bound. May be Double.POSITIVE_INFINITY if the parameter has no upper bound.
	 * @return
	 */
	public double getUpperBound() {
		return maxValue;
	}

	/**
	 * Returns true if the parameter has a finite lower bound.
	 * @return
	 */
	public boolean hasLowerBound() {
		return Double.isFinite(minValue);
	}

	/**
	 * Returns true if the parameter has a finite upper bound.
	 * @return
	 */
	public boolean hasUpperBound() {
		return Double.isFinite(maxValue);
	}

	/**
	 * Get the unit to display for this parameter (may be null if no unit is available).
	 * @return
	 */
	public String getUnit() {
		return unit;
	}

	/**
	 * Set the value from a double, converting as needed.
	 * @param val
	 * @return true if the value was set, false otherwise
	 */
	public abstract boolean setDoubleValue(double val);

	/**
	 * Set the value, clipping it to be within any lower and upper bounds if necessary.
	 * @param val
	 * @return true if the value was set, false otherwise (e.g. if it is NaN)
	 */
	public boolean setDoubleValueWithBoundsCheck(double val) {
		if (Double.isNaN(val))
			return false;
		return setDoubleValue(Math.max(Math.min(val, maxValue), minValue));
	}

	/**
	 * Numbers are considered valid if they are not NaN, and are within the bounds.
	 */
	@Override
	public boolean isValidInput(S value) {
		double d = value.doubleValue();
		return !Double.isNaN(d) && d >= minValue && d <= maxValue;
	}

	@Override
	public boolean setStringValue(Locale locale, String value) {
		if (value == null)
			return false;
		try {
			var format = NumberFormat.getInstance(locale == null ? Locale.getDefault(Locale.Category.FORMAT) : locale);
			return setDoubleValue(format.parse(value.trim()).doubleValue());
		} catch (ParseException e) {
			try {
				return setDoubleValue(Double.parseDouble(value.trim()));
			} catch (NumberFormatException e2) {
				return false;
			}
		}
	}

	@Override
	public String toString() {
		return unit == null ? super.toString() : super.toString() + " " + unit;
	}

}
