/*-
 * #%L
 * This file is part of ObjectFlow.
 * %%
 * Copyright (C) 2026 ObjectFlow developers
 * %%
 * ObjectFlow is free software: you can redistribute it and/or modify
 * it under the terms of the GNU General Public License as
 * published by the Free Software Foundation, either version 3 of the
 * License, or (at your option) any later version.
 * 
 * ObjectFlow is distributed in the hope that it will be useful,
 * but WITHOUT ANY WARRANTY; without even the implied warranty of
 * MERCHANTABILITY or FITNESS FOR A PARTICULAR PURPOSE.  See the
 * GNU General Public License for more details.
 * 
 * You should have received a copy of the GNU General Public License 
 * along with ObjectFlow.  If not, see <https://www.gnu.org/licenses/>.
 * #L%
 */

package objectflow.lib.plugins.parameters;

import java.text.NumberFormat;
import java.text.ParseException;
import java.util.Locale;

/**
 * Abstract parameter to represent a bounded numeric value.
 * 
 * @see IntParameter
 *
 * @param <S>
 */
public abstract class NumericParameter<S extends Number> extends AbstractParameter<S> {
	
	private final double minValue;
	private final double maxValue;
	
	NumericParameter(String prompt, S defaultValue, double minValue, double maxValue, S lastValue, String helpText) {
		super(prompt, defaultValue, lastValue, helpText);
		if (minValue > maxValue)
			throw new IllegalArgumentException("Invalid range " + minValue + "-" + maxValue + ": minValue must be <= maxValue");
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
	 * Set the value of this parameter from a double (subclasses should convert this as needed).
	 * 
	 * @param val
	 * @return
	 */
	public abstract boolean setDoubleValue(double val);
	
	/**
	 * Numbers are considered valid if they are not null, not NaN and within the bounds.
	 */
	@Override
	public boolean isValidInput(S value) {
		if (value == null)
			return false;
		double d = value.doubleValue();
		return !Double.isNaN(d) && d >= minValue && d <= maxValue;
	}
	
	@Override
	public boolean setStringValue(Locale locale, String value) {
		try {
			Number number = NumberFormat.getInstance(locale == null ? Locale.US : locale).parse(value.strip());
			return setDoubleValue(number.doubleValue());
		} catch (ParseException e) {
			try {
				return setDoubleValue(Double.parseDouble(value));
			} catch (NumberFormatException e2) {
				return false;
			}
		}
	}
	
}
