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

/**
 * Parameter to represent an integer numeric value.
 * <p>
 * May be bounded.
 */
public class IntParameter extends NumericParameter<Integer> {
	
	IntParameter(String prompt, Integer defaultValue, double minValue, double maxValue, Integer lastValue, String helpText) {
		super(prompt, defaultValue, minValue, maxValue, lastValue, helpText);
	}
	
	@Override
	public boolean setDoubleValue(double val) {
		if (val != Math.rint(val))
			return false;
		return setValue((int)val);
	}

	@Override
	public Parameter<Integer> duplicate() {
		return new IntParameter(getPrompt(), getDefaultValue(), getLowerBound(), getUpperBound(), lastValue, getHelpText());
	}

}
