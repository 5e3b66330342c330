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

import java.util.Locale;

/**
 * Interface defining configurable algorithm parameters.
 * @param <S>
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
	 * @return true if the value was valid and has been set
	 */
	public boolean setValue(S value);

	/**
	 * Set the value using a string; implementing classes may need to parse this.
	 * @param locale locale used for parsing numbers
	 * @param value
	 * @return true if the value could be parsed and has been set
	 */
	public boolean setStringValue(Locale locale, String value);

	/**
	 * Set the value to null (so the default is used).
	 */
	public void resetValue();

	/**
	 * Get the current set value (may be null).
	 * 
	 * @see #setValue
	 * @see #getValueOrDefault
	 * @return
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
	 * Get a description of the meaning of the Parameter (may be null).
	 * @return
	 */
	public String getHelpText();
	
}
