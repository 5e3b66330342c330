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
 * Abstract Parameter implementation.
 *
 * @param <S>
 */
abstract class AbstractParameter<S> implements Parameter<S> {

	private final String prompt;
	private final S defaultValue;
	private final String helpText;
	
	protected S lastValue = null;
	
	AbstractParameter(String prompt, S defaultValue, S value, String helpText) {
		this.prompt = prompt;
		this.defaultValue = defaultValue;
		this.lastValue = value;
		this.helpText = helpText;
	}
	
	@Override
	public S getDefaultValue() {
		return defaultValue;
	}
	
	@Override
	public S getValue() {
		return lastValue;
	}
	
	@Override
	public void resetValue() {
		lastValue = null;
	}

	@Override
	public S getValueOrDefault() {
		if (lastValue != null)
			return lastValue;
		return defaultValue;
	}
	
	@Override
	public String getPrompt() {
		return prompt;
	}
	
	@Override
	public boolean setValue(S value) {
		if (!isValidInput(value))
			return false;
		this.lastValue = value;
		return true;
	}
	
	@Override
	public String getHelpText() {
		return helpText;
	}
	
	@Override
	public String toString() {
		return getPrompt().replace(":", "-") + ":\t" + getValueOrDefault();
	}
	
}
