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

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Locale;
import java.util.Map;
import java.util.Map.Entry;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;


/**
 * A collection of Parameters, which can be used to configure an algorithm.
 * <p>
 * Each Parameter requires a key to be associated with it.
 * <p>
 * The order or parameters is maintained.
 */
public class ParameterList {
	
	private final static Logger logger = LoggerFactory.getLogger(ParameterList.class);
	
	private Map<String, Parameter<?>> params = new LinkedHashMap<>();
	
	/**
	 * Create a deep copy of this parameter list.
	 * @return
	 */
	public ParameterList duplicate() {
		ParameterList paramsCopy = new ParameterList();
		for (Entry<String, Parameter<?>> entry : params.entrySet()) {
			paramsCopy.params.put(entry.getKey(), entry.getValue().duplicate());
		}
		return paramsCopy;
	}
	
	/**
	 * Add an unbounded int parameter to this list.
	 * @param key
	 * @param prompt
	 * @param defaultValue
	 * @param helpText
	 * @return
	 */
	public ParameterList addIntParameter(String key, String prompt, int defaultValue, String helpText) {
		return addIntParameter(key, prompt, defaultValue, Double.NEGATIVE_INFINITY, Double.POSITIVE_INFINITY, helpText);
	}
	
	/**
	 * Add a bounded int parameter to this list.
	 * @param key
	 * @param prompt
	 * @param defaultValue
	 * @param lowerBound
	 * @param upperBound
	 * @param helpText
	 * @return
	 */
	public ParameterList addIntParameter(String key, String prompt, int defaultValue, double lowerBound, double upperBound, String helpText) {
		params.put(key, new IntParameter(prompt, defaultValue, lowerBound, upperBound, null, helpText));
		return this;
	}
	
	/**
	 * Returns a map of keys and their corresponding parameters
	 * @return
	 */
	public Map<String, Parameter<?>> getParameters() {
		return Collections.unmodifiableMap(params);
	}
	
	/**
	 * Returns a map of keys and their corresponding parameter values (or defaults)
	 * @return
	 */
	public Map<String, Object> getKeyValueParameters() {
		Map<String, Object> map = new LinkedHashMap<String, Object>();
		for (Entry<String, Parameter<?>> entry : params.entrySet()) {
			map.put(entry.getKey(), entry.getValue().getValueOrDefault());
		}
		return map;
	}
	
	/**
	 * Returns true if a parameter exists in this list with a specified key.
	 * @param key
	 * @return
	 */
	public boolean containsKey(final Object key) {
		return params.containsKey(key);
	}
	
	/**
	 * Get a integer parameter value (or its default) for the specified key.
	 * @param key
	 * @return
	 * @throws IllegalArgumentException if no integer parameter exists for the specified key
	 */
	public Integer getIntParameterValue(String key) {
		Parameter<?> p = params.get(key);
		if (p instanceof IntParameter)
			return ((IntParameter)p).getValueOrDefault();
		throw new IllegalArgumentException("No integer parameter with key '" + key + "'");
	}
	
	/**
	 * Set an integer parameter value for the specified key.
	 * @param key
	 * @param value
	 * @throws IllegalArgumentException if no integer parameter exists for the specified key, or the value is invalid
	 */
	public void setIntParameterValue(String key, int value) {
		Parameter<?> p = params.get(key);
		if (!(p instanceof IntParameter))
			throw new IllegalArgumentException("No integer parameter with key '" + key + "'");
		if (!((IntParameter)p).setValue(value))
			throw new IllegalArgumentException("Invalid value " + value + " for parameter '" + key + "'");
	}
	
	/**
	 * Update a ParameterList with the values specified in a map.
	 * Unknown keys and invalid values are logged and skipped.
	 * 
	 * @param params
	 * @param mapNew
	 * @param locale The Locale to use for any parsing required.
	 * @return true if all values could be set
	 */
	public static boolean updateParameterList(ParameterList params, Map<String, String> mapNew, Locale locale) {
		Map<String, Parameter<?>> mapParams = params.getParameters();
		boolean allSet = true;
		for (Entry<String, String> entry : mapNew.entrySet()) {
			String key = entry.getKey();
			Parameter<?> parameter = mapParams.get(key);
			if (parameter == null || !parameter.setStringValue(locale, entry.getValue())) {
				logger.warn("Unable to set parameter {} with value {}", key, entry.getValue());
				allSet = false;
			}
		}
		return allSet;
	}

	@Override
	public String toString() {
		return "ParameterList" + getKeyValueParameters();
	}

}
