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

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Locale;
import java.util.Map;
import java.util.Map.Entry;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * A collection of Parameters, which can be displayed to a user to set the options for one operation.
 * <p>
 * Parameters are stored by key, in insertion order. For an operation, the keys are the same
 * as the field names used when serializing the corresponding request (e.g. 'sigma', 'new_min').
 */
public class ParameterList {

	private static final Logger logger = LoggerFactory.getLogger(ParameterList.class);

	private final Map<String, Parameter<?>> params = new LinkedHashMap<>();

	private int titleCount = 1;
	private int emptyCount = 1;

	/**
	 * Create a deep copy of this parameter list.
	 * @return
	 */
	public ParameterList duplicate() {
		ParameterList paramsCopy = new ParameterList();
		for (Entry<String, Parameter<?>> entry : params.entrySet()) {
			paramsCopy.params.put(entry.getKey(), entry.getValue().duplicate());
		}
		paramsCopy.titleCount = titleCount;
		paramsCopy.emptyCount = emptyCount;
		return paramsCopy;
	}

	/**
	 * Add an unbounded double parameter.
	 * @param key
	 * @param prompt
	 * @param defaultValue
	 * @return this parameter list
	 */
	public ParameterList addDoubleParameter(String key, String prompt, double defaultValue) {
		return addDoubleParameter(key, prompt, defaultValue, null, Double.NEGATIVE_INFINITY, Double.POSITIVE_INFINITY, null);
	}

	/**
	 * Add a bounded double parameter.
	 * @param key
	 * @param prompt
	 * @param defaultValue
	 * @param unit
	 * @param lowerBound
	 * @param upperBound
	 * @param helpText
	 * @return this parameter list
	 */
	public ParameterList addDoubleParameter(String key, String prompt, double defaultValue, String unit, double lowerBound, double upperBound, String helpText) {
		params.put(key, new DoubleParameter(prompt, defaultValue, unit, lowerBound, upperBound, null, helpText));
		return this;
	}

	/**
	 * Add an unbounded integer parameter.
	 * @param key
	 * @param prompt
	 * @param defaultValue
	 * @return this parameter list
	 */
	public ParameterList addIntParameter(String key, String prompt, int defaultValue) {
		return addIntParameter(key, prompt, defaultValue, null, Double.NEGATIVE_INFINITY, Double.POSITIVE_INFINITY, null);
	}

	/**
	 * Add a bounded integer parameter.
	 * @param key
	 * @param prompt
	 * @param defaultValue
	 * @param unit
	 * @param lowerBound
	 * @param upperBound
	 * @param helpText
	 * @return this parameter list
	 */
	public ParameterList addIntParameter(String key, String prompt, int defaultValue, String unit, double lowerBound, double upperBound, String helpText) {
		params.put(key, new IntParameter(prompt, defaultValue, unit, lowerBound, upperBound, null, helpText));
		return this;
	}

	/**
	 * Add a string parameter.
	 * @param key
	 * @param prompt
	 * @param defaultValue
	 * @param helpText
	 * @return this parameter list
	 */
	public ParameterList addStringParameter(String key, String prompt, String defaultValue, String helpText) {
		params.put(key, new StringParameter(prompt, defaultValue, null, helpText));
		return this;
	}

	/**
	 * Add a parameter that only displays text.
	 * @param prompt
	 * @return this parameter list
	 */
	public ParameterList addEmptyParameter(String prompt) {
		params.put("empty" + emptyCount, new EmptyParameter(prompt, false));
		emptyCount++;
		return this;
	}

	/**
	 * Add a parameter that displays a title.
	 * @param prompt
	 * @return this parameter list
	 */
	public ParameterList addTitleParameter(String prompt) {
		params.put("title" + titleCount, new EmptyParameter(prompt, true));
		titleCount++;
		return this;
	}

	/**
	 * Get an unmodifiable map of all parameters.
	 * @return
	 */
	public Map<String, Parameter<?>> getParameters() {
		return Collections.unmodifiableMap(params);
	}

	/**
	 * Get a parameter by key.
	 * @param key
	 * @return the parameter, or null if no parameter exists with the key
	 */
	public Parameter<?> getParameter(String key) {
		return params.get(key);
	}

	/**
	 * Get a map of keys to current values (or defaults), skipping any {@link EmptyParameter EmptyParameters}.
	 * @return
	 */
	public Map<String, Object> getKeyValueParameters() {
		Map<String, Object> map = new LinkedHashMap<>();
		for (Entry<String, Parameter<?>> entry : params.entrySet()) {
			Parameter<?> p = entry.getValue();
			if (p instanceof EmptyParameter)
				continue;
			map.put(entry.getKey(), p.getValueOrDefault());
		}
		return map;
	}

	/**
	 * Returns true if a parameter exists with the key.
	 * @param key
	 * @return
	 */
	public boolean containsKey(final String key) {
		return params.containsKey(key);
	}

	/**
	 * Get the value of a double parameter.
	 * @param key
	 * @return
	 * @throws IllegalArgumentException if there is no double parameter with the key
	 */
	public Double getDoubleParameterValue(String key) {
		Parameter<?> p = params.get(key);
		if (p instanceof DoubleParameter)
			return ((DoubleParameter)p).getValueOrDefault();
		throw new IllegalArgumentException("No double parameter with key '" + key + "'");
	}

	/**
	 * Get the value of an integer parameter.
	 * @param key
	 * @return
	 * @throws IllegalArgumentException if there is no integer parameter with the key
	 */
	public Integer getIntParameterValue(String key) {
		Parameter<?> p = params.get(key);
		if (p instanceof IntParameter)
			return ((IntParameter)p).getValueOrDefault();
		throw new IllegalArgumentException("No integer parameter with key '" + key + "'");
	}

	/**
	 * Get the value of a string parameter.
	 * @param key
	 * @return
	 * @throws IllegalArgumentException if there is no string parameter with the key
	 */
	public String getStringParameterValue(String key) {
		Parameter<?> p = params.get(key);
		if (p instanceof StringParameter)
			return ((StringParameter)p).getValueOrDefault();
		throw new IllegalArgumentException("No String parameter with key '" + key + "'");
	}

	/**
	 * Set a parameter value from a string, as it may be entered by a user.
	 * @param key
	 * @param value
	 * @param locale
	 * @return true if the value was set, false if the key is unknown or the value is invalid
	 */
	public boolean setStringValue(String key, String value, Locale locale) {
		Parameter<?> parameter = params.get(key);
		if (parameter == null || !parameter.setStringValue(locale, value)) {
			logger.warn("Unable to set parameter {} with value {}", key, value);
			return false;
		}
		return true;
	}

	/**
	 * Update a parameter list with values from a map of strings.
	 * Keys that cannot be set are logged and skipped.
	 * @param params
	 * @param mapNew
	 * @param locale
	 * @return the number of parameters that were successfully updated
	 */
	public static int updateParameterList(ParameterList params, Map<String, String> mapNew, Locale locale) {
		int count = 0;
		for (Entry<String, String> entry : mapNew.entrySet()) {
			if (params.setStringValue(entry.getKey(), entry.getValue(), locale))
				count++;
		}
		return count;
	}

	@Override
	public String toString() {
		return "ParameterList " + getKeyValueParameters();
	}

}
