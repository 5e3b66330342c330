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

package objectflow.lib.classifiers.object;

/**
 * Exception thrown when the inputs of object classification are inconsistent, 
 * e.g. a segmentation that is not integer-valued or features that differ between time points.
 */
public class ConfigurationException extends RuntimeException {

	private static final long serialVersionUID = 1L;
	
	/**
	 * Constructor.
	 * @param message
	 */
	public ConfigurationException(String message) {
		super(message);
	}

}
