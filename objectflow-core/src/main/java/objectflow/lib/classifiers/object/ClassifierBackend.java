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

import objectflow.lib.measurements.FloatMatrix;

/**
 * Trains individual ensemble members.
 * <p>
 * Implementations must be safe to call concurrently from several threads.
 */
public interface ClassifierBackend {
	
	/**
	 * Train a classifier.
	 * @param features matrix of objects × features, containing only finite values
	 * @param labels label of each row, all > 0
	 * @param seed seed for any random number generation
	 * @return the trained classifier
	 */
	ClassifierHandle train(FloatMatrix features, int[] labels, long seed);

}
