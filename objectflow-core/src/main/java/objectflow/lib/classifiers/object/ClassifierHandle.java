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
 * A trained classifier that can predict class probabilities for feature vectors.
 * <p>
 * Classes correspond to the labels 1..{@link #nClasses()}; column {@code c} of the probability 
 * matrix holds the probability of label {@code c + 1}.
 */
public interface ClassifierHandle {
	
	/**
	 * Predict class probabilities.
	 * @param features matrix of objects × features, with the same columns used for training
	 * @return matrix of objects × {@link #nClasses()}
	 */
	FloatMatrix predictProbabilities(FloatMatrix features);
	
	/**
	 * Out-of-bag error estimated during training, used for diagnostics only.
	 * @return the error, or NaN if unavailable
	 */
	double getOutOfBagError();
	
	/**
	 * @return the number of probability columns, i.e. the maximum label used for training
	 */
	int nClasses();
	
	/**
	 * Relative importance of each feature column, if the classifier can provide it.
	 * @return an array with one value per feature column, or null
	 */
	default double[] getFeatureImportance() {
		return null;
	}

}
