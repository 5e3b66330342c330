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

package objectflow.opencv.ml;

import objectflow.lib.classifiers.object.ClassifierBackend;
import objectflow.lib.classifiers.object.ClassifierHandle;
import objectflow.lib.classifiers.object.ObjectClassifierParameters;
import objectflow.lib.classifiers.object.workflow.ObjectClassificationWorkflow;
import objectflow.lib.measurements.FloatMatrix;

/**
 * {@link ClassifierBackend} that trains OpenCV random forests.
 */
public class OpenCVClassifierBackend implements ClassifierBackend {
	
	private final ObjectClassifierParameters params;
	
	/**
	 * Constructor.
	 * @param params parameters for each forest; these are copied
	 */
	public OpenCVClassifierBackend(ObjectClassifierParameters params) {
		this.params = params.duplicate();
	}
	
	/**
	 * Create a workflow that trains random forests with the specified parameters.
	 * @param params
	 * @return
	 */
	public static ObjectClassificationWorkflow createWorkflow(ObjectClassifierParameters params) {
		return new ObjectClassificationWorkflow(new OpenCVClassifierBackend(params), params);
	}

	@Override
	public ClassifierHandle train(FloatMatrix features, int[] labels, long seed) {
		return RTreesObjectClassifier.train(features, labels, params, seed);
	}
	
	@Override
	public String toString() {
		return "OpenCV random trees (" + params.getTreeCount() + " trees)";
	}

}
