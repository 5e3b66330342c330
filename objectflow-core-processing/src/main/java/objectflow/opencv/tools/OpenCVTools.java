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

package objectflow.opencv.tools;

import java.nio.FloatBuffer;
import java.nio.IntBuffer;

import org.bytedeco.opencv.global.opencv_core;
import org.bytedeco.opencv.opencv_core.Mat;

import objectflow.lib.measurements.FloatMatrix;

/**
 * Conversions between ObjectFlow arrays and OpenCV Mats.
 */
public class OpenCVTools {
	
	/**
	 * Create a single-channel 32-bit float Mat containing a copy of the values of a matrix.
	 * @param matrix
	 * @return
	 */
	public static Mat toMat(FloatMatrix matrix) {
		Mat mat = new Mat(matrix.nRows(), matrix.nCols(), opencv_core.CV_32FC1);
		FloatBuffer buffer = mat.createBuffer();
		buffer.put(matrix.getData());
		return mat;
	}
	
	/**
	 * Create a column Mat of signed 32-bit integers.
	 * @param values
	 * @return
	 */
	public static Mat toColumnMat(int[] values) {
		Mat mat = new Mat(values.length, 1, opencv_core.CV_32SC1);
		IntBuffer buffer = mat.createBuffer();
		buffer.put(values);
		return mat;
	}
	
	/**
	 * Extract the values of a single-channel Mat as doubles, in row-major order.
	 * @param mat
	 * @return
	 */
	public static double[] extractDoubles(Mat mat) {
		int n = (int)(mat.total() * mat.channels());
		double[] values = new double[n];
		int cols = mat.cols();
		try (var indexer = mat.createIndexer()) {
			for (int i = 0; i < n; i++)
				values[i] = indexer.getDouble(i / cols, i % cols);
		}
		return values;
	}

}
