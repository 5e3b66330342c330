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

package objectflow.lib.measurements;

import java.util.Arrays;
import java.util.List;

/**
 * A dense 2D matrix of 32-bit floating point values, stored in row-major order.
 * <p>
 * Used for per-object feature arrays (objects × channels), feature matrices for training 
 * and class probabilities (objects × classes).
 */
public class FloatMatrix {
	
	private final int nRows;
	private final int nCols;
	private final float[] data;
	
	private FloatMatrix(int nRows, int nCols, float[] data) {
		this.nRows = nRows;
		this.nCols = nCols;
		this.data = data;
	}
	
	/**
	 * Create a matrix filled with zeros.
	 * @param nRows
	 * @param nCols
	 * @return
	 */
	public static FloatMatrix zeros(int nRows, int nCols) {
		if (nRows < 0 || nCols < 0)
			throw new IllegalArgumentException("Matrix dimensions must be >= 0, but got " + nRows + "x" + nCols);
		return new FloatMatrix(nRows, nCols, new float[nRows * nCols]);
	}
	
	/**
	 * Wrap an existing row-major array (not copied).
	 * @param nRows
	 * @param nCols
	 * @param data
	 * @return
	 */
	public static FloatMatrix wrap(int nRows, int nCols, float[] data) {
		if (data.length != nRows * nCols)
			throw new IllegalArgumentException("Array length " + data.length + " does not match " + nRows + "x" + nCols);
		return new FloatMatrix(nRows, nCols, data);
	}
	
	/**
	 * Create a matrix from rows, which must all have the same length.
	 * @param rows
	 * @return
	 */
	public static FloatMatrix fromRows(float[]... rows) {
		int nCols = rows.length == 0 ? 0 : rows[0].length;
		float[] data = new float[rows.length * nCols];
		for (int r = 0; r < rows.length; r++) {
			if (rows[r].length != nCols)
				throw new IllegalArgumentException("Row " + r + " has length " + rows[r].length + ", expected " + nCols);
			System.arraycopy(rows[r], 0, data, r * nCols, nCols);
		}
		return new FloatMatrix(rows.length, nCols, data);
	}
	
	/**
	 * Create a single-column matrix.
	 * @param values
	 * @return
	 */
	public static FloatMatrix column(float... values) {
		return new FloatMatrix(values.length, 1, values.clone());
	}
	
	/**
	 * Concatenate matrices with the same number of columns, one below the other.
	 * @param matrices
	 * @return
	 */
	public static FloatMatrix concatenateRows(List<FloatMatrix> matrices) {
		if (matrices.isEmpty())
			return zeros(0, 0);
		int nCols = matrices.get(0).nCols;
		int nRows = 0;
		for (var mat : matrices) {
			if (mat.nCols != nCols)
				throw new IllegalArgumentException("Cannot concatenate matrices with " + nCols + " and " + mat.nCols + " columns");
			nRows += mat.nRows;
		}
		float[] data = new float[nRows * nCols];
		int offset = 0;
		for (var mat : matrices) {
			System.arraycopy(mat.data, 0, data, offset, mat.data.length);
			offset += mat.data.length;
		}
		return new FloatMatrix(nRows, nCols, data);
	}
	
	/**
	 * @return number of rows
	 */
	public int nRows() {
		return nRows;
	}
	
	/**
	 * @return number of columns
	 */
	public int nCols() {
		return nCols;
	}
	
	/**
	 * @return true if the matrix contains no values
	 */
	public boolean isEmpty() {
		return data.length == 0;
	}
	
	/**
	 * Get a single value.
	 * @param row
	 * @param col
	 * @return
	 */
	public float get(int row, int col) {
		return data[row * nCols + col];
	}
	
	/**
	 * Set a single value.
	 * @param row
	 * @param col
	 * @param value
	 */
	public void set(int row, int col, float value) {
		data[row * nCols + col] = value;
	}
	
	/**
	 * Get a copy of a row.
	 * @param row
	 * @return
	 */
	public float[] getRow(int row) {
		return Arrays.copyOfRange(data, row * nCols, (row + 1) * nCols);
	}
	
	/**
	 * Get a copy of a column.
	 * @param col
	 * @return
	 */
	public float[] getColumn(int col) {
		float[] output = new float[nRows];
		for (int r = 0; r < nRows; r++)
			output[r] = data[r * nCols + col];
		return output;
	}
	
	/**
	 * Direct access to the underlying row-major array.
	 * @return
	 */
	public float[] getData() {
		return data;
	}
	
	/**
	 * @return a deep copy of this matrix
	 */
	public FloatMatrix copy() {
		return new FloatMatrix(nRows, nCols, data.clone());
	}
	
	@Override
	public String toString() {
		return "FloatMatrix[" + nRows + "x" + nCols + "]";
	}

}
