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

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Set;
import java.util.SortedSet;
import java.util.TreeSet;

import objectflow.lib.measurements.FeatureColumn;
import objectflow.lib.measurements.FloatMatrix;
import objectflow.lib.objects.TimeObject;

/**
 * A dense feature matrix built from per-object features, together with the identity of each row and column.
 * 
 * @see FeatureMatrixBuilder
 */
public class FeatureMatrix {
	
	/**
	 * Value used to replace NaN and infinite features.
	 */
	public static final float MISSING_VALUE = 0f;
	
	private final FloatMatrix data;
	private final List<TimeObject> rowIds;
	private final List<FeatureColumn> columns;
	private final int[] labels;
	private final SortedSet<Integer> badRows;
	private final SortedSet<Integer> badColumns;
	
	FeatureMatrix(FloatMatrix data, List<TimeObject> rowIds, List<FeatureColumn> columns, int[] labels, 
			SortedSet<Integer> badRows, SortedSet<Integer> badColumns) {
		this.data = data;
		this.rowIds = Collections.unmodifiableList(rowIds);
		this.columns = Collections.unmodifiableList(columns);
		this.labels = labels;
		this.badRows = Collections.unmodifiableSortedSet(badRows);
		this.badColumns = Collections.unmodifiableSortedSet(badColumns);
	}
	
	/**
	 * The feature values, with non-finite values replaced by {@link #MISSING_VALUE}.
	 * @return
	 */
	public FloatMatrix getData() {
		return data;
	}
	
	/**
	 * The (time, object) identity of each row.
	 * @return
	 */
	public List<TimeObject> getRowIds() {
		return rowIds;
	}
	
	/**
	 * The identity of each column.
	 * @return
	 */
	public List<FeatureColumn> getColumns() {
		return columns;
	}
	
	/**
	 * The label of each row, if labels were used to build the matrix.
	 * @return the labels, or null if the matrix was built without labels
	 */
	public int[] getLabels() {
		return labels == null ? null : labels.clone();
	}
	
	/**
	 * @return true if the matrix was built with labels
	 */
	public boolean hasLabels() {
		return labels != null;
	}
	
	/**
	 * @return number of rows
	 */
	public int nRows() {
		return data.nRows();
	}
	
	/**
	 * Indices of rows that contained at least one non-finite value.
	 * @return
	 */
	public SortedSet<Integer> getBadRows() {
		return badRows;
	}
	
	/**
	 * Indices of columns that contained at least one non-finite value.
	 * @return
	 */
	public SortedSet<Integer> getBadColumns() {
		return badColumns;
	}
	
	/**
	 * Get the objects corresponding to {@link #getBadRows()}.
	 * @return
	 */
	public List<TimeObject> getBadObjects() {
		List<TimeObject> list = new ArrayList<>(badRows.size());
		for (int r : badRows)
			list.add(rowIds.get(r));
		return list;
	}
	
	/**
	 * Get the names of the features corresponding to {@link #getBadColumns()}.
	 * @return
	 */
	public Set<String> getBadFeatureNames() {
		Set<String> names = new TreeSet<>();
		for (int c : badColumns)
			names.add(columns.get(c).getName());
		return names;
	}
	
	@Override
	public String toString() {
		return "FeatureMatrix[" + data.nRows() + " rows, " + data.nCols() + " columns" + 
				(labels == null ? "" : ", labelled") + "]";
	}

}
