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
import java.util.Arrays;
import java.util.Collections;
import java.util.List;
import java.util.Map;
import java.util.SortedSet;
import java.util.TreeMap;
import java.util.TreeSet;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import objectflow.lib.measurements.FeatureColumn;
import objectflow.lib.measurements.FeatureSelection;
import objectflow.lib.measurements.FeatureSet;
import objectflow.lib.measurements.FloatMatrix;
import objectflow.lib.objects.LabelArray;
import objectflow.lib.objects.TimeObject;

/**
 * Build dense feature matrices from per-object {@link FeatureSet}s.
 * <p>
 * Columns are ordered by plugin name, then feature name, then channel; 
 * the reserved {@link FeatureSet#DEFAULT_FEATURES_KEY} plugin is never included.
 * Rows are ordered by time, then object index.
 */
public class FeatureMatrixBuilder {
	
	private static final Logger logger = LoggerFactory.getLogger(FeatureMatrixBuilder.class);
	
	private FeatureMatrixBuilder() {
		throw new AssertionError();
	}
	
	/**
	 * Build a feature matrix containing every object (including the background row) at the requested times.
	 * @param features features per time point
	 * @param selected selected features
	 * @return
	 * @throws ConfigurationException if the features are inconsistent across time points
	 */
	public static FeatureMatrix build(Map<Integer, FeatureSet> features, FeatureSelection selected) {
		return build(features, selected, null);
	}
	
	/**
	 * Build a feature matrix.
	 * <p>
	 * If labels are supplied, only objects with a nonzero label are included and the labels are 
	 * returned in the same order as the rows. The background (object 0) is never included in this case.
	 * Only time points that are found in both maps are used.
	 * 
	 * @param features features per time point
	 * @param selected selected features
	 * @param labels labels per time point, or null
	 * @return
	 * @throws ConfigurationException if the features are inconsistent across time points
	 */
	public static FeatureMatrix build(Map<Integer, FeatureSet> features, FeatureSelection selected, Map<Integer, LabelArray> labels) {
		
		List<FeatureColumn> columns = null;
		List<FloatMatrix> blocks = new ArrayList<>();
		List<TimeObject> rowIds = new ArrayList<>();
		List<Integer> labelList = labels == null ? null : new ArrayList<>();
		
		for (var entry : new TreeMap<>(features).entrySet()) {
			int t = entry.getKey();
			var featureSet = entry.getValue();
			if (featureSet == null)
				throw new ConfigurationException("No features available for time point " + t);
			
			LabelArray timeLabels = null;
			if (labels != null) {
				timeLabels = labels.get(t);
				if (timeLabels == null)
					continue;
			}
			
			List<FeatureColumn> timeColumns = new ArrayList<>();
			List<FloatMatrix> timeFeatures = new ArrayList<>();
			for (String plugin : featureSet.getPlugins()) {
				if (FeatureSet.DEFAULT_FEATURES_KEY.equals(plugin) || !selected.containsPlugin(plugin))
					continue;
				for (var featureEntry : featureSet.getFeatures(plugin).entrySet()) {
					String name = featureEntry.getKey();
					if (!selected.contains(plugin, name))
						continue;
					var values = featureEntry.getValue();
					for (int c = 0; c < values.nCols(); c++)
						timeColumns.add(new FeatureColumn(plugin, name, c));
					timeFeatures.add(values);
				}
			}
			if (columns == null)
				columns = timeColumns;
			else if (!columns.equals(timeColumns))
				throw new ConfigurationException("Different time points do not have the same features: " + columns + " and " + timeColumns + " (time " + t + ")");
			
			int nObjects = timeFeatures.isEmpty() ? 0 : timeFeatures.get(0).nRows();
			for (var mat : timeFeatures) {
				if (mat.nRows() != nObjects)
					throw new ConfigurationException("Features at time " + t + " have different numbers of objects (" + nObjects + " and " + mat.nRows() + ")");
			}
			
			int[] rows;
			if (timeLabels == null) {
				rows = new int[nObjects];
				for (int i = 0; i < nObjects; i++)
					rows[i] = i;
			} else {
				rows = timeLabels.nonZeroIndices();
				int nValid = 0;
				for (int id : rows) {
					if (id == 0) {
						logger.warn("Ignoring label {} assigned to background at time {}", timeLabels.get(0), t);
						continue;
					}
					if (id >= nObjects) {
						logger.warn("Ignoring label for object {} at time {}: features are only available for {} objects", id, t, nObjects);
						continue;
					}
					rows[nValid++] = id;
				}
				if (nValid < rows.length)
					rows = Arrays.copyOf(rows, nValid);
			}
			
			int nCols = timeColumns.size();
			var block = FloatMatrix.zeros(rows.length, nCols);
			for (int r = 0; r < rows.length; r++) {
				int c = 0;
				for (var mat : timeFeatures) {
					for (int ch = 0; ch < mat.nCols(); ch++)
						block.set(r, c++, mat.get(rows[r], ch));
				}
				rowIds.add(TimeObject.of(t, rows[r]));
				if (labelList != null)
					labelList.add(timeLabels.get(rows[r]));
			}
			blocks.add(block);
		}
		
		if (columns == null)
			columns = Collections.emptyList();
		var data = blocks.isEmpty() ? FloatMatrix.zeros(0, columns.size()) : FloatMatrix.concatenateRows(blocks);
		
		SortedSet<Integer> badRows = new TreeSet<>();
		SortedSet<Integer> badColumns = new TreeSet<>();
		replaceMissing(data, badRows, badColumns);
		
		int[] labelArray = labelList == null ? null : labelList.stream().mapToInt(i -> i).toArray();
		return new FeatureMatrix(data, rowIds, new ArrayList<>(columns), labelArray, badRows, badColumns);
	}
	
	/**
	 * Replace all non-finite values in a matrix by {@link FeatureMatrix#MISSING_VALUE}, 
	 * recording the rows and columns where they occurred.
	 * @param mat
	 * @param badRows
	 * @param badColumns
	 * @return true if any value was replaced
	 */
	static boolean replaceMissing(FloatMatrix mat, SortedSet<Integer> badRows, SortedSet<Integer> badColumns) {
		boolean changes = false;
		for (int r = 0; r < mat.nRows(); r++) {
			for (int c = 0; c < mat.nCols(); c++) {
				if (!Float.isFinite(mat.get(r, c))) {
					mat.set(r, c, FeatureMatrix.MISSING_VALUE);
					badRows.add(r);
					badColumns.add(c);
					changes = true;
				}
			}
		}
		return changes;
	}

}
