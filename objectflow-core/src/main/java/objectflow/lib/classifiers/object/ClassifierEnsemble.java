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
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Future;

import objectflow.lib.common.ThreadTools;
import objectflow.lib.measurements.FeatureColumn;
import objectflow.lib.measurements.FloatMatrix;

/**
 * An immutable collection of independently trained classifiers, whose probabilities are averaged.
 * <p>
 * An ensemble always contains every member that was requested; 
 * a failed training never produces an ensemble.
 */
public class ClassifierEnsemble {
	
	private final List<ClassifierHandle> members;
	private final List<FeatureColumn> columns;
	
	/**
	 * Constructor.
	 * @param members trained classifiers
	 * @param columns feature columns used for training, or an empty list if unknown
	 */
	public ClassifierEnsemble(List<? extends ClassifierHandle> members, List<FeatureColumn> columns) {
		if (members.isEmpty())
			throw new IllegalArgumentException("An ensemble needs at least one member");
		this.members = List.copyOf(members);
		this.columns = List.copyOf(columns);
	}
	
	/**
	 * @return the ensemble members
	 */
	public List<ClassifierHandle> getMembers() {
		return members;
	}
	
	/**
	 * @return number of members
	 */
	public int size() {
		return members.size();
	}
	
	/**
	 * @return the feature columns used for training
	 */
	public List<FeatureColumn> getColumns() {
		return columns;
	}
	
	/**
	 * @return the maximum number of classes of any member
	 */
	public int nClasses() {
		int n = 0;
		for (var member : members)
			n = Math.max(n, member.nClasses());
		return n;
	}
	
	/**
	 * @return the mean out-of-bag error of all members
	 */
	public double getMeanOutOfBagError() {
		double sum = 0;
		for (var member : members)
			sum += member.getOutOfBagError();
		return sum / members.size();
	}
	
	/**
	 * Predict probabilities with every member in parallel, and average the results element-wise.
	 * @param features
	 * @param pool pool used to run the members
	 * @return matrix of objects × {@link #nClasses()}
	 * @throws InterruptedException if interrupted while waiting for the members
	 */
	public FloatMatrix predictProbabilities(FloatMatrix features, ExecutorService pool) throws InterruptedException {
		List<Future<FloatMatrix>> futures = new ArrayList<>();
		for (var member : members)
			futures.add(pool.submit(() -> member.predictProbabilities(features)));
		var results = ThreadTools.awaitAll(futures);
		
		var output = FloatMatrix.zeros(features.nRows(), nClasses());
		for (var result : results) {
			if (result.nRows() != output.nRows())
				throw new IllegalStateException("Classifier returned " + result.nRows() + " rows for " + output.nRows() + " objects");
			for (int r = 0; r < result.nRows(); r++) {
				for (int c = 0; c < result.nCols(); c++)
					output.set(r, c, output.get(r, c) + result.get(r, c));
			}
		}
		float n = results.size();
		float[] data = output.getData();
		for (int i = 0; i < data.length; i++)
			data[i] /= n;
		return output;
	}
	
	/**
	 * Get the feature importance of each member, where available.
	 * @return a list with one entry per member (null where unavailable)
	 */
	public List<double[]> getFeatureImportance() {
		List<double[]> list = new ArrayList<>();
		for (var member : members)
			list.add(member.getFeatureImportance());
		return Collections.unmodifiableList(list);
	}
	
	@Override
	public String toString() {
		return "ClassifierEnsemble[" + members.size() + " members, " + nClasses() + " classes]";
	}

}
