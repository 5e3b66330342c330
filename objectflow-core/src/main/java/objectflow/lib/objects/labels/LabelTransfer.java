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

package objectflow.lib.objects.labels;

import java.util.ArrayList;
import java.util.List;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import objectflow.lib.objects.LabelArray;
import objectflow.lib.objects.ObjectBoundingBoxes;

/**
 * Transfer object labels from an old segmentation to a new segmentation, 
 * by matching the bounding boxes of old and new objects.
 * <p>
 * For each labeled old object the new object with the largest bounding box overlap receives its label.
 * If an old object overlaps no new object, or has no bounding box, its label is lost; if it overlaps several, 
 * only the best match is kept. New objects claimed by more than one old object are left unlabeled.
 * Background (object 0) is never matched and always receives label 0.
 */
public class LabelTransfer {
	
	private static final Logger logger = LoggerFactory.getLogger(LabelTransfer.class);
	
	private LabelTransfer() {
		throw new AssertionError();
	}
	
	/**
	 * Transfer labels between segmentations.
	 * @param oldLabels labels of the old objects
	 * @param oldBoxes bounding boxes of the old objects
	 * @param newBoxes bounding boxes of the new objects
	 * @return
	 * @throws IllegalArgumentException if the old and new bounding boxes have different dimensions
	 */
	public static LabelTransferResult transfer(LabelArray oldLabels, ObjectBoundingBoxes oldBoxes, ObjectBoundingBoxes newBoxes) {
		if (oldBoxes.nDimensions() != newBoxes.nDimensions())
			throw new IllegalArgumentException("Cannot transfer labels between " + oldBoxes.nDimensions() + "D and " + newBoxes.nDimensions() + "D objects");
		
		List<double[]> full = new ArrayList<>();
		List<double[]> partial = new ArrayList<>();
		List<double[]> conflict = new ArrayList<>();
		
		List<Box> oldObjects = new ArrayList<>();
		List<Integer> oldObjectLabels = new ArrayList<>();
		for (int id : oldLabels.nonZeroIndices()) {
			if (id >= oldBoxes.nObjects()) {
				// Location unknown
				logger.warn("No bounding box for labeled object {} (only {} objects), label cannot be transferred", id, oldBoxes.nObjects());
				full.add(new double[] {Double.NaN, Double.NaN, Double.NaN});
				continue;
			}
			oldObjects.add(new Box(oldBoxes, id));
			oldObjectLabels.add(oldLabels.get(id));
		}
		
		// New object 0 is the background
		int nNew = Math.max(newBoxes.nObjects() - 1, 0);
		List<Box> newObjects = new ArrayList<>(nNew);
		for (int id = 1; id <= nNew; id++)
			newObjects.add(new Box(newBoxes, id));
		
		// Best match for each old object, or -1
		int nOld = oldObjects.size();
		int[] match = new int[nOld];
		for (int i = 0; i < nOld; i++) {
			Box box = oldObjects.get(i);
			double sum = 0;
			double best = 0;
			int bestInd = -1;
			for (int j = 0; j < nNew; j++) {
				double overlap = box.overlap(newObjects.get(j));
				sum += overlap;
				if (overlap > best) {
					best = overlap;
					bestInd = j;
				}
			}
			match[i] = bestInd;
			if (sum == 0) {
				full.add(box.centroid());
				continue;
			}
			if (sum - best > 0)
				partial.add(box.centroid());
		}
		
		LabelArray newLabels = LabelArray.ofSize(newBoxes.nObjects());
		for (int j = 0; j < nNew; j++) {
			int count = 0;
			int label = 0;
			for (int i = 0; i < nOld; i++) {
				if (match[i] == j) {
					count++;
					label = oldObjectLabels.get(i);
				}
			}
			if (count == 1)
				newLabels.set(j + 1, label);
			else if (count > 1)
				conflict.add(newObjects.get(j).centroid());
		}
		
		var result = new LabelTransferResult(newLabels, full, partial, conflict);
		logger.debug("Transferred {} labels to {} new objects: {}", nOld, nNew, result);
		return result;
	}
	
	
	/**
	 * Bounding box described by its centre and half extent, always in 3D.
	 * A box covering a single pixel along an axis has a half extent of 0.5.
	 */
	private static class Box {
		
		private final double[] centre = new double[3];
		private final double[] radius = new double[3];
		private final boolean is3D;
		
		Box(ObjectBoundingBoxes boxes, int id) {
			is3D = boxes.nDimensions() == 3;
			for (int d = 0; d < boxes.nDimensions(); d++) {
				double min = boxes.getMin(id, d);
				double max = boxes.getMax(id, d);
				// Maximum is inclusive
				radius[d] = 0.5 * (max - min + 1);
				centre[d] = 0.5 * (min + max);
			}
		}
		
		double overlap(Box other) {
			int n = is3D ? 3 : 2;
			double product = 1;
			for (int d = 0; d < n; d++) {
				double overlap = radius[d] + other.radius[d] - Math.abs(centre[d] - other.centre[d]);
				if (overlap <= 0)
					return 0;
				product *= overlap;
			}
			return product;
		}
		
		double[] centroid() {
			return centre.clone();
		}
		
	}

}
