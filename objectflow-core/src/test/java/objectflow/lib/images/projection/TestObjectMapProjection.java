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

package objectflow.lib.images.projection;

import static org.junit.jupiter.api.Assertions.assertArrayEquals;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.util.ArrayList;
import java.util.List;

import org.junit.jupiter.api.Test;

import objectflow.lib.graph.DirtyRegion;
import objectflow.lib.images.SegmentationImage;
import objectflow.lib.measurements.FloatMatrix;
import objectflow.lib.regions.ImageRegion;

@SuppressWarnings("javadoc")
public class TestObjectMapProjection {
	
	private static FloatMatrix column = FloatMatrix.column(0, 10, 20, 30);
	private static FloatMatrix column2 = FloatMatrix.column(0, 10, 20, 30, 40, 50);
	
	@Test
	public void test_mapValues() {
		var image = ProjectionTestUtils.createImage();
		var mapping = ProjectionTestUtils.createMapping(column, column, column2);
		var projection = new ObjectMapProjection("Test", image, mapping, ProjectionTestUtils.createFeatures(), 1);
		
		var values = projection.readRegion(ImageRegion.createFullSlice(0, ProjectionTestUtils.SHAPE));
		assertArrayEquals(new float[] {
				0, 10, 10, 0, 0, 0,
				0, 10, 10, 0, 20, 20,
				0, 0, 0, 0, 20, 20,
				30, 30, 0, 0, 0, 0}, values);
		
		values = projection.readRegion(ImageRegion.createInstance(2, new int[] {3, 1}, new int[] {6, 2}));
		assertArrayEquals(new float[] {0, 50, 50}, values);
	}
	
	@Test
	public void test_shortAndEmptyMappings() {
		var image = ProjectionTestUtils.createImage();
		var mapping = ProjectionTestUtils.createMapping(FloatMatrix.column(0, 10), FloatMatrix.zeros(0, 0));
		var projection = new ObjectMapProjection("Test", image, mapping, ProjectionTestUtils.createFeatures(), 1);
		
		var values = projection.readRegion(ImageRegion.createInstance(0, new int[] {0, 1}, new int[] {6, 2}));
		assertArrayEquals(new float[] {0, 10, 10, 0, 0, 0}, values);
		
		values = projection.readRegion(ImageRegion.createFullSlice(1, ProjectionTestUtils.SHAPE));
		assertEquals(24, values.length);
		for (float v : values)
			assertEquals(0f, v);
	}
	
	@Test
	public void test_multipleChannels() {
		var image = ProjectionTestUtils.createImage();
		var mapping = ProjectionTestUtils.createMapping(FloatMatrix.fromRows(
				new float[] {0, 0}, new float[] {1, 2}, new float[] {3, 4}, new float[] {5, 6}));
		var projection = new ObjectMapProjection("Test", image, mapping, ProjectionTestUtils.createFeatures(), 2);
		assertEquals(2, projection.nChannels());
		var values = projection.readRegion(ImageRegion.createInstance(0, new int[] {0, 3}, new int[] {3, 4}));
		assertArrayEquals(new float[] {5, 6, 5, 6, 0, 0}, values);
		
		assertThrows(IllegalArgumentException.class, 
				() -> new ObjectMapProjection("Test", image, mapping, ProjectionTestUtils.createFeatures(), 0));
	}
	
	@Test
	public void test_objectDirtyAffectsBoundingBoxOnly() {
		var image = ProjectionTestUtils.createImage();
		var mapping = ProjectionTestUtils.createMapping(column, column, column2);
		var projection = new ObjectMapProjection("Test", image, mapping, ProjectionTestUtils.createFeatures(), 1);
		List<DirtyRegion> events = new ArrayList<>();
		projection.addDirtyListener(e -> events.add(e.getRegion()));
		
		mapping.setDirty(DirtyRegion.object(2, 5));
		assertEquals(List.of(DirtyRegion.spatial(ImageRegion.createInstance(2, new int[] {4, 1}, new int[] {6, 3}))), events);
		
		// No bounding box available
		events.clear();
		mapping.setDirty(DirtyRegion.object(1, 9));
		assertEquals(List.of(DirtyRegion.spatial(ImageRegion.createFullSlice(1, ProjectionTestUtils.SHAPE))), events);
	}
	
	@Test
	public void test_timeAndAllDirty() {
		var image = ProjectionTestUtils.createImage();
		var mapping = ProjectionTestUtils.createMapping(column, column, column2);
		var features = ProjectionTestUtils.createFeatures();
		var projection = new ObjectMapProjection("Test", image, mapping, features, 1);
		List<DirtyRegion> events = new ArrayList<>();
		projection.addDirtyListener(e -> events.add(e.getRegion()));
		
		mapping.setValue(1, column);
		assertEquals(List.of(DirtyRegion.spatial(ImageRegion.createFullSlice(1, ProjectionTestUtils.SHAPE))), events);
		
		events.clear();
		features.setDirty(DirtyRegion.all());
		assertEquals(List.of(DirtyRegion.all()), events);
		
		events.clear();
		projection.dispose();
		mapping.setDirty(DirtyRegion.all());
		assertTrue(events.isEmpty());
	}
	
	@Test
	public void test_imageDirtyForwarded() {
		var image = ProjectionTestUtils.createImage();
		var projection = new ObjectMapProjection("Test", image, ProjectionTestUtils.createMapping(column), ProjectionTestUtils.createFeatures(), 1);
		List<DirtyRegion> events = new ArrayList<>();
		projection.addDirtyListener(e -> events.add(e.getRegion()));
		
		var region = DirtyRegion.spatial(ImageRegion.createInstance(0, new int[] {0, 0}, new int[] {2, 2}));
		image.setImage(SegmentationImage.create2D(ProjectionTestUtils.SLICE, ProjectionTestUtils.SLICE, ProjectionTestUtils.SLICE), region);
		assertEquals(List.of(region), events);
	}

}
