/*-
 * #%L
 * This file is part of HOGcv.
 * %%
 * Copyright (C) 2024 HOGcv developers
 * %%
 * HOGcv is free software: you can redistribute it and/or modify
 * it under the terms of the GNU General Public License as
 * published by the Free Software Foundation, either version 3 of the
 * License, or (at your option) any later version.
 * 
 * HOGcv is distributed in the hope that it will be useful,
 * but WITHOUT ANY WARRANTY; without even the implied warranty of
 * MERCHANTABILITY or FITNESS FOR A PARTICULAR PURPOSE.  See the
 * GNU General Public License for more details.
 * 
 * You should have received a copy of the GNU General Public License 
 * along with HOGcv.  If not, see <https://www.gnu.org/licenses/>.
 * #L%
 */

package hogcv.lib.analysis.features;

import static org.junit.jupiter.api.Assertions.assertArrayEquals;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;

import java.util.Random;

import org.junit.jupiter.api.Test;

import hogcv.lib.regions.ImageRegion;

@SuppressWarnings("javadoc")
public class TestWindowRetriever {

	private static GradientField createRandomField(int width, int height, long seed) {
		var rng = new Random(seed);
		var magnitude = new float[width * height];
		var orientation = new float[width * height];
		for (int i = 0; i < magnitude.length; i++) {
			magnitude[i] = rng.nextFloat() * 10f;
			orientation[i] = rng.nextFloat() * 360f;
		}
		return GradientField.create(width, height, magnitude, orientation);
	}

	@Test
	public void test_mismatchedGrid() {
		var field = createRandomField(32, 32, 1L);
		var params = HogParameters.builder(16).build();
		var window = ImageRegion.createFullImage(32, 32);

		// Different binning
		var grid = CellHistogramGrid.build(field, params.toBuilder().binning(12).build());
		assertEquals(12, grid.getBinning());
		var retriever = new WindowRetriever(params);
		assertThrows(IllegalArgumentException.class, () -> retriever.retrieve(grid, window));

		// Different cell size
		var grid2 = CellHistogramGrid.build(field, params.toBuilder().cellSize(4).stride(4).build());
		assertEquals(4, grid2.getCellSize());
		assertThrows(IllegalArgumentException.class, () -> retriever.retrieve(grid2, window));

		assertThrows(NullPointerException.class, () -> retriever.retrieve(null, window));
	}

	@Test
	public void test_sharedGrid() {
		// Grids only depend on cell size, binning and gradient mode
		var field = createRandomField(32, 32, 2L);
		var params = HogParameters.builder(16).build();
		var grid = CellHistogramGrid.build(field, params);
		var window = ImageRegion.createInstance(8, 0, 24, 32);

		var other = params.toBuilder()
				.blockSize(8)
				.normalization(BlockNormalization.L1)
				.build();
		var descriptor = new WindowRetriever(other).retrieve(grid, window);
		assertEquals(other.getDescriptorLength(24, 32), descriptor.length);

		var cache = new DescriptorCache(other);
		cache.process(field);
		assertArrayEquals(cache.retrieve(window), descriptor);
	}

}
