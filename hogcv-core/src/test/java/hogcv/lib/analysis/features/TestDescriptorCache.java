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
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertNotSame;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;
import java.util.Random;
import java.util.concurrent.Callable;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;

import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.EnumSource;

import hogcv.lib.regions.ImageRegion;

@SuppressWarnings("javadoc")
public class TestDescriptorCache {

	// 8x6 pixels, giving 3 rows and 4 columns of 2x2 cells
	private static final int WIDTH = 8;
	private static final int HEIGHT = 6;

	private static final HogParameters SMALL_PARAMS = HogParameters.builder(4)
			.cellSize(2)
			.stride(2)
			.binning(4)
			.gradientMode(GradientMode.SIGNED)
			.normalization(BlockNormalization.NONE)
			.build();

	/**
	 * Create a field where every pixel of cell (r, c) has magnitude {@code 1 + r*4 + c} and 
	 * an orientation falling into bin {@code (r + c) % 4}.
	 */
	private static GradientField createLabeledField() {
		var magnitude = new float[WIDTH * HEIGHT];
		var orientation = new float[WIDTH * HEIGHT];
		for (int y = 0; y < HEIGHT; y++) {
			for (int x = 0; x < WIDTH; x++) {
				int r = y / 2;
				int c = x / 2;
				magnitude[y * WIDTH + x] = 1 + r * 4 + c;
				orientation[y * WIDTH + x] = 90f * ((r + c) % 4) + 1f;
			}
		}
		return GradientField.create(WIDTH, HEIGHT, magnitude, orientation);
	}

	private static float[] expectedCellHistogram(int r, int c) {
		var histogram = new float[4];
		histogram[(r + c) % 4] = 4 * (1 + r * 4 + c);
		return histogram;
	}

	private static GradientField createRandomField(int width, int height, long seed) {
		var rng = new Random(seed);
		var magnitude = new float[width * height];
		var orientation = new float[width * height];
		for (int i = 0; i < magnitude.length; i++) {
			magnitude[i] = rng.nextFloat() * 100f;
			orientation[i] = rng.nextFloat() * 360f;
		}
		return GradientField.create(width, height, magnitude, orientation);
	}

	@Test
	public void test_notProcessed() {
		var cache = new DescriptorCache(SMALL_PARAMS);
		assertFalse(cache.hasImage());
		assertThrows(IllegalStateException.class, () -> cache.retrieve(ImageRegion.createInstance(0, 0, 4, 4)));
		assertThrows(IllegalStateException.class, () -> cache.retrieve(List.of(ImageRegion.createInstance(0, 0, 4, 4))));
		assertThrows(IllegalStateException.class, () -> cache.getGrid());
		assertThrows(IllegalStateException.class, () -> cache.getGradientField());
	}

	@Test
	public void test_clear() {
		var cache = new DescriptorCache(SMALL_PARAMS);
		cache.process(createLabeledField());
		assertTrue(cache.hasImage());
		cache.clear();
		assertFalse(cache.hasImage());
		assertThrows(IllegalStateException.class, () -> cache.retrieve(ImageRegion.createInstance(0, 0, 4, 4)));
	}

	@Test
	public void test_imageTooSmall() {
		var cache = new DescriptorCache(SMALL_PARAMS);
		assertThrows(IllegalArgumentException.class, () -> cache.process(createRandomField(3, 10, 1L)));
		assertThrows(IllegalArgumentException.class, () -> cache.process(createRandomField(10, 3, 1L)));
		assertFalse(cache.hasImage());
		// Exactly one block is fine
		cache.process(createRandomField(4, 4, 1L));
		assertTrue(cache.hasImage());
	}

	@Test
	public void test_invalidWindows() {
		var cache = new DescriptorCache(SMALL_PARAMS);
		cache.process(createLabeledField());
		assertThrows(NullPointerException.class, () -> cache.retrieve((ImageRegion)null));
		// Smaller than a block
		assertThrows(IllegalArgumentException.class, () -> cache.retrieve(ImageRegion.createInstance(0, 0, 3, 6)));
		assertThrows(IllegalArgumentException.class, () -> cache.retrieve(ImageRegion.createInstance(0, 0, 8, 3)));
		// Outside the image
		assertThrows(IllegalArgumentException.class, () -> cache.retrieve(ImageRegion.createInstance(1, 0, 8, 6)));
		assertThrows(IllegalArgumentException.class, () -> cache.retrieve(ImageRegion.createInstance(0, 1, 8, 6)));
		assertThrows(IllegalArgumentException.class, () -> cache.retrieve(ImageRegion.createInstance(-1, 0, 4, 4)));
		assertThrows(IllegalArgumentException.class, () -> cache.retrieve(ImageRegion.createInstance(0, -2, 4, 4)));
		// A single bad window fails the whole batch
		assertThrows(IllegalArgumentException.class, () -> cache.retrieve(List.of(
				ImageRegion.createInstance(0, 0, 4, 4),
				ImageRegion.createInstance(6, 0, 4, 4))));
	}

	@Test
	public void test_grid() {
		var cache = new DescriptorCache(SMALL_PARAMS);
		cache.process(createLabeledField());
		var grid = cache.getGrid();
		assertEquals(3, grid.getRows());
		assertEquals(4, grid.getCols());
		assertEquals(4, grid.getBinning());
		assertEquals(WIDTH, grid.getImageWidth());
		assertEquals(HEIGHT, grid.getImageHeight());
		for (int r = 0; r < 3; r++) {
			for (int c = 0; c < 4; c++)
				assertArrayEquals(expectedCellHistogram(r, c), grid.getHistogram(r, c));
		}
		assertThrows(IndexOutOfBoundsException.class, () -> grid.getHistogram(3, 0));
		assertThrows(IndexOutOfBoundsException.class, () -> grid.getHistogram(0, 4));
		assertThrows(IndexOutOfBoundsException.class, () -> grid.getHistogram(-1, 0));
	}

	@Test
	public void test_partialCellsIgnored() {
		// 9x7 has the same 3x4 cells as 8x6
		var rng = new Random(10L);
		var magnitude = new float[9 * 7];
		var orientation = new float[9 * 7];
		for (int i = 0; i < magnitude.length; i++) {
			magnitude[i] = rng.nextFloat();
			orientation[i] = rng.nextFloat() * 360f;
		}
		var grid = CellHistogramGrid.build(GradientField.create(9, 7, magnitude, orientation), SMALL_PARAMS);
		assertEquals(3, grid.getRows());
		assertEquals(4, grid.getCols());
	}

	@Test
	public void test_blockOrder() {
		var cache = new DescriptorCache(SMALL_PARAMS);
		cache.process(createLabeledField());
		var descriptor = cache.retrieve(ImageRegion.createFullImage(WIDTH, HEIGHT));

		// 2 block rows x 3 block columns, each of 2x2 cells with 4 bins
		assertEquals(96, descriptor.length);
		assertEquals(SMALL_PARAMS.getDescriptorLength(WIDTH, HEIGHT), descriptor.length);

		var expected = new float[96];
		int offset = 0;
		for (int by = 0; by < 2; by++) {
			for (int bx = 0; bx < 3; bx++) {
				for (int r = by; r < by + 2; r++) {
					for (int c = bx; c < bx + 2; c++) {
						System.arraycopy(expectedCellHistogram(r, c), 0, expected, offset, 4);
						offset += 4;
					}
				}
			}
		}
		assertArrayEquals(expected, descriptor);

		// First block starts with cell (0, 0): magnitude 1 x 4 pixels in bin 0
		assertEquals(4f, descriptor[0]);
		// Second cell of the first block is (0, 1): magnitude 2 x 4 pixels in bin 1
		assertEquals(8f, descriptor[5]);
		// Third cell of the first block is (1, 0): magnitude 5 x 4 pixels in bin 1
		assertEquals(20f, descriptor[9]);
	}

	@Test
	public void test_offsetWindow() {
		var cache = new DescriptorCache(SMALL_PARAMS);
		cache.process(createLabeledField());

		// Starts in cell (0, 1), covers 2x2 cells
		var descriptor = cache.retrieve(ImageRegion.createInstance(3, 1, 5, 5));
		assertEquals(16, descriptor.length);
		var expected = new float[16];
		System.arraycopy(expectedCellHistogram(0, 1), 0, expected, 0, 4);
		System.arraycopy(expectedCellHistogram(0, 2), 0, expected, 4, 4);
		System.arraycopy(expectedCellHistogram(1, 1), 0, expected, 8, 4);
		System.arraycopy(expectedCellHistogram(1, 2), 0, expected, 12, 4);
		assertArrayEquals(expected, descriptor);
	}

	@Test
	public void test_largerStride() {
		var params = SMALL_PARAMS.toBuilder()
				.blockSize(2)
				.stride(4)
				.build();
		var cache = new DescriptorCache(params);
		cache.process(createLabeledField());

		// Single-cell blocks at cells (0,0), (0,2), (2,0), (2,2)
		var descriptor = cache.retrieve(ImageRegion.createFullImage(WIDTH, HEIGHT));
		assertEquals(16, descriptor.length);
		assertArrayEquals(expectedCellHistogram(0, 0), Arrays.copyOfRange(descriptor, 0, 4));
		assertArrayEquals(expectedCellHistogram(0, 2), Arrays.copyOfRange(descriptor, 4, 8));
		assertArrayEquals(expectedCellHistogram(2, 0), Arrays.copyOfRange(descriptor, 8, 12));
		assertArrayEquals(expectedCellHistogram(2, 2), Arrays.copyOfRange(descriptor, 12, 16));
	}

	@ParameterizedTest
	@EnumSource(BlockNormalization.class)
	public void test_normalizedPerBlock(BlockNormalization normalization) {
		var params = SMALL_PARAMS.toBuilder().normalization(normalization).build();
		var cache = new DescriptorCache(params);
		var field = createRandomField(32, 24, 2L);
		cache.process(field);
		var descriptor = cache.retrieve(ImageRegion.createInstance(8, 4, 16, 12));

		var unnormalized = new DescriptorCache(SMALL_PARAMS);
		unnormalized.process(field);
		var raw = unnormalized.retrieve(ImageRegion.createInstance(8, 4, 16, 12));

		assertEquals(raw.length, descriptor.length);
		int blockLength = params.getBlockHistogramLength();
		for (int i = 0; i < raw.length; i += blockLength) {
			var block = Arrays.copyOfRange(raw, i, i + blockLength);
			normalization.normalize(block);
			assertArrayEquals(block, Arrays.copyOfRange(descriptor, i, i + blockLength));
		}
	}

	@Test
	public void test_deterministicAndIndependent() {
		var params = SMALL_PARAMS.toBuilder().normalization(BlockNormalization.L2_HYS).build();
		var cache = new DescriptorCache(params);
		cache.process(createRandomField(40, 40, 3L));
		var window = ImageRegion.createInstance(2, 6, 20, 30);

		var first = cache.retrieve(window);
		var second = cache.retrieve(window);
		assertNotSame(first, second);
		assertArrayEquals(first, second);

		// Modifying a returned descriptor must not affect the cache
		Arrays.fill(first, -1f);
		assertArrayEquals(second, cache.retrieve(window));

		// Overlapping windows don't influence one another
		var overlapping = cache.retrieve(ImageRegion.createInstance(4, 8, 20, 30));
		assertArrayEquals(second, cache.retrieve(window));
		assertEquals(second.length, overlapping.length);
	}

	@Test
	public void test_reprocess() {
		var cache = new DescriptorCache(SMALL_PARAMS);
		cache.process(createRandomField(16, 16, 4L));
		var window = ImageRegion.createInstance(0, 0, 8, 6);
		var before = cache.retrieve(window);

		cache.process(createLabeledField());
		assertEquals(WIDTH, cache.getGrid().getImageWidth());
		var after = cache.retrieve(window);
		assertEquals(before.length, after.length);
		assertEquals(4f, after[0]);

		// Windows valid for the previous image but not the new one are rejected
		assertThrows(IllegalArgumentException.class, () -> cache.retrieve(ImageRegion.createInstance(8, 8, 8, 8)));
	}

	@Test
	public void test_parallel() {
		var field = createRandomField(64, 48, 5L);
		var params = HogParameters.builder(8)
				.cellSize(4)
				.stride(4)
				.binning(9)
				.build();
		var sequential = new DescriptorCache(params);
		var parallel = new DescriptorCache(params.toBuilder().parallel(true).build());
		sequential.process(field);
		parallel.process(field);

		var windows = new ArrayList<ImageRegion>();
		for (int y = 0; y + 16 <= 48; y += 4) {
			for (int x = 0; x + 24 <= 64; x += 4)
				windows.add(ImageRegion.createInstance(x, y, 24, 16));
		}
		var expected = sequential.retrieve(windows);
		var actual = parallel.retrieve(windows);
		assertEquals(windows.size(), expected.size());
		assertEquals(windows.size(), actual.size());
		for (int i = 0; i < windows.size(); i++) {
			// Batch retrieval matches individual retrieval, in order
			assertArrayEquals(sequential.retrieve(windows.get(i)), expected.get(i));
			assertArrayEquals(expected.get(i), actual.get(i));
		}
	}

	@Test
	public void test_concurrentRetrieval() throws Exception {
		var field = createRandomField(64, 64, 6L);
		var params = HogParameters.builder(16).build();
		var cache = new DescriptorCache(params);
		cache.process(field);

		var window = ImageRegion.createInstance(8, 16, 48, 40);
		var expected = cache.retrieve(window);

		ExecutorService pool = Executors.newFixedThreadPool(4);
		try {
			var tasks = new ArrayList<Callable<float[]>>();
			for (int i = 0; i < 50; i++) {
				if (i % 10 == 0) {
					tasks.add(() -> {
						cache.process(field);
						return expected;
					});
				} else
					tasks.add(() -> cache.retrieve(window));
			}
			for (Future<float[]> future : pool.invokeAll(tasks))
				assertArrayEquals(expected, future.get());
		} finally {
			pool.shutdownNow();
		}
	}

}
