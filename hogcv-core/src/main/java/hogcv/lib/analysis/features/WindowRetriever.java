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

import java.util.Objects;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import hogcv.lib.regions.ImageRegion;

/**
 * Assemble the descriptor for a window of an image from a {@link CellHistogramGrid}.
 * <p>
 * Blocks of cells are visited row by row (top to bottom, then left to right within each row), 
 * starting from the cell containing the top left of the window and stepping by the stride.
 * The histograms of the cells within each block are concatenated in row-major order, normalized, 
 * and appended to the descriptor.
 * <p>
 * The cached histograms are only read; every descriptor is a new array.
 */
public class WindowRetriever {

	private static final Logger logger = LoggerFactory.getLogger(WindowRetriever.class);

	private final HogParameters params;

	/**
	 * Create a retriever for the specified parameters.
	 * @param params
	 */
	public WindowRetriever(HogParameters params) {
		this.params = Objects.requireNonNull(params);
	}

	/**
	 * Compute the descriptor for a window.
	 * @param grid cell histograms of the image
	 * @param window window in pixel coordinates
	 * @return the descriptor, with length {@link HogParameters#getDescriptorLength(int, int)}
	 * @throws IllegalArgumentException if the grid was built with a different cell size or binning, 
	 *         or the window is smaller than a block, or not completely inside the image
	 */
	public float[] retrieve(CellHistogramGrid grid, ImageRegion window) throws IllegalArgumentException {
		checkGrid(grid);
		checkWindow(grid, window);

		int cellSize = params.getCellSize();
		int cellX = window.getX() / cellSize;
		int cellY = window.getY() / cellSize;
		int cellWidth = window.getWidth() / cellSize;
		int cellHeight = window.getHeight() / cellSize;

		int blockCells = params.getCellsPerBlock();
		int strideCells = params.getStrideCells();
		int binning = params.getBinning();
		int blockLength = params.getBlockHistogramLength();
		var normalization = params.getNormalization();

		var descriptor = new float[params.getDescriptorLength(window.getWidth(), window.getHeight())];
		int offset = 0;
		for (int blockY = cellY; blockY + blockCells <= cellY + cellHeight; blockY += strideCells) {
			for (int blockX = cellX; blockX + blockCells <= cellX + cellWidth; blockX += strideCells) {
				int blockStart = offset;
				for (int y = blockY; y < blockY + blockCells; y++) {
					for (int x = blockX; x < blockX + blockCells; x++) {
						grid.copyHistogram(y, x, descriptor, offset);
						offset += binning;
					}
				}
				normalization.normalize(descriptor, blockStart, blockStart + blockLength);
			}
		}
		assert offset == descriptor.length;
		logger.trace("Retrieved descriptor of length {} for {}", descriptor.length, window);
		return descriptor;
	}

	private void checkGrid(CellHistogramGrid grid) throws IllegalArgumentException {
		Objects.requireNonNull(grid, "Grid must not be null");
		if (grid.getCellSize() != params.getCellSize() || grid.getBinning() != params.getBinning())
			throw new IllegalArgumentException("Grid with cell size " + grid.getCellSize() + " and binning " + grid.getBinning()
				+ " does not match parameters with cell size " + params.getCellSize() + " and binning " + params.getBinning());
	}

	private void checkWindow(CellHistogramGrid grid, ImageRegion window) throws IllegalArgumentException {
		Objects.requireNonNull(window, "Window must not be null");
		int blockSize = params.getBlockSize();
		if (window.getWidth() < blockSize || window.getHeight() < blockSize)
			throw new IllegalArgumentException("Window " + window.getWidth() + "x" + window.getHeight() 
				+ " is smaller than the block size " + blockSize);
		var bounds = ImageRegion.createFullImage(grid.getImageWidth(), grid.getImageHeight());
		if (!bounds.contains(window))
			throw new IllegalArgumentException(window + " is outside the image bounds " 
				+ grid.getImageWidth() + "x" + grid.getImageHeight());
	}

}
