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

import java.util.stream.IntStream;

/**
 * Orientation histograms for all the non-overlapping cells of an image.
 * <p>
 * The histograms are stored contiguously in row-major cell order, so that the histogram for cell 
 * {@code (row, col)} begins at index {@code (row * cols + col) * binning}.
 * Pixels to the right of or below the last complete cell are ignored.
 * <p>
 * A grid is immutable once built, and can safely be read from multiple threads.
 */
public class CellHistogramGrid {

	private final int imageWidth;
	private final int imageHeight;
	private final int cellSize;
	private final int rows;
	private final int cols;
	private final int binning;
	private final float[] histograms;

	private CellHistogramGrid(int imageWidth, int imageHeight, int cellSize, int rows, int cols, int binning, float[] histograms) {
		this.imageWidth = imageWidth;
		this.imageHeight = imageHeight;
		this.cellSize = cellSize;
		this.rows = rows;
		this.cols = cols;
		this.binning = binning;
		this.histograms = histograms;
	}

	/**
	 * Build the grid of cell histograms for a gradient field.
	 * @param field
	 * @param params
	 * @return
	 */
	public static CellHistogramGrid build(GradientField field, HogParameters params) {
		int cellSize = params.getCellSize();
		int binning = params.getBinning();
		int rows = field.getHeight() / cellSize;
		int cols = field.getWidth() / cellSize;
		var histograms = new float[rows * cols * binning];
		var builder = new CellHistogramBuilder(params);

		// Each row writes to its own section of the array
		var stream = IntStream.range(0, rows);
		if (params.isParallel())
			stream = stream.parallel();
		stream.forEach(row -> {
			for (int col = 0; col < cols; col++)
				builder.accumulate(field, row, col, histograms, (row * cols + col) * binning);
		});
		return new CellHistogramGrid(field.getWidth(), field.getHeight(), cellSize, rows, cols, binning, histograms);
	}

	/**
	 * Width of the image used to build the grid.
	 * @return
	 */
	public int getImageWidth() {
		return imageWidth;
	}

	/**
	 * Height of the image used to build the grid.
	 * @return
	 */
	public int getImageHeight() {
		return imageHeight;
	}

	/**
	 * Side length of each cell, in pixels.
	 * @return
	 */
	public int getCellSize() {
		return cellSize;
	}

	/**
	 * Number of rows of cells.
	 * @return
	 */
	public int getRows() {
		return rows;
	}

	/**
	 * Number of columns of cells.
	 * @return
	 */
	public int getCols() {
		return cols;
	}

	/**
	 * Number of bins in each cell histogram.
	 * @return
	 */
	public int getBinning() {
		return binning;
	}

	/**
	 * Get a copy of the histogram for a single cell.
	 * @param row
	 * @param col
	 * @return
	 * @throws IndexOutOfBoundsException if the cell is outside the grid
	 */
	public float[] getHistogram(int row, int col) throws IndexOutOfBoundsException {
		var histogram = new float[binning];
		copyHistogram(row, col, histogram, 0);
		return histogram;
	}

	/**
	 * Copy the histogram for a single cell into an array.
	 * @param row
	 * @param col
	 * @param dest destination array
	 * @param destOffset index in {@code dest} at which to write the first bin
	 * @throws IndexOutOfBoundsException if the cell is outside the grid
	 */
	void copyHistogram(int row, int col, float[] dest, int destOffset) throws IndexOutOfBoundsException {
		if (row < 0 || row >= rows || col < 0 || col >= cols)
			throw new IndexOutOfBoundsException("Cell (" + row + ", " + col + ") is outside the " + rows + "x" + cols + " grid");
		System.arraycopy(histograms, (row * cols + col) * binning, dest, destOffset, binning);
	}

}
