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

/**
 * Bin the pixels of a single cell into an orientation histogram weighted by gradient magnitude.
 * <p>
 * Each pixel votes with its full magnitude into exactly one bin (no interpolation between bins).
 * For unsigned gradients, orientations &gt;= 180 degrees are first folded by subtracting 180.
 */
public class CellHistogramBuilder {

	private final int cellSize;
	private final int binning;
	private final GradientMode gradientMode;

	/**
	 * Create a builder using the cell size, binning and gradient mode of the specified parameters.
	 * @param params
	 */
	public CellHistogramBuilder(HogParameters params) {
		this.cellSize = params.getCellSize();
		this.binning = params.getBinning();
		this.gradientMode = params.getGradientMode();
	}

	/**
	 * Compute the histogram for the cell at the specified grid location.
	 * @param field gradient field
	 * @param row cell row
	 * @param col cell column
	 * @return a new histogram of length {@code binning}
	 */
	public float[] build(GradientField field, int row, int col) {
		var histogram = new float[binning];
		accumulate(field, row, col, histogram, 0);
		return histogram;
	}

	/**
	 * Add the votes for the cell at the specified grid location into an existing array.
	 * @param field gradient field
	 * @param row cell row
	 * @param col cell column
	 * @param histograms destination array
	 * @param offset index of the first bin for this cell within {@code histograms}
	 */
	void accumulate(GradientField field, int row, int col, float[] histograms, int offset) {
		float[] magnitude = field.magnitudes();
		float[] orientation = field.orientations();
		int width = field.getWidth();
		int x0 = col * cellSize;
		int y0 = row * cellSize;
		for (int y = y0; y < y0 + cellSize; y++) {
			int ind = y * width + x0;
			for (int x = 0; x < cellSize; x++, ind++) {
				histograms[offset + getBin(orientation[ind])] += magnitude[ind];
			}
		}
	}

	/**
	 * Get the bin index for an orientation.
	 * @param orientation orientation in degrees, in the range [0, 360]
	 * @return
	 */
	int getBin(float orientation) {
		double value = orientation;
		if (value >= 360)
			value -= 360;
		int range = gradientMode.getRange();
		if (gradientMode == GradientMode.UNSIGNED && value >= 180)
			value -= 180;
		// Equivalent to floor(value / binWidth), without rounding the bin width first
		return (int)Math.floor(value * binning / range);
	}

}
