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

/**
 * Immutable parameters for computing Histogram of Oriented Gradients descriptors.
 * <p>
 * Instances are created with a {@link Builder}, which validates the parameters when {@link Builder#build()} is called.
 * All sizes are given in pixels.
 * <pre>{@code
 * var params = HogParameters.builder(32)
 *     .cellSize(16)
 *     .stride(16)
 *     .binning(9)
 *     .gradientMode(GradientMode.UNSIGNED)
 *     .normalization(BlockNormalization.L2_HYS)
 *     .build();
 * }</pre>
 */
public class HogParameters {

	/**
	 * Default number of orientation bins per cell.
	 */
	public static final int DEFAULT_BINNING = 9;

	/**
	 * Default gradient mode.
	 */
	public static final GradientMode DEFAULT_GRADIENT_MODE = GradientMode.UNSIGNED;

	/**
	 * Default block normalization.
	 */
	public static final BlockNormalization DEFAULT_NORMALIZATION = BlockNormalization.L2_HYS;

	private final int blockSize;
	private final int cellSize;
	private final int stride;
	private final int binning;
	private final GradientMode gradientMode;
	private final BlockNormalization normalization;
	private final boolean parallel;

	private HogParameters(Builder builder) {
		this.blockSize = builder.blockSize;
		this.cellSize = builder.cellSize == null ? builder.blockSize / 2 : builder.cellSize;
		this.stride = builder.stride == null ? builder.blockSize / 2 : builder.stride;
		this.binning = builder.binning;
		this.gradientMode = builder.gradientMode;
		this.normalization = builder.normalization;
		this.parallel = builder.parallel;
	}

	/**
	 * Create a new builder with the specified block size.
	 * The cell size and stride default to half the block size.
	 * @param blockSize block size in pixels
	 * @return
	 */
	public static Builder builder(int blockSize) {
		return new Builder(blockSize);
	}

	/**
	 * Create a new builder initialized with the values of these parameters.
	 * @return
	 */
	public Builder toBuilder() {
		return new Builder(blockSize)
				.cellSize(cellSize)
				.stride(stride)
				.binning(binning)
				.gradientMode(gradientMode)
				.normalization(normalization)
				.parallel(parallel);
	}

	/**
	 * Side length of a block, in pixels.
	 * @return
	 */
	public int getBlockSize() {
		return blockSize;
	}

	/**
	 * Side length of a cell, in pixels.
	 * @return
	 */
	public int getCellSize() {
		return cellSize;
	}

	/**
	 * Distance between the origins of adjacent blocks, in pixels.
	 * @return
	 */
	public int getStride() {
		return stride;
	}

	/**
	 * Number of orientation bins in each cell histogram.
	 * @return
	 */
	public int getBinning() {
		return binning;
	}

	/**
	 * Gradient mode, determining the orientation range.
	 * @return
	 */
	public GradientMode getGradientMode() {
		return gradientMode;
	}

	/**
	 * Normalization applied to each block.
	 * @return
	 */
	public BlockNormalization getNormalization() {
		return normalization;
	}

	/**
	 * Returns true if cell histograms and batches of windows may be computed in parallel.
	 * @return
	 */
	public boolean isParallel() {
		return parallel;
	}

	/**
	 * Width of one orientation bin, in degrees.
	 * @return
	 */
	public double getBinWidth() {
		return gradientMode.getRange() / (double)binning;
	}

	/**
	 * Number of cells along each side of a block.
	 * @return
	 */
	public int getCellsPerBlock() {
		return blockSize / cellSize;
	}

	/**
	 * Block stride, in cells.
	 * @return
	 */
	public int getStrideCells() {
		return stride / cellSize;
	}

	/**
	 * Length of a single normalized block vector, i.e. {@code binning * cellsPerBlock^2}.
	 * @return
	 */
	public int getBlockHistogramLength() {
		int n = getCellsPerBlock();
		return binning * n * n;
	}

	/**
	 * Number of block positions along one axis of a window.
	 * @param length window width or height in pixels
	 * @return the number of block positions, or 0 if the window is smaller than a block
	 */
	public int getBlockPositions(int length) {
		if (length < blockSize)
			return 0;
		return (length / cellSize - getCellsPerBlock()) / getStrideCells() + 1;
	}

	/**
	 * Length of the descriptor returned for any window of the specified size.
	 * @param width window width in pixels
	 * @param height window height in pixels
	 * @return the descriptor length, or 0 if the window is smaller than a block
	 */
	public int getDescriptorLength(int width, int height) {
		return getBlockPositions(width) * getBlockPositions(height) * getBlockHistogramLength();
	}

	@Override
	public String toString() {
		return "HogParameters [blockSize=" + blockSize + ", cellSize=" + cellSize + ", stride=" + stride
				+ ", binning=" + binning + ", gradientMode=" + gradientMode.name() + ", normalization="
				+ normalization.name() + ", parallel=" + parallel + "]";
	}

	@Override
	public int hashCode() {
		return Objects.hash(binning, blockSize, cellSize, gradientMode, normalization, parallel, stride);
	}

	@Override
	public boolean equals(Object obj) {
		if (this == obj)
			return true;
		if (obj == null || getClass() != obj.getClass())
			return false;
		HogParameters other = (HogParameters) obj;
		return binning == other.binning && blockSize == other.blockSize && cellSize == other.cellSize
				&& gradientMode == other.gradientMode && normalization == other.normalization
				&& parallel == other.parallel && stride == other.stride;
	}


	/**
	 * Builder for {@link HogParameters}.
	 */
	public static class Builder {

		private int blockSize;
		private Integer cellSize;
		private Integer stride;
		private int binning = DEFAULT_BINNING;
		private GradientMode gradientMode = DEFAULT_GRADIENT_MODE;
		private BlockNormalization normalization = DEFAULT_NORMALIZATION;
		private boolean parallel = false;

		private Builder(int blockSize) {
			this.blockSize = blockSize;
		}

		/**
		 * Set the block size, in pixels.
		 * @param blockSize
		 * @return this builder
		 */
		public Builder blockSize(int blockSize) {
			this.blockSize = blockSize;
			return this;
		}

		/**
		 * Set the cell size, in pixels. Defaults to half the block size.
		 * @param cellSize
		 * @return this builder
		 */
		public Builder cellSize(int cellSize) {
			this.cellSize = cellSize;
			return this;
		}

		/**
		 * Set the block stride, in pixels. Defaults to half the block size.
		 * @param stride
		 * @return this builder
		 */
		public Builder stride(int stride) {
			this.stride = stride;
			return this;
		}

		/**
		 * Set the number of orientation bins per cell. Defaults to {@link HogParameters#DEFAULT_BINNING}.
		 * @param binning
		 * @return this builder
		 */
		public Builder binning(int binning) {
			this.binning = binning;
			return this;
		}

		/**
		 * Set the gradient mode. Defaults to {@link GradientMode#UNSIGNED}.
		 * @param gradientMode
		 * @return this builder
		 */
		public Builder gradientMode(GradientMode gradientMode) {
			this.gradientMode = gradientMode;
			return this;
		}

		/**
		 * Set the block normalization. Defaults to {@link BlockNormalization#L2_HYS}.
		 * @param normalization
		 * @return this builder
		 */
		public Builder normalization(BlockNormalization normalization) {
			this.normalization = normalization;
			return this;
		}

		/**
		 * Request that cell histograms and batches of windows are computed in parallel.
		 * Results are identical either way.
		 * @param parallel
		 * @return this builder
		 */
		public Builder parallel(boolean parallel) {
			this.parallel = parallel;
			return this;
		}

		/**
		 * Validate the current values and create the parameters.
		 * @return
		 * @throws IllegalArgumentException if any parameter is invalid
		 */
		public HogParameters build() throws IllegalArgumentException {
			var params = new HogParameters(this);
			checkParameters(params);
			return params;
		}

		private static void checkParameters(HogParameters params) throws IllegalArgumentException {
			if (params.blockSize < 2)
				throw new IllegalArgumentException("Block size must be at least 2 pixels, but was " + params.blockSize);
			if (params.cellSize < 1)
				throw new IllegalArgumentException("Cell size must be at least 1 pixel, but was " + params.cellSize);
			if (params.stride < 1)
				throw new IllegalArgumentException("Stride must be at least 1 pixel, but was " + params.stride);
			if (params.binning < 2)
				throw new IllegalArgumentException("Binning must be at least 2, but was " + params.binning);
			if (params.gradientMode == null)
				throw new IllegalArgumentException("Gradient mode must be specified");
			if (params.normalization == null)
				throw new IllegalArgumentException("Block normalization must be specified");
			if (params.blockSize % params.cellSize != 0)
				throw new IllegalArgumentException("Block size (" + params.blockSize + ") must be a multiple of cell size (" + params.cellSize + ")");
			if (params.stride % params.cellSize != 0)
				throw new IllegalArgumentException("Stride (" + params.stride + ") must be a multiple of cell size (" + params.cellSize + ")");
		}

	}

}
