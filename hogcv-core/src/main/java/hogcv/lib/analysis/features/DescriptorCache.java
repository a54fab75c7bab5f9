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

import java.util.ArrayList;
import java.util.Collection;
import java.util.List;
import java.util.Objects;
import java.util.concurrent.locks.Lock;
import java.util.concurrent.locks.ReentrantReadWriteLock;
import java.util.stream.Collectors;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import hogcv.lib.regions.ImageRegion;

/**
 * Cache of cell histograms for the most recently processed image, from which descriptors
 * can be retrieved for any number of windows.
 * <p>
 * Processing an image is the only step that visits every pixel.
 * Retrieving a descriptor afterwards only touches the cells within the requested window.
 * <p>
 * Processing replaces the cache under a write lock, while retrievals share a read lock.
 * This means that calls may safely overlap across threads: a retrieval never observes a partially-built grid.
 */
public class DescriptorCache {

	private static final Logger logger = LoggerFactory.getLogger(DescriptorCache.class);

	private final HogParameters params;
	private final WindowRetriever retriever;

	private final ReentrantReadWriteLock rwl = new ReentrantReadWriteLock();
	private final Lock r = rwl.readLock();
	private final Lock w = rwl.writeLock();

	private GradientField field;
	private CellHistogramGrid grid;

	/**
	 * Create an empty cache.
	 * @param params
	 */
	public DescriptorCache(HogParameters params) {
		this.params = Objects.requireNonNull(params, "Parameters must not be null");
		this.retriever = new WindowRetriever(params);
	}

	/**
	 * Get the parameters used by this cache.
	 * @return
	 */
	public HogParameters getParameters() {
		return params;
	}

	/**
	 * Discard any cached histograms and compute new ones from a gradient field.
	 * @param field
	 * @throws IllegalArgumentException if the field is smaller than the block size in either dimension
	 */
	public void process(GradientField field) throws IllegalArgumentException {
		Objects.requireNonNull(field, "Gradient field must not be null");
		int blockSize = params.getBlockSize();
		if (field.getWidth() < blockSize || field.getHeight() < blockSize)
			throw new IllegalArgumentException("Image " + field.getWidth() + "x" + field.getHeight()
				+ " is smaller than the block size " + blockSize);

		w.lock();
		try {
			clearInternal();
			long startTime = System.currentTimeMillis();
			this.grid = CellHistogramGrid.build(field, params);
			this.field = field;
			long endTime = System.currentTimeMillis();
			logger.debug("Built {}x{} cell histograms for {}x{} image in {} ms",
					grid.getRows(), grid.getCols(), field.getWidth(), field.getHeight(), endTime - startTime);
		} finally {
			w.unlock();
		}
	}

	/**
	 * Retrieve the descriptor for a window of the processed image.
	 * @param window
	 * @return a new descriptor array
	 * @throws IllegalStateException if no image has been processed
	 * @throws IllegalArgumentException if the window is smaller than the block size or outside the image
	 */
	public float[] retrieve(ImageRegion window) throws IllegalStateException, IllegalArgumentException {
		r.lock();
		try {
			return retriever.retrieve(requireGrid(), window);
		} finally {
			r.unlock();
		}
	}

	/**
	 * Retrieve descriptors for multiple windows of the processed image.
	 * If the parameters request parallel processing, windows are handled in parallel.
	 * @param windows
	 * @return a list of descriptors, in the same order as the windows
	 * @throws IllegalStateException if no image has been processed
	 * @throws IllegalArgumentException if any window is smaller than the block size or outside the image
	 */
	public List<float[]> retrieve(Collection<? extends ImageRegion> windows) throws IllegalStateException, IllegalArgumentException {
		Objects.requireNonNull(windows, "Windows must not be null");
		r.lock();
		try {
			var currentGrid = requireGrid();
			if (params.isParallel()) {
				return windows.parallelStream()
						.map(window -> retriever.retrieve(currentGrid, window))
						.collect(Collectors.toList());
			}
			var descriptors = new ArrayList<float[]>(windows.size());
			for (var window : windows)
				descriptors.add(retriever.retrieve(currentGrid, window));
			return descriptors;
		} finally {
			r.unlock();
		}
	}

	/**
	 * Returns true if an image has been processed, and descriptors can be retrieved.
	 * @return
	 */
	public boolean hasImage() {
		r.lock();
		try {
			return grid != null;
		} finally {
			r.unlock();
		}
	}

	/**
	 * Get the cell histograms of the processed image.
	 * @return
	 * @throws IllegalStateException if no image has been processed
	 */
	public CellHistogramGrid getGrid() throws IllegalStateException {
		r.lock();
		try {
			return requireGrid();
		} finally {
			r.unlock();
		}
	}

	/**
	 * Get the gradient field of the processed image.
	 * @return
	 * @throws IllegalStateException if no image has been processed
	 */
	public GradientField getGradientField() throws IllegalStateException {
		r.lock();
		try {
			requireGrid();
			return field;
		} finally {
			r.unlock();
		}
	}

	/**
	 * Discard the cached histograms.
	 */
	public void clear() {
		w.lock();
		try {
			clearInternal();
		} finally {
			w.unlock();
		}
	}

	private void clearInternal() {
		this.grid = null;
		this.field = null;
	}

	private CellHistogramGrid requireGrid() throws IllegalStateException {
		if (grid == null)
			throw new IllegalStateException("No image has been processed - descriptors cannot be retrieved");
		return grid;
	}

}
