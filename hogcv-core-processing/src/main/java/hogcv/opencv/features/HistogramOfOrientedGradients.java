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

package hogcv.opencv.features;

import java.awt.image.BufferedImage;
import java.util.Collection;
import java.util.List;
import java.util.Objects;

import org.bytedeco.javacpp.PointerScope;
import org.bytedeco.opencv.opencv_core.Mat;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import hogcv.lib.analysis.features.DescriptorCache;
import hogcv.lib.analysis.features.HogParameters;
import hogcv.lib.analysis.images.SimpleImage;
import hogcv.lib.regions.ImageRegion;
import hogcv.opencv.tools.OpenCVTools;

/**
 * Extract Histogram of Oriented Gradients (HOG) descriptors from windows of an image.
 * <p>
 * An image is first passed to {@link #process(Mat)}, which computes the gradients and bins them into
 * cell histograms. Descriptors can then be retrieved for any number of windows with {@link #retrieve(ImageRegion)}
 * without revisiting the pixels.
 * <pre>{@code
 * var hog = new HistogramOfOrientedGradients(HogParameters.builder(16).build());
 * hog.process(mat);
 * float[] descriptor = hog.retrieve(ImageRegion.createInstance(0, 0, 64, 128));
 * }</pre>
 * <p>
 * Instances are thread-safe: processing a new image blocks until ongoing retrievals have finished,
 * and retrievals wait for processing to complete.
 *
 * @see <a href="https://lear.inrialpes.fr/people/triggs/pubs/Dalal-cvpr05.pdf">Dalal and Triggs (2005)</a>
 */
public class HistogramOfOrientedGradients {

	private static final Logger logger = LoggerFactory.getLogger(HistogramOfOrientedGradients.class);

	private final DescriptorCache cache;

	/**
	 * Create an extractor with the specified parameters.
	 * @param params
	 */
	public HistogramOfOrientedGradients(HogParameters params) {
		this.cache = new DescriptorCache(params);
	}

	/**
	 * Create an extractor with the specified block size, using default values for all other parameters.
	 * @param blockSize block size in pixels
	 * @return
	 * @throws IllegalArgumentException if the block size is invalid
	 */
	public static HistogramOfOrientedGradients create(int blockSize) throws IllegalArgumentException {
		return new HistogramOfOrientedGradients(HogParameters.builder(blockSize).build());
	}

	/**
	 * Get the parameters used by this extractor.
	 * @return
	 */
	public HogParameters getParameters() {
		return cache.getParameters();
	}

	/**
	 * Compute the cell histograms for an image, replacing those for any previous image.
	 * @param image single-channel image of any depth
	 * @throws IllegalArgumentException if the image is empty, has more than one channel, or is smaller than the block size
	 */
	public void process(Mat image) throws IllegalArgumentException {
		Objects.requireNonNull(image, "Image must not be null");
		if (image.empty())
			throw new IllegalArgumentException("Image must not be empty");
		checkImageSize(image.cols(), image.rows());
		logger.trace("Processing {}x{} image", image.cols(), image.rows());
		cache.process(GradientFields.compute(image));
	}

	/**
	 * Compute the cell histograms for an image, replacing those for any previous image.
	 * Images with more than one band are converted to grayscale first.
	 * @param img
	 * @throws IllegalArgumentException if the image is smaller than the block size
	 */
	public void process(BufferedImage img) throws IllegalArgumentException {
		Objects.requireNonNull(img, "Image must not be null");
		checkImageSize(img.getWidth(), img.getHeight());
		try (var scope = new PointerScope()) {
			process(OpenCVTools.imageToMatGray(img));
		}
	}

	/**
	 * Compute the cell histograms for an image, replacing those for any previous image.
	 * @param image
	 * @throws IllegalArgumentException if the image is smaller than the block size
	 */
	public void process(SimpleImage image) throws IllegalArgumentException {
		Objects.requireNonNull(image, "Image must not be null");
		checkImageSize(image.getWidth(), image.getHeight());
		try (var scope = new PointerScope()) {
			process(OpenCVTools.simpleImageToMat(image));
		}
	}

	private void checkImageSize(int width, int height) throws IllegalArgumentException {
		int blockSize = getParameters().getBlockSize();
		if (width < blockSize || height < blockSize)
			throw new IllegalArgumentException("Image " + width + "x" + height + " is smaller than the block size " + blockSize);
	}

	/**
	 * Retrieve the descriptor for a window of the last processed image.
	 * @param window window in pixel coordinates
	 * @return a new descriptor array, of length {@link #getDescriptorLength(int, int)}
	 * @throws IllegalStateException if no image has been processed
	 * @throws IllegalArgumentException if the window is smaller than the block size or not inside the image
	 */
	public float[] retrieve(ImageRegion window) throws IllegalStateException, IllegalArgumentException {
		return cache.retrieve(window);
	}

	/**
	 * Retrieve the descriptor for a window of the last processed image.
	 * @param x x coordinate of the top left of the window
	 * @param y y coordinate of the top left of the window
	 * @param width window width
	 * @param height window height
	 * @return a new descriptor array
	 * @throws IllegalStateException if no image has been processed
	 * @throws IllegalArgumentException if the window is smaller than the block size or not inside the image
	 */
	public float[] retrieve(int x, int y, int width, int height) throws IllegalStateException, IllegalArgumentException {
		return retrieve(ImageRegion.createInstance(x, y, width, height));
	}

	/**
	 * Retrieve descriptors for multiple windows of the last processed image.
	 * @param windows
	 * @return descriptors in the same order as the windows
	 * @throws IllegalStateException if no image has been processed
	 * @throws IllegalArgumentException if any window is smaller than the block size or not inside the image
	 */
	public List<float[]> retrieve(Collection<? extends ImageRegion> windows) throws IllegalStateException, IllegalArgumentException {
		return cache.retrieve(windows);
	}

	/**
	 * Retrieve the descriptor for a window as a single-row 32-bit floating point Mat.
	 * The caller is responsible for closing the Mat.
	 * @param window
	 * @return
	 * @throws IllegalStateException if no image has been processed
	 * @throws IllegalArgumentException if the window is smaller than the block size or not inside the image
	 */
	public Mat retrieveAsMat(ImageRegion window) throws IllegalStateException, IllegalArgumentException {
		var descriptor = retrieve(window);
		return OpenCVTools.createFloatMat(descriptor, descriptor.length, 1);
	}

	/**
	 * Get the length of the descriptor for any window of the specified size.
	 * This does not require an image to have been processed.
	 * @param width
	 * @param height
	 * @return the descriptor length, or 0 if the window is smaller than the block size
	 */
	public int getDescriptorLength(int width, int height) {
		return getParameters().getDescriptorLength(width, height);
	}

	/**
	 * Returns true if an image has been processed.
	 * @return
	 */
	public boolean hasImage() {
		return cache.hasImage();
	}

	/**
	 * Width of the last processed image.
	 * @return
	 * @throws IllegalStateException if no image has been processed
	 */
	public int getImageWidth() throws IllegalStateException {
		return cache.getGrid().getImageWidth();
	}

	/**
	 * Height of the last processed image.
	 * @return
	 * @throws IllegalStateException if no image has been processed
	 */
	public int getImageHeight() throws IllegalStateException {
		return cache.getGrid().getImageHeight();
	}

	/**
	 * Number of rows of cells in the last processed image.
	 * @return
	 * @throws IllegalStateException if no image has been processed
	 */
	public int getCellRows() throws IllegalStateException {
		return cache.getGrid().getRows();
	}

	/**
	 * Number of columns of cells in the last processed image.
	 * @return
	 * @throws IllegalStateException if no image has been processed
	 */
	public int getCellCols() throws IllegalStateException {
		return cache.getGrid().getCols();
	}

	/**
	 * Get a copy of the (unnormalized) histogram for one cell of the last processed image.
	 * @param row
	 * @param col
	 * @return
	 * @throws IllegalStateException if no image has been processed
	 * @throws IndexOutOfBoundsException if the cell is outside the grid
	 */
	public float[] getCellHistogram(int row, int col) throws IllegalStateException, IndexOutOfBoundsException {
		return cache.getGrid().getHistogram(row, col);
	}

	/**
	 * Get the gradient magnitudes of the last processed image, as a 32-bit floating point Mat.
	 * The caller is responsible for closing the Mat.
	 * @return
	 * @throws IllegalStateException if no image has been processed
	 */
	public Mat getMagnitudes() throws IllegalStateException {
		return OpenCVTools.simpleImageToMat(cache.getGradientField().getMagnitudeImage());
	}

	/**
	 * Get the gradient orientations of the last processed image in degrees, as a 32-bit floating point Mat.
	 * The caller is responsible for closing the Mat.
	 * @return
	 * @throws IllegalStateException if no image has been processed
	 */
	public Mat getOrientations() throws IllegalStateException {
		return OpenCVTools.simpleImageToMat(cache.getGradientField().getOrientationImage());
	}

	/**
	 * Discard the cell histograms of the last processed image.
	 */
	public void clear() {
		cache.clear();
	}

}
