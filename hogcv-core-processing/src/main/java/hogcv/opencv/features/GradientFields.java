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

import java.util.Objects;

import org.bytedeco.javacpp.PointerScope;
import org.bytedeco.javacpp.indexer.FloatIndexer;
import org.bytedeco.opencv.global.opencv_core;
import org.bytedeco.opencv.global.opencv_imgproc;
import org.bytedeco.opencv.opencv_core.Mat;

import hogcv.lib.analysis.features.GradientField;
import hogcv.opencv.tools.OpenCVTools;

/**
 * Compute {@link GradientField GradientFields} with OpenCV.
 * <p>
 * Derivatives are calculated with the centered kernels {@code [-1, 0, 1]} horizontally and vertically, 
 * using OpenCV's default border handling (reflection without repeating the edge pixel).
 * Orientations are in degrees, in the range [0, 360]; OpenCV may round orientations just below 360 up to 360.
 */
public class GradientFields {

	/**
	 * Border strategy for the derivative filters.
	 */
	static final int BORDER_TYPE = opencv_core.BORDER_DEFAULT;

	// Suppress default constructor for non-instantiability
	private GradientFields() {
		throw new AssertionError();
	}

	/**
	 * Compute the gradient magnitude and orientation of a single-channel image.
	 * @param image input image, of any depth
	 * @return
	 * @throws IllegalArgumentException if the image is empty or has more than one channel
	 */
	public static GradientField compute(Mat image) throws IllegalArgumentException {
		Objects.requireNonNull(image, "Image must not be null");
		if (image.empty())
			throw new IllegalArgumentException("Image must not be empty");
		if (image.channels() != 1)
			throw new IllegalArgumentException("Gradients require a single-channel image, but image has " + image.channels() + " channels");

		try (var scope = new PointerScope()) {
			var matFloat = new Mat();
			image.convertTo(matFloat, opencv_core.CV_32F);

			var dx = new Mat();
			var dy = new Mat();
			opencv_imgproc.filter2D(matFloat, dx, opencv_core.CV_32F, createDerivativeKernel(true), null, 0, BORDER_TYPE);
			opencv_imgproc.filter2D(matFloat, dy, opencv_core.CV_32F, createDerivativeKernel(false), null, 0, BORDER_TYPE);

			var magnitude = new Mat();
			var orientation = new Mat();
			opencv_core.magnitude(dx, dy, magnitude);
			opencv_core.phase(dx, dy, orientation, true);

			return GradientField.create(image.cols(), image.rows(),
					OpenCVTools.extractFloats(magnitude),
					OpenCVTools.extractFloats(orientation));
		}
	}

	/**
	 * Create a 1x3 (horizontal) or 3x1 (vertical) derivative kernel.
	 * @param horizontal
	 * @return
	 */
	static Mat createDerivativeKernel(boolean horizontal) {
		var kernel = horizontal ? new Mat(1, 3, opencv_core.CV_32FC1) : new Mat(3, 1, opencv_core.CV_32FC1);
		float[] values = {-1f, 0f, 1f};
		FloatIndexer idx = kernel.createIndexer();
		for (int i = 0; i < values.length; i++) {
			if (horizontal)
				idx.put(0, i, values[i]);
			else
				idx.put(i, 0, values[i]);
		}
		idx.release();
		return kernel;
	}

}
