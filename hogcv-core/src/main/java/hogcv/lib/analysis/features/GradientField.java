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

import hogcv.lib.analysis.images.SimpleImage;
import hogcv.lib.analysis.images.SimpleImages;

/**
 * Per-pixel gradient magnitude and orientation for a single-channel image.
 * <p>
 * Orientations are given in degrees, in the range [0, 360).
 * A value of exactly 360 is accepted and treated as 0 when binning.
 * Fields are immutable: values passed in are copied, and accessors return copies.
 */
public class GradientField {

	private final int width;
	private final int height;
	private final float[] magnitude;
	private final float[] orientation;

	private GradientField(int width, int height, float[] magnitude, float[] orientation) {
		this.width = width;
		this.height = height;
		this.magnitude = magnitude;
		this.orientation = orientation;
	}

	/**
	 * Create a gradient field from row-major magnitude and orientation arrays.
	 * @param width image width
	 * @param height image height
	 * @param magnitude gradient magnitudes, all &gt;= 0
	 * @param orientation gradient orientations in degrees
	 * @return
	 * @throws IllegalArgumentException if the array lengths do not match the image size, 
	 *         or any value lies outside the valid range
	 */
	public static GradientField create(int width, int height, float[] magnitude, float[] orientation) throws IllegalArgumentException {
		Objects.requireNonNull(magnitude, "Magnitude must not be null");
		Objects.requireNonNull(orientation, "Orientation must not be null");
		return createWithoutCopy(width, height, magnitude.clone(), orientation.clone());
	}

	/**
	 * Validate arrays that are not referenced anywhere else, and wrap them in a field.
	 */
	private static GradientField createWithoutCopy(int width, int height, float[] magnitude, float[] orientation) throws IllegalArgumentException {
		int n = width * height;
		if (width <= 0 || height <= 0)
			throw new IllegalArgumentException("Gradient field must not be empty, but size is " + width + "x" + height);
		if (magnitude.length != n || orientation.length != n)
			throw new IllegalArgumentException("Expected " + n + " gradient values for " + width + "x" + height
					+ " image, but got " + magnitude.length + " magnitudes and " + orientation.length + " orientations");
		for (int i = 0; i < n; i++) {
			if (!(magnitude[i] >= 0))
				throw new IllegalArgumentException("Gradient magnitude must be >= 0, but found " + magnitude[i] + " at index " + i);
			if (!(orientation[i] >= 0 && orientation[i] <= 360))
				throw new IllegalArgumentException("Gradient orientation must be in the range [0, 360], but found " + orientation[i] + " at index " + i);
		}
		return new GradientField(width, height, magnitude, orientation);
	}

	/**
	 * Create a gradient field from magnitude and orientation images.
	 * @param magnitude
	 * @param orientation
	 * @return
	 * @throws IllegalArgumentException if the images differ in size
	 */
	public static GradientField create(SimpleImage magnitude, SimpleImage orientation) throws IllegalArgumentException {
		Objects.requireNonNull(magnitude, "Magnitude must not be null");
		Objects.requireNonNull(orientation, "Orientation must not be null");
		if (!SimpleImages.sameSize(magnitude, orientation))
			throw new IllegalArgumentException("Magnitude and orientation images must have the same size");
		return createWithoutCopy(magnitude.getWidth(), magnitude.getHeight(),
				SimpleImages.getPixels(magnitude, false),
				SimpleImages.getPixels(orientation, false));
	}

	/**
	 * Image width, in pixels.
	 * @return
	 */
	public int getWidth() {
		return width;
	}

	/**
	 * Image height, in pixels.
	 * @return
	 */
	public int getHeight() {
		return height;
	}

	/**
	 * Gradient magnitude at a pixel.
	 * @param x
	 * @param y
	 * @return
	 */
	public float getMagnitude(int x, int y) {
		return magnitude[y * width + x];
	}

	/**
	 * Gradient orientation at a pixel, in degrees.
	 * @param x
	 * @param y
	 * @return
	 */
	public float getOrientation(int x, int y) {
		return orientation[y * width + x];
	}

	/**
	 * Get a copy of the gradient magnitudes as an image.
	 * @return
	 */
	public SimpleImage getMagnitudeImage() {
		return SimpleImages.createFloatImage(magnitude.clone(), width, height);
	}

	/**
	 * Get a copy of the gradient orientations as an image.
	 * @return
	 */
	public SimpleImage getOrientationImage() {
		return SimpleImages.createFloatImage(orientation.clone(), width, height);
	}

	/**
	 * Direct access to the magnitude array, for binning.
	 */
	float[] magnitudes() {
		return magnitude;
	}

	/**
	 * Direct access to the orientation array, for binning.
	 */
	float[] orientations() {
		return orientation;
	}

}
