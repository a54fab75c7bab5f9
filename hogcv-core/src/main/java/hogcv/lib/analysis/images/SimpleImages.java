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

package hogcv.lib.analysis.images;

import java.util.Objects;

/**
 * Create {@link SimpleImage SimpleImage} instances for basic pixel processing.
 */
public class SimpleImages {

	/**
	 * Get the pixel values for the image.
	 * @param image
	 * @param direct if true, return the direct pixel buffer if possible. The caller should <i>not</i> modify this.
	 * @return
	 */
	public static float[] getPixels(SimpleImage image, boolean direct) {
		if (image instanceof FloatArraySimpleImage)
			return ((FloatArraySimpleImage)image).getArray(direct);
		int n = image.getWidth() * image.getHeight();
		int w = image.getWidth();
		float[] pixels = new float[n];
		for (int i = 0; i < n; i++)
			pixels[i] = image.getValue(i % w, i / w);
		return pixels;
	}

	/**
	 * Create a {@link SimpleImage} backed by an existing float array of pixels.
	 * <p>
	 * Pixels are stored in row-major order.
	 * 
	 * @param data
	 * @param width
	 * @param height
	 * @return
	 * @throws IllegalArgumentException if the array length does not match width * height
	 */
	public static SimpleImage createFloatImage(float[] data, int width, int height) throws IllegalArgumentException {
		Objects.requireNonNull(data, "Pixel array must not be null");
		if (width < 0 || height < 0)
			throw new IllegalArgumentException("Image dimensions must be >= 0, but got " + width + "x" + height);
		if (data.length != width * height)
			throw new IllegalArgumentException("Pixel array length " + data.length + " does not match image size " + width + "x" + height);
		return new FloatArraySimpleImage(data, width, height);
	}

	/**
	 * Returns true if both images have the same width and height.
	 * @param first
	 * @param second
	 * @return
	 */
	public static boolean sameSize(SimpleImage first, SimpleImage second) {
		return first.getWidth() == second.getWidth() && first.getHeight() == second.getHeight();
	}


	/**
	 * Implementation of a SimpleImage backed by an array of floats.
	 */
	static class FloatArraySimpleImage implements SimpleImage {

		private final float[] data;
		private final int width;
		private final int height;

		FloatArraySimpleImage(float[] data, int width, int height) {
			this.data = data;
			this.width = width;
			this.height = height;
		}

		@Override
		public float getValue(int x, int y) {
			return data[y * width + x];
		}

		@Override
		public int getWidth() {
			return width;
		}

		@Override
		public int getHeight() {
			return height;
		}

		float[] getArray(boolean direct) {
			if (direct)
				return data;
			return data.clone();
		}

	}
}
