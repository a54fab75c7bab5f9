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

package hogcv.opencv.tools;

import java.awt.image.BufferedImage;
import java.awt.image.DataBuffer;
import java.awt.image.IndexColorModel;
import java.awt.image.WritableRaster;
import java.util.Objects;

import org.bytedeco.javacpp.indexer.FloatIndexer;
import org.bytedeco.javacpp.indexer.Indexer;
import org.bytedeco.javacpp.indexer.ShortIndexer;
import org.bytedeco.javacpp.indexer.UByteIndexer;
import org.bytedeco.javacpp.indexer.UShortIndexer;
import org.bytedeco.opencv.global.opencv_core;
import org.bytedeco.opencv.global.opencv_imgproc;
import org.bytedeco.opencv.opencv_core.Mat;
import org.bytedeco.opencv.opencv_core.Scalar;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import hogcv.lib.analysis.images.SimpleImage;
import hogcv.lib.analysis.images.SimpleImages;

/**
 * Collection of static methods to help with using OpenCV from Java.
 * <p>
 * Mats returned by these methods are owned by the caller, who is responsible for closing them 
 * (or creating them within a {@link org.bytedeco.javacpp.PointerScope}).
 */
public class OpenCVTools {

	private static final Logger logger = LoggerFactory.getLogger(OpenCVTools.class);

	/**
	 * Convert the raster of a BufferedImage to an OpenCV Mat, with one channel per band.
	 * <p>
	 * Samples are copied unchanged, using a Mat depth that matches the raster's data type.
	 * The color model is ignored, so palette indices are copied as they are.
	 * 
	 * @see #imageToMatGray(BufferedImage)
	 * 
	 * @param img
	 * @return
	 */
	public static Mat imageToMat(BufferedImage img) {
		int width = img.getWidth();
		int height = img.getHeight();
		WritableRaster raster = img.getRaster();

		DataBuffer buffer = raster.getDataBuffer();
		int nChannels = raster.getNumBands();
		int typeCV;
		switch (buffer.getDataType()) {
			case DataBuffer.TYPE_BYTE:
				typeCV = opencv_core.CV_8UC(nChannels);
				break;
			case DataBuffer.TYPE_FLOAT:
				typeCV = opencv_core.CV_32FC(nChannels); 
				break;
			case DataBuffer.TYPE_INT:
				typeCV = opencv_core.CV_32SC(nChannels); // Assuming signed int
				break;
			case DataBuffer.TYPE_SHORT:
				typeCV = opencv_core.CV_16SC(nChannels); 
				break;
			case DataBuffer.TYPE_USHORT:
				typeCV = opencv_core.CV_16UC(nChannels); 
				break;
			default:
				typeCV = opencv_core.CV_64FC(nChannels); // Assume 64-bit is as flexible as we can manage
		}

		// Create a new Mat & put the pixels
		Mat mat = new Mat(height, width, typeCV, Scalar.ZERO);
		putPixels(raster, mat);
		return mat;
	}

	/**
	 * Convert a BufferedImage to a single-channel OpenCV Mat.
	 * <p>
	 * Images with a single band are converted directly, unless they use an indexed color model. 
	 * Other images (including indexed and binary images) are converted to 8-bit RGB, and then to grayscale 
	 * using OpenCV's standard weights.
	 * 
	 * @param img
	 * @return
	 */
	public static Mat imageToMatGray(BufferedImage img) {
		if (img.getRaster().getNumBands() == 1 && !(img.getColorModel() instanceof IndexColorModel))
			return imageToMat(img);
		logger.trace("Converting {}-band image of type {} to grayscale", img.getRaster().getNumBands(), img.getType());
		var matRGB = imageToMatRGB(img);
		var matGray = new Mat();
		opencv_imgproc.cvtColor(matRGB, matGray, opencv_imgproc.COLOR_RGB2GRAY);
		matRGB.close();
		return matGray;
	}

	private static void putPixels(WritableRaster raster, UByteIndexer indexer) {
		int[] pixels = null;
		int width = raster.getWidth();
		int height = raster.getHeight();
		for (int b = 0; b < raster.getNumBands(); b++) {
			pixels = raster.getSamples(0, 0, width, height, b, pixels);
			for (int y = 0; y < height; y++) {
				for (int x = 0; x < width; x++) {
					indexer.put(y, x, b, pixels[y*width + x]);
				}
			}
		}
	}

	private static void putPixels(WritableRaster raster, UShortIndexer indexer) {
		int[] pixels = null;
		int width = raster.getWidth();
		int height = raster.getHeight();
		for (int b = 0; b < raster.getNumBands(); b++) {
			pixels = raster.getSamples(0, 0, width, height, b, pixels);
			for (int y = 0; y < height; y++) {
				for (int x = 0; x < width; x++) {
					indexer.put(y, x, b, pixels[y*width + x]);
				}
			}
		}
	}

	private static void putPixels(WritableRaster raster, ShortIndexer indexer) {
		int[] pixels = null;
		int width = raster.getWidth();
		int height = raster.getHeight();
		for (int b = 0; b < raster.getNumBands(); b++) {
			pixels = raster.getSamples(0, 0, width, height, b, pixels);
			for (int y = 0; y < height; y++) {
				for (int x = 0; x < width; x++) {
					indexer.put(y, x, b, (short)pixels[y*width + x]);
				}
			}
		}
	}

	private static void putPixels(WritableRaster raster, FloatIndexer indexer) {
		float[] pixels = null;
		int width = raster.getWidth();
		int height = raster.getHeight();
		for (int b = 0; b < raster.getNumBands(); b++) {
			pixels = raster.getSamples(0, 0, width, height, b, pixels);
			for (int y = 0; y < height; y++) {
				for (int x = 0; x < width; x++) {
					indexer.put(y, x, b, pixels[y*width + x]);
				}
			}
		}
	}

	/**
	 * Put the pixels for the specified raster into a preallocated Mat.
	 * 
	 * @param raster
	 * @param mat
	 */
	private static void putPixels(WritableRaster raster, Mat mat) {
		Indexer indexer = mat.createIndexer();
		if (indexer instanceof UByteIndexer)
			putPixels(raster, (UByteIndexer)indexer);
		else if (indexer instanceof ShortIndexer)
			putPixels(raster, (ShortIndexer)indexer);
		else if (indexer instanceof UShortIndexer)
			putPixels(raster, (UShortIndexer)indexer);
		else if (indexer instanceof FloatIndexer)
			putPixels(raster, (FloatIndexer)indexer);
		else {
			double[] pixels = null;
			int width = raster.getWidth();
			int height = raster.getHeight();
			long[] indices = new long[3];
			for (int b = 0; b < raster.getNumBands(); b++) {
				pixels = raster.getSamples(0, 0, width, height, b, pixels);
				indices[2] = b;
				for (int y = 0; y < height; y++) {
					indices[0] = y;
					for (int x = 0; x < width; x++) {
						indices[1] = x;
						indexer.putDouble(indices, pixels[y*width + x]);
					}
				}
			}
		}
		indexer.release();
	}

	/**
	 * Extract 8-bit unsigned pixels from a BufferedImage as a 3-channel RGB Mat.
	 * Any alpha channel is discarded.
	 * 
	 * @param img input image
	 * @return
	 */
	public static Mat imageToMatRGB(final BufferedImage img) {
		// We can request the RGB values directly
		int width = img.getWidth();
		int height = img.getHeight();
		int[] data = img.getRGB(0, 0, width, height, null, 0, img.getWidth());

		Mat mat = new Mat(height, width, opencv_core.CV_8UC3);

		UByteIndexer indexer = mat.createIndexer();
		for (int y = 0; y < height; y++) {
			for (int x = 0; x < width; x++) {
				int val = data[y*width + x];
				int r = (val >> 16) & 0xff;
				int g = (val >> 8) & 0xff;
				int b = val & 0xff;
				indexer.put(y, x, 0, r);
				indexer.put(y, x, 1, g);
				indexer.put(y, x, 2, b);
			}
		}
		indexer.release();

		return mat;
	}

	/**
	 * Ensure that a {@link Mat} is continuous, creating a copy of the data if necessary.
	 * <p>
	 * This can be necessary before calls to {@link Mat#createBuffer()} or {@link Mat#createIndexer()} for 
	 * simpler interpretation of the results.
	 * 
	 * @param mat input Mat, which may or may not be continuous
	 * @param inPlace if true, set {@code mat} to contain the cloned data if required
	 * @return the original mat unchanged if it is already continuous, or cloned data that is continuous if required
	 * @see Mat#isContinuous()
	 */
	public static Mat ensureContinuous(Mat mat, boolean inPlace) {
		if (!mat.isContinuous()) {
			var mat2 = mat.clone();
			if (!inPlace) {
				return mat2;
			}
			mat.put(mat2);
		}
		assert mat.isContinuous();
		return mat;
	}

	/**
	 * Extract pixels as a float array.
	 * @param mat
	 * @param pixels
	 * @return
	 * @implNote in its current form, this is not very efficient.
	 */
	public static float[] extractPixels(Mat mat, float[] pixels) {
		if (pixels == null)
			pixels = new float[(int)totalPixels(mat)];
		Mat mat2 = null;
		if (mat.depth() != opencv_core.CV_32F) {
			mat2 = new Mat();
			mat.convertTo(mat2, opencv_core.CV_32F);
			ensureContinuous(mat2, true);
		} else
			mat2 = ensureContinuous(mat, false);

		FloatIndexer idx = mat2.createIndexer();
		idx.get(0L, pixels);
		idx.release();

		if (mat2 != mat)
			mat2.close();
		return pixels;
	}

	/**
	 * Return the total number of pixels in an image, counting each channel separately.
	 * This is similar to Mat.total(), except that Mat.total() ignores multiple channels.
	 * @param mat
	 * @return
	 */
	static long totalPixels(Mat mat) {
		int nChannels = mat.channels();
		if (nChannels > 0)
			return mat.total() * nChannels;
		return mat.total();
	}

	/**
	 * Extract pixels as a float array.
	 * @param mat
	 * @return
	 */
	public static float[] extractFloats(Mat mat) {
		return extractPixels(mat, (float[])null);
	}

	/**
	 * Set pixels from a float array.
	 * <p>
	 * There is no real error checking; it is assumed that the pixel array is in the appropriate format.
	 * 
	 * @param mat
	 * @param pixels
	 */
	public static void putPixelsFloat(Mat mat, float[] pixels) {
		Indexer indexer = mat.createIndexer();
		if (indexer instanceof FloatIndexer) {
			((FloatIndexer) indexer).put(0, pixels);
			indexer.release();
		} else {
			indexer.release();
			throw new IllegalArgumentException("Expected a FloatIndexer, but instead got " + indexer.getClass());
		}
	}

	/**
	 * Create a single-channel 32-bit floating point Mat from row-major pixel values.
	 * @param pixels
	 * @param width
	 * @param height
	 * @return
	 * @throws IllegalArgumentException if the number of pixels does not match the size
	 */
	public static Mat createFloatMat(float[] pixels, int width, int height) throws IllegalArgumentException {
		Objects.requireNonNull(pixels, "Pixels must not be null");
		if (pixels.length != width * height)
			throw new IllegalArgumentException("Pixel array length " + pixels.length + " does not match size " + width + "x" + height);
		var mat = new Mat(height, width, opencv_core.CV_32FC1);
		putPixelsFloat(mat, pixels);
		return mat;
	}

	/**
	 * Convert a {@link SimpleImage} to a single-channel 32-bit floating point Mat.
	 * @param image
	 * @return
	 */
	public static Mat simpleImageToMat(SimpleImage image) {
		return createFloatMat(SimpleImages.getPixels(image, true), image.getWidth(), image.getHeight());
	}

	/**
	 * Convert a Mat to a {@link SimpleImage}.
	 * @param mat
	 * @param channel
	 * @return
	 */
	public static SimpleImage matToSimpleImage(Mat mat, int channel) {
		Mat temp = mat;
		if (mat.channels() > 1) {
			temp = new Mat();
			opencv_core.extractChannel(mat, temp, channel);
		}
		float[] pixels = extractPixels(temp, (float[])null);
		if (temp != mat)
			temp.close();
		return SimpleImages.createFloatImage(pixels, mat.cols(), mat.rows());
	}

}
