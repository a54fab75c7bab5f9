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

import java.util.Locale;

/**
 * Normalization methods applied to the concatenated cell histograms of a block.
 * <p>
 * See Dalal and Triggs, <i>Histograms of Oriented Gradients for Human Detection</i> (CVPR 2005)
 * for a comparison of the methods.
 * Each method operates on the full block vector in place.
 */
public enum BlockNormalization {

	/**
	 * Leave the block vector unchanged.
	 */
	NONE,
	/**
	 * Divide by the sum of the components (plus {@link #EPSILON}).
	 */
	L1,
	/**
	 * Apply {@link #L1} and then take the square root of each component.
	 */
	L1_SQRT,
	/**
	 * Divide by the square root of the sum of squared components (plus {@link #EPSILON}).
	 */
	L2,
	/**
	 * Apply {@link #L2}, clip each component to the range [0, {@link #L2_HYS_CLIP}], then apply {@link #L2} again.
	 */
	L2_HYS;

	/**
	 * Small constant added to denominators so that all-zero blocks remain all-zero.
	 */
	public static final float EPSILON = 1e-6f;

	/**
	 * Maximum component value after the first normalization step of {@link #L2_HYS}.
	 */
	public static final float L2_HYS_CLIP = 0.2f;

	/**
	 * Normalize all the values of an array in place.
	 * @param values
	 */
	public void normalize(float[] values) {
		normalize(values, 0, values.length);
	}

	/**
	 * Normalize a range of values in place.
	 * @param values the array containing the block vector
	 * @param from index of the first value (inclusive)
	 * @param to index of the last value (exclusive)
	 */
	public void normalize(float[] values, int from, int to) {
		switch (this) {
		case NONE:
			return;
		case L1:
			l1(values, from, to);
			return;
		case L1_SQRT:
			l1(values, from, to);
			for (int i = from; i < to; i++)
				values[i] = (float)Math.sqrt(values[i]);
			return;
		case L2:
			l2(values, from, to);
			return;
		case L2_HYS:
			l2(values, from, to);
			for (int i = from; i < to; i++) {
				float v = values[i];
				if (v > L2_HYS_CLIP)
					values[i] = L2_HYS_CLIP;
				else if (v < 0)
					values[i] = 0f;
			}
			l2(values, from, to);
			return;
		default:
			throw new IllegalArgumentException("Unknown block normalization " + this);
		}
	}

	private static void l1(float[] values, int from, int to) {
		double sum = 0;
		for (int i = from; i < to; i++)
			sum += values[i];
		divide(values, from, to, sum + EPSILON);
	}

	private static void l2(float[] values, int from, int to) {
		double sumSquares = 0;
		for (int i = from; i < to; i++)
			sumSquares += values[i] * values[i];
		divide(values, from, to, Math.sqrt(sumSquares + EPSILON));
	}

	private static void divide(float[] values, int from, int to, double denominator) {
		if (denominator == 0)
			return;
		for (int i = from; i < to; i++)
			values[i] = (float)(values[i] / denominator);
	}

	/**
	 * Parse a normalization name.
	 * Names are case-insensitive, and hyphens may be used in place of underscores (e.g. "l2-hys").
	 * @param name
	 * @return
	 * @throws IllegalArgumentException if the name does not match any normalization method
	 */
	public static BlockNormalization fromString(String name) throws IllegalArgumentException {
		if (name == null)
			throw new IllegalArgumentException("Block normalization name must not be null");
		String normalized = name.trim().toUpperCase(Locale.ROOT).replace('-', '_');
		for (var norm : values()) {
			if (norm.name().equals(normalized))
				return norm;
		}
		throw new IllegalArgumentException("Unknown block normalization '" + name + "'");
	}

	@Override
	public String toString() {
		switch (this) {
		case NONE:
			return "None";
		case L1:
			return "L1";
		case L1_SQRT:
			return "L1-sqrt";
		case L2:
			return "L2";
		case L2_HYS:
			return "L2-Hys";
		default:
			return super.toString();
		}
	}

}
