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
 * Range of gradient orientations used when binning cell histograms.
 */
public enum GradientMode {

	/**
	 * Orientations are folded into [0, 180) degrees, so that opposite gradient directions share a bin.
	 */
	UNSIGNED(180),

	/**
	 * Orientations cover the full [0, 360) degrees.
	 */
	SIGNED(360);

	private final int range;

	GradientMode(int range) {
		this.range = range;
	}

	/**
	 * Get the orientation range in degrees (180 or 360).
	 * @return
	 */
	public int getRange() {
		return range;
	}

	/**
	 * Get the gradient mode corresponding to an orientation range.
	 * @param range 180 for unsigned gradients, 360 for signed gradients
	 * @return
	 * @throws IllegalArgumentException if the range is neither 180 nor 360
	 */
	public static GradientMode fromRange(int range) throws IllegalArgumentException {
		for (var mode : values()) {
			if (mode.range == range)
				return mode;
		}
		throw new IllegalArgumentException("Unsupported gradient range " + range + " - must be 180 (unsigned) or 360 (signed)");
	}

	@Override
	public String toString() {
		switch (this) {
		case SIGNED:
			return "Signed (0-360)";
		case UNSIGNED:
			return "Unsigned (0-180)";
		default:
			return super.toString();
		}
	}

}
