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

package hogcv.lib.regions;

/**
 * Class for defining a rectangular region of an image.
 * <p>
 * The bounding box is given in pixel coordinates, with the origin at the top left of the image.
 */
public class ImageRegion {

	private final int x;
	private final int y;
	private final int width;
	private final int height;


	@Override
	public String toString() {
		return "Region: x=" + x + ", y=" + y + ", w=" + width + ", h=" + height;
	}

	ImageRegion(final int x, final int y, final int width, final int height) {
		this.x = x;
		this.y = y;
		this.width = width;
		this.height = height;
	}

	/**
	 * Create a region based on its bounding box coordinates.
	 * @param x
	 * @param y
	 * @param width
	 * @param height
	 * @return
	 * @throws IllegalArgumentException if the width or height is negative
	 */
	public static ImageRegion createInstance(final int x, final int y, final int width, final int height) throws IllegalArgumentException {
		if (width < 0)
			throw new IllegalArgumentException("Width must be >= 0! Requested width = " + width);
		if (height < 0)
			throw new IllegalArgumentException("Height must be >= 0! Requested height = " + height);
		return new ImageRegion(x, y, width, height);
	}

	/**
	 * Create a region covering a full image, i.e. with the origin at (0, 0).
	 * @param width image width
	 * @param height image height
	 * @return
	 */
	public static ImageRegion createFullImage(final int width, final int height) {
		return createInstance(0, 0, width, height);
	}

	/**
	 * Check if this region contains a specified pixel coordinate.
	 *
	 * @param x
	 * @param y
	 * @return
	 */
	public boolean contains(int x, int y) {
		return x >= getX() &&
			   x < getX() + getWidth() &&
			   y >= getY() &&
			   y < getY() + getHeight();
	}

	/**
	 * Check if this region completely contains another region.
	 * Empty regions are contained if their origin lies within the bounds (inclusive of the right and bottom edges).
	 *
	 * @param region
	 * @return
	 */
	public boolean contains(ImageRegion region) {
		return region.getMinX() >= getMinX() &&
				region.getMinY() >= getMinY() &&
				region.getMaxX() <= getMaxX() &&
				region.getMaxY() <= getMaxY();
	}

	/**
	 * Get the x coordinate of the region bounding box (top left).
	 * @return
	 */
	public int getX() {
		return x;
	}

	/**
	 * Get the y coordinate of the region bounding box (top left).
	 * @return
	 */
	public int getY() {
		return y;
	}

	/**
	 * Get the width of the region bounding box.
	 * @return
	 */
	public int getWidth() {
		return width;
	}

	/**
	 * Get the height of the region bounding box.
	 * @return
	 */
	public int getHeight() {
		return height;
	}

	/**
	 * Get the x coordinate of the top left of the region bounding box.
	 * @return
	 */
	public int getMinX() {
		return Math.min(getX(), getX() + getWidth());
	}

	/**
	 * Get the x coordinate of the bottom right of the region bounding box (exclusive).
	 * @return
	 */
	public int getMaxX() {
		return Math.max(getX(), getX() + getWidth());
	}

	/**
	 * Get the y coordinate of the top left of the region bounding box.
	 * @return
	 */
	public int getMinY() {
		return Math.min(getY(), getY() + getHeight());
	}

	/**
	 * Get the y coordinate of the bottom right of the region bounding box (exclusive).
	 * @return
	 */
	public int getMaxY() {
		return Math.max(getY(), getY() + getHeight());
	}

	/* (non-Javadoc)
	 * @see java.lang.Object#hashCode()
	 */
	@Override
	public int hashCode() {
		final int prime = 31;
		int result = 1;
		result = prime * result + height;
		result = prime * result + width;
		result = prime * result + x;
		result = prime * result + y;
		return result;
	}

	/* (non-Javadoc)
	 * @see java.lang.Object#equals(java.lang.Object)
	 */
	@Override
	public boolean equals(Object obj) {
		if (this == obj)
			return true;
		if (obj == null)
			return false;
		if (getClass() != obj.getClass())
			return false;
		ImageRegion other = (ImageRegion) obj;
		if (height != other.height)
			return false;
		if (width != other.width)
			return false;
		if (x != other.x)
			return false;
		if (y != other.y)
			return false;
		return true;
	}

}
