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

/**
 * OpenCV-based computation of Histogram of Oriented Gradients descriptors.
 */
package hogcv.opencv.features;
