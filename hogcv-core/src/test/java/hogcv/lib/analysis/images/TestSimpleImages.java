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

import static org.junit.jupiter.api.Assertions.assertArrayEquals;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertNotSame;
import static org.junit.jupiter.api.Assertions.assertSame;
import static org.junit.jupiter.api.Assertions.assertThrows;

import org.junit.jupiter.api.Test;

@SuppressWarnings("javadoc")
public class TestSimpleImages {

	@Test
	public void test_floatImage() {
		float[] pixels = {0, 1, 2, 3, 4, 5};
		var image = SimpleImages.createFloatImage(pixels, 3, 2);
		assertEquals(3, image.getWidth());
		assertEquals(2, image.getHeight());
		assertEquals(5f, image.getValue(2, 1));

		assertSame(pixels, SimpleImages.getPixels(image, true));
		assertNotSame(pixels, SimpleImages.getPixels(image, false));
		assertArrayEquals(pixels, SimpleImages.getPixels(image, false));
	}

	@Test
	public void test_invalidSize() {
		assertThrows(IllegalArgumentException.class, () -> SimpleImages.createFloatImage(new float[5], 3, 2));
		assertThrows(IllegalArgumentException.class, () -> SimpleImages.createFloatImage(new float[0], -1, 0));
		assertThrows(NullPointerException.class, () -> SimpleImages.createFloatImage(null, 1, 1));
	}

	@Test
	public void test_sameSize() {
		var first = SimpleImages.createFloatImage(new float[20], 4, 5);
		assertEquals(true, SimpleImages.sameSize(first, SimpleImages.createFloatImage(new float[20], 4, 5)));
		assertEquals(false, SimpleImages.sameSize(first, SimpleImages.createFloatImage(new float[20], 5, 4)));
	}

}
