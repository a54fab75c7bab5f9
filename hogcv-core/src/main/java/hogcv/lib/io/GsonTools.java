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

package hogcv.lib.io;

import java.io.IOException;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.google.gson.Gson;
import com.google.gson.GsonBuilder;
import com.google.gson.TypeAdapter;
import com.google.gson.stream.JsonReader;
import com.google.gson.stream.JsonToken;
import com.google.gson.stream.JsonWriter;

import hogcv.lib.analysis.features.BlockNormalization;
import hogcv.lib.analysis.features.GradientMode;
import hogcv.lib.analysis.features.HogParameters;

/**
 * Helper class providing Gson instances with type adapters registered to serialize 
 * {@link HogParameters}.
 * <p>
 * Parameters read from JSON are validated in the same way as parameters created with a {@link HogParameters.Builder}.
 * Any field that is omitted takes its default value, except for the block size which is required.
 */
public class GsonTools {

	private final static Logger logger = LoggerFactory.getLogger(GsonTools.class);

	private static final GsonBuilder builder = new GsonBuilder()
			.setLenient()
			.registerTypeAdapter(HogParameters.class, HogParametersTypeAdapter.INSTANCE);

	/**
	 * Get default Gson, capable of serializing/deserializing {@link HogParameters}.
	 * @return
	 * 
	 * @see #getInstance(boolean)
	 */
	public static Gson getInstance() {
		return builder.create();
	}

	/**
	 * Get default Gson, optionally with pretty printing enabled.
	 * 
	 * @param pretty if true, write using pretty-printing (i.e. more whitespace for formatting)
	 * @return
	 * 
	 * @see #getInstance()
	 */
	public static Gson getInstance(boolean pretty) {
		if (pretty)
			return getInstance().newBuilder().setPrettyPrinting().create();
		return getInstance();
	}


	/**
	 * TypeAdapter for {@link HogParameters}, reading via the builder so that values are validated.
	 */
	static class HogParametersTypeAdapter extends TypeAdapter<HogParameters> {

		static HogParametersTypeAdapter INSTANCE = new HogParametersTypeAdapter();

		@Override
		public void write(JsonWriter out, HogParameters value) throws IOException {
			if (value == null) {
				out.nullValue();
				return;
			}
			out.beginObject();
			out.name("blockSize").value(value.getBlockSize());
			out.name("cellSize").value(value.getCellSize());
			out.name("stride").value(value.getStride());
			out.name("binning").value(value.getBinning());
			out.name("gradientMode").value(value.getGradientMode().name());
			out.name("normalization").value(value.getNormalization().name());
			out.name("parallel").value(value.isParallel());
			out.endObject();
		}

		@Override
		public HogParameters read(JsonReader in) throws IOException {
			if (in.peek() == JsonToken.NULL) {
				in.nextNull();
				return null;
			}
			Integer blockSize = null;
			var builder = HogParameters.builder(0);
			in.beginObject();
			while (in.hasNext()) {
				String name = in.nextName();
				switch (name) {
				case "blockSize":
					blockSize = in.nextInt();
					builder.blockSize(blockSize);
					break;
				case "cellSize":
					builder.cellSize(in.nextInt());
					break;
				case "stride":
					builder.stride(in.nextInt());
					break;
				case "binning":
					builder.binning(in.nextInt());
					break;
				case "gradientMode":
					builder.gradientMode(readGradientMode(in));
					break;
				case "normalization":
					builder.normalization(BlockNormalization.fromString(in.nextString()));
					break;
				case "parallel":
					builder.parallel(in.nextBoolean());
					break;
				default:
					logger.warn("Unknown HOG parameter '{}' will be ignored", name);
					in.skipValue();
				}
			}
			in.endObject();
			if (blockSize == null)
				throw new IllegalArgumentException("HOG parameters must specify 'blockSize'");
			return builder.build();
		}

		private static GradientMode readGradientMode(JsonReader in) throws IOException {
			// Accept the orientation range as well as the name
			if (in.peek() == JsonToken.NUMBER)
				return GradientMode.fromRange(in.nextInt());
			String name = in.nextString();
			for (var mode : GradientMode.values()) {
				if (mode.name().equalsIgnoreCase(name))
					return mode;
			}
			throw new IllegalArgumentException("Unknown gradient mode '" + name + "'");
		}

	}

}
