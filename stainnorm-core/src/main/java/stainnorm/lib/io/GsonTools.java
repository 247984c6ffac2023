/*-
 * #%L
 * This file is part of StainNorm.
 * %%
 * Copyright (C) 2024 StainNorm developers
 * %%
 * StainNorm is free software: you can redistribute it and/or modify
 * it under the terms of the GNU General Public License as
 * published by the Free Software Foundation, either version 3 of the
 * License, or (at your option) any later version.
 *
 * StainNorm is distributed in the hope that it will be useful,
 * but WITHOUT ANY WARRANTY; without even the implied warranty of
 * MERCHANTABILITY or FITNESS FOR A PARTICULAR PURPOSE.  See the
 * GNU General Public License for more details.
 *
 * You should have received a copy of the GNU General Public License
 * along with StainNorm.  If not, see <https://www.gnu.org/licenses/>.
 * #L%
 */

package stainnorm.lib.io;

import java.io.IOException;
import java.lang.reflect.Type;
import java.util.List;
import java.util.Map;

import com.google.gson.Gson;
import com.google.gson.GsonBuilder;
import com.google.gson.TypeAdapter;
import com.google.gson.reflect.TypeToken;
import com.google.gson.stream.JsonReader;
import com.google.gson.stream.JsonToken;
import com.google.gson.stream.JsonWriter;

import stainnorm.lib.color.StainMatrix;

/**
 * Helper class providing Gson instances with type adapters registered to serialize
 * stain matrices.
 */
public final class GsonTools {

	// Suppressed default constructor for non-instantiability
	private GsonTools() {
		throw new AssertionError();
	}

	private static final GsonBuilder builder = new GsonBuilder()
			.serializeSpecialFloatingPointValues()
			.setLenient()
			.registerTypeAdapter(StainMatrix.class, new StainMatrixTypeAdapter());

	/**
	 * Get a default Gson instance.
	 * @return
	 */
	public static Gson getInstance() {
		return getInstance(false);
	}

	/**
	 * Get a Gson instance, optionally with pretty printing.
	 * @param pretty
	 * @return
	 */
	public static Gson getInstance(boolean pretty) {
		if (pretty)
			return builder.create().newBuilder().setPrettyPrinting().create();
		return builder.create();
	}


	/**
	 * Writes a stain matrix as {@code {"name": ..., "stains": {"Hematoxylin": [r, g, b], ..., "Background": [b, b, b]}}}.
	 */
	static class StainMatrixTypeAdapter extends TypeAdapter<StainMatrix> {

		private static final Type MAP_TYPE = new TypeToken<Map<String, List<Double>>>() {}.getType();

		private final Gson gson = new Gson();

		@Override
		public void write(JsonWriter out, StainMatrix value) throws IOException {
			if (value == null) {
				out.nullValue();
				return;
			}
			out.beginObject();
			out.name("name");
			if (value.getName() == null)
				out.nullValue();
			else
				out.value(value.getName());
			out.name("stains");
			gson.toJson(value.getStainMatrixAsMap(), MAP_TYPE, out);
			out.endObject();
		}

		@Override
		public StainMatrix read(JsonReader in) throws IOException {
			if (in.peek() == JsonToken.NULL) {
				in.nextNull();
				return null;
			}
			String name = null;
			Map<String, List<Number>> stains = null;
			in.beginObject();
			while (in.hasNext()) {
				String key = in.nextName();
				if ("name".equals(key)) {
					if (in.peek() == JsonToken.NULL)
						in.nextNull();
					else
						name = in.nextString();
				} else if ("stains".equals(key)) {
					stains = gson.fromJson(in, MAP_TYPE);
				} else
					in.skipValue();
			}
			in.endObject();
			if (stains == null)
				throw new IOException("No stains found in JSON for stain matrix");
			try {
				return StainMatrix.parseStainMatrix(name, stains);
			} catch (IllegalArgumentException e) {
				throw new IOException("Invalid stain matrix: " + e.getLocalizedMessage(), e);
			}
		}

	}

}
