package me.binarii.mirror.util;

import com.google.gson.FieldNamingPolicy;
import com.google.gson.Gson;
import com.google.gson.GsonBuilder;
import com.google.gson.JsonParseException;
import com.google.gson.TypeAdapter;
import com.google.gson.stream.JsonReader;
import com.google.gson.stream.JsonToken;
import com.google.gson.stream.JsonWriter;
import me.binarii.mirror.model.Protocol;

import java.io.IOException;
import java.time.Instant;
import java.time.OffsetDateTime;
import java.time.format.DateTimeParseException;

public class JSON {

	private static ThreadLocal<Gson> gson = ThreadLocal.withInitial(JSON::newGson);

	public static String toJSONString(Object obj) {
		return gson.get().toJson(obj);
	}

	public static <T> T parse(String json, Class<T> type) {
		return gson.get().fromJson(json, type);
	}

	private static Gson newGson() {
		return new GsonBuilder()
				.setFieldNamingPolicy(FieldNamingPolicy.LOWER_CASE_WITH_UNDERSCORES)
				.registerTypeAdapter(Instant.class, new InstantAdapter().nullSafe())
				.registerTypeAdapter(Protocol.class, new ProtocolAdapter().nullSafe())
				.serializeSpecialFloatingPointValues()
				.create();
	}

	private static class InstantAdapter extends TypeAdapter<Instant> {

		@Override
		public void write(JsonWriter out, Instant value) throws IOException {
			out.value(value.toString());
		}

		@Override
		public Instant read(JsonReader in) throws IOException {
			if (in.peek() != JsonToken.STRING) {
				// anything but a string means "never synchronised"
				in.skipValue();
				return null;
			}
			String text = in.nextString();
			try {
				return OffsetDateTime.parse(text).toInstant();
			} catch (DateTimeParseException e) {
				throw new JsonParseException("malformed timestamp: " + text, e);
			}
		}

	}

	private static class ProtocolAdapter extends TypeAdapter<Protocol> {

		@Override
		public void write(JsonWriter out, Protocol value) throws IOException {
			out.value(value.toString());
		}

		@Override
		public Protocol read(JsonReader in) throws IOException {
			String name = in.nextString();
			try {
				return Protocol.fromName(name);
			} catch (IllegalArgumentException e) {
				throw new JsonParseException(e.getMessage(), e);
			}
		}

	}

}
