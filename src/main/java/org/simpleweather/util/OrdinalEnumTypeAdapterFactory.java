package org.simpleweather.util;

import com.google.gson.Gson;
import com.google.gson.JsonParseException;
import com.google.gson.TypeAdapter;
import com.google.gson.TypeAdapterFactory;
import com.google.gson.reflect.TypeToken;
import com.google.gson.stream.JsonReader;
import com.google.gson.stream.JsonToken;
import com.google.gson.stream.JsonWriter;

import java.io.IOException;

/**
 * Writes enum constants as their ordinal numbers, matching the numeric
 * selection values the host keeps in its settings. Reads either a number or a
 * constant name.
 */
public final class OrdinalEnumTypeAdapterFactory implements TypeAdapterFactory {

    @Override
    @SuppressWarnings({"unchecked", "rawtypes"})
    public <T> TypeAdapter<T> create(Gson gson, TypeToken<T> type) {
        Class<?> raw = type.getRawType();
        if (!Enum.class.isAssignableFrom(raw) || raw == Enum.class) {
            return null;
        }
        if (!raw.isEnum()) {
            raw = raw.getSuperclass(); // constant-specific class body
        }
        return (TypeAdapter<T>) new OrdinalAdapter(raw);
    }

    private static final class OrdinalAdapter<E extends Enum<E>> extends TypeAdapter<E> {
        private final Class<E> type;
        private final E[] constants;

        OrdinalAdapter(Class<E> type) {
            this.type = type;
            this.constants = type.getEnumConstants();
        }

        @Override
        public void write(JsonWriter out, E value) throws IOException {
            if (value == null) {
                out.nullValue();
                return;
            }
            out.value(value.ordinal());
        }

        @Override
        public E read(JsonReader in) throws IOException {
            JsonToken token = in.peek();
            if (token == JsonToken.NULL) {
                in.nextNull();
                return null;
            }
            if (token == JsonToken.STRING) {
                String name = in.nextString();
                try {
                    return Enum.valueOf(type, name);
                } catch (IllegalArgumentException e) {
                    throw new JsonParseException("unknown " + type.getSimpleName() + " '" + name + "'", e);
                }
            }
            int ordinal = in.nextInt();
            if (ordinal < 0 || ordinal >= constants.length) {
                throw new JsonParseException(type.getSimpleName() + " ordinal out of range: " + ordinal);
            }
            return constants[ordinal];
        }
    }
}
