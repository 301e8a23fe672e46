package org.simpleweather.util;

import com.google.gson.Gson;
import com.google.gson.GsonBuilder;

/** Shared Gson configuration for everything written to the settings store. */
public final class Json {

    private static final Gson GSON = new GsonBuilder()
            .serializeNulls()
            .registerTypeAdapterFactory(new OrdinalEnumTypeAdapterFactory())
            .create();

    private Json() {}

    public static Gson gson() {
        return GSON;
    }
}
