package org.simpleweather.util;

import com.google.gson.JsonParseException;
import org.junit.jupiter.api.Test;
import org.simpleweather.model.ClimateParameters;
import org.simpleweather.model.Humidity;
import org.simpleweather.model.Season;
import org.simpleweather.model.TimeSnapshot;

import static org.junit.jupiter.api.Assertions.*;

class JsonTest {

    @Test
    void enumsAcceptOrdinalsOrNames() {
        assertEquals(Season.FALL, Json.gson().fromJson("2", Season.class));
        assertEquals(Season.FALL, Json.gson().fromJson("\"FALL\"", Season.class));
        assertThrows(JsonParseException.class, () -> Json.gson().fromJson("\"AUTUMN\"", Season.class));
    }

    @Test
    void missingParameterSurvivesAsNull() {
        String json = Json.gson().toJson(new ClimateParameters(null, Humidity.LAVISH, Season.SPRING));

        assertTrue(json.contains("\"climate\":null"), json);
        ClimateParameters back = Json.gson().fromJson(json, ClimateParameters.class);
        assertFalse(back.isComplete());
        assertEquals(Humidity.LAVISH, back.getHumidity());
    }

    @Test
    void partialFeedValueDecodesWithNulls() {
        TimeSnapshot snapshot = Json.gson().fromJson("{\"day\":2,\"month\":1,\"year\":1000}", TimeSnapshot.class);

        assertEquals(Integer.valueOf(2), snapshot.getDay());
        assertNull(snapshot.getSecond());
        assertFalse(TimeSnapshotValidator.isValid(snapshot));
        assertTrue(snapshot.getWeekdays().isEmpty());
    }
}
