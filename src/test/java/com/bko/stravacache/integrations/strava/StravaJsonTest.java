package com.bko.stravacache.integrations.strava;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.NullNode;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertTrue;

class StravaJsonTest {
    private final ObjectMapper mapper = new ObjectMapper();

    @Test
    void typedViewsReadOnlyKnownFields() throws Exception {
        JsonNode laps = mapper.readTree("[{\"lap_index\":1,\"distance\":1000.0,\"split\":1},{\"lap_index\":2}]");
        JsonNode streams = mapper.readTree("{\"heartrate\":{\"data\":[120,121],\"series_type\":\"time\",\"original_size\":2}}");

        List<StravaLap> lapList = StravaJson.laps(laps);
        Map<String, StravaStream> streamMap = StravaJson.streams(streams);

        assertEquals(2, lapList.size());
        assertEquals(1000.0, lapList.get(0).getDistance());
        assertEquals(2, lapList.get(1).getLapIndex());
        assertEquals(List.of(120, 121), streamMap.get("heartrate").getData());
        // the source node is left as received
        assertEquals(1, laps.path(0).path("split").asInt());
    }

    @Test
    void absentPartsHaveEmptyViews() {
        assertNull(StravaJson.activity(null));
        assertNull(StravaJson.activity(NullNode.getInstance()));
        assertTrue(StravaJson.comments(null).isEmpty());
        assertTrue(StravaJson.photos(StravaJson.emptyObject()).isEmpty());
        assertTrue(StravaJson.streams(StravaJson.emptyArray()).isEmpty());
    }

    @Test
    void activityIdAcceptsNumbersAndText() throws Exception {
        assertEquals("12345678901", StravaJson.activityId(mapper.readTree("{\"id\":12345678901}")));
        assertEquals("77", StravaJson.activityId(mapper.readTree("{\"id\":\"77\"}")));
        assertNull(StravaJson.activityId(mapper.readTree("{\"id\":null}")));
        assertNull(StravaJson.activityId(mapper.readTree("{\"name\":\"no id\"}")));
    }
}
