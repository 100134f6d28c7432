package com.bko.stravacache.integrations.strava;

import com.fasterxml.jackson.databind.ObjectMapper;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertTrue;

class StravaActivityTest {

    @Test
    void mapsSnakeCaseFieldsAndIgnoresUnknown() throws Exception {
        String json = "{\"id\":9,\"name\":\"Marathon\",\"sport_type\":\"Run\",\"moving_time\":10800,"
                + "\"workout_type\":1,\"comment_count\":4,\"athlete\":{\"id\":77},\"kudos_count\":12}";

        StravaActivity activity = new ObjectMapper().readValue(json, StravaActivity.class);

        assertEquals(9L, activity.getId());
        assertEquals("Run", activity.getSportType());
        assertEquals(10800, activity.getMovingTime());
        assertEquals(4, activity.getCommentCount());
        assertEquals(77L, activity.getAthlete().getId());
        assertTrue(activity.isRace());
    }

    @Test
    void regularWorkoutIsNotARace() {
        StravaActivity activity = new StravaActivity();
        activity.setWorkoutType(0);
        assertFalse(activity.isRace());
        activity.setWorkoutType(null);
        assertFalse(activity.isRace());
    }
}
