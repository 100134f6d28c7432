package com.bko.stravacache.integrations.strava;

import com.bko.stravacache.shared.AppSettings;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.apache.hc.client5.http.config.RequestConfig;
import org.apache.hc.client5.http.fluent.Executor;
import org.apache.hc.client5.http.fluent.Request;
import org.apache.hc.client5.http.impl.classic.CloseableHttpClient;
import org.apache.hc.client5.http.impl.classic.HttpClients;
import org.apache.hc.core5.http.ClassicHttpResponse;
import org.apache.hc.core5.http.Header;
import org.apache.hc.core5.http.ParseException;
import org.apache.hc.core5.http.io.entity.EntityUtils;
import org.apache.hc.core5.util.Timeout;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.net.URLEncoder;
import java.nio.charset.StandardCharsets;
import java.time.Instant;
import java.util.List;

@Component
public class StravaHttpClient implements StravaClientPort {
    private static final Logger logger = LoggerFactory.getLogger(StravaHttpClient.class);
    private static final String STREAM_KEYS = "time,distance,latlng,altitude,heartrate,cadence,velocity_smooth,grade_smooth";

    private final String apiBase;
    private final List<RateLimitListener> rateLimitListeners;
    private final ObjectMapper objectMapper = new ObjectMapper();
    private final Executor executor;

    public StravaHttpClient(AppSettings settings, List<RateLimitListener> rateLimitListeners) {
        this.apiBase = settings.strava().apiBaseUrl();
        this.rateLimitListeners = List.copyOf(rateLimitListeners);
        CloseableHttpClient httpClient = HttpClients.custom()
                .setDefaultRequestConfig(RequestConfig.custom()
                        .setConnectionRequestTimeout(Timeout.ofSeconds(10))
                        .setResponseTimeout(Timeout.ofSeconds(30))
                        .build())
                .build();
        this.executor = Executor.newInstance(httpClient);
    }

    @Override
    public JsonNode getAthleteActivities(String accessToken, int page, int perPage, Instant after, Instant before) throws IOException {
        StringBuilder url = new StringBuilder(apiBase)
                .append("/athlete/activities?page=")
                .append(page)
                .append("&per_page=")
                .append(perPage);
        if (after != null) {
            url.append("&after=").append(after.getEpochSecond());
        }
        if (before != null) {
            url.append("&before=").append(before.getEpochSecond());
        }
        return get(accessToken, url.toString(), "activity list page " + page);
    }

    @Override
    public JsonNode fetchActivityDetail(String accessToken, String activityId) throws IOException {
        String url = apiBase + "/activities/" + enc(activityId) + "?include_all_efforts=true";
        return get(accessToken, url, "activity " + activityId);
    }

    @Override
    public JsonNode fetchPhotos(String accessToken, String activityId) throws IOException {
        String url = apiBase + "/activities/" + enc(activityId) + "/photos?size=5000&photo_sources=true";
        return get(accessToken, url, "photos of activity " + activityId);
    }

    @Override
    public JsonNode fetchComments(String accessToken, String activityId) throws IOException {
        String url = apiBase + "/activities/" + enc(activityId) + "/comments?page_size=200";
        return get(accessToken, url, "comments of activity " + activityId);
    }

    @Override
    public JsonNode fetchLaps(String accessToken, String activityId) throws IOException {
        String url = apiBase + "/activities/" + enc(activityId) + "/laps";
        return get(accessToken, url, "laps of activity " + activityId);
    }

    @Override
    public JsonNode fetchStreams(String accessToken, String activityId) throws IOException {
        String url = apiBase + "/activities/" + enc(activityId) + "/streams?keys=" + STREAM_KEYS + "&key_by_type=true";
        UpstreamResponse response = execute(accessToken, url);
        // Manual activities have no streams.
        if (response.statusCode() == 404) {
            logger.debug("No streams for activity {}", activityId);
            return objectMapper.createObjectNode();
        }
        checkStatus(response, "streams of activity " + activityId);
        return objectMapper.readTree(response.body());
    }

    private JsonNode get(String accessToken, String url, String what) throws IOException {
        UpstreamResponse response = execute(accessToken, url);
        checkStatus(response, what);
        return objectMapper.readTree(response.body());
    }

    private UpstreamResponse execute(String accessToken, String url) throws IOException {
        UpstreamResponse response = executor.execute(Request.get(url)
                        .addHeader("Authorization", "Bearer " + accessToken)
                        .addHeader("Accept", "application/json"))
                .handleResponse(this::toUpstreamResponse);
        UpstreamRateLimit.parse(response.usageHeader(), response.limitHeader())
                .ifPresent(this::publishRateLimit);
        return response;
    }

    private void checkStatus(UpstreamResponse response, String what) throws StravaApiException {
        int status = response.statusCode();
        if (status == 401) {
            logger.warn("Strava 401: Unauthorized while fetching {}. Access token may be expired or missing scopes.", what);
        } else if (status == 429) {
            logger.warn("Strava 429: rate limit exceeded while fetching {} (usage {})", what, response.usageHeader());
        }
        if (status >= 400) {
            throw new StravaApiException(status, "Strava API error fetching " + what + ": HTTP " + status);
        }
    }

    private void publishRateLimit(UpstreamRateLimit rateLimit) {
        for (RateLimitListener listener : rateLimitListeners) {
            listener.onUpstreamRateLimit(rateLimit);
        }
    }

    private UpstreamResponse toUpstreamResponse(ClassicHttpResponse response) throws IOException, ParseException {
        String body = response.getEntity() == null ? "" : EntityUtils.toString(response.getEntity(), StandardCharsets.UTF_8);
        return new UpstreamResponse(
                response.getCode(),
                headerValue(response.getFirstHeader("X-RateLimit-Usage")),
                headerValue(response.getFirstHeader("X-RateLimit-Limit")),
                body
        );
    }

    private static String headerValue(Header header) {
        return header == null ? null : header.getValue();
    }

    private static String enc(String s) {
        return URLEncoder.encode(s, StandardCharsets.UTF_8);
    }

    private record UpstreamResponse(int statusCode, String usageHeader, String limitHeader, String body) {
    }
}
