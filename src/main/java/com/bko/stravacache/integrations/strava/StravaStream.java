package com.bko.stravacache.integrations.strava;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.List;

/**
 * One stream of an activity (time, distance, latlng, altitude, heartrate...), as returned with
 * {@code key_by_type=true}. Data points are numbers, or {@code [lat, lng]} pairs for latlng.
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public class StravaStream {
    private List<Object> data;
    @JsonProperty("series_type")
    private String seriesType;
    @JsonProperty("original_size")
    private Integer originalSize;
    private String resolution;

    public List<Object> getData() { return data; }
    public void setData(List<Object> data) { this.data = data; }
    public String getSeriesType() { return seriesType; }
    public void setSeriesType(String seriesType) { this.seriesType = seriesType; }
    public Integer getOriginalSize() { return originalSize; }
    public void setOriginalSize(Integer originalSize) { this.originalSize = originalSize; }
    public String getResolution() { return resolution; }
    public void setResolution(String resolution) { this.resolution = resolution; }
}
