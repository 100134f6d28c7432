package com.bko.stravacache.integrations.strava;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.List;
import java.util.Map;

@JsonIgnoreProperties(ignoreUnknown = true)
public class StravaPhoto {
    @JsonProperty("unique_id")
    private String uniqueId;
    private Map<String, String> urls;
    private String caption;
    @JsonProperty("created_at")
    private String createdAt;
    private List<Double> location;
    private Integer source;

    public String getUniqueId() { return uniqueId; }
    public void setUniqueId(String uniqueId) { this.uniqueId = uniqueId; }
    public Map<String, String> getUrls() { return urls; }
    public void setUrls(Map<String, String> urls) { this.urls = urls; }
    public String getCaption() { return caption; }
    public void setCaption(String caption) { this.caption = caption; }
    public String getCreatedAt() { return createdAt; }
    public void setCreatedAt(String createdAt) { this.createdAt = createdAt; }
    public List<Double> getLocation() { return location; }
    public void setLocation(List<Double> location) { this.location = location; }
    public Integer getSource() { return source; }
    public void setSource(Integer source) { this.source = source; }
}
