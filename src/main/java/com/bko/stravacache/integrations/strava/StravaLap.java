package com.bko.stravacache.integrations.strava;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;

@JsonIgnoreProperties(ignoreUnknown = true)
public class StravaLap {
    private Long id;
    private String name;
    @JsonProperty("lap_index")
    private Integer lapIndex;
    @JsonProperty("elapsed_time")
    private Integer elapsedTime;
    @JsonProperty("moving_time")
    private Integer movingTime;
    @JsonProperty("start_date")
    private String startDate;
    private Double distance;
    @JsonProperty("total_elevation_gain")
    private Double totalElevationGain;
    @JsonProperty("average_speed")
    private Double averageSpeed;
    @JsonProperty("max_speed")
    private Double maxSpeed;
    @JsonProperty("average_heartrate")
    private Double averageHeartrate;
    @JsonProperty("max_heartrate")
    private Double maxHeartrate;
    @JsonProperty("average_cadence")
    private Double averageCadence;
    @JsonProperty("pace_zone")
    private Integer paceZone;

    public Long getId() { return id; }
    public void setId(Long id) { this.id = id; }
    public String getName() { return name; }
    public void setName(String name) { this.name = name; }
    public Integer getLapIndex() { return lapIndex; }
    public void setLapIndex(Integer lapIndex) { this.lapIndex = lapIndex; }
    public Integer getElapsedTime() { return elapsedTime; }
    public void setElapsedTime(Integer elapsedTime) { this.elapsedTime = elapsedTime; }
    public Integer getMovingTime() { return movingTime; }
    public void setMovingTime(Integer movingTime) { this.movingTime = movingTime; }
    public String getStartDate() { return startDate; }
    public void setStartDate(String startDate) { this.startDate = startDate; }
    public Double getDistance() { return distance; }
    public void setDistance(Double distance) { this.distance = distance; }
    public Double getTotalElevationGain() { return totalElevationGain; }
    public void setTotalElevationGain(Double totalElevationGain) { this.totalElevationGain = totalElevationGain; }
    public Double getAverageSpeed() { return averageSpeed; }
    public void setAverageSpeed(Double averageSpeed) { this.averageSpeed = averageSpeed; }
    public Double getMaxSpeed() { return maxSpeed; }
    public void setMaxSpeed(Double maxSpeed) { this.maxSpeed = maxSpeed; }
    public Double getAverageHeartrate() { return averageHeartrate; }
    public void setAverageHeartrate(Double averageHeartrate) { this.averageHeartrate = averageHeartrate; }
    public Double getMaxHeartrate() { return maxHeartrate; }
    public void setMaxHeartrate(Double maxHeartrate) { this.maxHeartrate = maxHeartrate; }
    public Double getAverageCadence() { return averageCadence; }
    public void setAverageCadence(Double averageCadence) { this.averageCadence = averageCadence; }
    public Integer getPaceZone() { return paceZone; }
    public void setPaceZone(Integer paceZone) { this.paceZone = paceZone; }
}
