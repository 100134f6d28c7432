package com.bko.stravacache.integrations.strava;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;

@JsonIgnoreProperties(ignoreUnknown = true)
public class StravaActivity {
    private Long id;
    private String name;
    private String type;
    @JsonProperty("sport_type")
    private String sportType;
    private Double distance;
    @JsonProperty("moving_time")
    private Integer movingTime;
    @JsonProperty("elapsed_time")
    private Integer elapsedTime;
    @JsonProperty("total_elevation_gain")
    private Double totalElevationGain;
    @JsonProperty("start_date")
    private String startDate;
    @JsonProperty("start_date_local")
    private String startDateLocal;
    private String timezone;
    @JsonProperty("average_speed")
    private Double averageSpeed;
    @JsonProperty("max_speed")
    private Double maxSpeed;
    @JsonProperty("average_heartrate")
    private Double averageHeartrate;
    @JsonProperty("max_heartrate")
    private Double maxHeartrate;
    @JsonProperty("workout_type")
    private Integer workoutType;
    @JsonProperty("location_city")
    private String locationCity;
    @JsonProperty("total_photo_count")
    private Integer totalPhotoCount;
    @JsonProperty("comment_count")
    private Integer commentCount;
    private Athlete athlete;
    private String description;

    public Long getId() { return id; }
    public void setId(Long id) { this.id = id; }
    public String getName() { return name; }
    public void setName(String name) { this.name = name; }
    public String getType() { return type; }
    public void setType(String type) { this.type = type; }
    public String getSportType() { return sportType; }
    public void setSportType(String sportType) { this.sportType = sportType; }
    public Double getDistance() { return distance; }
    public void setDistance(Double distance) { this.distance = distance; }
    public Integer getMovingTime() { return movingTime; }
    public void setMovingTime(Integer movingTime) { this.movingTime = movingTime; }
    public Integer getElapsedTime() { return elapsedTime; }
    public void setElapsedTime(Integer elapsedTime) { this.elapsedTime = elapsedTime; }
    public Double getTotalElevationGain() { return totalElevationGain; }
    public void setTotalElevationGain(Double totalElevationGain) { this.totalElevationGain = totalElevationGain; }
    public String getStartDate() { return startDate; }
    public void setStartDate(String startDate) { this.startDate = startDate; }
    public String getStartDateLocal() { return startDateLocal; }
    public void setStartDateLocal(String startDateLocal) { this.startDateLocal = startDateLocal; }
    public String getTimezone() { return timezone; }
    public void setTimezone(String timezone) { this.timezone = timezone; }
    public Double getAverageSpeed() { return averageSpeed; }
    public void setAverageSpeed(Double averageSpeed) { this.averageSpeed = averageSpeed; }
    public Double getMaxSpeed() { return maxSpeed; }
    public void setMaxSpeed(Double maxSpeed) { this.maxSpeed = maxSpeed; }
    public Double getAverageHeartrate() { return averageHeartrate; }
    public void setAverageHeartrate(Double averageHeartrate) { this.averageHeartrate = averageHeartrate; }
    public Double getMaxHeartrate() { return maxHeartrate; }
    public void setMaxHeartrate(Double maxHeartrate) { this.maxHeartrate = maxHeartrate; }
    public Integer getWorkoutType() { return workoutType; }
    public void setWorkoutType(Integer workoutType) { this.workoutType = workoutType; }
    public String getLocationCity() { return locationCity; }
    public void setLocationCity(String locationCity) { this.locationCity = locationCity; }
    public Integer getTotalPhotoCount() { return totalPhotoCount; }
    public void setTotalPhotoCount(Integer totalPhotoCount) { this.totalPhotoCount = totalPhotoCount; }
    public Integer getCommentCount() { return commentCount; }
    public void setCommentCount(Integer commentCount) { this.commentCount = commentCount; }
    public Athlete getAthlete() { return athlete; }
    public void setAthlete(Athlete athlete) { this.athlete = athlete; }
    public String getDescription() { return description; }
    public void setDescription(String description) { this.description = description; }

    /**
     * Strava marks races with workout type 1 (runs) or 11 (rides).
     */
    public boolean isRace() {
        return workoutType != null && (workoutType == 1 || workoutType == 11);
    }

    @JsonIgnoreProperties(ignoreUnknown = true)
    public static class Athlete {
        private Long id;

        public Long getId() { return id; }
        public void setId(Long id) { this.id = id; }
    }
}
