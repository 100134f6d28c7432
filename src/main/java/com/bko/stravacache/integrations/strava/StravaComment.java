package com.bko.stravacache.integrations.strava;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;

@JsonIgnoreProperties(ignoreUnknown = true)
public class StravaComment {
    private Long id;
    private String text;
    @JsonProperty("created_at")
    private String createdAt;
    private Author athlete;

    public Long getId() { return id; }
    public void setId(Long id) { this.id = id; }
    public String getText() { return text; }
    public void setText(String text) { this.text = text; }
    public String getCreatedAt() { return createdAt; }
    public void setCreatedAt(String createdAt) { this.createdAt = createdAt; }
    public Author getAthlete() { return athlete; }
    public void setAthlete(Author athlete) { this.athlete = athlete; }

    @JsonIgnoreProperties(ignoreUnknown = true)
    public static class Author {
        private String firstname;
        private String lastname;

        public String getFirstname() { return firstname; }
        public void setFirstname(String firstname) { this.firstname = firstname; }
        public String getLastname() { return lastname; }
        public void setLastname(String lastname) { this.lastname = lastname; }
    }
}
