@org.springframework.modulith.NamedInterface("strava")
package com.bko.stravacache.integrations.strava;
