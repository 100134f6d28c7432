package com.bko.stravacache.harvest.web;

import com.bko.stravacache.cache.CacheAdminUseCase;
import com.bko.stravacache.harvest.BatchFetchUseCase;
import com.bko.stravacache.harvest.BatchOptions;
import com.bko.stravacache.harvest.BatchResult;
import com.bko.stravacache.harvest.CachedActivitiesUseCase;
import com.bko.stravacache.harvest.ComprehensiveActivity;
import com.bko.stravacache.harvest.ComprehensiveActivityUseCase;
import com.bko.stravacache.harvest.HarvestMode;
import com.bko.stravacache.harvest.HarvestRequest;
import com.bko.stravacache.harvest.HarvestStatus;
import com.bko.stravacache.harvest.HarvestSummary;
import com.bko.stravacache.harvest.HarvestUseCase;
import com.bko.stravacache.harvest.QuotaExhaustedException;
import com.bko.stravacache.harvest.web.dto.BatchRequestDto;
import com.bko.stravacache.harvest.web.dto.CacheOverviewDto;
import com.bko.stravacache.harvest.web.dto.CacheStatsDto;
import com.bko.stravacache.harvest.web.dto.CacheStatusDto;
import com.bko.stravacache.harvest.web.dto.CachedActivitiesDto;
import com.bko.stravacache.harvest.web.dto.ClearCacheDto;
import com.bko.stravacache.harvest.web.dto.EnrichRequestDto;
import com.bko.stravacache.harvest.web.dto.ErrorDto;
import com.bko.stravacache.harvest.web.dto.HarvestRequestDto;
import com.bko.stravacache.harvest.web.dto.RateLimitDto;
import com.bko.stravacache.integrations.strava.StravaApiException;
import com.bko.stravacache.ratelimit.RateLimitTracker;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.HttpHeaders;
import org.springframework.http.HttpStatus;
import org.springframework.http.MediaType;
import org.springframework.http.ResponseEntity;
import org.springframework.http.converter.HttpMessageNotReadableException;
import org.springframework.web.bind.annotation.DeleteMapping;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestHeader;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;
import org.springframework.web.method.annotation.MethodArgumentTypeMismatchException;

import java.io.IOException;
import java.util.List;
import java.util.Map;

@RestController
@RequestMapping(value = "/api", produces = MediaType.APPLICATION_JSON_VALUE)
public class StravaCacheController {
    private static final Logger logger = LoggerFactory.getLogger(StravaCacheController.class);
    private static final int OVERVIEW_ID_LIMIT = 100;
    private static final String BEARER = "Bearer ";

    private final BatchFetchUseCase batchFetchUseCase;
    private final HarvestUseCase harvestUseCase;
    private final ComprehensiveActivityUseCase comprehensiveActivityUseCase;
    private final CachedActivitiesUseCase cachedActivitiesUseCase;
    private final CacheAdminUseCase cacheAdminUseCase;
    private final RateLimitTracker rateLimitTracker;

    public StravaCacheController(BatchFetchUseCase batchFetchUseCase,
                                 HarvestUseCase harvestUseCase,
                                 ComprehensiveActivityUseCase comprehensiveActivityUseCase,
                                 CachedActivitiesUseCase cachedActivitiesUseCase,
                                 CacheAdminUseCase cacheAdminUseCase,
                                 RateLimitTracker rateLimitTracker) {
        this.batchFetchUseCase = batchFetchUseCase;
        this.harvestUseCase = harvestUseCase;
        this.comprehensiveActivityUseCase = comprehensiveActivityUseCase;
        this.cachedActivitiesUseCase = cachedActivitiesUseCase;
        this.cacheAdminUseCase = cacheAdminUseCase;
        this.rateLimitTracker = rateLimitTracker;
    }

    @GetMapping("/strava-cache")
    public CacheOverviewDto overview(@RequestParam(required = false) String athleteId) {
        List<String> ids = cacheAdminUseCase.listCachedActivityIds(athleteId);
        return new CacheOverviewDto(
                CacheStatsDto.from(cacheAdminUseCase.getStats()),
                ids.subList(0, Math.min(OVERVIEW_ID_LIMIT, ids.size())),
                ids.size(),
                rateLimit()
        );
    }

    @PostMapping(value = "/strava-cache", consumes = MediaType.APPLICATION_JSON_VALUE)
    public ResponseEntity<HarvestSummary> harvest(@RequestHeader(value = HttpHeaders.AUTHORIZATION, required = false) String authorization,
                                                  @RequestBody HarvestRequestDto requestDto) throws IOException {
        String token = bearerToken(authorization);
        HarvestRequest request = new HarvestRequest(
                HarvestMode.parse(requestDto.mode()),
                requestDto.year(),
                requestDto.limit() == null ? HarvestRequest.DEFAULT_LIMIT : requestDto.limit()
        );
        HarvestSummary summary = harvestUseCase.harvest(token, requestDto.athleteId(), request);
        HttpStatus status = summary.status() == HarvestStatus.RATE_LIMITED ? HttpStatus.TOO_MANY_REQUESTS : HttpStatus.OK;
        return ResponseEntity.status(status).body(summary);
    }

    @PostMapping(value = "/strava-cache/batch", consumes = MediaType.APPLICATION_JSON_VALUE)
    public BatchResult batch(@RequestHeader(value = HttpHeaders.AUTHORIZATION, required = false) String authorization,
                             @RequestBody BatchRequestDto requestDto) {
        String token = bearerToken(authorization);
        BatchOptions options = BatchOptions.defaults()
                .withForceRefresh(Boolean.TRUE.equals(requestDto.forceRefresh()));
        if (requestDto.maxConcurrent() != null) {
            options = options.withMaxConcurrent(requestDto.maxConcurrent());
        }
        if (Boolean.TRUE.equals(requestDto.includeStreams())) {
            options = options.withStreams();
        }
        return batchFetchUseCase.batchFetch(token, requestDto.activityIds(), requestDto.athleteId(), options);
    }

    @DeleteMapping("/strava-cache")
    public ClearCacheDto clear(@RequestParam(required = false) Boolean all,
                               @RequestParam(required = false) Integer olderThan) throws IOException {
        if (Boolean.TRUE.equals(all)) {
            int deleted = cacheAdminUseCase.clearAll();
            return new ClearCacheDto(deleted, "Cleared all " + deleted + " cache entries");
        }
        if (olderThan != null) {
            int deleted = cacheAdminUseCase.clearOlderThan(olderThan);
            return new ClearCacheDto(deleted, "Cleared " + deleted + " entries older than " + olderThan + " days");
        }
        throw new IllegalArgumentException("Specify all=true or olderThan=<days>");
    }

    @GetMapping("/strava-cache/activities/{athleteId}/{activityId}")
    public CacheStatusDto cacheStatus(@PathVariable String athleteId, @PathVariable String activityId) {
        return CacheStatusDto.from(cachedActivitiesUseCase.getCacheStatus(athleteId, activityId));
    }

    @DeleteMapping("/strava-cache/activities/{athleteId}/{activityId}")
    public ClearCacheDto deleteActivity(@PathVariable String athleteId, @PathVariable String activityId) throws IOException {
        int deleted = cacheAdminUseCase.deleteActivity(athleteId, activityId);
        return new ClearCacheDto(deleted, "Removed " + deleted + " cached resources of activity " + activityId);
    }

    @GetMapping("/comprehensive-activity-data")
    public ComprehensiveActivity comprehensiveActivity(@RequestHeader(value = HttpHeaders.AUTHORIZATION, required = false) String authorization,
                                                       @RequestParam String activityId,
                                                       @RequestParam String athleteId,
                                                       @RequestParam(defaultValue = "false") boolean skipCache) throws IOException {
        return comprehensiveActivityUseCase.getComprehensiveActivity(bearerToken(authorization), activityId, athleteId, skipCache);
    }

    @GetMapping("/cached-activities")
    public CachedActivitiesDto cachedActivities(@RequestParam(required = false) String athleteId) {
        if (athleteId == null || athleteId.isBlank()) {
            return CachedActivitiesDto.athletes(cacheAdminUseCase.listCachedAthletes());
        }
        return CachedActivitiesDto.forAthlete(athleteId, cachedActivitiesUseCase.listCachedActivities(athleteId));
    }

    @PostMapping(value = "/cached-activities/enrich", consumes = MediaType.APPLICATION_JSON_VALUE)
    public CachedActivitiesUseCase.Enrichment enrich(@RequestBody EnrichRequestDto requestDto) {
        List<String> ids = requestDto.activityIds() == null ? List.of() : requestDto.activityIds();
        return cachedActivitiesUseCase.enrichFromCache(ids, requestDto.athleteId());
    }

    @GetMapping("/rate-limit")
    public RateLimitDto rateLimit() {
        return RateLimitDto.from(rateLimitTracker.getInfo(), rateLimitTracker.isNearLimit());
    }

    @ExceptionHandler(IllegalArgumentException.class)
    public ResponseEntity<ErrorDto> badRequest(IllegalArgumentException e) {
        return error(HttpStatus.BAD_REQUEST, e.getMessage());
    }

    @ExceptionHandler({HttpMessageNotReadableException.class, MethodArgumentTypeMismatchException.class})
    public ResponseEntity<ErrorDto> malformedRequest(RuntimeException e) {
        return error(HttpStatus.BAD_REQUEST, "Malformed request: " + e.getMessage());
    }

    @ExceptionHandler(QuotaExhaustedException.class)
    public ResponseEntity<Map<String, Object>> quotaExhausted(QuotaExhaustedException e) {
        return ResponseEntity.status(HttpStatus.TOO_MANY_REQUESTS)
                .contentType(MediaType.APPLICATION_JSON)
                .body(Map.of("error", e.getMessage(), "rateLimits", e.getRateLimit()));
    }

    @ExceptionHandler(IOException.class)
    public ResponseEntity<ErrorDto> upstreamFailure(IOException e) {
        if (e instanceof StravaApiException apiException && apiException.getStatusCode() == 401) {
            return error(HttpStatus.UNAUTHORIZED, e.getMessage());
        }
        logger.error("Request failed", e);
        return error(HttpStatus.BAD_GATEWAY, e.getMessage());
    }

    @ExceptionHandler(MissingTokenException.class)
    public ResponseEntity<ErrorDto> missingToken(MissingTokenException e) {
        return error(HttpStatus.UNAUTHORIZED, e.getMessage());
    }

    @ExceptionHandler(RuntimeException.class)
    public ResponseEntity<ErrorDto> unexpectedFailure(RuntimeException e) {
        logger.error("Unexpected failure", e);
        return ResponseEntity.status(HttpStatus.INTERNAL_SERVER_ERROR)
                .contentType(MediaType.APPLICATION_JSON)
                .body(new ErrorDto("Internal server error", e.getMessage()));
    }

    private static ResponseEntity<ErrorDto> error(HttpStatus status, String message) {
        return ResponseEntity.status(status)
                .contentType(MediaType.APPLICATION_JSON)
                .body(new ErrorDto(message));
    }

    private static String bearerToken(String authorization) {
        if (authorization == null || !authorization.startsWith(BEARER) || authorization.substring(BEARER.length()).isBlank()) {
            throw new MissingTokenException();
        }
        return authorization.substring(BEARER.length()).trim();
    }

    static final class MissingTokenException extends RuntimeException {
        MissingTokenException() {
            super("Missing bearer token");
        }
    }
}
