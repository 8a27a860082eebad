package com.autopost.scheduler.config;

import lombok.Getter;
import lombok.Setter;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.stereotype.Component;

import java.time.Duration;
import java.time.ZoneId;
import java.util.List;

/**
 * Posting cadence, publisher timing and collaborator settings.
 * Defaults match a single-instance deployment publishing through one connector.
 */
@Getter
@Setter
@Component
@ConfigurationProperties(prefix = "autopost")
public class AutopostProperties {

    private Posting posting = new Posting();
    private Publisher publisher = new Publisher();
    private Media media = new Media();
    private RateLimiter rateLimiter = new RateLimiter();
    private Quota quota = new Quota();
    private Accounts accounts = new Accounts();
    private Endpoint connector = new Endpoint("http://localhost:8088", Duration.ofMinutes(5));
    private Endpoint generation = new Endpoint("http://localhost:8001", Duration.ofSeconds(60));

    @Getter
    @Setter
    public static class Posting {
        /**
         * First hour of the day (inclusive) in which posts may be published.
         */
        private int windowStartHour = 8;

        /**
         * Hour of the day (exclusive) after which no post is scheduled.
         */
        private int windowEndHour = 23;

        private Duration minPostInterval = Duration.ofMinutes(30);
        private int maxPostsPerDay = 10;
        private int defaultPostsPerDay = 3;

        /**
         * Zone the posting window is expressed in. Blank means the system zone.
         */
        private String zone;

        public ZoneId getZoneId() {
            return zone == null || zone.isBlank() ? ZoneId.systemDefault() : ZoneId.of(zone);
        }
    }

    @Getter
    @Setter
    public static class Publisher {
        private boolean autoStart = true;
        private Duration tickInterval = Duration.ofSeconds(30);
        private Duration publishPause = Duration.ofSeconds(5);

        /**
         * How long before its scheduled time a post is already considered due.
         */
        private Duration earlyTolerance = Duration.ofMinutes(2);

        /**
         * Posts later than this are still published but logged as late.
         */
        private Duration gracePeriod = Duration.ofMinutes(10);

        /**
         * Posts later than this are demoted back to draft instead of published.
         */
        private Duration staleThreshold = Duration.ofHours(1);

        private Duration stopTimeout = Duration.ofSeconds(5);

        /**
         * Case-insensitive fragments of a publish failure that mark it as a pacing rejection.
         */
        private List<String> timingMarkers = List.of("too soon", "wait");

        private String missedNote = "Missed scheduled publication: the publisher was not running at the scheduled time";
    }

    @Getter
    @Setter
    public static class Media {
        private String photosDir = "data/media/photos";
        private String videosDir = "data/media/videos";
        private List<String> videoExtensions = List.of(".mp4", ".mov", ".avi");
    }

    @Getter
    @Setter
    public static class RateLimiter {
        private Duration minInterval = Duration.ofMillis(2500);
        private Duration window = Duration.ofMinutes(1);
    }

    @Getter
    @Setter
    public static class Quota {
        private Duration fallbackDelay = Duration.ofSeconds(30);
        private Duration safetyMargin = Duration.ofSeconds(5);
        private Duration maxInteractiveWait = Duration.ofMinutes(2);
        private int maxInteractiveAttempts = 3;
        private Duration progressChunk = Duration.ofSeconds(60);
    }

    @Getter
    @Setter
    public static class Accounts {
        private boolean autoLogin = true;
    }

    @Getter
    @Setter
    public static class Endpoint {
        private String baseUrl;
        private Duration timeout;

        public Endpoint() {
        }

        public Endpoint(String baseUrl, Duration timeout) {
            this.baseUrl = baseUrl;
            this.timeout = timeout;
        }
    }
}
