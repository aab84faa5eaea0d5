package com.coursegen.orchestrator.stage;

import com.coursegen.orchestrator.config.CourseGenProperties;
import com.coursegen.orchestrator.fallback.ProducerResult;
import com.coursegen.orchestrator.pipeline.RatePacer;
import com.coursegen.orchestrator.provider.ProviderException;
import com.coursegen.orchestrator.provider.VideoProvider;
import com.coursegen.orchestrator.provider.VideoStatus;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Component;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;

/**
 * Bounded wait for an asynchronous video job.
 *
 * Polls every {@code interval} against an absolute deadline of
 * {@code maxWait} after the first poll; failed status checks are logged and
 * count against the same budget, so the loop always ends.
 */
@Component
public class VideoPoller {

    private static final Logger log = LoggerFactory.getLogger(VideoPoller.class);

    private final VideoProvider     provider;
    private final Duration          interval;
    private final Duration          maxWait;
    private final Clock             clock;
    private final RatePacer.Sleeper sleeper;

    @Autowired
    public VideoPoller(VideoProvider provider, CourseGenProperties props) {
        this(provider, props.videoPoll().interval(), props.videoPoll().maxWait(),
             Clock.systemUTC(), d -> Thread.sleep(d.toMillis()));
    }

    public VideoPoller(VideoProvider provider, Duration interval, Duration maxWait,
                       Clock clock, RatePacer.Sleeper sleeper) {
        this.provider = provider;
        this.interval = interval;
        this.maxWait  = maxWait;
        this.clock    = clock;
        this.sleeper  = sleeper;
    }

    public Duration maxWait() {
        return maxWait;
    }

    public Duration interval() {
        return interval;
    }

    /** @return the result URL, or a PROVIDER / TIMEOUT failure */
    public ProducerResult<String> await(String jobId) {
        Instant deadline = clock.instant().plus(maxWait);
        int polls = 0;
        while (true) {
            polls++;
            try {
                VideoStatus status = provider.poll(jobId);
                switch (status.state()) {
                    case DONE:
                        log.info("Video {} ready after {} poll(s)", jobId, polls);
                        return ProducerResult.ok(status.resultUrl());
                    case ERROR:
                        return ProducerResult.providerError("Video " + jobId + " failed: " + status.error());
                    case PENDING:
                    default:
                        break;
                }
            } catch (ProviderException e) {
                log.warn("Status check {} for video {} failed: {}", polls, jobId, e.getMessage());
            }

            Instant now = clock.instant();
            if (!now.isBefore(deadline)) {
                return ProducerResult.timedOut("Video " + jobId + " not ready after "
                        + maxWait.toSeconds() + " s (" + polls + " polls)");
            }
            Duration left = Duration.between(now, deadline);
            try {
                sleeper.sleep(left.compareTo(interval) < 0 ? left : interval);
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                return ProducerResult.providerError("Interrupted while waiting for video " + jobId);
            }
        }
    }
}
