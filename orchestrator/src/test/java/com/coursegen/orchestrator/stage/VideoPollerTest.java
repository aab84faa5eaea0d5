package com.coursegen.orchestrator.stage;

import com.coursegen.orchestrator.fallback.FailureKind;
import com.coursegen.orchestrator.fallback.ProducerResult;
import com.coursegen.orchestrator.provider.ProviderException;
import com.coursegen.orchestrator.provider.VideoProvider;
import com.coursegen.orchestrator.provider.VideoStatus;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.time.ZoneId;
import java.time.ZoneOffset;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.Mockito.*;

/**
 * The poller runs on a hand-advanced clock: every "sleep" moves time forward
 * instead of blocking.
 */
@ExtendWith(MockitoExtension.class)
class VideoPollerTest {

    @Mock VideoProvider provider;

    SteppingClock clock;
    VideoPoller   poller;

    @BeforeEach
    void setUp() {
        clock  = new SteppingClock(Instant.parse("2026-01-01T00:00:00Z"));
        poller = new VideoPoller(provider, Duration.ofSeconds(10), Duration.ofSeconds(30), clock, clock::advance);
    }

    @Test
    void readyOnThirdPoll_returnsUrl() {
        when(provider.poll("talk-1")).thenReturn(
                VideoStatus.pending(), VideoStatus.pending(), VideoStatus.done("https://cdn/video.mp4"));

        ProducerResult<String> result = poller.await("talk-1");

        assertThat(result.isOk()).isTrue();
        assertThat(result.value()).isEqualTo("https://cdn/video.mp4");
        verify(provider, times(3)).poll("talk-1");
    }

    @Test
    void neverReady_timesOutWithinBudget() {
        when(provider.poll("talk-1")).thenReturn(VideoStatus.pending());

        ProducerResult<String> result = poller.await("talk-1");

        assertThat(result.failureKind()).isEqualTo(FailureKind.TIMEOUT);
        // polls at 0, 10, 20 and 30 s; the last one meets the deadline
        verify(provider, times(4)).poll("talk-1");
        assertThat(clock.elapsed()).isEqualTo(Duration.ofSeconds(30));
    }

    @Test
    void failingStatusChecks_countAgainstTheBudget() {
        when(provider.poll("talk-1")).thenThrow(new ProviderException(FailureKind.PROVIDER, "502"));

        ProducerResult<String> result = poller.await("talk-1");

        assertThat(result.failureKind()).isEqualTo(FailureKind.TIMEOUT);
        assertThat(clock.elapsed()).isLessThanOrEqualTo(Duration.ofSeconds(40));
    }

    @Test
    void providerReportsError_isAProviderFailure() {
        when(provider.poll("talk-1")).thenReturn(VideoStatus.pending(), VideoStatus.error("face not found"));

        ProducerResult<String> result = poller.await("talk-1");

        assertThat(result.failureKind()).isEqualTo(FailureKind.PROVIDER);
        assertThat(result.reason()).contains("face not found");
    }

    static final class SteppingClock extends Clock {

        private final Instant start;
        private Instant       now;

        SteppingClock(Instant start) {
            this.start = start;
            this.now   = start;
        }

        void advance(Duration d) {
            now = now.plus(d);
        }

        Duration elapsed() {
            return Duration.between(start, now);
        }

        @Override public ZoneId getZone()                 { return ZoneOffset.UTC; }
        @Override public Clock withZone(ZoneId zone)      { return this; }
        @Override public Instant instant()                { return now; }
    }
}
