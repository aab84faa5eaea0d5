package com.coursegen.orchestrator.provider;

import com.coursegen.orchestrator.fallback.FailureKind;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;

class ProviderExceptionTest {

    @Test
    void httpStatus_authFailuresAreConfiguration() {
        assertThat(ProviderException.httpStatus("openai", 401, "bad key").kind()).isEqualTo(FailureKind.CONFIGURATION);
        assertThat(ProviderException.httpStatus("openai", 403, "forbidden").kind()).isEqualTo(FailureKind.CONFIGURATION);
    }

    @Test
    void httpStatus_otherStatusesAreProviderFailures() {
        ProviderException e = ProviderException.httpStatus("heygen", 503, "overloaded");

        assertThat(e.kind()).isEqualTo(FailureKind.PROVIDER);
        assertThat(e.getMessage()).isEqualTo("[PROVIDER] heygen error 503: overloaded");
    }

    @Test
    void httpStatus_abbreviatesLongBodies() {
        String body = "x".repeat(1000);

        assertThat(ProviderException.httpStatus("openai", 500, body).getMessage())
                .endsWith("...")
                .hasSizeLessThan(400);
    }

    @Test
    void missingCredential_isConfiguration() {
        ProviderException e = ProviderException.missingCredential("elevenlabs");

        assertThat(e.kind()).isEqualTo(FailureKind.CONFIGURATION);
        assertThat(e.getMessage()).contains("elevenlabs");
    }
}
