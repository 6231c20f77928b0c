package com.scaniq.collector.entity;

import com.scaniq.collector.exception.ExtractionException;
import com.scaniq.collector.exception.FetchException;
import com.scaniq.collector.exception.ToolExecutionException;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.net.ConnectException;
import java.net.UnknownHostException;
import java.util.concurrent.TimeoutException;

import static org.assertj.core.api.Assertions.assertThat;

class ToolFailureReasonTest {

    @Test
    @DisplayName("classifies common failures")
    void classifies() {
        assertThat(ToolFailureReason.fromException(new TimeoutException("Did not observe any item")))
                .isEqualTo(ToolFailureReason.TIMEOUT);
        assertThat(ToolFailureReason.fromException(new ConnectException("Connection refused")))
                .isEqualTo(ToolFailureReason.CONNECTION_REFUSED);
        assertThat(ToolFailureReason.fromException(new UnknownHostException("acme.invalid")))
                .isEqualTo(ToolFailureReason.DNS_RESOLUTION_FAILED);
        assertThat(ToolFailureReason.fromException(new FetchException("https://acme.io/", 503)))
                .isEqualTo(ToolFailureReason.HTTP_STATUS);
        assertThat(ToolFailureReason.fromException(new ExtractionException("bad json", null)))
                .isEqualTo(ToolFailureReason.EXTRACTION_FAILED);
        assertThat(ToolFailureReason.fromException(ToolExecutionException.unavailable("rendered-fetch", "disabled")))
                .isEqualTo(ToolFailureReason.SERVICE_UNAVAILABLE);
    }

    @Test
    @DisplayName("falls back to the cause, then to unknown")
    void causeAndUnknown() {
        assertThat(ToolFailureReason.fromException(new RuntimeException("wrapped", new ConnectException("Connection refused"))))
                .isEqualTo(ToolFailureReason.CONNECTION_REFUSED);
        assertThat(ToolFailureReason.fromException(new IllegalStateException("boom")))
                .isEqualTo(ToolFailureReason.UNKNOWN);
        assertThat(ToolFailureReason.fromException(null)).isEqualTo(ToolFailureReason.UNKNOWN);
    }
}
