package com.fragmentdl.services;

import com.fragmentdl.exceptions.ProbeException;
import com.fragmentdl.models.ProbeResult;
import com.fragmentdl.utils.CancellationToken;
import org.junit.jupiter.api.Test;

import java.net.URI;
import java.net.http.HttpClient;
import java.net.http.HttpHeaders;
import java.time.Duration;
import java.util.List;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class RangeProbeTest {

    private static HttpHeaders headers(String name, String value) {
        return HttpHeaders.of(Map.of(name, List.of(value)), (n, v) -> true);
    }

    @Test
    void partialContentReportsSizeAndRangeSupport() throws Exception {
        ProbeResult result = RangeProbe.interpret(206, headers("Content-Range", "bytes 0-0/1048576"));

        assertThat(result.totalSize()).isEqualTo(1_048_576);
        assertThat(result.supportsRanges()).isTrue();
    }

    @Test
    void partialContentWithUnexpectedRangeIsNotTrusted() throws Exception {
        ProbeResult result = RangeProbe.interpret(206, headers("Content-Range", "bytes 0-99/1000"));

        assertThat(result.totalSize()).isEqualTo(1000);
        assertThat(result.supportsRanges()).isFalse();
    }

    @Test
    void unknownTotalMeansUnknownSize() throws Exception {
        ProbeResult result = RangeProbe.interpret(206, headers("Content-Range", "bytes 0-0/*"));

        assertThat(result.isSizeKnown()).isFalse();
        assertThat(result.supportsRanges()).isFalse();
    }

    @Test
    void fullResponseMeansNoRanges() throws Exception {
        ProbeResult result = RangeProbe.interpret(200, headers("Content-Length", "5000"));

        assertThat(result.totalSize()).isEqualTo(5000);
        assertThat(result.supportsRanges()).isFalse();
        assertThat(RangeProbe.interpret(200, headers("Content-Type", "text/plain")).isSizeKnown()).isFalse();
    }

    @Test
    void unsatisfiableRangeOnEmptyResource() throws Exception {
        ProbeResult result = RangeProbe.interpret(416, headers("Content-Range", "bytes */0"));

        assertThat(result.totalSize()).isZero();
        assertThat(result.supportsRanges()).isFalse();
    }

    @Test
    void errorStatusFailsTheProbe() {
        assertThatThrownBy(() -> RangeProbe.interpret(403, headers("Content-Type", "text/html")))
                .isInstanceOf(ProbeException.class)
                .hasMessageContaining("403");
    }

    @Test
    void sizeBeyondLongRangeFailsTheRequest() {
        assertThatThrownBy(() -> RangeProbe.interpret(206, headers("Content-Range", "bytes 0-0/99999999999999999999")))
                .isInstanceOf(ProbeException.class)
                .hasMessageContaining("Malformed size headers")
                .hasCauseInstanceOf(NumberFormatException.class);
        assertThatThrownBy(() -> RangeProbe.interpret(200, headers("Content-Length", "99999999999999999999")))
                .isInstanceOf(ProbeException.class);
    }

    @Test
    void probesLiveServer() throws Exception {
        try (RangeServer server = new RangeServer(RangeServer.randomContent(12_345))) {
            HttpClient client = HttpClient.newBuilder().version(HttpClient.Version.HTTP_1_1).build();
            ProbeResult result = new RangeProbe(client, Duration.ofSeconds(5))
                    .probe(server.uri("/file"), new CancellationToken());

            assertThat(result).isEqualTo(new ProbeResult(12_345, true));
            assertThat(server.rangeHeaders()).containsExactly("bytes=0-0");
        }
    }

    @Test
    void unreachableHostIsProbeFailure() {
        HttpClient client = HttpClient.newBuilder().connectTimeout(Duration.ofSeconds(2)).build();
        RangeProbe probe = new RangeProbe(client, Duration.ofSeconds(2));

        assertThatThrownBy(() -> probe.probe(URI.create("http://127.0.0.1:1/file"), new CancellationToken()))
                .isInstanceOf(ProbeException.class)
                .hasMessageContaining("Cannot reach");
    }
}
