package com.fragmentdl.services;

import com.fragmentdl.exceptions.DownloadCancelledException;
import com.fragmentdl.exceptions.ProbeException;
import com.fragmentdl.models.ProbeResult;
import com.fragmentdl.utils.CancellationToken;
import lombok.extern.slf4j.Slf4j;

import java.io.IOException;
import java.io.InputStream;
import java.net.URI;
import java.net.http.HttpClient;
import java.net.http.HttpHeaders;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.time.Duration;
import java.util.Optional;
import java.util.OptionalLong;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Finds the resource size and whether the server honors byte ranges by asking for its first byte.
 */
@Slf4j
public class RangeProbe {

    private static final Pattern CONTENT_RANGE = Pattern.compile("bytes\\s+(\\d+)-(\\d+)/(\\d+|\\*)");
    private static final Pattern UNSATISFIED_RANGE = Pattern.compile("bytes\\s+\\*/(\\d+)");

    private final HttpClient client;
    private final Duration timeout;

    public RangeProbe(HttpClient client, Duration timeout) {
        this.client = client;
        this.timeout = timeout;
    }

    public ProbeResult probe(URI source, CancellationToken token) throws ProbeException, DownloadCancelledException {
        HttpRequest request = HttpRequest.newBuilder(source)
                .timeout(timeout)
                .header("Range", "bytes=0-0")
                .GET()
                .build();

        HttpResponse<InputStream> response;
        try {
            response = HttpCalls.await(client.sendAsync(request, HttpResponse.BodyHandlers.ofInputStream()), token);
        } catch (IOException e) {
            throw new ProbeException("Cannot reach " + source + ": " + describe(e), null, e);
        }

        // only headers matter, the body is dropped unread
        try (InputStream ignored = response.body()) {
            ProbeResult result = interpret(response.statusCode(), response.headers());
            log.info("Probe {}: status {}, size {}, ranges {}", source, response.statusCode(),
                    result.isSizeKnown() ? result.totalSize() : "unknown", result.supportsRanges());
            return result;
        } catch (IOException e) {
            throw new ProbeException("Probe of " + source + " failed: " + describe(e), response.statusCode(), e);
        }
    }

    static ProbeResult interpret(int status, HttpHeaders headers) throws ProbeException {
        try {
            return parse(status, headers);
        } catch (NumberFormatException e) {
            throw new ProbeException("Malformed size headers in probe response: " + e.getMessage(), status, e);
        }
    }

    private static ProbeResult parse(int status, HttpHeaders headers) throws ProbeException {
        Optional<String> contentRange = headers.firstValue("Content-Range");
        if (status == 206) {
            Matcher matcher = CONTENT_RANGE.matcher(contentRange.orElse(""));
            if (!matcher.find()) {
                return ProbeResult.unknownSize();
            }
            if ("*".equals(matcher.group(3))) {
                return ProbeResult.unknownSize();
            }
            long total = Long.parseLong(matcher.group(3));
            boolean exact = Long.parseLong(matcher.group(1)) == 0 && Long.parseLong(matcher.group(2)) == 0;
            return new ProbeResult(total, exact);
        }
        if (status == 200) {
            OptionalLong length = headers.firstValueAsLong("Content-Length");
            return length.isPresent() ? new ProbeResult(length.getAsLong(), false) : ProbeResult.unknownSize();
        }
        if (status == 416) {
            Matcher matcher = UNSATISFIED_RANGE.matcher(contentRange.orElse(""));
            if (matcher.find()) {
                return new ProbeResult(Long.parseLong(matcher.group(1)), false);
            }
        }
        throw new ProbeException("Probe failed with HTTP " + status, status, null);
    }

    private static String describe(IOException e) {
        return e.getMessage() != null ? e.getMessage() : e.getClass().getSimpleName();
    }
}
