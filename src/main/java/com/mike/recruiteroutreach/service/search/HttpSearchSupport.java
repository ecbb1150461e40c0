package com.mike.recruiteroutreach.service.search;

import com.mike.recruiteroutreach.dto.SearchHit;
import lombok.extern.slf4j.Slf4j;
import org.springframework.web.client.ResourceAccessException;
import org.springframework.web.client.RestClientException;
import org.springframework.web.client.RestClientResponseException;

import java.net.SocketTimeoutException;
import java.util.List;
import java.util.function.Supplier;

/**
 * Runs one RestClient search call and turns every kind of failure into a
 * {@link SearchOutcome} instead of an exception.
 */
@Slf4j
final class HttpSearchSupport {

    private HttpSearchSupport() {
    }

    static SearchOutcome call(String backend, Supplier<List<SearchHit>> request) {
        try {
            List<SearchHit> hits = request.get();
            return SearchOutcome.success(hits == null ? List.of() : hits);
        } catch (RestClientResponseException e) {
            int status = e.getStatusCode().value();
            log.warn("{}: HTTP error status={}", backend, status);
            return SearchOutcome.failed(classifyStatus(status), backend + " returned HTTP " + status);
        } catch (ResourceAccessException e) {
            if (hasCause(e, SocketTimeoutException.class)) {
                return SearchOutcome.failed(SearchFailure.Reason.TIMEOUT, backend + " request timed out");
            }
            return SearchOutcome.failed(SearchFailure.Reason.NETWORK, backend + " network error: " + e.getMessage());
        } catch (RestClientException e) {
            log.debug("{}: unreadable response", backend, e);
            return SearchOutcome.failed(SearchFailure.Reason.MALFORMED, backend + " malformed response: " + e.getMessage());
        } catch (RuntimeException e) {
            // bad base-url, unexpected body shape and the like
            log.warn("{}: request failed: {}", backend, e.toString());
            return SearchOutcome.failed(SearchFailure.Reason.HTTP_ERROR, backend + " request failed: " + e.getMessage());
        }
    }

    static SearchFailure.Reason classifyStatus(int status) {
        return switch (status) {
            case 401, 403 -> SearchFailure.Reason.AUTH;
            case 402, 429 -> SearchFailure.Reason.RATE_LIMITED;
            case 202 -> SearchFailure.Reason.BLOCKED;
            default -> SearchFailure.Reason.HTTP_ERROR;
        };
    }

    static boolean hasCause(Throwable ex, Class<? extends Throwable> type) {
        Throwable cause = ex;
        while (cause != null) {
            if (type.isInstance(cause)) {
                return true;
            }
            cause = cause.getCause();
        }
        return false;
    }

    static boolean isBlank(String s) {
        return s == null || s.isBlank();
    }
}
