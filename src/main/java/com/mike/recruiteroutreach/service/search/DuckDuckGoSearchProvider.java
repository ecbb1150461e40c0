package com.mike.recruiteroutreach.service.search;

import com.mike.recruiteroutreach.config.RecruiterFinderProperties;
import com.mike.recruiteroutreach.config.SearchBackendProperties;
import com.mike.recruiteroutreach.dto.SearchHit;
import lombok.extern.slf4j.Slf4j;
import org.jsoup.Connection;
import org.jsoup.Jsoup;
import org.jsoup.nodes.Document;
import org.jsoup.nodes.Element;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.net.SocketTimeoutException;
import java.net.URLDecoder;
import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.concurrent.ThreadLocalRandom;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * DuckDuckGo HTML endpoint. Free and keyless, so it always heads the cascade,
 * but it starts answering with bot challenges after a few quick queries.
 */
@Component
@Slf4j
public class DuckDuckGoSearchProvider implements SearchProvider {

    private static final String DEFAULT_BASE_URL = "https://html.duckduckgo.com/html/";

    private static final Pattern UDDG_PARAM = Pattern.compile("[?&]uddg=([^&]+)");

    private static final List<String> USER_AGENTS = List.of(
            "Mozilla/5.0 (Macintosh; Intel Mac OS X 10_15_7) AppleWebKit/537.36 (KHTML, like Gecko) Chrome/120.0.0.0 Safari/537.36",
            "Mozilla/5.0 (Windows NT 10.0; Win64; x64) AppleWebKit/537.36 (KHTML, like Gecko) Chrome/121.0.0.0 Safari/537.36",
            "Mozilla/5.0 (Macintosh; Intel Mac OS X 10.15; rv:109.0) Gecko/20100101 Firefox/109.0"
    );

    private final String baseUrl;
    private final int timeoutMillis;

    public DuckDuckGoSearchProvider(SearchBackendProperties backends, RecruiterFinderProperties properties) {
        String configured = backends.duckduckgo().baseUrl();
        this.baseUrl = configured == null || configured.isBlank() ? DEFAULT_BASE_URL : configured;
        this.timeoutMillis = (int) properties.getHttp().getReadTimeoutMillis();
    }

    @Override
    public String name() {
        return "duckduckgo";
    }

    @Override
    public boolean isConfigured() {
        return true;
    }

    @Override
    public SearchOutcome execute(String query) {
        log.info("DuckDuckGoSearchProvider.execute: query='{}'", query);

        Connection.Response response;
        try {
            response = Jsoup.connect(baseUrl)
                    .userAgent(USER_AGENTS.get(ThreadLocalRandom.current().nextInt(USER_AGENTS.size())))
                    .header("Accept", "text/html,application/xhtml+xml,application/xml;q=0.9,*/*;q=0.8")
                    .header("Accept-Language", "en-US,en;q=0.9")
                    .referrer("https://html.duckduckgo.com/")
                    .data("q", query)
                    .data("b", "")
                    .method(Connection.Method.POST)
                    .timeout(timeoutMillis)
                    .followRedirects(true)
                    .ignoreHttpErrors(true)
                    .execute();
        } catch (SocketTimeoutException e) {
            return SearchOutcome.failed(SearchFailure.Reason.TIMEOUT, "DuckDuckGo request timed out");
        } catch (IOException e) {
            return SearchOutcome.failed(SearchFailure.Reason.NETWORK, "DuckDuckGo network error: " + e.getMessage());
        } catch (IllegalArgumentException e) {
            // malformed base-url
            return SearchOutcome.failed(SearchFailure.Reason.HTTP_ERROR, "DuckDuckGo request failed: " + e.getMessage());
        }

        int status = response.statusCode();
        if (status == 202) {
            return SearchOutcome.failed(SearchFailure.Reason.BLOCKED, "DuckDuckGo bot detection triggered (HTTP 202)");
        }
        if (status == 429) {
            return SearchOutcome.failed(SearchFailure.Reason.RATE_LIMITED, "DuckDuckGo rate limited (HTTP 429)");
        }
        if (status != 200) {
            return SearchOutcome.failed(SearchFailure.Reason.HTTP_ERROR, "DuckDuckGo returned HTTP " + status);
        }

        String html = response.body();
        if (isChallengePage(html)) {
            return SearchOutcome.failed(SearchFailure.Reason.BLOCKED, "DuckDuckGo bot challenge detected");
        }

        List<SearchHit> hits = parseResults(html);
        log.debug("DuckDuckGoSearchProvider.execute: parsed {} results", hits.size());
        return SearchOutcome.success(hits);
    }

    static boolean isChallengePage(String html) {
        if (html == null) {
            return false;
        }
        return html.toLowerCase(Locale.ROOT).contains("anomaly") || html.contains("challenge-form");
    }

    static List<SearchHit> parseResults(String html) {
        List<SearchHit> hits = new ArrayList<>();
        if (html == null || html.isBlank()) {
            return hits;
        }

        Document doc = Jsoup.parse(html);
        for (Element anchor : doc.select("a.result__a")) {
            String target = extractTargetUrl(anchor.attr("href"));
            if (target == null) {
                continue;
            }
            Element result = anchor.closest(".result");
            String snippet = "";
            if (result != null) {
                Element snippetEl = result.selectFirst(".result__snippet");
                if (snippetEl != null) {
                    snippet = snippetEl.text();
                }
            }
            hits.add(new SearchHit(target, anchor.text().trim(), snippet));
        }
        return hits;
    }

    /**
     * DuckDuckGo wraps result links in a redirect: //duckduckgo.com/l/?uddg=&lt;encoded target&gt;.
     */
    static String extractTargetUrl(String href) {
        if (href == null || href.isBlank()) {
            return null;
        }
        Matcher m = UDDG_PARAM.matcher(href);
        if (m.find()) {
            try {
                return URLDecoder.decode(m.group(1), StandardCharsets.UTF_8);
            } catch (IllegalArgumentException ex) {
                log.debug("DuckDuckGoSearchProvider: could not decode redirect '{}'", href, ex);
                return null;
            }
        }
        return href.startsWith("http") ? href : null;
    }
}
