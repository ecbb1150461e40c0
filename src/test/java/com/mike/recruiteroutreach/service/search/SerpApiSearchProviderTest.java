package com.mike.recruiteroutreach.service.search;

import com.mike.recruiteroutreach.config.SearchBackendProperties;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.springframework.http.MediaType;
import org.springframework.test.web.client.MockRestServiceServer;
import org.springframework.web.client.RestClient;

import static org.assertj.core.api.Assertions.assertThat;
import static org.hamcrest.Matchers.startsWith;
import static org.springframework.test.web.client.match.MockRestRequestMatchers.queryParam;
import static org.springframework.test.web.client.match.MockRestRequestMatchers.requestTo;
import static org.springframework.test.web.client.response.MockRestResponseCreators.withSuccess;

class SerpApiSearchProviderTest {

    private MockRestServiceServer server;
    private SerpApiSearchProvider provider;

    @BeforeEach
    void setUp() {
        RestClient.Builder builder = RestClient.builder();
        server = MockRestServiceServer.bindTo(builder).build();
        SearchBackendProperties properties = new SearchBackendProperties(null, null, null, null,
                new SearchBackendProperties.SerpApi("serp-key", null, null, null, null));
        provider = new SerpApiSearchProvider(properties, builder.build());
    }

    @Test
    @DisplayName("organic_results with a link become hits")
    void parses_organic_results() {
        server.expect(requestTo(startsWith("https://serpapi.com/search")))
                .andExpect(queryParam("engine", "google"))
                .andExpect(queryParam("api_key", "serp-key"))
                .andRespond(withSuccess("""
                        {"search_metadata":{"status":"Success"},
                         "organic_results":[
                           {"position":1,"link":"https://www.linkedin.com/in/janedoe","title":"Jane Doe - Recruiter","snippet":"Acme"},
                           {"position":2,"title":"no link"}
                         ]}
                        """, MediaType.APPLICATION_JSON));

        SearchOutcome outcome = provider.execute("q");

        assertThat(outcome.isSuccess()).isTrue();
        assertThat(outcome.hits()).singleElement()
                .satisfies(h -> assertThat(h.url()).isEqualTo("https://www.linkedin.com/in/janedoe"));
        server.verify();
    }

    @Test
    @DisplayName("error field on a 200 body -> failed outcome")
    void error_body_is_a_failure() {
        server.expect(requestTo(startsWith("https://serpapi.com/search")))
                .andRespond(withSuccess("{\"error\":\"Your account has run out of searches.\"}", MediaType.APPLICATION_JSON));

        SearchOutcome outcome = provider.execute("q");

        assertThat(outcome.isSuccess()).isFalse();
        assertThat(outcome.failure().message()).contains("run out of searches");
    }

    @Test
    @DisplayName("configured only with an api key")
    void is_configured() {
        assertThat(provider.isConfigured()).isTrue();
        assertThat(new SerpApiSearchProvider(new SearchBackendProperties(null, null, null, null, null),
                RestClient.create()).isConfigured()).isFalse();
    }
}
