package com.yescount.planner;

import com.github.tomakehurst.wiremock.WireMockServer;
import com.github.tomakehurst.wiremock.core.WireMockConfiguration;
import org.junit.jupiter.api.AfterAll;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.data.redis.core.StringRedisTemplate;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.test.context.DynamicPropertyRegistry;
import org.springframework.test.context.DynamicPropertySource;
import org.springframework.test.web.servlet.MockMvc;
import org.springframework.test.web.servlet.request.MockMvcRequestBuilders;
import org.springframework.test.web.servlet.setup.MockMvcBuilders;
import org.springframework.web.context.WebApplicationContext;
import org.testcontainers.containers.GenericContainer;
import org.testcontainers.containers.PostgreSQLContainer;
import org.testcontainers.junit.jupiter.Container;
import org.testcontainers.junit.jupiter.Testcontainers;
import org.testcontainers.utility.DockerImageName;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.file.Files;
import java.nio.file.Path;

import static com.github.tomakehurst.wiremock.client.WireMock.aResponse;
import static com.github.tomakehurst.wiremock.client.WireMock.equalTo;
import static com.github.tomakehurst.wiremock.client.WireMock.get;
import static com.github.tomakehurst.wiremock.client.WireMock.urlPathEqualTo;
import static org.assertj.core.api.Assertions.assertThat;
import static org.hamcrest.Matchers.closeTo;
import static org.hamcrest.Matchers.contains;
import static org.hamcrest.Matchers.hasSize;
import static org.hamcrest.Matchers.is;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.post;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.jsonPath;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.status;

/**
 * End to end: open-data API and a scraped page served by WireMock, Postgres and Redis in containers.
 */
@SpringBootTest(classes = YesCountApplication.class)
@Testcontainers(disabledWithoutDocker = true)
class YesCountFullIntegrationTest {

    private static final String DATASET = "test-dataset";

    @Container
    static PostgreSQLContainer<?> postgres = new PostgreSQLContainer<>("postgres:15-alpine")
            .withDatabaseName("yescount_test")
            .withUsername("test")
            .withPassword("test");

    @Container
    static GenericContainer<?> redis = new GenericContainer<>(DockerImageName.parse("redis:7-alpine"))
            .withExposedPorts(6379)
            .withCommand("redis-server", "--save", "", "--appendonly", "no");

    private static final WireMockServer wireMockServer =
            new WireMockServer(WireMockConfiguration.options().dynamicPort());

    private static final Path sourcesFile;

    static {
        wireMockServer.start();
        try {
            sourcesFile = Files.createTempFile("scraper_sites", ".yaml");
            Files.writeString(sourcesFile, """
                    sources:
                      - name: local_cards
                        url: %s/listings
                        required: true
                        enabled: true
                      - name: paused_site
                        url: https://paused.example.com/
                        required: true
                        enabled: false
                    """.formatted(wireMockServer.baseUrl()));
        } catch (IOException e) {
            throw new UncheckedIOException(e);
        }
    }

    @Autowired
    private WebApplicationContext webApplicationContext;

    @Autowired
    private JdbcTemplate jdbcTemplate;

    @Autowired
    private StringRedisTemplate redisTemplate;

    private MockMvc mockMvc;

    @DynamicPropertySource
    static void configureProperties(DynamicPropertyRegistry registry) {
        registry.add("spring.datasource.url", postgres::getJdbcUrl);
        registry.add("spring.datasource.username", postgres::getUsername);
        registry.add("spring.datasource.password", postgres::getPassword);

        registry.add("spring.data.redis.host", redis::getHost);
        registry.add("spring.data.redis.port", () -> redis.getMappedPort(6379));

        registry.add("yescount.open-data.base-url", () -> wireMockServer.baseUrl() + "/");
        registry.add("yescount.open-data.dataset-id", () -> DATASET);
        registry.add("yescount.ingestion.sites-config-path", sourcesFile::toString);
        registry.add("yescount.ingestion.auto-refresh", () -> "false");
    }

    @AfterAll
    static void tearDownAll() throws IOException {
        wireMockServer.stop();
        Files.deleteIfExists(sourcesFile);
    }

    @BeforeEach
    void setUp() {
        mockMvc = MockMvcBuilders.webAppContextSetup(webApplicationContext).build();

        jdbcTemplate.update("DELETE FROM ingestion_source_checks");
        jdbcTemplate.update("DELETE FROM ingestion_runs");
        jdbcTemplate.update("DELETE FROM events");
        redisTemplate.getConnectionFactory().getConnection().serverCommands().flushDb();

        wireMockServer.resetAll();
        stubOpenData();
    }

    @Test
    void shouldIngestAndServeEvents() throws Exception {
        // Given
        stubListingsPage();

        // When
        mockMvc.perform(post("/ingestion/runs").param("force", "true"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.status", is("success")))
                .andExpect(jsonPath("$.events_upserted", is(3)));

        // Then
        mockMvc.perform(MockMvcRequestBuilders.get("/events/search").param("q", "jazz"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.data.events", hasSize(2)))
                .andExpect(jsonPath("$.data.events[*].title",
                        contains("Rooftop Jazz Night", "Summer Jazz Festival")));

        mockMvc.perform(MockMvcRequestBuilders.get("/events/search").param("tags", "family"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.data.events", hasSize(1)))
                .andExpect(jsonPath("$.data.events[0].title", is("Kids Science Day")))
                .andExpect(jsonPath("$.data.events[0].price_max", closeTo(0.0, 1e-9)));

        mockMvc.perform(MockMvcRequestBuilders.get("/events/curated").param("year", "2026").param("month", "4"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.data.events", hasSize(1)))
                .andExpect(jsonPath("$.data.events[0].source", is("scraped")))
                .andExpect(jsonPath("$.data.events[0].date_start", is("2026-04-18T00:00:00Z")));

        assertThat(jdbcTemplate.queryForList(
                "SELECT source_name || ':' || status FROM ingestion_source_checks ORDER BY id", String.class))
                .containsExactly("nyc_open_data:success", "local_cards:success", "paused_site:skipped");
    }

    @Test
    void shouldSkipFreshRunUnlessForced() throws Exception {
        stubListingsPage();

        mockMvc.perform(post("/ingestion/runs").param("force", "true"))
                .andExpect(jsonPath("$.status", is("success")));

        mockMvc.perform(post("/ingestion/runs"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.status", is("skipped")))
                .andExpect(jsonPath("$.reason", is("fresh_enough")));

        assertThat(jdbcTemplate.queryForObject("SELECT count(*) FROM ingestion_runs", Integer.class))
                .isEqualTo(1);
    }

    @Test
    void shouldFailRunWhenRequiredSiteIsDown() throws Exception {
        // Given
        wireMockServer.stubFor(get(urlPathEqualTo("/listings"))
                .willReturn(aResponse().withStatus(503)));

        // When & Then
        mockMvc.perform(post("/ingestion/runs").param("force", "true"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.status", is("failed")))
                .andExpect(jsonPath("$.events_upserted", is(2)))
                .andExpect(jsonPath("$.required_failed", contains("local_cards")));

        assertThat(jdbcTemplate.queryForObject("SELECT status FROM ingestion_runs", String.class))
                .isEqualTo("failed");
        assertThat(jdbcTemplate.queryForObject("SELECT count(*) FROM events", Integer.class))
                .isEqualTo(2);
    }

    private void stubOpenData() {
        wireMockServer.stubFor(get(urlPathEqualTo("/resource/" + DATASET + ".json"))
                .atPriority(5)
                .willReturn(aResponse()
                        .withHeader("Content-Type", "application/json")
                        .withBody("[]")));

        wireMockServer.stubFor(get(urlPathEqualTo("/resource/" + DATASET + ".json"))
                .withQueryParam("$offset", equalTo("0"))
                .atPriority(1)
                .willReturn(aResponse()
                        .withHeader("Content-Type", "application/json")
                        .withBody("""
                                [
                                  {"event_id": "nyc-1", "event_name": "Summer Jazz Festival",
                                   "description": "Open air concerts", "location": "Central Park",
                                   "start_date_time": "2026-04-20T19:00:00.000", "price": "$20 - $45"},
                                  {"event_id": "nyc-2", "event_name": "Kids Science Day",
                                   "short_description": "Hands-on experiments", "event_location": "Queens",
                                   "start_date_time": "2026-04-12T10:00:00.000", "free": true}
                                ]
                                """)));
    }

    private void stubListingsPage() {
        wireMockServer.stubFor(get(urlPathEqualTo("/listings"))
                .willReturn(aResponse()
                        .withHeader("Content-Type", "text/html; charset=utf-8")
                        .withBody("""
                                <html><body>
                                  <article>
                                    <h3>Rooftop Jazz Night</h3>
                                    <p>April 18, 2026</p>
                                    <p>Tickets $25</p>
                                    <a href="/jazz-night">Details</a>
                                  </article>
                                </body></html>
                                """)));
    }
}
