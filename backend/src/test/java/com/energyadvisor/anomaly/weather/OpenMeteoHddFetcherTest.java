package com.energyadvisor.anomaly.weather;

import com.energyadvisor.anomaly.config.AnomalyDetectionProperties;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.springframework.http.HttpMethod;
import org.springframework.http.MediaType;
import org.springframework.test.web.client.MockRestServiceServer;
import org.springframework.web.client.RestTemplate;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.hamcrest.Matchers.startsWith;
import static org.springframework.test.web.client.match.MockRestRequestMatchers.method;
import static org.springframework.test.web.client.match.MockRestRequestMatchers.queryParam;
import static org.springframework.test.web.client.match.MockRestRequestMatchers.requestTo;
import static org.springframework.test.web.client.response.MockRestResponseCreators.withServerError;
import static org.springframework.test.web.client.response.MockRestResponseCreators.withSuccess;

class OpenMeteoHddFetcherTest {

    private MockRestServiceServer server;
    private OpenMeteoHddFetcher fetcher;

    @BeforeEach
    void setUp() {
        RestTemplate restTemplate = new RestTemplate();
        server = MockRestServiceServer.bindTo(restTemplate).build();
        fetcher = new OpenMeteoHddFetcher(restTemplate, new PostalCodeLocator(), AnomalyDetectionProperties.defaults());
    }

    @Test
    @DisplayName("Should sum degrees below 18 C over the year's daily means")
    void shouldComputeHddFromDailyMeans() throws Exception {
        // Given
        server.expect(requestTo(startsWith("https://archive-api.open-meteo.com/v1/archive")))
                .andExpect(method(HttpMethod.GET))
                .andExpect(queryParam("latitude", "52.52"))
                .andExpect(queryParam("longitude", "13.4"))
                .andExpect(queryParam("start_date", "2023-01-01"))
                .andExpect(queryParam("end_date", "2023-12-31"))
                .andExpect(queryParam("daily", "temperature_2m_mean"))
                .andRespond(withSuccess("""
                        {"daily": {
                            "time": ["2023-01-01", "2023-01-02", "2023-01-03", "2023-07-01"],
                            "temperature_2m_mean": [10.0, 17.5, null, 22.3]
                        }}
                        """, MediaType.APPLICATION_JSON));

        // When
        double hdd = fetcher.fetchHdd("10115", 2023);

        // Then
        assertThat(hdd).isEqualTo(8.5);
        server.verify();
    }

    @Test
    @DisplayName("Should wrap server errors in HddFetchException")
    void shouldWrapServerErrors() {
        server.expect(requestTo(startsWith("https://archive-api.open-meteo.com/v1/archive")))
                .andRespond(withServerError());

        assertThatThrownBy(() -> fetcher.fetchHdd("10115", 2023))
                .isInstanceOf(HddFetchException.class)
                .hasMessageContaining("10115/2023");
    }

    @Test
    @DisplayName("Should reject a response without temperature data")
    void shouldRejectEmptyResponse() {
        server.expect(requestTo(startsWith("https://archive-api.open-meteo.com/v1/archive")))
                .andRespond(withSuccess("{\"daily\": {\"time\": []}}", MediaType.APPLICATION_JSON));

        assertThatThrownBy(() -> fetcher.fetchHdd("10115", 2023))
                .isInstanceOf(HddFetchException.class)
                .hasMessageContaining("No temperature data");
    }

    @Test
    @DisplayName("Should reject a year of missing daily values")
    void shouldRejectAllNullDays() {
        server.expect(requestTo(startsWith("https://archive-api.open-meteo.com/v1/archive")))
                .andRespond(withSuccess("{\"daily\": {\"temperature_2m_mean\": [null, null]}}",
                        MediaType.APPLICATION_JSON));

        assertThatThrownBy(() -> fetcher.fetchHdd("10115", 2023))
                .isInstanceOf(HddFetchException.class)
                .hasMessageContaining("empty days");
    }

    @Test
    @DisplayName("Should locate unknown postal codes in the centre of Germany")
    void shouldUseDefaultCoordinates() throws Exception {
        server.expect(requestTo(startsWith("https://archive-api.open-meteo.com/v1/archive")))
                .andExpect(queryParam("latitude", "51.16"))
                .andExpect(queryParam("longitude", "10.45"))
                .andRespond(withSuccess("{\"daily\": {\"temperature_2m_mean\": [18.0, 19.0]}}",
                        MediaType.APPLICATION_JSON));

        assertThat(fetcher.fetchHdd("AB-123", 2023)).isZero();
        server.verify();
    }
}
