package com.energyadvisor.anomaly.weather;

import com.energyadvisor.anomaly.config.AnomalyDetectionProperties;
import com.fasterxml.jackson.databind.JsonNode;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import org.springframework.web.client.RestClientException;
import org.springframework.web.client.RestTemplate;
import org.springframework.web.util.UriComponentsBuilder;

import java.math.BigDecimal;
import java.math.RoundingMode;
import java.net.URI;

/**
 * Heating degree days from the Open-Meteo historical weather archive.
 *
 * No API key is required. Daily mean temperatures of the postal region's reference
 * city are summed into HDD: every day below the base temperature contributes
 * (base - mean temperature).
 */
@Service
@Slf4j
public class OpenMeteoHddFetcher implements HddFetcher {

    private static final String DAILY_VARIABLE = "temperature_2m_mean";
    private static final String TIMEZONE = "Europe/Berlin";

    private final RestTemplate restTemplate;
    private final PostalCodeLocator postalCodeLocator;
    private final String apiBaseUrl;
    private final double baseTemperature;

    public OpenMeteoHddFetcher(RestTemplate weatherRestTemplate,
                               PostalCodeLocator postalCodeLocator,
                               AnomalyDetectionProperties properties) {
        this.restTemplate = weatherRestTemplate;
        this.postalCodeLocator = postalCodeLocator;
        this.apiBaseUrl = properties.weather().apiBaseUrl();
        this.baseTemperature = properties.weather().baseTemperatureCelsius();
    }

    @Override
    public double fetchHdd(String postalCode, int year) throws HddFetchException {
        var coordinates = postalCodeLocator.locate(postalCode);
        URI uri = UriComponentsBuilder.fromHttpUrl(apiBaseUrl)
                .queryParam("latitude", coordinates.latitude())
                .queryParam("longitude", coordinates.longitude())
                .queryParam("start_date", year + "-01-01")
                .queryParam("end_date", year + "-12-31")
                .queryParam("daily", DAILY_VARIABLE)
                .queryParam("timezone", TIMEZONE)
                .build()
                .toUri();

        log.debug("Requesting Open-Meteo archive for {}/{}: {}", postalCode, year, uri);

        JsonNode response;
        try {
            response = restTemplate.getForObject(uri, JsonNode.class);
        } catch (RestClientException e) {
            throw new HddFetchException("Open-Meteo request failed for " + postalCode + "/" + year, e);
        }

        JsonNode temperatures = response == null ? null : response.path("daily").path(DAILY_VARIABLE);
        if (temperatures == null || !temperatures.isArray() || temperatures.isEmpty()) {
            throw new HddFetchException("No temperature data in Open-Meteo response for " + postalCode + "/" + year);
        }

        double hdd = 0;
        int days = 0;
        for (JsonNode temperature : temperatures) {
            if (temperature.isNull() || !temperature.isNumber()) {
                continue;
            }
            days++;
            double mean = temperature.asDouble();
            if (mean < baseTemperature) {
                hdd += baseTemperature - mean;
            }
        }
        if (days == 0) {
            throw new HddFetchException("Open-Meteo returned only empty days for " + postalCode + "/" + year);
        }

        double rounded = BigDecimal.valueOf(hdd).setScale(1, RoundingMode.HALF_UP).doubleValue();
        log.info("Fetched HDD {} for {}/{} from {} days", rounded, postalCode, year, days);
        return rounded;
    }
}
