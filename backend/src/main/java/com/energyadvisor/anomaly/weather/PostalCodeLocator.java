package com.energyadvisor.anomaly.weather;

import org.springframework.stereotype.Component;

import java.util.Map;

/**
 * Maps German postal codes to approximate coordinates for weather lookups.
 *
 * The first digit of a German postal code identifies a postal region; each region
 * is represented by the coordinates of its main city. Unknown or malformed codes
 * resolve to the geographic centre of Germany.
 */
@Component
public class PostalCodeLocator {

    private static final Coordinates CENTRE_OF_GERMANY = new Coordinates(51.16, 10.45);

    private static final Map<Character, Coordinates> REGION_COORDINATES = Map.ofEntries(
            Map.entry('0', new Coordinates(51.05, 13.74)),   // Dresden
            Map.entry('1', new Coordinates(52.52, 13.40)),   // Berlin
            Map.entry('2', new Coordinates(53.55, 9.99)),    // Hamburg
            Map.entry('3', new Coordinates(52.37, 9.73)),    // Hannover
            Map.entry('4', new Coordinates(51.23, 6.78)),    // Duesseldorf
            Map.entry('5', new Coordinates(50.94, 6.96)),    // Cologne
            Map.entry('6', new Coordinates(50.11, 8.68)),    // Frankfurt
            Map.entry('7', new Coordinates(48.78, 9.18)),    // Stuttgart
            Map.entry('8', new Coordinates(48.14, 11.58)),   // Munich
            Map.entry('9', new Coordinates(49.45, 11.08))    // Nuremberg
    );

    public Coordinates locate(String postalCode) {
        if (postalCode == null || postalCode.isBlank()) {
            return CENTRE_OF_GERMANY;
        }
        return REGION_COORDINATES.getOrDefault(postalCode.trim().charAt(0), CENTRE_OF_GERMANY);
    }

    /**
     * Postal region digit, or {@code '?'} for codes that do not start with a digit.
     */
    public char region(String postalCode) {
        if (postalCode == null || postalCode.isBlank()) {
            return '?';
        }
        char first = postalCode.trim().charAt(0);
        return Character.isDigit(first) ? first : '?';
    }

    public record Coordinates(double latitude, double longitude) {}
}
