package com.energyadvisor.anomaly.detection;

import com.energyadvisor.anomaly.domain.model.Severity;
import org.springframework.stereotype.Component;

import java.util.EnumMap;
import java.util.List;
import java.util.Map;

/**
 * Fixed suggestions shown with a verdict, keyed by severity.
 */
@Component
public class RecommendationCatalog {

    private static final Map<Severity, List<String>> RECOMMENDATIONS = new EnumMap<>(Severity.class);

    static {
        RECOMMENDATIONS.put(Severity.NORMAL, List.of(
                "Continue current energy practices",
                "Monitor for any changes"
        ));
        RECOMMENDATIONS.put(Severity.WARNING, List.of(
                "Check for new appliances or changed usage patterns",
                "Review thermostat settings",
                "Monitor your next meter readings closely"
        ));
        RECOMMENDATIONS.put(Severity.CRITICAL, List.of(
                "Check for equipment malfunctions",
                "Review heating system efficiency",
                "Check insulation and window seals",
                "Consider an energy audit"
        ));
        RECOMMENDATIONS.put(Severity.UNKNOWN, List.of(
                "Upload bills from previous years to enable a comparison",
                "Monitor for any changes"
        ));
    }

    public List<String> forSeverity(Severity severity) {
        return RECOMMENDATIONS.getOrDefault(severity, List.of());
    }
}
