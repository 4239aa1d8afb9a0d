package com.linlay.chatrunner.tool;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import org.springframework.stereotype.Component;

import java.util.List;
import java.util.Map;
import java.util.Random;

/**
 * Deterministic stand-in for a forecast API: the same coordinates always produce the same weather.
 */
@Component
public class GetWeatherTool implements ChatTool {

    private static final String[] CONDITIONS = {
            "clear", "partly cloudy", "overcast", "light rain", "thunderstorm", "fog", "light snow"
    };

    private final ObjectMapper objectMapper;

    public GetWeatherTool(ObjectMapper objectMapper) {
        this.objectMapper = objectMapper;
    }

    @Override
    public String name() {
        return "getWeather";
    }

    @Override
    public String description() {
        return "Get the current weather at a location using latitude and longitude coordinates";
    }

    @Override
    public Map<String, Object> parametersSchema() {
        return Map.of(
                "type", "object",
                "properties", Map.of(
                        "latitude", Map.of(
                                "type", "number",
                                "description", "The latitude coordinate for the location",
                                "minimum", -90,
                                "maximum", 90
                        ),
                        "longitude", Map.of(
                                "type", "number",
                                "description", "The longitude coordinate for the location",
                                "minimum", -180,
                                "maximum", 180
                        )
                ),
                "required", List.of("latitude", "longitude")
        );
    }

    @Override
    public JsonNode invoke(Map<String, Object> args, ToolContext context) {
        double latitude = ((Number) args.get("latitude")).doubleValue();
        double longitude = ((Number) args.get("longitude")).doubleValue();
        Random random = new Random(Double.hashCode(latitude) * 31L + Double.hashCode(longitude));

        double current = roundTenth(baseTemperature(latitude) + random.nextGaussian() * 3);
        ObjectNode root = objectMapper.createObjectNode();
        root.put("latitude", latitude);
        root.put("longitude", longitude);
        root.putObject("current_units").put("temperature_2m", "°C");
        root.putObject("current")
                .put("temperature_2m", current)
                .put("condition", CONDITIONS[random.nextInt(CONDITIONS.length)]);

        ArrayNode hourly = root.putObject("hourly").putArray("temperature_2m");
        for (int hour = 0; hour < 24; hour++) {
            double swing = -Math.cos((hour - 3) / 24D * 2 * Math.PI) * 4;
            hourly.add(roundTenth(current + swing + random.nextGaussian()));
        }

        int sunriseMinute = 5 * 60 + random.nextInt(120);
        int sunsetMinute = 17 * 60 + random.nextInt(180);
        ObjectNode daily = root.putObject("daily");
        daily.putArray("sunrise").add(clockTime(sunriseMinute));
        daily.putArray("sunset").add(clockTime(sunsetMinute));
        return root;
    }

    private double baseTemperature(double latitude) {
        return 28 - Math.abs(latitude) * 0.45;
    }

    private double roundTenth(double value) {
        return Math.round(value * 10) / 10D;
    }

    private String clockTime(int minuteOfDay) {
        return String.format("%02d:%02d", minuteOfDay / 60, minuteOfDay % 60);
    }
}
