package com.roadside.request.config;

import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;

@Data
@ConfigurationProperties(prefix = "matching")
public class MatchingProperties {

    /** Ascending search radii in km; the session walks it one step per expansion. */
    private List<Double> radiusLadderKm = new ArrayList<>(List.of(3.0, 5.0, 10.0, 20.0, 50.0, 100.0));

    /** Time spent at one radius before the session cools down and expands. */
    private Duration dwell = Duration.ofSeconds(6);

    private Duration cooldown = Duration.ofSeconds(2);
}
