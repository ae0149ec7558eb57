package com.roadside.request.config;

import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;

import java.time.Duration;

@Data
@ConfigurationProperties(prefix = "lifecycle")
public class LifecycleProperties {

    private Duration lockWait = Duration.ofSeconds(2);

    private Duration lockLease = Duration.ofSeconds(10);

    /** A completed service the client never confirms is finished by the system after this. */
    private Duration autoFinishAfter = Duration.ofMinutes(15);
}
