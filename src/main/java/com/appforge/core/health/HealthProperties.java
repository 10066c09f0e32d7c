package com.appforge.core.health;

import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.stereotype.Component;

import java.time.Duration;

@Component
@ConfigurationProperties(prefix = "appforge.health")
public class HealthProperties {

    /** Window utilization above which the monitor warns. */
    private double usageAlertThreshold = 0.9;
    private Duration checkInterval = Duration.ofMinutes(5);

    public double getUsageAlertThreshold() { return usageAlertThreshold; }
    public void setUsageAlertThreshold(double usageAlertThreshold) { this.usageAlertThreshold = usageAlertThreshold; }
    public Duration getCheckInterval() { return checkInterval; }
    public void setCheckInterval(Duration checkInterval) { this.checkInterval = checkInterval; }
}
