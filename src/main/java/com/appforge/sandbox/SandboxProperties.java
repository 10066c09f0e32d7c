package com.appforge.sandbox;

import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.stereotype.Component;

import java.time.Duration;

@Component
@ConfigurationProperties(prefix = "appforge.sandbox")
public class SandboxProperties {

    private String provider = "docker";
    private String imageRegistry = "ghcr.io/appforge";
    private String imagePrefix = "sandbox";
    private String workdir = "/workspace";
    private int memoryLimitMb = 2048;
    private int cpuCount = 2;
    private Duration commandTimeout = Duration.ofSeconds(120);
    private int createMaxAttempts = 3;
    private Duration createBackoffBase = Duration.ofSeconds(1);
    private Duration createBackoffMax = Duration.ofSeconds(10);

    /** PROVISIONING records older than this are presumed abandoned. */
    private Duration provisioningTimeout = Duration.ofMinutes(5);

    public String imageFor(String imageTag) {
        return imageRegistry + "/" + imagePrefix + ":" + imageTag;
    }

    /** Backoff before retry number {@code attempt} (1-based): base * 2^(attempt-1), capped. */
    public Duration createBackoff(int attempt) {
        long millis = createBackoffBase.toMillis() * (1L << Math.min(Math.max(attempt - 1, 0), 20));
        return Duration.ofMillis(Math.min(millis, createBackoffMax.toMillis()));
    }

    public String getProvider() { return provider; }
    public void setProvider(String provider) { this.provider = provider; }
    public String getImageRegistry() { return imageRegistry; }
    public void setImageRegistry(String imageRegistry) { this.imageRegistry = imageRegistry; }
    public String getImagePrefix() { return imagePrefix; }
    public void setImagePrefix(String imagePrefix) { this.imagePrefix = imagePrefix; }
    public String getWorkdir() { return workdir; }
    public void setWorkdir(String workdir) { this.workdir = workdir; }
    public int getMemoryLimitMb() { return memoryLimitMb; }
    public void setMemoryLimitMb(int memoryLimitMb) { this.memoryLimitMb = memoryLimitMb; }
    public int getCpuCount() { return cpuCount; }
    public void setCpuCount(int cpuCount) { this.cpuCount = cpuCount; }
    public Duration getCommandTimeout() { return commandTimeout; }
    public void setCommandTimeout(Duration commandTimeout) { this.commandTimeout = commandTimeout; }
    public int getCreateMaxAttempts() { return createMaxAttempts; }
    public void setCreateMaxAttempts(int createMaxAttempts) { this.createMaxAttempts = createMaxAttempts; }
    public Duration getCreateBackoffBase() { return createBackoffBase; }
    public void setCreateBackoffBase(Duration createBackoffBase) { this.createBackoffBase = createBackoffBase; }
    public Duration getCreateBackoffMax() { return createBackoffMax; }
    public void setCreateBackoffMax(Duration createBackoffMax) { this.createBackoffMax = createBackoffMax; }
    public Duration getProvisioningTimeout() { return provisioningTimeout; }
    public void setProvisioningTimeout(Duration provisioningTimeout) { this.provisioningTimeout = provisioningTimeout; }
}
