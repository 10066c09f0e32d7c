package com.appforge.core.config;

import com.appforge.core.model.TargetStack;
import com.appforge.core.model.ValidationMode;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.stereotype.Component;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;

@Component
@ConfigurationProperties(prefix = "appforge.agent")
public class AgentProperties {

    /** Repair cycles allowed after the first failed validation. */
    private int maxRepairAttempts = 2;

    /** LLM calls per stage before malformed output becomes fatal. */
    private int maxOutputAttempts = 3;

    private List<String> validationCommands = new ArrayList<>(List.of("npm run lint", "npm run build"));
    private Duration validationTimeout = Duration.ofSeconds(120);
    private int maxFiles = 500;
    private ValidationMode defaultMode = ValidationMode.SAFE;

    /** Stack used when the selector cannot produce a usable answer. */
    private TargetStack defaultFramework = TargetStack.DEFAULT;

    private int runPoolSize = 4;
    private int runQueueCapacity = 100;

    public int getMaxRepairAttempts() { return maxRepairAttempts; }
    public void setMaxRepairAttempts(int maxRepairAttempts) { this.maxRepairAttempts = maxRepairAttempts; }
    public int getMaxOutputAttempts() { return maxOutputAttempts; }
    public void setMaxOutputAttempts(int maxOutputAttempts) { this.maxOutputAttempts = maxOutputAttempts; }
    public List<String> getValidationCommands() { return validationCommands; }
    public void setValidationCommands(List<String> validationCommands) { this.validationCommands = validationCommands; }
    public Duration getValidationTimeout() { return validationTimeout; }
    public void setValidationTimeout(Duration validationTimeout) { this.validationTimeout = validationTimeout; }
    public int getMaxFiles() { return maxFiles; }
    public void setMaxFiles(int maxFiles) { this.maxFiles = maxFiles; }
    public ValidationMode getDefaultMode() { return defaultMode; }
    public void setDefaultMode(ValidationMode defaultMode) { this.defaultMode = defaultMode; }
    public TargetStack getDefaultFramework() { return defaultFramework; }
    public void setDefaultFramework(TargetStack defaultFramework) { this.defaultFramework = defaultFramework; }
    public int getRunPoolSize() { return runPoolSize; }
    public void setRunPoolSize(int runPoolSize) { this.runPoolSize = runPoolSize; }
    public int getRunQueueCapacity() { return runQueueCapacity; }
    public void setRunQueueCapacity(int runQueueCapacity) { this.runQueueCapacity = runQueueCapacity; }
}
