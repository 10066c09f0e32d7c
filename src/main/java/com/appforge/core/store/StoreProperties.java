package com.appforge.core.store;

import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.stereotype.Component;

/**
 * Shared database for rate-limit windows, breaker state, jobs, sandbox sessions
 * and runs. Leaving {@code url} empty selects in-memory stores.
 */
@Component
@ConfigurationProperties(prefix = "appforge.store")
public class StoreProperties {

    private String url = "";
    private String username = "";
    private String password = "";
    private int maxPoolSize = 10;

    public boolean isConfigured() {
        return url != null && !url.isBlank();
    }

    public String getUrl() { return url; }
    public void setUrl(String url) { this.url = url; }
    public String getUsername() { return username; }
    public void setUsername(String username) { this.username = username; }
    public String getPassword() { return password; }
    public void setPassword(String password) { this.password = password; }
    public int getMaxPoolSize() { return maxPoolSize; }
    public void setMaxPoolSize(int maxPoolSize) { this.maxPoolSize = maxPoolSize; }
}
