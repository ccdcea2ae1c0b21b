package com.venn.adapter.spring;

import org.springframework.boot.context.properties.ConfigurationProperties;

/**
 * Spring Boot configuration properties for Venn.
 */
@ConfigurationProperties(prefix = "venn")
public class VennProperties {

    /**
     * Whether Venn is enabled.
     */
    private boolean enabled = true;

    /**
     * Path to the Venn configuration file.
     * Supports classpath: prefix for classpath resources.
     */
    private String configPath = "classpath:venn.yaml";

    public boolean isEnabled() {
        return enabled;
    }

    public void setEnabled(boolean enabled) {
        this.enabled = enabled;
    }

    public String getConfigPath() {
        return configPath;
    }

    public void setConfigPath(String configPath) {
        this.configPath = configPath;
    }
}
