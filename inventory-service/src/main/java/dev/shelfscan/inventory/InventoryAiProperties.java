package dev.shelfscan.inventory;

import java.time.Duration;
import org.springframework.boot.context.properties.ConfigurationProperties;

@ConfigurationProperties(prefix = "inventory.ai")
public class InventoryAiProperties {

    /**
     * Whether a configured Spring AI {@code ChatModel} should be used for extraction and categorization.
     */
    private boolean enabled = true;

    /**
     * Minimum spacing between consecutive model calls. Zero disables pacing.
     */
    private Duration minInterval = Duration.ofMillis(500);

    public boolean isEnabled() {
        return enabled;
    }

    public void setEnabled(boolean enabled) {
        this.enabled = enabled;
    }

    public Duration getMinInterval() {
        return minInterval;
    }

    public void setMinInterval(Duration minInterval) {
        this.minInterval = minInterval;
    }
}
