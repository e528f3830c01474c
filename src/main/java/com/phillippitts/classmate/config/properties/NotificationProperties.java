package com.phillippitts.classmate.config.properties;

import org.springframework.boot.context.properties.ConfigurationProperties;

import java.util.ArrayList;
import java.util.List;

/**
 * Selects the outbound notification sinks at startup.
 */
@ConfigurationProperties(prefix = "classmate.notify")
public class NotificationProperties {

    public enum SinkType { LOG }

    private boolean enabled = true;

    private List<SinkType> sinks = new ArrayList<>(List.of(SinkType.LOG));

    public boolean isEnabled() {
        return enabled;
    }

    public void setEnabled(boolean enabled) {
        this.enabled = enabled;
    }

    public List<SinkType> getSinks() {
        return sinks;
    }

    public void setSinks(List<SinkType> sinks) {
        this.sinks = sinks;
    }
}
