package com.pitchcraft.core.workflow;

import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.stereotype.Component;

import java.time.Duration;

@Component
@ConfigurationProperties(prefix = "pitchcraft.workflow")
public class WorkflowProperties {

    private int autoRefineMax = 3;
    private int totalIterationMax = 10;
    private double passThreshold = 7.5;
    private Duration sessionIdleTimeout = Duration.ofHours(2);
    private Duration reaperInterval = Duration.ofMinutes(5);
    private String pitchTemplate = "elevator";

    public int getAutoRefineMax() {
        return autoRefineMax;
    }

    public void setAutoRefineMax(int autoRefineMax) {
        this.autoRefineMax = autoRefineMax;
    }

    public int getTotalIterationMax() {
        return totalIterationMax;
    }

    public void setTotalIterationMax(int totalIterationMax) {
        this.totalIterationMax = totalIterationMax;
    }

    public double getPassThreshold() {
        return passThreshold;
    }

    public void setPassThreshold(double passThreshold) {
        this.passThreshold = passThreshold;
    }

    public Duration getSessionIdleTimeout() {
        return sessionIdleTimeout;
    }

    public void setSessionIdleTimeout(Duration sessionIdleTimeout) {
        this.sessionIdleTimeout = sessionIdleTimeout;
    }

    public Duration getReaperInterval() {
        return reaperInterval;
    }

    public void setReaperInterval(Duration reaperInterval) {
        this.reaperInterval = reaperInterval;
    }

    public String getPitchTemplate() {
        return pitchTemplate;
    }

    public void setPitchTemplate(String pitchTemplate) {
        this.pitchTemplate = pitchTemplate;
    }
}
