package com.pitchcraft.core.llm;

import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.stereotype.Component;

import java.time.Duration;

@Component
@ConfigurationProperties(prefix = "pitchcraft.llm")
public class LlmProperties {

    private Duration timeout = Duration.ofSeconds(60);
    private int maxConcurrentCalls = 8;
    private final Temperatures temperatures = new Temperatures();

    public Duration getTimeout() {
        return timeout;
    }

    public void setTimeout(Duration timeout) {
        this.timeout = timeout;
    }

    public int getMaxConcurrentCalls() {
        return maxConcurrentCalls;
    }

    public void setMaxConcurrentCalls(int maxConcurrentCalls) {
        this.maxConcurrentCalls = maxConcurrentCalls;
    }

    public Temperatures getTemperatures() {
        return temperatures;
    }

    /**
     * Sampling temperature per agent step.
     */
    public static class Temperatures {

        private double context = 0.7;
        private double generator = 0.8;
        private double critic = 0.3;
        private double refiner = 0.7;
        private double readiness = 0.5;

        public double getContext() {
            return context;
        }

        public void setContext(double context) {
            this.context = context;
        }

        public double getGenerator() {
            return generator;
        }

        public void setGenerator(double generator) {
            this.generator = generator;
        }

        public double getCritic() {
            return critic;
        }

        public void setCritic(double critic) {
            this.critic = critic;
        }

        public double getRefiner() {
            return refiner;
        }

        public void setRefiner(double refiner) {
            this.refiner = refiner;
        }

        public double getReadiness() {
            return readiness;
        }

        public void setReadiness(double readiness) {
            this.readiness = readiness;
        }
    }
}
