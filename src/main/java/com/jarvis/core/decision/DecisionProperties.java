package com.jarvis.core.decision;

import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.stereotype.Component;

@Component
@ConfigurationProperties(prefix = "jarvis.decision")
public class DecisionProperties {

    private Thresholds thresholds = new Thresholds();
    /** Starting confidence for tasks no rule covers. */
    private double priorConfidence = 0.5;
    private double feedbackStep = 0.02;
    private double feedbackCeiling = 0.95;
    /** Rejections above this confidence tighten the threshold. */
    private double feedbackConfidenceFloor = 0.8;
    private String rulesLocation = "classpath:decision-rules.json";

    public Thresholds getThresholds() { return thresholds; }
    public void setThresholds(Thresholds thresholds) { this.thresholds = thresholds; }
    public double getPriorConfidence() { return priorConfidence; }
    public void setPriorConfidence(double priorConfidence) { this.priorConfidence = priorConfidence; }
    public double getFeedbackStep() { return feedbackStep; }
    public void setFeedbackStep(double feedbackStep) { this.feedbackStep = feedbackStep; }
    public double getFeedbackCeiling() { return feedbackCeiling; }
    public void setFeedbackCeiling(double feedbackCeiling) { this.feedbackCeiling = feedbackCeiling; }
    public double getFeedbackConfidenceFloor() { return feedbackConfidenceFloor; }
    public void setFeedbackConfidenceFloor(double feedbackConfidenceFloor) { this.feedbackConfidenceFloor = feedbackConfidenceFloor; }
    public String getRulesLocation() { return rulesLocation; }
    public void setRulesLocation(String rulesLocation) { this.rulesLocation = rulesLocation; }

    public static class Thresholds {
        private double low = 0.7;
        private double medium = 0.8;
        private double high = 0.9;
        private double critical = 1.0;

        public double getLow() { return low; }
        public void setLow(double low) { this.low = low; }
        public double getMedium() { return medium; }
        public void setMedium(double medium) { this.medium = medium; }
        public double getHigh() { return high; }
        public void setHigh(double high) { this.high = high; }
        public double getCritical() { return critical; }
        public void setCritical(double critical) { this.critical = critical; }
    }
}
