package com.example.statement.infrastructure.config;

import org.springframework.boot.context.properties.ConfigurationProperties;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

@ConfigurationProperties(prefix = "statement")
public class StatementProperties {

    private Detection detection = new Detection();

    public Detection getDetection() {
        return detection;
    }

    public void setDetection(Detection detection) {
        this.detection = detection;
    }

    public static class Detection {

        /**
         * Number of leading pages read to identify the issuing bank.
         */
        private int pageBudget = 2;

        /**
         * Partial-match score a fuzzy match is compared against.
         */
        private int fuzzyThreshold = 80;

        /**
         * When false, any fuzzy score above zero identifies the bank.
         */
        private boolean enforceFuzzyThreshold = false;

        /**
         * Override keywords checked before the built-in table, bank name to keywords, in priority order.
         */
        private Map<String, List<String>> bankMapping = new LinkedHashMap<>();

        public int getPageBudget() {
            return pageBudget;
        }

        public void setPageBudget(int pageBudget) {
            this.pageBudget = pageBudget;
        }

        public int getFuzzyThreshold() {
            return fuzzyThreshold;
        }

        public void setFuzzyThreshold(int fuzzyThreshold) {
            this.fuzzyThreshold = fuzzyThreshold;
        }

        public boolean isEnforceFuzzyThreshold() {
            return enforceFuzzyThreshold;
        }

        public void setEnforceFuzzyThreshold(boolean enforceFuzzyThreshold) {
            this.enforceFuzzyThreshold = enforceFuzzyThreshold;
        }

        public Map<String, List<String>> getBankMapping() {
            return bankMapping;
        }

        public void setBankMapping(Map<String, List<String>> bankMapping) {
            this.bankMapping = bankMapping;
        }
    }
}
