package com.example.guardianintake.config;

import org.springframework.boot.context.properties.ConfigurationProperties;

/**
 * Tunables for the intake pipeline. The defaults were picked against a small
 * sample of real forms and are expected to be re-tuned.
 */
@ConfigurationProperties(prefix = "intake")
public class IntakeProperties {

    /**
     * Where the correction rules, anchors and separators are loaded from.
     * Accepts any Spring resource location, e.g. "file:/etc/intake/rules.json".
     */
    private String rulesLocation = "classpath:extraction-rules.json";

    private Cascade cascade = new Cascade();

    private Anchor anchor = new Anchor();

    private Extraction extraction = new Extraction();

    private Inbox inbox = new Inbox();

    private Store store = new Store();

    public String getRulesLocation() {
        return rulesLocation;
    }

    public void setRulesLocation(String rulesLocation) {
        this.rulesLocation = rulesLocation;
    }

    public Cascade getCascade() {
        return cascade;
    }

    public void setCascade(Cascade cascade) {
        this.cascade = cascade;
    }

    public Anchor getAnchor() {
        return anchor;
    }

    public void setAnchor(Anchor anchor) {
        this.anchor = anchor;
    }

    public Extraction getExtraction() {
        return extraction;
    }

    public void setExtraction(Extraction extraction) {
        this.extraction = extraction;
    }

    public Inbox getInbox() {
        return inbox;
    }

    public void setInbox(Inbox inbox) {
        this.inbox = inbox;
    }

    public Store getStore() {
        return store;
    }

    public void setStore(Store store) {
        this.store = store;
    }

    public static class Cascade {

        /**
         * Minimum count of non-whitespace characters for an engine's output to be usable.
         */
        private int sufficiencyThreshold = 80;

        /**
         * Pause before the single retry of an engine that failed transiently.
         */
        private long retryBackoffMs = 1000;

        /**
         * Re-enter the cascade once when the guardian name is missing after parsing.
         */
        private boolean escalationEnabled = true;

        public int getSufficiencyThreshold() {
            return sufficiencyThreshold;
        }

        public void setSufficiencyThreshold(int sufficiencyThreshold) {
            this.sufficiencyThreshold = sufficiencyThreshold;
        }

        public long getRetryBackoffMs() {
            return retryBackoffMs;
        }

        public void setRetryBackoffMs(long retryBackoffMs) {
            this.retryBackoffMs = retryBackoffMs;
        }

        public boolean isEscalationEnabled() {
            return escalationEnabled;
        }

        public void setEscalationEnabled(boolean escalationEnabled) {
            this.escalationEnabled = escalationEnabled;
        }
    }

    public static class Anchor {

        /**
         * Largest edit distance allowed, as a fraction of the anchor phrase length.
         */
        private double maxEditRatio = 0.2;

        /**
         * Lowest similarity score (1 - distance / length) accepted as a match.
         */
        private double scoreFloor = 0.8;

        public double getMaxEditRatio() {
            return maxEditRatio;
        }

        public void setMaxEditRatio(double maxEditRatio) {
            this.maxEditRatio = maxEditRatio;
        }

        public double getScoreFloor() {
            return scoreFloor;
        }

        public void setScoreFloor(double scoreFloor) {
            this.scoreFloor = scoreFloor;
        }
    }

    public static class Extraction {

        /**
         * A guardian surname within this distance of the ward surname takes the ward spelling.
         */
        private int surnameMaxEditDistance = 1;

        public int getSurnameMaxEditDistance() {
            return surnameMaxEditDistance;
        }

        public void setSurnameMaxEditDistance(int surnameMaxEditDistance) {
            this.surnameMaxEditDistance = surnameMaxEditDistance;
        }
    }

    public static class Inbox {

        private String dir = "inbox";

        private boolean runOnStartup = false;

        public String getDir() {
            return dir;
        }

        public void setDir(String dir) {
            this.dir = dir;
        }

        public boolean isRunOnStartup() {
            return runOnStartup;
        }

        public void setRunOnStartup(boolean runOnStartup) {
            this.runOnStartup = runOnStartup;
        }
    }

    public static class Store {

        private String lockFile = "data/case-store.lock";

        public String getLockFile() {
            return lockFile;
        }

        public void setLockFile(String lockFile) {
            this.lockFile = lockFile;
        }
    }
}
