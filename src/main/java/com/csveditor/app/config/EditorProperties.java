package com.csveditor.app.config;

import org.springframework.boot.context.properties.ConfigurationProperties;

/**
 * Settings bound from the "csveditor" prefix in application.properties.
 */
@ConfigurationProperties(prefix = "csveditor")
public class EditorProperties {

    private final History history = new History();
    private final Transform transform = new Transform();

    public History getHistory() {
        return history;
    }

    public Transform getTransform() {
        return transform;
    }

    public static class History {
        // Oldest entries are evicted past this size
        private int maxEntries = 100;

        public int getMaxEntries() {
            return maxEntries;
        }

        public void setMaxEntries(int maxEntries) {
            this.maxEntries = maxEntries;
        }
    }

    public static class Transform {
        // Worker threads for sort/reorder computations
        private int threads = 2;

        public int getThreads() {
            return threads;
        }

        public void setThreads(int threads) {
            this.threads = threads;
        }
    }
}
