package github.sarthakdev143.photo_forge.config;

import org.springframework.boot.context.properties.ConfigurationProperties;

/**
 * Binds {@code photo-forge.*} from application.properties.
 */
@ConfigurationProperties(prefix = "photo-forge")
public class PhotoForgeProperties {

    private String defaultOutputDirectory;
    private Batch batch = new Batch();
    private Preflight preflight = new Preflight();

    public String getDefaultOutputDirectory() {
        return defaultOutputDirectory;
    }

    public void setDefaultOutputDirectory(String defaultOutputDirectory) {
        this.defaultOutputDirectory = defaultOutputDirectory;
    }

    public Batch getBatch() {
        return batch;
    }

    public void setBatch(Batch batch) {
        this.batch = batch;
    }

    public Preflight getPreflight() {
        return preflight;
    }

    public void setPreflight(Preflight preflight) {
        this.preflight = preflight;
    }

    public static class Batch {

        public static final int MIN_CONCURRENT_JOBS = 1;
        public static final int MAX_CONCURRENT_JOBS = 10;

        private int maxConcurrentJobs = 3;
        private int executorPoolSize = MAX_CONCURRENT_JOBS;

        public int getMaxConcurrentJobs() {
            return maxConcurrentJobs;
        }

        public void setMaxConcurrentJobs(int maxConcurrentJobs) {
            this.maxConcurrentJobs = maxConcurrentJobs;
        }

        public int getExecutorPoolSize() {
            return executorPoolSize;
        }

        public void setExecutorPoolSize(int executorPoolSize) {
            this.executorPoolSize = executorPoolSize;
        }
    }

    public static class Preflight {

        private boolean enabled = true;

        public boolean isEnabled() {
            return enabled;
        }

        public void setEnabled(boolean enabled) {
            this.enabled = enabled;
        }
    }
}
