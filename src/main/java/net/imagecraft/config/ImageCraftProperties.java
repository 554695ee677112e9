package net.imagecraft.config;

import jakarta.annotation.PostConstruct;
import java.nio.file.Path;
import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.stereotype.Component;
import org.springframework.util.Assert;

/**
 * Strongly typed configuration for the image pipeline.
 */
@Component
@ConfigurationProperties(prefix = "imagecraft")
public class ImageCraftProperties {

    private final Storage storage = new Storage();
    private final Models models = new Models();
    private final Gateway gateway = new Gateway();
    private final Batch batch = new Batch();
    private final Enrichment enrichment = new Enrichment();

    @PostConstruct
    void validate() {
        Assert.notEmpty(models.getImageModels(), "imagecraft.models.image-models must list at least one model");
        Assert.isTrue(batch.getPoolSize() > 0, "imagecraft.batch.pool-size must be positive");
        Assert.isTrue(batch.getMaxJobUnits() > 0, "imagecraft.batch.max-job-units must be positive");
        Assert.isTrue(!batch.getJobRetention().isNegative(), "imagecraft.batch.job-retention must be non-negative");
        Assert.isTrue(!gateway.getRequestTimeout().isNegative(), "imagecraft.gateway.request-timeout must be non-negative");
    }

    public Storage getStorage() {
        return storage;
    }

    public Models getModels() {
        return models;
    }

    public Gateway getGateway() {
        return gateway;
    }

    public Batch getBatch() {
        return batch;
    }

    public Enrichment getEnrichment() {
        return enrichment;
    }

    public static class Storage {

        /**
         * Directory holding the record file and the raster files.
         */
        private Path root = Path.of("data");

        public Path getRoot() {
            return root;
        }

        public void setRoot(Path root) {
            this.root = root;
        }

        public Path recordFile() {
            return root.resolve("images.json");
        }

        public Path rasterDirectory() {
            return root.resolve("images");
        }
    }

    public static class Models {

        /**
         * Image model aliases in fallback order. One adapter is registered per alias.
         */
        private List<String> imageModels = new ArrayList<>(List.of("gpt-image", "gemini-image"));

        /**
         * Model used for mask-aware edits (inpaint, outpaint, object replacement).
         */
        private String editModel = "gpt-image";

        /**
         * Model used to regenerate from text when every edit stage failed.
         */
        private String regenerateModel = "gemini-image";

        public List<String> getImageModels() {
            return imageModels;
        }

        public void setImageModels(List<String> imageModels) {
            this.imageModels = imageModels;
        }

        public String getEditModel() {
            return editModel;
        }

        public void setEditModel(String editModel) {
            this.editModel = editModel;
        }

        public String getRegenerateModel() {
            return regenerateModel;
        }

        public void setRegenerateModel(String regenerateModel) {
            this.regenerateModel = regenerateModel;
        }
    }

    public static class Gateway {

        /**
         * Base URL of the OpenAI-compatible image gateway.
         */
        private String baseUrl = "http://localhost:4000";

        private String apiKey = "";

        private Duration requestTimeout = Duration.ofSeconds(180);

        public String getBaseUrl() {
            return baseUrl;
        }

        public void setBaseUrl(String baseUrl) {
            this.baseUrl = baseUrl;
        }

        public String getApiKey() {
            return apiKey;
        }

        public void setApiKey(String apiKey) {
            this.apiKey = apiKey;
        }

        public Duration getRequestTimeout() {
            return requestTimeout;
        }

        public void setRequestTimeout(Duration requestTimeout) {
            this.requestTimeout = requestTimeout;
        }
    }

    public static class Batch {

        /**
         * Worker threads shared by every batch mode.
         */
        private int poolSize = 4;

        /**
         * How long a job stays queryable after it was last read or updated.
         */
        private Duration jobRetention = Duration.ofHours(1);

        private int maxJobUnits = 100;

        public int getPoolSize() {
            return poolSize;
        }

        public void setPoolSize(int poolSize) {
            this.poolSize = poolSize;
        }

        public Duration getJobRetention() {
            return jobRetention;
        }

        public void setJobRetention(Duration jobRetention) {
            this.jobRetention = jobRetention;
        }

        public int getMaxJobUnits() {
            return maxJobUnits;
        }

        public void setMaxJobUnits(int maxJobUnits) {
            this.maxJobUnits = maxJobUnits;
        }
    }

    public static class Enrichment {

        /**
         * Chat model used for prompt enhancement and image description.
         */
        private String model = "gpt-4o-mini";

        public String getModel() {
            return model;
        }

        public void setModel(String model) {
            this.model = model;
        }
    }
}
