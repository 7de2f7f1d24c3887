package org.dxworks.formframe;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.dataformat.yaml.YAMLFactory;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;

public class FormframeConfig {

    private static final String CONFIG_FILE_NAME = "formframe-config.yml";
    private static final int DEFAULT_LABEL_LOOKBACK = 5;
    private static final boolean DEFAULT_PARALLEL_VIEWS = true;
    private static final int DEFAULT_LARGE_FORM_THRESHOLD = 100;
    private static final long DEFAULT_MAX_VIEW_BYTES = 20L * 1024 * 1024;

    private final int labelLookback;
    private final boolean parallelViews;
    private final int largeFormThreshold;
    private final long maxViewBytes;

    private FormframeConfig(int labelLookback, boolean parallelViews, int largeFormThreshold, long maxViewBytes) {
        this.labelLookback = labelLookback;
        this.parallelViews = parallelViews;
        this.largeFormThreshold = largeFormThreshold;
        this.maxViewBytes = maxViewBytes;
    }

    /**
     * Number of recent captions kept to name repeating sections and tables.
     */
    public int getLabelLookback() {
        return labelLookback;
    }

    public boolean isParallelViews() {
        return parallelViews;
    }

    public int getLargeFormThreshold() {
        return largeFormThreshold;
    }

    /**
     * View files larger than this are not loaded.
     */
    public long getMaxViewBytes() {
        return maxViewBytes;
    }

    public static FormframeConfig defaults() {
        return new FormframeConfig(DEFAULT_LABEL_LOOKBACK, DEFAULT_PARALLEL_VIEWS,
                DEFAULT_LARGE_FORM_THRESHOLD, DEFAULT_MAX_VIEW_BYTES);
    }

    public static FormframeConfig load() {
        return load(Paths.get(CONFIG_FILE_NAME));
    }

    public static FormframeConfig load(Path configPath) {
        if (!Files.exists(configPath)) {
            return defaults();
        }

        try {
            ObjectMapper yamlMapper = new ObjectMapper(new YAMLFactory());
            YamlConfig yamlConfig = yamlMapper.readValue(configPath.toFile(), YamlConfig.class);
            if (yamlConfig != null) {
                int labelLookback = (yamlConfig.labelLookback != null && yamlConfig.labelLookback > 0)
                        ? yamlConfig.labelLookback
                        : DEFAULT_LABEL_LOOKBACK;
                boolean parallelViews = yamlConfig.parallelViews != null
                        ? yamlConfig.parallelViews
                        : DEFAULT_PARALLEL_VIEWS;
                int largeFormThreshold = (yamlConfig.largeFormThreshold != null && yamlConfig.largeFormThreshold > 0)
                        ? yamlConfig.largeFormThreshold
                        : DEFAULT_LARGE_FORM_THRESHOLD;
                long maxViewBytes = (yamlConfig.maxViewBytes != null && yamlConfig.maxViewBytes > 0)
                        ? yamlConfig.maxViewBytes
                        : DEFAULT_MAX_VIEW_BYTES;

                return new FormframeConfig(labelLookback, parallelViews, largeFormThreshold, maxViewBytes);
            }
        } catch (IOException e) {
            System.err.println("[FormframeConfig] Ignoring " + configPath + ": " + e.getMessage());
        }

        return defaults();
    }

    public static FormframeConfig with(int labelLookback, boolean parallelViews, int largeFormThreshold, long maxViewBytes) {
        return new FormframeConfig(
                labelLookback > 0 ? labelLookback : DEFAULT_LABEL_LOOKBACK,
                parallelViews,
                largeFormThreshold > 0 ? largeFormThreshold : DEFAULT_LARGE_FORM_THRESHOLD,
                maxViewBytes > 0 ? maxViewBytes : DEFAULT_MAX_VIEW_BYTES);
    }

    private static class YamlConfig {
        public Integer labelLookback;
        public Boolean parallelViews;
        public Integer largeFormThreshold;
        public Long maxViewBytes;
    }
}
