/*
 * XNAT Scan Curator
 * Copyright (c) 2025 XNATWorks.
 * All rights reserved.
 *
 * This software is distributed under the terms described in the LICENSE file.
 */
package io.xnatworks.curator.config;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.dataformat.yaml.YAMLFactory;
import io.xnatworks.curator.engine.ScanClassifier;
import io.xnatworks.curator.engine.UpdatePlanner;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.File;
import java.io.IOException;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

/**
 * Application configuration for the scan curator, read from YAML.
 *
 * Example:
 * <pre>
 * xnat:
 *   url: https://xnat.example.org
 *   username: curator
 *   password: secret
 *   project: CUTTING
 * rules_file: scan_type_renames.csv
 * unusable_markers: [INC, BAD]
 * expected_frames:
 *   MR: 176
 * </pre>
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public class AppConfig {
    private static final Logger log = LoggerFactory.getLogger(AppConfig.class);

    private XnatConfig xnat = new XnatConfig();

    /**
     * CSV rename rule table. Relative paths resolve against the config file.
     */
    @JsonProperty("rules_file")
    private String rulesFile = "scan_type_renames.csv";

    /**
     * Substrings (case-insensitive) marking a scan as unusable.
     */
    @JsonProperty("unusable_markers")
    private List<String> unusableMarkers = new ArrayList<>(ScanClassifier.DEFAULT_MARKERS);

    /**
     * Quality value XNAT assigns by default.
     */
    @JsonProperty("usable_quality")
    private String usableQuality = ScanClassifier.DEFAULT_USABLE_QUALITY;

    /**
     * Quality value written to scans with an unusable marker.
     */
    @JsonProperty("unusable_quality")
    private String unusableQuality = UpdatePlanner.DEFAULT_UNUSABLE_QUALITY;

    /**
     * Expected frame count per modality (MR, PT, CT, ...).
     */
    @JsonProperty("expected_frames")
    private Map<String, Integer> expectedFrames = new HashMap<>();

    /**
     * Directory for JSON reports written by the CLI.
     */
    @JsonProperty("report_directory")
    private String reportDirectory = "./reports";

    /**
     * Path to the config file (set when loaded).
     */
    private transient File configFile;

    public static AppConfig load(File configFile) throws IOException {
        log.info("Loading configuration from: {}", configFile.getAbsolutePath());
        ObjectMapper mapper = new ObjectMapper(new YAMLFactory());
        AppConfig config = mapper.readValue(configFile, AppConfig.class);
        config.configFile = configFile;
        return config;
    }

    public static AppConfig load(String configPath) throws IOException {
        return load(new File(configPath));
    }

    /**
     * Rule table file, resolved against the config file's directory when relative.
     */
    public File resolveRulesFile() {
        File file = new File(rulesFile);
        if (file.isAbsolute() || configFile == null || configFile.getAbsoluteFile().getParentFile() == null) {
            return file;
        }
        return new File(configFile.getAbsoluteFile().getParentFile(), rulesFile);
    }

    // Getters and setters
    public XnatConfig getXnat() { return xnat; }
    public void setXnat(XnatConfig xnat) { this.xnat = xnat; }

    public String getRulesFile() { return rulesFile; }
    public void setRulesFile(String rulesFile) { this.rulesFile = rulesFile; }

    public List<String> getUnusableMarkers() { return unusableMarkers; }
    public void setUnusableMarkers(List<String> unusableMarkers) { this.unusableMarkers = unusableMarkers; }

    public String getUsableQuality() { return usableQuality; }
    public void setUsableQuality(String usableQuality) { this.usableQuality = usableQuality; }

    public String getUnusableQuality() { return unusableQuality; }
    public void setUnusableQuality(String unusableQuality) { this.unusableQuality = unusableQuality; }

    public Map<String, Integer> getExpectedFrames() { return expectedFrames; }
    public void setExpectedFrames(Map<String, Integer> expectedFrames) { this.expectedFrames = expectedFrames; }

    public String getReportDirectory() { return reportDirectory; }
    public void setReportDirectory(String reportDirectory) { this.reportDirectory = reportDirectory; }

    public File getConfigFile() { return configFile; }
    public void setConfigFile(File configFile) { this.configFile = configFile; }

    /**
     * Connection settings for the XNAT instance holding the subjects.
     */
    @JsonIgnoreProperties(ignoreUnknown = true)
    public static class XnatConfig {
        private String url = "http://localhost";
        private String username = "admin";
        private String password = "admin";

        /**
         * XNAT project the subjects live in.
         */
        private String project = "CUTTING";

        @JsonProperty("connect_timeout_seconds")
        private int connectTimeoutSeconds = 30;

        @JsonProperty("read_timeout_seconds")
        private int readTimeoutSeconds = 120;

        public String getUrl() { return url; }
        public void setUrl(String url) { this.url = url; }

        public String getUsername() { return username; }
        public void setUsername(String username) { this.username = username; }

        public String getPassword() { return password; }
        public void setPassword(String password) { this.password = password; }

        public String getProject() { return project; }
        public void setProject(String project) { this.project = project; }

        public int getConnectTimeoutSeconds() { return connectTimeoutSeconds; }
        public void setConnectTimeoutSeconds(int connectTimeoutSeconds) { this.connectTimeoutSeconds = connectTimeoutSeconds; }

        public int getReadTimeoutSeconds() { return readTimeoutSeconds; }
        public void setReadTimeoutSeconds(int readTimeoutSeconds) { this.readTimeoutSeconds = readTimeoutSeconds; }
    }
}
