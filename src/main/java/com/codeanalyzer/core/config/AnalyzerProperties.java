package com.codeanalyzer.core.config;

import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.stereotype.Component;

/**
 * Defaults for the command-line surface, bound from {@code analyzer.*} in application YAML.
 * Every value can be overridden per invocation by the matching command option.
 */
@Component
@ConfigurationProperties(prefix = "analyzer")
public class AnalyzerProperties {

    /** Analyzer configuration file, resolved against the workspace when relative. */
    private String configFile = ".codeclimate.yml";

    /** Source directory path handed to engines (the mount point inside their containers). */
    private String sourceDir = "/code";

    /** Directory scanned for ignore rules and includable files. */
    private String workspace = ".";

    /** Engine registry file; blank means the bundled {@code engines.yml}. */
    private String registryFile = "";

    /** Label attached to engine containers; blank means none. */
    private String containerLabel = "";

    public String getConfigFile() {
        return configFile;
    }

    public void setConfigFile(String configFile) {
        this.configFile = configFile;
    }

    public String getSourceDir() {
        return sourceDir;
    }

    public void setSourceDir(String sourceDir) {
        this.sourceDir = sourceDir;
    }

    public String getWorkspace() {
        return workspace;
    }

    public void setWorkspace(String workspace) {
        this.workspace = workspace;
    }

    public String getRegistryFile() {
        return registryFile;
    }

    public void setRegistryFile(String registryFile) {
        this.registryFile = registryFile;
    }

    public boolean isRegistryFileConfigured() {
        return registryFile != null && !registryFile.isBlank();
    }

    public String getContainerLabel() {
        return containerLabel;
    }

    public void setContainerLabel(String containerLabel) {
        this.containerLabel = containerLabel;
    }

    /**
     * Returns the container label, or {@code null} when none is configured.
     */
    public String getContainerLabelOrNull() {
        return containerLabel == null || containerLabel.isBlank() ? null : containerLabel;
    }
}
