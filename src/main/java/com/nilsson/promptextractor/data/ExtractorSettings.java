package com.nilsson.promptextractor.data;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;

import java.util.ArrayList;
import java.util.List;

/**
 Tunable parameters of a prompt extraction run. Populated by {@link SettingsRepository}
 from {@code extractor-defaults.json} and an optional {@code prompt-extractor.json} overlay.
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public class ExtractorSettings {

    private int maxWorkers = 4;
    private int fileCap = 1000;
    private String extension = "png";
    private List<String> annotationKeys = new ArrayList<>(List.of("parameters", "Prompt", "Description"));
    private String outputPrefix = "prompts_";
    private String runLogName = "error.log";
    private int progressLogPercent = 10;

    public int getMaxWorkers() {
        return maxWorkers;
    }

    public void setMaxWorkers(int maxWorkers) {
        this.maxWorkers = maxWorkers;
    }

    public int getFileCap() {
        return fileCap;
    }

    public void setFileCap(int fileCap) {
        this.fileCap = fileCap;
    }

    public String getExtension() {
        return extension;
    }

    public void setExtension(String extension) {
        this.extension = extension;
    }

    /** Container annotation keywords, highest priority first. */
    public List<String> getAnnotationKeys() {
        return annotationKeys;
    }

    public void setAnnotationKeys(List<String> annotationKeys) {
        this.annotationKeys = annotationKeys;
    }

    public String getOutputPrefix() {
        return outputPrefix;
    }

    public void setOutputPrefix(String outputPrefix) {
        this.outputPrefix = outputPrefix;
    }

    public String getRunLogName() {
        return runLogName;
    }

    public void setRunLogName(String runLogName) {
        this.runLogName = runLogName;
    }

    public int getProgressLogPercent() {
        return progressLogPercent;
    }

    public void setProgressLogPercent(int progressLogPercent) {
        this.progressLogPercent = progressLogPercent;
    }

    @Override
    public String toString() {
        return "ExtractorSettings{maxWorkers=" + maxWorkers
                + ", fileCap=" + fileCap
                + ", extension=" + extension
                + ", annotationKeys=" + annotationKeys
                + ", outputPrefix=" + outputPrefix
                + ", runLogName=" + runLogName
                + ", progressLogPercent=" + progressLogPercent + "}";
    }
}
