package com.siteaudit.config;

import org.springframework.boot.context.properties.ConfigurationProperties;

@ConfigurationProperties(prefix = "site-audit.export")
public class ExportProperties {
    /**
     * Directory finished crawl reports are written to; exporting is off when unset.
     */
    private String directory;
    private boolean prettyPrint = true;

    public String getDirectory() {
        return directory;
    }

    public void setDirectory(String directory) {
        this.directory = directory == null || directory.isBlank() ? null : directory.trim();
    }

    public boolean isPrettyPrint() {
        return prettyPrint;
    }

    public void setPrettyPrint(boolean prettyPrint) {
        this.prettyPrint = prettyPrint;
    }
}
