package org.learningjava.uniagent.config;

import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.stereotype.Component;

@Component
@ConfigurationProperties(prefix = "uniagent")
public class UniAgentProperties {
    private int maxRounds = 12;
    private int lintMaxItems = 12;
    private int snippetMaxChars = 240;
    private String defaultProvider = "openai";
    private String defaultModel = "gpt-5-mini";
    private Patch patch = new Patch();
    private Cli cli = new Cli();

    public int getMaxRounds() { return maxRounds; }
    public void setMaxRounds(int v) { this.maxRounds = v; }
    public int getLintMaxItems() { return lintMaxItems; }
    public void setLintMaxItems(int v) { this.lintMaxItems = v; }
    public int getSnippetMaxChars() { return snippetMaxChars; }
    public void setSnippetMaxChars(int v) { this.snippetMaxChars = v; }
    public String getDefaultProvider() { return defaultProvider; }
    public void setDefaultProvider(String v) { this.defaultProvider = v; }
    public String getDefaultModel() { return defaultModel; }
    public void setDefaultModel(String v) { this.defaultModel = v; }
    public Patch getPatch() { return patch; }
    public void setPatch(Patch p) { this.patch = p; }
    public Cli getCli() { return cli; }
    public void setCli(Cli c) { this.cli = c; }

    public static class Patch {
        private int minDocumentLength = 200;
        private int maxIssues = 5;

        public int getMinDocumentLength() { return minDocumentLength; }
        public void setMinDocumentLength(int v) { this.minDocumentLength = v; }
        public int getMaxIssues() { return maxIssues; }
        public void setMaxIssues(int v) { this.maxIssues = v; }
    }

    public static class Cli {
        private boolean enabled = false;

        public boolean isEnabled() { return enabled; }
        public void setEnabled(boolean v) { this.enabled = v; }
    }
}
