package org.yamldiff.config;

import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.stereotype.Component;
import org.springframework.validation.annotation.Validated;
import org.yamldiff.domain.CompareOptions;
import org.yamldiff.domain.FilterOptions;

import jakarta.validation.Valid;
import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import java.util.ArrayList;
import java.util.List;

/**
 * Configuration properties for the yaml diff application
 */
@Component
@Validated
@ConfigurationProperties(prefix = "yamldiff")
public class YamlDiffConfig {

    @Valid
    @NotNull
    private CompareConfig compare = new CompareConfig();

    @Valid
    @NotNull
    private FilterConfig filter = new FilterConfig();

    @Valid
    @NotNull
    private OutputConfig output = new OutputConfig();

    @Valid
    @NotNull
    private RemoteConfig remote = new RemoteConfig();

    // Nested configuration classes
    public static class CompareConfig {
        private boolean ignoreOrderChanges = false;
        private boolean ignoreWhitespaceChanges = false;
        private boolean ignoreValueChanges = false;
        private boolean detectKubernetes = true;
        private boolean detectRenames = true;
        private boolean ignoreApiVersion = false;
        private List<String> additionalIdentifiers = new ArrayList<>();
        private boolean swap = false;
        private String chroot;
        private String chrootFrom;
        private String chrootTo;
        private boolean chrootListToDocuments = false;

        public CompareOptions toCompareOptions() {
            return CompareOptions.builder()
                    .ignoreOrderChanges(ignoreOrderChanges)
                    .ignoreWhitespaceChanges(ignoreWhitespaceChanges)
                    .ignoreValueChanges(ignoreValueChanges)
                    .detectKubernetes(detectKubernetes)
                    .detectRenames(detectRenames)
                    .ignoreApiVersion(ignoreApiVersion)
                    .additionalIdentifiers(additionalIdentifiers)
                    .swap(swap)
                    .chroot(chroot)
                    .chrootFrom(chrootFrom)
                    .chrootTo(chrootTo)
                    .chrootListToDocuments(chrootListToDocuments)
                    .build();
        }

        // Getters and Setters
        public boolean isIgnoreOrderChanges() { return ignoreOrderChanges; }
        public void setIgnoreOrderChanges(boolean ignoreOrderChanges) { this.ignoreOrderChanges = ignoreOrderChanges; }
        public boolean isIgnoreWhitespaceChanges() { return ignoreWhitespaceChanges; }
        public void setIgnoreWhitespaceChanges(boolean ignoreWhitespaceChanges) { this.ignoreWhitespaceChanges = ignoreWhitespaceChanges; }
        public boolean isIgnoreValueChanges() { return ignoreValueChanges; }
        public void setIgnoreValueChanges(boolean ignoreValueChanges) { this.ignoreValueChanges = ignoreValueChanges; }
        public boolean isDetectKubernetes() { return detectKubernetes; }
        public void setDetectKubernetes(boolean detectKubernetes) { this.detectKubernetes = detectKubernetes; }
        public boolean isDetectRenames() { return detectRenames; }
        public void setDetectRenames(boolean detectRenames) { this.detectRenames = detectRenames; }
        public boolean isIgnoreApiVersion() { return ignoreApiVersion; }
        public void setIgnoreApiVersion(boolean ignoreApiVersion) { this.ignoreApiVersion = ignoreApiVersion; }
        public List<String> getAdditionalIdentifiers() { return additionalIdentifiers; }
        public void setAdditionalIdentifiers(List<String> additionalIdentifiers) { this.additionalIdentifiers = additionalIdentifiers; }
        public boolean isSwap() { return swap; }
        public void setSwap(boolean swap) { this.swap = swap; }
        public String getChroot() { return chroot; }
        public void setChroot(String chroot) { this.chroot = chroot; }
        public String getChrootFrom() { return chrootFrom; }
        public void setChrootFrom(String chrootFrom) { this.chrootFrom = chrootFrom; }
        public String getChrootTo() { return chrootTo; }
        public void setChrootTo(String chrootTo) { this.chrootTo = chrootTo; }
        public boolean isChrootListToDocuments() { return chrootListToDocuments; }
        public void setChrootListToDocuments(boolean chrootListToDocuments) { this.chrootListToDocuments = chrootListToDocuments; }
    }

    public static class FilterConfig {
        private List<String> includePaths = new ArrayList<>();
        private List<String> excludePaths = new ArrayList<>();
        private List<String> includeRegexp = new ArrayList<>();
        private List<String> excludeRegexp = new ArrayList<>();

        public FilterOptions toFilterOptions() {
            return new FilterOptions(includePaths, excludePaths, includeRegexp, excludeRegexp);
        }

        // Getters and Setters
        public List<String> getIncludePaths() { return includePaths; }
        public void setIncludePaths(List<String> includePaths) { this.includePaths = includePaths; }
        public List<String> getExcludePaths() { return excludePaths; }
        public void setExcludePaths(List<String> excludePaths) { this.excludePaths = excludePaths; }
        public List<String> getIncludeRegexp() { return includeRegexp; }
        public void setIncludeRegexp(List<String> includeRegexp) { this.includeRegexp = includeRegexp; }
        public List<String> getExcludeRegexp() { return excludeRegexp; }
        public void setExcludeRegexp(List<String> excludeRegexp) { this.excludeRegexp = excludeRegexp; }
    }

    public static class OutputConfig {
        @NotBlank
        private String format = "compact";
        private boolean omitHeader = false;
        private boolean goPatchStyle = false;
        private boolean setExitCode = false;
        private String jsonReport;  // Optional JSON report file

        // Getters and Setters
        public String getFormat() { return format; }
        public void setFormat(String format) { this.format = format; }
        public boolean isOmitHeader() { return omitHeader; }
        public void setOmitHeader(boolean omitHeader) { this.omitHeader = omitHeader; }
        public boolean isGoPatchStyle() { return goPatchStyle; }
        public void setGoPatchStyle(boolean goPatchStyle) { this.goPatchStyle = goPatchStyle; }
        public boolean isSetExitCode() { return setExitCode; }
        public void setSetExitCode(boolean setExitCode) { this.setExitCode = setExitCode; }
        public String getJsonReport() { return jsonReport; }
        public void setJsonReport(String jsonReport) { this.jsonReport = jsonReport; }
    }

    public static class RemoteConfig {
        @Min(1)
        private int timeoutSeconds = 30;
        @Min(1)
        private long maxBytes = 10L * 1024 * 1024;

        // Getters and Setters
        public int getTimeoutSeconds() { return timeoutSeconds; }
        public void setTimeoutSeconds(int timeoutSeconds) { this.timeoutSeconds = timeoutSeconds; }
        public long getMaxBytes() { return maxBytes; }
        public void setMaxBytes(long maxBytes) { this.maxBytes = maxBytes; }
    }

    // Main getters and setters
    public CompareConfig getCompare() { return compare; }
    public void setCompare(CompareConfig compare) { this.compare = compare; }
    public FilterConfig getFilter() { return filter; }
    public void setFilter(FilterConfig filter) { this.filter = filter; }
    public OutputConfig getOutput() { return output; }
    public void setOutput(OutputConfig output) { this.output = output; }
    public RemoteConfig getRemote() { return remote; }
    public void setRemote(RemoteConfig remote) { this.remote = remote; }
}
