package org.yamldiff.reporting;

import com.fasterxml.jackson.annotation.JsonInclude;

import java.time.LocalDateTime;
import java.util.List;

@JsonInclude(JsonInclude.Include.NON_NULL)
public class DiffReportModels {

    @JsonInclude(JsonInclude.Include.NON_NULL)
    public static class DiffRow {
        public String path;
        public String type; // ADDED | REMOVED | MODIFIED | ORDER_CHANGED
        public Integer documentIndex;
        public Object from; // plain value, maps and lists kept structured
        public Object to;
    }

    @JsonInclude(JsonInclude.Include.NON_NULL)
    public static class DiffReport {
        public String title;
        public LocalDateTime generatedAt;
        public String fromLabel;
        public String toLabel;
        public int added;
        public int removed;
        public int modified;
        public List<DiffRow> differences;

        public boolean isPassing() {
            return differences == null || differences.isEmpty();
        }
    }
}
