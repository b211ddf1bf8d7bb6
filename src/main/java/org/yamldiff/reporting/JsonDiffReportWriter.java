package org.yamldiff.reporting;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;

import java.io.File;

public class JsonDiffReportWriter {
    private final ObjectMapper mapper;

    public JsonDiffReportWriter() {
        this.mapper = new ObjectMapper()
                .registerModule(new JavaTimeModule())
                .disable(SerializationFeature.WRITE_DATES_AS_TIMESTAMPS)
                .enable(SerializationFeature.INDENT_OUTPUT);
    }

    public File write(File out, DiffReportModels.DiffReport report) {
        try {
            File parent = out.getAbsoluteFile().getParentFile();
            if (parent != null && !parent.exists()) parent.mkdirs();
            mapper.writeValue(out, report);
            return out;
        } catch (Exception e) {
            throw new RuntimeException("Failed to write JSON diff report", e);
        }
    }
}
