package org.yamldiff.reporting;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;
import org.yamldiff.domain.Difference;
import org.yamldiff.domain.YamlNode;
import org.yamldiff.service.YamlDiffService;

import java.io.File;
import java.time.LocalDateTime;
import java.util.ArrayList;

@Service
public class DiffReportService {

    private static final Logger logger = LoggerFactory.getLogger(DiffReportService.class);

    static final String TITLE = "YAML Difference Report";

    private final JsonDiffReportWriter jsonWriter = new JsonDiffReportWriter();

    public DiffReportModels.DiffReport buildReport(YamlDiffService.DiffSummary summary) {
        DiffReportModels.DiffReport report = new DiffReportModels.DiffReport();
        report.title = TITLE;
        report.generatedAt = LocalDateTime.now();
        report.fromLabel = summary.getFromLocation();
        report.toLabel = summary.getToLocation();
        report.added = summary.getAdded();
        report.removed = summary.getRemoved();
        report.modified = summary.getModified();
        report.differences = new ArrayList<>();
        for (Difference difference : summary.getDifferences()) {
            report.differences.add(toRow(difference));
        }
        return report;
    }

    public File writeJson(YamlDiffService.DiffSummary summary, String fileName) {
        File out = jsonWriter.write(new File(fileName), buildReport(summary));
        logger.info("JSON report written to {}", out.getAbsolutePath());
        return out;
    }

    private DiffReportModels.DiffRow toRow(Difference difference) {
        DiffReportModels.DiffRow row = new DiffReportModels.DiffRow();
        row.path = difference.getPath();
        row.type = difference.getType().name();
        row.documentIndex = difference.getDocumentIndex();
        row.from = plain(difference.getFrom());
        row.to = plain(difference.getTo());
        return row;
    }

    private static Object plain(YamlNode node) {
        return node == null ? null : node.toPlainObject();
    }
}
