package org.yamldiff;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;
import org.yamldiff.config.YamlDiffConfig;
import org.yamldiff.reporting.DiffFormatter;
import org.yamldiff.reporting.DiffFormatters;
import org.yamldiff.reporting.DiffReportService;
import org.yamldiff.reporting.FormatOptions;
import org.yamldiff.service.YamlDiffService;

import java.io.PrintStream;
import java.util.ArrayList;
import java.util.List;

/**
 * Runs one comparison for the command line and turns the outcome into an exit code
 */
@Component
public class YamlDiffRunner {

    private static final Logger logger = LoggerFactory.getLogger(YamlDiffRunner.class);

    public static final int EXIT_OK = 0;
    public static final int EXIT_DIFFERENCES = 1;
    public static final int EXIT_ERROR = 255;

    private final YamlDiffService yamlDiffService;
    private final DiffReportService diffReportService;
    private final YamlDiffConfig config;
    private final PrintStream out;

    public YamlDiffRunner(YamlDiffService yamlDiffService, DiffReportService diffReportService, YamlDiffConfig config) {
        this(yamlDiffService, diffReportService, config, System.out);
    }

    YamlDiffRunner(YamlDiffService yamlDiffService, DiffReportService diffReportService,
                   YamlDiffConfig config, PrintStream out) {
        this.yamlDiffService = yamlDiffService;
        this.diffReportService = diffReportService;
        this.config = config;
        this.out = out;
    }

    /**
     * @param args command line arguments; the two non-option arguments are the from and to locations
     * @return process exit code
     */
    public int run(String... args) {
        List<String> locations = positionalArguments(args);
        if (locations.size() != 2) {
            logger.error("Expected <from> <to>, got {} argument(s): {}", locations.size(), locations);
            return EXIT_ERROR;
        }

        try {
            logCurrentConfiguration();
            YamlDiffConfig.OutputConfig output = config.getOutput();
            DiffFormatter formatter = DiffFormatters.forName(output.getFormat());

            YamlDiffService.DiffSummary summary = yamlDiffService.compare(locations.get(0), locations.get(1),
                    config.getCompare().toCompareOptions(), config.getFilter().toFilterOptions());

            out.print(formatter.format(summary.getDifferences(),
                    new FormatOptions(output.isOmitHeader(), output.isGoPatchStyle())));
            out.flush();

            if (output.getJsonReport() != null && !output.getJsonReport().isBlank()) {
                diffReportService.writeJson(summary, output.getJsonReport());
            }

            if (summary.hasDifferences() && output.isSetExitCode()) {
                return EXIT_DIFFERENCES;
            }
            return EXIT_OK;
        } catch (Exception e) {
            logger.error("Error during yaml comparison: {}", e.getMessage(), e);
            return EXIT_ERROR;
        }
    }

    /** Arguments that are not {@code --property=value} overrides. */
    static List<String> positionalArguments(String... args) {
        List<String> result = new ArrayList<>();
        for (String arg : args) {
            if (!arg.startsWith("--")) {
                result.add(arg);
            }
        }
        return result;
    }

    private void logCurrentConfiguration() {
        YamlDiffConfig.CompareConfig compare = config.getCompare();
        logger.debug("Compare options: ignoreOrder={}, ignoreWhitespace={}, ignoreValues={}, kubernetes={}, renames={}",
                compare.isIgnoreOrderChanges(), compare.isIgnoreWhitespaceChanges(), compare.isIgnoreValueChanges(),
                compare.isDetectKubernetes(), compare.isDetectRenames());
        logger.debug("Output format: {}", config.getOutput().getFormat());
    }
}
