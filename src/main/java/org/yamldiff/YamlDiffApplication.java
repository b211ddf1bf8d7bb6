package org.yamldiff;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.CommandLineRunner;
import org.springframework.boot.ExitCodeGenerator;
import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.context.annotation.Bean;

/**
 * Main Spring Boot application for semantic YAML comparison
 */
@SpringBootApplication
public class YamlDiffApplication {

    private static final Logger logger = LoggerFactory.getLogger(YamlDiffApplication.class);

    public static void main(String[] args) {
        // Check for help argument before starting Spring
        if (args.length == 0 || args[0].equals("--help") || args[0].equals("-h")) {
            printUsage();
            System.exit(args.length == 0 ? YamlDiffRunner.EXIT_ERROR : YamlDiffRunner.EXIT_OK);
        }

        SpringApplication app = new SpringApplication(YamlDiffApplication.class);
        System.exit(SpringApplication.exit(app.run(args)));
    }

    /**
     * Prints usage information
     */
    static void printUsage() {
        System.out.println("\nYAML semantic diff");
        System.out.println("Usage: java -jar yaml-semantic-diff.jar <from> <to> [OPTIONS]");
        System.out.println("\nArguments:");
        System.out.println("  from, to                 Local file path or http(s) URL");
        System.out.println("\nComparison Options:");
        System.out.println("  --yamldiff.compare.ignore-order-changes=true        Compare lists as sets");
        System.out.println("  --yamldiff.compare.ignore-whitespace-changes=true   Ignore leading/trailing whitespace");
        System.out.println("  --yamldiff.compare.ignore-value-changes=true        Report structural changes only");
        System.out.println("  --yamldiff.compare.detect-kubernetes=false          Match documents by position only");
        System.out.println("  --yamldiff.compare.detect-renames=false             Disable renamed resource pairing");
        System.out.println("  --yamldiff.compare.ignore-api-version=true          Match resources without apiVersion");
        System.out.println("  --yamldiff.compare.additional-identifiers=key,...   Extra list entry identifier fields");
        System.out.println("  --yamldiff.compare.swap=true                        Swap from and to");
        System.out.println("  --yamldiff.compare.chroot=PATH                      Compare only the subtree at PATH");
        System.out.println("  --yamldiff.compare.chroot-from=PATH                 Chroot the from side only");
        System.out.println("  --yamldiff.compare.chroot-to=PATH                   Chroot the to side only");
        System.out.println("  --yamldiff.compare.chroot-list-to-documents=true    Treat a chroot list as documents");
        System.out.println("\nFilter Options:");
        System.out.println("  --yamldiff.filter.include-paths=PATH,...            Keep differences under these paths");
        System.out.println("  --yamldiff.filter.exclude-paths=PATH,...            Drop differences under these paths");
        System.out.println("  --yamldiff.filter.include-regexp=REGEX,...          Keep paths matching a pattern");
        System.out.println("  --yamldiff.filter.exclude-regexp=REGEX,...          Drop paths matching a pattern");
        System.out.println("\nOutput Options:");
        System.out.println("  --yamldiff.output.format=compact|brief              Output style (default compact)");
        System.out.println("  --yamldiff.output.omit-header=true                  Skip the summary header");
        System.out.println("  --yamldiff.output.go-patch-style=true               Print paths as /a/b/0");
        System.out.println("  --yamldiff.output.set-exit-code=true                Exit with 1 when differences exist");
        System.out.println("  --yamldiff.output.json-report=FILE                  Also write a JSON report");
        System.out.println("  -h, --help                                          Show this help message");
        System.out.println("\nExit codes: 0 success, 1 differences found (with set-exit-code), 255 error");
        System.out.println("\nExamples:");
        System.out.println("  java -jar yaml-semantic-diff.jar old.yaml new.yaml");
        System.out.println("");
        System.out.println("  java -jar yaml-semantic-diff.jar old.yaml https://example.com/new.yaml \\");
        System.out.println("    --yamldiff.compare.ignore-order-changes=true --yamldiff.output.format=brief");
        System.out.println("");
    }

    @Bean
    public CommandLineRunner commandLineRunner(YamlDiffRunner yamlDiffRunner, ExitCodeHolder exitCodeHolder) {
        return args -> {
            logger.debug("Starting YAML diff");
            exitCodeHolder.exitCode = yamlDiffRunner.run(args);
        };
    }

    @Bean
    public ExitCodeHolder exitCodeHolder() {
        return new ExitCodeHolder();
    }

    /**
     * Carries the runner's exit code to {@link SpringApplication#exit}
     */
    public static class ExitCodeHolder implements ExitCodeGenerator {
        private int exitCode;

        @Override
        public int getExitCode() {
            return exitCode;
        }
    }
}
