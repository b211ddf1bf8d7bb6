package org.yamldiff.config;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.boot.test.context.runner.ApplicationContextRunner;
import org.springframework.context.annotation.Configuration;
import org.yamldiff.domain.CompareOptions;
import org.yamldiff.domain.FilterOptions;

import jakarta.validation.ConstraintViolation;
import jakarta.validation.Validation;
import jakarta.validation.Validator;
import jakarta.validation.ValidatorFactory;

import java.util.List;
import java.util.Set;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Unit tests for YamlDiffConfig and its nested configuration classes
 */
@DisplayName("YamlDiffConfig Tests")
class YamlDiffConfigTest {

    private YamlDiffConfig yamlDiffConfig;
    private Validator validator;

    @BeforeEach
    void setUp() {
        yamlDiffConfig = new YamlDiffConfig();
        ValidatorFactory factory = Validation.buildDefaultValidatorFactory();
        validator = factory.getValidator();
    }

    @Configuration
    @EnableConfigurationProperties(YamlDiffConfig.class)
    static class PropertiesConfiguration {
    }

    @Nested
    @DisplayName("Defaults")
    class Defaults {

        @Test
        @DisplayName("Should detect Kubernetes resources and renames by default")
        void shouldUseCommandLineDefaults() {
            // When
            CompareOptions options = yamlDiffConfig.getCompare().toCompareOptions();

            // Then
            assertTrue(options.isDetectKubernetes());
            assertTrue(options.isDetectRenames());
            assertFalse(options.isIgnoreOrderChanges());
            assertFalse(options.isSwap());
            assertNull(options.getChroot());
            assertEquals("compact", yamlDiffConfig.getOutput().getFormat());
            assertEquals(30, yamlDiffConfig.getRemote().getTimeoutSeconds());
            assertEquals(10L * 1024 * 1024, yamlDiffConfig.getRemote().getMaxBytes());
        }

        @Test
        @DisplayName("Should produce empty filter options by default")
        void shouldProduceEmptyFilters() {
            assertTrue(yamlDiffConfig.getFilter().toFilterOptions().isEmpty());
        }

        @Test
        @DisplayName("Default configuration should be valid")
        void defaultConfigurationIsValid() {
            assertTrue(validator.validate(yamlDiffConfig).isEmpty());
        }
    }

    @Nested
    @DisplayName("Conversion")
    class Conversion {

        @Test
        @DisplayName("Should carry every compare setting into CompareOptions")
        void shouldConvertCompareSettings() {
            // Given
            YamlDiffConfig.CompareConfig compare = yamlDiffConfig.getCompare();
            compare.setIgnoreOrderChanges(true);
            compare.setIgnoreWhitespaceChanges(true);
            compare.setIgnoreValueChanges(true);
            compare.setDetectKubernetes(false);
            compare.setDetectRenames(false);
            compare.setIgnoreApiVersion(true);
            compare.setAdditionalIdentifiers(List.of("key"));
            compare.setSwap(true);
            compare.setChrootFrom("a");
            compare.setChrootTo("b");
            compare.setChrootListToDocuments(true);

            // When
            CompareOptions options = compare.toCompareOptions();

            // Then
            assertTrue(options.isIgnoreOrderChanges());
            assertTrue(options.isIgnoreWhitespaceChanges());
            assertTrue(options.isIgnoreValueChanges());
            assertFalse(options.isDetectKubernetes());
            assertFalse(options.isDetectRenames());
            assertTrue(options.isIgnoreApiVersion());
            assertEquals(List.of("key"), options.getAdditionalIdentifiers());
            assertTrue(options.isSwap());
            assertEquals("a", options.getChrootFrom());
            assertEquals("b", options.getChrootTo());
            assertTrue(options.isChrootListToDocuments());
        }

        @Test
        @DisplayName("Should carry filters into FilterOptions")
        void shouldConvertFilterSettings() {
            // Given
            YamlDiffConfig.FilterConfig filter = yamlDiffConfig.getFilter();
            filter.setIncludePaths(List.of("spec"));
            filter.setExcludeRegexp(List.of("status$"));

            // When
            FilterOptions options = filter.toFilterOptions();

            // Then
            assertEquals(List.of("spec"), options.getIncludePaths());
            assertEquals(List.of("status$"), options.getExcludeRegexp());
            assertTrue(options.getExcludePaths().isEmpty());
            assertFalse(options.isEmpty());
        }
    }

    @Nested
    @DisplayName("Validation")
    class ValidationTests {

        @Test
        @DisplayName("Blank output format should be rejected")
        void blankFormatIsInvalid() {
            // Given
            yamlDiffConfig.getOutput().setFormat(" ");

            // When
            Set<ConstraintViolation<YamlDiffConfig>> violations = validator.validate(yamlDiffConfig);

            // Then
            assertEquals(1, violations.size());
            assertEquals("output.format", violations.iterator().next().getPropertyPath().toString());
        }

        @Test
        @DisplayName("Non-positive remote limits should be rejected")
        void remoteLimitsMustBePositive() {
            yamlDiffConfig.getRemote().setTimeoutSeconds(0);
            yamlDiffConfig.getRemote().setMaxBytes(0);

            assertEquals(2, validator.validate(yamlDiffConfig).size());
        }
    }

    @Nested
    @DisplayName("Binding")
    class Binding {

        private final ApplicationContextRunner contextRunner = new ApplicationContextRunner()
                .withUserConfiguration(PropertiesConfiguration.class);

        @Test
        @DisplayName("Should bind kebab-case properties")
        void shouldBindProperties() {
            contextRunner.withPropertyValues(
                    "yamldiff.compare.ignore-order-changes=true",
                    "yamldiff.compare.additional-identifiers=key,uid",
                    "yamldiff.compare.chroot=spec.template",
                    "yamldiff.filter.exclude-paths=status",
                    "yamldiff.output.format=brief",
                    "yamldiff.output.set-exit-code=true",
                    "yamldiff.remote.timeout-seconds=5"
            ).run(ctx -> {
                YamlDiffConfig config = ctx.getBean(YamlDiffConfig.class);
                assertTrue(config.getCompare().isIgnoreOrderChanges());
                assertEquals(List.of("key", "uid"), config.getCompare().getAdditionalIdentifiers());
                assertEquals("spec.template", config.getCompare().getChroot());
                assertEquals(List.of("status"), config.getFilter().getExcludePaths());
                assertEquals("brief", config.getOutput().getFormat());
                assertTrue(config.getOutput().isSetExitCode());
                assertEquals(5, config.getRemote().getTimeoutSeconds());
            });
        }

        @Test
        @DisplayName("Invalid properties should fail startup")
        void shouldFailOnInvalidProperties() {
            contextRunner.withPropertyValues("yamldiff.remote.timeout-seconds=0").run(ctx ->
                    assertNotNull(ctx.getStartupFailure()));
        }
    }
}
