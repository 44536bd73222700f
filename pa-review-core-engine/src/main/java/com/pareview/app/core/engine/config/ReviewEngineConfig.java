package com.pareview.app.core.engine.config;

import com.pareview.app.core.engine.confidence.ConfidenceWeights;
import com.pareview.app.core.engine.decision.DecisionResolverConfig;
import com.pareview.app.integration.enumerations.ReviewStoreType;
import lombok.Builder;
import lombok.Getter;
import lombok.ToString;
import lombok.extern.slf4j.Slf4j;

import java.nio.file.Path;
import java.nio.file.Paths;
import java.time.Duration;
import java.time.format.DateTimeParseException;
import java.util.Arrays;
import java.util.List;
import java.util.Locale;
import java.util.Optional;
import java.util.Set;
import java.util.function.Function;
import java.util.stream.Collectors;

/**
 * Engine settings.
 *
 * <h2>Configuration</h2>
 * Every setting can be given programmatically through the builder or read by
 * {@link #fromEnvironment()}, which looks at the system property first and then at the matching
 * environment variable:
 * <ul>
 *   <li>{@code pareview.store.type} / {@code PAREVIEW_STORE_TYPE}: MEMORY or FILE</li>
 *   <li>{@code pareview.store.path} / {@code PAREVIEW_STORE_PATH}</li>
 *   <li>{@code pareview.task.timeout} / {@code PAREVIEW_TASK_TIMEOUT}: ISO-8601 duration</li>
 *   <li>{@code pareview.collaborator.timeout} / {@code PAREVIEW_COLLABORATOR_TIMEOUT}</li>
 *   <li>{@code pareview.lock.duration} / {@code PAREVIEW_LOCK_DURATION}</li>
 *   <li>{@code pareview.decision.strict-denial} / {@code PAREVIEW_DECISION_STRICT_DENIAL}</li>
 *   <li>{@code pareview.documentation.required} / {@code PAREVIEW_DOCUMENTATION_REQUIRED}: comma separated</li>
 *   <li>{@code pareview.provider.demo-ids} / {@code PAREVIEW_PROVIDER_DEMO_IDS}: comma separated</li>
 *   <li>{@code pareview.policy.min-relevance} / {@code PAREVIEW_POLICY_MIN_RELEVANCE}</li>
 * </ul>
 * An unparsable value is logged and replaced by the default. Weights and resolver settings are
 * validated when built, so an invalid combination fails at load.
 */
@Slf4j
@Getter
@Builder(toBuilder = true)
@ToString
public class ReviewEngineConfig {

    static final String STORE_TYPE_PROPERTY = "pareview.store.type";
    static final String STORE_PATH_PROPERTY = "pareview.store.path";
    static final String TASK_TIMEOUT_PROPERTY = "pareview.task.timeout";
    static final String COLLABORATOR_TIMEOUT_PROPERTY = "pareview.collaborator.timeout";
    static final String LOCK_DURATION_PROPERTY = "pareview.lock.duration";
    static final String STRICT_DENIAL_PROPERTY = "pareview.decision.strict-denial";
    static final String REQUIRED_DOCUMENTATION_PROPERTY = "pareview.documentation.required";
    static final String DEMO_PROVIDER_IDS_PROPERTY = "pareview.provider.demo-ids";
    static final String MIN_POLICY_RELEVANCE_PROPERTY = "pareview.policy.min-relevance";

    @Builder.Default
    private final ReviewStoreType storeType = ReviewStoreType.MEMORY;

    @Builder.Default
    private final Path storePath = Paths.get(System.getProperty("user.home"), ".pareview");

    @Builder.Default
    private final Duration taskTimeout = Duration.ofMinutes(5);

    @Builder.Default
    private final Duration collaboratorTimeout = Duration.ofSeconds(10);

    @Builder.Default
    private final Duration lockDuration = Duration.ofMinutes(5);

    @Builder.Default
    private final ConfidenceWeights weights = ConfidenceWeights.defaults();

    @Builder.Default
    private final DecisionResolverConfig resolverConfig = DecisionResolverConfig.defaults();

    @Builder.Default
    private final List<String> requiredDocumentationCategories = List.of(
            "clinical-notes", "imaging-report", "treatment-history");

    /** Provider ids treated as verified without a registry lookup. Empty unless configured. */
    @Builder.Default
    private final Set<String> demoProviderIds = Set.of();

    @Builder.Default
    private final double minimumPolicyRelevance = 50.0;

    public static ReviewEngineConfig defaults() {
        return ReviewEngineConfig.builder().build();
    }

    public static ReviewEngineConfig fromEnvironment() {
        ReviewEngineConfig defaults = defaults();
        ReviewEngineConfigBuilder builder = defaults.toBuilder();

        read(STORE_TYPE_PROPERTY, value -> ReviewStoreType.valueOf(value.trim().toUpperCase(Locale.ROOT)))
                .ifPresent(builder::storeType);
        read(STORE_PATH_PROPERTY, value -> Paths.get(value.trim())).ifPresent(builder::storePath);
        read(TASK_TIMEOUT_PROPERTY, ReviewEngineConfig::parseDuration).ifPresent(builder::taskTimeout);
        read(COLLABORATOR_TIMEOUT_PROPERTY, ReviewEngineConfig::parseDuration).ifPresent(builder::collaboratorTimeout);
        read(LOCK_DURATION_PROPERTY, ReviewEngineConfig::parseDuration).ifPresent(builder::lockDuration);
        read(STRICT_DENIAL_PROPERTY, ReviewEngineConfig::parseBoolean)
                .ifPresent(strict -> builder.resolverConfig(strict
                        ? DecisionResolverConfig.strictDenial() : DecisionResolverConfig.defaults()));
        read(REQUIRED_DOCUMENTATION_PROPERTY, ReviewEngineConfig::parseList)
                .ifPresent(builder::requiredDocumentationCategories);
        read(DEMO_PROVIDER_IDS_PROPERTY, value -> Set.copyOf(parseList(value))).ifPresent(builder::demoProviderIds);
        read(MIN_POLICY_RELEVANCE_PROPERTY, value -> Double.parseDouble(value.trim()))
                .ifPresent(builder::minimumPolicyRelevance);

        ReviewEngineConfig config = builder.build();
        log.info("Review engine configuration loaded: storeType={}, storePath={}, strictDenial={}",
                config.getStoreType(), config.getStorePath(), config.getResolverConfig().isStrictDenialEnabled());
        return config;
    }

    // ========================================================================
    // PRIVATE HELPERS
    // ========================================================================

    private static <T> Optional<T> read(String property, Function<String, T> parser) {
        String value = System.getProperty(property);
        String source = "system property";
        if (value == null || value.isBlank()) {
            value = System.getenv(toEnvironmentName(property));
            source = "environment variable";
        }
        if (value == null || value.isBlank()) {
            return Optional.empty();
        }
        try {
            return Optional.of(parser.apply(value));
        } catch (IllegalArgumentException | DateTimeParseException e) {
            log.warn("Invalid value in {} {}: {}. Using default.", source, property, value);
            return Optional.empty();
        }
    }

    static String toEnvironmentName(String property) {
        return property.toUpperCase(Locale.ROOT).replace('.', '_').replace('-', '_');
    }

    static Duration parseDuration(String value) {
        return Duration.parse(value.trim());
    }

    static boolean parseBoolean(String value) {
        String normalized = value.trim().toLowerCase(Locale.ROOT);
        if (!normalized.equals("true") && !normalized.equals("false")) {
            throw new IllegalArgumentException("Not a boolean: " + value);
        }
        return Boolean.parseBoolean(normalized);
    }

    static List<String> parseList(String value) {
        return Arrays.stream(value.split(","))
                .map(String::trim)
                .filter(item -> !item.isEmpty())
                .collect(Collectors.toList());
    }
}
