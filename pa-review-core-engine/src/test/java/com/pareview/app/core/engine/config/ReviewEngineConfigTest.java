package com.pareview.app.core.engine.config;

import com.pareview.app.integration.enumerations.ReviewStoreType;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.nio.file.Paths;
import java.time.Duration;
import java.util.List;
import java.util.Locale;
import java.util.Set;

import static org.junit.jupiter.api.Assertions.*;

class ReviewEngineConfigTest {

    private static final List<String> PROPERTIES = List.of(
            ReviewEngineConfig.STORE_TYPE_PROPERTY,
            ReviewEngineConfig.STORE_PATH_PROPERTY,
            ReviewEngineConfig.TASK_TIMEOUT_PROPERTY,
            ReviewEngineConfig.COLLABORATOR_TIMEOUT_PROPERTY,
            ReviewEngineConfig.LOCK_DURATION_PROPERTY,
            ReviewEngineConfig.STRICT_DENIAL_PROPERTY,
            ReviewEngineConfig.REQUIRED_DOCUMENTATION_PROPERTY,
            ReviewEngineConfig.DEMO_PROVIDER_IDS_PROPERTY,
            ReviewEngineConfig.MIN_POLICY_RELEVANCE_PROPERTY);

    @AfterEach
    void clearProperties() {
        PROPERTIES.forEach(System::clearProperty);
    }

    @Test
    void defaults() {
        ReviewEngineConfig config = ReviewEngineConfig.defaults();

        assertEquals(ReviewStoreType.MEMORY, config.getStoreType());
        assertEquals(Duration.ofMinutes(5), config.getTaskTimeout());
        assertEquals(List.of("clinical-notes", "imaging-report", "treatment-history"),
                config.getRequiredDocumentationCategories());
        assertTrue(config.getDemoProviderIds().isEmpty());
        assertFalse(config.getResolverConfig().isStrictDenialEnabled());
        assertEquals(50.0, config.getMinimumPolicyRelevance());
    }

    @Nested
    @DisplayName("System properties")
    class SystemPropertyTests {

        @Test
        @DisplayName("store type and flags parse the same under a Turkish default locale")
        void localeIndependentParsing() {
            Locale previous = Locale.getDefault();
            Locale.setDefault(new Locale("tr", "TR"));
            try {
                System.setProperty(ReviewEngineConfig.STORE_TYPE_PROPERTY, "file");
                System.setProperty(ReviewEngineConfig.STRICT_DENIAL_PROPERTY, "TRUE");

                ReviewEngineConfig config = ReviewEngineConfig.fromEnvironment();

                assertEquals(ReviewStoreType.FILE, config.getStoreType());
                assertTrue(config.getResolverConfig().isStrictDenialEnabled());
                assertEquals("PAREVIEW_STORE_TYPE", ReviewEngineConfig.toEnvironmentName("pareview.store-type"));
            } finally {
                Locale.setDefault(previous);
            }
        }

        @Test
        void overridesDefaults() {
            System.setProperty(ReviewEngineConfig.STORE_TYPE_PROPERTY, "file");
            System.setProperty(ReviewEngineConfig.STORE_PATH_PROPERTY, "/var/lib/pareview");
            System.setProperty(ReviewEngineConfig.TASK_TIMEOUT_PROPERTY, "PT30S");
            System.setProperty(ReviewEngineConfig.STRICT_DENIAL_PROPERTY, "TRUE");
            System.setProperty(ReviewEngineConfig.DEMO_PROVIDER_IDS_PROPERTY, "0000000006, 1245319599");
            System.setProperty(ReviewEngineConfig.MIN_POLICY_RELEVANCE_PROPERTY, "65");

            ReviewEngineConfig config = ReviewEngineConfig.fromEnvironment();

            assertEquals(ReviewStoreType.FILE, config.getStoreType());
            assertEquals(Paths.get("/var/lib/pareview"), config.getStorePath());
            assertEquals(Duration.ofSeconds(30), config.getTaskTimeout());
            assertTrue(config.getResolverConfig().isStrictDenialEnabled());
            assertEquals(Set.of("0000000006", "1245319599"), config.getDemoProviderIds());
            assertEquals(65.0, config.getMinimumPolicyRelevance());
        }

        @Test
        @DisplayName("unparsable values fall back to the defaults")
        void invalidValuesKeepDefaults() {
            System.setProperty(ReviewEngineConfig.STORE_TYPE_PROPERTY, "cassandra");
            System.setProperty(ReviewEngineConfig.LOCK_DURATION_PROPERTY, "five minutes");
            System.setProperty(ReviewEngineConfig.STRICT_DENIAL_PROPERTY, "yes");
            System.setProperty(ReviewEngineConfig.MIN_POLICY_RELEVANCE_PROPERTY, "high");

            ReviewEngineConfig config = ReviewEngineConfig.fromEnvironment();

            assertEquals(ReviewStoreType.MEMORY, config.getStoreType());
            assertEquals(Duration.ofMinutes(5), config.getLockDuration());
            assertFalse(config.getResolverConfig().isStrictDenialEnabled());
            assertEquals(50.0, config.getMinimumPolicyRelevance());
        }
    }

    @Nested
    @DisplayName("Parsers")
    class ParserTests {

        @Test
        void environmentName() {
            assertEquals("PAREVIEW_DECISION_STRICT_DENIAL",
                    ReviewEngineConfig.toEnvironmentName(ReviewEngineConfig.STRICT_DENIAL_PROPERTY));
        }

        @Test
        void list() {
            assertEquals(List.of("a", "b"), ReviewEngineConfig.parseList(" a, ,b ,"));
        }

        @Test
        void booleanRejectsAnythingElse() {
            assertTrue(ReviewEngineConfig.parseBoolean(" true "));
            assertThrows(IllegalArgumentException.class, () -> ReviewEngineConfig.parseBoolean("1"));
        }

        @Test
        void duration() {
            assertEquals(Duration.ofMinutes(2), ReviewEngineConfig.parseDuration("PT2M"));
        }
    }
}
