package de.mirkosertic.catalog.bitbucket.config;

import de.mirkosertic.catalog.bitbucket.scheduler.TaskScheduleDefinition;
import org.jspecify.annotations.Nullable;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.regex.Pattern;
import java.util.regex.PatternSyntaxException;

/**
 * Reads the provider configs below {@code catalog.providers.bitbucketCloud}.
 * <p>
 * The section is either a single provider (it has a {@code workspace} key, id {@code default})
 * or a map from provider id to provider config.
 */
public final class ProviderConfigReader {

    private static final String PROVIDERS_PATH = "catalog.providers.bitbucketCloud";
    private static final String DEFAULT_PROVIDER_ID = "default";

    private ProviderConfigReader() {
    }

    public static List<ProviderConfig> readProviderConfigs(final Map<String, Object> root) {
        final Map<String, Object> catalog = ConfigValues.optionalMap(root, "catalog", "catalog");
        if (catalog == null) {
            return List.of();
        }
        final Map<String, Object> providers = ConfigValues.optionalMap(catalog, "providers", "catalog.providers");
        if (providers == null) {
            return List.of();
        }
        final Map<String, Object> section = ConfigValues.optionalMap(providers, "bitbucketCloud", PROVIDERS_PATH);
        if (section == null) {
            return List.of();
        }

        if (section.containsKey("workspace")) {
            return List.of(readProviderConfig(DEFAULT_PROVIDER_ID, section, PROVIDERS_PATH));
        }

        final List<ProviderConfig> result = new ArrayList<>();
        for (final String id : section.keySet()) {
            final String path = PROVIDERS_PATH + "." + id;
            final Map<String, Object> providerSection = ConfigValues.optionalMap(section, id, path);
            if (providerSection == null) {
                throw new ConfigurationException("Missing provider config at '" + path + "'");
            }
            result.add(readProviderConfig(id, providerSection, path));
        }
        return result;
    }

    static ProviderConfig readProviderConfig(final String id, final Map<String, Object> section, final String path) {
        final String workspace = ConfigValues.requiredString(section, "workspace", path + ".workspace");
        final String catalogPath = ConfigValues.optionalString(section, "catalogPath", path + ".catalogPath");

        return new ProviderConfig(
                id,
                workspace,
                catalogPath == null ? ProviderConfig.DEFAULT_CATALOG_PATH : catalogPath,
                readFilters(section, path + ".filters"),
                readSchedule(section, path + ".schedule")
        );
    }

    private static @Nullable ProviderFilters readFilters(final Map<String, Object> section, final String path) {
        final Map<String, Object> filters = ConfigValues.optionalMap(section, "filters", path);
        if (filters == null) {
            return null;
        }
        return new ProviderFilters(
                compile(ConfigValues.optionalString(filters, "projectKey", path + ".projectKey"), path + ".projectKey"),
                compile(ConfigValues.optionalString(filters, "repoSlug", path + ".repoSlug"), path + ".repoSlug")
        );
    }

    private static @Nullable TaskScheduleDefinition readSchedule(final Map<String, Object> section, final String path) {
        final Map<String, Object> schedule = ConfigValues.optionalMap(section, "schedule", path);
        if (schedule == null) {
            return null;
        }
        final Duration frequency = requiredDuration(schedule, "frequency", path);
        final Duration timeout = requiredDuration(schedule, "timeout", path);
        final Object initialDelay = schedule.get("initialDelay");

        return new TaskScheduleDefinition(
                frequency,
                timeout,
                initialDelay == null ? Duration.ZERO : DurationParser.parse(initialDelay, path + ".initialDelay")
        );
    }

    private static Duration requiredDuration(final Map<String, Object> schedule, final String key, final String path) {
        final Object value = schedule.get(key);
        if (value == null) {
            throw new ConfigurationException("Missing required config value at '" + path + "." + key + "'");
        }
        final Duration duration = DurationParser.parse(value, path + "." + key);
        if (duration.isZero() || duration.isNegative()) {
            throw new ConfigurationException("Duration at '" + path + "." + key + "' must be positive");
        }
        return duration;
    }

    private static @Nullable Pattern compile(final @Nullable String regex, final String path) {
        if (regex == null) {
            return null;
        }
        try {
            return Pattern.compile(regex);
        } catch (final PatternSyntaxException e) {
            throw new ConfigurationException("Invalid regular expression at '" + path + "': " + regex, e);
        }
    }
}
