package de.mirkosertic.catalog.bitbucket.config;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Reads the Bitbucket Cloud integrations below {@code integrations.bitbucketCloud}.
 * An anonymous default integration is added when none is configured.
 */
public final class IntegrationConfigReader {

    private static final String INTEGRATIONS_PATH = "integrations.bitbucketCloud";

    private IntegrationConfigReader() {
    }

    public static List<BitbucketCloudIntegrationConfig> readIntegrations(final Map<String, Object> root) {
        final List<BitbucketCloudIntegrationConfig> result = new ArrayList<>();

        final Map<String, Object> integrations = ConfigValues.optionalMap(root, "integrations", "integrations");
        final Object section = integrations == null ? null : integrations.get("bitbucketCloud");
        if (section != null) {
            if (!(section instanceof List<?> entries)) {
                throw new ConfigurationException("Invalid type in config for key '" + INTEGRATIONS_PATH + "', expected list");
            }
            for (int i = 0; i < entries.size(); i++) {
                result.add(readIntegration(entries.get(i), INTEGRATIONS_PATH + "[" + i + "]"));
            }
        }

        if (result.isEmpty()) {
            result.add(BitbucketCloudIntegrationConfig.anonymous());
        }
        return result;
    }

    public static Optional<BitbucketCloudIntegrationConfig> byHost(final List<BitbucketCloudIntegrationConfig> integrations,
                                                                    final String host) {
        return integrations.stream()
                .filter(integration -> integration.host().equals(host))
                .findFirst();
    }

    @SuppressWarnings("unchecked")
    private static BitbucketCloudIntegrationConfig readIntegration(final Object entry, final String path) {
        if (!(entry instanceof Map)) {
            throw new ConfigurationException("Invalid type in config for key '" + path + "', expected object");
        }
        final Map<String, Object> values = (Map<String, Object>) entry;
        final String username = ConfigValues.optionalString(values, "username", path + ".username");
        final String appPassword = ConfigValues.optionalString(values, "appPassword", path + ".appPassword");
        if ((username == null || username.isEmpty()) != (appPassword == null || appPassword.isEmpty())) {
            throw new ConfigurationException("Bitbucket Cloud integration at '" + path
                    + "' needs both username and appPassword, or neither");
        }
        return new BitbucketCloudIntegrationConfig(
                BitbucketCloudIntegrationConfig.HOST,
                BitbucketCloudIntegrationConfig.API_BASE_URL,
                username,
                appPassword
        );
    }
}
