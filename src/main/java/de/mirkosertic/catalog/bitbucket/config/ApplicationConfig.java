package de.mirkosertic.catalog.bitbucket.config;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.yaml.snakeyaml.Yaml;

import java.io.IOException;
import java.io.InputStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Central configuration of the catalog discovery.
 * Loads YAML documents and merges them into one tree.
 * <p>
 * Configuration priority (highest to lowest):
 * 1. File named by the BITBUCKET_CATALOG_CONFIG environment variable or the
 *    bitbucket.catalog.config system property
 * 2. User config file (~/.bitbucket-catalog/config.yaml)
 * 3. Application defaults (application.yaml in classpath)
 * <p>
 * String values may reference ${VAR:default}, resolved from environment variables
 * first and system properties second.
 */
public class ApplicationConfig {

    private static final Logger logger = LoggerFactory.getLogger(ApplicationConfig.class);

    private static final String ENV_CONFIG_FILE = "BITBUCKET_CATALOG_CONFIG";
    private static final String PROP_CONFIG_FILE = "bitbucket.catalog.config";
    private static final String CONFIG_DIR = ".bitbucket-catalog";
    private static final String USER_CONFIG_FILE = "config.yaml";
    private static final String DEFAULT_CONFIG_FILE = "application.yaml";

    private final Map<String, Object> root;

    private ApplicationConfig(final Map<String, Object> root) {
        this.root = root;
    }

    /**
     * Load configuration from all sources with proper priority.
     */
    public static ApplicationConfig load() {
        final Map<String, Object> merged = new LinkedHashMap<>();

        // Step 1: Load application defaults from classpath
        try (final InputStream is = ApplicationConfig.class.getClassLoader().getResourceAsStream(DEFAULT_CONFIG_FILE)) {
            if (is != null) {
                mergeInto(merged, parse(is));
                logger.debug("Loaded defaults from classpath: {}", DEFAULT_CONFIG_FILE);
            }
        } catch (final IOException e) {
            logger.warn("Failed to load default config from classpath", e);
        }

        // Step 2: Load user config file
        loadFile(merged, getUserConfigPath());

        // Step 3: Explicitly named config file
        String explicitFile = System.getenv(ENV_CONFIG_FILE);
        if (explicitFile == null || explicitFile.trim().isEmpty()) {
            explicitFile = System.getProperty(PROP_CONFIG_FILE);
        }
        if (explicitFile != null && !explicitFile.trim().isEmpty()) {
            final Path path = Paths.get(explicitFile.trim());
            if (!Files.exists(path)) {
                throw new ConfigurationException("Config file " + path + " does not exist");
            }
            loadFile(merged, path);
        }

        final ApplicationConfig config = new ApplicationConfig(resolveAll(merged));
        logger.info("Configuration loaded: providers={}", config.getProviderConfigs().size());
        return config;
    }

    /**
     * Build a configuration from a single YAML document.
     */
    public static ApplicationConfig fromYaml(final String yamlDocument) {
        final Object document = new Yaml().load(yamlDocument);
        return fromMap(asMap(document, "<document>"));
    }

    public static ApplicationConfig fromMap(final Map<String, Object> root) {
        final Map<String, Object> copy = new LinkedHashMap<>();
        mergeInto(copy, root);
        return new ApplicationConfig(resolveAll(copy));
    }

    private static void loadFile(final Map<String, Object> merged, final Path path) {
        if (!Files.exists(path)) {
            return;
        }
        try (final InputStream is = Files.newInputStream(path)) {
            mergeInto(merged, parse(is));
            logger.debug("Loaded config from: {}", path);
        } catch (final IOException e) {
            throw new ConfigurationException("Failed to read config file " + path, e);
        }
    }

    private static Map<String, Object> parse(final InputStream is) {
        final Object document = new Yaml().load(is);
        if (document == null) {
            return Map.of();
        }
        return asMap(document, "<document>");
    }

    @SuppressWarnings("unchecked")
    private static Map<String, Object> asMap(final Object value, final String path) {
        if (value == null) {
            return Map.of();
        }
        if (!(value instanceof Map)) {
            throw new ConfigurationException("Invalid type in config for key '" + path + "', expected object");
        }
        return (Map<String, Object>) value;
    }

    /**
     * Deep merge: nested maps are merged key by key, everything else is replaced.
     */
    @SuppressWarnings("unchecked")
    static void mergeInto(final Map<String, Object> target, final Map<String, Object> source) {
        for (final Map.Entry<String, Object> entry : source.entrySet()) {
            final Object existing = target.get(entry.getKey());
            final Object incoming = entry.getValue();
            if (existing instanceof Map && incoming instanceof Map) {
                final Map<String, Object> mergedChild = new LinkedHashMap<>((Map<String, Object>) existing);
                mergeInto(mergedChild, (Map<String, Object>) incoming);
                target.put(entry.getKey(), mergedChild);
            } else if (incoming instanceof Map) {
                final Map<String, Object> copy = new LinkedHashMap<>();
                mergeInto(copy, (Map<String, Object>) incoming);
                target.put(entry.getKey(), copy);
            } else {
                target.put(entry.getKey(), incoming);
            }
        }
    }

    private static Map<String, Object> resolveAll(final Map<String, Object> map) {
        final Map<String, Object> result = new LinkedHashMap<>();
        for (final Map.Entry<String, Object> entry : map.entrySet()) {
            result.put(entry.getKey(), resolveValue(entry.getValue()));
        }
        return result;
    }

    @SuppressWarnings("unchecked")
    private static Object resolveValue(final Object value) {
        if (value instanceof Map) {
            return resolveAll((Map<String, Object>) value);
        }
        if (value instanceof List<?> list) {
            final List<Object> resolved = new ArrayList<>(list.size());
            for (final Object element : list) {
                resolved.add(resolveValue(element));
            }
            return resolved;
        }
        if (value instanceof String string) {
            return resolveVariables(string);
        }
        return value;
    }

    /**
     * Resolve variables in strings like ${VAR:default}
     */
    static String resolveVariables(final String value) {
        if (value == null || !value.contains("${")) {
            return value;
        }

        String result = value;
        int start;
        while ((start = result.indexOf("${")) >= 0) {
            final int end = result.indexOf("}", start);
            if (end < 0) {
                break;
            }

            final String varExpr = result.substring(start + 2, end);
            final String[] parts = varExpr.split(":", 2);
            final String varName = parts[0];
            final String defaultValue = parts.length > 1 ? parts[1] : "";

            // Check environment first, then system properties
            String replacement = System.getenv(varName);
            if (replacement == null || replacement.isEmpty()) {
                replacement = System.getProperty(varName, defaultValue);
            }

            // Handle nested ${user.home} type variables
            if (replacement.contains("${")) {
                replacement = resolveVariables(replacement);
            }

            result = result.substring(0, start) + replacement + result.substring(end + 1);
        }

        return result;
    }

    public static Path getUserConfigPath() {
        return Paths.get(System.getProperty("user.home"), CONFIG_DIR, USER_CONFIG_FILE);
    }

    public Map<String, Object> getRoot() {
        return root;
    }

    public List<ProviderConfig> getProviderConfigs() {
        return ProviderConfigReader.readProviderConfigs(root);
    }

    public List<BitbucketCloudIntegrationConfig> getIntegrations() {
        return IntegrationConfigReader.readIntegrations(root);
    }
}
