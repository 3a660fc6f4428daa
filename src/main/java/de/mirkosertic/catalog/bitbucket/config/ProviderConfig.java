package de.mirkosertic.catalog.bitbucket.config;

import de.mirkosertic.catalog.bitbucket.scheduler.TaskScheduleDefinition;
import org.jspecify.annotations.Nullable;

/**
 * Configuration of one provider instance. Each instance discovers one workspace
 * and owns its own set of catalog locations.
 */
public record ProviderConfig(
        String id,
        String workspace,
        String catalogPath,
        @Nullable ProviderFilters filters,
        @Nullable TaskScheduleDefinition schedule
) {
    public static final String DEFAULT_CATALOG_PATH = "/catalog-info.yaml";
}
