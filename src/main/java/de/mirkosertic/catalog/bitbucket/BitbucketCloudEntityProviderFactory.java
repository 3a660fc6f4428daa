package de.mirkosertic.catalog.bitbucket;

import de.mirkosertic.catalog.bitbucket.bitbucket.BitbucketCloudClient;
import de.mirkosertic.catalog.bitbucket.bitbucket.HttpBitbucketCloudClient;
import de.mirkosertic.catalog.bitbucket.catalog.CatalogApi;
import de.mirkosertic.catalog.bitbucket.catalog.TokenManager;
import de.mirkosertic.catalog.bitbucket.config.ApplicationConfig;
import de.mirkosertic.catalog.bitbucket.config.BitbucketCloudIntegrationConfig;
import de.mirkosertic.catalog.bitbucket.config.ConfigurationException;
import de.mirkosertic.catalog.bitbucket.config.IntegrationConfigReader;
import de.mirkosertic.catalog.bitbucket.config.ProviderConfig;
import de.mirkosertic.catalog.bitbucket.scheduler.TaskRunner;
import de.mirkosertic.catalog.bitbucket.scheduler.TaskScheduler;
import org.jspecify.annotations.Nullable;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.List;
import java.util.function.Function;

/**
 * Creates one {@link BitbucketCloudEntityProvider} per configured provider.
 */
public final class BitbucketCloudEntityProviderFactory {

    private static final Logger logger = LoggerFactory.getLogger(BitbucketCloudEntityProviderFactory.class);

    private BitbucketCloudEntityProviderFactory() {
    }

    /**
     * @throws ConfigurationException if there is no Bitbucket Cloud integration, if neither a task runner
     *                                nor a scheduler is given, or if a provider has no schedule
     */
    public static List<BitbucketCloudEntityProvider> fromConfig(final ApplicationConfig config, final Options options) {
        final BitbucketCloudIntegrationConfig integration = IntegrationConfigReader
                .byHost(config.getIntegrations(), BitbucketCloudIntegrationConfig.HOST)
                .orElseThrow(() -> new ConfigurationException(
                        "No integration for " + BitbucketCloudIntegrationConfig.HOST + " available"));

        if (options.schedule == null && options.scheduler == null) {
            throw new ConfigurationException("Either schedule or scheduler must be provided.");
        }

        final List<BitbucketCloudEntityProvider> providers = new ArrayList<>();
        for (final ProviderConfig providerConfig : config.getProviderConfigs()) {
            if (options.schedule == null && providerConfig.schedule() == null) {
                throw new ConfigurationException("No schedule provided neither via code nor config for bitbucketCloud-provider:"
                        + providerConfig.id() + ".");
            }

            final TaskRunner taskRunner = options.schedule != null
                    ? options.schedule
                    : options.scheduler.createScheduledTaskRunner(providerConfig.schedule());

            providers.add(new BitbucketCloudEntityProvider(
                    providerConfig,
                    options.clientFactory.apply(integration),
                    taskRunner,
                    options.catalogApi,
                    options.tokenManager
            ));
        }

        logger.info("Created {} Bitbucket Cloud entity providers", providers.size());
        return providers;
    }

    public static Options.Builder options() {
        return new Options.Builder();
    }

    /**
     * Collaborators of the providers. Catalog api and token manager are only needed for push events.
     */
    public static final class Options {

        private final @Nullable CatalogApi catalogApi;
        private final @Nullable TokenManager tokenManager;
        private final @Nullable TaskRunner schedule;
        private final @Nullable TaskScheduler scheduler;
        private final Function<BitbucketCloudIntegrationConfig, BitbucketCloudClient> clientFactory;

        private Options(final Builder builder) {
            this.catalogApi = builder.catalogApi;
            this.tokenManager = builder.tokenManager;
            this.schedule = builder.schedule;
            this.scheduler = builder.scheduler;
            this.clientFactory = builder.clientFactory;
        }

        public static final class Builder {

            private @Nullable CatalogApi catalogApi;
            private @Nullable TokenManager tokenManager;
            private @Nullable TaskRunner schedule;
            private @Nullable TaskScheduler scheduler;
            private Function<BitbucketCloudIntegrationConfig, BitbucketCloudClient> clientFactory = HttpBitbucketCloudClient::new;

            private Builder() {
            }

            public Builder catalogApi(final CatalogApi catalogApi) {
                this.catalogApi = catalogApi;
                return this;
            }

            public Builder tokenManager(final TokenManager tokenManager) {
                this.tokenManager = tokenManager;
                return this;
            }

            /**
             * Task runner shared by all providers; takes precedence over per-provider schedules.
             */
            public Builder schedule(final TaskRunner schedule) {
                this.schedule = schedule;
                return this;
            }

            public Builder scheduler(final TaskScheduler scheduler) {
                this.scheduler = scheduler;
                return this;
            }

            public Builder clientFactory(final Function<BitbucketCloudIntegrationConfig, BitbucketCloudClient> clientFactory) {
                this.clientFactory = clientFactory;
                return this;
            }

            public Options build() {
                return new Options(this);
            }
        }
    }
}
