package de.mirkosertic.catalog.bitbucket;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import de.mirkosertic.catalog.bitbucket.bitbucket.BitbucketCloudClient;
import de.mirkosertic.catalog.bitbucket.bitbucket.model.RepoPushEvent;
import de.mirkosertic.catalog.bitbucket.bitbucket.model.Repository;
import de.mirkosertic.catalog.bitbucket.catalog.CatalogApi;
import de.mirkosertic.catalog.bitbucket.catalog.DeferredEntity;
import de.mirkosertic.catalog.bitbucket.catalog.EntityFilter;
import de.mirkosertic.catalog.bitbucket.catalog.EntityMutation;
import de.mirkosertic.catalog.bitbucket.catalog.EntityProvider;
import de.mirkosertic.catalog.bitbucket.catalog.EntityProviderConnection;
import de.mirkosertic.catalog.bitbucket.catalog.EntityRefs;
import de.mirkosertic.catalog.bitbucket.catalog.LocationEntity;
import de.mirkosertic.catalog.bitbucket.catalog.TokenManager;
import de.mirkosertic.catalog.bitbucket.config.ProviderConfig;
import de.mirkosertic.catalog.bitbucket.discovery.CatalogFileScanner;
import de.mirkosertic.catalog.bitbucket.discovery.DiscoveryTarget;
import de.mirkosertic.catalog.bitbucket.discovery.EntityMaterializer;
import de.mirkosertic.catalog.bitbucket.discovery.RepositoryFilter;
import de.mirkosertic.catalog.bitbucket.events.EventParams;
import de.mirkosertic.catalog.bitbucket.events.EventSubscriber;
import de.mirkosertic.catalog.bitbucket.scheduler.TaskInvocationDefinition;
import de.mirkosertic.catalog.bitbucket.scheduler.TaskRunner;
import org.jspecify.annotations.Nullable;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.slf4j.MDC;

import java.io.IOException;
import java.util.ArrayList;
import java.util.List;
import java.util.UUID;
import java.util.concurrent.Callable;
import java.util.concurrent.atomic.AtomicBoolean;

/**
 * Discovers catalog files located in Bitbucket Cloud and registers them as {@code Location}
 * entities.
 * <p>
 * Two entry points keep the catalog in sync:
 * <ul>
 *   <li>{@link #refresh()} runs on a schedule, searches the whole workspace and replaces every
 *       location this provider owns with one full mutation.</li>
 *   <li>{@link #onEvent(EventParams)} handles {@code repo:push} webhooks. It searches only the
 *       pushed repository, diffs the result against the locations annotated with that
 *       repository's URL, and applies one delta mutation plus a refresh of every location
 *       that still exists.</li>
 * </ul>
 * Only locations whose location key equals {@link #getProviderName()} are ever removed.
 */
public class BitbucketCloudEntityProvider implements EntityProvider, EventSubscriber {

    private static final Logger logger = LoggerFactory.getLogger(BitbucketCloudEntityProvider.class);

    public static final String TOPIC_REPO_PUSH = "bitbucketCloud/repo:push";
    static final String METADATA_EVENT_KEY = "x-event-key";
    static final String EVENT_KEY_REPO_PUSH = "repo:push";

    private final ProviderConfig config;
    private final RepositoryFilter repositoryFilter;
    private final CatalogFileScanner scanner;
    private final TaskRunner taskRunner;
    private final @Nullable CatalogApi catalogApi;
    private final @Nullable TokenManager tokenManager;
    private final MutationGateway mutationGateway;
    private final ObjectMapper objectMapper = new ObjectMapper();

    private final AtomicBoolean eventConfigErrorThrown = new AtomicBoolean(false);
    private volatile @Nullable EntityProviderConnection connection;

    BitbucketCloudEntityProvider(final ProviderConfig config,
                                 final BitbucketCloudClient client,
                                 final TaskRunner taskRunner,
                                 final @Nullable CatalogApi catalogApi,
                                 final @Nullable TokenManager tokenManager) {
        this.config = config;
        this.repositoryFilter = new RepositoryFilter(config.filters());
        this.scanner = new CatalogFileScanner(client, repositoryFilter);
        this.taskRunner = taskRunner;
        this.catalogApi = catalogApi;
        this.tokenManager = tokenManager;
        this.mutationGateway = new MutationGateway(getProviderName());
    }

    @Override
    public String getProviderName() {
        return "bitbucketCloud-provider:" + config.id();
    }

    public String getTaskId() {
        return getProviderName() + ":refresh";
    }

    /**
     * Store the connection and hand the periodic refresh to the task runner.
     */
    @Override
    public void connect(final EntityProviderConnection connection) {
        this.connection = connection;
        taskRunner.run(new TaskInvocationDefinition(getTaskId(), this::runScheduledRefresh));
    }

    private void runScheduledRefresh() {
        MDC.put("target", getProviderName());
        MDC.put("taskId", getTaskId());
        MDC.put("taskInstanceId", UUID.randomUUID().toString());
        try {
            refresh();
        } catch (final Exception e) {
            // the next scheduled run starts from scratch
            logger.error("Refresh of {} failed", getProviderName(), e);
        } finally {
            MDC.remove("target");
            MDC.remove("taskId");
            MDC.remove("taskInstanceId");
        }
    }

    /**
     * Full refresh: discover all catalog files of the workspace and replace the owned set.
     *
     * @throws NotInitializedException if {@link #connect} was not called yet
     * @throws IOException             if the catalog rejects the mutation
     */
    public void refresh() throws IOException {
        final EntityProviderConnection current = connection;
        if (current == null) {
            throw new NotInitializedException();
        }

        logger.info("Discovering catalog files in Bitbucket Cloud repositories");

        final List<DiscoveryTarget> targets = findCatalogFiles(null);
        final List<DeferredEntity> entities = EntityMaterializer.toDeferredEntities(targets, getProviderName());

        current.applyMutation(new EntityMutation.Full(entities));

        logger.info("Committed {} Locations for catalog files in Bitbucket Cloud repositories", entities.size());
    }

    @Override
    public List<String> supportsEventTopics() {
        return List.of(TOPIC_REPO_PUSH);
    }

    @Override
    public void onEvent(final EventParams params) throws IOException, InterruptedException {
        if (!TOPIC_REPO_PUSH.equals(params.topic())) {
            return;
        }

        if (EVENT_KEY_REPO_PUSH.equals(params.metadataValue(METADATA_EVENT_KEY))) {
            onRepoPush(toRepoPushEvent(params.eventPayload()));
        }
    }

    /**
     * Delta refresh of the pushed repository.
     * <p>
     * The webhook only carries high level commit metadata. Finding out whether catalog files
     * changed would cost additional API calls per commit, so every push triggers a scoped
     * search and a refresh of the repository's locations instead.
     *
     * @throws EventHandlingMisconfiguredException on the first event if catalog api or token manager are missing
     * @throws NotInitializedException             if {@link #connect} was not called yet
     * @throws MutationFailedException             if at least one catalog call failed
     */
    public void onRepoPush(final RepoPushEvent event) throws IOException, InterruptedException {
        if (!canHandleEvents()) {
            return;
        }

        final EntityProviderConnection current = connection;
        if (current == null) {
            throw new NotInitializedException();
        }

        final Repository repository = event.repository();
        if (repository == null || !config.workspace().equals(repository.workspaceSlug())) {
            return;
        }

        if (!repositoryFilter.matches(repository)) {
            return;
        }

        final String repoSlug = repository.slug();
        if (repoSlug == null) {
            logger.warn("Ignoring repo:push event without repository slug");
            return;
        }
        final String repoUrl = repository.webUrl();
        logger.info("handle repo:push event for {}", repoUrl);

        final List<DiscoveryTarget> targets = findCatalogFiles(repoSlug);

        final String token = tokenManager.getToken().token();
        final List<LocationEntity> existing = findExistingLocations(repoUrl, token);

        final LocationDiff diff = LocationReconciler.diff(targets, existing, getProviderName());

        final List<Callable<Void>> calls = new ArrayList<>();
        for (final LocationEntity entity : diff.stillPresent()) {
            final String entityRef = EntityRefs.stringify(entity);
            calls.add(() -> {
                catalogApi.refreshEntity(entityRef, token);
                return null;
            });
        }
        if (diff.hasMembershipChanges()) {
            final EntityMutation.Delta mutation = new EntityMutation.Delta(diff.added(), diff.removed());
            calls.add(() -> {
                current.applyMutation(mutation);
                return null;
            });
        }

        logger.info("repo:push for {}: added={}, removed={}, refreshed={}",
                repoUrl, diff.added().size(), diff.removed().size(), diff.stillPresent().size());

        mutationGateway.invokeAll(calls);
    }

    /**
     * Throws only once per instance, later events are dropped silently.
     */
    private boolean canHandleEvents() {
        if (catalogApi != null && tokenManager != null) {
            return true;
        }

        if (eventConfigErrorThrown.compareAndSet(false, true)) {
            throw new EventHandlingMisconfiguredException(getProviderName());
        }

        return false;
    }

    private List<LocationEntity> findExistingLocations(final String repoUrl, final String token) throws IOException {
        final EntityFilter filter = EntityFilter.builder()
                .kind(LocationEntity.KIND)
                .annotation(EntityMaterializer.ANNOTATION_REPO_URL, repoUrl)
                .build();

        return catalogApi.getEntities(filter, token);
    }

    private List<DiscoveryTarget> findCatalogFiles(final @Nullable String repoSlug) {
        return scanner.scan(config.workspace(), config.catalogPath(), repoSlug)
                .distinct()
                .toList();
    }

    private RepoPushEvent toRepoPushEvent(final Object payload) {
        if (payload instanceof RepoPushEvent event) {
            return event;
        }
        try {
            if (payload instanceof String json) {
                return objectMapper.readValue(json, RepoPushEvent.class);
            }
            return objectMapper.convertValue(payload, RepoPushEvent.class);
        } catch (final JsonProcessingException | IllegalArgumentException e) {
            throw new CatalogProviderException("Invalid repo:push payload for " + getProviderName(), e);
        }
    }

    /**
     * Release the worker threads. The provider must not be used afterwards.
     */
    public void shutdown() {
        mutationGateway.shutdown();
    }
}
