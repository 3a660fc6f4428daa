package de.mirkosertic.catalog.bitbucket.discovery;

import de.mirkosertic.catalog.bitbucket.catalog.DeferredEntity;
import de.mirkosertic.catalog.bitbucket.catalog.LocationEntities;
import de.mirkosertic.catalog.bitbucket.catalog.LocationEntity;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;

@DisplayName("EntityMaterializer Tests")
class EntityMaterializerTest {

    private static final String FILE_URL = "https://bitbucket.org/ws/orders/src/main/catalog-info.yaml";
    private static final String REPO_URL = "https://bitbucket.org/ws/orders";

    @Test
    @DisplayName("Should create a required url Location with provenance annotations")
    void shouldCreateLocationEntity() {
        final LocationEntity entity = EntityMaterializer.toLocationEntity(new DiscoveryTarget(FILE_URL, REPO_URL));

        assertThat(entity.kind()).isEqualTo("Location");
        assertThat(entity.apiVersion()).isEqualTo("backstage.io/v1alpha1");
        assertThat(entity.spec().type()).isEqualTo("url");
        assertThat(entity.spec().target()).isEqualTo(FILE_URL);
        assertThat(entity.spec().presence()).isEqualTo("required");
        assertThat(entity.metadata().annotation(EntityMaterializer.ANNOTATION_REPO_URL)).isEqualTo(REPO_URL);
        assertThat(entity.metadata().annotation(LocationEntities.ANNOTATION_MANAGED_BY_LOCATION))
                .isEqualTo("url:" + FILE_URL);
        assertThat(entity.metadata().annotation(LocationEntities.ANNOTATION_MANAGED_BY_ORIGIN_LOCATION))
                .isEqualTo("url:" + FILE_URL);
    }

    @Test
    @DisplayName("Should tag every entity with the provider name and keep order")
    void shouldSetLocationKey() {
        final List<DeferredEntity> entities = EntityMaterializer.toDeferredEntities(List.of(
                new DiscoveryTarget(FILE_URL, REPO_URL),
                new DiscoveryTarget("https://bitbucket.org/ws/billing/src/master/catalog-info.yaml",
                        "https://bitbucket.org/ws/billing")
        ), "bitbucketCloud-provider:default");

        assertThat(entities).extracting(DeferredEntity::locationKey)
                .containsOnly("bitbucketCloud-provider:default");
        assertThat(entities).extracting(e -> e.entity().spec().target())
                .containsExactly(FILE_URL, "https://bitbucket.org/ws/billing/src/master/catalog-info.yaml");
    }

    @Test
    @DisplayName("Should derive the same entity for the same target")
    void shouldBeDeterministic() {
        final DiscoveryTarget target = new DiscoveryTarget(FILE_URL, REPO_URL);

        assertThat(EntityMaterializer.toLocationEntity(target)).isEqualTo(EntityMaterializer.toLocationEntity(target));
    }
}
