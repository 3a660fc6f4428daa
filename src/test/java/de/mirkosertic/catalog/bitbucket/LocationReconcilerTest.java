package de.mirkosertic.catalog.bitbucket;

import de.mirkosertic.catalog.bitbucket.catalog.DeferredEntity;
import de.mirkosertic.catalog.bitbucket.catalog.LocationEntities;
import de.mirkosertic.catalog.bitbucket.catalog.LocationEntity;
import de.mirkosertic.catalog.bitbucket.catalog.LocationSpec;
import de.mirkosertic.catalog.bitbucket.discovery.DiscoveryTarget;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;

@DisplayName("LocationReconciler Tests")
class LocationReconcilerTest {

    private static final String PROVIDER = "bitbucketCloud-provider:default";
    private static final String REPO_URL = "https://bitbucket.org/ws/orders";

    private static DiscoveryTarget target(final String file) {
        return new DiscoveryTarget(REPO_URL + "/src/main/" + file, REPO_URL);
    }

    private static LocationEntity existing(final String file) {
        return LocationEntities.fromLocationSpec(LocationSpec.requiredUrl(REPO_URL + "/src/main/" + file));
    }

    @Test
    @DisplayName("Should partition into added, removed and still present")
    void shouldComputeThreeWayDiff() {
        final LocationDiff diff = LocationReconciler.diff(
                List.of(target("a.yaml"), target("b.yaml")),
                List.of(existing("b.yaml"), existing("c.yaml")),
                PROVIDER);

        assertThat(diff.added()).extracting(e -> e.entity().spec().target())
                .containsExactly(REPO_URL + "/src/main/a.yaml");
        assertThat(diff.removed()).extracting(e -> e.entity().spec().target())
                .containsExactly(REPO_URL + "/src/main/c.yaml");
        assertThat(diff.stillPresent()).extracting(e -> e.spec().target())
                .containsExactly(REPO_URL + "/src/main/b.yaml");
        assertThat(diff.hasMembershipChanges()).isTrue();
    }

    @Test
    @DisplayName("Should tag added and removed entities with the provider name")
    void shouldUseProviderAsLocationKey() {
        final LocationDiff diff = LocationReconciler.diff(
                List.of(target("a.yaml")), List.of(existing("c.yaml")), PROVIDER);

        assertThat(diff.added()).extracting(DeferredEntity::locationKey).containsOnly(PROVIDER);
        assertThat(diff.removed()).extracting(DeferredEntity::locationKey).containsOnly(PROVIDER);
    }

    @Test
    @DisplayName("Should report no membership change when sets are equal")
    void shouldDetectUnchangedSets() {
        final LocationDiff diff = LocationReconciler.diff(
                List.of(target("a.yaml")), List.of(existing("a.yaml")), PROVIDER);

        assertThat(diff.added()).isEmpty();
        assertThat(diff.removed()).isEmpty();
        assertThat(diff.stillPresent()).hasSize(1);
        assertThat(diff.hasMembershipChanges()).isFalse();
    }

    @Test
    @DisplayName("Should add a file discovered twice only once")
    void shouldDeduplicateDiscoveries() {
        final LocationDiff diff = LocationReconciler.diff(
                List.of(target("a.yaml"), target("a.yaml")), List.of(), PROVIDER);

        assertThat(diff.added()).hasSize(1);
    }

    @Test
    @DisplayName("Should remove everything when nothing is discovered")
    void shouldRemoveAllWhenNothingFound() {
        final LocationDiff diff = LocationReconciler.diff(
                List.of(), List.of(existing("a.yaml"), existing("b.yaml")), PROVIDER);

        assertThat(diff.removed()).hasSize(2);
        assertThat(diff.stillPresent()).isEmpty();
    }

    @Test
    @DisplayName("Should compare targets case sensitively")
    void shouldCompareExactly() {
        final LocationDiff diff = LocationReconciler.diff(
                List.of(target("A.yaml")), List.of(existing("a.yaml")), PROVIDER);

        assertThat(diff.added()).hasSize(1);
        assertThat(diff.removed()).hasSize(1);
    }
}
