package de.mirkosertic.catalog.bitbucket.catalog;

import java.util.List;

/**
 * A change to the set of entities owned by one provider.
 */
public interface EntityMutation {

    /**
     * Replaces everything the provider owns with {@code entities}.
     */
    record Full(List<DeferredEntity> entities) implements EntityMutation {
        public Full {
            entities = List.copyOf(entities);
        }
    }

    /**
     * Adds and removes entities relative to what the provider currently owns.
     */
    record Delta(List<DeferredEntity> added, List<DeferredEntity> removed) implements EntityMutation {
        public Delta {
            added = List.copyOf(added);
            removed = List.copyOf(removed);
        }
    }
}
