package de.mirkosertic.catalog.bitbucket.discovery;

import de.mirkosertic.catalog.bitbucket.bitbucket.model.Repository;

/**
 * Builds the browser URL of a file on the repository's default branch.
 */
public final class FileUrlResolver {

    static final String DEFAULT_BRANCH = "master";

    private FileUrlResolver() {
    }

    /**
     * {@code <repository web url>/src/<default branch>/<filePath>}. The file path is used as
     * returned by the API, without any further encoding.
     */
    public static String resolve(final Repository repository, final String filePath) {
        final String branch = repository.defaultBranch() != null ? repository.defaultBranch() : DEFAULT_BRANCH;
        return repository.webUrl() + "/src/" + branch + "/" + filePath;
    }
}
