package de.mirkosertic.catalog.bitbucket.bitbucket.model;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import org.jspecify.annotations.Nullable;

@JsonIgnoreProperties(ignoreUnknown = true)
public record Links(@Nullable Link html) {

    public static Links html(final String href) {
        return new Links(new Link(href));
    }
}
