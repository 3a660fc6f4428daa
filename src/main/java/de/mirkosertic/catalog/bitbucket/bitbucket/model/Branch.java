package de.mirkosertic.catalog.bitbucket.bitbucket.model;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import org.jspecify.annotations.Nullable;

@JsonIgnoreProperties(ignoreUnknown = true)
public record Branch(@Nullable String name) {
}
