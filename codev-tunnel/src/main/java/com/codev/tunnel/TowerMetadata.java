package com.codev.tunnel;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;

import java.util.List;

/**
 * Snapshot of the projects and terminals this tower serves, answered to the relay
 * on the metadata poll path.
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public record TowerMetadata(List<Project> projects, List<Terminal> terminals) {

    public static final TowerMetadata EMPTY = new TowerMetadata(List.of(), List.of());

    public TowerMetadata {
        projects = projects == null ? List.of() : List.copyOf(projects);
        terminals = terminals == null ? List.of() : List.copyOf(terminals);
    }

    @JsonIgnoreProperties(ignoreUnknown = true)
    public record Project(String path, String name) {
    }

    @JsonIgnoreProperties(ignoreUnknown = true)
    public record Terminal(String id, String projectPath) {
    }
}
