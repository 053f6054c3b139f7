package com.acme.relay.registry;

import java.util.Collection;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Immutable lookup table from repository identifier to {@link ProjectDescriptor}. Built once at
 * startup; there are no writers afterwards, so lookups need no synchronization.
 */
public final class ProjectRegistry {

  private final Map<String, ProjectDescriptor> projects;

  private ProjectRegistry(Map<String, ProjectDescriptor> projects) {
    this.projects = Collections.unmodifiableMap(projects);
  }

  /** Builds a registry from {@code descriptors}; a repeated identifier keeps the last entry. */
  public static ProjectRegistry of(List<ProjectDescriptor> descriptors) {
    Map<String, ProjectDescriptor> byRepo = new LinkedHashMap<>();
    for (ProjectDescriptor descriptor : descriptors) {
      byRepo.put(descriptor.repo(), descriptor);
    }
    return new ProjectRegistry(byRepo);
  }

  public static ProjectRegistry of(ProjectDescriptor... descriptors) {
    return of(List.of(descriptors));
  }

  public Optional<ProjectDescriptor> lookup(String repositoryId) {
    return Optional.ofNullable(projects.get(repositoryId));
  }

  public Collection<ProjectDescriptor> descriptors() {
    return projects.values();
  }

  public int size() {
    return projects.size();
  }
}
