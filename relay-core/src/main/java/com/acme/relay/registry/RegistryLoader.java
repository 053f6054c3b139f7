package com.acme.relay.registry;

import com.acme.relay.core.Jsons;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.JsonNode;
import java.io.IOException;
import java.io.InputStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.HashSet;
import java.util.List;
import java.util.Set;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Reads the project registry from its JSON source: an array of projects, or an object whose
 * {@code projects} field holds that array. Anything else fails the load. Each project has the fields {@code repo}, {@code dir}, {@code upCommands}, {@code downCommands}
 * and the optional {@code restartCommands} and {@code targetQueue}.
 */
public class RegistryLoader {
  private static final Logger LOG = LoggerFactory.getLogger(RegistryLoader.class);
  private static final String PROJECTS_FIELD = "projects";
  private static final TypeReference<List<ProjectDescriptor>> PROJECT_LIST = new TypeReference<>() {};

  public ProjectRegistry load(Path path) {
    try (InputStream in = Files.newInputStream(path)) {
      return load(in, path.toString());
    } catch (IOException e) {
      throw new RegistryLoadException("failed to read config file: " + path, e);
    }
  }

  public ProjectRegistry load(InputStream in, String source) {
    List<ProjectDescriptor> descriptors;
    try {
      JsonNode root = Jsons.mapper().readTree(in);
      if (root == null || root.isMissingNode() || root.isNull()) {
        throw new RegistryLoadException("failed to parse config file: " + source + " is empty");
      }
      JsonNode projects = root.isArray() ? root : root.path(PROJECTS_FIELD);
      if (!projects.isArray()) {
        throw new RegistryLoadException(
            "failed to parse config file: expected an array of projects or a '"
                + PROJECTS_FIELD
                + "' array in "
                + source);
      }
      descriptors = Jsons.mapper().convertValue(projects, PROJECT_LIST);
    } catch (IOException | IllegalArgumentException e) {
      throw new RegistryLoadException("failed to parse config file: " + source, e);
    }

    Set<String> seen = new HashSet<>();
    for (ProjectDescriptor descriptor : descriptors) {
      if (descriptor == null || descriptor.repo() == null || descriptor.repo().isEmpty()) {
        throw new RegistryLoadException("failed to parse config file: project without 'repo' in " + source);
      }
      if (!seen.add(descriptor.repo())) {
        LOG.warn("Duplicate configuration for {} in {}; the last entry wins", descriptor.repo(), source);
      }
    }

    ProjectRegistry registry = ProjectRegistry.of(descriptors);
    LOG.info("Loaded {} project configurations", registry.size());
    return registry;
  }
}
