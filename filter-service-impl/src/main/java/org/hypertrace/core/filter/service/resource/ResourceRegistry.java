package org.hypertrace.core.filter.service.resource;

import com.google.common.base.Preconditions;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.function.Function;
import java.util.stream.Collectors;
import javax.inject.Inject;
import javax.inject.Singleton;
import org.hypertrace.core.filter.service.FilterServiceConfig;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/** Resource definitions by type name, loaded once from configuration. */
@Singleton
public class ResourceRegistry {
  private static final Logger LOG = LoggerFactory.getLogger(ResourceRegistry.class);

  private final Map<String, ResourceDefinition> definitions;

  @Inject
  ResourceRegistry(FilterServiceConfig config) {
    this.definitions =
        config.getResourceConfigs().stream()
            .map(ResourceDefinition::parse)
            .collect(
                Collectors.collectingAndThen(
                    Collectors.toMap(
                        ResourceDefinition::getType,
                        Function.identity(),
                        (first, second) -> {
                          throw new IllegalArgumentException(
                              "Duplicate resource definition: " + first.getType());
                        },
                        LinkedHashMap::new),
                    Collections::unmodifiableMap));
    LOG.info("Loaded resource definitions for types: {}", definitions.keySet());
  }

  public ResourceDefinition get(String type) {
    ResourceDefinition definition = definitions.get(type);
    Preconditions.checkArgument(definition != null, "No resource definition for type: %s", type);
    return definition;
  }
}
