package io.intellixity.pagesync.source;

import java.util.List;
import java.util.Objects;

public record DatabaseSchema(String id, String title, List<PropertyDef> properties) {
  public DatabaseSchema {
    Objects.requireNonNull(id, "id");
    properties = properties == null ? List.of() : List.copyOf(properties);
  }

  public List<PropertyDef> relations() {
    return properties.stream().filter(PropertyDef::isRelation).toList();
  }
}
