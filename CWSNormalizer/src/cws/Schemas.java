package cws;

import java.util.Optional;

import com.google.common.collect.ImmutableMap;

/** The document schemas known by name. */
public final class Schemas {

  private static final DocumentSchema TECHNOLOGIES = buildTechnologies();

  private static final ImmutableMap<String, DocumentSchema> BY_NAME =
      ImmutableMap.of(
          TECHNOLOGIES.name(), TECHNOLOGIES,
          DocumentSchema.permissive().name(), DocumentSchema.permissive());

  // technologies = { <tech> = { path = { ... } research_cost = 1 ... } ... }
  private static DocumentSchema buildTechnologies() {
    KeyRule technology =
        KeyRule.builder(KeyRule.WILDCARD, KeyRule.Kind.BLOCK)
            .addChild(KeyRule.builder("path", KeyRule.Kind.BLOCK).setRepeatable(true).build())
            .addChild(KeyRule.builder("folder", KeyRule.Kind.BLOCK).setRepeatable(true).build())
            .addChild(KeyRule.of("categories", KeyRule.Kind.LIST))
            .addChild(KeyRule.of("ai_will_do", KeyRule.Kind.BLOCK))
            .addChild(KeyRule.of("research_cost", KeyRule.Kind.SCALAR))
            .addChild(KeyRule.of("start_year", KeyRule.Kind.SCALAR))
            .build();

    return DocumentSchema.create(
        "technologies",
        Optional.of("technologies"),
        KeyRule.builder("technologies", KeyRule.Kind.BLOCK).addChild(technology).build());
  }

  public static DocumentSchema technologies() {
    return TECHNOLOGIES;
  }

  public static Optional<DocumentSchema> byName(String name) {
    return Optional.ofNullable(BY_NAME.get(name));
  }

  public static ImmutableMap<String, DocumentSchema> all() {
    return BY_NAME;
  }

  private Schemas() {}
}
