package com.flamingo.ai.xmlrag.service.xml.model;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Normalised summary extracted from a document by its winning handler.
 *
 * @param documentType display name of the detected document family, e.g. {@code Maven POM}
 * @param fields named scalar or nested values, in insertion order
 * @param hints structural hints for the chunker; {@link StructuralHints#none()} when absent
 */
public record SummaryRecord(
    String documentType, Map<String, Object> fields, StructuralHints hints) {

  public SummaryRecord {
    fields =
        fields == null
            ? Map.of()
            : Collections.unmodifiableMap(new LinkedHashMap<>(fields));
    hints = hints == null ? StructuralHints.none() : hints;
  }

  public static SummaryRecord empty(String documentType) {
    return new SummaryRecord(documentType, Map.of(), StructuralHints.none());
  }

  public static Builder builder(String documentType) {
    return new Builder(documentType);
  }

  public Object field(String name) {
    return fields.get(name);
  }

  /**
   * Accumulates fields and hints during extraction.
   *
   * <p>The builder can be snapshotted with {@link #build()} at any point, which is how a partial
   * record survives an extraction failure.
   */
  public static final class Builder {

    private String documentType;
    private final Map<String, Object> fields = new LinkedHashMap<>();
    private final List<BoundaryHint> boundaries = new ArrayList<>();
    private final List<ReferenceHint> references = new ArrayList<>();

    private Builder(String documentType) {
      this.documentType = documentType;
    }

    public Builder documentType(String documentType) {
      this.documentType = documentType;
      return this;
    }

    /** Adds a field; {@code null} values are skipped. */
    public Builder field(String name, Object value) {
      if (value != null) {
        fields.put(name, value);
      }
      return this;
    }

    public Builder fields(Map<String, ?> values) {
      values.forEach(this::field);
      return this;
    }

    public Builder boundary(String path, String kind) {
      return boundary(path, kind, null);
    }

    public Builder boundary(String path, String kind, String identifierPath) {
      boundaries.add(new BoundaryHint(path, kind, identifierPath));
      return this;
    }

    public Builder reference(String path, String valuePath, String relation) {
      return reference(path, valuePath, relation, false);
    }

    public Builder reference(
        String path, String valuePath, String relation, boolean groupWithTarget) {
      references.add(new ReferenceHint(path, valuePath, relation, groupWithTarget));
      return this;
    }

    public SummaryRecord build() {
      return new SummaryRecord(
          documentType, fields, new StructuralHints(boundaries, references));
    }
  }
}
