/*
 * Copyright OpenSearch Contributors
 * SPDX-License-Identifier: Apache-2.0
 */

package org.fusionsql.data.schema;

import com.google.common.collect.ImmutableList;
import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Optional;
import java.util.Set;
import java.util.stream.Collectors;
import lombok.EqualsAndHashCode;
import org.fusionsql.exception.SchemaException;

/** Immutable ordered list of fields. */
@EqualsAndHashCode
public class Schema {

  private final List<Field> fields;

  public Schema(List<Field> fields) {
    this.fields = ImmutableList.copyOf(fields);
  }

  public static Schema of(Field... fields) {
    return new Schema(ImmutableList.copyOf(fields));
  }

  public static Schema empty() {
    return new Schema(ImmutableList.of());
  }

  public List<Field> getFields() {
    return fields;
  }

  public Field getField(int index) {
    return fields.get(index);
  }

  public int size() {
    return fields.size();
  }

  public List<String> getFieldNames() {
    return fields.stream().map(Field::getName).collect(Collectors.toList());
  }

  /**
   * Resolves a column name to its position. A bare name matches any field with that name and
   * fails when more than one field matches; {@code q.name} matches the field with that qualifier.
   *
   * @throws SchemaException if the name is absent or ambiguous
   */
  public int indexOf(String name) {
    return findIndex(name)
        .orElseThrow(
            () ->
                new SchemaException(
                    String.format("Column '%s' not found in schema %s", name, this)));
  }

  /** Same as {@link #indexOf(String)} but returns empty for an absent name. */
  public Optional<Integer> findIndex(String name) {
    List<Integer> matches = new ArrayList<>();
    for (int i = 0; i < fields.size(); i++) {
      if (fields.get(i).getName().equals(name)) {
        matches.add(i);
      }
    }
    if (matches.isEmpty()) {
      int dot = name.indexOf('.');
      if (dot > 0) {
        String qualifier = name.substring(0, dot);
        String bare = name.substring(dot + 1);
        for (int i = 0; i < fields.size(); i++) {
          Field field = fields.get(i);
          if (qualifier.equals(field.getQualifier()) && field.getName().equals(bare)) {
            matches.add(i);
          }
        }
      }
    }
    if (matches.size() > 1) {
      throw new SchemaException(
          String.format("Column reference '%s' is ambiguous in schema %s", name, this));
    }
    return matches.isEmpty() ? Optional.empty() : Optional.of(matches.get(0));
  }

  public Field getField(String name) {
    return fields.get(indexOf(name));
  }

  /**
   * Returns a schema with only the named fields, in the requested order.
   *
   * @throws SchemaException if a name is absent
   */
  public Schema project(List<String> names) {
    ImmutableList.Builder<Field> builder = ImmutableList.builder();
    for (String name : names) {
      builder.add(getField(name));
    }
    return new Schema(builder.build());
  }

  /** Returns the fields at the given positions. */
  public Schema select(List<Integer> indices) {
    ImmutableList.Builder<Field> builder = ImmutableList.builder();
    for (int index : indices) {
      builder.add(fields.get(index));
    }
    return new Schema(builder.build());
  }

  /**
   * Concatenates two schemas.
   *
   * @throws SchemaException if a qualified name appears on both sides
   */
  public Schema merge(Schema other) {
    Set<String> names = new HashSet<>();
    for (Field field : fields) {
      names.add(field.getQualifiedName());
    }
    for (Field field : other.fields) {
      if (!names.add(field.getQualifiedName())) {
        throw new SchemaException(
            String.format(
                "Duplicate column '%s' when merging %s and %s",
                field.getQualifiedName(), this, other));
      }
    }
    return new Schema(ImmutableList.<Field>builder().addAll(fields).addAll(other.fields).build());
  }

  /** Re-qualifies every field with the given alias. */
  public Schema withQualifier(String qualifier) {
    return new Schema(
        fields.stream().map(f -> f.withQualifier(qualifier)).collect(Collectors.toList()));
  }

  /** Marks every field nullable. */
  public Schema asNullable() {
    return new Schema(
        fields.stream().map(f -> f.withNullable(true)).collect(Collectors.toList()));
  }

  /**
   * Union compatibility: same field count and the same types in the same order. Columns match by
   * position; names, qualifiers and nullability are ignored.
   */
  public boolean isUnionCompatible(Schema other) {
    if (fields.size() != other.fields.size()) {
      return false;
    }
    for (int i = 0; i < fields.size(); i++) {
      if (fields.get(i).getType() != other.fields.get(i).getType()) {
        return false;
      }
    }
    return true;
  }

  @Override
  public String toString() {
    return fields.stream().map(Field::toString).collect(Collectors.joining(", ", "[", "]"));
  }
}
