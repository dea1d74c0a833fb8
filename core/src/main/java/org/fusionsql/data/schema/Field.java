/*
 * Copyright OpenSearch Contributors
 * SPDX-License-Identifier: Apache-2.0
 */

package org.fusionsql.data.schema;

import java.util.Objects;
import lombok.EqualsAndHashCode;
import lombok.Getter;
import org.fusionsql.data.type.DataType;

/**
 * Column descriptor. The optional qualifier is the relation alias the column was read from and
 * lets {@code t.a} and {@code u.a} coexist in one schema.
 */
@Getter
@EqualsAndHashCode
public class Field {

  private final String name;
  private final DataType type;
  private final boolean nullable;
  private final String qualifier;

  public Field(String name, DataType type, boolean nullable, String qualifier) {
    this.name = Objects.requireNonNull(name, "name");
    this.type = Objects.requireNonNull(type, "type");
    this.nullable = nullable;
    this.qualifier = qualifier;
  }

  public Field(String name, DataType type, boolean nullable) {
    this(name, type, nullable, null);
  }

  public Field(String name, DataType type) {
    this(name, type, true, null);
  }

  /** Returns {@code qualifier.name}, or the bare name when unqualified. */
  public String getQualifiedName() {
    return qualifier == null ? name : qualifier + "." + name;
  }

  public Field withQualifier(String newQualifier) {
    return new Field(name, type, nullable, newQualifier);
  }

  public Field withNullable(boolean newNullable) {
    return new Field(name, type, newNullable, qualifier);
  }

  public Field withName(String newName) {
    return new Field(newName, type, nullable, qualifier);
  }

  @Override
  public String toString() {
    return getQualifiedName() + ":" + type + (nullable ? "" : " NOT NULL");
  }
}
