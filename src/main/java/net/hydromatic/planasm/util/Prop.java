/*
 * Licensed to Julian Hyde under one or more contributor license
 * agreements.  See the NOTICE file distributed with this work
 * for additional information regarding copyright ownership.
 * Julian Hyde licenses this file to you under the Apache
 * License, Version 2.0 (the "License"); you may not use this
 * file except in compliance with the License.  You may obtain a
 * copy of the License at
 *
 * http://www.apache.org/licenses/LICENSE-2.0
 *
 * Unless required by applicable law or agreed to in writing,
 * software distributed under the License is distributed on an
 * "AS IS" BASIS, WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND,
 * either express or implied.  See the License for the specific
 * language governing permissions and limitations under the
 * License.
 */
package net.hydromatic.planasm.util;

import static com.google.common.base.Preconditions.checkArgument;

import com.google.common.base.CaseFormat;
import com.google.common.collect.ImmutableMap;
import com.google.common.collect.Ordering;
import java.util.Arrays;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import org.checkerframework.checker.nullness.qual.Nullable;

/**
 * Property.
 *
 * <p>Properties are held in a {@code Map<Prop, Object>}; a property that is
 * not in the map has its default value.
 */
public enum Prop {
  /**
   * String property "uriPrefix" is the prefix of identifiers that the
   * disassembler generates for extension URIs. Default is "uri".
   */
  URI_PREFIX("uriPrefix", String.class, true, "uri"),

  /**
   * String property "functionPrefix" is the prefix of identifiers that the
   * disassembler generates for extension functions. Default is "fn".
   */
  FUNCTION_PREFIX("functionPrefix", String.class, true, "fn"),

  /**
   * String property "typePrefix" is the prefix of identifiers that the
   * disassembler generates for extension types. Default is "typ".
   */
  TYPE_PREFIX("typePrefix", String.class, true, "typ"),

  /**
   * String property "typeVariationPrefix" is the prefix of identifiers that
   * the disassembler generates for extension type variations. Default is
   * "tv".
   */
  TYPE_VARIATION_PREFIX("typeVariationPrefix", String.class, true, "tv"),

  /**
   * String property "relationPrefix" is the prefix of identifiers that the
   * disassembler generates for relations. Default is "rel".
   */
  RELATION_PREFIX("relationPrefix", String.class, true, "rel"),

  /**
   * Boolean property "strict" controls whether the disassembler rejects a
   * relation or field that the plan schema cannot classify. If false, such
   * values are copied into the program unchanged. Default is false.
   */
  STRICT("strict", Boolean.class, true, false),

  /**
   * Boolean property "sectionComments" controls whether a disassembled
   * program contains comments that introduce each group of statements.
   * Default is true.
   */
  SECTION_COMMENTS("sectionComments", Boolean.class, true, true),

  /**
   * Boolean property "prettyJson" controls whether an assembled plan is
   * written with one member per line. Default is true.
   */
  PRETTY_JSON("prettyJson", Boolean.class, true, true);

  public final String camelName;
  private final Class<?> type;
  private final boolean required;
  private final Object defaultValue;

  /**
   * Map of all properties, keyed by both {@link #name()} and {@link
   * #camelName}.
   */
  public static final ImmutableMap<String, Prop> BY_NAME;

  /** List of all properties sorted by {@link #camelName}. */
  public static final List<Prop> BY_CAMEL_NAME;

  static {
    final List<Prop> list = Arrays.asList(values());
    final Ordering<Prop> ordering =
        Ordering.from(Comparator.comparing((Prop o) -> o.camelName));
    BY_CAMEL_NAME = ordering.sortedCopy(list);

    final Map<String, Prop> map = new LinkedHashMap<>();
    for (Prop value : BY_CAMEL_NAME) {
      map.put(value.name(), value);
      map.put(value.camelName, value);
    }
    BY_NAME = ImmutableMap.copyOf(map);
  }

  Prop(String camelName, Class<?> type, boolean required, Object defaultValue) {
    this.camelName = camelName;
    this.type = type;
    this.required = required;
    this.defaultValue = defaultValue;
    checkArgument(
        CaseFormat.LOWER_CAMEL
            .to(CaseFormat.UPPER_UNDERSCORE, camelName)
            .equals(name()));
    if (defaultValue == null) {
      checkArgument(
          !required, "required property %s must have default value", camelName);
    } else {
      checkArgument(type.isInstance(defaultValue));
    }
  }

  /** Looks up a property by name. Throws if not found; never returns null. */
  public static Prop lookup(String propName) {
    Prop prop = BY_NAME.get(propName);
    if (prop == null) {
      throw new IllegalArgumentException("property " + propName + " not found");
    }
    return prop;
  }

  /** Returns the value of a property. */
  public Object get(Map<Prop, Object> map) {
    Object o = map.get(this);
    return o != null ? o : defaultValue;
  }

  /** Throws if the requested type does not match this property's type. */
  private void checkType(Class<?> requestedType) {
    checkArgument(
        type == requestedType,
        "invalid type %s for property %s",
        type,
        camelName);
  }

  /** Returns the value of a boolean property. */
  public boolean booleanValue(Map<Prop, Object> map) {
    checkType(Boolean.class);
    Object o = map.get(this);
    return this.<Boolean>typeValue(o);
  }

  /** Returns the value of a string property. */
  public String stringValue(Map<Prop, Object> map) {
    checkType(String.class);
    Object o = map.get(this);
    return this.typeValue(o);
  }

  @SuppressWarnings("unchecked")
  private <T> T typeValue(Object o) {
    if (o == null) {
      if (defaultValue == null) {
        throw new IllegalStateException(
            "no value for property " + camelName + " and no default value");
      }
      return (T) defaultValue;
    }
    return (T) o;
  }

  /**
   * Sets the value of a property, allowing strings for boolean types.
   *
   * <p>For example, the command line option {@code -DsectionComments=false}
   * arrives here as the string "false".
   */
  public void setLenient(Map<Prop, Object> map, @Nullable Object value) {
    if (type == Boolean.class && value instanceof String) {
      final String s = ((String) value).toLowerCase(Locale.ROOT);
      switch (s) {
      case "true":
      case "false":
        set(map, Boolean.valueOf(s));
        return;
      default:
        throw new IllegalArgumentException(
            "value for property " + camelName + " must be true or false");
      }
    }
    set(map, value);
  }

  /** Sets the value of a property. Checks that its type is valid. */
  public void set(Map<Prop, Object> map, @Nullable Object value) {
    if (value == null) {
      if (required) {
        throw new IllegalArgumentException("property is required");
      }
      map.remove(this);
    } else {
      if (!type.isInstance(value)) {
        throw new IllegalArgumentException(
            "value for property must have type " + type);
      }
      map.put(this, value);
    }
  }
}

// End Prop.java
