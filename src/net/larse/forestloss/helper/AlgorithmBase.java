/*
 * Copyright (c) 2015 LCMS Project Authors.
 *
 * Permission is hereby granted, free of charge, to any person obtaining a copy
 * of this software and associated documentation files (the "Software"), to deal
 * in the Software without restriction, including without limitation the rights
 * to use, copy, modify, merge, publish, distribute, sublicense, and/or sell
 * copies of the Software, and to permit persons to whom the Software is
 * furnished to do so, subject to the following conditions:
 *
 * The above copyright notice and this permission notice shall be included in
 * all copies or substantial portions of the Software.
 *
 * THE SOFTWARE IS PROVIDED "AS IS", WITHOUT WARRANTY OF ANY KIND, EXPRESS OR
 * IMPLIED, INCLUDING BUT NOT LIMITED TO THE WARRANTIES OF MERCHANTABILITY,
 * FITNESS FOR A PARTICULAR PURPOSE AND NONINFRINGEMENT. IN NO EVENT SHALL THE
 * AUTHORS OR COPYRIGHT HOLDERS BE LIABLE FOR ANY CLAIM, DAMAGES OR OTHER
 * LIABILITY, WHETHER IN AN ACTION OF CONTRACT, TORT OR OTHERWISE, ARISING FROM,
 * OUT OF OR IN CONNECTION WITH THE SOFTWARE OR THE USE OR OTHER DEALINGS IN
 * THE SOFTWARE.
 */

package net.larse.forestloss.helper;

import com.google.common.base.Splitter;
import com.google.common.collect.ImmutableList;
import com.google.common.collect.Lists;

import org.apache.commons.lang3.StringUtils;

import java.lang.annotation.ElementType;
import java.lang.annotation.Retention;
import java.lang.annotation.RetentionPolicy;
import java.lang.annotation.Target;
import java.lang.reflect.Field;
import java.lang.reflect.Modifier;
import java.lang.reflect.ParameterizedType;
import java.time.MonthDay;
import java.time.format.DateTimeFormatter;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Properties;

/**
 * Common plumbing for algorithm arguments. Every algorithm declares a nested {@code Args} class
 * extending {@link ArgsBase} whose public fields carry the defaults; callers either set the fields
 * directly or override them from a {@link Properties} source.
 */
public final class AlgorithmBase {
  /** Month-day values are written as in the compositing windows, e.g. "06-20". */
  public static final DateTimeFormatter MONTH_DAY = DateTimeFormatter.ofPattern("MM-dd");

  private AlgorithmBase() {}

  public abstract static class ArgsBase {
    @Retention(RetentionPolicy.RUNTIME)
    @Target(ElementType.FIELD)
    public @interface Doc {
      String help();
    }

    @Retention(RetentionPolicy.RUNTIME)
    @Target(ElementType.FIELD)
    public @interface Optional {}

    @Retention(RetentionPolicy.RUNTIME)
    @Target(ElementType.FIELD)
    public @interface Required {}

    /**
     * Override fields from properties. A field {@code foo} is read from the key
     * {@code prefix + "foo"}; absent keys leave the default in place.
     *
     * @throws IllegalArgumentException if a value cannot be converted to its field's type or a
     *     required field is still unset afterwards.
     */
    public void load(Properties properties, String prefix) {
      for (Field field : argumentFields()) {
        String value = properties.getProperty(prefix + field.getName());
        if (value == null) {
          continue;
        }
        try {
          field.set(this, convert(field, value.trim()));
        } catch (IllegalAccessException e) {
          throw new IllegalStateException("Cannot set argument " + field.getName(), e);
        } catch (RuntimeException e) {
          throw new IllegalArgumentException(String.format(
              "Invalid value '%s' for argument %s%s", value, prefix, field.getName()), e);
        }
      }
      checkRequired();
    }

    public void load(Properties properties) {
      load(properties, "");
    }

    /** Fail if a field tagged {@link Required} holds no value. */
    public void checkRequired() {
      for (Field field : argumentFields()) {
        if (!field.isAnnotationPresent(Required.class)) {
          continue;
        }
        try {
          if (field.get(this) == null) {
            throw new IllegalArgumentException("Missing required argument " + field.getName());
          }
        } catch (IllegalAccessException e) {
          throw new IllegalStateException("Cannot read argument " + field.getName(), e);
        }
      }
    }

    /** The documented arguments with their help text, in declaration order. */
    public Map<String, String> describe() {
      Map<String, String> docs = new LinkedHashMap<>();
      for (Field field : argumentFields()) {
        Doc doc = field.getAnnotation(Doc.class);
        if (doc != null) {
          docs.put(field.getName(), doc.help());
        }
      }
      return docs;
    }

    private List<Field> argumentFields() {
      List<Class<?>> hierarchy = Lists.newArrayList();
      for (Class<?> c = getClass(); c != ArgsBase.class; c = c.getSuperclass()) {
        hierarchy.add(0, c);
      }
      List<Field> fields = Lists.newArrayList();
      for (Class<?> c : hierarchy) {
        for (Field field : c.getDeclaredFields()) {
          int modifiers = field.getModifiers();
          if (Modifier.isStatic(modifiers) || Modifier.isFinal(modifiers) || field.isSynthetic()) {
            continue;
          }
          field.setAccessible(true);
          fields.add(field);
        }
      }
      return fields;
    }

    @SuppressWarnings({"unchecked", "rawtypes"})
    private static Object convert(Field field, String value) {
      Class<?> type = field.getType();
      if (type == int.class || type == Integer.class) {
        return Integer.parseInt(value);
      } else if (type == long.class || type == Long.class) {
        return Long.parseLong(value);
      } else if (type == double.class || type == Double.class) {
        return Double.parseDouble(value);
      } else if (type == boolean.class || type == Boolean.class) {
        if (!"true".equalsIgnoreCase(value) && !"false".equalsIgnoreCase(value)) {
          throw new IllegalArgumentException("not a boolean: " + value);
        }
        return Boolean.parseBoolean(value);
      } else if (type == String.class) {
        return value;
      } else if (type == MonthDay.class) {
        return MonthDay.parse(value, MONTH_DAY);
      } else if (type.isEnum()) {
        return Enum.valueOf((Class<Enum>) type, StringUtils.upperCase(value));
      } else if (type == List.class && isListOf(field, String.class)) {
        return ImmutableList.copyOf(
            Splitter.on(',').trimResults().omitEmptyStrings().split(value));
      }
      throw new IllegalArgumentException("unsupported argument type " + type.getSimpleName());
    }

    private static boolean isListOf(Field field, Class<?> elementType) {
      return field.getGenericType() instanceof ParameterizedType
          && ((ParameterizedType) field.getGenericType()).getActualTypeArguments()[0]
              == elementType;
    }
  }
}
