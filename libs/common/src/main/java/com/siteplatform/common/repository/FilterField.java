package com.siteplatform.common.repository;

import java.util.Locale;
import java.util.function.Function;

/** 一覧条件として許可する列と、クエリ文字列から SQL バインド値への変換。 */
public record FilterField(String column, Function<String, Object> converter) {

  public static FilterField text(String column) {
    return new FilterField(column, value -> value);
  }

  public static FilterField number(String column) {
    return new FilterField(column, Long::parseLong);
  }

  public static <T extends Enum<T>> FilterField enumName(String column, Class<T> type) {
    return new FilterField(
        column, value -> Enum.valueOf(type, value.trim().toUpperCase(Locale.ROOT)).name());
  }
}
