package com.siteplatform.common.api;

import com.fasterxml.jackson.databind.JsonMappingException;
import java.util.stream.Collectors;

public final class JsonPaths {

  private JsonPaths() {}

  // "items[0].quantity" のように JSON 上の位置を人が読める形へ整形する
  public static String describe(JsonMappingException ex) {
    return ex.getPath().stream()
        .map(ref -> ref.getFieldName() != null ? ref.getFieldName() : "[" + ref.getIndex() + "]")
        .collect(Collectors.joining("."))
        .replace(".[", "[");
  }
}
