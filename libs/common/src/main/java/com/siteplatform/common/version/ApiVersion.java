/*
 * どこで: API バージョニング
 * 何を: major.minor 形式の順序付きバージョンタグを表す
 * なぜ: パス上のトークン表記ゆれ ("1" と "1.0") を同一視し、数値順で比較するため
 */
package com.siteplatform.common.version;

import java.util.Optional;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

public record ApiVersion(int major, int minor) implements Comparable<ApiVersion> {

  private static final Pattern TOKEN = Pattern.compile("(\\d{1,4})(?:\\.(\\d{1,4}))?");

  public ApiVersion {
    if (major < 0 || minor < 0) {
      throw new IllegalArgumentException("version components must not be negative");
    }
  }

  /**
   * 役割: パスや設定から受け取ったトークンを解釈する。
   * 動作: "1" / "1.0" / "2.10" を受理し、それ以外 (空白, "v1", "1.x") は空を返す。
   */
  public static Optional<ApiVersion> tryParse(String token) {
    if (token == null) {
      return Optional.empty();
    }
    final Matcher matcher = TOKEN.matcher(token.trim());
    if (!matcher.matches()) {
      return Optional.empty();
    }
    final int major = Integer.parseInt(matcher.group(1));
    final int minor = matcher.group(2) == null ? 0 : Integer.parseInt(matcher.group(2));
    return Optional.of(new ApiVersion(major, minor));
  }

  public static ApiVersion of(String token) {
    return tryParse(token)
        .orElseThrow(() -> new IllegalArgumentException("invalid api version: " + token));
  }

  @Override
  public int compareTo(ApiVersion other) {
    final int byMajor = Integer.compare(major, other.major);
    return byMajor != 0 ? byMajor : Integer.compare(minor, other.minor);
  }

  @Override
  public String toString() {
    return major + "." + minor;
  }
}
