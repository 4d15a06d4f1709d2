package com.siteplatform.common.version;

import java.util.Objects;

public record VersionKey(String resource, ApiVersion version) {

  public VersionKey {
    Objects.requireNonNull(resource, "resource");
    Objects.requireNonNull(version, "version");
  }

  @Override
  public String toString() {
    return resource + "@" + version;
  }
}
