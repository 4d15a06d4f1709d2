package com.siteplatform.common.dispatch;

import com.siteplatform.common.version.ApiVersion;
import com.siteplatform.common.version.VersionState;

public record ResolvedVersion<D>(
    VersionedResource<D> handler, ApiVersion version, VersionState state) {

  public boolean deprecated() {
    return state == VersionState.DEPRECATED;
  }
}
