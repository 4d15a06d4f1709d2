package com.siteplatform.common.version;

import java.time.Instant;
import java.util.Map;

/** (resource, version) ごとのライフサイクル状態の永続化。再起動をまたいで遷移を一方向に保つ。 */
public interface VersionLifecycleStore {

  Map<VersionKey, VersionState> loadAll();

  void save(VersionKey key, VersionState state, Instant changedAt);
}
