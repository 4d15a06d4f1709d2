/*
 * どこで: API バージョニング
 * 何を: (resource, version) ごとのライフサイクル状態を定義する
 * なぜ: 非推奨/削除の遷移を一方向に固定し、運用ミスによる巻き戻しを防ぐため
 */
package com.siteplatform.common.version;

public enum VersionState {
  ACTIVE,
  DEPRECATED,
  REMOVED;

  /**
   * 役割: 運用操作による状態遷移を適用する。
   * 動作: 同一状態は何もしない。前進のみ許可し、逆方向は IllegalStateException を送出する。
   */
  public VersionState transitionTo(VersionState next) {
    if (next == null) {
      throw new IllegalArgumentException("next state is required");
    }
    if (next.ordinal() < ordinal()) {
      throw new IllegalStateException("version state cannot move from " + this + " to " + next);
    }
    return next;
  }

  public boolean isResolvable() {
    return this != REMOVED;
  }
}
