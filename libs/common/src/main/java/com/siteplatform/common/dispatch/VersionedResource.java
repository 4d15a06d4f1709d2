/*
 * どこで: 共通ディスパッチ層
 * 何を: (resource, version) ごとのサービス操作ハンドルを定義する
 * なぜ: バージョン別インターフェースを継承ではなくタグ付きバリアントとして登録するため
 */
package com.siteplatform.common.dispatch;

import com.siteplatform.common.repository.ListFilter;
import com.siteplatform.common.version.ApiVersion;
import java.util.List;

public interface VersionedResource<D> {

  String resource();

  ApiVersion version();

  /** リクエスト本文をバインドする DTO 型。 */
  Class<D> dtoType();

  long idOf(D dto);

  D get(long id);

  List<D> list(ListFilter filter);

  D create(D dto);

  D update(long id, D dto);

  void delete(long id);
}
