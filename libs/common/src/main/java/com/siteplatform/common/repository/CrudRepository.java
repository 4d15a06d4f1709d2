/*
 * どこで: 共通データアクセス
 * 何を: 任意エンティティ向けの同期 CRUD 契約を定義する
 * なぜ: サービス層がストア実装に依存せず、id 単位の操作だけを前提にできるようにするため
 */
package com.siteplatform.common.repository;

import com.siteplatform.common.api.NotFoundException;
import java.util.List;
import java.util.Optional;

public interface CrudRepository<E> {

  /** エラーメッセージや NotFound 応答に使うリソース名。 */
  String resourceName();

  Optional<E> get(long id);

  List<E> list(ListFilter filter);

  /** id と作成/更新時刻はストア側で採番した値を返す。 */
  E create(E entity);

  Optional<E> update(long id, E entity);

  boolean delete(long id);

  default E require(long id) {
    return get(id).orElseThrow(() -> new NotFoundException(resourceName(), id));
  }

  default boolean exists(long id) {
    return get(id).isPresent();
  }
}
