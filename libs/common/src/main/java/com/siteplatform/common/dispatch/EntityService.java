package com.siteplatform.common.dispatch;

import com.siteplatform.common.repository.ListFilter;
import java.util.List;
import java.util.function.UnaryOperator;

/**
 * バージョンに依存しないドメインサービスの契約。
 *
 * <p>共通の業務ルール (状態遷移など) はここで適用し、バージョン固有のルールは
 * {@link CodecBackedResource} のフックで適用する。
 */
public interface EntityService<E> {

  E get(long id);

  List<E> list(ListFilter filter);

  E create(E draft);

  /** 既存値を読み込み、{@code change} で作った更新後の値を検証して保存する。 */
  E update(long id, UnaryOperator<E> change);

  void delete(long id);
}
