/*
 * どこで: 共通ディスパッチ層
 * 何を: バージョン別 DTO とエンティティの相互変換・検証関数の契約を定義する
 * なぜ: バージョンごとの入力ルールと射影を副作用の無い関数として閉じ込めるため
 */
package com.siteplatform.common.dispatch;

import com.siteplatform.common.api.ValidationErrors;

public interface DtoCodec<E, D> {

  /** 入力 DTO の検証結果。空なら業務処理へ進める。 */
  ValidationErrors validate(D dto);

  /** 新規作成用のエンティティ下書き。id/時刻はストアが採番する。 */
  E toEntity(D dto);

  /** 既存エンティティへ DTO が持つフィールドだけを上書きする。射影外の列は保持する。 */
  E merge(E existing, D dto);

  D toDto(E entity);

  long idOf(D dto);
}
