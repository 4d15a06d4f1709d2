/*
 * どこで: 共通ディスパッチ層
 * 何を: DtoCodec と EntityService を組み合わせた VersionedResource の骨格
 * なぜ: 各バージョンの実装を「検証・射影・固有ルール」だけに絞るため
 */
package com.siteplatform.common.dispatch;

import com.siteplatform.common.repository.ListFilter;
import com.siteplatform.common.version.ApiVersion;
import java.util.List;

public abstract class CodecBackedResource<E, D> implements VersionedResource<D> {

  private final String resource;
  private final ApiVersion version;
  private final Class<D> dtoType;
  private final DtoCodec<E, D> codec;
  private final EntityService<E> service;

  protected CodecBackedResource(
      String resource,
      ApiVersion version,
      Class<D> dtoType,
      DtoCodec<E, D> codec,
      EntityService<E> service) {
    this.resource = resource;
    this.version = version;
    this.dtoType = dtoType;
    this.codec = codec;
    this.service = service;
  }

  @Override
  public String resource() {
    return resource;
  }

  @Override
  public ApiVersion version() {
    return version;
  }

  @Override
  public Class<D> dtoType() {
    return dtoType;
  }

  @Override
  public long idOf(D dto) {
    return codec.idOf(dto);
  }

  @Override
  public D get(long id) {
    return codec.toDto(service.get(id));
  }

  @Override
  public List<D> list(ListFilter filter) {
    return service.list(filter).stream().map(codec::toDto).toList();
  }

  @Override
  public D create(D dto) {
    codec.validate(dto).throwIfAny();
    final E draft = codec.toEntity(dto);
    beforeCreate(draft);
    return codec.toDto(service.create(draft));
  }

  @Override
  public D update(long id, D dto) {
    codec.validate(dto).throwIfAny();
    final E updated =
        service.update(
            id,
            existing -> {
              final E merged = codec.merge(existing, dto);
              beforeUpdate(existing, merged);
              return merged;
            });
    return codec.toDto(updated);
  }

  @Override
  public void delete(long id) {
    service.delete(id);
  }

  /** バージョン固有の業務ルール。違反時は BusinessRuleException を送出する。 */
  protected void beforeCreate(E draft) {}

  protected void beforeUpdate(E existing, E merged) {}
}
