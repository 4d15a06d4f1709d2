/*
 * どこで: 共通ディスパッチ層
 * 何を: /api/v{version}/{resource}[/{id}] を解決済みの VersionedResource へ委譲する
 * なぜ: 各ホストのコントローラを持たず、バージョン解決とヘッダ付与を 1 か所に集約するため
 */
package com.siteplatform.common.dispatch;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonMappingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.siteplatform.common.api.JsonPaths;
import com.siteplatform.common.api.ValidationException;
import com.siteplatform.common.repository.ListFilter;
import java.net.URI;
import java.util.List;
import java.util.Map;
import lombok.RequiredArgsConstructor;
import org.springframework.http.MediaType;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.DeleteMapping;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.PutMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

@RestController
@RequestMapping("/api")
@RequiredArgsConstructor
public class ResourceDispatchController {

  // resource は英小文字始まりに限定し、"/api/v1/projects" と "/api/{resource}/{id}" の衝突を避ける
  static final String VERSIONED_COLLECTION = "/v{version}/{resource:[a-z][a-z-]*}";
  static final String VERSIONED_ITEM = "/v{version}/{resource:[a-z][a-z-]*}/{id:\\d+}";
  static final String DEFAULT_COLLECTION = "/{resource:[a-z][a-z-]*}";
  static final String DEFAULT_ITEM = "/{resource:[a-z][a-z-]*}/{id:\\d+}";

  private final VersionRegistry versionRegistry;
  private final ObjectMapper objectMapper;

  @GetMapping({VERSIONED_COLLECTION, DEFAULT_COLLECTION})
  public ResponseEntity<?> list(
      @PathVariable(name = "version", required = false) String version,
      @PathVariable("resource") String resource,
      @RequestParam Map<String, String> parameters) {
    final ResolvedVersion<?> resolved = versionRegistry.resolve(resource, version);
    final ListFilter filter = ListFilter.fromQueryParameters(parameters);
    return ResponseEntity.ok()
        .headers(VersionHeaders.of(resource, resolved))
        .body(listWith(resolved, filter));
  }

  @GetMapping({VERSIONED_ITEM, DEFAULT_ITEM})
  public ResponseEntity<?> get(
      @PathVariable(name = "version", required = false) String version,
      @PathVariable("resource") String resource,
      @PathVariable("id") long id) {
    final ResolvedVersion<?> resolved = versionRegistry.resolve(resource, version);
    return ResponseEntity.ok()
        .headers(VersionHeaders.of(resource, resolved))
        .body(resolved.handler().get(id));
  }

  @PostMapping(
      value = {VERSIONED_COLLECTION, DEFAULT_COLLECTION},
      consumes = MediaType.APPLICATION_JSON_VALUE)
  public ResponseEntity<?> create(
      @PathVariable(name = "version", required = false) String version,
      @PathVariable("resource") String resource,
      @RequestBody JsonNode body) {
    final ResolvedVersion<?> resolved = versionRegistry.resolve(resource, version);
    return createWith(resolved, resource, body);
  }

  @PutMapping(
      value = {VERSIONED_ITEM, DEFAULT_ITEM},
      consumes = MediaType.APPLICATION_JSON_VALUE)
  public ResponseEntity<?> update(
      @PathVariable(name = "version", required = false) String version,
      @PathVariable("resource") String resource,
      @PathVariable("id") long id,
      @RequestBody JsonNode body) {
    final ResolvedVersion<?> resolved = versionRegistry.resolve(resource, version);
    return updateWith(resolved, resource, id, body);
  }

  @DeleteMapping({VERSIONED_ITEM, DEFAULT_ITEM})
  public ResponseEntity<Void> delete(
      @PathVariable(name = "version", required = false) String version,
      @PathVariable("resource") String resource,
      @PathVariable("id") long id) {
    final ResolvedVersion<?> resolved = versionRegistry.resolve(resource, version);
    resolved.handler().delete(id);
    return ResponseEntity.noContent().headers(VersionHeaders.of(resource, resolved)).build();
  }

  private <D> List<D> listWith(ResolvedVersion<D> resolved, ListFilter filter) {
    return resolved.handler().list(filter);
  }

  private <D> ResponseEntity<D> createWith(
      ResolvedVersion<D> resolved, String resource, JsonNode body) {
    final VersionedResource<D> handler = resolved.handler();
    final D created = handler.create(readBody(body, handler.dtoType()));
    final URI location =
        URI.create("/api/v" + resolved.version() + "/" + resource + "/" + handler.idOf(created));
    return ResponseEntity.created(location)
        .headers(VersionHeaders.of(resource, resolved))
        .body(created);
  }

  private <D> ResponseEntity<D> updateWith(
      ResolvedVersion<D> resolved, String resource, long id, JsonNode body) {
    final VersionedResource<D> handler = resolved.handler();
    final D updated = handler.update(id, readBody(body, handler.dtoType()));
    return ResponseEntity.ok().headers(VersionHeaders.of(resource, resolved)).body(updated);
  }

  private <D> D readBody(JsonNode body, Class<D> dtoType) {
    if (body == null || !body.isObject()) {
      throw new ValidationException("body", "request body must be a JSON object");
    }
    try {
      return objectMapper.treeToValue(body, dtoType);
    } catch (JsonMappingException ex) {
      final String field = ex.getPath().isEmpty() ? "body" : JsonPaths.describe(ex);
      throw new ValidationException(field, field + " has an invalid value");
    } catch (JsonProcessingException ex) {
      throw new ValidationException("body", "request body is invalid");
    }
  }
}
