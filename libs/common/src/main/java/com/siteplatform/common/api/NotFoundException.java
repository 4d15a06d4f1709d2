package com.siteplatform.common.api;

public class NotFoundException extends RuntimeException {

  public NotFoundException(String resource, long id) {
    super(resource + " not found: " + id);
  }

  public NotFoundException(String message) {
    super(message);
  }
}
