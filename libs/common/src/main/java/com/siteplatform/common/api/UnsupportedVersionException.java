package com.siteplatform.common.api;

public class UnsupportedVersionException extends RuntimeException {

  public UnsupportedVersionException(String resource, String versionToken) {
    super("unsupported api version '" + versionToken + "' for resource '" + resource + "'");
  }

  public UnsupportedVersionException(String message) {
    super(message);
  }
}
