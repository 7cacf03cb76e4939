package org.moneyformat.rest;

public final class ApiConstants {
  public static final class ApiPath {
    public static final String BASE_V1_API_PATH = "/api/v1";
    public static final String VALIDATIONS = "/currency/validations";
    public static final String FORMATS = "/currency/formats";

    private ApiPath() {}
  }

  private ApiConstants() {}
}
