package io.playgroundx.web.api;

public record ApiResponse<T>(String status, String message, T data) {
  public static <T> ApiResponse<T> up(T data) { return new ApiResponse<>("UP", "Success", data); }
}
