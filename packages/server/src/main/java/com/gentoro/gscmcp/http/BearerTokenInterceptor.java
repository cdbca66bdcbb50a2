package com.gentoro.gscmcp.http;

import java.io.IOException;
import java.util.function.Supplier;
import okhttp3.Interceptor;
import okhttp3.Request;
import okhttp3.Response;
import org.jetbrains.annotations.NotNull;

/** Adds {@code Authorization: Bearer <token>} using the token current at request time. */
public class BearerTokenInterceptor implements Interceptor {
  private final Supplier<String> tokenSupplier;

  public BearerTokenInterceptor(Supplier<String> tokenSupplier) {
    this.tokenSupplier = tokenSupplier;
  }

  @NotNull
  @Override
  public Response intercept(Chain chain) throws IOException {
    Request original = chain.request();
    if (original.header("Authorization") != null) {
      return chain.proceed(original);
    }
    String token = tokenSupplier.get();
    if (token == null || token.isBlank()) {
      return chain.proceed(original);
    }
    return chain.proceed(
        original.newBuilder().header("Authorization", "Bearer " + token).build());
  }
}
