package com.gentoro.gscmcp.http;

import java.io.IOException;
import okhttp3.*;
import okio.Buffer;
import org.jetbrains.annotations.NotNull;

public class LoggingInterceptor implements Interceptor {
  private static final org.slf4j.Logger log =
      com.gentoro.gscmcp.logging.LoggingService.getLogger(LoggingInterceptor.class);

  @NotNull
  @Override
  public Response intercept(Chain chain) throws IOException {
    Request request = chain.request();

    long startTime = System.nanoTime();
    if (log.isDebugEnabled()) {
      log.debug(
          "Sending {} {}\nHeaders:\n{}\nBody:\n{}\n",
          request.method(),
          request.url(),
          redact(request.headers()),
          bodyToString(request));
    }

    Response response = chain.proceed(request);

    long endTime = System.nanoTime();
    log.debug(
        "Received response for {} in {} ms, status {}",
        response.request().url(),
        String.format("%.1f", (endTime - startTime) / 1e6d),
        response.code());

    if (log.isTraceEnabled()) {
      ResponseBody responseBody = response.peekBody(Long.MAX_VALUE);
      log.trace("Response body:\n{}\n", responseBody.string());
    }

    return response;
  }

  private static Headers redact(Headers headers) {
    Headers.Builder builder = headers.newBuilder();
    for (String name : headers.names()) {
      if ("Authorization".equalsIgnoreCase(name) || "apikey".equalsIgnoreCase(name)) {
        builder.set(name, "<redacted>");
      }
    }
    return builder.build();
  }

  private static String bodyToString(Request request) {
    RequestBody body = request.body();
    if (body == null) return "";
    MediaType type = body.contentType();
    // form bodies carry OAuth client secrets and refresh tokens
    if (type != null && "x-www-form-urlencoded".equalsIgnoreCase(type.subtype())) {
      return "(form body omitted)";
    }
    try {
      Buffer buffer = new Buffer();
      body.writeTo(buffer);
      return buffer.readUtf8();
    } catch (IOException e) {
      return "(error reading body)";
    }
  }
}
