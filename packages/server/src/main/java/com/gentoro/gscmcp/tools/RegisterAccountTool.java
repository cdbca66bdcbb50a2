package com.gentoro.gscmcp.tools;

import com.gentoro.gscmcp.GscMcp;
import com.gentoro.gscmcp.account.Account;
import java.util.LinkedHashMap;
import java.util.Map;

/** Adds or replaces an account at runtime. */
public class RegisterAccountTool extends GscTool {

  public RegisterAccountTool(GscMcp context) {
    super(context);
  }

  @Override
  public ToolDefinition definition() {
    return ToolDefinition.builder()
        .name("register_account")
        .description(
            "Register a Google account with an OAuth refresh token. Registering an existing id replaces its credentials.")
        .property(ToolProperty.string("id").description("Unique account identifier").required())
        .property(ToolProperty.string("email").description("Google account email").required())
        .property(
            ToolProperty.string("refreshToken").description("OAuth 2.0 refresh token").required())
        .property(
            ToolProperty.string("accessToken")
                .description("Optional current access token, refreshed on first use"))
        .build();
  }

  @Override
  public Object call(ToolArguments arguments) {
    String id = arguments.requiredString("id");
    String email = arguments.requiredString("email");
    String refreshToken = arguments.requiredString("refreshToken");
    String accessToken = arguments.optionalString("accessToken");
    arguments.ensureValid();

    Account account = context.accountRegistry().register(id, email, refreshToken, accessToken);

    Map<String, Object> result = new LinkedHashMap<>();
    result.put("success", true);
    result.put("id", account.id());
    result.put("email", account.email());
    result.put("totalAccounts", context.accountRegistry().count());
    return result;
  }
}
