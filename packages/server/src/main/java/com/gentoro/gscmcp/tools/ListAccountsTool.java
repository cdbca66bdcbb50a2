package com.gentoro.gscmcp.tools;

import com.gentoro.gscmcp.GscMcp;
import com.gentoro.gscmcp.account.Account;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

public class ListAccountsTool extends GscTool {

  public ListAccountsTool(GscMcp context) {
    super(context);
  }

  @Override
  public ToolDefinition definition() {
    return ToolDefinition.builder()
        .name("list_accounts")
        .description("List all configured Google Search Console accounts")
        .build();
  }

  @Override
  public Object call(ToolArguments arguments) {
    List<Account> accounts = context.accountRegistry().list();
    List<Map<String, Object>> entries =
        accounts.stream()
            .map(
                a -> {
                  Map<String, Object> entry = new LinkedHashMap<>();
                  entry.put("id", a.id());
                  entry.put("email", a.email());
                  return entry;
                })
            .toList();

    Map<String, Object> result = new LinkedHashMap<>();
    result.put("accounts", entries);
    result.put("totalAccounts", accounts.size());
    return result;
  }
}
