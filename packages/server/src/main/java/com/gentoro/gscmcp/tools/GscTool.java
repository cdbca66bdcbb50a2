package com.gentoro.gscmcp.tools;

import com.gentoro.gscmcp.GscMcp;
import com.gentoro.gscmcp.account.Account;
import com.gentoro.gscmcp.searchconsole.SearchConsoleService;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Base class of every tool exposed over MCP. A tool declares its input schema and turns validated
 * arguments into a JSON-serializable result; failures are raised as exceptions and converted to
 * error results by {@link ToolRegistry}.
 */
public abstract class GscTool {
  protected static final String ACCOUNT_DESCRIPTION =
      "Account id or Google account email to use. If not specified, the first available account is used.";
  protected static final String SITE_URL_DESCRIPTION =
      "The site URL as defined in Search Console. Example: sc-domain:example.com or https://www.example.com/";

  protected final GscMcp context;

  protected GscTool(GscMcp context) {
    this.context = context;
  }

  public abstract ToolDefinition definition();

  public String name() {
    return definition().name();
  }

  /** Executes the tool; the returned value is serialized to JSON as the call result. */
  public abstract Object call(ToolArguments arguments);

  /** Resolves the account selector and binds a Search Console facade to its live client. */
  protected Session open(String accountSelector) {
    Account account = context.accountResolver().resolve(accountSelector);
    return new Session(account, context.searchConsoleFor(account));
  }

  protected static ToolProperty.Builder accountProperty() {
    return ToolProperty.string("account").description(ACCOUNT_DESCRIPTION);
  }

  protected static ToolProperty.Builder siteUrlProperty() {
    return ToolProperty.string("siteUrl").description(SITE_URL_DESCRIPTION).required();
  }

  protected static Map<String, Object> dateRange(String start, String end) {
    Map<String, Object> range = new LinkedHashMap<>();
    range.put("start", start);
    range.put("end", end);
    return range;
  }

  protected record Session(Account account, SearchConsoleService service) {}
}
