package com.gentoro.gscmcp.tools;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.*;
import static org.mockito.Mockito.*;

import com.gentoro.gscmcp.GscMcp;
import com.gentoro.gscmcp.account.Account;
import com.gentoro.gscmcp.account.AccountRegistry;
import com.gentoro.gscmcp.account.AccountResolver;
import com.gentoro.gscmcp.analytics.QuickWinSummary;
import com.gentoro.gscmcp.analytics.QuickWinThresholds;
import com.gentoro.gscmcp.searchconsole.SearchConsoleService;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

@ExtendWith(MockitoExtension.class)
class DetectQuickWinsToolTest {
  private static final String SITE = "sc-domain:example.com";

  @Mock private GscMcp context;
  @Mock private SearchConsoleService service;

  private DetectQuickWinsTool tool;

  @BeforeEach
  void setUp() {
    AccountRegistry registry = new AccountRegistry();
    registry.register("work", "me@work.com", "rt", null);
    registry.register("agency", "seo@agency.com", "rt2", null);
    lenient().when(context.accountResolver()).thenReturn(new AccountResolver(registry));
    lenient().when(context.searchConsoleFor(any(Account.class))).thenReturn(service);
    tool = new DetectQuickWinsTool(context);
  }

  @Test
  @SuppressWarnings("unchecked")
  void reportsAppliedThresholds() {
    when(service.detectQuickWins(eq(SITE), eq("2024-01-01"), eq("2024-01-31"), any()))
        .thenReturn(List.of());

    Map<String, Object> args = new HashMap<>();
    args.put("account", "seo@agency.com");
    args.put("siteUrl", SITE);
    args.put("startDate", "2024-01-01");
    args.put("endDate", "2024-01-31");

    Map<String, Object> result = (Map<String, Object>) tool.call(new ToolArguments(args));

    verify(service)
        .detectQuickWins(SITE, "2024-01-01", "2024-01-31", QuickWinThresholds.DEFAULTS);
    assertEquals("seo@agency.com", result.get("account"));
    Map<String, Object> thresholds = (Map<String, Object>) result.get("thresholds");
    assertEquals(Double.valueOf(100.0), thresholds.get("minImpressions"));
    assertEquals(Double.valueOf(3.0), thresholds.get("maxCtr"));
    assertEquals("4-20", thresholds.get("positionRange"));
    assertEquals(new QuickWinSummary(0, 0, 0), result.get("summary"));
    assertEquals(List.of(), result.get("quickWins"));
  }

  @Test
  void fractionalImpressionFloorRoundsUp() {
    when(service.detectQuickWins(any(), any(), any(), any())).thenReturn(List.of());

    Map<String, Object> args = new HashMap<>();
    args.put("siteUrl", SITE);
    args.put("startDate", "2024-01-01");
    args.put("endDate", "2024-01-31");
    args.put("minImpressions", 100.5);
    args.put("positionRangeMin", 2.5);

    tool.call(new ToolArguments(args));

    verify(service)
        .detectQuickWins(
            SITE, "2024-01-01", "2024-01-31", new QuickWinThresholds(101, 3.0, 2.5, 20, 50));
  }

  @Test
  void plainDropsTrailingZeros() {
    assertEquals("4", DetectQuickWinsTool.plain(4.0));
    assertEquals("4.5", DetectQuickWinsTool.plain(4.5));
    assertEquals("20", DetectQuickWinsTool.plain(20));
  }
}
