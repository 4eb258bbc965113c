package com.siteaudit.crawl.robots;

import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertTrue;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.times;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

import com.siteaudit.crawl.http.PageFetcher;
import com.siteaudit.crawl.model.FetchResult;
import java.time.Duration;
import java.util.Map;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

@ExtendWith(MockitoExtension.class)
class RobotsTxtServiceDecisionTest {
  private static final String AGENT = "SiteAuditBot/0.1";

  @Mock private PageFetcher fetcher;

  @Test
  void rulesAreFetchedOncePerOrigin() {
    when(fetcher.fetch(eq("https://example.com/robots.txt"), any(Duration.class), anyString()))
        .thenReturn(robots(200, "User-agent: *\nDisallow: /private\n"));

    RobotsTxtService service = new RobotsTxtService(fetcher, Duration.ofSeconds(5), AGENT, true);

    assertFalse(service.isAllowed("https://example.com/private/a"));
    assertTrue(service.isAllowed("https://example.com/public"));
    assertFalse(service.isAllowed("https://example.com/private"));
    verify(fetcher, times(1)).fetch(eq("https://example.com/robots.txt"), any(Duration.class), anyString());
  }

  @Test
  void missingRobotsAllowsEverything() {
    when(fetcher.fetch(anyString(), any(Duration.class), anyString()))
        .thenReturn(robots(404, "not found"));

    RobotsTxtService service = new RobotsTxtService(fetcher, Duration.ofSeconds(5), AGENT, false);

    assertTrue(service.isAllowed("https://example.com/anything"));
  }

  @Test
  void failClosedDisallowsWhenRobotsUnavailable() {
    when(fetcher.fetch(anyString(), any(Duration.class), anyString()))
        .thenReturn(new FetchResult.NetworkError("connection refused"));

    RobotsTxtService service = new RobotsTxtService(fetcher, Duration.ofSeconds(5), AGENT, false);

    assertFalse(service.isAllowed("https://example.com/careers"));
  }

  @Test
  void failOpenAllowsWhenRobotsServerErrors() {
    when(fetcher.fetch(anyString(), any(Duration.class), anyString()))
        .thenReturn(robots(503, "busy"));

    RobotsTxtService service = new RobotsTxtService(fetcher, Duration.ofSeconds(5), AGENT, true);

    assertTrue(service.isAllowed("https://example.com/careers"));
  }

  private static FetchResult robots(int status, String body) {
    return new FetchResult.Success(
        status, Map.of(), body, body.length(), "text/plain", "https://example.com/robots.txt");
  }
}
