package com.wordvault.infrastructure;

import com.wordvault.application.FetchException;
import com.wordvault.application.port.PageFetcher;
import java.io.IOException;
import java.io.UncheckedIOException;
import java.net.SocketTimeoutException;
import java.util.Objects;
import java.util.Optional;
import org.jsoup.Connection;
import org.jsoup.Jsoup;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Component;

/**
 * HTTP page fetcher backed by jsoup's connection API.
 *
 * <p>Every request carries a browser user agent and a bounded timeout. HTTP 404 means "no such
 * page" and yields an empty result; any other non-2xx status, a timeout or an I/O failure raises
 * {@link FetchException}, including failures while the body is still streaming.
 */
@Component
public class JsoupPageFetcher implements PageFetcher {
  private static final Logger log = LoggerFactory.getLogger(JsoupPageFetcher.class);

  private final int timeoutMs;
  private final int maxBodyBytes;
  private final String userAgent;

  /** @param maxBodyBytes largest body jsoup will read, 0 for unlimited */
  public JsoupPageFetcher(
      @Value("${wordvault.fetch-timeout-ms:30000}") int timeoutMs,
      @Value("${wordvault.max-body-bytes:0}") int maxBodyBytes,
      @Value("${wordvault.user-agent:Mozilla/5.0}") String userAgent) {
    this.timeoutMs = timeoutMs;
    this.maxBodyBytes = maxBodyBytes;
    this.userAgent = Objects.requireNonNull(userAgent, "wordvault.user-agent");
  }

  @Override
  public Optional<String> fetch(String url) {
    long t0 = System.nanoTime();
    try {
      Connection.Response res =
          Jsoup.connect(url)
              .userAgent(userAgent)
              .header("Accept-Language", "en-US,en;q=0.9")
              .timeout(timeoutMs)
              .maxBodySize(maxBodyBytes)
              .ignoreHttpErrors(true)
              .followRedirects(true)
              .execute();

      int status = res.statusCode();
      log.debug("GET {} -> {} ({} ms)", url, status, (System.nanoTime() - t0) / 1_000_000);
      if (status == 404) return Optional.empty();
      if (status < 200 || status >= 300) {
        log.warn("Unexpected status {} for {}", status, url);
        throw new FetchException("Unexpected status " + status + " for " + url);
      }
      // execute() reads only the headers; the body streams in here
      return Optional.of(res.body());
    } catch (SocketTimeoutException e) {
      throw timedOut(url, e);
    } catch (IOException e) {
      throw failed(url, e);
    } catch (UncheckedIOException e) {
      if (e.getCause() instanceof SocketTimeoutException) throw timedOut(url, e);
      throw failed(url, e);
    }
  }

  private FetchException timedOut(String url, Exception e) {
    log.warn("Timed out after {} ms fetching {}", timeoutMs, url);
    return new FetchException("Timed out fetching " + url, e);
  }

  private static FetchException failed(String url, Exception e) {
    log.warn("Fetch failed for {}: {}", url, e.getMessage());
    return new FetchException("Fetch failed for " + url, e);
  }
}
