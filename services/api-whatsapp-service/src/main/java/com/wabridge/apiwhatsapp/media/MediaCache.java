package com.wabridge.apiwhatsapp.media;

import com.github.benmanes.caffeine.cache.Cache;
import com.github.benmanes.caffeine.cache.Caffeine;
import com.github.benmanes.caffeine.cache.Ticker;
import java.time.Duration;
import java.util.Optional;
import lombok.extern.slf4j.Slf4j;
import org.springframework.web.client.RestClient;
import org.springframework.web.client.RestClientException;

/**
 * Downloads images for outbound messages and keeps them for {@code ttl}, bounded by their total
 * size in bytes. An image larger than the whole budget is returned but not cached.
 */
@Slf4j
public class MediaCache {

  private final RestClient rest;
  private final Cache<String, byte[]> cache;
  private final long maxBytes;

  public MediaCache(RestClient rest, long maxBytes, Duration ttl, Ticker ticker) {
    this.rest = rest;
    this.maxBytes = maxBytes;
    this.cache =
        Caffeine.newBuilder()
            .maximumWeight(maxBytes)
            .weigher((String url, byte[] bytes) -> bytes.length)
            .expireAfterWrite(ttl)
            .ticker(ticker)
            .build();
  }

  public Optional<byte[]> fetch(String url) {
    byte[] cached = cache.getIfPresent(url);
    if (cached != null) {
      log.debug("Image {} served from cache", url);
      return Optional.of(cached);
    }

    byte[] downloaded;
    try {
      log.debug("Downloading image {} (cache miss)", url);
      downloaded = rest.get().uri(url).retrieve().body(byte[].class);
    } catch (RestClientException e) {
      log.warn("Failed to download image {}: {}", url, e.getMessage());
      return Optional.empty();
    }
    if (downloaded == null) {
      log.warn("Image {} download returned no body", url);
      return Optional.empty();
    }

    if (downloaded.length > maxBytes) {
      log.warn(
          "Image {} is {} bytes, larger than the cache budget {}; not cached",
          url,
          downloaded.length,
          maxBytes);
      return Optional.of(downloaded);
    }
    cache.put(url, downloaded);
    log.debug("Image {} cached ({} bytes)", url, downloaded.length);
    return Optional.of(downloaded);
  }

  public long estimatedSize() {
    return cache.estimatedSize();
  }

  public void cleanUp() {
    cache.cleanUp();
  }
}
