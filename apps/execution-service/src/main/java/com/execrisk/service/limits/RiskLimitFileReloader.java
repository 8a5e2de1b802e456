package com.execrisk.service.limits;

import com.execrisk.domain.risk.RiskLimitConfig;
import com.execrisk.engine.risk.RiskLimitConfigHolder;
import com.fasterxml.jackson.databind.ObjectMapper;
import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.attribute.FileTime;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.boot.autoconfigure.condition.ConditionalOnExpression;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Component;

/**
 * Polls a JSON limits file and swaps the live {@link RiskLimitConfig} when the file changes. A
 * file that cannot be read or parsed leaves the current limits in place.
 */
@Component
@ConditionalOnExpression("'${execrisk.limits-file:}' != ''")
public class RiskLimitFileReloader {
  private static final Logger log = LoggerFactory.getLogger(RiskLimitFileReloader.class);

  private final RiskLimitConfigHolder holder;
  private final ObjectMapper objectMapper;
  private final Path file;
  private FileTime lastLoaded;

  public RiskLimitFileReloader(
      RiskLimitConfigHolder holder,
      ObjectMapper objectMapper,
      @Value("${execrisk.limits-file}") String file) {
    this.holder = holder;
    this.objectMapper = objectMapper;
    this.file = Path.of(file);
  }

  @Scheduled(fixedDelayString = "${execrisk.limits-file-poll-ms:5000}")
  public void runScheduled() {
    reloadIfChanged();
  }

  /** Returns true when new limits were applied. */
  public synchronized boolean reloadIfChanged() {
    if (!Files.isRegularFile(file)) {
      log.warn("Risk limits file missing path={}", file);
      return false;
    }
    try {
      FileTime modified = Files.getLastModifiedTime(file);
      if (modified.equals(lastLoaded)) {
        return false;
      }
      RiskLimitConfig next = objectMapper.readValue(file.toFile(), RiskLimitConfig.class);
      holder.reconfigure(next);
      lastLoaded = modified;
      log.info("Risk limits reloaded path={} modifiedAt={}", file, modified);
      return true;
    } catch (IOException ex) {
      log.warn("Risk limits file rejected path={} error={}", file, ex.getMessage());
      return false;
    }
  }
}
