package com.github.spud.intake.infrastructure.storage;

import com.github.spud.intake.application.config.IntakeProperties;
import com.github.spud.intake.domain.intake.IntakeRecordStore;
import com.github.spud.intake.domain.intake.IntakeSnapshot;
import com.github.spud.intake.domain.intake.QuoteSubmission;
import com.github.spud.intake.util.JsonUtils;
import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.nio.file.StandardOpenOption;
import java.util.Objects;
import lombok.Getter;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Component;

/**
 * 以格式化 JSON 文件保存采集记录与报价提交，每次写入覆盖同名文件
 */
@Slf4j
@Component
public class JsonFileIntakeRecordStore implements IntakeRecordStore {

  @Getter
  private final Path directory;

  @Autowired
  public JsonFileIntakeRecordStore(IntakeProperties properties) {
    this(Paths.get(properties.getStorage().getDirectory()));
  }

  JsonFileIntakeRecordStore(Path directory) {
    this.directory = directory;
    log.info("Intake records stored under {}", directory.toAbsolutePath());
  }

  @Override
  public boolean saveSnapshot(IntakeSnapshot snapshot) {
    String fileName = snapshot.getInsuranceType().wire() + "_insurance_" + snapshot.getSessionId()
      + "_" + Objects.requireNonNullElse(snapshot.primaryName(), "unknown") + ".json";
    return write(fileName, snapshot);
  }

  @Override
  public boolean saveSubmission(QuoteSubmission submission) {
    String fileName = "SUBMITTED_" + submission.getQuoteRequest().getInsuranceType().wire()
      + "_quote_" + submission.getSessionId() + "_" + submission.getSubmissionTimestamp()
      + ".json";
    return write(fileName, submission);
  }

  private boolean write(String fileName, Object content) {
    Path target = directory.resolve(sanitize(fileName));
    try {
      Files.createDirectories(directory);
      Files.writeString(target, JsonUtils.toPrettyJson(content), StandardCharsets.UTF_8,
        StandardOpenOption.CREATE, StandardOpenOption.TRUNCATE_EXISTING,
        StandardOpenOption.WRITE);
      log.info("Saved intake data to {}", target.getFileName());
      return true;
    } catch (IOException | RuntimeException e) {
      log.error("Failed to save intake data to {}: {}", target.getFileName(), e.getMessage(), e);
      return false;
    }
  }

  /**
   * Spaces become underscores; anything that could leave the directory is dropped
   */
  static String sanitize(String fileName) {
    String cleaned = fileName.trim().replace(' ', '_').replaceAll("[^A-Za-z0-9._-]", "");
    while (cleaned.startsWith(".")) {
      cleaned = cleaned.substring(1);
    }
    return cleaned.isEmpty() ? "record.json" : cleaned;
  }
}
