package com.example.skillgap.courses.util;

import com.example.skillgap.courses.model.SkillCategory;
import com.example.skillgap.courses.model.SkillQuery;

import java.nio.charset.StandardCharsets;
import java.security.MessageDigest;
import java.security.NoSuchAlgorithmException;
import java.util.HexFormat;
import java.util.Locale;

/**
 * Cache keys for course availability lookups.
 * <p>
 * The key hashes the exact text sent to the embedding model, so two skills share a cache entry only
 * when they would produce the same query vector under the same threshold and platform.
 */
public final class CacheKeyUtils {

  public static final int KEY_LENGTH = 16;
  private static final String SEPARATOR = "|";

  private CacheKeyUtils() {}

  /**
   * Text embedded for a skill. SKILL queries lean towards course/project/certificate wording,
   * FIELD queries towards specialization/degree wording.
   */
  public static String embeddingText(SkillQuery skill, SkillCategory category) {
    String name = safe(skill.getSkillName());
    String description = safe(skill.getDescription());
    SkillCategory resolved = category == null ? SkillCategory.DEFAULT : category;
    return switch (resolved) {
      case SKILL -> name + " course project certificate. " + description;
      case FIELD -> name + " specialization degree. " + description;
      default -> name + " " + description;
    };
  }

  public static String buildKey(SkillQuery skill, SkillCategory category, double threshold, String platform) {
    SkillCategory resolved = category == null ? SkillCategory.DEFAULT : category;
    String material = String.join(SEPARATOR,
        embeddingText(skill, resolved),
        resolved.name(),
        String.format(Locale.ROOT, "%.2f", threshold),
        safe(platform));
    return md5Hex(material).substring(0, KEY_LENGTH);
  }

  private static String md5Hex(String material) {
    try {
      MessageDigest md = MessageDigest.getInstance("MD5");
      return HexFormat.of().formatHex(md.digest(material.getBytes(StandardCharsets.UTF_8)));
    } catch (NoSuchAlgorithmException e) {
      throw new IllegalStateException("MD5 digest unavailable", e);
    }
  }

  private static String safe(String s) {
    return s == null ? "" : s;
  }
}
