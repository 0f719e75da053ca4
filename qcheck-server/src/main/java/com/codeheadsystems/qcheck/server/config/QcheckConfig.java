package com.codeheadsystems.qcheck.server.config;

import com.codeheadsystems.qcheck.server.check.SheetRule;
import java.nio.file.Path;
import java.time.Duration;
import java.time.ZoneId;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Set;

/**
 * Runtime configuration for the check/upload pipeline.
 * Built once at startup and handed to every component explicitly.
 *
 * @param sessionTtl               how long a session stays valid after login
 * @param sessionDirectory         where session records are written
 * @param uploadRoot               root of the proposal-partitioned file store
 * @param acceptedSignatures       allowed file extensions mapped to the content signatures
 *                                 each may legitimately carry; iteration order is the order
 *                                 extensions are listed to users
 * @param sheetRules               per-sheet rules for the baseline workbook checker
 * @param externalSheetUrlTemplate export URL for external sheets, {@code {0}} is the sheet name
 * @param zoneId                   zone used for upload timestamps
 */
public record QcheckConfig(
    Duration sessionTtl,
    Path sessionDirectory,
    Path uploadRoot,
    Map<String, Set<String>> acceptedSignatures,
    List<SheetRule> sheetRules,
    String externalSheetUrlTemplate,
    ZoneId zoneId) {

  public static final Duration DEFAULT_SESSION_TTL = Duration.ofHours(3);

  /**
   * Extensions and signatures for current and legacy Excel workbooks.
   */
  public static final Map<String, Set<String>> EXCEL_SIGNATURES = excelSignatures();

  public static final String DEFAULT_EXTERNAL_SHEET_URL =
      "https://docs.google.com/spreadsheets/d/{0}/export?format=xlsx";

  public QcheckConfig {
    if (sessionTtl == null || sessionTtl.isNegative() || sessionTtl.isZero()) {
      throw new IllegalArgumentException("sessionTtl must be positive");
    }
    if (sessionDirectory == null || uploadRoot == null) {
      throw new IllegalArgumentException("sessionDirectory and uploadRoot are required");
    }
    if (acceptedSignatures == null || acceptedSignatures.isEmpty()) {
      throw new IllegalArgumentException("At least one accepted extension is required");
    }
    Map<String, Set<String>> copy = new LinkedHashMap<>();
    acceptedSignatures.forEach((ext, sigs) ->
        copy.put(ext.toLowerCase(Locale.ROOT), Collections.unmodifiableSet(new LinkedHashSet<>(sigs))));
    acceptedSignatures = Collections.unmodifiableMap(copy);
    sheetRules = sheetRules == null ? List.of() : List.copyOf(sheetRules);
    externalSheetUrlTemplate = externalSheetUrlTemplate == null
        ? DEFAULT_EXTERNAL_SHEET_URL : externalSheetUrlTemplate;
    zoneId = zoneId == null ? ZoneId.systemDefault() : zoneId;
  }

  /**
   * Creates a configuration rooted in a scratch directory, with the default TTL,
   * Excel signatures and no sheet rules.
   *
   * @param root a writable directory
   * @return the config
   */
  public static QcheckConfig forTesting(Path root) {
    return new QcheckConfig(DEFAULT_SESSION_TTL, root.resolve("sessions"), root.resolve("uploads"),
        EXCEL_SIGNATURES, List.of(), DEFAULT_EXTERNAL_SHEET_URL, ZoneId.of("UTC"));
  }

  /**
   * The allowed file extensions, in display order.
   *
   * @return the extensions
   */
  public List<String> allowedExtensions() {
    return List.copyOf(acceptedSignatures.keySet());
  }

  private static Map<String, Set<String>> excelSignatures() {
    Map<String, Set<String>> map = new LinkedHashMap<>();
    map.put("xlsx", new LinkedHashSet<>(List.of("OOXML")));
    map.put("xls", new LinkedHashSet<>(List.of("OLE2", "BIFF2", "BIFF3", "BIFF4")));
    return Collections.unmodifiableMap(map);
  }
}
