/*
 * どこで: Importer 取込エンジン
 * 何を: CSV ヘッダーを検証し、1 レコードを ProductRow か行エラーに変換する
 * なぜ: ヘッダー不備はデータ行を読む前に失敗させ、行単位の不備はバッチを止めずに記録するため
 */
package com.example.importer.engine;

import com.example.importer.model.ProductRow;
import com.example.importer.model.RowError;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Set;
import org.apache.commons.csv.CSVRecord;

final class CsvColumns {

  static final String SKU = "sku";
  static final String NAME = "name";
  static final String DESCRIPTION = "description";
  static final String ACTIVE = "active";

  private static final List<String> REQUIRED = List.of(SKU, NAME);
  private static final Set<String> KNOWN = Set.of(SKU, NAME, DESCRIPTION, ACTIVE);
  private static final Set<String> TRUE_TOKENS = Set.of("true", "yes", "1", "t", "y");
  private static final Set<String> FALSE_TOKENS = Set.of("false", "no", "0", "f", "n");
  private static final char BOM = '\uFEFF';

  private final Map<String, Integer> indexes;
  private final List<String> unknownHeaders;

  private CsvColumns(Map<String, Integer> indexes, List<String> unknownHeaders) {
    this.indexes = indexes;
    this.unknownHeaders = unknownHeaders;
  }

  /**
   * ヘッダー名は前後空白を除き大文字小文字を無視して照合する。
   *
   * @throws CsvHeaderValidationException sku / name が無い場合
   */
  static CsvColumns resolve(List<String> headerNames) {
    final Map<String, Integer> indexes = new HashMap<>();
    final List<String> unknown = new ArrayList<>();
    for (int i = 0; i < headerNames.size(); i++) {
      final String normalized = normalize(headerNames.get(i), i == 0);
      if (normalized.isEmpty()) {
        continue;
      }
      if (KNOWN.contains(normalized)) {
        indexes.putIfAbsent(normalized, i);
      } else {
        unknown.add(headerNames.get(i).trim());
      }
    }
    final List<String> missing = new ArrayList<>();
    for (String required : REQUIRED) {
      if (!indexes.containsKey(required)) {
        missing.add(required);
      }
    }
    if (!missing.isEmpty()) {
      throw new CsvHeaderValidationException(missing);
    }
    return new CsvColumns(indexes, List.copyOf(unknown));
  }

  List<String> unknownHeaders() {
    return unknownHeaders;
  }

  /** rowNumber はヘッダーを除いた 1 始まりの行番号。 */
  ParsedRow parse(CSVRecord record, long rowNumber) {
    final String sku = value(record, SKU);
    if (sku == null) {
      return ParsedRow.error(new RowError(rowNumber, "Row " + rowNumber + ": sku is required"));
    }
    final String name = value(record, NAME);
    if (name == null) {
      return ParsedRow.error(new RowError(rowNumber, "Row " + rowNumber + ": name is required"));
    }
    final String rawActive = value(record, ACTIVE);
    final Boolean active = rawActive == null ? Boolean.TRUE : parseActive(rawActive);
    if (active == null) {
      return ParsedRow.error(
          new RowError(
              rowNumber,
              "Row " + rowNumber + ": invalid active value '" + rawActive + "'"));
    }
    return ParsedRow.row(new ProductRow(sku, name, value(record, DESCRIPTION), active));
  }

  static Boolean parseActive(String raw) {
    final String token = raw.trim().toLowerCase(Locale.ROOT);
    if (TRUE_TOKENS.contains(token)) {
      return Boolean.TRUE;
    }
    if (FALSE_TOKENS.contains(token)) {
      return Boolean.FALSE;
    }
    return null;
  }

  private String value(CSVRecord record, String column) {
    final Integer index = indexes.get(column);
    if (index == null || index >= record.size()) {
      return null;
    }
    final String value = record.get(index).trim();
    return value.isEmpty() ? null : value;
  }

  private static String normalize(String header, boolean first) {
    if (header == null) {
      return "";
    }
    String value = header;
    if (first && !value.isEmpty() && value.charAt(0) == BOM) {
      value = value.substring(1);
    }
    return value.trim().toLowerCase(Locale.ROOT);
  }

  record ParsedRow(ProductRow row, RowError error) {

    static ParsedRow row(ProductRow row) {
      return new ParsedRow(row, null);
    }

    static ParsedRow error(RowError error) {
      return new ParsedRow(null, error);
    }

    boolean isValid() {
      return row != null;
    }
  }
}
