package com.example.importer.engine;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import com.example.importer.model.ProductRow;
import java.io.IOException;
import java.io.StringReader;
import java.util.List;
import org.apache.commons.csv.CSVParser;
import org.apache.commons.csv.CSVRecord;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.ValueSource;

class CsvColumnsTest {

  @Test
  void headersMatchIgnoringCaseWhitespaceAndBom() {
    final CsvColumns columns =
        CsvColumns.resolve(List.of("\uFEFF SKU ", "Name", "Description", "ACTIVE", "color"));

    assertThat(columns.unknownHeaders()).containsExactly("color");
  }

  @Test
  void missingRequiredHeadersAreReportedTogether() {
    assertThatThrownBy(() -> CsvColumns.resolve(List.of("description", "active")))
        .isInstanceOf(CsvHeaderValidationException.class)
        .hasMessage("Missing required columns: sku, name")
        .satisfies(
            ex ->
                assertThat(((CsvHeaderValidationException) ex).missingHeaders())
                    .containsExactly("sku", "name"));
  }

  @Test
  void parsesRowWithDefaultActive() throws IOException {
    final List<CSVRecord> records = records("sku,name,description\n A1 , Widget ,\n");
    final CsvColumns columns = CsvColumns.resolve(List.of("sku", "name", "description"));

    final CsvColumns.ParsedRow parsed = columns.parse(records.get(0), 1);

    assertThat(parsed.isValid()).isTrue();
    assertThat(parsed.row()).isEqualTo(new ProductRow("A1", "Widget", null, true));
  }

  @Test
  void rowErrorsCarryRowNumberAndReason() throws IOException {
    final List<CSVRecord> records = records("sku,name,active\n,Widget,yes\nB2,,no\nC3,Gadget,maybe\n");
    final CsvColumns columns = CsvColumns.resolve(List.of("sku", "name", "active"));

    assertThat(columns.parse(records.get(0), 1).error().message()).isEqualTo("Row 1: sku is required");
    assertThat(columns.parse(records.get(1), 2).error().message()).isEqualTo("Row 2: name is required");
    assertThat(columns.parse(records.get(2), 3).error().message())
        .isEqualTo("Row 3: invalid active value 'maybe'");
  }

  @ParameterizedTest
  @ValueSource(strings = {"true", "YES", "1", "t", "Y"})
  void truthyTokens(String token) {
    assertThat(CsvColumns.parseActive(token)).isTrue();
  }

  @ParameterizedTest
  @ValueSource(strings = {"false", "No", "0", "F", "n"})
  void falsyTokens(String token) {
    assertThat(CsvColumns.parseActive(token)).isFalse();
  }

  @Test
  void unknownTokenIsNull() {
    assertThat(CsvColumns.parseActive("enabled")).isNull();
  }

  private static List<CSVRecord> records(String csv) throws IOException {
    try (CSVParser parser = CsvImportEngine.CSV_FORMAT.parse(new StringReader(csv))) {
      return parser.getRecords();
    }
  }
}
