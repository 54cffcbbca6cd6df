package com.flamingo.ai.filingqa.domain.model;

import com.flamingo.ai.filingqa.domain.enums.FilingType;
import java.time.LocalDate;
import java.util.LinkedHashMap;
import java.util.Map;
import lombok.Builder;

/**
 * Citation-grade metadata attached to every chunk.
 *
 * @param ticker upper-case company ticker
 * @param filingType SEC form the chunk was taken from
 * @param filingDate date the filing was made
 * @param sectionType section label assigned by the document processor, e.g. "risk_factors"
 * @param qualityScore processor-assigned quality in [0,1]
 * @param companyName optional display name
 * @param sector optional industry sector
 */
@Builder(toBuilder = true)
public record ChunkMetadata(
    String ticker,
    FilingType filingType,
    LocalDate filingDate,
    String sectionType,
    double qualityScore,
    String companyName,
    String sector) {

  public static final String FIELD_TICKER = "ticker";
  public static final String FIELD_FILING_TYPE = "filing_type";
  public static final String FIELD_FILING_DATE = "filing_date";
  public static final String FIELD_FILING_YEAR = "filing_year";
  public static final String FIELD_SECTION_TYPE = "section_type";
  public static final String FIELD_SECTOR = "sector";

  /**
   * Returns the exact-match fields this chunk is indexed under. Absent optional fields are
   * omitted.
   */
  public Map<String, String> indexFields() {
    Map<String, String> fields = new LinkedHashMap<>();
    fields.put(FIELD_TICKER, ticker);
    fields.put(FIELD_FILING_TYPE, filingType.getCode());
    fields.put(FIELD_FILING_DATE, filingDate.toString());
    fields.put(FIELD_FILING_YEAR, String.valueOf(filingDate.getYear()));
    if (sectionType != null && !sectionType.isBlank()) {
      fields.put(FIELD_SECTION_TYPE, sectionType);
    }
    if (sector != null && !sector.isBlank()) {
      fields.put(FIELD_SECTOR, sector);
    }
    return fields;
  }
}
