package com.tradeingest.domain.model;

import java.util.List;
import java.util.Map;
import lombok.Builder;
import lombok.Getter;

/** Output of the raw parser: header row, every data row as a header-keyed map, and size facts. */
@Getter
@Builder
public class ParsedCsv {

    private final List<String> headers;
    private final List<Map<String, String>> rows;
    private final long fileSize;
    private final int sampleSize;

    public int getRowCount() {
        return rows.size();
    }

    public List<Map<String, String>> getSampleRows() {
        return rows.subList(0, Math.min(sampleSize, rows.size()));
    }
}
