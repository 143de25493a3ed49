package com.statementprocessor.tokenizer;

import com.fasterxml.jackson.databind.ObjectReader;
import com.fasterxml.jackson.dataformat.csv.CsvMapper;
import com.fasterxml.jackson.dataformat.csv.CsvSchema;
import java.io.IOException;
import java.util.ArrayList;
import java.util.List;
import org.springframework.stereotype.Component;

/**
 * Splits one statement line into fields, honouring double-quoted fields with embedded commas.
 * Lines Jackson cannot read (unbalanced quotes) fall back to a plain comma split so that a single
 * broken line never stops tokenization.
 */
@Component
public class CsvLineSplitter {

    private static final CsvMapper CSV_MAPPER = new CsvMapper();

    private final ObjectReader lineReader =
            CSV_MAPPER.readerForListOf(String.class).with(CsvSchema.emptySchema());

    public List<String> split(String line) {
        if (line == null || line.isBlank()) {
            return List.of();
        }
        try {
            List<String> fields = lineReader.readValue(line);
            return fields != null ? fields : List.of();
        } catch (IOException e) {
            return naiveSplit(line);
        }
    }

    private List<String> naiveSplit(String line) {
        List<String> fields = new ArrayList<>();
        for (String part : line.split(",", -1)) {
            fields.add(part.replace("\"", ""));
        }
        return fields;
    }
}
