package com.statementprocessor.tokenizer;

import com.statementprocessor.config.StatementProcessingConfig;
import com.statementprocessor.domain.enums.RowType;
import com.statementprocessor.domain.enums.SectionKind;
import com.statementprocessor.domain.model.Section;
import com.statementprocessor.domain.model.SectionRow;
import com.statementprocessor.domain.model.StatementDocument;
import com.statementprocessor.exception.StatementFormatException;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.regex.Pattern;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Component;

/**
 * Splits a raw statement into labeled sections.
 *
 * <p>Statement exports put the section name in column 1 and a row marker (Header, Data, Total,
 * SubTotal, Notes) in column 2. A new section starts on every Header row and whenever the section
 * name changes. Its kind comes from the first matching {@link SectionRule}; anything unmatched is kept
 * as an UNKNOWN section so that no line of the document is lost.
 *
 * <p>Row typing inside a section:
 * <ul>
 *   <li>Header -> HEADER (its remaining columns become the section's column names)</li>
 *   <li>Total / SubTotal, or a Data row whose leading label cell is an aggregate label -> TOTAL</li>
 *   <li>Data rows with a Lot / ClosedLot discriminator -> DETAIL</li>
 *   <li>Notes -> NOTES, empty lines -> BLANK, everything else -> DATA</li>
 * </ul>
 */
@Component
public class SectionTokenizer {

    private static final Logger log = LoggerFactory.getLogger(SectionTokenizer.class);

    private static final String BOM = "\uFEFF";
    private static final Pattern LINE_BREAK = Pattern.compile("\\R");
    private static final Pattern AGGREGATE_CELL = Pattern.compile("(?i)^(sub)?total(\\s.*)?$");
    private static final Set<String> AGGREGATE_LABELS = Set.of("base currency summary");
    private static final Set<String> DETAIL_DISCRIMINATORS = Set.of("lot", "closedlot", "executionlevel");
    private static final String DISCRIMINATOR_COLUMN = "DataDiscriminator";
    private static final String CURRENCY_COLUMN = "Currency";

    private final SectionRules rules;
    private final CsvLineSplitter splitter;

    @Autowired
    public SectionTokenizer(CsvLineSplitter splitter, StatementProcessingConfig config) {
        this(rulesFor(config), splitter);
    }

    public SectionTokenizer(SectionRules rules, CsvLineSplitter splitter) {
        this.rules = rules;
        this.splitter = splitter;
    }

    /**
     * Tokenizes the whole document into sections covering every line.
     *
     * @throws StatementFormatException if no section header matches any rule
     */
    public List<Section> tokenize(StatementDocument document) {
        String text = document.getRawText() != null ? document.getRawText() : "";
        if (text.startsWith(BOM)) {
            text = text.substring(1);
        }
        String[] lines = LINE_BREAK.split(text, -1);
        int lineCount = lines.length;
        // A trailing newline produces one empty element that is not a real line
        if (lineCount > 0 && lines[lineCount - 1].isEmpty()) {
            lineCount--;
        }

        List<Section> sections = new ArrayList<>();
        SectionBuilder current = null;

        for (int i = 0; i < lineCount; i++) {
            int lineNumber = i + 1;
            List<String> fields = splitter.split(stripBom(lines[i]));

            if (fields.isEmpty() || fields.stream().allMatch(String::isBlank)) {
                if (current == null) {
                    current = new SectionBuilder(sections.size(), SectionKind.UNKNOWN, "", null, lineNumber, List.of());
                }
                current.add(new SectionRow(lineNumber, RowType.BLANK, "", List.of(), current.columns));
                continue;
            }

            String sectionName = fields.get(0).trim();
            String marker = fields.size() > 1 ? fields.get(1).trim() : "";
            boolean headerRow = "Header".equalsIgnoreCase(marker);
            boolean nameChanged = current == null || !sectionName.equals(current.name);

            if (headerRow || nameChanged) {
                if (current != null) {
                    sections.add(current.build(lineNumber - 1));
                }
                Optional<SectionRule> rule = rules.match(sectionName);
                List<String> columns = headerRow ? List.copyOf(tail(fields)) : List.of();
                current = new SectionBuilder(
                        sections.size(),
                        rule.map(SectionRule::kind).orElse(SectionKind.UNKNOWN),
                        sectionName,
                        rule.map(SectionRule::name).orElse(null),
                        lineNumber,
                        columns);
                if (headerRow) {
                    current.add(new SectionRow(lineNumber, RowType.HEADER, marker, columns, columns));
                    continue;
                }
            }

            List<String> values = tail(fields);
            current.add(new SectionRow(lineNumber, classify(marker, values, current.columns), marker, values, current.columns));
        }

        if (current != null) {
            sections.add(current.build(lineCount));
        }

        long recognized = sections.stream().filter(Section::isRecognized).count();
        if (recognized == 0) {
            log.warn("No recognizable sections in document {} ({} lines)", document.getDocumentId(), lineCount);
            throw new StatementFormatException(
                    "Statement format unrecognized: none of " + rules.asList().size()
                            + " section rules matched any header");
        }

        log.debug(
                "Tokenized document {}: {} sections ({} recognized) over {} lines",
                document.getDocumentId(),
                sections.size(),
                recognized,
                lineCount);
        return sections;
    }

    /** Default rules followed by the configured header aliases, in configuration order. */
    private static SectionRules rulesFor(StatementProcessingConfig config) {
        SectionRules rules = SectionRules.defaults();
        for (Map.Entry<String, SectionKind> alias : config.getSectionAliases().entrySet()) {
            rules = rules.with(SectionRule.prefix("alias:" + alias.getKey(), alias.getValue(), alias.getKey()));
        }
        return rules;
    }

    private RowType classify(String marker, List<String> values, List<String> columns) {
        if (marker.equalsIgnoreCase("Total") || marker.equalsIgnoreCase("SubTotal")) {
            return RowType.TOTAL;
        }
        if (marker.equalsIgnoreCase("Notes")) {
            return RowType.NOTES;
        }
        if (values.stream().allMatch(String::isBlank)) {
            return RowType.BLANK;
        }
        if (isDetail(values, columns)) {
            return RowType.DETAIL;
        }
        if (isAggregate(values, columns)) {
            return RowType.TOTAL;
        }
        return RowType.DATA;
    }

    private boolean isDetail(List<String> values, List<String> columns) {
        for (int i = 0; i < columns.size() && i < values.size(); i++) {
            if (columns.get(i).trim().equalsIgnoreCase(DISCRIMINATOR_COLUMN)) {
                return DETAIL_DISCRIMINATORS.contains(values.get(i).trim().toLowerCase());
            }
        }
        return false;
    }

    /**
     * Only the leading label cell (the first one after the discriminator) and the currency cell can
     * mark an aggregate. Descriptions or symbols that happen to start with "Total" stay data.
     */
    private boolean isAggregate(List<String> values, List<String> columns) {
        int leading = 0;
        if (!columns.isEmpty() && columns.get(0).trim().equalsIgnoreCase(DISCRIMINATOR_COLUMN)) {
            leading = 1;
        }
        if (leading < values.size() && isAggregateLabel(values.get(leading).trim())) {
            return true;
        }
        int currency = indexOf(columns, CURRENCY_COLUMN);
        return currency >= 0
                && currency < values.size()
                && AGGREGATE_LABELS.contains(values.get(currency).trim().toLowerCase());
    }

    private boolean isAggregateLabel(String cell) {
        return AGGREGATE_CELL.matcher(cell).matches() || AGGREGATE_LABELS.contains(cell.toLowerCase());
    }

    private static int indexOf(List<String> columns, String name) {
        for (int i = 0; i < columns.size(); i++) {
            if (columns.get(i).trim().equalsIgnoreCase(name)) {
                return i;
            }
        }
        return -1;
    }

    private static List<String> tail(List<String> fields) {
        return fields.size() > 2 ? fields.subList(2, fields.size()) : List.of();
    }

    private static String stripBom(String line) {
        return line.startsWith(BOM) ? line.substring(1) : line;
    }

    private static final class SectionBuilder {

        private final int index;
        private final SectionKind kind;
        private final String name;
        private final String ruleName;
        private final int startLine;
        private final List<String> columns;
        private final List<SectionRow> rows = new ArrayList<>();

        private SectionBuilder(
                int index, SectionKind kind, String name, String ruleName, int startLine, List<String> columns) {
            this.index = index;
            this.kind = kind;
            this.name = name;
            this.ruleName = ruleName;
            this.startLine = startLine;
            this.columns = columns;
        }

        private void add(SectionRow row) {
            rows.add(row);
        }

        private Section build(int endLine) {
            return Section.builder()
                    .index(index)
                    .kind(kind)
                    .name(name)
                    .ruleName(ruleName)
                    .startLine(startLine)
                    .endLine(endLine)
                    .columns(columns)
                    .rows(List.copyOf(rows))
                    .build();
        }
    }
}
