package net.imagecraft.application.batch;

import com.fasterxml.jackson.databind.MappingIterator;
import com.fasterxml.jackson.dataformat.csv.CsvMapper;
import com.fasterxml.jackson.dataformat.csv.CsvParser;
import java.io.IOException;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import lombok.extern.slf4j.Slf4j;
import net.imagecraft.exception.ImageValidationException;
import net.imagecraft.model.batch.GenerationUnit;
import net.imagecraft.model.image.OperationKind;
import net.imagecraft.model.image.PixelDimensions;
import net.imagecraft.support.adapter.GenerationSizes;
import org.springframework.stereotype.Component;

/**
 * Parses {@code prompt,style,size,model} rows into batch units.
 *
 * <p>The header row is optional, fields may be quoted, and only {@code prompt} is required.
 * Missing style means {@code none}, missing size means {@code 1024x1024}, and a missing model
 * keeps the default fallback order.</p>
 */
@Slf4j
@Component
public class CsvBatchParser {

    private static final String HEADER_FIRST_CELL = "prompt";

    private final CsvMapper csvMapper = CsvMapper.builder()
        .enable(CsvParser.Feature.WRAP_AS_ARRAY)
        .enable(CsvParser.Feature.TRIM_SPACES)
        .enable(CsvParser.Feature.SKIP_EMPTY_LINES)
        .build();

    /**
     * @throws ImageValidationException naming the 1-based line of the first invalid row
     */
    public List<GenerationUnit> parse(String csv) {
        if (csv == null || csv.isBlank()) {
            throw new ImageValidationException("CSV batch is empty");
        }
        List<GenerationUnit> units = new ArrayList<>();
        try (MappingIterator<String[]> rows = csvMapper.readerFor(String[].class).readValues(csv)) {
            int line = 0;
            while (rows.hasNextValue()) {
                String[] row = rows.nextValue();
                line++;
                if (line == 1 && isHeader(row)) {
                    continue;
                }
                if (isBlankRow(row)) {
                    continue;
                }
                units.add(toUnit(row, line));
            }
        } catch (IOException e) {
            throw new ImageValidationException("Malformed CSV batch: " + e.getMessage(), e);
        }
        if (units.isEmpty()) {
            throw new ImageValidationException("CSV batch contains no rows");
        }
        log.debug("Parsed {} batch units from CSV", units.size());
        return units;
    }

    private static GenerationUnit toUnit(String[] row, int line) {
        String prompt = cell(row, 0);
        if (prompt == null) {
            throw new ImageValidationException("CSV line " + line + ": prompt is required");
        }
        String style = cell(row, 1);
        String sizeLabel = cell(row, 2);
        PixelDimensions size;
        try {
            size = sizeLabel == null ? GenerationSizes.SQUARE : GenerationSizes.requireValid(sizeLabel);
        } catch (ImageValidationException e) {
            throw new ImageValidationException("CSV line " + line + ": " + e.getMessage(), e);
        }
        return new GenerationUnit(prompt, style == null ? "none" : style, size, cell(row, 3),
            false, null, null, OperationKind.BATCH_ITEM);
    }

    private static boolean isHeader(String[] row) {
        String first = cell(row, 0);
        return first != null && first.toLowerCase(Locale.ROOT).equals(HEADER_FIRST_CELL);
    }

    private static boolean isBlankRow(String[] row) {
        for (String value : row) {
            if (value != null && !value.isBlank()) {
                return false;
            }
        }
        return true;
    }

    private static String cell(String[] row, int index) {
        if (index >= row.length || row[index] == null || row[index].isBlank()) {
            return null;
        }
        return row[index].trim();
    }
}
