package io.github.yok.flexintegrity.parser;

import io.github.yok.flexintegrity.model.CellValue;
import io.github.yok.flexintegrity.model.Source;
import io.github.yok.flexintegrity.model.Table;
import java.io.IOException;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import lombok.extern.slf4j.Slf4j;
import org.apache.commons.lang3.StringUtils;
import org.apache.pdfbox.pdmodel.PDDocument;
import org.apache.pdfbox.text.PDFTextStripper;
import org.apache.poi.poifs.filesystem.FileMagic;

/**
 * Implementation of {@link SourceParser} that extracts the full text of a document.
 *
 * <p>
 * A payload is a PDF when it starts with the PDF signature or the source is named
 * {@code .pdf}; PDFs are read with Apache PDFBox page by page. Anything else is decoded as strict
 * UTF-8 text and forms a single page. Trailing line breaks of each page are removed and the pages
 * are joined with {@code \n}.
 * The result is a single-row, single-column table whose column is {@value #COLUMN_NAME}. The
 * document's own layout is not reconstructed.
 * </p>
 *
 * @author Yasuharu.Okawauchi
 */
@Slf4j
public class DocumentTextParser implements SourceParser {

    /**
     * Name of the only column produced by this parser.
     */
    public static final String COLUMN_NAME = "Extracted Text";

    private static final String PAGE_SEPARATOR = "\n";

    /**
     * {@inheritDoc}
     */
    @Override
    public Table parse(Source source) throws SourceFormatException {
        String name = source.getLabel();
        List<String> pages;
        byte[] payload = source.getPayload();
        if (isPdf(source, payload)) {
            pages = extractPdfPages(payload, name);
        } else {
            pages = List.of(ColumnNames.decodeUtf8(payload, SourceKind.DOCUMENT_TEXT, name));
        }

        List<String> trimmed = new ArrayList<>(pages.size());
        pages.forEach(page -> trimmed.add(StringUtils.stripEnd(page, "\r\n")));
        String text = String.join(PAGE_SEPARATOR, trimmed);

        Table table = new Table(name);
        table.addRow(Map.of(COLUMN_NAME, CellValue.ofString(text)));
        log.debug("Extracted text from [{}]: pages={}, chars={}", name, pages.size(),
                text.length());
        return table;
    }

    // Explicitly tagged sources may have no file name, so the signature decides first
    private static boolean isPdf(Source source, byte[] payload) {
        return FileMagic.valueOf(payload) == FileMagic.PDF || "pdf".equals(source.getExtension());
    }

    private static List<String> extractPdfPages(byte[] payload, String name)
            throws SourceFormatException {
        try (PDDocument document = PDDocument.load(payload)) {
            PDFTextStripper stripper = new PDFTextStripper();
            stripper.setLineSeparator("\n");
            List<String> pages = new ArrayList<>(document.getNumberOfPages());
            for (int p = 1; p <= document.getNumberOfPages(); p++) {
                stripper.setStartPage(p);
                stripper.setEndPage(p);
                pages.add(stripper.getText(document));
            }
            return pages;
        } catch (IOException e) {
            throw new SourceFormatException(SourceKind.DOCUMENT_TEXT, name,
                    "unreadable PDF: " + e.getMessage(), e);
        }
    }
}
