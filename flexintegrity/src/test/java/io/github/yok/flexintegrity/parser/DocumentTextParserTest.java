package io.github.yok.flexintegrity.parser;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;
import io.github.yok.flexintegrity.model.CellValue;
import io.github.yok.flexintegrity.model.Source;
import io.github.yok.flexintegrity.model.Table;
import java.io.ByteArrayOutputStream;
import java.nio.charset.StandardCharsets;
import java.util.List;
import org.apache.pdfbox.pdmodel.PDDocument;
import org.apache.pdfbox.pdmodel.PDPage;
import org.apache.pdfbox.pdmodel.PDPageContentStream;
import org.apache.pdfbox.pdmodel.font.PDType1Font;
import org.junit.jupiter.api.Test;

class DocumentTextParserTest {

    private final DocumentTextParser parser = new DocumentTextParser();

    @Test
    void parse_正常ケース_2ページのPDF_改行で連結された1行1列のテーブルが返ること() throws Exception {
        Table table = parser.parse(Source.ofFile("doc.pdf", pdf("page1", "page2")));

        assertEquals(List.of(DocumentTextParser.COLUMN_NAME), table.getColumns());
        assertEquals(1, table.getRowCount());
        assertEquals(CellValue.ofString("page1\npage2"),
                table.getValue(0, DocumentTextParser.COLUMN_NAME));
    }

    @Test
    void parse_正常ケース_テキストファイル_全文が1セルに格納されること() throws Exception {
        Source source =
                Source.ofFile("notes.txt", "page1\npage2\n".getBytes(StandardCharsets.UTF_8));

        Table table = parser.parse(source);

        assertEquals(1, table.getRowCount());
        assertEquals(CellValue.ofString("page1\npage2"), table.getValue(0, "Extracted Text"));
    }

    @Test
    void parse_正常ケース_種別指定で名前なしのテキスト_テキストとして1セルに格納されること()
            throws Exception {
        Source source = Source.ofKind(SourceKind.DOCUMENT_TEXT,
                "page1\npage2".getBytes(StandardCharsets.UTF_8), null);

        Table table = parser.parse(source);

        assertEquals(List.of(DocumentTextParser.COLUMN_NAME), table.getColumns());
        assertEquals(1, table.getRowCount());
        assertEquals(CellValue.ofString("page1\npage2"), table.getValue(0, "Extracted Text"));
    }

    @Test
    void parse_正常ケース_種別指定で名前なしのPDF_署名からPDFとして読まれること() throws Exception {
        Source source = Source.ofKind(SourceKind.DOCUMENT_TEXT, pdf("page1", "page2"), "upload-1");

        Table table = parser.parse(source);

        assertEquals(CellValue.ofString("page1\npage2"), table.getValue(0, "Extracted Text"));
    }

    @Test
    void parse_異常ケース_種別指定で不正なUTF8_SourceFormatExceptionが送出されること() {
        Source source = Source.ofKind(SourceKind.DOCUMENT_TEXT,
                new byte[] {(byte) 0xC3, (byte) 0x28}, "upload-2");

        SourceFormatException ex =
                assertThrows(SourceFormatException.class, () -> parser.parse(source));
        assertEquals(SourceKind.DOCUMENT_TEXT, ex.getKind());
        assertEquals("upload-2", ex.getSourceName());
    }

    @Test
    void parse_正常ケース_ページなしのPDF_空文字列のセルが返ること() throws Exception {
        Table table = parser.parse(Source.ofFile("blank.pdf", pdf()));

        assertEquals(1, table.getRowCount());
        assertEquals(CellValue.ofString(""), table.getValue(0, "Extracted Text"));
    }

    @Test
    void parse_異常ケース_壊れたPDF_SourceFormatExceptionが送出されること() {
        Source source = Source.ofFile("broken.pdf",
                "this is not a pdf".getBytes(StandardCharsets.UTF_8));

        SourceFormatException ex =
                assertThrows(SourceFormatException.class, () -> parser.parse(source));
        assertEquals(SourceKind.DOCUMENT_TEXT, ex.getKind());
    }

    /**
     * Builds a PDF with one page per given text.
     */
    static byte[] pdf(String... pages) throws Exception {
        try (PDDocument document = new PDDocument()) {
            for (String text : pages) {
                PDPage page = new PDPage();
                document.addPage(page);
                try (PDPageContentStream content = new PDPageContentStream(document, page)) {
                    content.beginText();
                    content.setFont(PDType1Font.HELVETICA, 12);
                    content.newLineAtOffset(72, 700);
                    content.showText(text);
                    content.endText();
                }
            }
            ByteArrayOutputStream out = new ByteArrayOutputStream();
            document.save(out);
            return out.toByteArray();
        }
    }
}
