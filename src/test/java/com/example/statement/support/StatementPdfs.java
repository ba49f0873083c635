package com.example.statement.support;

import org.apache.pdfbox.pdmodel.PDDocument;
import org.apache.pdfbox.pdmodel.PDPage;
import org.apache.pdfbox.pdmodel.PDPageContentStream;
import org.apache.pdfbox.pdmodel.common.PDRectangle;
import org.apache.pdfbox.pdmodel.font.PDType1Font;
import org.apache.pdfbox.pdmodel.font.Standard14Fonts;

import java.io.ByteArrayOutputStream;
import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;

/**
 * Builds small statement PDFs for tests. Each argument is one page; lines are separated by {@code \n}.
 */
public final class StatementPdfs {

    private StatementPdfs() {
    }

    public static Path write(Path target, String... pages) throws IOException {
        Files.write(target, create(pages));
        return target;
    }

    public static byte[] create(String... pages) throws IOException {
        try (PDDocument document = new PDDocument(); ByteArrayOutputStream output = new ByteArrayOutputStream()) {
            PDType1Font font = new PDType1Font(Standard14Fonts.FontName.HELVETICA);
            for (String pageText : pages) {
                PDPage page = new PDPage(PDRectangle.LETTER);
                document.addPage(page);
                if (pageText.isEmpty()) {
                    continue;
                }
                try (PDPageContentStream contentStream = new PDPageContentStream(document, page)) {
                    contentStream.beginText();
                    contentStream.setFont(font, 11);
                    contentStream.setLeading(16f);
                    contentStream.newLineAtOffset(72, 700);
                    for (String line : pageText.split("\n")) {
                        contentStream.showText(line);
                        contentStream.newLine();
                    }
                    contentStream.endText();
                }
            }
            document.save(output);
            return output.toByteArray();
        }
    }
}
