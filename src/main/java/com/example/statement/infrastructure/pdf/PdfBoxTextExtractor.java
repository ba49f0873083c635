package com.example.statement.infrastructure.pdf;

import com.example.statement.domain.model.PageTextExtraction;

import org.apache.pdfbox.Loader;
import org.apache.pdfbox.pdmodel.PDDocument;
import org.apache.pdfbox.text.PDFTextStripper;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.io.IOException;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.stream.IntStream;

/**
 * Infrastructure service that reads plain text from a bounded subset of a PDF's pages.
 * Hides PDFBox from the rest of the application and never lets a read failure escape.
 */
@Service
public class PdfBoxTextExtractor {

    private static final Logger log = LoggerFactory.getLogger(PdfBoxTextExtractor.class);
    static final String PAGE_SEPARATOR = "\n\n";

    /**
     * Extracts the text of every page.
     *
     * @param documentPath PDF on disk
     * @return extraction result, failed when the document cannot be read
     */
    public PageTextExtraction extractText(Path documentPath) {
        return extractText(documentPath, null, null);
    }

    /**
     * Extracts the text of the selected pages and joins them with a blank line.
     * Explicit page indices win over {@code maxPages} when both are given.
     *
     * @param documentPath PDF on disk
     * @param maxPages     number of leading pages to read, {@code null} for all
     * @param pageIndices  zero-based page indices; out-of-range entries are ignored
     * @return extraction result, failed when the document cannot be opened
     */
    public PageTextExtraction extractText(Path documentPath, Integer maxPages, List<Integer> pageIndices) {
        if (documentPath == null) {
            log.warn("Text extraction requested without a document path");
            return PageTextExtraction.failed("No document path supplied.");
        }
        try (PDDocument document = Loader.loadPDF(documentPath.toFile())) {
            int pageCount = document.getNumberOfPages();
            List<Integer> selected = selectPages(pageCount, maxPages, pageIndices);
            PDFTextStripper stripper = createStripper();
            List<String> pageTexts = new ArrayList<>(selected.size());
            for (int pageIndex : selected) {
                pageTexts.add(extractPage(stripper, document, pageIndex));
            }
            return PageTextExtraction.success(String.join(PAGE_SEPARATOR, pageTexts), pageCount, selected.size());
        } catch (IOException | RuntimeException ex) {
            log.warn("Failed to extract text from {}", documentPath, ex);
            return PageTextExtraction.failed("Unable to read " + documentPath.getFileName() + ": " + ex.getMessage());
        }
    }

    /**
     * Resolves which pages to read.
     *
     * @param pageCount   total pages in the document
     * @param maxPages    leading page cap, may be {@code null}
     * @param pageIndices explicit indices, may be {@code null}
     * @return zero-based indices in reading order
     */
    static List<Integer> selectPages(int pageCount, Integer maxPages, List<Integer> pageIndices) {
        if (pageIndices != null && !pageIndices.isEmpty()) {
            return pageIndices.stream()
                    .filter(index -> index != null && index >= 0 && index < pageCount)
                    .toList();
        }
        int limit = maxPages == null ? pageCount : Math.min(Math.max(maxPages, 0), pageCount);
        return IntStream.range(0, limit).boxed().toList();
    }

    /**
     * @return stripper configured for {@code \n} line endings and reading order by position
     */
    PDFTextStripper createStripper() throws IOException {
        PDFTextStripper stripper = new PDFTextStripper();
        stripper.setLineSeparator("\n");
        stripper.setSortByPosition(true);
        return stripper;
    }

    private String extractPage(PDFTextStripper stripper, PDDocument document, int pageIndex) {
        stripper.setStartPage(pageIndex + 1);
        stripper.setEndPage(pageIndex + 1);
        try {
            String text = stripper.getText(document);
            return text == null ? "" : text.strip();
        } catch (IOException | RuntimeException ex) {
            log.warn("Page {} has no extractable text, treating it as empty", pageIndex + 1, ex);
            return "";
        }
    }
}
