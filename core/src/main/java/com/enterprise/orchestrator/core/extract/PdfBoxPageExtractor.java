package com.enterprise.orchestrator.core.extract;

import com.enterprise.orchestrator.core.exception.DocumentIngestException;
import lombok.extern.slf4j.Slf4j;
import org.apache.pdfbox.pdmodel.PDDocument;
import org.apache.pdfbox.text.PDFTextStripper;

import java.io.IOException;
import java.util.ArrayList;
import java.util.List;

@Slf4j
public class PdfBoxPageExtractor implements PageExtractor {

    @Override
    public List<String> extractPages(byte[] document) {
        List<String> pages = new ArrayList<>();

        try (PDDocument pdf = PDDocument.load(document)) {
            PDFTextStripper textStripper = new PDFTextStripper();
            int numberOfPages = pdf.getNumberOfPages();

            for (int pageNumber = 1; pageNumber <= numberOfPages; pageNumber++) {
                textStripper.setStartPage(pageNumber);
                textStripper.setEndPage(pageNumber);
                String pageText = textStripper.getText(pdf)
                        .replace("\n", " ")
                        .replaceAll("\\s{2,}", " ")
                        .trim();
                pages.add(pageText);
            }
        } catch (IOException e) {
            throw new DocumentIngestException("Unable to extract text from PDF", e);
        }

        log.info("Parsed PDF: {} pages", pages.size());
        return pages;
    }
}
