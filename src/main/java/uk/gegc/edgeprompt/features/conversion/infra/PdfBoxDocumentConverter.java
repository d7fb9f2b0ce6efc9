package uk.gegc.edgeprompt.features.conversion.infra;

import lombok.extern.slf4j.Slf4j;
import org.apache.pdfbox.pdmodel.PDDocument;
import org.apache.pdfbox.text.PDFTextStripper;
import org.springframework.stereotype.Component;
import uk.gegc.edgeprompt.features.conversion.domain.ConversionFailedException;
import uk.gegc.edgeprompt.features.conversion.domain.ConversionResult;
import uk.gegc.edgeprompt.features.conversion.domain.DocumentConverter;

/**
 * PDF document converter using Apache PDFBox.
 * Text is extracted page by page; words on a page are joined by single spaces
 * and every page ends with a newline.
 */
@Component
@Slf4j
public class PdfBoxDocumentConverter implements DocumentConverter {

    @Override
    public boolean supports(String typeTag) {
        return "pdf".equals(typeTag);
    }

    @Override
    public ConversionResult convert(String filePath) {
        try {
            byte[] bytes = StoredFileReader.readBytes(filePath);
            if (bytes.length == 0) {
                throw new ConversionFailedException("Empty or invalid file");
            }

            StringBuilder text = new StringBuilder();
            try (PDDocument document = PDDocument.load(bytes)) {
                PDFTextStripper stripper = new PDFTextStripper();
                stripper.setSortByPosition(true);
                for (int page = 1; page <= document.getNumberOfPages(); page++) {
                    stripper.setStartPage(page);
                    stripper.setEndPage(page);
                    String pageText = stripper.getText(document).replaceAll("\\s+", " ").trim();
                    text.append(pageText).append('\n');
                }
                log.debug("Converted PDF {}: {} pages -> {} characters",
                        filePath, document.getNumberOfPages(), text.length());
            }

            if (text.toString().isBlank()) {
                throw new ConversionFailedException("No text content extracted from PDF");
            }
            return new ConversionResult(text.toString());
        } catch (Exception e) {
            log.error("PDF processing error for {}", filePath, e);
            throw new ConversionFailedException("Failed to process PDF file: " + e.getMessage(), e);
        }
    }
}
