package uk.gegc.edgeprompt.features.conversion.infra;

import lombok.extern.slf4j.Slf4j;
import org.apache.poi.hwpf.extractor.WordExtractor;
import org.apache.poi.poifs.filesystem.FileMagic;
import org.apache.poi.xwpf.extractor.XWPFWordExtractor;
import org.apache.poi.xwpf.usermodel.XWPFDocument;
import org.springframework.stereotype.Component;
import uk.gegc.edgeprompt.features.conversion.domain.ConversionFailedException;
import uk.gegc.edgeprompt.features.conversion.domain.ConversionResult;
import uk.gegc.edgeprompt.features.conversion.domain.DocumentConverter;

import java.io.ByteArrayInputStream;
import java.io.IOException;
import java.io.InputStream;

/**
 * Word converter using Apache POI. The container is chosen from the file's magic bytes,
 * not from the declared extension: OLE2 goes through HWPF, OOXML through XWPF.
 */
@Component
@Slf4j
public class WordDocumentConverter implements DocumentConverter {

    @Override
    public boolean supports(String typeTag) {
        return "doc".equals(typeTag) || "docx".equals(typeTag);
    }

    @Override
    public ConversionResult convert(String filePath) {
        try {
            byte[] bytes = StoredFileReader.readBytes(filePath);
            try (InputStream in = FileMagic.prepareToCheckMagic(new ByteArrayInputStream(bytes))) {
                FileMagic magic = FileMagic.valueOf(in);
                String text = switch (magic) {
                    case OLE2 -> extractOle2(in);
                    case OOXML -> extractOoxml(in);
                    default -> throw new ConversionFailedException("Not a Word document (" + magic + ")");
                };
                log.debug("Converted Word document {} ({}): {} characters", filePath, magic, text.length());
                return new ConversionResult(text);
            }
        } catch (Exception e) {
            log.error("Word processing error for {}", filePath, e);
            throw new ConversionFailedException("Failed to process Word file: " + e.getMessage(), e);
        }
    }

    private String extractOle2(InputStream in) throws IOException {
        try (WordExtractor extractor = new WordExtractor(in)) {
            return extractor.getText();
        }
    }

    private String extractOoxml(InputStream in) throws IOException {
        try (XWPFWordExtractor extractor = new XWPFWordExtractor(new XWPFDocument(in))) {
            return extractor.getText();
        }
    }
}
