package uk.gegc.edgeprompt.features.conversion.domain;

/**
 * Strategy for turning a material's content into plain text.
 * Implementations are selected by the material type tag (e.g. {@code pdf}, {@code docx}, {@code url}).
 */
public interface DocumentConverter {

    /**
     * Checks if this converter handles the given type tag.
     *
     * @param typeTag lower-cased material type without a leading dot
     * @return true if this converter can handle the type
     */
    boolean supports(String typeTag);

    /**
     * Converts material content to plain text.
     *
     * @param content raw text, an absolute path to a stored file, or a URL, depending on the type
     * @return ConversionResult containing the extracted text
     * @throws ConversionFailedException if the content cannot be read or decoded
     */
    ConversionResult convert(String content);
}
